package net.tollgate.core.support;

import net.tollgate.core.model.SchedulerSnapshot;
import net.tollgate.core.model.ServiceInstance;
import net.tollgate.core.spi.SchedulerClient;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/** 테스트가 상태를 바꿔 끼우는 스케줄러 */
public final class FakeSchedulerClient implements SchedulerClient {
    private final AtomicReference<SchedulerSnapshot> state =
            new AtomicReference<>(new SchedulerSnapshot(Set.of(), Map.of(), null));
    private final List<ServiceInstance> killed = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    public void set(SchedulerSnapshot snapshot) {
        state.set(snapshot);
    }

    public void failing(boolean failing) {
        this.failing = failing;
    }

    public List<ServiceInstance> killedNotifications() {
        return killed;
    }

    @Override public SchedulerSnapshot fetchState() throws Exception {
        if (failing) throw new IllegalStateException("scheduler unreachable");
        return state.get();
    }

    @Override public void instanceKilled(ServiceInstance instance) {
        killed.add(instance);
    }
}
