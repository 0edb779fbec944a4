package net.tollgate.core.scheduler;

import net.tollgate.core.model.SchedulerSnapshot;
import net.tollgate.core.model.ServiceInstance;
import net.tollgate.core.model.ServiceInstances;
import net.tollgate.core.spi.Clock;
import net.tollgate.core.spi.SchedulerClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 스케줄러를 주기적으로 폴링해서 구독자들에게 스냅샷을 뿌린다.
 * 폴링 주기는 호출하는 쪽(@Scheduled 등)이 정한다.
 */
public final class SchedulerSyncer {
    private static final Logger log = LoggerFactory.getLogger(SchedulerSyncer.class);

    private final SchedulerClient client;
    private final Clock clock;
    private final List<SchedulerStateListener> listeners = new CopyOnWriteArrayList<>();
    private volatile SchedulerSnapshot last;

    public SchedulerSyncer(SchedulerClient client, Clock clock) {
        this.client = client;
        this.clock = clock;
    }

    public void addListener(SchedulerStateListener listener) {
        listeners.add(listener);
    }

    public SchedulerSnapshot lastSnapshot() {
        return last;
    }

    /**
     * 한 번 폴링한다.
     * @return 구독자에게 전달된 스냅샷, 폴링 실패 시 null
     */
    public SchedulerSnapshot syncOnce() {
        SchedulerSnapshot fetched;
        try {
            fetched = client.fetchState();
        } catch (Exception e) {
            log.error("scheduler poll failed", e);
            return null;
        }
        if (fetched == null) {
            log.warn("scheduler returned no state");
            return null;
        }

        SchedulerSnapshot snapshot = sanitize(fetched);
        last = snapshot;
        for (SchedulerStateListener l : listeners) {
            try {
                l.onSchedulerSnapshot(snapshot);
            } catch (RuntimeException e) {
                log.error("scheduler listener {} failed", l.getClass().getSimpleName(), e);
            }
        }
        return snapshot;
    }

    /**
     * 형식이 잘못된 서비스 항목은 로그를 남기고 무시한다.
     * 서비스는 available에 남고, 직전 스냅샷의 항목(없으면 빈 항목)을 대신 쓴다.
     */
    SchedulerSnapshot sanitize(SchedulerSnapshot s) {
        SchedulerSnapshot previous = last;
        Set<String> available = new HashSet<>();
        Map<String, ServiceInstances> instances = new HashMap<>();
        for (String serviceId : s.availableServiceIds()) {
            if (serviceId == null || serviceId.isBlank()) {
                log.warn("dropping blank service id from scheduler state");
                continue;
            }
            ServiceInstances si = s.instancesOf(serviceId);
            if (!wellFormed(serviceId, si)) {
                si = previous != null ? previous.instancesOf(serviceId) : ServiceInstances.empty();
                log.warn("ignoring malformed scheduler entry for service {}, keeping its previous instances", serviceId);
            }
            available.add(serviceId);
            instances.put(serviceId, si);
        }
        return new SchedulerSnapshot(available, instances, s.syncedAt() != null ? s.syncedAt() : clock.now());
    }

    private static boolean wellFormed(String serviceId, ServiceInstances si) {
        for (List<ServiceInstance> list : List.of(si.healthy(), si.unhealthy(), si.killed())) {
            for (ServiceInstance i : list) {
                if (i == null || !i.wellFormed() || !serviceId.equals(i.serviceId())) return false;
            }
        }
        return true;
    }
}
