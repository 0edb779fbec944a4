package net.tollgate.core.scheduler;

import net.tollgate.core.config.RouterSettings;
import net.tollgate.core.model.BlacklistResult;
import net.tollgate.core.model.InstanceSelection;
import net.tollgate.core.model.RequestContext;
import net.tollgate.core.model.ResponderState;
import net.tollgate.core.model.ResponderStatus;
import net.tollgate.core.model.SchedulerSnapshot;
import net.tollgate.core.model.ServiceInstance;
import net.tollgate.core.model.ServiceInstances;
import net.tollgate.core.service.TollgateRouter;
import net.tollgate.core.support.FakeSchedulerClient;
import net.tollgate.core.support.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static net.tollgate.core.support.Fixtures.await;
import static net.tollgate.core.support.Fixtures.instance;
import static net.tollgate.core.support.Fixtures.snapshot;
import static org.junit.jupiter.api.Assertions.*;

@TestMethodOrder(MethodOrderer.MethodName.class)
class SchedulerSyncerTest {

    FakeSchedulerClient client;
    ManualClock clock;
    SchedulerSyncer syncer;
    List<SchedulerSnapshot> received;

    @BeforeEach
    void setUp() {
        client = new FakeSchedulerClient();
        clock = new ManualClock();
        syncer = new SchedulerSyncer(client, clock);
        received = new CopyOnWriteArrayList<>();
        syncer.addListener(received::add);
    }

    // ========== t1: 스냅샷 전파 ==========
    @Test
    void t1_snapshot_is_broadcast_to_listeners() {
        client.set(snapshot().service("svc-a", List.of(instance("a-1", "svc-a"))).build());

        SchedulerSnapshot s = syncer.syncOnce();

        assertNotNull(s);
        assertEquals(List.of(s), received);
        assertSame(s, syncer.lastSnapshot());
        assertEquals(Set.of("svc-a"), s.availableServiceIds());
    }

    // ========== t2: 폴링 실패 ==========
    @Test
    void t2_failed_poll_keeps_previous_snapshot() {
        client.set(snapshot().service("svc-a", List.of()).build());
        SchedulerSnapshot first = syncer.syncOnce();

        client.failing(true);
        assertNull(syncer.syncOnce());
        assertSame(first, syncer.lastSnapshot());
        assertEquals(1, received.size());
    }

    // ========== t3: 잘못된 항목은 무시하고 이전 항목을 유지한다 ==========
    @Test
    void t3_malformed_entries_keep_previous_instances() {
        client.set(snapshot().service("bad", List.of(instance("b-0", "bad"))).build());
        syncer.syncOnce();

        SchedulerSnapshot raw = new SchedulerSnapshot(
                Set.of("good", "bad", "new-bad", " "),
                Map.of("good", ServiceInstances.healthy(instance("g-1", "good")),
                        "bad", ServiceInstances.healthy(instance("b-1", "elsewhere")),
                        "new-bad", ServiceInstances.healthy(ServiceInstance.of("n-1", "new-bad", "10.0.0.9", 0))),
                null);

        SchedulerSnapshot clean = syncer.sanitize(raw);

        assertEquals(Set.of("good", "bad", "new-bad"), clean.availableServiceIds());
        assertEquals(ServiceInstances.healthy(instance("b-0", "bad")), clean.instancesOf("bad"));
        assertEquals(ServiceInstances.empty(), clean.instancesOf("new-bad"));
        assertEquals(clock.now(), clean.syncedAt(), "missing sync time is filled from the clock");
    }

    // ========== t4: 리스너 예외는 다른 리스너를 막지 않는다 ==========
    @Test
    void t4_failing_listener_does_not_block_others() {
        List<SchedulerSnapshot> second = new CopyOnWriteArrayList<>();
        syncer.addListener(s -> { throw new IllegalStateException("listener down"); });
        syncer.addListener(second::add);
        client.set(snapshot().build());

        assertNotNull(syncer.syncOnce());
        assertEquals(1, received.size());
        assertEquals(1, second.size());
    }

    // ========== t5: 잘못된 스냅샷이 와도 Responder 상태(블랙리스트)는 그대로 ==========
    @Test
    void t5_malformed_entry_keeps_responder_and_blacklist() {
        FakeSchedulerClient scheduler = new FakeSchedulerClient();
        ServiceInstance i1 = instance("i-1", "svc");
        ServiceInstance i2 = instance("i-2", "svc");
        try (TollgateRouter router = TollgateRouter.builder(scheduler)
                .settings(RouterSettings.builder().routerId("router-1").build())
                .build()) {
            scheduler.set(snapshot().service("svc", List.of(i1, i2)).build());
            router.syncer().syncOnce();
            assertEquals(BlacklistResult.BLACKLISTED,
                    await(router.dispatcher().blacklistInstance("svc", "i-1", Duration.ofSeconds(60), "busy")));

            ServiceInstance broken = ServiceInstance.of("i-3", "svc", "10.0.0.3", 0);
            scheduler.set(snapshot().service("svc", List.of(i1, i2), List.of(broken), List.of()).build());
            router.syncer().syncOnce();

            ResponderState state = await(router.dispatcher().queryState("svc")).orElseThrow();
            assertEquals(ResponderStatus.ACTIVE, state.status());
            assertEquals(Set.of("i-1"), state.blacklisted().keySet());

            scheduler.set(snapshot().service("svc", List.of(i1, i2)).build());
            router.syncer().syncOnce();
            for (int n = 0; n < 2; n++) {
                InstanceSelection picked = await(router.dispatcher().selectInstanceForRequest("svc", RequestContext.of("req-" + n)));
                assertNotEquals(new InstanceSelection.Selected(i1, false), picked, "blacklisted instance is not routed");
            }
        }
    }
}
