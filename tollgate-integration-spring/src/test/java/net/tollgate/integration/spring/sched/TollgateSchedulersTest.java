package net.tollgate.integration.spring.sched;

import net.tollgate.core.config.RouterSettings;
import net.tollgate.core.model.SchedulerSnapshot;
import net.tollgate.core.model.ServiceInstance;
import net.tollgate.core.model.ServiceInstances;
import net.tollgate.core.service.TollgateRouter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@TestMethodOrder(MethodOrderer.MethodName.class)
class TollgateSchedulersTest {

    AtomicInteger polls;
    TollgateRouter router;
    TollgateSchedulers schedulers;

    @BeforeEach
    void setUp() {
        polls = new AtomicInteger();
        ServiceInstance a1 = ServiceInstance.of("a-1", "svc-a", "10.0.0.1", 8080);
        router = TollgateRouter.builder(() -> {
                    polls.incrementAndGet();
                    return new SchedulerSnapshot(Set.of("svc-a"), Map.of("svc-a", ServiceInstances.healthy(a1)), Instant.now());
                })
                .settings(RouterSettings.builder().routerId("router-1").build())
                .build();
        schedulers = new TollgateSchedulers(router.syncer(), router.workStealing(), router.maintenance());
    }

    @AfterEach
    void tearDown() {
        router.close();
    }

    // ========== t1: 각 주기 작업은 코어 호출 하나 ==========
    @Test
    void t1_sync_polls_the_scheduler() {
        schedulers.syncScheduler();
        assertEquals(1, polls.get());
        assertEquals(Set.of("svc-a"), router.syncer().lastSnapshot().availableServiceIds());
        assertEquals(Set.of("svc-a"), router.dispatcher().serviceIds());
    }

    @Test
    void t2_offer_help_and_maintenance_run_without_peers() {
        schedulers.syncScheduler();
        assertDoesNotThrow(schedulers::offerHelp);
        schedulers.setRefreshDescriptions(true);
        assertDoesNotThrow(schedulers::maintenance);
        assertEquals(0, router.workStealing().queryState().offersSent());
    }
}
