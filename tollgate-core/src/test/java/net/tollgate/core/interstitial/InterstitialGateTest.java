package net.tollgate.core.interstitial;

import net.tollgate.core.metrics.MetricNames;
import net.tollgate.core.model.DistributionScheme;
import net.tollgate.core.model.InterstitialResolution;
import net.tollgate.core.model.ServiceDescription;
import net.tollgate.core.support.ManualClock;
import net.tollgate.core.support.RecordingMetricsSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static net.tollgate.core.support.Fixtures.await;
import static net.tollgate.core.support.Fixtures.instance;
import static net.tollgate.core.support.Fixtures.snapshot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

@TestMethodOrder(MethodOrderer.MethodName.class)
class InterstitialGateTest {

    ExecutorService pool;
    ScheduledExecutorService timer;
    RecordingMetricsSink metrics;
    Map<String, Integer> secs;
    InterstitialGate gate;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(2);
        timer = Executors.newSingleThreadScheduledExecutor();
        metrics = new RecordingMetricsSink();
        secs = new ConcurrentHashMap<>();
        gate = new InterstitialGate(
                id -> new ServiceDescription(id, secs.getOrDefault(id, 0), 10, 1, DistributionScheme.BALANCED),
                new ManualClock(), metrics, timer, pool, 64, Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        gate.close();
        timer.shutdownNow();
        pool.shutdownNow();
    }

    private InterstitialGateState sync() {
        // maintainer는 FIFO이므로 조회 응답이 오면 앞선 스냅샷은 처리된 상태
        return await(gate.queryAllState());
    }

    // ========== t1: 경합해도 promise는 하나 ==========
    @Test
    void t1_concurrent_ensure_creates_one_promise() throws Exception {
        int threads = 16;
        ExecutorService callers = Executors.newFixedThreadPool(threads);
        CountDownLatch ready = new CountDownLatch(threads);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<InterstitialPromise>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            futures.add(callers.submit(() -> {
                ready.countDown();
                go.await();
                return gate.ensure("svc-a", 30);
            }));
        }
        assertTrue(ready.await(5, TimeUnit.SECONDS));
        go.countDown();

        Set<InterstitialPromise> distinct = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Future<InterstitialPromise> f : futures) distinct.add(f.get(5, TimeUnit.SECONDS));
        callers.shutdownNow();

        assertEquals(1, distinct.size(), "only one promise may win");
        assertEquals(1, metrics.value(MetricNames.routerCounter("interstitial", "promise", "total")));
    }

    // ========== t2: 결과는 한 번만 ==========
    @Test
    void t2_promise_resolves_exactly_once() {
        InterstitialPromise p = gate.ensure("svc-a", 30);
        assertEquals(InterstitialGate.NOT_REALIZED, p.describe());

        assertTrue(gate.resolve(p, InterstitialResolution.HEALTHY_INSTANCE_FOUND));
        assertFalse(gate.resolve(p, InterstitialResolution.INTERSTITIAL_TIMEOUT));

        assertEquals("healthy-instance-found", p.describe());
        assertTrue(p.healthyInstanceFound());
        assertEquals(1, metrics.value(MetricNames.routerCounter("interstitial", "promise", "resolved")));
        assertEquals(0, metrics.value(MetricNames.routerCounter("interstitial", "resolution", "interstitial-timeout")));
    }

    // ========== t3: 타임아웃 ==========
    @Test
    void t3_promise_times_out_without_healthy_instances() {
        long start = System.nanoTime();
        InterstitialPromise p = gate.ensure("svc-a", 1);

        assertEquals(InterstitialResolution.INTERSTITIAL_TIMEOUT, await(p.future()));
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(900));
        assertFalse(p.healthyInstanceFound(), "timeout does not open the gate");
    }

    @Test
    void t4_opted_out_service_gets_no_timeout() throws Exception {
        InterstitialPromise p = gate.ensure("svc-a", 0);
        Thread.sleep(200);
        assertFalse(p.resolved());
    }

    // ========== t5: 스케줄러 스냅샷 처리 ==========
    @Test
    void t5_healthy_service_resolves_its_promise() {
        secs.put("svc-a", 30);
        assertFalse(gate.initialized());

        gate.onSchedulerSnapshot(snapshot()
                .service("svc-a", List.of(instance("a-1", "svc-a")))
                .service("svc-b", List.of())
                .build());
        InterstitialGateState state = sync();

        assertTrue(state.initialized());
        assertTrue(gate.initialized());
        assertEquals(Map.of("svc-a", "healthy-instance-found"), state.promises(),
                "svc-b opted out and gets no promise from the maintainer");
        assertEquals(Set.of("svc-a", "svc-b"), state.availableServiceIds());
    }

    @Test
    void t6_unresolved_promises_are_never_purged() {
        secs.put("svc-a", 30);
        gate.onSchedulerSnapshot(snapshot()
                .service("svc-a", List.of(), List.of(instance("a-1", "svc-a")), List.of())
                .build());
        assertEquals(Map.of("svc-a", InterstitialGate.NOT_REALIZED), sync().promises());

        gate.onSchedulerSnapshot(snapshot().build());
        InterstitialGateState afterRemoval = sync();
        assertEquals(Map.of("svc-a", InterstitialGate.NOT_REALIZED), afterRemoval.promises());
        assertTrue(afterRemoval.availableServiceIds().contains("svc-a"));

        gate.onSchedulerSnapshot(snapshot().service("svc-a", List.of(instance("a-1", "svc-a"))).build());
        assertEquals(Map.of("svc-a", "healthy-instance-found"), sync().promises());

        gate.onSchedulerSnapshot(snapshot().build());
        InterstitialGateState purged = sync();
        assertThat(purged.promises()).isEmpty();
        assertThat(purged.availableServiceIds()).isEmpty();
        assertTrue(gate.promise("svc-a").isEmpty());
    }

    @Test
    void t7_service_state_query() {
        secs.put("svc-a", 30);
        gate.onSchedulerSnapshot(snapshot()
                .service("svc-a", List.of(), List.of(instance("a-1", "svc-a")), List.of())
                .build());

        assertEquals(new InterstitialServiceState("svc-a", true, InterstitialGate.NOT_REALIZED),
                await(gate.queryState("svc-a")));
        assertEquals(new InterstitialServiceState("svc-x", false, null), await(gate.queryState("svc-x")));
    }
}
