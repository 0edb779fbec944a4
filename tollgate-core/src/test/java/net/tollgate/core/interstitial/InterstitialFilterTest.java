package net.tollgate.core.interstitial;

import net.tollgate.core.description.ServiceDescriptionLookup;
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
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static net.tollgate.core.support.Fixtures.await;
import static net.tollgate.core.support.Fixtures.instance;
import static net.tollgate.core.support.Fixtures.snapshot;
import static org.junit.jupiter.api.Assertions.*;

@TestMethodOrder(MethodOrderer.MethodName.class)
class InterstitialFilterTest {

    static final String HTML = "text/html,application/xhtml+xml";

    ExecutorService pool;
    ScheduledExecutorService timer;
    InterstitialGate gate;
    InterstitialFilter filter;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(2);
        timer = Executors.newSingleThreadScheduledExecutor();
        // svc-a는 30초, svc-t는 1초 대기 페이지 사용
        ServiceDescriptionLookup lookup = id -> new ServiceDescription(id,
                id.equals("svc-a") ? 30 : id.equals("svc-t") ? 1 : 0, 10, 1, DistributionScheme.BALANCED);
        RecordingMetricsSink metrics = new RecordingMetricsSink();
        gate = new InterstitialGate(lookup, new ManualClock(), metrics, timer, pool, 64, Duration.ofSeconds(5));
        filter = new InterstitialFilter(gate, lookup, metrics);
    }

    @AfterEach
    void tearDown() {
        gate.close();
        timer.shutdownNow();
        pool.shutdownNow();
    }

    private void initialize(boolean healthy) {
        gate.onSchedulerSnapshot(snapshot()
                .service("svc-a", healthy ? List.of(instance("a-1", "svc-a")) : List.of())
                .build());
        await(gate.queryAllState());
    }

    private static InterstitialRequest html(String serviceId, String query) {
        return new InterstitialRequest(serviceId, "/app/index", query, HTML, false);
    }

    // ========== t1: 준비 안 된 서비스는 대기 페이지로 ==========
    @Test
    void t1_unready_service_is_redirected() {
        initialize(false);

        InterstitialDecision d = filter.decide(html("svc-a", "page=2"));

        InterstitialDecision.Redirect r = assertInstanceOf(InterstitialDecision.Redirect.class, d);
        assertEquals("/tollgate-interstitial/app/index?page=2", r.location());
        assertEquals(Map.of("location", r.location(), InterstitialFilter.INTERSTITIAL_HEADER, "true"), r.headers());
        assertEquals(303, InterstitialDecision.Redirect.STATUS);
    }

    @Test
    void t2_redirect_without_query_has_no_question_mark() {
        initialize(false);
        InterstitialDecision.Redirect r = assertInstanceOf(InterstitialDecision.Redirect.class,
                filter.decide(html("svc-a", null)));
        assertEquals("/tollgate-interstitial/app/index", r.location());
    }

    // ========== t3: 통과 조건 ==========
    @Test
    void t3_healthy_service_proceeds() {
        initialize(true);
        assertEquals(new InterstitialDecision.Proceed("page=2"), filter.decide(html("svc-a", "page=2")));
    }

    @Test
    void t4_opted_out_or_non_html_or_on_the_fly_requests_proceed() {
        initialize(false);
        assertInstanceOf(InterstitialDecision.Proceed.class, filter.decide(html("svc-b", null)));
        assertInstanceOf(InterstitialDecision.Proceed.class,
                filter.decide(new InterstitialRequest("svc-a", "/api", null, "application/json", false)));
        assertInstanceOf(InterstitialDecision.Proceed.class,
                filter.decide(new InterstitialRequest("svc-a", "/app", null, HTML, true)));
        assertInstanceOf(InterstitialDecision.Proceed.class,
                filter.decide(new InterstitialRequest("svc-a", "/app", null, null, false)));
    }

    @Test
    void t5_uninitialized_gate_lets_requests_through() {
        assertFalse(gate.initialized());
        assertInstanceOf(InterstitialDecision.Proceed.class, filter.decide(html("svc-a", null)));
    }

    // ========== t6: bypass 파라미터 ==========
    @Test
    void t6_trailing_bypass_param_is_stripped() {
        initialize(false);
        assertEquals(new InterstitialDecision.Proceed("page=2"),
                filter.decide(html("svc-a", "page=2&" + InterstitialFilter.BYPASS_PARAM)));
        assertEquals(new InterstitialDecision.Proceed(""),
                filter.decide(html("svc-a", InterstitialFilter.BYPASS_PARAM)));
    }

    @Test
    void t7_bypass_param_in_the_middle_does_not_bypass() {
        initialize(false);
        assertInstanceOf(InterstitialDecision.Redirect.class,
                filter.decide(html("svc-a", InterstitialFilter.BYPASS_PARAM + "&page=2")));
    }

    @Test
    void t8_interstitial_target_appends_bypass_last() {
        assertEquals("/app/index?page=2&" + InterstitialFilter.BYPASS_PARAM,
                InterstitialFilter.interstitialTarget("/app/index", "page=2"));
        assertEquals("/app?" + InterstitialFilter.BYPASS_PARAM,
                InterstitialFilter.interstitialTarget("app", null));
    }

    // ========== t9: 타임아웃으로 끝난 약속은 직접 요청을 통과시키지 않는다 ==========
    @Test
    void t9_timed_out_promise_still_redirects_direct_requests() {
        initialize(false);
        InterstitialPromise promise = gate.ensure("svc-t", 1);

        assertEquals(InterstitialResolution.INTERSTITIAL_TIMEOUT, await(promise.future()));
        assertTrue(promise.resolved());
        assertFalse(promise.healthyInstanceFound());

        InterstitialDecision.Redirect r = assertInstanceOf(InterstitialDecision.Redirect.class,
                filter.decide(html("svc-t", "page=1")));
        assertEquals("/tollgate-interstitial/app/index?page=1", r.location());
        assertEquals(new InterstitialDecision.Proceed("page=1"),
                filter.decide(html("svc-t", "page=1&" + InterstitialFilter.BYPASS_PARAM)));
    }
}
