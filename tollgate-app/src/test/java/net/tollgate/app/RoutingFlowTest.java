package net.tollgate.app;

import net.tollgate.core.interstitial.InterstitialDecision;
import net.tollgate.core.interstitial.InterstitialFilter;
import net.tollgate.core.interstitial.InterstitialRequest;
import net.tollgate.core.model.SchedulerSnapshot;
import net.tollgate.core.model.ServiceInstance;
import net.tollgate.core.model.ServiceInstances;
import net.tollgate.core.service.ControlResponse;
import net.tollgate.core.service.RouterControlService;
import net.tollgate.core.service.TollgateRouter;
import net.tollgate.core.spi.SchedulerClient;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "tollgate.router-id=router-it",
        "tollgate.scheduler.syncer-interval-secs=1",
        "tollgate.scheduler.maintenance-delay-ms=200",
        "tollgate.catalog.services[0].service-id=web",
        "tollgate.catalog.services[0].interstitial-secs=60"
})
class RoutingFlowTest {

    static final ServiceInstance WEB_1 = ServiceInstance.of("web-1", "web", "10.0.0.10", 8080);

    /** 테스트가 바꿔 끼우는 스케줄러 상태 */
    static final AtomicReference<SchedulerSnapshot> STATE = new AtomicReference<>(
            new SchedulerSnapshot(Set.of("web"), Map.of("web", ServiceInstances.empty()), null));

    @TestConfiguration
    static class FakeScheduler {
        @Bean
        SchedulerClient schedulerClient() {
            return STATE::get;
        }
    }

    @Autowired TollgateRouter router;
    @Autowired RouterControlService control;
    @Autowired InterstitialFilter filter;

    @Test
    void service_becomes_routable_once_the_scheduler_reports_a_healthy_instance() throws Exception {
        InterstitialRequest page = new InterstitialRequest("web", "/home", null, "text/html", false);

        // 1) 스케줄러 동기화 전후: healthy가 없으면 대기 페이지
        Awaitility.await().atMost(Duration.ofSeconds(10)).until(() -> router.interstitialGate().initialized());
        assertThat(filter.decide(page)).isInstanceOf(InterstitialDecision.Redirect.class);
        assertThat(control.selectInstanceForRequest("web").get(5, TimeUnit.SECONDS).status())
                .isEqualTo(ControlResponse.UNAVAILABLE);

        // 2) healthy 인스턴스 등장
        STATE.set(new SchedulerSnapshot(Set.of("web"), Map.of("web", ServiceInstances.healthy(WEB_1)), Instant.now()));

        Awaitility.await().atMost(Duration.ofSeconds(10)).untilAsserted(() ->
                assertThat(filter.decide(page)).isEqualTo(new InterstitialDecision.Proceed(null)));

        ControlResponse selected = control.selectInstanceForRequest("web").get(5, TimeUnit.SECONDS);
        assertThat(selected.status()).isEqualTo(ControlResponse.OK);
        assertThat(selected.body()).containsEntry("instance-id", "web-1").containsEntry("borrowed", false);

        // 3) 사용 중인 인스턴스는 블랙리스트 불가
        ControlResponse locked = control.blacklistInstance(Map.of(
                "instance", Map.of("id", "web-1", "service-id", "web"),
                "period-in-ms", 5000,
                "reason", "busy")).get(5, TimeUnit.SECONDS);
        assertThat(locked.status()).isEqualTo(ControlResponse.LOCKED);

        // 4) 상태 조회
        ControlResponse state = control.serviceState("web").get(5, TimeUnit.SECONDS);
        assertThat(state.body()).containsEntry("router-id", "router-it");
    }
}
