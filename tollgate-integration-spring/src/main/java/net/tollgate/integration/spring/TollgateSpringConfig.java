package net.tollgate.integration.spring;

import io.micrometer.core.instrument.MeterRegistry;
import net.tollgate.core.spi.Clock;
import net.tollgate.core.spi.MetricsSink;
import net.tollgate.integration.spring.metrics.MicrometerMetricsSink;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TollgateSpringConfig {

    // 기본 Clock
    @Bean public Clock systemClock() { return java.time.Instant::now; }

    // MetricsSink는 Micrometer 레지스트리로 내보낸다 (레지스트리는 앱/부트스트랩에서)
    @Bean public MetricsSink metricsSink(MeterRegistry registry) { return new MicrometerMetricsSink(registry); }
}
