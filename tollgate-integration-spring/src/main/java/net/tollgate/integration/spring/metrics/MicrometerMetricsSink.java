package net.tollgate.integration.spring.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import net.tollgate.core.spi.MetricsSink;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 코어 MetricsSink → Micrometer.
 * counter는 값을 직접 맞출 수 있어야 해서 gauge(AtomicLong)로, meter는 Counter로, timer는 Timer로 등록한다.
 */
public final class MicrometerMetricsSink implements MetricsSink {
    private final MeterRegistry registry;
    private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();

    public MicrometerMetricsSink(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override public void incrementCounter(String name, long delta) {
        counter(name).addAndGet(delta);
    }

    @Override public void resetCounter(String name, long value) {
        counter(name).set(value);
    }

    @Override public void markMeter(String name) {
        registry.counter(name).increment();
    }

    @Override public void recordTime(String name, Duration elapsed) {
        registry.timer(name).record(elapsed);
    }

    /** 테스트/상태 조회용 현재값 */
    public long counterValue(String name) {
        AtomicLong v = counters.get(name);
        return v == null ? 0 : v.get();
    }

    private AtomicLong counter(String name) {
        // gauge는 약한 참조이므로 맵에서 강하게 잡아둔다
        return counters.computeIfAbsent(name, n -> registry.gauge(n, new AtomicLong()));
    }
}
