package net.tollgate.core.support;

import net.tollgate.core.spi.MetricsSink;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** 마지막 값과 누적값만 기억하는 메트릭 싱크 */
public final class RecordingMetricsSink implements MetricsSink {
    private final Map<String, Long> values = new ConcurrentHashMap<>();

    @Override public void incrementCounter(String name, long delta) {
        values.merge(name, delta, Long::sum);
    }

    @Override public void resetCounter(String name, long value) {
        values.put(name, value);
    }

    @Override public void markMeter(String name) {
        values.merge(name, 1L, Long::sum);
    }

    @Override public void recordTime(String name, Duration elapsed) {
        values.merge(name, 1L, Long::sum);
    }

    public long value(String name) {
        return values.getOrDefault(name, 0L);
    }
}
