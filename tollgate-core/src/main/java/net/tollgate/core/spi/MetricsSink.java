package net.tollgate.core.spi;

import java.time.Duration;

/**
 * 메트릭 방출 SPI. 이름은 {@code net.tollgate.core.metrics.MetricNames} 규칙을 따른다.
 */
public interface MetricsSink {
    void incrementCounter(String name, long delta);

    /** 카운터를 주어진 값으로 맞춘다 (slots-available 같은 현재값 지표) */
    void resetCounter(String name, long value);

    void markMeter(String name);

    void recordTime(String name, Duration elapsed);

    default void incrementCounter(String name) { incrementCounter(name, 1); }

    static MetricsSink noop() {
        return new MetricsSink() {
            @Override public void incrementCounter(String name, long delta) { }
            @Override public void resetCounter(String name, long value) { }
            @Override public void markMeter(String name) { }
            @Override public void recordTime(String name, Duration elapsed) { }
        };
    }
}
