package net.tollgate.core.responder;

import java.time.Duration;

final class ExponentialBlacklistPolicy implements BlacklistPolicy {
    private final long baseMs;
    private final long maxMs;

    ExponentialBlacklistPolicy(Duration base, Duration max) {
        if (base.isNegative() || base.isZero()) throw new IllegalArgumentException("base must be positive");
        if (max.compareTo(base) < 0) throw new IllegalArgumentException("max must be >= base");
        this.baseMs = base.toMillis();
        this.maxMs = max.toMillis();
    }

    @Override public Duration backoff(int consecutiveFailures) {
        return Duration.ofMillis(computeBackoffMs(consecutiveFailures));
    }

    @Override public Duration maxBlacklistTime() {
        return Duration.ofMillis(maxMs);
    }

    long computeBackoffMs(int failures) {
        int exponent = Math.max(0, failures - 1);
        // 2^62 이상은 어차피 max로 잘린다
        if (exponent >= 62) return maxMs;
        long factor = 1L << exponent;
        if (baseMs > maxMs / factor) return maxMs;
        return Math.min(baseMs * factor, maxMs);
    }
}
