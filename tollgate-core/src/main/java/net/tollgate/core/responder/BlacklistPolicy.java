package net.tollgate.core.responder;

import java.time.Duration;

public interface BlacklistPolicy {
    /** 연속 실패 횟수(1부터)에 대한 블랙리스트 기간 */
    Duration backoff(int consecutiveFailures);

    Duration maxBlacklistTime();

    /** min(base * 2^(failures-1), max) */
    static BlacklistPolicy exponential(Duration base, Duration max) {
        return new ExponentialBlacklistPolicy(base, max);
    }
}
