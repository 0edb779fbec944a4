package net.tollgate.core.responder;

import net.tollgate.core.model.BlacklistEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@TestMethodOrder(MethodOrderer.MethodName.class)
class BlacklistTrackerTest {

    static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    BlacklistTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new BlacklistTracker(BlacklistPolicy.exponential(Duration.ofSeconds(1), Duration.ofSeconds(60)));
    }

    // ========== t1: 지수 백오프 ==========
    @Test
    void t1_backoff_doubles_and_is_capped() {
        ExponentialBlacklistPolicy p = new ExponentialBlacklistPolicy(Duration.ofSeconds(1), Duration.ofSeconds(60));
        assertEquals(1000, p.computeBackoffMs(1));
        assertEquals(2000, p.computeBackoffMs(2));
        assertEquals(4000, p.computeBackoffMs(3));
        assertEquals(32000, p.computeBackoffMs(6));
        assertEquals(60000, p.computeBackoffMs(7));
        assertEquals(60000, p.computeBackoffMs(Integer.MAX_VALUE), "no overflow on huge failure counts");
    }

    @Test
    void t2_invalid_policy_is_rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> BlacklistPolicy.exponential(Duration.ZERO, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class,
                () -> BlacklistPolicy.exponential(Duration.ofSeconds(2), Duration.ofSeconds(1)));
    }

    // ========== t3: 연속 실패가 누적된다 ==========
    @Test
    void t3_consecutive_failures_accumulate() {
        BlacklistEntry first = tracker.blacklist("i1", null, "instance-error", T0);
        BlacklistEntry second = tracker.blacklist("i1", null, "instance-error", T0);
        BlacklistEntry third = tracker.blacklist("i1", null, "instance-error", T0);

        assertEquals(1, first.consecutiveFailures());
        assertEquals(2, second.consecutiveFailures());
        assertEquals(3, third.consecutiveFailures());
        assertEquals(T0.plusSeconds(4), third.expiresAt());
    }

    // ========== t4: 요청 기간과 상한 ==========
    @Test
    void t4_requested_period_wins_over_backoff_but_not_over_max() {
        assertEquals(T0.plusSeconds(30), tracker.blacklist("a", Duration.ofSeconds(30), "killed", T0).expiresAt());
        assertEquals(T0.plusSeconds(60), tracker.blacklist("b", Duration.ofHours(1), "killed", T0).expiresAt());
    }

    @Test
    void t5_existing_longer_expiry_is_not_shortened() {
        tracker.blacklist("i1", Duration.ofSeconds(50), "killed", T0);
        BlacklistEntry again = tracker.blacklist("i1", null, "instance-error", T0.plusSeconds(1));
        assertEquals(T0.plusSeconds(50), again.expiresAt());
    }

    // ========== t6: 만료와 정리 ==========
    @Test
    void t6_expire_removes_only_past_entries() {
        tracker.blacklist("short", null, "x", T0);                         // 1s
        tracker.blacklist("long", Duration.ofSeconds(10), "x", T0);

        assertTrue(tracker.isBlacklisted("short", T0));
        assertEquals(2, tracker.activeCount(T0));

        List<String> expired = tracker.expire(T0.plusSeconds(1));
        assertEquals(List.of("short"), expired);
        assertFalse(tracker.isBlacklisted("short", T0.plusSeconds(1)));
        assertTrue(tracker.isBlacklisted("long", T0.plusSeconds(1)));
        assertThat(tracker.entry("short")).isEmpty();
    }

    @Test
    void t7_retain_only_drops_unknown_instances() {
        tracker.blacklist("a", null, "x", T0);
        tracker.blacklist("b", null, "x", T0);
        assertEquals(1, tracker.retainOnly(List.of("a")));
        assertThat(tracker.snapshot()).containsOnlyKeys("a");
        assertTrue(tracker.remove("a"));
        assertFalse(tracker.remove("a"));
    }
}
