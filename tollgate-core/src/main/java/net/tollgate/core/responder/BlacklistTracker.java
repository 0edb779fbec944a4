package net.tollgate.core.responder;

import net.tollgate.core.model.BlacklistEntry;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 서비스 하나의 블랙리스트. Responder 내부 상태이므로 스레드 안전하지 않다.
 */
final class BlacklistTracker {
    private final BlacklistPolicy policy;
    private final Map<String, BlacklistEntry> entries = new HashMap<>();

    BlacklistTracker(BlacklistPolicy policy) {
        this.policy = policy;
    }

    /**
     * 실패 횟수를 올리고 만료 시각을 다시 계산한다.
     * 기간 = min(max(요청 기간, backoff(failures)), max)
     */
    BlacklistEntry blacklist(String instanceId, Duration requested, String reason, Instant now) {
        BlacklistEntry previous = entries.get(instanceId);
        int failures = previous == null ? 1 : previous.consecutiveFailures() + 1;
        Duration period = policy.backoff(failures);
        if (requested != null && requested.compareTo(period) > 0) period = requested;
        if (period.compareTo(policy.maxBlacklistTime()) > 0) period = policy.maxBlacklistTime();

        Instant expiry = now.plus(period);
        // 더 긴 기존 만료를 줄이지 않는다
        if (previous != null && previous.expiresAt().isAfter(expiry)) expiry = previous.expiresAt();

        BlacklistEntry entry = new BlacklistEntry(instanceId, expiry, failures, reason);
        entries.put(instanceId, entry);
        return entry;
    }

    boolean isBlacklisted(String instanceId, Instant now) {
        BlacklistEntry e = entries.get(instanceId);
        return e != null && !e.expired(now);
    }

    Optional<BlacklistEntry> entry(String instanceId) {
        return Optional.ofNullable(entries.get(instanceId));
    }

    /** 만료된 항목을 제거하고 그 id들을 돌려준다 */
    List<String> expire(Instant now) {
        List<String> expired = new ArrayList<>();
        var it = entries.values().iterator();
        while (it.hasNext()) {
            BlacklistEntry e = it.next();
            if (e.expired(now)) {
                expired.add(e.instanceId());
                it.remove();
            }
        }
        return expired;
    }

    boolean remove(String instanceId) {
        return entries.remove(instanceId) != null;
    }

    /** 스케줄러 상태에서 사라진 인스턴스의 항목을 정리 */
    int retainOnly(Collection<String> knownInstanceIds) {
        int before = entries.size();
        entries.keySet().retainAll(knownInstanceIds);
        return before - entries.size();
    }

    int activeCount(Instant now) {
        int n = 0;
        for (BlacklistEntry e : entries.values()) if (!e.expired(now)) n++;
        return n;
    }

    Map<String, BlacklistEntry> snapshot() {
        return Map.copyOf(entries);
    }
}
