package net.tollgate.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Responder 상태의 읽기 전용 스냅샷.
 */
public record ResponderState(
        String serviceId,
        ResponderStatus status,
        Set<String> healthyInstanceIds,
        Set<String> availableInstanceIds,
        Map<String, Integer> inUse,
        Set<String> offeredInstanceIds,
        Set<String> borrowedInstanceIds,
        Map<String, BlacklistEntry> blacklisted,
        int pendingRequests,
        Instant lastSchedulerUpdate
) {
    public ResponderState {
        healthyInstanceIds = Set.copyOf(healthyInstanceIds);
        availableInstanceIds = Set.copyOf(availableInstanceIds);
        inUse = Map.copyOf(inUse);
        offeredInstanceIds = Set.copyOf(offeredInstanceIds);
        borrowedInstanceIds = Set.copyOf(borrowedInstanceIds);
        blacklisted = Map.copyOf(blacklisted);
    }
}
