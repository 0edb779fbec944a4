package net.tollgate.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * 스케줄러 폴링 한 번의 결과. 리스너들에게 읽기 전용으로 브로드캐스트된다.
 */
public record SchedulerSnapshot(
        Set<String> availableServiceIds,
        Map<String, ServiceInstances> instancesByService,
        Instant syncedAt
) {
    public SchedulerSnapshot {
        availableServiceIds = availableServiceIds == null ? Set.of() : Set.copyOf(availableServiceIds);
        instancesByService = instancesByService == null ? Map.of() : Map.copyOf(instancesByService);
    }

    public ServiceInstances instancesOf(String serviceId) {
        return instancesByService.getOrDefault(serviceId, ServiceInstances.empty());
    }
}
