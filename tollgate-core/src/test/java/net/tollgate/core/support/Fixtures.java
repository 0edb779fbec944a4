package net.tollgate.core.support;

import net.tollgate.core.model.SchedulerSnapshot;
import net.tollgate.core.model.ServiceInstance;
import net.tollgate.core.model.ServiceInstances;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

public final class Fixtures {
    private Fixtures() { }

    public static ServiceInstance instance(String id, String serviceId) {
        return ServiceInstance.of(id, serviceId, "10.0.0." + (Math.abs(id.hashCode()) % 250 + 1), 8080);
    }

    public static <T> T await(CompletableFuture<T> f) {
        try {
            return f.get(5, TimeUnit.SECONDS);
        } catch (Exception e) {
            throw new AssertionError("future did not complete: " + e, e);
        }
    }

    /** 스냅샷 빌더 */
    public static SnapshotBuilder snapshot() {
        return new SnapshotBuilder();
    }

    public static final class SnapshotBuilder {
        private final Set<String> available = new LinkedHashSet<>();
        private final Map<String, ServiceInstances> instances = new HashMap<>();
        private Instant syncedAt = Instant.parse("2024-01-01T00:00:00Z");

        public SnapshotBuilder service(String serviceId, List<ServiceInstance> healthy) {
            return service(serviceId, healthy, List.of(), List.of());
        }

        public SnapshotBuilder service(String serviceId,
                                       List<ServiceInstance> healthy,
                                       List<ServiceInstance> unhealthy,
                                       List<ServiceInstance> killed) {
            available.add(serviceId);
            instances.put(serviceId, new ServiceInstances(healthy, unhealthy, killed));
            return this;
        }

        public SnapshotBuilder at(Instant t) {
            this.syncedAt = t;
            return this;
        }

        public SchedulerSnapshot build() {
            return new SchedulerSnapshot(available, instances, syncedAt);
        }
    }
}
