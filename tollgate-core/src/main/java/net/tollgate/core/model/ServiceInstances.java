package net.tollgate.core.model;

import java.util.List;

/** 서비스 하나에 대한 스케줄러 보고: healthy / unhealthy / killed */
public record ServiceInstances(
        List<ServiceInstance> healthy,
        List<ServiceInstance> unhealthy,
        List<ServiceInstance> killed
) {
    public ServiceInstances {
        healthy = healthy == null ? List.of() : List.copyOf(healthy);
        unhealthy = unhealthy == null ? List.of() : List.copyOf(unhealthy);
        killed = killed == null ? List.of() : List.copyOf(killed);
    }

    public static ServiceInstances empty() {
        return new ServiceInstances(List.of(), List.of(), List.of());
    }

    public static ServiceInstances healthy(ServiceInstance... instances) {
        return new ServiceInstances(List.of(instances), List.of(), List.of());
    }
}
