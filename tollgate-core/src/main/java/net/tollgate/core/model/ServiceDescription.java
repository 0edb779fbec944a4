package net.tollgate.core.model;

public record ServiceDescription(
        String serviceId,
        int interstitialSecs,
        int maxQueueLength,
        int concurrencyLevel,
        DistributionScheme distributionScheme
) {
    public ServiceDescription {
        if (serviceId == null || serviceId.isBlank()) throw new IllegalArgumentException("serviceId is required");
        if (interstitialSecs < 0) throw new IllegalArgumentException("interstitialSecs must be >= 0");
        if (maxQueueLength < 0) throw new IllegalArgumentException("maxQueueLength must be >= 0");
        if (concurrencyLevel < 1) throw new IllegalArgumentException("concurrencyLevel must be >= 1");
        if (distributionScheme == null) distributionScheme = DistributionScheme.BALANCED;
    }

    public boolean workStealingEnabled() {
        return distributionScheme == DistributionScheme.BALANCED;
    }
}
