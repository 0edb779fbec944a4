package net.tollgate.core.model;

public enum InterstitialResolution {
    HEALTHY_INSTANCE_FOUND, INTERSTITIAL_TIMEOUT;

    public String code() { return name().toLowerCase().replace('_', '-'); }
}
