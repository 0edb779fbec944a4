package net.tollgate.core.interstitial;

/**
 * @param interstitial promise 상태 코드. promise가 없으면 null
 */
public record InterstitialServiceState(String serviceId, boolean available, String interstitial) {}
