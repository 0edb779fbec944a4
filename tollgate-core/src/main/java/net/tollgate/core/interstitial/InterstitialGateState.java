package net.tollgate.core.interstitial;

import java.util.Map;
import java.util.Set;

public record InterstitialGateState(
        boolean initialized,
        Map<String, String> promises,
        Set<String> availableServiceIds
) {
    public InterstitialGateState {
        promises = Map.copyOf(promises);
        availableServiceIds = Set.copyOf(availableServiceIds);
    }
}
