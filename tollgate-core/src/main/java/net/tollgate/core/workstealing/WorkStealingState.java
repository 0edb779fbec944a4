package net.tollgate.core.workstealing;

import java.util.List;

/** work stealing 현황 (주는 쪽 누계 + 받은 제안 수) */
public record WorkStealingState(
        String routerId,
        List<String> offersInFlight,
        long offersSent,
        long offersAccepted,
        long offersDeclined,
        long offersTimedOut,
        long offersReceived
) {
    public WorkStealingState {
        offersInFlight = List.copyOf(offersInFlight);
    }
}
