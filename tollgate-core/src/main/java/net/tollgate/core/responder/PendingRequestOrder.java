package net.tollgate.core.responder;

import java.util.Comparator;

/** 대기 큐의 꺼내는 순서. 교체 가능. */
public final class PendingRequestOrder {
    private PendingRequestOrder() { }

    /** priority 높은 것 먼저, 같으면 먼저 온 것 먼저 */
    public static Comparator<PendingRequest> priorityThenArrival() {
        return Comparator.comparingInt((PendingRequest p) -> p.request().priority()).reversed()
                .thenComparingLong(PendingRequest::arrival);
    }

    public static Comparator<PendingRequest> arrival() {
        return Comparator.comparingLong(PendingRequest::arrival);
    }
}
