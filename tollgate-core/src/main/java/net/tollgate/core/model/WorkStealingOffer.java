package net.tollgate.core.model;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * 다른 라우터에 유휴 인스턴스를 빌려주는 제안.
 * response는 수락/거절 한 번만, returned는 빌려간 쪽이 인스턴스를 돌려줄 때 한 번만 완료된다.
 */
public record WorkStealingOffer(
        String cid,
        String requestId,
        String routerId,
        String serviceId,
        ServiceInstance instance,
        Instant expiresAt,
        CompletableFuture<OfferResponse> response,
        CompletableFuture<ReleaseOutcome> returned
) {
    public static WorkStealingOffer create(String cid, String requestId, String routerId,
                                           ServiceInstance instance, Instant expiresAt) {
        return new WorkStealingOffer(cid, requestId, routerId, instance.serviceId(), instance, expiresAt,
                new CompletableFuture<>(), new CompletableFuture<>());
    }

    /** 필수 필드 누락 여부 (누락 시 프로토콜 위반) */
    public boolean complete() {
        return notBlank(cid) && notBlank(requestId) && notBlank(routerId) && notBlank(serviceId)
                && instance != null && expiresAt != null && response != null && returned != null;
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
