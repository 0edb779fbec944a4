package net.tollgate.core.responder;

import net.tollgate.core.model.BlacklistResult;
import net.tollgate.core.model.InstanceSelection;
import net.tollgate.core.model.OfferResponse;
import net.tollgate.core.model.ReleaseOutcome;
import net.tollgate.core.model.RequestContext;
import net.tollgate.core.model.ResponderState;
import net.tollgate.core.model.ServiceInstances;
import net.tollgate.core.model.WorkStealingOffer;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Responder 수신 채널의 메시지. 응답이 필요한 메시지는 단발성 future를 들고 온다.
 * 전달되지 못한 메시지는 {@link #reject(Throwable)}로 호출자에게 실패를 알린다.
 */
public interface ResponderMessage {

    default void reject(Throwable cause) { }

    record ApplySchedulerUpdate(ServiceInstances instances, Instant syncedAt) implements ResponderMessage {}

    /** 스케줄러의 available-service-ids에서 빠짐 → DRAINING */
    record ServiceRemoved() implements ResponderMessage {}

    /**
     * @param queueIfUnavailable false면 즉시 NoInstanceAvailable, true면 max-queue-length까지 대기
     */
    record SelectInstance(RequestContext request,
                          boolean queueIfUnavailable,
                          CompletableFuture<InstanceSelection> reply) implements ResponderMessage {
        @Override public void reject(Throwable cause) { reply.completeExceptionally(cause); }
    }

    record ReleaseInstance(String instanceId, ReleaseOutcome outcome) implements ResponderMessage {}

    record BlacklistInstance(String instanceId,
                             Duration period,
                             String reason,
                             CompletableFuture<BlacklistResult> reply) implements ResponderMessage {
        @Override public void reject(Throwable cause) { reply.completeExceptionally(cause); }
    }

    /** 다른 라우터가 보낸 제안 (받는 쪽) */
    record OfferInstance(WorkStealingOffer offer) implements ResponderMessage {
        @Override public void reject(Throwable cause) { offer.response().complete(OfferResponse.DECLINED); }
    }

    /** 유휴 인스턴스 하나를 예약하고 targetRouterId에 보낼 제안을 만든다 (주는 쪽) */
    record ReserveIdleForOffer(String targetRouterId,
                               CompletableFuture<Optional<WorkStealingOffer>> reply) implements ResponderMessage {
        @Override public void reject(Throwable cause) { reply.complete(Optional.empty()); }
    }

    record OfferResolved(WorkStealingOffer offer, OfferResponse response) implements ResponderMessage {}

    record OfferReturned(WorkStealingOffer offer, ReleaseOutcome outcome) implements ResponderMessage {}

    record QueryState(CompletableFuture<ResponderState> reply) implements ResponderMessage {
        @Override public void reject(Throwable cause) { reply.completeExceptionally(cause); }
    }

    /** 만료 정리 (블랙리스트, 예약, DRAINING 종료 판단) */
    record Sweep() implements ResponderMessage {}
}
