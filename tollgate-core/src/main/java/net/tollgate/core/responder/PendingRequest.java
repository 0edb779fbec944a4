package net.tollgate.core.responder;

import net.tollgate.core.model.InstanceSelection;
import net.tollgate.core.model.RequestContext;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/** 인스턴스를 기다리는 요청. arrival은 같은 priority 사이의 FIFO 순서. */
public record PendingRequest(
        RequestContext request,
        long arrival,
        Instant enqueuedAt,
        CompletableFuture<InstanceSelection> reply
) {
    /** 호출자가 타임아웃/취소로 포기했는지 */
    boolean abandoned() {
        return reply.isDone();
    }
}
