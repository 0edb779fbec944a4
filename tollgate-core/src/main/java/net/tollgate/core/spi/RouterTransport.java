package net.tollgate.core.spi;

import net.tollgate.core.model.OfferResponse;
import net.tollgate.core.model.WorkStealingOffer;

import java.util.concurrent.CompletableFuture;

/** 라우터 간 요청/응답 전송. routerId로 주소 지정. */
public interface RouterTransport {
    /**
     * 상대 라우터에 제안을 보낸다. 반환 future는 상대의 수락/거절로 완료된다.
     * 빌려간 인스턴스의 반납은 offer.returned()로 전달되어야 한다.
     */
    CompletableFuture<OfferResponse> sendOffer(String routerId, WorkStealingOffer offer);
}
