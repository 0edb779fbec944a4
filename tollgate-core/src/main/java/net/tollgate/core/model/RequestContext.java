package net.tollgate.core.model;

/** 인스턴스 선택을 요청하는 라우팅 요청. priority가 클수록 먼저 처리된다. */
public record RequestContext(String requestId, int priority) {
    public static RequestContext of(String requestId) {
        return new RequestContext(requestId, 0);
    }
}
