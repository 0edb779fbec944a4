package net.tollgate.core.support;

/** 요청 필드 누락/형식 오류. 상태는 바뀌지 않는다 (400). */
public class InvalidRequestException extends IllegalArgumentException {
    public InvalidRequestException(String message) {
        super(message);
    }
}
