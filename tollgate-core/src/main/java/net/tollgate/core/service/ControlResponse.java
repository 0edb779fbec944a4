package net.tollgate.core.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 핸들러 계층에 돌려주는 응답. status는 HTTP 상태 코드와 같은 값을 쓴다.
 */
public record ControlResponse(int status, Map<String, Object> body) {
    public static final int OK = 200;
    public static final int BAD_REQUEST = 400;
    public static final int LOCKED = 423;
    public static final int INTERNAL_ERROR = 500;
    public static final int UNAVAILABLE = 503;

    public ControlResponse {
        body = Collections.unmodifiableMap(new LinkedHashMap<>(body));
    }

    public static ControlResponse ok(Map<String, Object> body) {
        return new ControlResponse(OK, body);
    }

    public static ControlResponse error(int status, String message, Map<String, Object> details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", message);
        body.putAll(details);
        return new ControlResponse(status, body);
    }

    public boolean successful() {
        return status >= 200 && status < 300;
    }
}
