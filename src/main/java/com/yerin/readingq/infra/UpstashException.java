package com.yerin.readingq.infra;

import lombok.Getter;

/**
 * Upstash REST 호출 실패. HTTP 계층 실패(타임아웃, 2xx 아님, 응답 파싱 불가)와
 * 브로커가 돌려준 오류(BROKER)를 구분한다.
 */
@Getter
public class UpstashException extends RuntimeException {

    public enum Kind {
        TIMEOUT,
        HTTP_STATUS,
        IO,
        MALFORMED_RESPONSE,
        BROKER
    }

    private final Kind kind;
    private final int httpStatus;

    public UpstashException(Kind kind, String message, Throwable cause) {
        this(kind, 0, message, cause);
    }

    public UpstashException(Kind kind, int httpStatus, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.httpStatus = httpStatus;
    }

    public boolean isTransportError() {
        return kind != Kind.BROKER;
    }

    public boolean isBusyGroup() {
        String msg = getMessage() == null ? "" : getMessage();
        return msg.contains("BUSYGROUP") || msg.contains("already exists");
    }
}
