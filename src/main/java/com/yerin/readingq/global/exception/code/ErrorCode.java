package com.yerin.readingq.global.exception.code;

import org.springframework.http.HttpStatus;

public interface ErrorCode {
    HttpStatus getHttpStatus();

    /** 사용자에게 보여줄 메시지. 백엔드 이름, 호스트, 원본 예외 문구를 담지 않는다. */
    String getMessage();

    String getCode();

    ErrorSeverity getSeverity();

    boolean isRetryable();
}
