package com.yerin.readingq.global.exception.code;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

import static com.yerin.readingq.global.exception.code.ErrorSeverity.ERROR;
import static com.yerin.readingq.global.exception.code.ErrorSeverity.WARNING;

@Getter
@RequiredArgsConstructor
public enum QueueErrorCode implements ErrorCode {
    QUEUE_CONNECTION_FAILED(HttpStatus.SERVICE_UNAVAILABLE, ERROR, true,
            "Service temporarily unavailable. Please try again in a few moments."),
    QUEUE_NETWORK_ERROR(HttpStatus.SERVICE_UNAVAILABLE, ERROR, true,
            "Service temporarily unavailable. Please try again in a few moments."),
    QUEUE_TIMEOUT_ERROR(HttpStatus.GATEWAY_TIMEOUT, WARNING, true,
            "Request timed out. Please try again."),
    QUEUE_ENQUEUE_FAILED(HttpStatus.SERVICE_UNAVAILABLE, WARNING, true,
            "Service is experiencing high demand. Please try again later."),
    QUEUE_QUEUE_FULL(HttpStatus.TOO_MANY_REQUESTS, WARNING, true,
            "Service is experiencing high demand. Please try again later."),
    QUEUE_DEQUEUE_FAILED(HttpStatus.SERVICE_UNAVAILABLE, WARNING, true,
            "Unable to process request at this time. Please try again."),
    // ack/nack 실패는 작업 상태가 모호하므로 자동 재시도하지 않는다
    QUEUE_ACK_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, WARNING, false,
            "Job processing encountered an issue. Please contact support if this persists."),
    QUEUE_NACK_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, WARNING, false,
            "Job processing encountered an issue. Please contact support if this persists."),
    QUEUE_INVALID_PAYLOAD(HttpStatus.BAD_REQUEST, WARNING, false,
            "Invalid request format. Please check your input and try again."),
    QUEUE_INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, ERROR, false,
            "An unexpected error occurred. Please try again or contact support.");

    private final HttpStatus httpStatus;
    private final ErrorSeverity severity;
    private final boolean retryable;
    private final String message;

    @Override
    public String getCode() {
        return name();
    }
}
