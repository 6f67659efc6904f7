package com.yerin.readingq.global.exception.code;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

import static com.yerin.readingq.global.exception.code.ErrorSeverity.ERROR;
import static com.yerin.readingq.global.exception.code.ErrorSeverity.WARNING;

@Getter
@RequiredArgsConstructor
public enum WorkerErrorCode implements ErrorCode {
    WORKER_JOB_PROCESSING_FAILED(HttpStatus.ACCEPTED, WARNING, true,
            "Your request is being processed. This may take a few moments."),
    WORKER_JOB_TIMEOUT(HttpStatus.GATEWAY_TIMEOUT, WARNING, true,
            "Request processing timed out. Please try again with a simpler query."),
    WORKER_RETRYABLE_ERROR(HttpStatus.ACCEPTED, WARNING, true,
            "Your request is still being processed. Please check back in a few moments."),
    WORKER_MAX_RETRIES_EXCEEDED(HttpStatus.INTERNAL_SERVER_ERROR, ERROR, false,
            "Request processing failed after multiple attempts. Please try again later."),
    WORKER_INVALID_JOB_DATA(HttpStatus.BAD_REQUEST, WARNING, false,
            "Invalid request format. Please check your input and try again."),
    WORKER_INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, ERROR, false,
            "An unexpected error occurred during processing. Please try again.");

    private final HttpStatus httpStatus;
    private final ErrorSeverity severity;
    private final boolean retryable;
    private final String message;

    @Override
    public String getCode() {
        return name();
    }
}
