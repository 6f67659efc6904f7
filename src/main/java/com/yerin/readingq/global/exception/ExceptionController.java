package com.yerin.readingq.global.exception;

import com.yerin.readingq.global.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class ExceptionController {

    static final String REQUEST_ID_HEADER = "X-Request-Id";

    @ExceptionHandler(AppException.class)
    public ResponseEntity<ErrorResponse> handleAppException(AppException e,
                                                            HttpServletRequest request) {
        log.warn("AppException: {}, path={} {}", e.logContext(),
                request.getMethod(), request.getRequestURI(), e);

        ErrorResponse body = ErrorResponse.of(e, request.getHeader(REQUEST_ID_HEADER));
        return ResponseEntity.status(e.getErrorCode().getHttpStatus()).body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAll(Exception e,
                                                   HttpServletRequest request) {
        QueueException classified = ErrorClassifier.classify(e);
        log.error("Unhandled exception: {}, path={} {}", classified.logContext(),
                request.getMethod(), request.getRequestURI(), e);

        ErrorResponse body = ErrorResponse.of(classified, request.getHeader(REQUEST_ID_HEADER));
        return ResponseEntity.status(classified.getErrorCode().getHttpStatus()).body(body);
    }
}
