package com.yerin.readingq.global.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.yerin.readingq.global.exception.AppException;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ErrorResponse(
        String errorCode,
        String userMessage,
        String severity,
        String timestamp,
        String requestId
) {
    public static ErrorResponse of(AppException e, String requestId) {
        return new ErrorResponse(
                e.getErrorCode().getCode(),
                e.userMessage(),
                e.severity().toString(),
                e.getOccurredAt().toString(),
                requestId
        );
    }

    public static ErrorResponse of(AppException e) {
        return of(e, null);
    }
}
