package com.yerin.readingq.global.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.yerin.readingq.global.exception.code.ErrorSeverity;

import java.time.Instant;
import java.util.Map;

/**
 * 운영자용 오류 문맥. 로그/트레이싱으로만 내보낸다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ErrorContext(
        String errorCode,
        ErrorSeverity severity,
        Instant timestamp,
        String jobId,
        String userId,
        String traceId,
        Map<String, String> metadata
) {
    public ErrorContext {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
