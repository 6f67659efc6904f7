package com.yerin.readingq.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * 타로 리딩 작업 페이로드. 생성 후 변경되지 않는다.
 * <p>
 * 큐는 내용을 검증하지 않는다(card_count 3/5 등은 생산자 책임).
 */
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobPayload(
        String jobId,
        UUID userId,
        String question,
        int cardCount,
        String schemaVersion,
        String promptVersion,
        String dedupeKey,
        String traceId,
        Instant createdAt,
        Map<String, Object> metadata
) {
    public JobPayload {
        Objects.requireNonNull(jobId, "jobId");
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
