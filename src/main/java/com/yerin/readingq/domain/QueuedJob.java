package com.yerin.readingq.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * 컨슈머에게 전달된 작업. attempts 는 지금까지 전달된 횟수(첫 dequeue 시 1).
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record QueuedJob(
        String jobId,
        JobPayload payload,
        int attempts,
        Instant claimedAt
) {
    public static QueuedJob claimed(JobPayload payload, int attempts, Instant claimedAt) {
        return new QueuedJob(payload.jobId(), payload, attempts, claimedAt);
    }
}
