package com.yerin.readingq.service;

import com.yerin.readingq.domain.DedupeGate;
import com.yerin.readingq.domain.JobPayload;
import com.yerin.readingq.domain.JobQueuePort;
import com.yerin.readingq.domain.QueueMetrics;
import com.yerin.readingq.global.exception.QueueException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;

@Slf4j
@Service
@RequiredArgsConstructor
public class EnqueueJobService {
    private final JobQueuePort jobQueuePort;
    private final DedupeGate dedupeGate;
    private final QueueMetrics metrics;

    @Value("${readingq.dedupe.ttl-seconds:300}")
    private long dedupeTtlSeconds = 300;

    public EnqueueResult submit(JobPayload payload) {
        String dedupeKey = payload.dedupeKey();
        boolean gated = dedupeKey != null && !dedupeKey.isBlank();

        if (gated && !dedupeGate.trySetKey(dedupeKey, Duration.ofSeconds(dedupeTtlSeconds))) {
            metrics.incDuplicate();
            log.info("[Enqueue] duplicate suppressed jobId={}, dedupeKey={}", payload.jobId(), dedupeKey);
            return new EnqueueResult(payload.jobId(), true);
        }

        try {
            String jobId = jobQueuePort.enqueue(payload);
            metrics.incEnqueued();
            return new EnqueueResult(jobId, false);
        } catch (QueueException e) {
            // 실패한 제출의 키는 해제
            if (gated) releaseQuietly(dedupeKey, e);
            throw e;
        }
    }

    private void releaseQuietly(String dedupeKey, QueueException original) {
        try {
            dedupeGate.deleteKey(dedupeKey);
        } catch (QueueException release) {
            original.addSuppressed(release);
            log.warn("[Enqueue] dedupe key release failed key={}, {}", dedupeKey, release.logContext());
        }
    }
}
