package com.yerin.readingq.domain;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * 모든 큐 백엔드(in-memory, Redis Streams, Upstash REST)가 구현하는 계약.
 * <p>
 * 상태 전이: QUEUED → PROCESSING(dequeue) → SUCCEEDED(ack) | QUEUED(nack) | DLQ(deadLetter).
 * 모든 실패는 {@link com.yerin.readingq.global.exception.QueueException} 으로 감싸서 던진다.
 */
public interface JobQueuePort {

    /**
     * 페이로드를 큐 끝에 넣고 job_id 를 그대로 돌려준다. 내용 검증은 하지 않는다.
     */
    String enqueue(JobPayload payload);

    /**
     * 다른 컨슈머가 점유하지 않은 다음 작업. 비어 있으면 empty (정상 결과).
     * 백엔드에 따라 read timeout 동안 블로킹될 수 있다.
     */
    Optional<QueuedJob> dequeue(String consumerId);

    /**
     * 처리 완료. 이미 ack 됐거나 모르는 job_id 는 무시한다.
     */
    void ack(String jobId, String consumerId);

    /**
     * 처리 실패. 작업을 다시 dequeue 가능한 상태로 돌린다.
     *
     * @param reason 진단용 사유, null 허용
     */
    void nack(String jobId, String consumerId, String reason);

    /** 점유되지 않은 대기 작업 수 */
    long queueLength();

    /**
     * 재시도 예산을 다 쓴 작업을 DLQ 로 보낸다. ack 와 마찬가지로 모르는 job_id 는 무시한다.
     */
    void deadLetter(String jobId, String consumerId, String reason);

    long deadLetterLength();

    /**
     * 다른 컨슈머가 가져간 뒤 minIdle 이상 ack 되지 않은 작업을 consumerId 로 가져온다.
     * 점유 기록을 브로커가 관리하지 않는 백엔드는 빈 목록을 돌려준다.
     */
    default List<QueuedJob> reclaimStale(String consumerId, Duration minIdle) {
        return List.of();
    }

    /**
     * 상태를 명시적으로 추적하는 백엔드만 값을 돌려준다.
     */
    default Optional<JobStatus> statusOf(String jobId) {
        return Optional.empty();
    }
}
