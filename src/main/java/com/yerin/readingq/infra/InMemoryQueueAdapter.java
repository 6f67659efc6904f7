package com.yerin.readingq.infra;

import com.yerin.readingq.domain.JobPayload;
import com.yerin.readingq.domain.JobQueuePort;
import com.yerin.readingq.domain.JobStatus;
import com.yerin.readingq.domain.QueuedJob;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 프로세스 내 기준 구현(테스트/로컬용).
 * <p>
 * 모든 상태는 {@link State} 하나에 있고 모든 연산이 같은 락을 처음부터 끝까지 잡는다.
 * nack 된 작업은 대기열 <b>앞</b>으로 돌아간다(새 작업보다 재시도 우선).
 * dequeue 후 ack/nack 없이 사라진 컨슈머의 작업은 claimed 에 남는다(visibility timeout 없음).
 */
@Slf4j
public class InMemoryQueueAdapter implements JobQueuePort {

    private static final class State {
        final Deque<JobPayload> pending = new ArrayDeque<>();
        final Map<String, Claim> claimed = new HashMap<>();
        final Map<String, Integer> attempts = new HashMap<>();
        final Map<String, JobStatus> statuses = new HashMap<>();
        final List<DeadLetter> deadLetters = new ArrayList<>();
    }

    private record Claim(String consumerId, QueuedJob job) {}

    private record DeadLetter(QueuedJob job, String reason, Instant failedAt) {}

    private final State state = new State();
    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;

    public InMemoryQueueAdapter() {
        this(Clock.systemUTC());
    }

    public InMemoryQueueAdapter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String enqueue(JobPayload payload) {
        lock.lock();
        try {
            String jobId = payload.jobId();
            state.pending.addLast(payload);
            state.attempts.putIfAbsent(jobId, 0);
            state.statuses.put(jobId, JobStatus.QUEUED);
            log.debug("[InMemoryQueue] enqueue jobId={}, pending={}", jobId, state.pending.size());
            return jobId;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<QueuedJob> dequeue(String consumerId) {
        lock.lock();
        try {
            JobPayload payload = state.pending.pollFirst();
            if (payload == null) return Optional.empty();

            String jobId = payload.jobId();
            int attempts = state.attempts.merge(jobId, 1, Integer::sum);
            QueuedJob job = QueuedJob.claimed(payload, attempts, clock.instant());
            state.claimed.put(jobId, new Claim(consumerId, job));
            state.statuses.put(jobId, JobStatus.PROCESSING);
            log.debug("[InMemoryQueue] dequeue jobId={}, consumer={}, attempts={}", jobId, consumerId, attempts);
            return Optional.of(job);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void ack(String jobId, String consumerId) {
        lock.lock();
        try {
            Claim claim = state.claimed.remove(jobId);
            if (claim == null) {
                // 중복 ack 또는 모르는 job → 무시
                log.debug("[InMemoryQueue] ack ignored (not in processing) jobId={}", jobId);
                return;
            }
            warnOnMismatch("ack", jobId, claim, consumerId);
            state.attempts.remove(jobId);
            state.statuses.put(jobId, JobStatus.SUCCEEDED);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void nack(String jobId, String consumerId, String reason) {
        lock.lock();
        try {
            Claim claim = state.claimed.remove(jobId);
            if (claim == null) {
                log.debug("[InMemoryQueue] nack ignored (not in processing) jobId={}", jobId);
                return;
            }
            warnOnMismatch("nack", jobId, claim, consumerId);
            state.pending.addFirst(claim.job().payload());
            state.statuses.put(jobId, JobStatus.QUEUED);
            log.info("[InMemoryQueue] NACK jobId={}, consumer={}, attempts={}, reason={}",
                    jobId, consumerId, claim.job().attempts(), reason);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long queueLength() {
        lock.lock();
        try {
            return state.pending.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void deadLetter(String jobId, String consumerId, String reason) {
        lock.lock();
        try {
            Claim claim = state.claimed.remove(jobId);
            if (claim == null) {
                log.debug("[InMemoryQueue] deadLetter ignored (not in processing) jobId={}", jobId);
                return;
            }
            warnOnMismatch("deadLetter", jobId, claim, consumerId);
            state.attempts.remove(jobId);
            state.deadLetters.add(new DeadLetter(claim.job(), reason, clock.instant()));
            state.statuses.put(jobId, JobStatus.DLQ);
            log.warn("[InMemoryQueue] DLQ jobId={}, attempts={}, reason={}", jobId, claim.job().attempts(), reason);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long deadLetterLength() {
        lock.lock();
        try {
            return state.deadLetters.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<JobStatus> statusOf(String jobId) {
        lock.lock();
        try {
            return Optional.ofNullable(state.statuses.get(jobId));
        } finally {
            lock.unlock();
        }
    }

    /** 현재 점유 중인 작업 수 */
    public int processingCount() {
        lock.lock();
        try {
            return state.claimed.size();
        } finally {
            lock.unlock();
        }
    }

    private static void warnOnMismatch(String op, String jobId, Claim claim, String consumerId) {
        if (!claim.consumerId().equals(consumerId)) {
            log.warn("[InMemoryQueue] {} consumer mismatch jobId={}, owner={}, caller={}",
                    op, jobId, claim.consumerId(), consumerId);
        }
    }
}
