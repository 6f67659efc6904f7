package com.yerin.readingq.infra;

import com.yerin.readingq.application.ReadingJobHandler;
import com.yerin.readingq.domain.JobQueuePort;
import com.yerin.readingq.domain.QueueMetrics;
import com.yerin.readingq.domain.QueuedJob;
import com.yerin.readingq.global.exception.AppException;
import com.yerin.readingq.global.exception.QueueException;
import com.yerin.readingq.global.exception.WorkerException;
import com.yerin.readingq.global.exception.code.WorkerErrorCode;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 컨슈머 루프: dequeue → handle → ack. 실패 시 {@link RetryPolicy} 로 nack(지연 후) 또는 DLQ 를 고른다.
 */
@Slf4j
public class WorkerRunner {

    private static final Duration ERROR_BACKOFF = Duration.ofMillis(500);

    private final JobQueuePort queue;
    private final ReadingJobHandler handler;
    private final RetryPolicy retryPolicy;
    private final QueueMetrics metrics;
    private final WorkerSettings settings;

    private ExecutorService workers;
    private final ExecutorService handlerPool;
    private volatile boolean running = false;

    public WorkerRunner(JobQueuePort queue, ReadingJobHandler handler, RetryPolicy retryPolicy,
                        QueueMetrics metrics, WorkerSettings settings) {
        this.queue = queue;
        this.handler = handler;
        this.retryPolicy = retryPolicy;
        this.metrics = metrics;
        this.settings = settings.requireSafeReclaim(retryPolicy.getConfig().maxDelay());
        this.handlerPool = Executors.newCachedThreadPool();
    }

    @PostConstruct
    public void startWorkers() {
        running = true;
        workers = Executors.newFixedThreadPool(settings.concurrency());
        for (int i = 0; i < settings.concurrency(); i++) {
            final String consumer = WorkerId.consumerName(i);
            workers.submit(() -> runLoop(consumer));
        }
        log.info("[Worker] started {} consumers, jobTimeout={}, reclaimInterval={}",
                settings.concurrency(), settings.jobTimeout(), settings.reclaimInterval());
    }

    @PreDestroy
    public void stopWorkers() {
        running = false;
        if (workers != null) workers.shutdownNow();
        handlerPool.shutdownNow();
        try {
            if (workers != null && !workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Worker] consumers did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("[Worker] stopped");
    }

    void runLoop(String consumer) {
        long lastReclaim = System.nanoTime();
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                if (settings.reclaimEnabled()
                        && System.nanoTime() - lastReclaim >= settings.reclaimInterval().toNanos()) {
                    lastReclaim = System.nanoTime();
                    reclaimOnce(consumer);
                }
                if (!pollOnce(consumer)) {
                    sleep(settings.idleSleep());
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            } catch (QueueException qe) {
                metrics.incQueueError();
                log.warn("[Worker] queue error consumer={}, {}", consumer, qe.logContext());
                backoffAfterError();
            } catch (RuntimeException e) {
                log.error("[Worker] poll loop error consumer={}", consumer, e);
                backoffAfterError();
            }
        }
        log.info("[Worker] consumer {} exited", consumer);
    }

    /**
     * @return 작업을 하나 처리했으면 true, 큐가 비어 있었으면 false
     */
    public boolean pollOnce(String consumer) throws InterruptedException {
        Optional<QueuedJob> next = queue.dequeue(consumer);
        if (next.isEmpty()) return false;
        process(next.get(), consumer);
        return true;
    }

    /** 다른 컨슈머가 잡고 죽은 작업을 가져와 처리한다 */
    public int reclaimOnce(String consumer) throws InterruptedException {
        List<QueuedJob> stale = queue.reclaimStale(consumer, settings.reclaimMinIdle());
        for (QueuedJob job : stale) {
            process(job, consumer);
        }
        return stale.size();
    }

    void process(QueuedJob job, String consumer) throws InterruptedException {
        try {
            runHandler(job);
        } catch (InterruptedException ie) {
            // 종료 중: 다음 워커가 다시 가져가도록 되돌린다
            queue.nack(job.jobId(), consumer, "worker interrupted");
            throw ie;
        } catch (Exception e) {
            metrics.incFailed();
            onFailure(job, consumer, e);
            return;
        }
        queue.ack(job.jobId(), consumer);
        metrics.incSucceeded();
        log.info("[Worker] ACK jobId={}, consumer={}, attempts={}", job.jobId(), consumer, job.attempts());
    }

    private void runHandler(QueuedJob job) throws Exception {
        long start = System.nanoTime();
        try {
            if (!settings.timeoutEnabled()) {
                handler.handle(job);
                return;
            }
            Future<?> future = handlerPool.submit(() -> {
                handler.handle(job);
                return null;
            });
            try {
                future.get(settings.jobTimeout().toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException te) {
                future.cancel(true);
                throw WorkerException.timeout(job.jobId(), job.attempts(), settings.jobTimeout());
            } catch (InterruptedException ie) {
                future.cancel(true);
                throw ie;
            } catch (ExecutionException ee) {
                Throwable cause = ee.getCause();
                if (cause instanceof Exception ex) throw ex;
                throw WorkerException.internal("handler raised " + cause, cause);
            }
        } finally {
            metrics.handlerTimer(job.payload().promptVersion()).record(Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private void onFailure(QueuedJob job, String consumer, Exception e) throws InterruptedException {
        if (e instanceof WorkerException we && we.getErrorCode() == WorkerErrorCode.WORKER_INVALID_JOB_DATA) {
            log.warn("[Worker] invalid job data, {}", we.logContext());
            deadLetter(job, consumer, we.logContext());
            return;
        }

        WorkerException failure = WorkerException.processingFailed(job.jobId(), job.attempts(),
                retryPolicy.getConfig().maxAttempts(), describe(e), e);
        log.warn("[Worker] handler failed, {}", failure.logContext(), e);

        Optional<Duration> delay = retryPolicy.nextAttemptDelay(job);
        if (delay.isEmpty()) {
            WorkerException exhausted = WorkerException.maxRetriesExceeded(job.jobId(), job.attempts());
            log.error("[Worker] {}", exhausted.logContext());
            deadLetter(job, consumer, exhausted.logContext() + " last_error=\"" + describe(e) + "\"");
            return;
        }

        WorkerException retry = WorkerException.retryable(job.jobId(), job.attempts(), delay.get(), describe(e));
        log.info("[Worker] retry scheduled, {}", retry.logContext());
        try {
            sleep(delay.get());
        } catch (InterruptedException ie) {
            queue.nack(job.jobId(), consumer, describe(e));
            throw ie;
        }
        queue.nack(job.jobId(), consumer, describe(e));
        metrics.incRetried();
    }

    private void deadLetter(QueuedJob job, String consumer, String reason) {
        queue.deadLetter(job.jobId(), consumer, reason);
        metrics.incDlq();
    }

    private static String describe(Throwable e) {
        if (e instanceof AppException ae) return ae.logContext();
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    private static void sleep(Duration d) throws InterruptedException {
        if (d == null || d.isZero() || d.isNegative()) return;
        Thread.sleep(d.toMillis());
    }

    private void backoffAfterError() {
        try {
            Thread.sleep(ERROR_BACKOFF.toMillis());
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }
}
