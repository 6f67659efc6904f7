package com.yerin.readingq.domain;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

@Component
public class QueueMetrics {

    private final MeterRegistry registry;

    private final Counter jobEnqueued;
    private final Counter jobDuplicate;
    private final Counter jobSucceeded;
    private final Counter jobFailed;
    private final Counter jobRetried;
    private final Counter jobDlq;
    private final Counter queueErrors;

    public QueueMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.jobEnqueued  = Counter.builder("readingq_jobs_enqueued_total")
                .description("jobs enqueued").register(registry);
        this.jobDuplicate = Counter.builder("readingq_jobs_duplicate_total")
                .description("submissions suppressed by dedupe key").register(registry);
        this.jobSucceeded = Counter.builder("readingq_jobs_succeeded_total")
                .description("jobs acked").register(registry);
        this.jobFailed    = Counter.builder("readingq_jobs_failed_total")
                .description("jobs failed (handler thrown or timed out)").register(registry);
        this.jobRetried   = Counter.builder("readingq_jobs_retried_total")
                .description("jobs nacked for retry").register(registry);
        this.jobDlq       = Counter.builder("readingq_jobs_dlq_total")
                .description("jobs moved to DLQ").register(registry);
        this.queueErrors  = Counter.builder("readingq_queue_errors_total")
                .description("queue operation failures seen by workers").register(registry);
    }

    public void incEnqueued()  { jobEnqueued.increment(); }
    public void incDuplicate() { jobDuplicate.increment(); }
    public void incSucceeded() { jobSucceeded.increment(); }
    public void incFailed()    { jobFailed.increment(); }
    public void incRetried()   { jobRetried.increment(); }
    public void incDlq()       { jobDlq.increment(); }
    public void incQueueError() { queueErrors.increment(); }

    // 프롬프트 버전 태그가 붙은 핸들러 타이머
    public Timer handlerTimer(String promptVersion) {
        return Timer.builder("readingq_handler_duration_seconds")
                .description("handler duration by prompt version")
                .tag("prompt_version", promptVersion == null ? "unknown" : promptVersion)
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry);
    }
}
