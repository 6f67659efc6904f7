package com.yerin.readingq.config;

import com.yerin.readingq.application.LoggingReadingJobHandler;
import com.yerin.readingq.application.ReadingJobHandler;
import com.yerin.readingq.domain.JobQueuePort;
import com.yerin.readingq.domain.QueueMetrics;
import com.yerin.readingq.infra.RetryPolicy;
import com.yerin.readingq.infra.WorkerRunner;
import com.yerin.readingq.infra.WorkerSettings;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConditionalOnProperty(name = "readingq.worker.enabled", havingValue = "true")
public class WorkerConfig {

    @Bean
    @ConditionalOnMissingBean
    public ReadingJobHandler readingJobHandler() {
        return new LoggingReadingJobHandler();
    }

    @Bean
    public WorkerSettings workerSettings(
            @Value("${readingq.worker.concurrency:1}") int concurrency,
            @Value("${readingq.worker.job-timeout-seconds:120}") long jobTimeoutSeconds,
            @Value("${readingq.worker.idle-sleep-millis:1000}") long idleSleepMillis,
            @Value("${readingq.worker.reclaim-interval-seconds:30}") long reclaimIntervalSeconds,
            @Value("${readingq.worker.reclaim-min-idle-seconds:180}") long reclaimMinIdleSeconds) {
        return new WorkerSettings(concurrency, Duration.ofSeconds(jobTimeoutSeconds),
                Duration.ofMillis(idleSleepMillis), Duration.ofSeconds(reclaimIntervalSeconds),
                Duration.ofSeconds(reclaimMinIdleSeconds));
    }

    @Bean
    public WorkerRunner workerRunner(JobQueuePort queue, ReadingJobHandler handler, RetryPolicy retryPolicy,
                                     QueueMetrics metrics, WorkerSettings settings) {
        return new WorkerRunner(queue, handler, retryPolicy, metrics, settings);
    }
}
