package com.yerin.readingq.global.exception;

import com.yerin.readingq.global.exception.code.WorkerErrorCode;
import lombok.Getter;

import java.time.Duration;
import java.util.List;

import static com.yerin.readingq.global.exception.QueueException.details;

/**
 * 워커(작업 처리) 측 오류. 핸들러는 재시도하면 안 되는 입력 오류를 {@link #invalidJobData} 로 던진다.
 */
@Getter
public class WorkerException extends AppException {

    private final String jobId;
    private final int attempts;
    private final int maxAttempts;

    private WorkerException(WorkerErrorCode code, String jobId, int attempts, int maxAttempts,
                            String[] details, Throwable cause) {
        super(code, details(details), cause);
        this.jobId = jobId;
        this.attempts = attempts;
        this.maxAttempts = maxAttempts;
    }

    @Override
    public WorkerErrorCode getErrorCode() {
        return (WorkerErrorCode) super.getErrorCode();
    }

    @Override
    public String userMessage() {
        if (getErrorCode() == WorkerErrorCode.WORKER_JOB_PROCESSING_FAILED && attempts > 1 && maxAttempts > 0) {
            return "Job processing is taking longer than expected. Attempt %d of %d. Please be patient."
                    .formatted(attempts, maxAttempts);
        }
        return super.userMessage();
    }

    public static WorkerException processingFailed(String jobId, int attempts, int maxAttempts,
                                                   String reason, Throwable cause) {
        return new WorkerException(WorkerErrorCode.WORKER_JOB_PROCESSING_FAILED, jobId, attempts, maxAttempts,
                new String[]{"job_id", jobId, "attempts", String.valueOf(attempts), "reason", reason}, cause);
    }

    public static WorkerException timeout(String jobId, int attempts, Duration timeout) {
        return new WorkerException(WorkerErrorCode.WORKER_JOB_TIMEOUT, jobId, attempts, 0,
                new String[]{"job_id", jobId, "timeout_seconds", String.valueOf(timeout.toSeconds())}, null);
    }

    public static WorkerException retryable(String jobId, int attempts, Duration nextRetryIn, String reason) {
        return new WorkerException(WorkerErrorCode.WORKER_RETRYABLE_ERROR, jobId, attempts, 0,
                new String[]{"job_id", jobId, "attempts", String.valueOf(attempts),
                        "next_retry_in", nextRetryIn.toSeconds() + "s", "reason", reason}, null);
    }

    public static WorkerException maxRetriesExceeded(String jobId, int totalAttempts) {
        return new WorkerException(WorkerErrorCode.WORKER_MAX_RETRIES_EXCEEDED, jobId, totalAttempts, totalAttempts,
                new String[]{"job_id", jobId, "total_attempts", String.valueOf(totalAttempts)}, null);
    }

    public static WorkerException invalidJobData(String jobId, List<String> validationErrors) {
        return new WorkerException(WorkerErrorCode.WORKER_INVALID_JOB_DATA, jobId, 0, 0,
                new String[]{"job_id", jobId, "validation_errors", "[" + String.join(", ", validationErrors) + "]"}, null);
    }

    public static WorkerException internal(String reason, Throwable cause) {
        return new WorkerException(WorkerErrorCode.WORKER_INTERNAL_ERROR, null, 0, 0,
                new String[]{"reason", reason}, cause);
    }
}
