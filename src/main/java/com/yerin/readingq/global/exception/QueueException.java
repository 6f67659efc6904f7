package com.yerin.readingq.global.exception;

import com.yerin.readingq.global.exception.code.QueueErrorCode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 큐 전송 계층 오류. 어댑터가 하위 예외를 처음 관찰한 지점에서 이 타입으로 감싼다.
 */
public class QueueException extends AppException {

    private QueueException(QueueErrorCode code, Map<String, String> details, Throwable cause) {
        super(code, details, cause);
    }

    @Override
    public QueueErrorCode getErrorCode() {
        return (QueueErrorCode) super.getErrorCode();
    }

    public static QueueException of(QueueErrorCode code, String reason, Throwable cause) {
        return new QueueException(code, details("reason", reason), cause);
    }

    public static QueueException of(QueueErrorCode code, String jobId, String reason, Throwable cause) {
        return switch (code) {
            case QUEUE_ENQUEUE_FAILED -> new QueueException(code, details("payload_id", jobId, "reason", reason), cause);
            case QUEUE_ACK_FAILED, QUEUE_NACK_FAILED -> new QueueException(code, details("job_id", jobId, "reason", reason), cause);
            default -> jobId == null
                    ? of(code, reason, cause)
                    : new QueueException(code, details("job_id", jobId, "reason", reason), cause);
        };
    }

    public static QueueException connectionFailed(String reason, Throwable cause) {
        return of(QueueErrorCode.QUEUE_CONNECTION_FAILED, reason, cause);
    }

    public static QueueException timeout(String reason, Throwable cause) {
        return of(QueueErrorCode.QUEUE_TIMEOUT_ERROR, reason, cause);
    }

    public static QueueException enqueueFailed(String payloadId, String reason, Throwable cause) {
        return of(QueueErrorCode.QUEUE_ENQUEUE_FAILED, payloadId, reason, cause);
    }

    public static QueueException ackFailed(String jobId, String reason, Throwable cause) {
        return of(QueueErrorCode.QUEUE_ACK_FAILED, jobId, reason, cause);
    }

    public static QueueException nackFailed(String jobId, String reason, Throwable cause) {
        return of(QueueErrorCode.QUEUE_NACK_FAILED, jobId, reason, cause);
    }

    public static QueueException invalidPayload(String reason) {
        return of(QueueErrorCode.QUEUE_INVALID_PAYLOAD, reason, null);
    }

    static Map<String, String> details(String... kv) {
        Map<String, String> m = new LinkedHashMap<>();
        for (int i = 0; i + 1 < kv.length; i += 2) {
            if (kv[i + 1] != null) m.put(kv[i], kv[i + 1]);
        }
        return m;
    }
}
