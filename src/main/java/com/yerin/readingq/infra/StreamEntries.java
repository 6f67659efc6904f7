package com.yerin.readingq.infra;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Redis/Upstash 스트림 엔트리 필드 규약.
 * <pre>
 * job_id       페이로드의 job_id
 * payload      JobPayload JSON
 * attempts     이 엔트리 이전까지 컨슈머에게 전달된 횟수(nack 시 이월)
 * enqueued_at  RFC 3339
 * </pre>
 * DLQ 스트림 엔트리는 reason, failed_at 을 추가로 가진다.
 */
final class StreamEntries {
    private StreamEntries() {}

    static final String JOB_ID = "job_id";
    static final String PAYLOAD = "payload";
    static final String ATTEMPTS = "attempts";
    static final String ENQUEUED_AT = "enqueued_at";
    static final String REASON = "reason";
    static final String FAILED_AT = "failed_at";

    static final String DLQ_SUFFIX = ":dlq";

    static Map<String, String> fields(String jobId, String payloadJson, int priorAttempts, Instant now) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(JOB_ID, jobId);
        fields.put(PAYLOAD, payloadJson);
        fields.put(ATTEMPTS, String.valueOf(priorAttempts));
        fields.put(ENQUEUED_AT, now.toString());
        return fields;
    }

    static Map<String, String> deadLetterFields(String jobId, String payloadJson, int attempts,
                                                String reason, Instant now) {
        Map<String, String> fields = new LinkedHashMap<>();
        if (jobId != null) fields.put(JOB_ID, jobId);
        fields.put(PAYLOAD, payloadJson == null ? "" : payloadJson);
        fields.put(ATTEMPTS, String.valueOf(attempts));
        fields.put(REASON, reason == null ? "" : reason);
        fields.put(FAILED_AT, now.toString());
        return fields;
    }

    static int priorAttempts(Object raw) {
        if (raw == null) return 0;
        try {
            return Math.max(0, Integer.parseInt(String.valueOf(raw)));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /** 브로커의 in-flight 작업 한 건: job_id → 엔트리 id 매핑의 값 */
    record InFlight(String entryId, String consumerId, int attempts, String payloadJson) {}
}
