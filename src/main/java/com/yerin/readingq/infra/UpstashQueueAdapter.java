package com.yerin.readingq.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.yerin.readingq.domain.JobPayload;
import com.yerin.readingq.domain.JobQueuePort;
import com.yerin.readingq.domain.QueuedJob;
import com.yerin.readingq.global.exception.ErrorClassifier;
import com.yerin.readingq.global.exception.QueueException;
import com.yerin.readingq.global.exception.code.QueueErrorCode;
import com.yerin.readingq.infra.StreamEntries.InFlight;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Upstash REST 프록시를 통한 Redis Streams 백엔드. 명령 구성은 {@link RedisStreamsQueueAdapter} 와 같다.
 * 프록시가 BLOCK 을 지원하지 않으므로 dequeue 는 한 번 조회하고 바로 돌아온다.
 */
@Slf4j
public class UpstashQueueAdapter implements JobQueuePort {

    private static final int RECLAIM_BATCH = 100;

    private final UpstashCommandClient client;
    private final JobPayloadCodec codec;
    private final String streamKey;
    private final String dlqKey;
    private final String groupName;
    private final Clock clock;

    private final Map<String, InFlight> inFlight = new ConcurrentHashMap<>();
    private volatile boolean grouped = false;

    public UpstashQueueAdapter(UpstashCommandClient client, JobPayloadCodec codec,
                               String streamKey, String groupName) {
        this(client, codec, streamKey, groupName, Clock.systemUTC());
    }

    public UpstashQueueAdapter(UpstashCommandClient client, JobPayloadCodec codec,
                               String streamKey, String groupName, Clock clock) {
        this.client = client;
        this.codec = codec;
        this.streamKey = streamKey;
        this.dlqKey = streamKey + StreamEntries.DLQ_SUFFIX;
        this.groupName = groupName;
        this.clock = clock;
    }

    @Override
    public String enqueue(JobPayload payload) {
        String jobId = payload.jobId();
        String json = codec.encode(payload);
        try {
            ensureGroupOnce();
            String id = append(streamKey, StreamEntries.fields(jobId, json, 0, clock.instant()));
            log.info("[Upstash] XADD key={}, id={}, jobId={}", streamKey, id, jobId);
            return jobId;
        } catch (RuntimeException e) {
            throw ErrorClassifier.classify(e, QueueErrorCode.QUEUE_ENQUEUE_FAILED, jobId);
        }
    }

    @Override
    public Optional<QueuedJob> dequeue(String consumerId) {
        try {
            ensureGroupOnce();
            JsonNode result = client.execute("XREADGROUP", "GROUP", groupName, consumerId,
                    "COUNT", 1, "STREAMS", streamKey, ">");
            // [[stream_key, [[entry_id, [field, value, ...]], ...]], ...]
            if (result.isNull() || !result.isArray()) return Optional.empty();

            // claim 도 정리/DLQ 명령을 보내므로 같은 try 안에서 분류한다
            for (JsonNode stream : result) {
                if (!stream.isArray() || stream.size() < 2) continue;
                for (JsonNode entry : stream.get(1)) {
                    Optional<QueuedJob> job = claim(entry, consumerId, 1);
                    if (job.isPresent()) {
                        log.info("[Upstash] XREADGROUP key={}, jobId={}, consumer={}, attempts={}",
                                streamKey, job.get().jobId(), consumerId, job.get().attempts());
                        return job;
                    }
                }
            }
            return Optional.empty();
        } catch (RuntimeException e) {
            throw ErrorClassifier.classify(e, QueueErrorCode.QUEUE_DEQUEUE_FAILED, null);
        }
    }

    @Override
    public void ack(String jobId, String consumerId) {
        InFlight entry = inFlight.remove(jobId);
        if (entry == null) {
            log.debug("[Upstash] ack ignored (no in-flight entry) jobId={}", jobId);
            return;
        }
        warnOnMismatch("ack", jobId, entry, consumerId);
        try {
            settle(entry.entryId());
            log.info("[Upstash] ACK key={}, id={}, jobId={}", streamKey, entry.entryId(), jobId);
        } catch (RuntimeException e) {
            inFlight.putIfAbsent(jobId, entry);
            throw ErrorClassifier.classify(e, QueueErrorCode.QUEUE_ACK_FAILED, jobId);
        }
    }

    @Override
    public void nack(String jobId, String consumerId, String reason) {
        InFlight entry = inFlight.remove(jobId);
        if (entry == null) {
            log.debug("[Upstash] nack ignored (no in-flight entry) jobId={}", jobId);
            return;
        }
        warnOnMismatch("nack", jobId, entry, consumerId);
        try {
            String requeued = append(streamKey,
                    StreamEntries.fields(jobId, entry.payloadJson(), entry.attempts(), clock.instant()));
            settle(entry.entryId());
            log.info("[Upstash] NACK key={}, id={} -> {}, jobId={}, attempts={}, reason={}",
                    streamKey, entry.entryId(), requeued, jobId, entry.attempts(), reason);
        } catch (RuntimeException e) {
            inFlight.putIfAbsent(jobId, entry);
            throw ErrorClassifier.classify(e, QueueErrorCode.QUEUE_NACK_FAILED, jobId);
        }
    }

    @Override
    public long queueLength() {
        try {
            ensureGroupOnce();
            long total = client.execute("XLEN", streamKey).asLong(0);
            // XPENDING 요약: [count, min_id, max_id, [[consumer, count], ...]]
            JsonNode summary = client.execute("XPENDING", streamKey, groupName);
            long pending = summary.isArray() && summary.size() > 0 ? summary.get(0).asLong(0) : 0;
            return Math.max(0, total - pending);
        } catch (RuntimeException e) {
            throw ErrorClassifier.classify(e, QueueErrorCode.QUEUE_INTERNAL_ERROR, null);
        }
    }

    @Override
    public void deadLetter(String jobId, String consumerId, String reason) {
        InFlight entry = inFlight.remove(jobId);
        if (entry == null) {
            log.debug("[Upstash] deadLetter ignored (no in-flight entry) jobId={}", jobId);
            return;
        }
        warnOnMismatch("deadLetter", jobId, entry, consumerId);
        try {
            String dlqId = append(dlqKey, StreamEntries.deadLetterFields(
                    jobId, entry.payloadJson(), entry.attempts(), reason, clock.instant()));
            settle(entry.entryId());
            log.warn("[Upstash] DLQ key={}, id={}, jobId={}, attempts={}, reason={}",
                    dlqKey, dlqId, jobId, entry.attempts(), reason);
        } catch (RuntimeException e) {
            inFlight.putIfAbsent(jobId, entry);
            throw ErrorClassifier.classify(e, QueueErrorCode.QUEUE_NACK_FAILED, jobId);
        }
    }

    @Override
    public long deadLetterLength() {
        try {
            return client.execute("XLEN", dlqKey).asLong(0);
        } catch (RuntimeException e) {
            throw ErrorClassifier.classify(e, QueueErrorCode.QUEUE_INTERNAL_ERROR, null);
        }
    }

    @Override
    public List<QueuedJob> reclaimStale(String consumerId, Duration minIdle) {
        List<QueuedJob> reclaimed = new ArrayList<>();
        try {
            ensureGroupOnce();
            // [[entry_id, consumer, idle_ms, deliveries], ...]
            JsonNode pending = client.execute("XPENDING", streamKey, groupName, "-", "+", RECLAIM_BATCH);
            if (!pending.isArray()) return reclaimed;

            for (JsonNode pm : pending) {
                if (!pm.isArray() || pm.size() < 4) continue;
                String entryId = pm.get(0).asText();
                String owner = pm.get(1).asText();
                long idleMs = pm.get(2).asLong();
                int deliveries = pm.get(3).asInt();
                if (consumerId.equals(owner) || idleMs < minIdle.toMillis()) continue;

                JsonNode claimed = client.execute("XCLAIM", streamKey, groupName, consumerId,
                        minIdle.toMillis(), entryId);
                if (!claimed.isArray()) continue;
                for (JsonNode entry : claimed) {
                    claim(entry, consumerId, deliveries + 1).ifPresent(job -> {
                        reclaimed.add(job);
                        log.warn("[Upstash] XCLAIM key={}, id={}, jobId={}, from={}, to={}, idle={}ms",
                                streamKey, entryId, job.jobId(), owner, consumerId, idleMs);
                    });
                }
            }
            return reclaimed;
        } catch (RuntimeException e) {
            throw ErrorClassifier.classify(e, QueueErrorCode.QUEUE_DEQUEUE_FAILED, null);
        }
    }

    private Optional<QueuedJob> claim(JsonNode entry, String consumerId, int deliveries) {
        // 삭제된 엔트리는 XCLAIM 결과에서 null 로 온다
        if (entry == null || !entry.isArray() || entry.size() < 2) return Optional.empty();
        String entryId = entry.get(0).asText();
        Map<String, String> fields = toFields(entry.get(1));

        String json = fields.get(StreamEntries.PAYLOAD);
        if (json == null) {
            settle(entryId);
            log.debug("[Upstash] skip entry without payload id={}", entryId);
            return Optional.empty();
        }

        JobPayload payload;
        try {
            payload = codec.decode(json);
        } catch (QueueException e) {
            append(dlqKey, StreamEntries.deadLetterFields(fields.get(StreamEntries.JOB_ID),
                    json, deliveries, e.logContext(), clock.instant()));
            settle(entryId);
            log.warn("[Upstash] poison entry moved to DLQ id={}, {}", entryId, e.logContext());
            return Optional.empty();
        }

        int attempts = StreamEntries.priorAttempts(fields.get(StreamEntries.ATTEMPTS)) + deliveries;
        inFlight.put(payload.jobId(), new InFlight(entryId, consumerId, attempts, json));
        return Optional.of(QueuedJob.claimed(payload, attempts, clock.instant()));
    }

    private static Map<String, String> toFields(JsonNode flat) {
        Map<String, String> fields = new LinkedHashMap<>();
        if (flat == null || !flat.isArray()) return fields;
        for (int i = 0; i + 1 < flat.size(); i += 2) {
            fields.put(flat.get(i).asText(), flat.get(i + 1).asText());
        }
        return fields;
    }

    private String append(String key, Map<String, String> fields) {
        List<Object> cmd = new ArrayList<>();
        cmd.add("XADD");
        cmd.add(key);
        cmd.add("*");
        fields.forEach((k, v) -> {
            cmd.add(k);
            cmd.add(v);
        });
        return client.execute(cmd.toArray()).asText();
    }

    private void settle(String entryId) {
        client.execute("XACK", streamKey, groupName, entryId);
        client.execute("XDEL", streamKey, entryId);
    }

    private void ensureGroupOnce() {
        if (grouped) return;
        synchronized (this) {
            if (grouped) return;
            try {
                client.execute("XGROUP", "CREATE", streamKey, groupName, "0", "MKSTREAM");
                log.info("[Upstash] createGroup key={}, group={}", streamKey, groupName);
            } catch (UpstashException e) {
                if (!e.isBusyGroup()) throw e;
                log.debug("[Upstash] group already exists key={}, group={}", streamKey, groupName);
            }
            grouped = true;
        }
    }

    private static void warnOnMismatch(String op, String jobId, InFlight entry, String consumerId) {
        if (!entry.consumerId().equals(consumerId)) {
            log.warn("[Upstash] {} consumer mismatch jobId={}, owner={}, caller={}",
                    op, jobId, entry.consumerId(), consumerId);
        }
    }
}
