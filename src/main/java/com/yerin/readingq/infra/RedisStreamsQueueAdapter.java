package com.yerin.readingq.infra;

import com.yerin.readingq.domain.JobPayload;
import com.yerin.readingq.domain.JobQueuePort;
import com.yerin.readingq.domain.QueuedJob;
import com.yerin.readingq.global.exception.ErrorClassifier;
import com.yerin.readingq.global.exception.QueueException;
import com.yerin.readingq.global.exception.code.QueueErrorCode;
import com.yerin.readingq.infra.StreamEntries.InFlight;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.connection.stream.Consumer;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.PendingMessage;
import org.springframework.data.redis.connection.stream.PendingMessages;
import org.springframework.data.redis.connection.stream.PendingMessagesSummary;
import org.springframework.data.redis.connection.stream.ReadOffset;
import org.springframework.data.redis.connection.stream.RecordId;
import org.springframework.data.redis.connection.stream.StreamOffset;
import org.springframework.data.redis.connection.stream.StreamReadOptions;
import org.springframework.data.redis.connection.stream.StreamRecords;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StreamOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Redis Streams + consumer group 백엔드.
 * <p>
 * ack/nack 는 payload 의 job_id 가 아니라 브로커가 붙인 엔트리 id 로 XACK 해야 하므로
 * dequeue 시점에 job_id → 엔트리 id 를 {@link #inFlight} 에 기록하고 작업이 끝날 때까지 유지한다.
 * 프로세스가 죽어 이 매핑을 잃으면 엔트리는 PEL 에 남고 {@link #reclaimStale} 로 다른 컨슈머가 가져간다.
 */
@Slf4j
public class RedisStreamsQueueAdapter implements JobQueuePort {

    private static final int RECLAIM_BATCH = 100;

    private final StringRedisTemplate redis;
    private final JobPayloadCodec codec;
    private final String streamKey;
    private final String dlqKey;
    private final String groupName;
    private final Duration readBlock;
    private final Clock clock;

    private final Map<String, InFlight> inFlight = new ConcurrentHashMap<>();
    private volatile boolean grouped = false; // 그룹 준비 1회 보장

    public RedisStreamsQueueAdapter(StringRedisTemplate redis, JobPayloadCodec codec,
                                    String streamKey, String groupName, Duration readBlock) {
        this(redis, codec, streamKey, groupName, readBlock, Clock.systemUTC());
    }

    public RedisStreamsQueueAdapter(StringRedisTemplate redis, JobPayloadCodec codec,
                                    String streamKey, String groupName, Duration readBlock, Clock clock) {
        this.redis = redis;
        this.codec = codec;
        this.streamKey = streamKey;
        this.dlqKey = streamKey + StreamEntries.DLQ_SUFFIX;
        this.groupName = groupName;
        this.readBlock = readBlock;
        this.clock = clock;
    }

    private StreamOperations<String, Object, Object> ops() {
        return redis.opsForStream();
    }

    @Override
    public String enqueue(JobPayload payload) {
        String jobId = payload.jobId();
        String json = codec.encode(payload);
        try {
            ensureGroupOnce();
            RecordId rid = append(streamKey, StreamEntries.fields(jobId, json, 0, clock.instant()));
            log.info("[RedisStream] XADD key={}, id={}, jobId={}", streamKey, rid, jobId);
            return jobId;
        } catch (RuntimeException e) {
            throw ErrorClassifier.classify(e, QueueErrorCode.QUEUE_ENQUEUE_FAILED, jobId);
        }
    }

    @Override
    public Optional<QueuedJob> dequeue(String consumerId) {
        try {
            ensureGroupOnce();
            StreamReadOptions options = StreamReadOptions.empty().count(1);
            // BLOCK 0 은 무한 대기이므로 양수일 때만 건다
            if (readBlock != null && !readBlock.isZero() && !readBlock.isNegative()) {
                options = options.block(readBlock);
            }
            List<MapRecord<String, Object, Object>> records = ops().read(
                    Consumer.from(groupName, consumerId),
                    options,
                    StreamOffset.create(streamKey, ReadOffset.lastConsumed())
            );
            if (records == null || records.isEmpty()) return Optional.empty();

            // claim 도 정리/DLQ 명령을 보내므로 같은 try 안에서 분류한다
            for (MapRecord<String, Object, Object> rec : records) {
                Optional<QueuedJob> job = claim(rec, consumerId, 1);
                if (job.isPresent()) {
                    log.info("[RedisStream] XREADGROUP key={}, id={}, jobId={}, consumer={}, attempts={}",
                            streamKey, rec.getId(), job.get().jobId(), consumerId, job.get().attempts());
                    return job;
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
            log.debug("[RedisStream] ack ignored (no in-flight entry) jobId={}", jobId);
            return;
        }
        warnOnMismatch("ack", jobId, entry, consumerId);
        try {
            settle(streamKey, entry.entryId());
            log.info("[RedisStream] ACK key={}, id={}, jobId={}", streamKey, entry.entryId(), jobId);
        } catch (RuntimeException e) {
            inFlight.putIfAbsent(jobId, entry);
            throw ErrorClassifier.classify(e, QueueErrorCode.QUEUE_ACK_FAILED, jobId);
        }
    }

    @Override
    public void nack(String jobId, String consumerId, String reason) {
        InFlight entry = inFlight.remove(jobId);
        if (entry == null) {
            log.debug("[RedisStream] nack ignored (no in-flight entry) jobId={}", jobId);
            return;
        }
        warnOnMismatch("nack", jobId, entry, consumerId);
        try {
            // 새 엔트리를 먼저 넣고 기존 엔트리를 정리한다: 중간에 죽으면 유실 대신 중복
            RecordId requeued = append(streamKey,
                    StreamEntries.fields(jobId, entry.payloadJson(), entry.attempts(), clock.instant()));
            settle(streamKey, entry.entryId());
            log.info("[RedisStream] NACK key={}, id={} -> {}, jobId={}, attempts={}, reason={}",
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
            Long size = ops().size(streamKey);
            PendingMessagesSummary summary = ops().pending(streamKey, groupName);
            long total = size == null ? 0 : size;
            long pending = summary == null ? 0 : summary.getTotalPendingMessages();
            return Math.max(0, total - pending);
        } catch (RuntimeException e) {
            throw ErrorClassifier.classify(e, QueueErrorCode.QUEUE_INTERNAL_ERROR, null);
        }
    }

    @Override
    public void deadLetter(String jobId, String consumerId, String reason) {
        InFlight entry = inFlight.remove(jobId);
        if (entry == null) {
            log.debug("[RedisStream] deadLetter ignored (no in-flight entry) jobId={}", jobId);
            return;
        }
        warnOnMismatch("deadLetter", jobId, entry, consumerId);
        try {
            RecordId dlqId = append(dlqKey, StreamEntries.deadLetterFields(
                    jobId, entry.payloadJson(), entry.attempts(), reason, clock.instant()));
            settle(streamKey, entry.entryId());
            log.warn("[RedisStream] DLQ key={}, id={}, jobId={}, attempts={}, reason={}",
                    dlqKey, dlqId, jobId, entry.attempts(), reason);
        } catch (RuntimeException e) {
            inFlight.putIfAbsent(jobId, entry);
            throw ErrorClassifier.classify(e, QueueErrorCode.QUEUE_NACK_FAILED, jobId);
        }
    }

    @Override
    public long deadLetterLength() {
        try {
            Long size = ops().size(dlqKey);
            return size == null ? 0 : size;
        } catch (RuntimeException e) {
            throw ErrorClassifier.classify(e, QueueErrorCode.QUEUE_INTERNAL_ERROR, null);
        }
    }

    @Override
    public List<QueuedJob> reclaimStale(String consumerId, Duration minIdle) {
        List<QueuedJob> reclaimed = new ArrayList<>();
        try {
            ensureGroupOnce();
            PendingMessages pending = ops().pending(streamKey, groupName, Range.unbounded(), RECLAIM_BATCH);
            if (pending == null || pending.isEmpty()) return reclaimed;

            for (PendingMessage pm : pending) {
                if (consumerId.equals(pm.getConsumerName())) continue;
                if (pm.getElapsedTimeSinceLastDelivery().compareTo(minIdle) < 0) continue;

                List<MapRecord<String, Object, Object>> claimed =
                        ops().claim(streamKey, groupName, consumerId, minIdle, pm.getId());
                if (claimed == null) continue;
                for (MapRecord<String, Object, Object> rec : claimed) {
                    // XCLAIM 이 전달 횟수를 1 늘린다
                    int deliveries = (int) pm.getTotalDeliveryCount() + 1;
                    claim(rec, consumerId, deliveries).ifPresent(job -> {
                        reclaimed.add(job);
                        log.warn("[RedisStream] XCLAIM key={}, id={}, jobId={}, from={}, to={}, idle={}ms",
                                streamKey, rec.getId(), job.jobId(), pm.getConsumerName(), consumerId,
                                pm.getElapsedTimeSinceLastDelivery().toMillis());
                    });
                }
            }
            return reclaimed;
        } catch (RuntimeException e) {
            throw ErrorClassifier.classify(e, QueueErrorCode.QUEUE_DEQUEUE_FAILED, null);
        }
    }

    /**
     * 엔트리를 QueuedJob 으로 바꾸고 in-flight 매핑을 기록한다.
     * payload 가 없거나(부트스트랩/잘못된 엔트리) 파싱되지 않으면 DLQ 로 옮기고 empty.
     */
    private Optional<QueuedJob> claim(MapRecord<String, Object, Object> rec, String consumerId, int deliveries) {
        Map<Object, Object> value = rec.getValue();
        Object rawPayload = value.get(StreamEntries.PAYLOAD);
        String entryId = rec.getId().getValue();

        if (rawPayload == null) {
            settle(streamKey, entryId);
            log.debug("[RedisStream] skip entry without payload id={}", entryId);
            return Optional.empty();
        }

        String json = String.valueOf(rawPayload);
        JobPayload payload;
        try {
            payload = codec.decode(json);
        } catch (QueueException e) {
            Object rawJobId = value.get(StreamEntries.JOB_ID);
            append(dlqKey, StreamEntries.deadLetterFields(rawJobId == null ? null : String.valueOf(rawJobId),
                    json, deliveries, e.logContext(), clock.instant()));
            settle(streamKey, entryId);
            log.warn("[RedisStream] poison entry moved to DLQ id={}, {}", entryId, e.logContext());
            return Optional.empty();
        }

        int attempts = StreamEntries.priorAttempts(value.get(StreamEntries.ATTEMPTS)) + deliveries;
        InFlight previous = inFlight.put(payload.jobId(), new InFlight(entryId, consumerId, attempts, json));
        if (previous != null && !previous.entryId().equals(entryId)) {
            log.warn("[RedisStream] jobId={} already in flight as id={}, now tracking id={}",
                    payload.jobId(), previous.entryId(), entryId);
        }
        return Optional.of(QueuedJob.claimed(payload, attempts, clock.instant()));
    }

    private RecordId append(String key, Map<String, String> fields) {
        return ops().add(StreamRecords.mapBacked(fields).withStreamKey(key));
    }

    private void settle(String key, String entryId) {
        RecordId id = RecordId.of(entryId);
        ops().acknowledge(key, groupName, id);
        ops().delete(key, id);
    }

    private void ensureGroupOnce() {
        if (grouped) return;
        synchronized (this) {
            if (grouped) return;
            try {
                byte[] rawKey = streamKey.getBytes(StandardCharsets.UTF_8);
                redis.execute((RedisCallback<String>) connection -> connection.streamCommands()
                        .xGroupCreate(rawKey, groupName, ReadOffset.from("0"), true));
                log.info("[RedisStream] createGroup key={}, group={}", streamKey, groupName);
            } catch (RuntimeException e) {
                if (!isBusyGroup(e)) throw e;
                log.debug("[RedisStream] group already exists key={}, group={}", streamKey, groupName);
            }
            grouped = true;
        }
    }

    static boolean isBusyGroup(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            String msg = t.getMessage();
            if (msg != null && (msg.contains("BUSYGROUP") || msg.contains("already exists"))) return true;
        }
        return false;
    }

    private static void warnOnMismatch(String op, String jobId, InFlight entry, String consumerId) {
        if (!entry.consumerId().equals(consumerId)) {
            log.warn("[RedisStream] {} consumer mismatch jobId={}, owner={}, caller={}",
                    op, jobId, entry.consumerId(), consumerId);
        }
    }
}
