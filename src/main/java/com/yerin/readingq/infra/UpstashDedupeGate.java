package com.yerin.readingq.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.yerin.readingq.domain.DedupeGate;
import com.yerin.readingq.global.exception.ErrorClassifier;
import com.yerin.readingq.global.exception.code.QueueErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;

@Slf4j
@RequiredArgsConstructor
public class UpstashDedupeGate implements DedupeGate {

    private final UpstashCommandClient client;

    @Override
    public boolean trySetKey(String key, Duration ttl) {
        DedupeGate.requireKey(key);
        DedupeGate.requireTtl(ttl);
        try {
            // 선점 성공 시 "OK", 이미 있으면 null
            JsonNode result = client.execute("SET", key, "1", "NX", "PX", ttl.toMillis());
            boolean won = !result.isNull();
            log.debug("[UpstashDedupe] SET NX key={}, ttl={}s, won={}", key, ttl.toSeconds(), won);
            return won;
        } catch (RuntimeException e) {
            throw ErrorClassifier.classify(e, QueueErrorCode.QUEUE_INTERNAL_ERROR, null);
        }
    }

    @Override
    public boolean exists(String key) {
        DedupeGate.requireKey(key);
        try {
            return client.execute("EXISTS", key).asLong(0) > 0;
        } catch (RuntimeException e) {
            throw ErrorClassifier.classify(e, QueueErrorCode.QUEUE_INTERNAL_ERROR, null);
        }
    }

    @Override
    public void deleteKey(String key) {
        DedupeGate.requireKey(key);
        try {
            client.execute("DEL", key);
        } catch (RuntimeException e) {
            throw ErrorClassifier.classify(e, QueueErrorCode.QUEUE_INTERNAL_ERROR, null);
        }
    }

    @Override
    public Optional<Duration> ttl(String key) {
        DedupeGate.requireKey(key);
        try {
            long millis = client.execute("PTTL", key).asLong(-2);
            return millis <= 0 ? Optional.empty() : Optional.of(Duration.ofMillis(millis));
        } catch (RuntimeException e) {
            throw ErrorClassifier.classify(e, QueueErrorCode.QUEUE_INTERNAL_ERROR, null);
        }
    }
}
