package com.yerin.readingq.infra;

import com.yerin.readingq.domain.DedupeGate;
import com.yerin.readingq.global.exception.ErrorClassifier;
import com.yerin.readingq.global.exception.code.QueueErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * SET key 1 NX PX ttl 기반 dedupe.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisDedupeGate implements DedupeGate {

    private final StringRedisTemplate redis;

    @Override
    public boolean trySetKey(String key, Duration ttl) {
        DedupeGate.requireKey(key);
        DedupeGate.requireTtl(ttl);
        try {
            Boolean ok = redis.opsForValue().setIfAbsent(key, "1", ttl);
            log.debug("[RedisDedupe] SET NX key={}, ttl={}s, won={}", key, ttl.toSeconds(), ok);
            return Boolean.TRUE.equals(ok);
        } catch (RuntimeException e) {
            throw ErrorClassifier.classify(e, QueueErrorCode.QUEUE_INTERNAL_ERROR, null);
        }
    }

    @Override
    public boolean exists(String key) {
        DedupeGate.requireKey(key);
        try {
            return Boolean.TRUE.equals(redis.hasKey(key));
        } catch (RuntimeException e) {
            throw ErrorClassifier.classify(e, QueueErrorCode.QUEUE_INTERNAL_ERROR, null);
        }
    }

    @Override
    public void deleteKey(String key) {
        DedupeGate.requireKey(key);
        try {
            redis.delete(key);
        } catch (RuntimeException e) {
            throw ErrorClassifier.classify(e, QueueErrorCode.QUEUE_INTERNAL_ERROR, null);
        }
    }

    @Override
    public Optional<Duration> ttl(String key) {
        DedupeGate.requireKey(key);
        try {
            // -2: 키 없음, -1: 만료 없음
            Long millis = redis.getExpire(key, TimeUnit.MILLISECONDS);
            return millis == null || millis <= 0 ? Optional.empty() : Optional.of(Duration.ofMillis(millis));
        } catch (RuntimeException e) {
            throw ErrorClassifier.classify(e, QueueErrorCode.QUEUE_INTERNAL_ERROR, null);
        }
    }
}
