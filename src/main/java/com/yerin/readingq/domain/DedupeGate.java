package com.yerin.readingq.domain;

import com.yerin.readingq.global.exception.QueueException;

import java.time.Duration;
import java.util.Optional;

/**
 * 중복 제출 차단용 원자적 set-if-absent-with-expiry.
 * <p>
 * {@link #exists(String)} 다음에 {@link #trySetKey(String, Duration)} 를 호출하는 방식은 경쟁 조건이 있으므로
 * 중복 판단은 항상 trySetKey 결과로만 한다.
 */
public interface DedupeGate {

    /**
     * @return 키가 없어서 이번 호출이 선점했으면 true, TTL 안에 이미 누가 잡고 있으면 false
     */
    boolean trySetKey(String key, Duration ttl);

    boolean exists(String key);

    void deleteKey(String key);

    /** 남은 TTL. 키가 없거나 만료가 설정되지 않았으면 empty */
    Optional<Duration> ttl(String key);

    /** 빈 키는 백엔드 호출 전에 거절한다 */
    static String requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw QueueException.invalidPayload("Dedupe key cannot be empty or whitespace");
        }
        return key;
    }

    /** null 이거나 0 이하인 TTL 은 백엔드 호출 전에 거절한다 */
    static Duration requireTtl(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw QueueException.invalidPayload("Dedupe TTL must be positive: " + ttl);
        }
        return ttl;
    }
}
