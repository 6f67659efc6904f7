package com.yerin.readingq.infra;

import com.yerin.readingq.domain.DedupeGate;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 프로세스 내 dedupe 키 저장소. 만료는 조회 시점에 Clock 기준으로 판단한다.
 */
@Slf4j
public class InMemoryDedupeGate implements DedupeGate {

    private final Map<String, Instant> expiries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryDedupeGate() {
        this(Clock.systemUTC());
    }

    public InMemoryDedupeGate(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean trySetKey(String key, Duration ttl) {
        DedupeGate.requireKey(key);
        DedupeGate.requireTtl(ttl);
        Instant now = clock.instant();
        Instant expiresAt = now.plus(ttl);
        boolean[] won = {false};
        // compute 는 키 단위로 원자적
        expiries.compute(key, (k, current) -> {
            if (current != null && current.isAfter(now)) return current;
            won[0] = true;
            return expiresAt;
        });
        log.debug("[InMemoryDedupe] trySetKey key={}, won={}", key, won[0]);
        return won[0];
    }

    @Override
    public boolean exists(String key) {
        DedupeGate.requireKey(key);
        return remaining(key).isPresent();
    }

    @Override
    public void deleteKey(String key) {
        DedupeGate.requireKey(key);
        expiries.remove(key);
    }

    @Override
    public Optional<Duration> ttl(String key) {
        DedupeGate.requireKey(key);
        return remaining(key);
    }

    private Optional<Duration> remaining(String key) {
        Instant expiresAt = expiries.get(key);
        if (expiresAt == null) return Optional.empty();
        Duration left = Duration.between(clock.instant(), expiresAt);
        if (left.isNegative() || left.isZero()) {
            expiries.remove(key, expiresAt);
            return Optional.empty();
        }
        return Optional.of(left);
    }
}
