package com.yerin.readingq.infra;

import com.yerin.readingq.domain.QueuedJob;
import lombok.Getter;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 지수 백오프 + full jitter.
 * <pre>
 * delay(a) = min(maxDelay, baseDelay * multiplier^(a-1))
 * jitter   = uniform[0, delay], 단 baseDelay/4 (최소 1ms) 아래로는 내려가지 않음
 * </pre>
 */
@Getter
public final class RetryPolicy {

    private final RetryConfig config;

    public RetryPolicy(RetryConfig config) {
        validate(config);
        this.config = config;
    }

    private static void validate(RetryConfig c) {
        if (c == null) throw new IllegalArgumentException("Invalid retry config: config is required");
        if (c.maxAttempts() <= 0) {
            throw new IllegalArgumentException("Invalid retry config: max_attempts must be > 0");
        }
        if (c.baseDelay() == null || c.baseDelay().isNegative() || c.baseDelay().isZero()) {
            throw new IllegalArgumentException("Invalid retry config: base_delay must be > 0");
        }
        if (c.maxDelay() == null || c.maxDelay().compareTo(c.baseDelay()) <= 0) {
            throw new IllegalArgumentException("Invalid retry config: max_delay must be > base_delay");
        }
        if (!(c.backoffMultiplier() > 1.0)) {
            throw new IllegalArgumentException("Invalid retry config: backoff_multiplier must be > 1.0");
        }
    }

    public boolean shouldRetry(int attempts) {
        return attempts < config.maxAttempts();
    }

    /**
     * @param attempt 1부터 시작하는 시도 번호
     */
    public Duration calculateDelay(int attempt) {
        Duration delay = exponential(attempt);
        return config.jitter() ? addJitter(delay) : delay;
    }

    /**
     * 다음 시도까지의 지연. 예산을 다 썼으면 empty 이며 호출자는 DLQ 로 보내야 한다(0 지연 재시도가 아님).
     */
    public Optional<Duration> nextAttemptDelay(QueuedJob job) {
        if (!shouldRetry(job.attempts())) return Optional.empty();
        return Optional.of(calculateDelay(job.attempts() + 1));
    }

    Duration exponential(int attempt) {
        int exponent = Math.max(0, attempt - 1);
        double millis = config.baseDelay().toMillis() * Math.pow(config.backoffMultiplier(), exponent);
        long capMillis = config.maxDelay().toMillis();
        // pow 가 Infinity 가 되어도 min 으로 cap 된다
        long capped = millis >= capMillis ? capMillis : (long) millis;
        return Duration.ofMillis(capped);
    }

    private Duration addJitter(Duration delay) {
        long upper = delay.toMillis();
        long jittered = ThreadLocalRandom.current().nextLong(upper + 1);
        long floor = Math.max(1L, config.baseDelay().toMillis() / 4);
        return Duration.ofMillis(Math.max(jittered, floor));
    }
}
