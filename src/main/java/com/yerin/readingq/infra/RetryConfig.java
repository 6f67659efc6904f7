package com.yerin.readingq.infra;

import java.time.Duration;

/**
 * 재시도 설정. 유효성은 {@link RetryPolicy} 생성 시점에 검사한다.
 */
public record RetryConfig(
        int maxAttempts,
        Duration baseDelay,
        Duration maxDelay,
        double backoffMultiplier,
        boolean jitter
) {
    public static RetryConfig defaults() {
        return new RetryConfig(3, Duration.ofMillis(1000), Duration.ofMillis(30000), 2.0, true);
    }
}
