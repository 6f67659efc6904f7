package com.yerin.readingq.infra;

import java.time.Duration;

/**
 * @param concurrency     컨슈머 루프 수
 * @param jobTimeout      핸들러 1회 실행 한도, 0 이면 제한 없음
 * @param idleSleep       빈 dequeue 후 쉬는 시간(BLOCK 을 못 쓰는 백엔드용)
 * @param reclaimInterval 오래 점유된 작업 회수 주기, 0 이면 회수하지 않음
 * @param reclaimMinIdle  이 시간 이상 ack 되지 않은 작업만 회수. 핸들러 한도 + 최대 재시도 대기보다 길어야 한다
 */
public record WorkerSettings(
        int concurrency,
        Duration jobTimeout,
        Duration idleSleep,
        Duration reclaimInterval,
        Duration reclaimMinIdle
) {
    public WorkerSettings {
        if (concurrency <= 0) throw new IllegalArgumentException("worker concurrency must be > 0");
    }

    public boolean reclaimEnabled() {
        return reclaimInterval != null && !reclaimInterval.isZero() && !reclaimInterval.isNegative();
    }

    public boolean timeoutEnabled() {
        return jobTimeout != null && !jobTimeout.isZero() && !jobTimeout.isNegative();
    }

    /**
     * 정상 처리 중인 작업은 핸들러 실행과 재시도 대기 동안 PEL 에서 유휴 상태로 보인다.
     * 회수 기준이 그보다 짧으면 살아 있는 작업을 다른 컨슈머가 XCLAIM 해 두 번 처리한다.
     *
     * @throws IllegalArgumentException 회수가 켜져 있는데 기준이 안전하지 않을 때
     */
    public WorkerSettings requireSafeReclaim(Duration retryMaxDelay) {
        if (!reclaimEnabled()) return this;
        if (!timeoutEnabled()) {
            throw new IllegalArgumentException("stale job reclaim requires a positive job timeout");
        }
        Duration longestHold = jobTimeout.plus(retryMaxDelay == null ? Duration.ZERO : retryMaxDelay);
        if (reclaimMinIdle == null || reclaimMinIdle.compareTo(longestHold) <= 0) {
            throw new IllegalArgumentException("reclaim min idle " + reclaimMinIdle
                    + " must exceed job timeout + retry max delay (" + longestHold + ")");
        }
        return this;
    }
}
