package com.yerin.readingq.infra;

import com.yerin.readingq.global.exception.QueueException;
import com.yerin.readingq.global.exception.code.QueueErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

@DisplayName("InMemoryDedupeGate 테스트")
public class InMemoryDedupeGateTest {

    /** 테스트에서 앞으로 감을 수 있는 시계 */
    static final class MutableClock extends Clock {
        private Instant now = Instant.parse("2025-11-20T00:00:00Z");

        void advance(Duration d) { now = now.plus(d); }

        @Override public ZoneId getZone() { return ZoneOffset.UTC; }
        @Override public Clock withZone(ZoneId zone) { return this; }
        @Override public Instant instant() { return now; }
    }

    MutableClock clock = new MutableClock();
    InMemoryDedupeGate sut = new InMemoryDedupeGate(clock);

    @Test
    @DisplayName("TTL 안에서는 한 번만 선점된다")
    void first_caller_wins() {
        assertThat(sut.trySetKey("user-1:love", Duration.ofMinutes(5))).isTrue();
        assertThat(sut.trySetKey("user-1:love", Duration.ofMinutes(5))).isFalse();
        assertThat(sut.exists("user-1:love")).isTrue();
        assertThat(sut.ttl("user-1:love")).contains(Duration.ofMinutes(5));
    }

    @Test
    @DisplayName("TTL 이 지나면 다시 선점할 수 있다")
    void expires_after_ttl() {
        sut.trySetKey("k", Duration.ofSeconds(10));

        clock.advance(Duration.ofSeconds(4));
        assertThat(sut.ttl("k")).contains(Duration.ofSeconds(6));

        clock.advance(Duration.ofSeconds(6));
        assertThat(sut.exists("k")).isFalse();
        assertThat(sut.ttl("k")).isEmpty();
        assertThat(sut.trySetKey("k", Duration.ofSeconds(10))).isTrue();
    }

    @Test
    @DisplayName("deleteKey 후에는 다시 선점 가능")
    void delete_releases_key() {
        sut.trySetKey("k", Duration.ofMinutes(1));
        sut.deleteKey("k");

        assertThat(sut.exists("k")).isFalse();
        assertThat(sut.trySetKey("k", Duration.ofMinutes(1))).isTrue();
    }

    @Test
    @DisplayName("빈 키/공백 키는 QUEUE_INVALID_PAYLOAD")
    void rejects_blank_key() {
        assertThatThrownBy(() -> sut.trySetKey("  ", Duration.ofMinutes(1)))
                .isInstanceOfSatisfying(QueueException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(QueueErrorCode.QUEUE_INVALID_PAYLOAD));
        assertThatThrownBy(() -> sut.exists("")).isInstanceOf(QueueException.class);
        assertThatThrownBy(() -> sut.deleteKey(null)).isInstanceOf(QueueException.class);
    }

    @Test
    @DisplayName("null/0/음수 TTL 은 QUEUE_INVALID_PAYLOAD 이고 키를 잡지 않는다")
    void rejects_non_positive_ttl() {
        assertThatThrownBy(() -> sut.trySetKey("k", Duration.ZERO))
                .isInstanceOfSatisfying(QueueException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(QueueErrorCode.QUEUE_INVALID_PAYLOAD));
        assertThatThrownBy(() -> sut.trySetKey("k", Duration.ofSeconds(-5))).isInstanceOf(QueueException.class);
        assertThatThrownBy(() -> sut.trySetKey("k", null)).isInstanceOf(QueueException.class);

        assertThat(sut.exists("k")).isFalse();
    }

    @Test
    @DisplayName("동시에 여러 스레드가 같은 키를 잡아도 승자는 하나")
    void single_winner_under_contention() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();
        for (int i = 0; i < threads; i++) {
            pool.submit(() -> {
                start.await();
                if (sut.trySetKey("hot", Duration.ofMinutes(1))) winners.incrementAndGet();
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        assertThat(winners.get()).isEqualTo(1);
    }
}
