package com.yerin.readingq.infra;

import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.yerin.readingq.global.exception.QueueException;
import com.yerin.readingq.global.exception.code.QueueErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("Redis/Upstash DedupeGate 단위 테스트")
public class DedupeGateMockTest {

    @Nested
    @DisplayName("RedisDedupeGate")
    class Redis {
        StringRedisTemplate redis = mock(StringRedisTemplate.class);
        @SuppressWarnings("unchecked")
        ValueOperations<String, String> values = mock(ValueOperations.class);
        RedisDedupeGate sut = new RedisDedupeGate(redis);

        @Test
        @DisplayName("setIfAbsent 결과로 선점 여부를 판단")
        void set_if_absent() {
            when(redis.opsForValue()).thenReturn(values);
            when(values.setIfAbsent("k", "1", Duration.ofSeconds(300))).thenReturn(true, false);

            assertThat(sut.trySetKey("k", Duration.ofSeconds(300))).isTrue();
            assertThat(sut.trySetKey("k", Duration.ofSeconds(300))).isFalse();
        }

        @Test
        @DisplayName("TTL -2/-1 은 empty")
        void ttl_sentinels() {
            when(redis.getExpire("gone", TimeUnit.MILLISECONDS)).thenReturn(-2L);
            when(redis.getExpire("forever", TimeUnit.MILLISECONDS)).thenReturn(-1L);
            when(redis.getExpire("live", TimeUnit.MILLISECONDS)).thenReturn(1500L);

            assertThat(sut.ttl("gone")).isEmpty();
            assertThat(sut.ttl("forever")).isEmpty();
            assertThat(sut.ttl("live")).contains(Duration.ofMillis(1500));
        }

        @Test
        @DisplayName("빈 키는 Redis 를 호출하지 않고 거절")
        void blank_key_rejected_locally() {
            assertThatThrownBy(() -> sut.trySetKey(" ", Duration.ofSeconds(1))).isInstanceOf(QueueException.class);
            assertThatThrownBy(() -> sut.exists("")).isInstanceOf(QueueException.class);
            verifyNoInteractions(redis);
        }

        @Test
        @DisplayName("0 이하 TTL 은 Redis 를 호출하지 않고 거절")
        void non_positive_ttl_rejected_locally() {
            assertThatThrownBy(() -> sut.trySetKey("k", Duration.ZERO))
                    .isInstanceOfSatisfying(QueueException.class,
                            e -> assertThat(e.getErrorCode()).isEqualTo(QueueErrorCode.QUEUE_INVALID_PAYLOAD));
            assertThatThrownBy(() -> sut.trySetKey("k", null)).isInstanceOf(QueueException.class);
            verifyNoInteractions(redis);
        }

        @Test
        @DisplayName("연결 실패는 QueueException 으로 분류")
        void connection_failure() {
            when(redis.hasKey(anyString())).thenThrow(new RedisConnectionFailureException("refused"));

            assertThatThrownBy(() -> sut.exists("k"))
                    .isInstanceOfSatisfying(QueueException.class,
                            e -> assertThat(e.getErrorCode()).isEqualTo(QueueErrorCode.QUEUE_CONNECTION_FAILED));
        }
    }

    @Nested
    @DisplayName("UpstashDedupeGate")
    class Upstash {
        UpstashCommandClient client = mock(UpstashCommandClient.class);
        UpstashDedupeGate sut = new UpstashDedupeGate(client);

        @Test
        @DisplayName("SET NX PX 가 OK 면 선점, null 이면 이미 존재")
        void set_nx_px() {
            when(client.execute("SET", "k", "1", "NX", "PX", 300000L))
                    .thenReturn(TextNode.valueOf("OK"), NullNode.getInstance());

            assertThat(sut.trySetKey("k", Duration.ofMinutes(5))).isTrue();
            assertThat(sut.trySetKey("k", Duration.ofMinutes(5))).isFalse();
        }

        @Test
        @DisplayName("음수 TTL 은 SET 을 보내지 않고 거절")
        void negative_ttl_rejected_locally() {
            assertThatThrownBy(() -> sut.trySetKey("k", Duration.ofMillis(-1)))
                    .isInstanceOfSatisfying(QueueException.class,
                            e -> assertThat(e.getErrorCode()).isEqualTo(QueueErrorCode.QUEUE_INVALID_PAYLOAD));
            verifyNoInteractions(client);
        }

        @Test
        @DisplayName("EXISTS/PTTL 응답 해석")
        void exists_and_ttl() {
            when(client.execute("EXISTS", "k")).thenReturn(LongNode.valueOf(1));
            when(client.execute("PTTL", "k")).thenReturn(LongNode.valueOf(2500));
            when(client.execute("PTTL", "gone")).thenReturn(LongNode.valueOf(-2));

            assertThat(sut.exists("k")).isTrue();
            assertThat(sut.ttl("k")).contains(Duration.ofMillis(2500));
            assertThat(sut.ttl("gone")).isEmpty();
        }

        @Test
        @DisplayName("전송 오류는 분류된 QueueException")
        void transport_error() {
            when(client.execute(any(Object[].class)))
                    .thenThrow(new UpstashException(UpstashException.Kind.TIMEOUT, "Request timed out", null));

            assertThatThrownBy(() -> sut.deleteKey("k"))
                    .isInstanceOfSatisfying(QueueException.class,
                            e -> assertThat(e.getErrorCode()).isEqualTo(QueueErrorCode.QUEUE_TIMEOUT_ERROR));
        }
    }
}
