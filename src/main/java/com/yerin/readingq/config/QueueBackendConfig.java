package com.yerin.readingq.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.readingq.domain.DedupeGate;
import com.yerin.readingq.domain.JobQueuePort;
import com.yerin.readingq.infra.InMemoryDedupeGate;
import com.yerin.readingq.infra.InMemoryQueueAdapter;
import com.yerin.readingq.infra.JobPayloadCodec;
import com.yerin.readingq.infra.RedisDedupeGate;
import com.yerin.readingq.infra.RedisStreamsQueueAdapter;
import com.yerin.readingq.infra.RetryConfig;
import com.yerin.readingq.infra.RetryPolicy;
import com.yerin.readingq.infra.UpstashCommandClient;
import com.yerin.readingq.infra.UpstashDedupeGate;
import com.yerin.readingq.infra.UpstashQueueAdapter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

/**
 * readingq.queue.backend 값(inmemory | redis | upstash)에 따라 큐와 dedupe 구현을 고른다.
 */
@Slf4j
@Configuration
public class QueueBackendConfig {

    static final String BACKEND = "readingq.queue.backend";

    @Bean
    public JobPayloadCodec jobPayloadCodec(ObjectMapper objectMapper) {
        return new JobPayloadCodec(objectMapper);
    }

    @Bean
    public RetryPolicy retryPolicy(
            @Value("${readingq.retry.max-attempts:3}") int maxAttempts,
            @Value("${readingq.retry.base-delay-ms:1000}") long baseDelayMs,
            @Value("${readingq.retry.max-delay-ms:30000}") long maxDelayMs,
            @Value("${readingq.retry.backoff-multiplier:2.0}") double multiplier,
            @Value("${readingq.retry.jitter:true}") boolean jitter) {
        return new RetryPolicy(new RetryConfig(maxAttempts, Duration.ofMillis(baseDelayMs),
                Duration.ofMillis(maxDelayMs), multiplier, jitter));
    }

    @Configuration
    @ConditionalOnProperty(name = BACKEND, havingValue = "inmemory", matchIfMissing = true)
    static class InMemoryBackend {

        @Bean
        public JobQueuePort jobQueuePort() {
            log.info("[QueueBackend] using in-memory queue");
            return new InMemoryQueueAdapter();
        }

        @Bean
        public DedupeGate dedupeGate() {
            return new InMemoryDedupeGate();
        }
    }

    @Configuration
    @ConditionalOnProperty(name = BACKEND, havingValue = "redis")
    static class RedisBackend {

        @Bean
        public JobQueuePort jobQueuePort(StringRedisTemplate redis, JobPayloadCodec codec,
                                         @Value("${readingq.redis.stream-key:tarot:jobs}") String streamKey,
                                         @Value("${readingq.redis.consumer-group:tarot-workers}") String group,
                                         @Value("${readingq.redis.block-millis:2000}") long blockMillis) {
            log.info("[QueueBackend] using redis streams key={}, group={}", streamKey, group);
            return new RedisStreamsQueueAdapter(redis, codec, streamKey, group, Duration.ofMillis(blockMillis));
        }

        @Bean
        public DedupeGate dedupeGate(StringRedisTemplate redis) {
            return new RedisDedupeGate(redis);
        }
    }

    @Configuration
    @ConditionalOnProperty(name = BACKEND, havingValue = "upstash")
    static class UpstashBackend {

        @Bean
        public UpstashCommandClient upstashCommandClient(
                RestTemplateBuilder builder, ObjectMapper objectMapper,
                @Value("${readingq.upstash.url:}") String url,
                @Value("${readingq.upstash.token:}") String token,
                @Value("${readingq.upstash.timeout-seconds:30}") long timeoutSeconds) {
            if (url.isBlank()) throw new IllegalStateException("UPSTASH_REDIS_URL not set");
            if (token.isBlank()) throw new IllegalStateException("UPSTASH_REDIS_TOKEN not set");
            var rest = builder
                    .setConnectTimeout(Duration.ofSeconds(timeoutSeconds))
                    .setReadTimeout(Duration.ofSeconds(timeoutSeconds))
                    .build();
            return new UpstashCommandClient(rest, url, token, objectMapper);
        }

        @Bean
        public JobQueuePort jobQueuePort(UpstashCommandClient client, JobPayloadCodec codec,
                                         @Value("${readingq.redis.stream-key:tarot:jobs}") String streamKey,
                                         @Value("${readingq.redis.consumer-group:tarot-workers}") String group) {
            log.info("[QueueBackend] using upstash streams key={}, group={}", streamKey, group);
            return new UpstashQueueAdapter(client, codec, streamKey, group);
        }

        @Bean
        public DedupeGate dedupeGate(UpstashCommandClient client) {
            return new UpstashDedupeGate(client);
        }
    }
}
