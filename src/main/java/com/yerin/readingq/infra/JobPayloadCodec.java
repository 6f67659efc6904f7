package com.yerin.readingq.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.yerin.readingq.domain.JobPayload;
import com.yerin.readingq.global.exception.QueueException;

/**
 * 스트림 엔트리의 payload 필드(JSON) 인코딩. created_at 은 RFC 3339 문자열로 쓴다.
 */
public class JobPayloadCodec {

    private final ObjectMapper om;

    public JobPayloadCodec() {
        this(new ObjectMapper());
    }

    public JobPayloadCodec(ObjectMapper base) {
        this.om = base.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String encode(JobPayload payload) {
        try {
            return om.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw QueueException.invalidPayload("payload serialization failed: " + e.getOriginalMessage());
        }
    }

    public JobPayload decode(String json) {
        try {
            return om.readValue(json, JobPayload.class);
        } catch (JsonProcessingException | RuntimeException e) {
            throw QueueException.invalidPayload("payload parse error: " + e.getMessage());
        }
    }
}
