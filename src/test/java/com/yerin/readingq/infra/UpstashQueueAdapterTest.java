package com.yerin.readingq.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.readingq.domain.JobPayload;
import com.yerin.readingq.domain.QueuedJob;
import com.yerin.readingq.global.exception.QueueException;
import com.yerin.readingq.global.exception.code.QueueErrorCode;
import com.yerin.readingq.support.Payloads;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.test.web.client.ResponseActions;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

@DisplayName("UpstashQueueAdapter 테스트 (MockRestServiceServer)")
public class UpstashQueueAdapterTest {

    static final String URL = "https://upstash.test";
    static final String KEY = "tarot:jobs";
    static final String GROUP = "tarot-workers";

    ObjectMapper om = new ObjectMapper();
    JobPayloadCodec codec = new JobPayloadCodec();
    RestTemplate rest = new RestTemplate();
    MockRestServiceServer server;
    UpstashQueueAdapter sut;

    @BeforeEach
    void setUp() {
        server = MockRestServiceServer.bindTo(rest).build();
        UpstashCommandClient client = new UpstashCommandClient(rest, URL, "secret-token", om);
        sut = new UpstashQueueAdapter(client, codec, KEY, GROUP);
    }

    private ResponseActions expectCommand(String command) {
        return server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer secret-token"))
                .andExpect(jsonPath("$[0]").value(command));
    }

    private void expectGroupCreated() {
        expectCommand("XGROUP")
                .andExpect(content().json("[\"XGROUP\",\"CREATE\",\"tarot:jobs\",\"tarot-workers\",\"0\",\"MKSTREAM\"]"))
                .andRespond(withSuccess("{\"result\":\"OK\"}", MediaType.APPLICATION_JSON));
    }

    private String result(Object value) throws Exception {
        return om.writeValueAsString(Map.of("result", value));
    }

    private String readReply(String entryId, JobPayload p, int priorAttempts) throws Exception {
        List<Object> fields = List.of("job_id", p.jobId(), "payload", codec.encode(p),
                "attempts", String.valueOf(priorAttempts));
        return result(List.of(List.of(KEY, List.of(List.of(entryId, fields)))));
    }

    @Test
    @DisplayName("enqueue 는 Bearer 토큰으로 XADD 명령 배열을 POST 한다")
    void enqueue_posts_xadd() {
        JobPayload p = Payloads.reading("Will I find love?");
        expectGroupCreated();
        expectCommand("XADD")
                .andExpect(jsonPath("$[1]").value(KEY))
                .andExpect(jsonPath("$[2]").value("*"))
                .andExpect(jsonPath("$[3]").value("job_id"))
                .andExpect(jsonPath("$[4]").value(p.jobId()))
                .andExpect(jsonPath("$[5]").value("payload"))
                .andRespond(withSuccess("{\"result\":\"1700000000000-0\"}", MediaType.APPLICATION_JSON));

        assertThat(sut.enqueue(p)).isEqualTo(p.jobId());
        server.verify();
    }

    @Test
    @DisplayName("XREADGROUP 중첩 응답을 파싱하고 ack 는 엔트리 id 로 XACK + XDEL")
    void dequeue_parses_nested_reply_and_acks_by_entry_id() throws Exception {
        JobPayload p = Payloads.reading("Career?");
        expectGroupCreated();
        expectCommand("XREADGROUP")
                .andExpect(content().json("[\"XREADGROUP\",\"GROUP\",\"tarot-workers\",\"c1\",\"COUNT\",\"1\",\"STREAMS\",\"tarot:jobs\",\">\"]"))
                .andRespond(withSuccess(readReply("1700000000000-0", p, 0), MediaType.APPLICATION_JSON));
        expectCommand("XACK")
                .andExpect(jsonPath("$[3]").value("1700000000000-0"))
                .andRespond(withSuccess("{\"result\":1}", MediaType.APPLICATION_JSON));
        expectCommand("XDEL")
                .andExpect(jsonPath("$[2]").value("1700000000000-0"))
                .andRespond(withSuccess("{\"result\":1}", MediaType.APPLICATION_JSON));

        QueuedJob job = sut.dequeue("c1").orElseThrow();
        sut.ack(job.jobId(), "c1");

        assertThat(job.payload()).isEqualTo(p);
        assertThat(job.attempts()).isEqualTo(1);
        server.verify();
    }

    @Test
    @DisplayName("result 가 null 이면 빈 큐")
    void null_result_is_empty() {
        expectGroupCreated();
        expectCommand("XREADGROUP").andRespond(withSuccess("{\"result\":null}", MediaType.APPLICATION_JSON));

        assertThat(sut.dequeue("c1")).isEmpty();
    }

    @Test
    @DisplayName("nack 는 attempts 를 이월해 XADD 후 기존 엔트리를 XACK + XDEL")
    void nack_reappends() throws Exception {
        JobPayload p = Payloads.reading("q");
        expectGroupCreated();
        expectCommand("XREADGROUP").andRespond(withSuccess(readReply("5-0", p, 1), MediaType.APPLICATION_JSON));
        expectCommand("XADD")
                .andExpect(jsonPath("$[7]").value("attempts"))
                .andExpect(jsonPath("$[8]").value("2"))
                .andRespond(withSuccess("{\"result\":\"6-0\"}", MediaType.APPLICATION_JSON));
        expectCommand("XACK").andRespond(withSuccess("{\"result\":1}", MediaType.APPLICATION_JSON));
        expectCommand("XDEL").andRespond(withSuccess("{\"result\":1}", MediaType.APPLICATION_JSON));

        QueuedJob job = sut.dequeue("c1").orElseThrow();
        sut.nack(job.jobId(), "c1", "LLM timeout");

        assertThat(job.attempts()).isEqualTo(2);
        server.verify();
    }

    @Test
    @DisplayName("queueLength 는 XLEN - XPENDING count")
    void queue_length() {
        expectGroupCreated();
        expectCommand("XLEN").andRespond(withSuccess("{\"result\":7}", MediaType.APPLICATION_JSON));
        expectCommand("XPENDING").andRespond(withSuccess(
                "{\"result\":[2,\"1-0\",\"2-0\",[[\"c1\",\"2\"]]]}", MediaType.APPLICATION_JSON));

        assertThat(sut.queueLength()).isEqualTo(5);
    }

    @Test
    @DisplayName("XPENDING + XCLAIM 으로 오래된 작업을 회수한다")
    void reclaim_stale() throws Exception {
        JobPayload p = Payloads.reading("q");
        expectGroupCreated();
        expectCommand("XPENDING").andRespond(withSuccess(
                result(List.of(List.of("9-0", "crashed", 120000, 1), List.of("9-1", "c2", 10, 1))),
                MediaType.APPLICATION_JSON));
        expectCommand("XCLAIM")
                .andExpect(jsonPath("$[3]").value("c2"))
                .andExpect(jsonPath("$[4]").value("60000"))
                .andExpect(jsonPath("$[5]").value("9-0"))
                .andRespond(withSuccess(result(List.of(List.of("9-0",
                        List.of("job_id", p.jobId(), "payload", codec.encode(p), "attempts", "0")))),
                        MediaType.APPLICATION_JSON));

        List<QueuedJob> reclaimed = sut.reclaimStale("c2", Duration.ofMinutes(1));

        assertThat(reclaimed).extracting(QueuedJob::jobId).containsExactly(p.jobId());
        assertThat(reclaimed.get(0).attempts()).isEqualTo(2);
        server.verify();
    }

    @Test
    @DisplayName("이미 있는 그룹(BUSYGROUP)은 200/400 어느 쪽으로 와도 성공으로 본다")
    void busy_group_is_tolerated() {
        expectCommand("XGROUP").andRespond(withStatus(HttpStatus.BAD_REQUEST)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"error\":\"BUSYGROUP Consumer Group name already exists\"}"));
        expectCommand("XADD").andRespond(withSuccess("{\"result\":\"1-0\"}", MediaType.APPLICATION_JSON));

        sut.enqueue(Payloads.reading("q"));
        server.verify();

        server.reset();
        UpstashQueueAdapter other = new UpstashQueueAdapter(
                new UpstashCommandClient(rest, URL, "secret-token", om), codec, KEY, GROUP);
        expectCommand("XGROUP").andRespond(withSuccess(
                "{\"error\":\"BUSYGROUP Consumer Group name already exists\"}", MediaType.APPLICATION_JSON));
        expectCommand("XADD").andRespond(withSuccess("{\"result\":\"2-0\"}", MediaType.APPLICATION_JSON));

        other.enqueue(Payloads.reading("q2"));
        server.verify();
    }

    @Test
    @DisplayName("5xx 는 전송 오류(QUEUE_NETWORK_ERROR)")
    void server_error_is_transport_error() {
        expectCommand("XGROUP").andRespond(withServerError());

        assertThatThrownBy(() -> sut.enqueue(Payloads.reading("q")))
                .isInstanceOfSatisfying(QueueException.class, e -> {
                    assertThat(e.getErrorCode()).isEqualTo(QueueErrorCode.QUEUE_NETWORK_ERROR);
                    assertThat(e.getCause()).isInstanceOfSatisfying(UpstashException.class, ue -> {
                        assertThat(ue.getKind()).isEqualTo(UpstashException.Kind.HTTP_STATUS);
                        assertThat(ue.getHttpStatus()).isEqualTo(500);
                        assertThat(ue.isTransportError()).isTrue();
                    });
                });
    }

    @Test
    @DisplayName("429 는 QUEUE_QUEUE_FULL")
    void too_many_requests_is_queue_full() {
        expectCommand("XGROUP").andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertThatThrownBy(() -> sut.enqueue(Payloads.reading("q")))
                .isInstanceOfSatisfying(QueueException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(QueueErrorCode.QUEUE_QUEUE_FULL));
    }

    @Test
    @DisplayName("읽기 타임아웃은 QUEUE_TIMEOUT_ERROR")
    void timeout_is_timeout_error() {
        expectCommand("XGROUP").andRespond(withException(new SocketTimeoutException("Read timed out")));

        assertThatThrownBy(() -> sut.enqueue(Payloads.reading("q")))
                .isInstanceOfSatisfying(QueueException.class, e -> {
                    assertThat(e.getErrorCode()).isEqualTo(QueueErrorCode.QUEUE_TIMEOUT_ERROR);
                    assertThat(((UpstashException) e.getCause()).getKind()).isEqualTo(UpstashException.Kind.TIMEOUT);
                });
    }

    @Test
    @DisplayName("JSON 이 아닌 응답은 MALFORMED_RESPONSE 이고 작업별 코드로 떨어진다")
    void malformed_body() {
        expectGroupCreated();
        expectCommand("XADD").andRespond(withSuccess("<html>bad gateway</html>", MediaType.TEXT_HTML));

        assertThatThrownBy(() -> sut.enqueue(Payloads.reading("q")))
                .isInstanceOfSatisfying(QueueException.class, e -> {
                    assertThat(e.getErrorCode()).isEqualTo(QueueErrorCode.QUEUE_ENQUEUE_FAILED);
                    assertThat(((UpstashException) e.getCause()).getKind())
                            .isEqualTo(UpstashException.Kind.MALFORMED_RESPONSE);
                });
    }

    @Test
    @DisplayName("브로커 오류(error 필드)는 전송 오류와 구분된다")
    void broker_error_is_not_transport_error() {
        expectGroupCreated();
        expectCommand("XADD").andRespond(withSuccess(
                "{\"error\":\"ERR wrong number of arguments for 'xadd' command\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> sut.enqueue(Payloads.reading("q")))
                .isInstanceOfSatisfying(QueueException.class, e -> {
                    assertThat(e.getErrorCode()).isEqualTo(QueueErrorCode.QUEUE_ENQUEUE_FAILED);
                    UpstashException cause = (UpstashException) e.getCause();
                    assertThat(cause.getKind()).isEqualTo(UpstashException.Kind.BROKER);
                    assertThat(cause.isTransportError()).isFalse();
                });
    }

    @Test
    @DisplayName("payload 없는 엔트리 정리 중 실패도 QueueException 으로 감싼다")
    void cleanup_failure_during_dequeue_is_classified() throws Exception {
        expectGroupCreated();
        expectCommand("XREADGROUP").andRespond(withSuccess(
                result(List.of(List.of(KEY, List.of(List.of("1-0", List.of("job_id", "j1")))))),
                MediaType.APPLICATION_JSON));
        expectCommand("XACK").andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThatThrownBy(() -> sut.dequeue("c1"))
                .isInstanceOfSatisfying(QueueException.class, e -> {
                    assertThat(e.getErrorCode()).isEqualTo(QueueErrorCode.QUEUE_NETWORK_ERROR);
                    assertThat(((UpstashException) e.getCause()).getHttpStatus()).isEqualTo(503);
                });
        server.verify();
    }

    @Test
    @DisplayName("poison 엔트리의 DLQ 기록 실패는 QUEUE_DEQUEUE_FAILED")
    void dead_letter_failure_during_dequeue_is_classified() throws Exception {
        expectGroupCreated();
        expectCommand("XREADGROUP").andRespond(withSuccess(
                result(List.of(List.of(KEY, List.of(List.of("1-0", List.of("job_id", "bad", "payload", "{oops")))))),
                MediaType.APPLICATION_JSON));
        expectCommand("XADD")
                .andExpect(jsonPath("$[1]").value("tarot:jobs:dlq"))
                .andRespond(withSuccess("{\"error\":\"OOM command not allowed\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> sut.dequeue("c1"))
                .isInstanceOfSatisfying(QueueException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(QueueErrorCode.QUEUE_DEQUEUE_FAILED));
    }
}
