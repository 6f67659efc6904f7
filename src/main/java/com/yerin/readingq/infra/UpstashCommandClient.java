package com.yerin.readingq.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.List;

/**
 * Upstash REST 명령 프록시 클라이언트.
 * <p>
 * 명령은 {@code ["XADD", "key", "*", ...]} 같은 JSON 배열로 POST 하고 응답은 {@code {"result": ...}} 또는
 * {@code {"error": "..."}} 이다. HTTP 계층 실패와 브로커 오류를 {@link UpstashException.Kind} 로 구분한다.
 */
@Slf4j
public class UpstashCommandClient {

    private final RestTemplate rest;
    private final String baseUrl;
    private final String token;
    private final ObjectMapper om;

    public UpstashCommandClient(RestTemplate rest, String baseUrl, String token, ObjectMapper om) {
        this.rest = rest;
        this.baseUrl = baseUrl;
        this.token = token;
        this.om = om;
    }

    /**
     * @return result 필드. null 이거나 없으면 {@link NullNode}
     */
    public JsonNode execute(Object... command) {
        List<String> args = new ArrayList<>(command.length);
        for (Object c : command) args.add(String.valueOf(c));

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(token);
        headers.setContentType(MediaType.APPLICATION_JSON);

        String body;
        try {
            ResponseEntity<String> resp = rest.exchange(baseUrl, HttpMethod.POST,
                    new HttpEntity<>(args, headers), String.class);
            body = resp.getBody();
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            throw new UpstashException(UpstashException.Kind.HTTP_STATUS, status,
                    "API request failed with status " + status + ": " + e.getResponseBodyAsString(), e);
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw new UpstashException(UpstashException.Kind.TIMEOUT, "Request timed out: " + e.getMessage(), e);
            }
            throw new UpstashException(UpstashException.Kind.IO, "HTTP request failed: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new UpstashException(UpstashException.Kind.IO, "HTTP request failed: " + e.getMessage(), e);
        }

        JsonNode reply = parse(body);
        JsonNode error = reply.get("error");
        if (error != null && !error.isNull()) {
            log.debug("[Upstash] {} error={}", args.get(0), error.asText());
            throw new UpstashException(UpstashException.Kind.BROKER, error.asText(), null);
        }
        JsonNode result = reply.get("result");
        return result == null ? NullNode.getInstance() : result;
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            throw new UpstashException(UpstashException.Kind.MALFORMED_RESPONSE, "Empty response body", null);
        }
        try {
            JsonNode node = om.readTree(body);
            if (node == null || !node.isObject()) {
                throw new UpstashException(UpstashException.Kind.MALFORMED_RESPONSE,
                        "Failed to parse response - Response: " + body, null);
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new UpstashException(UpstashException.Kind.MALFORMED_RESPONSE,
                    "Failed to parse response: " + e.getOriginalMessage() + " - Response: " + body, e);
        }
    }
}
