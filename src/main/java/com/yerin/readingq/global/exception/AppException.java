package com.yerin.readingq.global.exception;

import com.yerin.readingq.global.dto.ErrorContext;
import com.yerin.readingq.global.exception.code.ErrorCode;
import com.yerin.readingq.global.exception.code.ErrorSeverity;
import lombok.Getter;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 큐/워커 오류의 공통 부모.
 * <p>
 * {@link #getMessage()} 는 "코드: 사용자 메시지" 형태만 담는다. 원본 사유, job id, 시도 횟수 같은
 * 운영자용 정보는 {@link #getDetails()} 와 {@link #logContext()} 로만 노출한다.
 */
@Getter
public class AppException extends RuntimeException {

    private static final Pattern BARE = Pattern.compile("\\d+s?|\\[.*]");

    private final ErrorCode errorCode;
    private final Instant occurredAt;
    private final Map<String, String> details;

    protected AppException(ErrorCode errorCode, Map<String, String> details, Throwable cause) {
        super(errorCode.getCode() + ": " + errorCode.getMessage(), cause);
        this.errorCode = errorCode;
        this.occurredAt = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public String userMessage() {
        return errorCode.getMessage();
    }

    public ErrorSeverity severity() {
        return errorCode.getSeverity();
    }

    public boolean isRetryable() {
        return errorCode.isRetryable();
    }

    public String logContext() {
        String code = errorCode.getCode();
        StringBuilder sb = new StringBuilder()
                .append('[').append(code).append("] error_code=").append(code)
                .append(" severity=").append(severity())
                .append(" timestamp=").append(occurredAt);
        details.forEach((k, v) -> {
            sb.append(' ').append(k).append('=');
            if (isBare(v)) sb.append(v);
            else sb.append('"').append(v).append('"');
        });
        return sb.toString();
    }

    public ErrorContext toContext() {
        Map<String, String> metadata = new LinkedHashMap<>(details);
        String jobId = metadata.remove("job_id");
        String userId = metadata.remove("user_id");
        String traceId = metadata.remove("trace_id");
        return new ErrorContext(errorCode.getCode(), severity(), occurredAt, jobId, userId, traceId, metadata);
    }

    // 숫자, 초 단위(5s), 목록([a, b])은 따옴표 없이 기록
    private static boolean isBare(String v) {
        return BARE.matcher(v).matches();
    }
}
