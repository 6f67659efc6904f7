package com.yerin.readingq.global.exception;

import com.yerin.readingq.global.exception.code.QueueErrorCode;
import com.yerin.readingq.infra.UpstashException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.web.client.ResourceAccessException;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * 하위 예외를 큐 오류 코드로 분류한다.
 * <p>
 * 1) 예외 체인에서 알려진 타입(연결 실패, 타임아웃, Upstash 전송 오류)을 먼저 찾고
 * 2) 없으면 메시지의 키워드(connection/timeout/network/capacity)로 추정한다.
 * 키워드 매칭은 휴리스틱이라 낯선 백엔드 오류는 fallback 코드로 떨어진다.
 */
public final class ErrorClassifier {
    private ErrorClassifier() {}

    public static QueueException classify(Throwable error) {
        return classify(error, QueueErrorCode.QUEUE_INTERNAL_ERROR, null);
    }

    /**
     * @param fallback 전송 계층 오류로 판별되지 않을 때 쓸 작업별 코드(예: QUEUE_ACK_FAILED)
     * @param jobId    오류와 관련된 job id, 없으면 null
     */
    public static QueueException classify(Throwable error, QueueErrorCode fallback, String jobId) {
        if (error instanceof QueueException qe) return qe;
        String reason = describe(error);
        QueueErrorCode code = byType(error);
        if (code == null) code = byKeyword(reason);
        if (code == null) code = fallback;
        return QueueException.of(code, jobId, reason, error);
    }

    static QueueErrorCode byType(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof UpstashException ue) {
                switch (ue.getKind()) {
                    case TIMEOUT:
                        return QueueErrorCode.QUEUE_TIMEOUT_ERROR;
                    case HTTP_STATUS:
                        return ue.getHttpStatus() == 429 ? QueueErrorCode.QUEUE_QUEUE_FULL : QueueErrorCode.QUEUE_NETWORK_ERROR;
                    case IO:
                        return QueueErrorCode.QUEUE_NETWORK_ERROR;
                    default:
                        // 파싱 실패/브로커 오류는 작업별 코드로 둔다
                        return null;
                }
            }
            if (t instanceof SocketTimeoutException || t instanceof TimeoutException
                    || t instanceof QueryTimeoutException) {
                return QueueErrorCode.QUEUE_TIMEOUT_ERROR;
            }
            if (t instanceof RedisConnectionFailureException || t instanceof ConnectException) {
                return QueueErrorCode.QUEUE_CONNECTION_FAILED;
            }
            if (t instanceof UnknownHostException || t instanceof NoRouteToHostException) {
                return QueueErrorCode.QUEUE_NETWORK_ERROR;
            }
            if (t instanceof ResourceAccessException && t.getCause() == null) {
                return QueueErrorCode.QUEUE_NETWORK_ERROR;
            }
        }
        return null;
    }

    static QueueErrorCode byKeyword(String reason) {
        String msg = reason.toLowerCase(Locale.ROOT);
        if (msg.contains("connection") || msg.contains("connect")) return QueueErrorCode.QUEUE_CONNECTION_FAILED;
        if (msg.contains("timeout") || msg.contains("timed out")) return QueueErrorCode.QUEUE_TIMEOUT_ERROR;
        if (msg.contains("network") || msg.contains("dns")) return QueueErrorCode.QUEUE_NETWORK_ERROR;
        if (msg.contains("full") || msg.contains("capacity")) return QueueErrorCode.QUEUE_QUEUE_FULL;
        return null;
    }

    private static String describe(Throwable error) {
        if (error == null) return "unknown error";
        String msg = error.getMessage();
        return msg == null || msg.isBlank() ? error.getClass().getName() : msg;
    }
}
