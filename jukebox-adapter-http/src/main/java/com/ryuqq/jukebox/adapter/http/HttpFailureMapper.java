package com.ryuqq.jukebox.adapter.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.jukebox.core.failure.FailureKind;
import com.ryuqq.jukebox.core.failure.UpstreamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP 응답 상태 → {@link UpstreamException} 변환.
 *
 * <p>업스트림 오류가 처음 관측되는 경계에서 한 번만 분류합니다.</p>
 * <ul>
 *   <li>403 → QUOTA_EXHAUSTED (자격 증명 교체 대상)</li>
 *   <li>429 → RATE_LIMITED</li>
 *   <li>그 외 비 2xx → TRANSIENT</li>
 * </ul>
 *
 * <p>메시지 형식: {@code API request failed: <status> (<reason>)}. reason은 Google API 오류 본문의
 * {@code error.errors[0].reason}이며, 본문을 읽을 수 없으면 생략됩니다.</p>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public final class HttpFailureMapper {

    private static final Logger log = LoggerFactory.getLogger(HttpFailureMapper.class);

    private HttpFailureMapper() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 코드의 실패 분류.
     *
     * @param statusCode HTTP 상태 코드
     * @return 실패 분류
     */
    public static FailureKind kindFor(int statusCode) {
        if (statusCode == 403) {
            return FailureKind.QUOTA_EXHAUSTED;
        }
        if (statusCode == 429) {
            return FailureKind.RATE_LIMITED;
        }
        return FailureKind.TRANSIENT;
    }

    /**
     * 실패 응답을 분류된 예외로 변환.
     *
     * @param statusCode HTTP 상태 코드
     * @param body 응답 본문 (nullable)
     * @param objectMapper 본문 파싱용
     * @return 분류된 예외
     */
    public static UpstreamException toException(int statusCode, String body, ObjectMapper objectMapper) {
        String reason = errorReason(body, objectMapper);
        String message = reason == null
            ? "API request failed: " + statusCode
            : "API request failed: " + statusCode + " (" + reason + ")";
        return new UpstreamException(kindFor(statusCode), statusCode, message);
    }

    private static String errorReason(String body, ObjectMapper objectMapper) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode reason = objectMapper.readTree(body).path("error").path("errors").path(0).path("reason");
            return reason.isTextual() ? reason.asText() : null;
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON: {}", e.getOriginalMessage());
            return null;
        }
    }
}
