package com.ryuqq.jukebox.adapter.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.jukebox.core.failure.FailureKind;
import com.ryuqq.jukebox.core.failure.UpstreamException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * HttpFailureMapper 테스트.
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
@DisplayName("HttpFailureMapper 테스트")
class HttpFailureMapperTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("403은 QUOTA_EXHAUSTED, 429는 RATE_LIMITED, 나머지는 TRANSIENT")
    void 상태_코드_분류() {
        assertThat(HttpFailureMapper.kindFor(403)).isEqualTo(FailureKind.QUOTA_EXHAUSTED);
        assertThat(HttpFailureMapper.kindFor(429)).isEqualTo(FailureKind.RATE_LIMITED);
        assertThat(HttpFailureMapper.kindFor(400)).isEqualTo(FailureKind.TRANSIENT);
        assertThat(HttpFailureMapper.kindFor(500)).isEqualTo(FailureKind.TRANSIENT);
    }

    @Test
    @DisplayName("Google API 오류 본문의 reason을 메시지에 포함한다")
    void reason_포함() {
        // given
        String body = "{\"error\":{\"code\":429,\"errors\":[{\"reason\":\"rateLimitExceeded\",\"message\":\"slow down\"}]}}";

        // when
        UpstreamException failure = HttpFailureMapper.toException(429, body, objectMapper);

        // then
        assertThat(failure.getKind()).isEqualTo(FailureKind.RATE_LIMITED);
        assertThat(failure.getStatusCode()).isEqualTo(429);
        assertThat(failure.getMessage()).isEqualTo("API request failed: 429 (rateLimitExceeded)");
    }

    @Test
    @DisplayName("본문이 없거나 형식이 다르면 상태 코드만 남긴다")
    void reason_없음() {
        assertThat(HttpFailureMapper.toException(500, null, objectMapper).getMessage())
            .isEqualTo("API request failed: 500");
        assertThat(HttpFailureMapper.toException(500, "{\"message\":\"oops\"}", objectMapper).getMessage())
            .isEqualTo("API request failed: 500");
        assertThat(HttpFailureMapper.toException(502, "<html>Bad Gateway</html>", objectMapper).getMessage())
            .isEqualTo("API request failed: 502");
    }
}
