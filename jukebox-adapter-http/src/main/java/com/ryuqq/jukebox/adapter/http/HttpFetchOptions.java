package com.ryuqq.jukebox.adapter.http;

import java.time.Duration;
import java.util.Map;

/**
 * HTTP 요청 옵션 (불변 record).
 *
 * <p>기본값: GET, {@code Accept: application/json}, 요청 timeout 10초</p>
 *
 * @param method HTTP 메서드
 * @param headers 요청 헤더
 * @param timeout 요청 timeout (양수)
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public record HttpFetchOptions(String method, Map<String, String> headers, Duration timeout) {

    public HttpFetchOptions {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method cannot be null or blank");
        }
        if (headers == null) {
            throw new IllegalArgumentException("headers cannot be null");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        headers = Map.copyOf(headers);
    }

    /**
     * 기본 설정 생성자.
     */
    public HttpFetchOptions() {
        this("GET", Map.of("Accept", "application/json"), Duration.ofSeconds(10));
    }

    public HttpFetchOptions withMethod(String method) {
        return new HttpFetchOptions(method, headers, timeout);
    }

    public HttpFetchOptions withHeaders(Map<String, String> headers) {
        return new HttpFetchOptions(method, headers, timeout);
    }

    public HttpFetchOptions withTimeout(Duration timeout) {
        return new HttpFetchOptions(method, headers, timeout);
    }
}
