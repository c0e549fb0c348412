package com.ryuqq.jukebox.adapter.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.jukebox.core.failure.DefaultFailureClassifier;
import com.ryuqq.jukebox.core.failure.FailureKind;
import com.ryuqq.jukebox.core.failure.UpstreamException;
import com.ryuqq.jukebox.core.spi.ResponseCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * ResponseCache를 앞에 둔 JSON HTTP 호출기.
 *
 * <p><strong>cachedFetch 동작:</strong></p>
 * <ol>
 *   <li>cacheKey(없으면 URL)로 캐시 조회 → 적중 시 네트워크 호출 없이 반환</li>
 *   <li>{@link HttpClient#sendAsync}로 요청</li>
 *   <li>비 2xx → {@link HttpFailureMapper}로 분류된 {@link UpstreamException}</li>
 *   <li>본문을 Jackson으로 파싱해 캐시에 저장한 뒤 반환</li>
 * </ol>
 *
 * <p>네트워크 오류와 파싱 오류는 TRANSIENT로 분류됩니다. URL의 쿼리 문자열에는
 * API 키가 들어 있으므로 로그에는 host와 path만 남깁니다.</p>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public class CachedHttpFetcher {

    private static final Logger log = LoggerFactory.getLogger(CachedHttpFetcher.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ResponseCache cache;

    /**
     * 생성자.
     *
     * @param httpClient HTTP 클라이언트
     * @param objectMapper JSON 파서
     * @param cache 응답 캐시
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public CachedHttpFetcher(HttpClient httpClient, ObjectMapper objectMapper, ResponseCache cache) {
        if (httpClient == null || objectMapper == null || cache == null) {
            throw new IllegalArgumentException("httpClient, objectMapper and cache cannot be null");
        }
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.cache = cache;
    }

    /**
     * 캐시 우선 JSON 조회 (기본 옵션, URL을 캐시 키로, 캐시 기본 TTL).
     *
     * @see #cachedFetch(URI, HttpFetchOptions, String, Duration, Class)
     */
    public <T> CompletableFuture<T> cachedFetch(URI url, Class<T> type) {
        return cachedFetch(url, new HttpFetchOptions(), null, null, type);
    }

    /**
     * 캐시 우선 JSON 조회.
     *
     * @param url 요청 URL
     * @param options 요청 옵션
     * @param cacheKey 캐시 키 (null이면 URL 문자열)
     * @param ttl 보관 시간 (null이면 캐시 기본 TTL)
     * @param type 결과 타입 (Jackson 역직렬화 대상)
     * @param <T> 결과 타입
     * @return 결과 future. 실패는 {@link UpstreamException}
     * @throws IllegalArgumentException url, options, type이 null인 경우
     */
    public <T> CompletableFuture<T> cachedFetch(
        URI url,
        HttpFetchOptions options,
        String cacheKey,
        Duration ttl,
        Class<T> type
    ) {
        if (url == null || options == null || type == null) {
            throw new IllegalArgumentException("url, options and type cannot be null");
        }
        String key = cacheKey != null ? cacheKey : url.toString();

        Optional<T> cached = cache.get(key, type);
        if (cached.isPresent()) {
            log.debug("HTTP cache hit: {}", describe(url));
            return CompletableFuture.completedFuture(cached.get());
        }

        log.info("Making API request: {} {}", options.method(), describe(url));
        return send(url, options)
            .thenApply(response -> {
                T data = parse(response, type);
                if (ttl == null) {
                    cache.set(key, data);
                } else {
                    cache.set(key, data, ttl);
                }
                return data;
            });
    }

    private CompletableFuture<HttpResponse<String>> send(URI url, HttpFetchOptions options) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(url)
            .timeout(options.timeout())
            .method(options.method(), HttpRequest.BodyPublishers.noBody());
        options.headers().forEach(builder::header);

        return httpClient.sendAsync(builder.build(), HttpResponse.BodyHandlers.ofString())
            .exceptionally(error -> {
                Throwable cause = DefaultFailureClassifier.unwrap(error);
                log.warn("API request to {} failed before a response: {}", describe(url), cause.toString());
                throw new UpstreamException(
                    FailureKind.TRANSIENT, UpstreamException.NO_STATUS, "Network error: " + cause.getMessage(), cause
                );
            });
    }

    private <T> T parse(HttpResponse<String> response, Class<T> type) {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            UpstreamException failure = HttpFailureMapper.toException(status, response.body(), objectMapper);
            log.warn("{} ({}: {})", failure.getMessage(), failure.getKind(), describe(response.uri()));
            throw failure;
        }
        try {
            return objectMapper.readValue(response.body(), type);
        } catch (JsonProcessingException e) {
            throw new UpstreamException(
                FailureKind.TRANSIENT, status, "Invalid JSON response from " + describe(response.uri()), e
            );
        }
    }

    private static String describe(URI url) {
        return url == null ? "unknown" : url.getHost() + url.getPath();
    }
}
