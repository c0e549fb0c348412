package com.ryuqq.jukebox.adapter.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.jukebox.adapter.inmemory.cache.InMemoryResponseCache;
import com.ryuqq.jukebox.adapter.inmemory.cache.ResponseCacheConfig;
import com.ryuqq.jukebox.core.failure.FailureKind;
import com.ryuqq.jukebox.core.failure.UpstreamException;
import com.ryuqq.jukebox.testkit.clock.ManualClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * CachedHttpFetcher 테스트.
 *
 * <p>HttpClient는 Mockito로 대체하고, 캐시는 ManualClock 위의 실제 InMemoryResponseCache를 사용합니다.</p>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("CachedHttpFetcher 테스트")
class CachedHttpFetcherTest {

    private static final URI URL = URI.create("https://www.googleapis.com/youtube/v3/videos?id=abc&key=secret");

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<String> response;

    private ManualClock clock;
    private InMemoryResponseCache cache;
    private CachedHttpFetcher fetcher;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(0L);
        cache = new InMemoryResponseCache(new ResponseCacheConfig(), clock);
        fetcher = new CachedHttpFetcher(httpClient, new ObjectMapper(), cache);
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    private void respondWith(int status, String body) {
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        when(httpClient.sendAsync(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
            .thenReturn(CompletableFuture.completedFuture(response));
    }

    private static UpstreamException upstreamFailure(CompletableFuture<?> future) {
        Throwable thrown = catchThrowable(future::join);
        assertThat(thrown).isInstanceOf(CompletionException.class);
        assertThat(thrown.getCause()).isInstanceOf(UpstreamException.class);
        return (UpstreamException) thrown.getCause();
    }

    @Test
    @DisplayName("캐시 미스이면 요청 후 JSON을 파싱해 캐시에 저장한다")
    void 캐시_미스_저장() {
        // given
        respondWith(200, "{\"items\":[{\"id\":\"abc\"}]}");

        // when
        JsonNode result = fetcher.cachedFetch(URL, JsonNode.class).join();

        // then
        assertThat(result.path("items").get(0).path("id").asText()).isEqualTo("abc");
        assertThat(cache.has(URL.toString())).isTrue();
    }

    @Test
    @DisplayName("캐시 적중이면 네트워크를 호출하지 않는다")
    void 캐시_적중() {
        // given
        respondWith(200, "{\"value\":1}");
        fetcher.cachedFetch(URL, new HttpFetchOptions(), "videos:abc", null, JsonNode.class).join();

        // when
        JsonNode second = fetcher.cachedFetch(URL, new HttpFetchOptions(), "videos:abc", null, JsonNode.class).join();

        // then
        assertThat(second.path("value").asInt()).isEqualTo(1);
        verify(httpClient, times(1)).sendAsync(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
    }

    @Test
    @DisplayName("TTL이 지나면 다시 요청한다")
    void TTL_만료_재요청() {
        // given
        respondWith(200, "{\"value\":1}");
        fetcher.cachedFetch(URL, new HttpFetchOptions(), "videos:abc", Duration.ofSeconds(30), JsonNode.class).join();

        // when
        clock.advanceMillis(30_001);
        fetcher.cachedFetch(URL, new HttpFetchOptions(), "videos:abc", Duration.ofSeconds(30), JsonNode.class).join();

        // then
        verify(httpClient, times(2)).sendAsync(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
    }

    @Test
    @DisplayName("옵션의 메서드, 헤더, timeout이 요청에 반영된다")
    void 요청_옵션_반영() {
        // given
        respondWith(200, "{}");
        HttpFetchOptions options = new HttpFetchOptions()
            .withHeaders(Map.of("Accept", "application/json", "X-Client", "jukebox"))
            .withTimeout(Duration.ofSeconds(3));

        // when
        fetcher.cachedFetch(URL, options, null, null, JsonNode.class).join();

        // then
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).sendAsync(captor.capture(), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
        HttpRequest request = captor.getValue();
        assertThat(request.method()).isEqualTo("GET");
        assertThat(request.uri()).isEqualTo(URL);
        assertThat(request.headers().firstValue("X-Client")).contains("jukebox");
        assertThat(request.timeout()).contains(Duration.ofSeconds(3));
    }

    @Test
    @DisplayName("403 응답은 QUOTA_EXHAUSTED로 분류되고 캐시되지 않는다")
    void 쿼터_초과_응답() {
        // given
        respondWith(403, "{\"error\":{\"code\":403,\"errors\":[{\"reason\":\"quotaExceeded\"}]}}");

        // when
        UpstreamException failure = upstreamFailure(fetcher.cachedFetch(URL, JsonNode.class));

        // then
        assertThat(failure.getKind()).isEqualTo(FailureKind.QUOTA_EXHAUSTED);
        assertThat(failure.getStatusCode()).isEqualTo(403);
        assertThat(failure.getMessage()).isEqualTo("API request failed: 403 (quotaExceeded)");
        assertThat(cache.has(URL.toString())).isFalse();
    }

    @Test
    @DisplayName("5xx 응답은 TRANSIENT로 분류된다")
    void 서버_오류_응답() {
        // given
        respondWith(503, "<html>Service Unavailable</html>");

        // when
        UpstreamException failure = upstreamFailure(fetcher.cachedFetch(URL, JsonNode.class));

        // then
        assertThat(failure.getKind()).isEqualTo(FailureKind.TRANSIENT);
        assertThat(failure.getMessage()).isEqualTo("API request failed: 503");
    }

    @Test
    @DisplayName("네트워크 오류는 상태 코드 없는 TRANSIENT 실패가 된다")
    void 네트워크_오류() {
        // given
        when(httpClient.sendAsync(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
            .thenReturn(CompletableFuture.failedFuture(new IOException("Connection refused")));

        // when
        UpstreamException failure = upstreamFailure(fetcher.cachedFetch(URL, JsonNode.class));

        // then
        assertThat(failure.getKind()).isEqualTo(FailureKind.TRANSIENT);
        assertThat(failure.getStatusCode()).isEqualTo(UpstreamException.NO_STATUS);
        assertThat(failure.getCause()).isInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("2xx인데 본문이 JSON이 아니면 TRANSIENT 실패가 된다")
    void 잘못된_JSON() {
        // given
        respondWith(200, "not json");

        // when
        UpstreamException failure = upstreamFailure(fetcher.cachedFetch(URL, JsonNode.class));

        // then
        assertThat(failure.getKind()).isEqualTo(FailureKind.TRANSIENT);
        assertThat(failure.getMessage()).startsWith("Invalid JSON response");
    }

    @Test
    @DisplayName("캐시 적중 시 HttpClient는 한 번도 호출되지 않는다")
    void 미리_채운_캐시() {
        // given
        cache.set("prefilled", new ObjectMapper().createObjectNode().put("cached", true));

        // when
        JsonNode result = fetcher.cachedFetch(URL, new HttpFetchOptions(), "prefilled", null, JsonNode.class).join();

        // then
        assertThat(result.path("cached").asBoolean()).isTrue();
        verify(httpClient, never()).sendAsync(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
    }
}
