package com.ryuqq.jukebox.application.search;

import com.ryuqq.jukebox.application.credential.CredentialPool;
import com.ryuqq.jukebox.core.credential.Credential;
import com.ryuqq.jukebox.core.model.ServiceName;
import com.ryuqq.jukebox.core.spi.ResponseCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * SearchFallbackChain 유닛 테스트.
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("SearchFallbackChain 테스트")
class SearchFallbackChainTest {

    private static final String KEY = "AIzaSyA-1234567890abcdefgh";
    private static final List<Video> VIDEOS = List.of(Video.of("v1", "Song", "Artist"));

    @Mock
    private CredentialPool credentialPool;

    @Mock
    private VideoSearchBackend apiBackend;

    @Mock
    private VideoSearchBackend proxyBackend;

    @Mock
    private VideoSearchBackend scraperBackend;

    @Mock
    private ResponseCache cache;

    private DirectRequestOrchestrator orchestrator;
    private SearchFallbackChain chain;

    @BeforeEach
    void setUp() {
        orchestrator = new DirectRequestOrchestrator();
        VideoSearchService apiSearch = new VideoSearchService(
            orchestrator, credentialPool, apiBackend, cache, Duration.ofMinutes(15)
        );
        chain = new SearchFallbackChain(apiSearch, proxyBackend, scraperBackend, orchestrator);
    }

    @Test
    @DisplayName("API 성공 시 fallback 없이 결과 반환")
    void API_성공() {
        // given
        when(cache.get(anyString(), eq(CachedVideos.class))).thenReturn(Optional.empty());
        when(credentialPool.activeCredential()).thenReturn(Optional.of(Credential.of(KEY)));
        when(apiBackend.search("song", 48, KEY)).thenReturn(CompletableFuture.completedFuture(VIDEOS));

        // when
        SearchResult result = chain.search("song", new SearchOptions()).join();

        // then
        assertThat(result.method()).isEqualTo(SearchMethod.API);
        assertThat(result.fallbackUsed()).isFalse();
        assertThat(result.videos()).isEqualTo(VIDEOS);
        verifyNoInteractions(proxyBackend, scraperBackend);
    }

    @Test
    @DisplayName("API 실패, 프록시 불가 시 스크래퍼를 youtube-scraper 대기열로 호출")
    void API_실패_프록시_불가_스크래퍼_사용() {
        // given
        when(cache.get(anyString(), eq(CachedVideos.class))).thenReturn(Optional.empty());
        when(credentialPool.activeCredential()).thenReturn(Optional.of(Credential.of(KEY)));
        when(apiBackend.search(anyString(), anyInt(), any()))
            .thenReturn(CompletableFuture.failedFuture(new RuntimeException("quotaExceeded")));
        when(proxyBackend.isAvailable()).thenReturn(false);
        when(scraperBackend.search("song", 48, null)).thenReturn(CompletableFuture.completedFuture(VIDEOS));

        // when
        SearchResult result = chain.search("song", new SearchOptions()).join();

        // then
        assertThat(result.method()).isEqualTo(SearchMethod.SCRAPER);
        assertThat(result.fallbackUsed()).isTrue();
        assertThat(orchestrator.enqueued).extracting(DirectRequestOrchestrator.Enqueued::serviceName)
            .containsExactly(ServiceName.YOUTUBE_API, ServiceName.YOUTUBE_SCRAPER);
        verify(proxyBackend, never()).search(anyString(), anyInt(), any());
    }

    @Test
    @DisplayName("선호 백엔드가 먼저 시도됨")
    void 선호_백엔드_우선() {
        // given
        when(proxyBackend.isAvailable()).thenReturn(true);
        when(proxyBackend.search("song", 48, null)).thenReturn(CompletableFuture.completedFuture(VIDEOS));

        // when
        SearchResult result = chain.search("song", new SearchOptions().withPreferredMethod(SearchMethod.PROXY)).join();

        // then
        assertThat(result.method()).isEqualTo(SearchMethod.PROXY);
        assertThat(result.fallbackUsed()).isFalse();
        verifyNoInteractions(apiBackend, scraperBackend);
    }

    @Test
    @DisplayName("fallback 비활성화 시 첫 실패를 그대로 전달")
    void fallback_비활성화() {
        // given
        when(proxyBackend.isAvailable()).thenReturn(true);
        RuntimeException failure = new RuntimeException("proxy down");
        when(proxyBackend.search(anyString(), anyInt(), any())).thenReturn(CompletableFuture.failedFuture(failure));
        SearchOptions options = new SearchOptions()
            .withPreferredMethod(SearchMethod.PROXY)
            .withEnableFallback(false);

        // when
        CompletableFuture<SearchResult> result = chain.search("song", options);

        // then
        assertThatThrownBy(result::join)
            .isInstanceOf(CompletionException.class)
            .hasCause(failure);
        verifyNoInteractions(apiBackend, scraperBackend);
    }

    @Test
    @DisplayName("모든 백엔드 실패 시 마지막 오류로 실패")
    void 모든_백엔드_실패() {
        // given
        when(cache.get(anyString(), eq(CachedVideos.class))).thenReturn(Optional.empty());
        when(credentialPool.activeCredential()).thenReturn(Optional.empty());
        when(proxyBackend.isAvailable()).thenReturn(false);
        RuntimeException scraperFailure = new RuntimeException("scraper blocked");
        when(scraperBackend.search(anyString(), anyInt(), any()))
            .thenReturn(CompletableFuture.failedFuture(scraperFailure));

        // when
        CompletableFuture<SearchResult> result = chain.search("song", new SearchOptions());

        // then
        assertThatThrownBy(result::join).hasCause(scraperFailure);
    }

    @Test
    @DisplayName("시도 순서: 선호 백엔드 다음 선언 순서")
    void 시도_순서() {
        assertThat(SearchFallbackChain.methodOrder(SearchMethod.SCRAPER))
            .containsExactly(SearchMethod.SCRAPER, SearchMethod.API, SearchMethod.PROXY);
        assertThat(SearchFallbackChain.methodOrder(SearchMethod.API))
            .containsExactly(SearchMethod.API, SearchMethod.PROXY, SearchMethod.SCRAPER);
    }
}
