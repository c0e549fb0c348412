package com.ryuqq.jukebox.application.search;

import com.ryuqq.jukebox.application.credential.CredentialPool;
import com.ryuqq.jukebox.application.orchestrator.RequestOrchestrator;
import com.ryuqq.jukebox.core.credential.Credential;
import com.ryuqq.jukebox.core.failure.NoCredentialAvailableException;
import com.ryuqq.jukebox.core.model.CacheKeys;
import com.ryuqq.jukebox.core.model.Priority;
import com.ryuqq.jukebox.core.model.RequestParams;
import com.ryuqq.jukebox.core.model.RequestType;
import com.ryuqq.jukebox.core.model.ServiceName;
import com.ryuqq.jukebox.core.spi.ResponseCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * YouTube Data API 검색 유스케이스.
 *
 * <p>검색 요청을 {@code youtube-api} 서비스로 대기열에 넣고, 성공한 결과를
 * ResponseCache에 저장합니다.</p>
 *
 * <p><strong>자격 증명 사용:</strong></p>
 * <ul>
 *   <li>executor는 호출 시점에 CredentialPool의 활성 키를 읽음</li>
 *   <li>따라서 쿼터 소진 후 교체가 일어나면 재시도는 새 키로 수행됨</li>
 *   <li>활성 키가 없으면 NoCredentialAvailableException (재시도 없음)</li>
 * </ul>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public class VideoSearchService {

    private static final Logger log = LoggerFactory.getLogger(VideoSearchService.class);

    static final String SEARCH_ENDPOINT = "search";

    private final RequestOrchestrator orchestrator;
    private final CredentialPool credentialPool;
    private final VideoSearchBackend apiBackend;
    private final ResponseCache cache;
    private final Duration cacheTtl;

    /**
     * 생성자.
     *
     * @param orchestrator 요청 대기열
     * @param credentialPool 자격 증명 풀
     * @param apiBackend YouTube Data API 백엔드
     * @param cache 응답 캐시
     * @param cacheTtl 검색 결과 보관 시간
     * @throws IllegalArgumentException 인자가 null이거나 cacheTtl이 양수가 아닌 경우
     */
    public VideoSearchService(
        RequestOrchestrator orchestrator,
        CredentialPool credentialPool,
        VideoSearchBackend apiBackend,
        ResponseCache cache,
        Duration cacheTtl
    ) {
        if (orchestrator == null || credentialPool == null || apiBackend == null || cache == null) {
            throw new IllegalArgumentException("orchestrator, credentialPool, apiBackend and cache cannot be null");
        }
        if (cacheTtl == null || cacheTtl.isZero() || cacheTtl.isNegative()) {
            throw new IllegalArgumentException("cacheTtl must be positive (current: " + cacheTtl + ")");
        }
        this.orchestrator = orchestrator;
        this.credentialPool = credentialPool;
        this.apiBackend = apiBackend;
        this.cache = cache;
        this.cacheTtl = cacheTtl;
    }

    /**
     * 영상 검색.
     *
     * @param query 검색어
     * @param maxResults 최대 결과 수
     * @param priority 대기열 우선순위
     * @return 검색 결과 future
     * @throws IllegalArgumentException query가 비었거나 maxResults가 양수가 아닌 경우
     */
    public CompletableFuture<List<Video>> search(String query, int maxResults, Priority priority) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query cannot be null or blank");
        }
        if (maxResults <= 0) {
            throw new IllegalArgumentException("maxResults must be positive (current: " + maxResults + ")");
        }

        RequestParams params = RequestParams.of("q", query, "maxResults", maxResults);
        String cacheKey = CacheKeys.forVideoSearch(SEARCH_ENDPOINT, params);

        Optional<CachedVideos> cached = cache.get(cacheKey, CachedVideos.class);
        if (cached.isPresent()) {
            log.debug("Search cache hit: {}", cacheKey);
            return CompletableFuture.completedFuture(cached.get().videos());
        }

        CompletableFuture<List<Video>> result = orchestrator.enqueue(
            RequestType.SEARCH,
            ServiceName.YOUTUBE_API,
            params,
            () -> {
                Credential credential = credentialPool.activeCredential()
                    .orElseThrow(() -> new NoCredentialAvailableException("No API key selected"));
                log.debug("Searching '{}' with key ...{}", query, credential.maskedKey());
                return apiBackend.search(query, maxResults, credential.key());
            },
            priority
        );

        return result.thenApply(videos -> {
            CachedVideos entry = new CachedVideos(videos);
            cache.set(cacheKey, entry, cacheTtl);
            return entry.videos();
        });
    }
}
