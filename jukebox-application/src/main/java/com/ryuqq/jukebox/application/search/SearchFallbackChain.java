package com.ryuqq.jukebox.application.search;

import com.ryuqq.jukebox.application.orchestrator.RequestOrchestrator;
import com.ryuqq.jukebox.core.failure.DefaultFailureClassifier;
import com.ryuqq.jukebox.core.failure.FailureKind;
import com.ryuqq.jukebox.core.failure.UpstreamException;
import com.ryuqq.jukebox.core.model.RequestParams;
import com.ryuqq.jukebox.core.model.RequestType;
import com.ryuqq.jukebox.core.model.ServiceName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * 검색 백엔드 fallback 체인.
 *
 * <p>선호 백엔드를 먼저 시도하고, 실패하면 나머지를 API → PROXY → SCRAPER 순서로 시도합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>API: {@link VideoSearchService} (youtube-api 대기열, 자격 증명 교체 대상)</li>
 *   <li>PROXY: 가용성 확인 후 직접 호출 (대기열을 거치지 않음)</li>
 *   <li>SCRAPER: youtube-scraper 서비스로 대기열에 등록</li>
 *   <li>fallback이 꺼져 있거나 마지막 백엔드까지 실패하면 마지막 오류로 실패</li>
 * </ol>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public class SearchFallbackChain {

    private static final Logger log = LoggerFactory.getLogger(SearchFallbackChain.class);

    private final VideoSearchService apiSearch;
    private final VideoSearchBackend proxyBackend;
    private final VideoSearchBackend scraperBackend;
    private final RequestOrchestrator orchestrator;

    public SearchFallbackChain(
        VideoSearchService apiSearch,
        VideoSearchBackend proxyBackend,
        VideoSearchBackend scraperBackend,
        RequestOrchestrator orchestrator
    ) {
        if (apiSearch == null || proxyBackend == null || scraperBackend == null || orchestrator == null) {
            throw new IllegalArgumentException("All collaborators are required for SearchFallbackChain");
        }
        this.apiSearch = apiSearch;
        this.proxyBackend = proxyBackend;
        this.scraperBackend = scraperBackend;
        this.orchestrator = orchestrator;
    }

    /**
     * fallback 검색.
     *
     * @param query 검색어
     * @param options 검색 옵션
     * @return 결과 future (사용된 백엔드와 fallback 여부 포함)
     * @throws IllegalArgumentException query가 비었거나 options가 null인 경우
     */
    public CompletableFuture<SearchResult> search(String query, SearchOptions options) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query cannot be null or blank");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        return attempt(methodOrder(options.preferredMethod()), 0, query, options);
    }

    /**
     * 선호 백엔드를 맨 앞에 두고 나머지는 선언 순서대로.
     *
     * @param preferred 선호 백엔드
     * @return 시도 순서
     */
    static List<SearchMethod> methodOrder(SearchMethod preferred) {
        List<SearchMethod> order = new ArrayList<>();
        order.add(preferred);
        for (SearchMethod method : SearchMethod.values()) {
            if (method != preferred) {
                order.add(method);
            }
        }
        return order;
    }

    private CompletableFuture<SearchResult> attempt(
        List<SearchMethod> methods,
        int index,
        String query,
        SearchOptions options
    ) {
        SearchMethod method = methods.get(index);
        boolean lastMethod = index == methods.size() - 1;
        log.info("Attempting {} search for '{}'", method, query);

        return execute(method, query, options)
            .thenApply(videos -> {
                log.info("{} search succeeded with {} results", method, videos.size());
                return new SearchResult(videos, method, index > 0);
            })
            .handle((result, error) -> {
                if (error == null) {
                    return CompletableFuture.completedFuture(result);
                }
                Throwable cause = DefaultFailureClassifier.unwrap(error);
                log.warn("{} search failed: {}", method, cause.getMessage());
                if (lastMethod || !options.enableFallback()) {
                    return CompletableFuture.<SearchResult>failedFuture(cause);
                }
                return attempt(methods, index + 1, query, options);
            })
            .thenCompose(Function.identity());
    }

    private CompletableFuture<List<Video>> execute(SearchMethod method, String query, SearchOptions options) {
        try {
            switch (method) {
                case API:
                    return apiSearch.search(query, options.maxResults(), options.priority());
                case PROXY:
                    return searchWithProxy(query, options.maxResults());
                case SCRAPER:
                    return searchWithScraper(query, options);
                default:
                    throw new IllegalStateException("Unknown search method: " + method);
            }
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private CompletableFuture<List<Video>> searchWithProxy(String query, int maxResults) {
        if (!proxyBackend.isAvailable()) {
            return CompletableFuture.failedFuture(
                new UpstreamException(FailureKind.TRANSIENT, UpstreamException.NO_STATUS, "Proxy service not available")
            );
        }
        return proxyBackend.search(query, maxResults, null).toCompletableFuture();
    }

    private CompletableFuture<List<Video>> searchWithScraper(String query, SearchOptions options) {
        RequestParams params = RequestParams.of(
            "action", "search",
            "query", query,
            "limit", options.maxResults()
        );
        return orchestrator.enqueue(
            RequestType.SEARCH,
            ServiceName.YOUTUBE_SCRAPER,
            params,
            () -> scraperBackend.search(query, options.maxResults(), null),
            options.priority()
        );
    }
}
