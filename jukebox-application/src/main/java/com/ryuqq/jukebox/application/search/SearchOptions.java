package com.ryuqq.jukebox.application.search;

import com.ryuqq.jukebox.core.model.Priority;

/**
 * 검색 fallback 옵션.
 *
 * @param maxResults 최대 결과 수 (기본값: 48)
 * @param preferredMethod 먼저 시도할 백엔드 (기본값: API)
 * @param enableFallback 실패 시 다음 백엔드 시도 여부 (기본값: true)
 * @param priority 대기열 우선순위 (기본값: HIGH, 사용자 검색)
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public record SearchOptions(
    int maxResults,
    SearchMethod preferredMethod,
    boolean enableFallback,
    Priority priority
) {

    public SearchOptions {
        if (maxResults <= 0) {
            throw new IllegalArgumentException("maxResults must be positive (current: " + maxResults + ")");
        }
        if (preferredMethod == null) {
            throw new IllegalArgumentException("preferredMethod cannot be null");
        }
        if (priority == null) {
            throw new IllegalArgumentException("priority cannot be null");
        }
    }

    /**
     * 기본 설정으로 생성.
     */
    public SearchOptions() {
        this(48, SearchMethod.API, true, Priority.HIGH);
    }

    public SearchOptions withMaxResults(int maxResults) {
        return new SearchOptions(maxResults, preferredMethod, enableFallback, priority);
    }

    public SearchOptions withPreferredMethod(SearchMethod preferredMethod) {
        return new SearchOptions(maxResults, preferredMethod, enableFallback, priority);
    }

    public SearchOptions withEnableFallback(boolean enableFallback) {
        return new SearchOptions(maxResults, preferredMethod, enableFallback, priority);
    }
}
