package com.ryuqq.jukebox.core.model;

import java.util.stream.Collectors;

/**
 * ResponseCache 키 생성 규칙.
 *
 * <pre>
 * CacheKeys.forVideoSearch("search", RequestParams.of("q", "lofi", "maxResults", 10))
 *   → "youtube:search:maxResults=10&amp;q=lofi"
 * </pre>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public final class CacheKeys {

    private static final String VIDEO_SEARCH_PREFIX = "youtube";

    private CacheKeys() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 영상 검색 API 응답의 캐시 키.
     *
     * @param endpoint API 엔드포인트 이름 (예: "search", "videos")
     * @param params 요청 파라미터 (키 정렬됨)
     * @return {@code youtube:<endpoint>:<k1=v1&k2=v2...>}
     * @throws IllegalArgumentException endpoint가 비었거나 params가 null인 경우
     */
    public static String forVideoSearch(String endpoint, RequestParams params) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("endpoint cannot be null or blank");
        }
        if (params == null) {
            throw new IllegalArgumentException("params cannot be null");
        }
        String joined = params.asMap().entrySet().stream()
            .map(e -> e.getKey() + "=" + e.getValue())
            .collect(Collectors.joining("&"));
        return VIDEO_SEARCH_PREFIX + ":" + endpoint + ":" + joined;
    }
}
