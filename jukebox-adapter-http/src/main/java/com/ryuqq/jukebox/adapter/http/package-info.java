/**
 * HTTP Adapter Layer - 업스트림 HTTP 호출과 오류 분류.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.jukebox.adapter.http.CachedHttpFetcher} - ResponseCache 우선 JSON 조회</li>
 *   <li>{@link com.ryuqq.jukebox.adapter.http.HttpFailureMapper} - 상태 코드 → FailureKind</li>
 *   <li>{@link com.ryuqq.jukebox.adapter.http.YouTubeSearchBackend} - YouTube Data API 검색</li>
 * </ul>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
package com.ryuqq.jukebox.adapter.http;
