/**
 * 영상 검색 유스케이스.
 *
 * <p>API 검색({@link com.ryuqq.jukebox.application.search.VideoSearchService})과
 * 백엔드 fallback({@link com.ryuqq.jukebox.application.search.SearchFallbackChain})을 제공합니다.
 * 두 유스케이스 모두 외부 호출을 RequestOrchestrator 대기열을 통해 수행합니다.</p>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
package com.ryuqq.jukebox.application.search;
