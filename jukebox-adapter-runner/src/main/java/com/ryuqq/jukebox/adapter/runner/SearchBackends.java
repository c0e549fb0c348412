package com.ryuqq.jukebox.adapter.runner;

import com.ryuqq.jukebox.application.search.VideoSearchBackend;

/**
 * 검색 fallback 체인을 구성하는 백엔드 묶음.
 *
 * @param api YouTube Data API (자격 증명 필요)
 * @param proxy 프록시 검색 서비스
 * @param scraper 스크레이퍼 (youtube-scraper 서비스로 대기열 경유)
 * @author Jukebox Team
 * @since 1.0.0
 */
public record SearchBackends(VideoSearchBackend api, VideoSearchBackend proxy, VideoSearchBackend scraper) {

    public SearchBackends {
        if (api == null || proxy == null || scraper == null) {
            throw new IllegalArgumentException("api, proxy and scraper backends are required");
        }
    }
}
