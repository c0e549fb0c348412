package com.ryuqq.jukebox.application.search;

/**
 * 검색 백엔드 종류.
 *
 * <p>선언 순서가 기본 fallback 순서입니다.</p>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public enum SearchMethod {

    /**
     * YouTube Data API (쿼터 과금, 자격 증명 필요).
     */
    API,

    /**
     * 백엔드 프록시 서버.
     */
    PROXY,

    /**
     * 키 없는 스크래퍼 (youtube-scraper rate limit 적용).
     */
    SCRAPER
}
