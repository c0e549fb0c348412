package com.ryuqq.jukebox.application.search;

import java.util.List;

/**
 * fallback 검색 결과.
 *
 * @param videos 검색된 영상
 * @param method 결과를 돌려준 백엔드
 * @param fallbackUsed 첫 번째 백엔드가 아닌 다른 백엔드가 사용되었는지 여부
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public record SearchResult(List<Video> videos, SearchMethod method, boolean fallbackUsed) {

    public SearchResult {
        if (videos == null || method == null) {
            throw new IllegalArgumentException("videos and method cannot be null");
        }
        videos = List.copyOf(videos);
    }
}
