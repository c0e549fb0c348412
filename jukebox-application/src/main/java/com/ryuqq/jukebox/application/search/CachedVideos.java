package com.ryuqq.jukebox.application.search;

import java.util.List;

/**
 * ResponseCache에 저장되는 검색 결과 묶음.
 *
 * @param videos 검색 결과 (불변 복사본)
 * @author Jukebox Team
 * @since 1.0.0
 */
record CachedVideos(List<Video> videos) {

    CachedVideos {
        if (videos == null) {
            throw new IllegalArgumentException("videos cannot be null");
        }
        videos = List.copyOf(videos);
    }
}
