package com.ryuqq.jukebox.adapter.inmemory.cache;

import java.util.List;

/**
 * 캐시 통계 스냅샷.
 *
 * @param size 저장된 항목 수 (만료되었지만 아직 정리되지 않은 항목 포함)
 * @param keys 저장된 키 목록
 * @author Jukebox Team
 * @since 1.0.0
 */
public record CacheStats(int size, List<String> keys) {

    public CacheStats {
        keys = List.copyOf(keys);
    }
}
