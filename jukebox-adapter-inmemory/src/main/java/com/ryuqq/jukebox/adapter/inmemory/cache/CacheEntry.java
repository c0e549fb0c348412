package com.ryuqq.jukebox.adapter.inmemory.cache;

/**
 * 캐시 항목.
 *
 * @param data 저장된 값
 * @param timestamp 저장 시각 (epoch 밀리초)
 * @param ttlMs 보관 시간 (밀리초)
 * @author Jukebox Team
 * @since 1.0.0
 */
record CacheEntry(Object data, long timestamp, long ttlMs) {

    CacheEntry {
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
        if (ttlMs <= 0) {
            throw new IllegalArgumentException("ttlMs must be positive (current: " + ttlMs + ")");
        }
    }

    /**
     * {@code now - timestamp <= ttl}이면 유효.
     */
    boolean isValidAt(long now) {
        return now - timestamp <= ttlMs;
    }
}
