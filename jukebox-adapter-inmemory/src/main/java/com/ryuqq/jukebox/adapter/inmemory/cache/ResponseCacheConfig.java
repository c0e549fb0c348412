package com.ryuqq.jukebox.adapter.inmemory.cache;

import java.time.Duration;

/**
 * 응답 캐시 설정.
 *
 * @param defaultTtl TTL 미지정 시 보관 시간 (기본값: 15분)
 * @param sweepInterval 만료 항목 정리 주기 (기본값: 5분)
 * @author Jukebox Team
 * @since 1.0.0
 */
public record ResponseCacheConfig(Duration defaultTtl, Duration sweepInterval) {

    public ResponseCacheConfig {
        requirePositive(defaultTtl, "defaultTtl");
        requirePositive(sweepInterval, "sweepInterval");
    }

    /**
     * 기본 설정으로 생성.
     */
    public ResponseCacheConfig() {
        this(Duration.ofMinutes(15), Duration.ofMinutes(5));
    }

    public ResponseCacheConfig withDefaultTtl(Duration defaultTtl) {
        return new ResponseCacheConfig(defaultTtl, sweepInterval);
    }

    public ResponseCacheConfig withSweepInterval(Duration sweepInterval) {
        return new ResponseCacheConfig(defaultTtl, sweepInterval);
    }

    static void requirePositive(Duration value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive (current: " + value + ")");
        }
    }
}
