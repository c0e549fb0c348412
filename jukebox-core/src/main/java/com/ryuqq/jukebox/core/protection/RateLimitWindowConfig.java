package com.ryuqq.jukebox.core.protection;

/**
 * 슬라이딩 윈도우 한도 설정.
 *
 * <p>윈도우 길이(windowMs) 동안 최대 maxRequests건의 요청을 허용합니다.</p>
 *
 * @param maxRequests 윈도우 내 최대 요청 수 (예: 10)
 * @param windowMs 윈도우 길이 (밀리초, 예: 60000)
 * @author Jukebox Team
 * @since 1.0.0
 */
public record RateLimitWindowConfig(int maxRequests, long windowMs) {

    /**
     * 기본 한도 (알 수 없는 서비스용): 10 req / 60s.
     */
    public static final RateLimitWindowConfig DEFAULT = new RateLimitWindowConfig(10, 60_000L);

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if maxRequests is not positive
     * @throws IllegalArgumentException if windowMs is not positive
     */
    public RateLimitWindowConfig {
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("maxRequests must be positive (current: " + maxRequests + ")");
        }
        if (windowMs <= 0) {
            throw new IllegalArgumentException("windowMs must be positive (current: " + windowMs + ")");
        }
    }

    public static RateLimitWindowConfig of(int maxRequests, long windowMs) {
        return new RateLimitWindowConfig(maxRequests, windowMs);
    }
}
