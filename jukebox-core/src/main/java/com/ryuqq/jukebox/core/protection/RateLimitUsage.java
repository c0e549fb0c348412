package com.ryuqq.jukebox.core.protection;

import java.time.Duration;

/**
 * 윈도우 사용량 스냅샷.
 *
 * @param current 윈도우 내 요청 수
 * @param max 윈도우 최대 요청 수
 * @param waitTime 다음 요청까지 대기 시간
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public record RateLimitUsage(int current, int max, Duration waitTime) {

    public RateLimitUsage {
        if (current < 0) {
            throw new IllegalArgumentException("current cannot be negative (current: " + current + ")");
        }
        if (max <= 0) {
            throw new IllegalArgumentException("max must be positive (current: " + max + ")");
        }
        if (waitTime == null) {
            throw new IllegalArgumentException("waitTime cannot be null");
        }
    }

    public boolean isFull() {
        return current >= max;
    }
}
