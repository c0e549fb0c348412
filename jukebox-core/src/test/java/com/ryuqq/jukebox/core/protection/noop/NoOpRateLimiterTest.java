package com.ryuqq.jukebox.core.protection.noop;

import com.ryuqq.jukebox.core.model.ServiceName;
import com.ryuqq.jukebox.core.protection.RateLimitWindowConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NoOpRateLimiter 테스트.
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
class NoOpRateLimiterTest {

    @Test
    void canMakeRequest_AlwaysReturnsTrue() {
        // Given
        NoOpRateLimiter limiter = new NoOpRateLimiter();

        // When & Then
        for (int i = 0; i < 1_000; i++) {
            assertTrue(limiter.canMakeRequest(ServiceName.YOUTUBE_API));
        }
        assertEquals(Duration.ZERO, limiter.getWaitTime(ServiceName.YOUTUBE_API));
        assertFalse(limiter.getRequestCount(ServiceName.YOUTUBE_API).isFull());
        assertTrue(limiter.getAllStatuses().isEmpty());
    }

    @Test
    void windowConfig_NonPositiveValues_ThrowException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> RateLimitWindowConfig.of(0, 1000));
        assertThrows(IllegalArgumentException.class, () -> RateLimitWindowConfig.of(1, 0));
        assertEquals(10, RateLimitWindowConfig.DEFAULT.maxRequests());
    }
}
