package com.ryuqq.jukebox.core.protection.noop;

import com.ryuqq.jukebox.core.model.ServiceName;
import com.ryuqq.jukebox.core.protection.RateLimitUsage;
import com.ryuqq.jukebox.core.protection.RateLimiter;

import java.time.Duration;
import java.util.Map;

/**
 * Rate Limiter NoOp 구현.
 *
 * <p>모든 요청을 항상 허용합니다.
 * 로컬 개발이나 admission 제어 없이 큐 동작만 확인하고자 할 때 사용합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>canMakeRequest(): 항상 true 반환, 아무것도 기록하지 않음</li>
 *   <li>getWaitTime(): 항상 0 반환</li>
 *   <li>getAllStatuses(): 빈 Map 반환</li>
 * </ul>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public final class NoOpRateLimiter implements RateLimiter {

    private static final RateLimitUsage UNLIMITED = new RateLimitUsage(0, Integer.MAX_VALUE, Duration.ZERO);

    @Override
    public boolean canMakeRequest(ServiceName serviceName) {
        return true;
    }

    @Override
    public Duration getWaitTime(ServiceName serviceName) {
        return Duration.ZERO;
    }

    @Override
    public RateLimitUsage getRequestCount(ServiceName serviceName) {
        return UNLIMITED;
    }

    @Override
    public Map<ServiceName, RateLimitUsage> getAllStatuses() {
        return Map.of();
    }

    @Override
    public void clear(ServiceName serviceName) {
    }

    @Override
    public void clearAll() {
    }
}
