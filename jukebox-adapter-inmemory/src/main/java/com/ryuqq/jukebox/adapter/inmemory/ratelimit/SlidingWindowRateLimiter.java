package com.ryuqq.jukebox.adapter.inmemory.ratelimit;

import com.ryuqq.jukebox.core.clock.Clock;
import com.ryuqq.jukebox.core.model.ServiceName;
import com.ryuqq.jukebox.core.protection.RateLimitUsage;
import com.ryuqq.jukebox.core.protection.RateLimitWindowConfig;
import com.ryuqq.jukebox.core.protection.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 슬라이딩 윈도우(log) 기반 {@link RateLimiter} 구현.
 *
 * <p>서비스마다 허용된 요청의 타임스탬프를 보관하고, 조회 시점에
 * {@code timestamp <= now - windowMs}인 항목을 정리합니다.</p>
 *
 * <p><strong>Thread Safety:</strong></p>
 * <ul>
 *   <li>윈도우는 {@link ConcurrentHashMap#computeIfAbsent}로 원자적으로 생성</li>
 *   <li>윈도우 단위 연산은 윈도우 객체에 대해 synchronized</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * RateLimiter limiter = new SlidingWindowRateLimiter(new ServiceLimits(), SystemClock.INSTANCE);
 *
 * if (limiter.canMakeRequest(ServiceName.PLAYLIST)) {
 *     loadPlaylist();
 * } else {
 *     Duration wait = limiter.getWaitTime(ServiceName.PLAYLIST);
 * }
 * </pre>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public class SlidingWindowRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

    private final ServiceLimits serviceLimits;
    private final Clock clock;
    private final ConcurrentHashMap<ServiceName, SlidingWindow> windows = new ConcurrentHashMap<>();

    /**
     * 생성자.
     *
     * @param serviceLimits 서비스별 한도
     * @param clock 시간 소스
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public SlidingWindowRateLimiter(ServiceLimits serviceLimits, Clock clock) {
        if (serviceLimits == null) {
            throw new IllegalArgumentException("serviceLimits cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.serviceLimits = serviceLimits;
        this.clock = clock;
    }

    @Override
    public boolean canMakeRequest(ServiceName serviceName) {
        boolean allowed = windowFor(serviceName).tryRecord(clock.currentTimeMillis());
        if (!allowed) {
            log.warn("Rate limit reached for service: {}", serviceName);
        }
        return allowed;
    }

    @Override
    public Duration getWaitTime(ServiceName serviceName) {
        return Duration.ofMillis(windowFor(serviceName).waitTimeMs(clock.currentTimeMillis()));
    }

    @Override
    public RateLimitUsage getRequestCount(ServiceName serviceName) {
        return windowFor(serviceName).usage(clock.currentTimeMillis());
    }

    @Override
    public Map<ServiceName, RateLimitUsage> getAllStatuses() {
        long now = clock.currentTimeMillis();
        Map<ServiceName, RateLimitUsage> statuses = new LinkedHashMap<>();
        windows.forEach((serviceName, window) -> statuses.put(serviceName, window.usage(now)));
        return Collections.unmodifiableMap(statuses);
    }

    @Override
    public void clear(ServiceName serviceName) {
        requireServiceName(serviceName);
        SlidingWindow window = windows.get(serviceName);
        if (window != null) {
            window.clear();
            log.info("Rate limit window cleared for service: {}", serviceName);
        }
    }

    @Override
    public void clearAll() {
        windows.values().forEach(SlidingWindow::clear);
        log.info("All rate limit windows cleared");
    }

    private SlidingWindow windowFor(ServiceName serviceName) {
        requireServiceName(serviceName);
        return windows.computeIfAbsent(serviceName, name -> new SlidingWindow(serviceLimits.limitFor(name)));
    }

    private static void requireServiceName(ServiceName serviceName) {
        if (serviceName == null) {
            throw new IllegalArgumentException("serviceName cannot be null");
        }
    }

    /**
     * 단일 서비스의 타임스탬프 로그.
     */
    private static final class SlidingWindow {

        private final int maxRequests;
        private final long windowMs;
        private final ArrayDeque<Long> timestamps = new ArrayDeque<>();

        SlidingWindow(RateLimitWindowConfig config) {
            this.maxRequests = config.maxRequests();
            this.windowMs = config.windowMs();
        }

        synchronized boolean tryRecord(long now) {
            prune(now);
            if (timestamps.size() < maxRequests) {
                timestamps.addLast(now);
                return true;
            }
            return false;
        }

        synchronized long waitTimeMs(long now) {
            prune(now);
            if (timestamps.size() < maxRequests) {
                return 0L;
            }
            long oldest = timestamps.peekFirst();
            return Math.max(0L, (oldest + windowMs) - now);
        }

        synchronized RateLimitUsage usage(long now) {
            long waitMs = waitTimeMs(now);
            return new RateLimitUsage(timestamps.size(), maxRequests, Duration.ofMillis(waitMs));
        }

        synchronized void clear() {
            timestamps.clear();
        }

        private void prune(long now) {
            long cutoff = now - windowMs;
            while (!timestamps.isEmpty() && timestamps.peekFirst() <= cutoff) {
                timestamps.removeFirst();
            }
        }
    }
}
