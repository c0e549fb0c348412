package com.ryuqq.jukebox.adapter.inmemory.ratelimit;

import com.ryuqq.jukebox.core.model.ServiceName;
import com.ryuqq.jukebox.core.protection.RateLimitWindowConfig;

import java.util.HashMap;
import java.util.Map;

/**
 * 서비스별 rate limit 설정.
 *
 * <p><strong>기본 설정:</strong></p>
 * <ul>
 *   <li>youtube-scraper: 10 req / 60s</li>
 *   <li>youtube-api: 100 req / 60s</li>
 *   <li>search: 20 req / 60s</li>
 *   <li>playlist: 5 req / 300s</li>
 *   <li>그 외: 10 req / 60s</li>
 * </ul>
 *
 * @param limits 서비스 → 윈도우 설정
 * @param defaultLimit 등록되지 않은 서비스의 윈도우 설정
 * @author Jukebox Team
 * @since 1.0.0
 */
public record ServiceLimits(Map<ServiceName, RateLimitWindowConfig> limits, RateLimitWindowConfig defaultLimit) {

    public ServiceLimits {
        if (limits == null) {
            throw new IllegalArgumentException("limits cannot be null");
        }
        if (defaultLimit == null) {
            throw new IllegalArgumentException("defaultLimit cannot be null");
        }
        limits = Map.copyOf(limits);
    }

    /**
     * 기본 설정으로 생성.
     */
    public ServiceLimits() {
        this(
            Map.of(
                ServiceName.YOUTUBE_SCRAPER, RateLimitWindowConfig.of(10, 60_000L),
                ServiceName.YOUTUBE_API, RateLimitWindowConfig.of(100, 60_000L),
                ServiceName.SEARCH, RateLimitWindowConfig.of(20, 60_000L),
                ServiceName.PLAYLIST, RateLimitWindowConfig.of(5, 300_000L)
            ),
            RateLimitWindowConfig.DEFAULT
        );
    }

    /**
     * 서비스의 윈도우 설정 조회.
     *
     * @param serviceName 서비스
     * @return 등록된 설정, 없으면 기본 설정
     */
    public RateLimitWindowConfig limitFor(ServiceName serviceName) {
        return limits.getOrDefault(serviceName, defaultLimit);
    }

    /**
     * 특정 서비스 설정을 추가/변경한 사본 생성.
     *
     * @param serviceName 서비스
     * @param config 윈도우 설정
     * @return 새 ServiceLimits
     */
    public ServiceLimits withLimit(ServiceName serviceName, RateLimitWindowConfig config) {
        if (serviceName == null || config == null) {
            throw new IllegalArgumentException("serviceName and config cannot be null");
        }
        Map<ServiceName, RateLimitWindowConfig> copy = new HashMap<>(limits);
        copy.put(serviceName, config);
        return new ServiceLimits(copy, defaultLimit);
    }

    public ServiceLimits withDefaultLimit(RateLimitWindowConfig defaultLimit) {
        return new ServiceLimits(limits, defaultLimit);
    }
}
