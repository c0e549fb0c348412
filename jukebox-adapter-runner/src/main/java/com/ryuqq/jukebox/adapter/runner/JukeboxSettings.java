package com.ryuqq.jukebox.adapter.runner;

import com.ryuqq.jukebox.adapter.inmemory.cache.ResponseCacheConfig;
import com.ryuqq.jukebox.adapter.inmemory.credential.CredentialPoolConfig;
import com.ryuqq.jukebox.adapter.inmemory.ratelimit.ServiceLimits;

/**
 * {@link JukeboxContext} 구성 설정 (불변 record).
 *
 * <p>각 구성 요소의 설정을 한곳에 모읍니다. 검색 결과 캐시 TTL은
 * {@code cacheConfig.defaultTtl()}을 따릅니다.</p>
 *
 * @author Jukebox Team
 * @since 1.0.0
 * @param serviceLimits 서비스별 rate limit
 * @param cacheConfig 응답 캐시 설정
 * @param credentialPoolConfig 자격 증명 풀 설정
 * @param queueConfig 요청 대기열 설정
 */
public record JukeboxSettings(
    ServiceLimits serviceLimits,
    ResponseCacheConfig cacheConfig,
    CredentialPoolConfig credentialPoolConfig,
    RequestQueueConfig queueConfig
) {

    /**
     * 기본 설정 생성자.
     */
    public JukeboxSettings() {
        this(new ServiceLimits(), new ResponseCacheConfig(), new CredentialPoolConfig(), new RequestQueueConfig());
    }

    public JukeboxSettings {
        if (serviceLimits == null || cacheConfig == null || credentialPoolConfig == null || queueConfig == null) {
            throw new IllegalArgumentException("All settings are required for JukeboxSettings");
        }
    }

    public JukeboxSettings withServiceLimits(ServiceLimits serviceLimits) {
        return new JukeboxSettings(serviceLimits, cacheConfig, credentialPoolConfig, queueConfig);
    }

    public JukeboxSettings withCacheConfig(ResponseCacheConfig cacheConfig) {
        return new JukeboxSettings(serviceLimits, cacheConfig, credentialPoolConfig, queueConfig);
    }

    public JukeboxSettings withCredentialPoolConfig(CredentialPoolConfig credentialPoolConfig) {
        return new JukeboxSettings(serviceLimits, cacheConfig, credentialPoolConfig, queueConfig);
    }

    public JukeboxSettings withQueueConfig(RequestQueueConfig queueConfig) {
        return new JukeboxSettings(serviceLimits, cacheConfig, credentialPoolConfig, queueConfig);
    }
}
