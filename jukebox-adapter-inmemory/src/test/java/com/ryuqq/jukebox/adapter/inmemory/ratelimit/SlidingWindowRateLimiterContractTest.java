package com.ryuqq.jukebox.adapter.inmemory.ratelimit;

import com.ryuqq.jukebox.core.clock.Clock;
import com.ryuqq.jukebox.core.model.ServiceName;
import com.ryuqq.jukebox.core.protection.RateLimitWindowConfig;
import com.ryuqq.jukebox.core.protection.RateLimiter;
import com.ryuqq.jukebox.testkit.contract.AbstractRateLimiterContractTest;

import java.util.Map;

/**
 * {@link SlidingWindowRateLimiter}의 RateLimiter 계약 테스트.
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
class SlidingWindowRateLimiterContractTest extends AbstractRateLimiterContractTest {

    @Override
    protected RateLimiter createLimiter(
        Map<ServiceName, RateLimitWindowConfig> limits,
        RateLimitWindowConfig defaultLimit,
        Clock clock
    ) {
        return new SlidingWindowRateLimiter(new ServiceLimits(limits, defaultLimit), clock);
    }
}
