package com.ryuqq.jukebox.core.clock;

/**
 * 시간 소스 추상화.
 *
 * <p>슬라이딩 윈도우와 캐시 TTL 계산은 모두 이 인터페이스를 통해 현재 시각을 얻으므로,
 * 테스트에서는 수동으로 진행되는 시계로 교체할 수 있습니다.</p>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Clock {

    /**
     * 현재 시각 (epoch 밀리초).
     *
     * @return 현재 시각
     */
    long currentTimeMillis();
}
