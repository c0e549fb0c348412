package com.ryuqq.jukebox.core.protection;

import com.ryuqq.jukebox.core.model.ServiceName;

import java.time.Duration;
import java.util.Map;

/**
 * 서비스별 Rate Limiter SPI.
 *
 * <p>서비스마다 독립된 슬라이딩 윈도우를 유지하여 외부 API 과부하를 방지합니다.
 * 윈도우는 처음 참조될 때 생성되며, 알 수 없는 서비스는 기본 한도를 사용합니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>어떤 메서드도 블로킹하지 않음</li>
 *   <li>어떤 서비스 이름에 대해서도 예외를 던지지 않음 (null 제외)</li>
 *   <li>{@link #canMakeRequest}가 true를 반환하면 그 시점이 윈도우에 기록됨 (check-and-reserve)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * if (!limiter.canMakeRequest(ServiceName.YOUTUBE_API)) {
 *     Duration wait = limiter.getWaitTime(ServiceName.YOUTUBE_API);
 *     scheduler.schedule(this::drain, wait.toMillis());
 *     return;
 * }
 * executor.execute();
 * }</pre>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public interface RateLimiter {

    /**
     * 요청 허용 여부 확인 및 예약.
     *
     * <p>만료된 타임스탬프를 정리한 뒤 윈도우에 여유가 있으면 현재 시각을 기록하고
     * true를 반환합니다. 여유가 없으면 아무것도 기록하지 않고 false를 반환합니다.</p>
     *
     * @param serviceName 서비스
     * @return 허용되면 true
     */
    boolean canMakeRequest(ServiceName serviceName);

    /**
     * 다음 요청이 허용될 때까지의 대기 시간.
     *
     * @param serviceName 서비스
     * @return 대기 시간, 윈도우가 가득 차지 않았으면 {@link Duration#ZERO}
     */
    Duration getWaitTime(ServiceName serviceName);

    /**
     * 현재 윈도우 사용량.
     *
     * @param serviceName 서비스
     * @return 사용량 (현재 요청 수, 최대 요청 수, 대기 시간)
     */
    RateLimitUsage getRequestCount(ServiceName serviceName);

    /**
     * 지금까지 참조된 모든 서비스의 사용량.
     *
     * @return 서비스 → 사용량
     */
    Map<ServiceName, RateLimitUsage> getAllStatuses();

    /**
     * 특정 서비스의 윈도우 초기화.
     *
     * @param serviceName 서비스
     */
    void clear(ServiceName serviceName);

    /**
     * 모든 윈도우 초기화.
     */
    void clearAll();
}
