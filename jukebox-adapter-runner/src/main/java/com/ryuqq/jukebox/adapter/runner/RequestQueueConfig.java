package com.ryuqq.jukebox.adapter.runner;

/**
 * PriorityRequestQueue 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxRetries: 첫 시도 이후 최대 재시도 횟수 (기본 3)</li>
 *   <li>baseRetryDelayMs: 첫 재시도 지연 (기본 1000ms, 이후 2배씩 증가)</li>
 *   <li>maxRetryDelayMs: 재시도 지연 상한 (기본 30000ms)</li>
 *   <li>jitterFactor: 지연에 더할 무작위 비율 (기본 0.0)</li>
 * </ul>
 *
 * <p>기본값에서 재시도 지연은 1초, 2초, 4초입니다.</p>
 *
 * @author Jukebox Team
 * @since 1.0.0
 * @param maxRetries 최대 재시도 횟수 (0 이상)
 * @param baseRetryDelayMs 기본 지연 (밀리초, 양수)
 * @param maxRetryDelayMs 최대 지연 (밀리초, baseRetryDelayMs 이상)
 * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
 */
public record RequestQueueConfig(
    int maxRetries,
    long baseRetryDelayMs,
    long maxRetryDelayMs,
    double jitterFactor
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxRetries=3, baseRetryDelayMs=1000ms, maxRetryDelayMs=30000ms, jitterFactor=0.0</p>
     */
    public RequestQueueConfig() {
        this(3, 1000, 30000, 0.0);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RequestQueueConfig {
        if (maxRetries < 0) {
            throw new IllegalArgumentException(
                "maxRetries cannot be negative (current: " + maxRetries + ")"
            );
        }
        if (baseRetryDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseRetryDelayMs must be positive (current: " + baseRetryDelayMs + ")"
            );
        }
        if (maxRetryDelayMs < baseRetryDelayMs) {
            throw new IllegalArgumentException(
                "maxRetryDelayMs must be >= baseRetryDelayMs (base: " + baseRetryDelayMs + ", max: " + maxRetryDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
    }

    public RequestQueueConfig withMaxRetries(int maxRetries) {
        return new RequestQueueConfig(maxRetries, baseRetryDelayMs, maxRetryDelayMs, jitterFactor);
    }

    public RequestQueueConfig withBaseRetryDelayMs(long baseRetryDelayMs) {
        return new RequestQueueConfig(maxRetries, baseRetryDelayMs, maxRetryDelayMs, jitterFactor);
    }

    public RequestQueueConfig withMaxRetryDelayMs(long maxRetryDelayMs) {
        return new RequestQueueConfig(maxRetries, baseRetryDelayMs, maxRetryDelayMs, jitterFactor);
    }

    public RequestQueueConfig withJitterFactor(double jitterFactor) {
        return new RequestQueueConfig(maxRetries, baseRetryDelayMs, maxRetryDelayMs, jitterFactor);
    }

    /**
     * 이 설정으로 BackoffCalculator 생성.
     *
     * @return BackoffCalculator
     */
    public BackoffCalculator backoffCalculator() {
        return new BackoffCalculator(baseRetryDelayMs, maxRetryDelayMs, jitterFactor);
    }
}
