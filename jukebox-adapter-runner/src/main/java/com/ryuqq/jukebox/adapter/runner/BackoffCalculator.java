package com.ryuqq.jukebox.adapter.runner;

import java.util.concurrent.ThreadLocalRandom;

/**
 * 재시도 지연 계산기 (Exponential Backoff, 선택적 Jitter).
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(baseDelay * 2^(retryCount-1) + jitter, maxDelay)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=1000ms, jitterFactor=0.0):</strong></p>
 * <ul>
 *   <li>retryCount=1: 1000ms</li>
 *   <li>retryCount=2: 2000ms</li>
 *   <li>retryCount=3: 4000ms</li>
 *   <li>retryCount=6: 32000ms → maxDelay=30000ms로 제한</li>
 * </ul>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private static final int MAX_SHIFT = 30;

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;

    /**
     * 기본 설정으로 생성.
     *
     * <p>기본값: baseDelay=1000ms, maxDelay=30000ms, jitterFactor=0.0</p>
     */
    public BackoffCalculator() {
        this(1000, 30000, 0.0);
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param baseDelayMs 기본 지연 시간 (밀리초, 양수여야 함)
     * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상이어야 함)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }

        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param retryCount 이번 재시도 번호 (1부터 시작)
     * @return 재시도 전 대기 시간 (밀리초)
     * @throws IllegalArgumentException retryCount가 양수가 아닌 경우
     */
    public long calculate(int retryCount) {
        if (retryCount <= 0) {
            throw new IllegalArgumentException(
                "retryCount must be positive (current: " + retryCount + ")"
            );
        }

        // shift 상한으로 overflow 방지
        int shift = Math.min(retryCount - 1, MAX_SHIFT);
        long exponential = Math.min(baseDelayMs * (1L << shift), maxDelayMs);

        long jitter = jitterFactor == 0.0
            ? 0L
            : (long) (exponential * jitterFactor * ThreadLocalRandom.current().nextDouble());

        return Math.min(exponential + jitter, maxDelayMs);
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
