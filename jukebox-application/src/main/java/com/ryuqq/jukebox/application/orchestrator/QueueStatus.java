package com.ryuqq.jukebox.application.orchestrator;

/**
 * 대기열 상태 스냅샷.
 *
 * @param queueLength dispatch를 기다리는 작업 수
 * @param activeRequests 예약된 DedupKey 수 (대기 + 실행 + 재시도 대기)
 * @param processing drain loop 실행 여부
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public record QueueStatus(int queueLength, int activeRequests, boolean processing) {

    public QueueStatus {
        if (queueLength < 0 || activeRequests < 0) {
            throw new IllegalArgumentException(
                "counts cannot be negative (queueLength: " + queueLength + ", activeRequests: " + activeRequests + ")"
            );
        }
    }

    public boolean isIdle() {
        return activeRequests == 0 && !processing;
    }
}
