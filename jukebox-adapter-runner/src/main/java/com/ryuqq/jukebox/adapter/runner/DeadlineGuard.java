package com.ryuqq.jukebox.adapter.runner;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 초기화 단계에 마감 시간을 거는 유틸리티.
 *
 * <p>큐의 재시도 타이머와 무관하게, 주어진 시간 안에 완료되지 않으면
 * {@link TimeoutException}으로 실패하는 새 future를 돌려줍니다.
 * 원래 작업은 취소하지 않습니다.</p>
 *
 * <pre>
 * DeadlineGuard.withDeadline(playerReady, Duration.ofSeconds(10), "player initialization")
 *     .exceptionally(...);
 * </pre>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public final class DeadlineGuard {

    private DeadlineGuard() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 마감 시간 적용.
     *
     * @param stage 감시할 작업
     * @param timeout 마감 시간 (양수)
     * @param label 오류 메시지에 넣을 작업 이름
     * @param <T> 결과 타입
     * @return 원래 결과 또는 TimeoutException으로 완료되는 future
     * @throws IllegalArgumentException 인자가 null이거나 timeout이 양수가 아닌 경우
     */
    public static <T> CompletableFuture<T> withDeadline(CompletionStage<T> stage, Duration timeout, String label) {
        if (stage == null) {
            throw new IllegalArgumentException("stage cannot be null");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("label cannot be null or blank");
        }

        CompletableFuture<T> guarded = new CompletableFuture<>();
        stage.whenComplete((value, error) -> {
            if (error != null) {
                guarded.completeExceptionally(error);
            } else {
                guarded.complete(value);
            }
        });

        CompletableFuture.delayedExecutor(timeout.toMillis(), TimeUnit.MILLISECONDS).execute(() ->
            guarded.completeExceptionally(
                new TimeoutException(label + " timed out after " + timeout.toMillis() + "ms")
            )
        );
        return guarded;
    }
}
