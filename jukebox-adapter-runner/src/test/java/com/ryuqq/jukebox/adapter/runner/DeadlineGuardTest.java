package com.ryuqq.jukebox.adapter.runner;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * DeadlineGuard 테스트.
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
@DisplayName("DeadlineGuard 테스트")
class DeadlineGuardTest {

    @Test
    @DisplayName("마감 전에 완료되면 원래 결과를 전달한다")
    void 마감_전_완료() {
        // given
        CompletableFuture<String> source = new CompletableFuture<>();
        CompletableFuture<String> guarded = DeadlineGuard.withDeadline(source, Duration.ofSeconds(5), "player initialization");

        // when
        source.complete("ready");

        // then
        assertThat(guarded.join()).isEqualTo("ready");
    }

    @Test
    @DisplayName("마감 전에 실패하면 원래 오류를 전달한다")
    void 마감_전_실패() {
        // given
        CompletableFuture<String> source = new CompletableFuture<>();
        CompletableFuture<String> guarded = DeadlineGuard.withDeadline(source, Duration.ofSeconds(5), "player initialization");
        IllegalStateException error = new IllegalStateException("player error");

        // when
        source.completeExceptionally(error);

        // then
        assertThat(guarded).failsWithin(Duration.ofSeconds(1))
            .withThrowableOfType(ExecutionException.class)
            .withCause(error);
    }

    @Test
    @DisplayName("마감까지 완료되지 않으면 TimeoutException으로 실패하고 원래 작업은 취소하지 않는다")
    void 마감_초과() {
        // given
        CompletableFuture<String> source = new CompletableFuture<>();

        // when
        CompletableFuture<String> guarded = DeadlineGuard.withDeadline(source, Duration.ofMillis(50), "player initialization");

        // then
        assertThat(guarded).failsWithin(Duration.ofSeconds(2))
            .withThrowableOfType(ExecutionException.class)
            .havingCause()
            .isInstanceOf(TimeoutException.class)
            .withMessageContaining("player initialization timed out after 50ms");
        assertThat(source).isNotDone();
    }

    @Test
    @DisplayName("timeout이 양수가 아니면 예외가 발생한다")
    void 잘못된_timeout() {
        CompletableFuture<String> source = new CompletableFuture<>();

        assertThatThrownBy(() -> DeadlineGuard.withDeadline(source, Duration.ZERO, "init"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("timeout");
        assertThatThrownBy(() -> DeadlineGuard.withDeadline(source, Duration.ofSeconds(1), " "))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
