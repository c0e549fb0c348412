package com.ryuqq.jukebox.core.failure;

/**
 * 원시 오류 → {@link FailureKind} 매핑 SPI.
 *
 * <p>RequestQueue는 executor 실패를 관측한 직후 한 번만 이 분류기를 호출하며,
 * 이후 로직은 분류 결과만 사용합니다.</p>
 *
 * @author Jukebox Team
 * @since 1.0.0
 * @see DefaultFailureClassifier
 */
@FunctionalInterface
public interface FailureClassifier {

    /**
     * 오류 분류.
     *
     * @param error executor가 던진 오류 (CompletionException 래핑 가능)
     * @return 분류 결과
     */
    FailureKind classify(Throwable error);
}
