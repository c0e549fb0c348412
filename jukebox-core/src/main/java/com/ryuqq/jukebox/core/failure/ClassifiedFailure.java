package com.ryuqq.jukebox.core.failure;

import com.ryuqq.jukebox.core.model.DedupKey;
import com.ryuqq.jukebox.core.model.ServiceName;

/**
 * 분류된 실패 (RequestQueue → FailureListener 전달용).
 *
 * @param kind 실패 분류
 * @param serviceName 실패한 요청의 서비스
 * @param dedupKey 실패한 요청의 키
 * @param attempt 실패한 시도 번호 (1부터)
 * @param cause 원본 오류 (호출자에게는 이 값이 그대로 전달됨)
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public record ClassifiedFailure(
    FailureKind kind,
    ServiceName serviceName,
    DedupKey dedupKey,
    int attempt,
    Throwable cause
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 attempt가 1 미만인 경우
     */
    public ClassifiedFailure {
        if (kind == null || serviceName == null || dedupKey == null || cause == null) {
            throw new IllegalArgumentException("All fields are required for ClassifiedFailure");
        }
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
    }

    public boolean isQuotaExhausted() {
        return kind == FailureKind.QUOTA_EXHAUSTED;
    }
}
