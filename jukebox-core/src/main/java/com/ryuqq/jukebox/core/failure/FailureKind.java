package com.ryuqq.jukebox.core.failure;

/**
 * 실패 분류 태그.
 *
 * <p>업스트림 오류는 경계에서 한 번만 이 태그로 매핑되며,
 * 이후의 재시도 / 교체 / 실패 판단은 모두 태그로만 분기합니다.</p>
 *
 * <pre>
 * DUPLICATE_IN_PROGRESS   → 두 번째 호출자에게만 즉시 전달, 재시도 없음
 * RATE_LIMITED            → 재시도 가능 (내부 admission 거부는 호출자에게 노출되지 않음)
 * TRANSIENT               → 지수 백오프로 재시도
 * QUOTA_EXHAUSTED         → TRANSIENT의 하위 유형, 자격 증명 교체 후 재시도
 * NO_CREDENTIAL_AVAILABLE → 종료 상태, 사용자 설정 필요
 * </pre>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public enum FailureKind {

    DUPLICATE_IN_PROGRESS(false),

    RATE_LIMITED(true),

    TRANSIENT(true),

    QUOTA_EXHAUSTED(true),

    NO_CREDENTIAL_AVAILABLE(false);

    private final boolean retryable;

    FailureKind(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * RequestQueue가 재시도해도 되는 실패인지 확인.
     *
     * @return 재시도 가능하면 true
     */
    public boolean isRetryable() {
        return retryable;
    }
}
