package com.ryuqq.jukebox.core.failure;

/**
 * 요청 계층 예외의 공통 상위 타입.
 *
 * <p>모든 하위 예외는 {@link FailureKind} 태그를 가지므로
 * 호출자가 "나중에 다시 시도"와 "사용자에게 설정 요청"을 구분할 수 있습니다.</p>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public class JukeboxException extends RuntimeException {

    private final FailureKind kind;

    public JukeboxException(FailureKind kind, String message) {
        super(message);
        this.kind = requireKind(kind);
    }

    public JukeboxException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = requireKind(kind);
    }

    private static FailureKind requireKind(FailureKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        return kind;
    }

    /**
     * 실패 분류 태그 조회.
     *
     * @return FailureKind
     */
    public FailureKind getKind() {
        return kind;
    }
}
