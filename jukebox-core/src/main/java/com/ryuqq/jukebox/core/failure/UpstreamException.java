package com.ryuqq.jukebox.core.failure;

/**
 * 업스트림 호출 실패 (경계에서 분류 완료).
 *
 * <p>HTTP 어댑터처럼 원시 오류를 처음 관측하는 지점에서 생성되며,
 * 상태 코드와 분류 태그를 함께 보관합니다.</p>
 *
 * <p><strong>상태 코드 매핑 예시:</strong></p>
 * <ul>
 *   <li>403 → QUOTA_EXHAUSTED</li>
 *   <li>429 → RATE_LIMITED</li>
 *   <li>그 외 → TRANSIENT</li>
 * </ul>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public class UpstreamException extends JukeboxException {

    /**
     * 상태 코드가 없는 경우 (네트워크 오류 등).
     */
    public static final int NO_STATUS = -1;

    private final int statusCode;

    public UpstreamException(FailureKind kind, int statusCode, String message) {
        super(kind, message);
        this.statusCode = statusCode;
    }

    public UpstreamException(FailureKind kind, int statusCode, String message, Throwable cause) {
        super(kind, message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP 상태 코드 조회.
     *
     * @return 상태 코드, 없으면 {@link #NO_STATUS}
     */
    public int getStatusCode() {
        return statusCode;
    }
}
