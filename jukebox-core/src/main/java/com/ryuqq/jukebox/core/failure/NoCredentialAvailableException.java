package com.ryuqq.jukebox.core.failure;

/**
 * 사용 가능한 자격 증명이 없음 (종료 상태).
 *
 * <p>재시도해도 해결되지 않으므로 RequestQueue는 이 실패를 재시도하지 않습니다.
 * UI는 새 API Key 입력을 요청해야 합니다.</p>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public class NoCredentialAvailableException extends JukeboxException {

    public NoCredentialAvailableException(String message) {
        super(FailureKind.NO_CREDENTIAL_AVAILABLE, message);
    }
}
