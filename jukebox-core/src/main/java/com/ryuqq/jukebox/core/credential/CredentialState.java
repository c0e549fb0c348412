package com.ryuqq.jukebox.core.credential;

import java.util.List;

/**
 * 재시작 간 유지되는 자격 증명 상태 스냅샷.
 *
 * @param activeKey 마지막으로 선택된 키 (없으면 null)
 * @param rotationHistory 교체 이력 (최신순)
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public record CredentialState(
    String activeKey,
    List<RotationEvent> rotationHistory
) {

    private static final CredentialState EMPTY = new CredentialState(null, List.of());

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException rotationHistory가 null인 경우
     */
    public CredentialState {
        if (rotationHistory == null) {
            throw new IllegalArgumentException("rotationHistory cannot be null");
        }
        rotationHistory = List.copyOf(rotationHistory);
        // activeKey는 null 허용 (선택 없음)
    }

    /**
     * 초기 상태 (선택 없음, 이력 없음).
     *
     * @return 빈 상태
     */
    public static CredentialState empty() {
        return EMPTY;
    }

    public boolean hasActiveKey() {
        return activeKey != null && !activeKey.isBlank();
    }
}
