package com.ryuqq.jukebox.core.credential;

import java.time.Instant;

/**
 * 자격 증명 교체 이력 항목.
 *
 * <p>관측(observability) 목적이며 정확성에는 필요하지 않습니다.
 * 키는 비밀값이므로 마스킹된 형태(마지막 8자)로만 기록합니다.</p>
 *
 * @param timestamp 교체 시각
 * @param fromKey 이전 키 (마스킹, 선택된 키가 없었으면 "none")
 * @param toKey 새 키 (마스킹)
 * @param reason 교체 사유 (예: "quota exhausted")
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public record RotationEvent(
    Instant timestamp,
    String fromKey,
    String toKey,
    String reason
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 reason이 빈 문자열인 경우
     */
    public RotationEvent {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (fromKey == null || toKey == null) {
            throw new IllegalArgumentException("fromKey and toKey cannot be null");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
    }

    /**
     * 원본 키로부터 마스킹된 이벤트 생성.
     *
     * @param timestamp 교체 시각
     * @param fromKey 이전 원본 키 (null 허용)
     * @param toKey 새 원본 키
     * @param reason 사유
     * @return RotationEvent
     */
    public static RotationEvent of(Instant timestamp, String fromKey, String toKey, String reason) {
        if (toKey == null) {
            throw new IllegalArgumentException("toKey cannot be null");
        }
        return new RotationEvent(timestamp, Credential.mask(fromKey), Credential.mask(toKey), reason);
    }
}
