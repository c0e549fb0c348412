package com.ryuqq.jukebox.application.credential;

import com.ryuqq.jukebox.core.credential.Credential;
import com.ryuqq.jukebox.core.credential.RotationEvent;

import java.util.List;
import java.util.Optional;

/**
 * API 자격 증명 풀.
 *
 * <p>여러 API Key와 각 키의 관측된 쿼터 사용률을 보관하고,
 * 사용할 키를 선택하거나 교체(rotation)합니다.</p>
 *
 * <p><strong>선택 규칙:</strong></p>
 * <ol>
 *   <li>현재 활성 키의 사용률이 임계치(기본 90%) 미만이면 그대로 유지</li>
 *   <li>아니면 형식이 유효한 키 중 사용률이 가장 낮은 키 선택 (동률이면 설정 순서)</li>
 *   <li>후보가 없으면 empty (사용자 설정 필요)</li>
 * </ol>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>활성 키는 항상 알려진 키 집합의 원소이거나 "선택 없음"</li>
 *   <li>교체 이력은 최신순, 최대 10건, 추가만 가능</li>
 *   <li>선택 결과가 바뀌지 않으면 이력이 추가되지 않음</li>
 * </ul>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public interface CredentialPool {

    /**
     * 사용할 자격 증명 선택 (상태 변경 없음).
     *
     * @return 선택된 자격 증명, 후보가 없으면 empty
     */
    Optional<Credential> selectActive();

    /**
     * 자격 증명 교체.
     *
     * <p>{@link #selectActive()} 결과가 현재 활성 키와 다르면 활성 키를 바꾸고
     * 교체 이력을 남깁니다. 같으면 아무것도 바꾸지 않고 empty를 반환합니다.</p>
     *
     * @param reason 교체 사유 (예: "quota exhausted")
     * @return 교체 이벤트, 변경이 없으면 empty
     * @throws com.ryuqq.jukebox.core.failure.NoCredentialAvailableException 사용 가능한 키가 없는 경우
     */
    Optional<RotationEvent> rotate(String reason);

    /**
     * 모든 키의 쿼터 사용률을 QuotaProbe로 갱신.
     *
     * <p>probe 실패는 0%로 취급합니다.</p>
     */
    void refreshQuota();

    /**
     * 현재 활성 자격 증명.
     *
     * @return 활성 자격 증명, 선택 없으면 empty
     */
    Optional<Credential> activeCredential();

    /**
     * 관리자가 직접 활성 키 지정.
     *
     * @param key 알려진 키 중 하나
     * @return 교체 이벤트, 이미 활성 키이면 empty
     * @throws IllegalArgumentException 알려지지 않은 키인 경우
     */
    Optional<RotationEvent> setActive(String key);

    /**
     * 알려진 자격 증명 목록 (설정 순서).
     *
     * @return 자격 증명 목록 (읽기 전용)
     */
    List<Credential> getCredentials();

    /**
     * 교체 이력 (최신순).
     *
     * @return 이력 목록 (읽기 전용)
     */
    List<RotationEvent> getRotationHistory();

    /**
     * 사용자가 새 키를 입력해야 하는지 확인.
     *
     * @return 형식이 유효한 키가 하나도 없으면 true
     */
    boolean requiresManualConfiguration();
}
