package com.ryuqq.jukebox.application.orchestrator;

import com.ryuqq.jukebox.core.failure.ClassifiedFailure;

/**
 * 요청 실패 관찰자.
 *
 * <p>RequestQueue는 executor가 실패할 때마다(재시도 여부 결정 전) 등록된 리스너를
 * drain loop 스레드에서 호출합니다. 따라서 리스너가 수행한 부수효과
 * (예: 자격 증명 교체)는 다음 시도에 반영됩니다.</p>
 *
 * <p>리스너가 던진 예외는 로그만 남기고 무시되며 대기열 처리를 멈추지 않습니다.</p>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface FailureListener {

    /**
     * 실패 통지.
     *
     * @param failure 분류된 실패
     */
    void onFailure(ClassifiedFailure failure);
}
