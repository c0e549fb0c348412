package com.ryuqq.jukebox.core.statemachine;

/**
 * 대기열 작업(WorkItem)의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>PENDING → DISPATCHING (admission 통과, executor 호출)</li>
 *   <li>DISPATCHING → SUCCEEDED (성공)</li>
 *   <li>DISPATCHING → RETRYING (재시도 가능한 실패, 백오프 대기)</li>
 *   <li>DISPATCHING → FAILED (재시도 소진 또는 종료 실패)</li>
 *   <li>RETRYING → PENDING (백오프 경과, 대기열 재진입)</li>
 *   <li>PENDING / RETRYING → FAILED (큐 clear)</li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING ◄──────────┐
 *    │               │ (백오프 경과)
 *    ▼ (dispatch)    │
 * DISPATCHING ──► RETRYING
 *    │
 *    ├─► SUCCEEDED
 *    │
 *    └─► FAILED
 *
 * 금지된 전이:
 * - SUCCEEDED → * ❌
 * - FAILED → * ❌
 * - PENDING → SUCCEEDED ❌
 * - RETRYING → DISPATCHING ❌ (반드시 PENDING을 거쳐 우선순위 정렬 대상이 됨)
 * </pre>
 *
 * <p>rate limit으로 거부된 작업은 상태를 바꾸지 않고 PENDING으로 대기열 맨 앞에 남습니다.</p>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public enum WorkItemState {

    /**
     * 대기열에서 dispatch를 기다리는 중.
     */
    PENDING,

    /**
     * executor 실행 중.
     */
    DISPATCHING,

    /**
     * 백오프 지연 후 재진입 대기 중 (DedupKey 예약 유지).
     */
    RETRYING,

    /**
     * 성공 완료.
     */
    SUCCEEDED,

    /**
     * 실패 완료 (영구).
     */
    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * @return SUCCEEDED 또는 FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
