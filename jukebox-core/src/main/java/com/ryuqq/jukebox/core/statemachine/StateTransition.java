package com.ryuqq.jukebox.core.statemachine;

/**
 * 작업 상태 전이 검증 및 실행.
 *
 * <p>RequestQueue는 작업 상태를 바꿀 때마다 이 클래스를 거치며,
 * 허용되지 않은 전이는 구현 버그로 간주하여 즉시 실패시킵니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태(SUCCEEDED, FAILED)에서는 어떤 상태로도 전이 불가</li>
 *   <li>재시도 작업은 반드시 PENDING을 거쳐 다시 dispatch됨</li>
 * </ul>
 *
 * @author Jukebox Team
 * @since 1.0.0
 * @see WorkItemState
 */
public final class StateTransition {

    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(WorkItemState from, WorkItemState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case PENDING -> to == WorkItemState.DISPATCHING || to == WorkItemState.FAILED;
            case DISPATCHING -> to == WorkItemState.SUCCEEDED
                || to == WorkItemState.RETRYING
                || to == WorkItemState.FAILED;
            case RETRYING -> to == WorkItemState.PENDING || to == WorkItemState.FAILED;
            case SUCCEEDED, FAILED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static WorkItemState transition(WorkItemState current, WorkItemState next) {
        validate(current, next);
        return next;
    }
}
