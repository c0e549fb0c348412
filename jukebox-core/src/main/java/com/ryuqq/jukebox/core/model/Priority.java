package com.ryuqq.jukebox.core.model;

/**
 * 요청 우선순위.
 *
 * <p>RequestQueue는 매 dispatch 직전에 대기열을 우선순위로 안정 정렬합니다.
 * 같은 우선순위끼리는 도착 순서(FIFO)를 유지합니다.</p>
 *
 * <pre>
 * HIGH (3) &gt; NORMAL (2) &gt; LOW (1)
 * </pre>
 *
 * <p>재시도 대상이 된 요청은 {@link #LOW}로 강등되어, 실패 중인 요청이
 * 정상적인 HIGH 요청을 막지 않습니다.</p>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public enum Priority {

    /**
     * 사용자 검색 등 즉시 응답이 필요한 요청.
     */
    HIGH(3),

    /**
     * 기본 우선순위.
     */
    NORMAL(2),

    /**
     * 백그라운드 작업 및 재시도 요청.
     */
    LOW(1);

    private final int rank;

    Priority(int rank) {
        this.rank = rank;
    }

    /**
     * 정렬용 순위 값 (클수록 먼저 dispatch).
     *
     * @return 순위 값
     */
    public int rank() {
        return rank;
    }

    /**
     * 다른 우선순위보다 먼저 dispatch되어야 하는지 확인.
     *
     * @param other 비교 대상
     * @return this가 other보다 높은 경우 true
     */
    public boolean isHigherThan(Priority other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        return this.rank > other.rank;
    }
}
