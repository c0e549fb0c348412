package com.ryuqq.jukebox.core.clock;

/**
 * 시스템 시계 구현.
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public final class SystemClock implements Clock {

    /**
     * 공유 인스턴스 (상태 없음).
     */
    public static final SystemClock INSTANCE = new SystemClock();

    private SystemClock() {
    }

    @Override
    public long currentTimeMillis() {
        return System.currentTimeMillis();
    }
}
