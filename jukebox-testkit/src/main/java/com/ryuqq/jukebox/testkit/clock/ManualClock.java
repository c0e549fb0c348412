package com.ryuqq.jukebox.testkit.clock;

import com.ryuqq.jukebox.core.clock.Clock;

/**
 * Clock that only moves when a test moves it.
 *
 * <p>Shared between the rate limiter, the response cache and
 * {@link com.ryuqq.jukebox.testkit.scheduler.ManualDispatchScheduler} so that window
 * expiry, TTL expiry and delayed tasks all follow the same timeline.</p>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public final class ManualClock implements Clock {

    private long nowMillis;

    public ManualClock(long startMillis) {
        this.nowMillis = startMillis;
    }

    @Override
    public synchronized long currentTimeMillis() {
        return nowMillis;
    }

    /**
     * Moves the clock forward.
     *
     * @param deltaMillis milliseconds to advance (not negative)
     * @throws IllegalArgumentException if deltaMillis is negative
     */
    public synchronized void advanceMillis(long deltaMillis) {
        if (deltaMillis < 0) {
            throw new IllegalArgumentException("deltaMillis cannot be negative (current: " + deltaMillis + ")");
        }
        nowMillis += deltaMillis;
    }

    /**
     * Sets the clock. Time never goes backwards.
     *
     * @param millis new time
     * @throws IllegalArgumentException if millis is before the current time
     */
    public synchronized void setMillis(long millis) {
        if (millis < nowMillis) {
            throw new IllegalArgumentException("Clock cannot go backwards (now: " + nowMillis + ", requested: " + millis + ")");
        }
        nowMillis = millis;
    }
}
