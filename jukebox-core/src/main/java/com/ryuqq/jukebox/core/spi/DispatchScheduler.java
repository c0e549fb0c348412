package com.ryuqq.jukebox.core.spi;

/**
 * Scheduler SPI on which the request queue's drain loop runs.
 *
 * <p>All drain-loop work (dispatch decisions, completion handling, retry re-queueing)
 * is submitted through this interface so that it executes on a single logical thread.
 * Executor completions hop back onto the scheduler before touching queue state.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Serial: tasks never run concurrently with one another</li>
 *   <li>Non-blocking: {@link #execute} and {@link #schedule} return immediately</li>
 *   <li>Thread-safe submission: callers may submit from any thread</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * scheduler.execute(this::drain);             // as soon as possible
 * scheduler.schedule(this::drain, 2000L);     // after the limiter's wait time
 * </pre>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public interface DispatchScheduler {

    /**
     * Submits a task for execution as soon as possible.
     *
     * @param task the task to run
     * @throws IllegalArgumentException if task is null
     */
    void execute(Runnable task);

    /**
     * Submits a task for execution after the given delay.
     *
     * @param task the task to run
     * @param delayMs delay in milliseconds (0 for immediate)
     * @throws IllegalArgumentException if task is null or delayMs is negative
     */
    void schedule(Runnable task, long delayMs);

    /**
     * Stops accepting tasks and discards pending delayed tasks.
     */
    void shutdown();
}
