package com.ryuqq.jukebox.testkit.scheduler;

import com.ryuqq.jukebox.core.spi.DispatchScheduler;
import com.ryuqq.jukebox.testkit.clock.ManualClock;

import java.util.ArrayList;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Deterministic {@link DispatchScheduler} driven by a {@link ManualClock}.
 *
 * <p>Nothing runs until the test calls {@link #runUntilIdle()}, {@link #advanceBy(long)}
 * or {@link #advanceToNextTask()}. Tasks run on the calling thread, in due-time order,
 * FIFO among tasks with the same due time.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * ManualClock clock = new ManualClock(0);
 * ManualDispatchScheduler scheduler = new ManualDispatchScheduler(clock);
 *
 * queue.enqueue(...);
 * scheduler.runUntilIdle();          // first attempt runs
 * scheduler.advanceBy(1_000);        // retry after 1s backoff runs
 * assertEquals(List.of(1000L), scheduler.getScheduledDelays());
 * </pre>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public final class ManualDispatchScheduler implements DispatchScheduler {

    private final ManualClock clock;
    private final PriorityQueue<ScheduledTask> tasks = new PriorityQueue<>();
    private final List<Long> scheduledDelays = new ArrayList<>();
    private long sequence;
    private boolean shutdown;

    public ManualDispatchScheduler(ManualClock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    public synchronized void execute(Runnable task) {
        submit(task, 0L);
    }

    @Override
    public synchronized void schedule(Runnable task, long delayMs) {
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs cannot be negative (current: " + delayMs + ")");
        }
        if (delayMs > 0) {
            scheduledDelays.add(delayMs);
        }
        submit(task, delayMs);
    }

    @Override
    public synchronized void shutdown() {
        shutdown = true;
        tasks.clear();
    }

    /**
     * Runs every task that is due now, including tasks they submit, until none is due.
     *
     * @return number of tasks run
     */
    public int runUntilIdle() {
        int ran = 0;
        Runnable next;
        while ((next = pollDue(clock.currentTimeMillis())) != null) {
            next.run();
            ran++;
        }
        return ran;
    }

    /**
     * Advances the clock step by step to {@code now + deltaMs}, running each task at its due time.
     *
     * @param deltaMs milliseconds to advance
     * @return number of tasks run
     */
    public int advanceBy(long deltaMs) {
        if (deltaMs < 0) {
            throw new IllegalArgumentException("deltaMs cannot be negative (current: " + deltaMs + ")");
        }
        long target = clock.currentTimeMillis() + deltaMs;
        int ran = runUntilIdle();
        Long nextDue;
        while ((nextDue = nextDueAt()) != null && nextDue <= target) {
            clock.setMillis(Math.max(clock.currentTimeMillis(), nextDue));
            ran += runUntilIdle();
        }
        clock.setMillis(target);
        return ran + runUntilIdle();
    }

    /**
     * Jumps the clock to the earliest pending task and runs everything due then.
     *
     * @return number of tasks run, 0 if nothing is pending
     */
    public int advanceToNextTask() {
        Long nextDue = nextDueAt();
        if (nextDue == null) {
            return 0;
        }
        clock.setMillis(Math.max(clock.currentTimeMillis(), nextDue));
        return runUntilIdle();
    }

    /**
     * Delays (ms) of every {@link #schedule} call with a positive delay, in call order.
     *
     * @return recorded delays
     */
    public synchronized List<Long> getScheduledDelays() {
        return List.copyOf(scheduledDelays);
    }

    public synchronized int pendingTaskCount() {
        return tasks.size();
    }

    public synchronized boolean isShutdown() {
        return shutdown;
    }

    private void submit(Runnable task, long delayMs) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        if (shutdown) {
            throw new IllegalStateException("Scheduler is shut down");
        }
        tasks.add(new ScheduledTask(clock.currentTimeMillis() + delayMs, sequence++, task));
    }

    private synchronized Runnable pollDue(long now) {
        ScheduledTask head = tasks.peek();
        if (head == null || head.dueAt() > now) {
            return null;
        }
        return tasks.poll().task();
    }

    private synchronized Long nextDueAt() {
        ScheduledTask head = tasks.peek();
        return head == null ? null : head.dueAt();
    }

    private record ScheduledTask(long dueAt, long sequence, Runnable task) implements Comparable<ScheduledTask> {

        @Override
        public int compareTo(ScheduledTask other) {
            int byDue = Long.compare(dueAt, other.dueAt);
            return byDue != 0 ? byDue : Long.compare(sequence, other.sequence);
        }
    }
}
