package com.ryuqq.jukebox.adapter.runner;

import com.ryuqq.jukebox.core.spi.DispatchScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 단일 daemon 스레드 위에서 drain loop를 실행하는 {@link DispatchScheduler}.
 *
 * <p>모든 작업이 같은 스레드에서 순서대로 실행되므로, 큐의 dispatch 로직은
 * 협력적 단일 스레드 모델로 동작합니다. 종료 후 제출은
 * {@link java.util.concurrent.RejectedExecutionException}으로 거부됩니다.</p>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public final class SingleThreadDispatchScheduler implements DispatchScheduler {

    private static final Logger log = LoggerFactory.getLogger(SingleThreadDispatchScheduler.class);

    private static final String THREAD_NAME = "jukebox-dispatch";
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final ScheduledExecutorService executor;

    public SingleThreadDispatchScheduler() {
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, THREAD_NAME);
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public void execute(Runnable task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        executor.execute(guarded(task));
    }

    @Override
    public void schedule(Runnable task, long delayMs) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs cannot be negative (current: " + delayMs + ")");
        }
        executor.schedule(guarded(task), delayMs, TimeUnit.MILLISECONDS);
    }

    /**
     * 스케줄러 종료.
     *
     * <p>대기 중인 지연 작업은 버리고, 실행 중인 작업은 최대 5초 기다립니다.</p>
     */
    @Override
    public void shutdown() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Dispatch thread did not stop within {}s", SHUTDOWN_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping dispatch thread");
        }
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    /**
     * 작업 예외가 스케줄러 스레드를 조용히 멈추지 않도록 로그로 남김.
     */
    private static Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Dispatch task failed", e);
            }
        };
    }
}
