package com.ryuqq.jukebox.testkit.executor;

import com.ryuqq.jukebox.core.executor.RequestExecutor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * {@link RequestExecutor} that replays a scripted sequence of outcomes.
 *
 * <p>Each call to {@link #execute()} consumes the next outcome; once the script is used
 * up, the last outcome repeats.</p>
 *
 * <pre>
 * ScriptedExecutor&lt;String&gt; executor = ScriptedExecutor.&lt;String&gt;create()
 *     .thenFail(new RuntimeException("HTTP 503"))
 *     .thenSucceed("ok");
 * </pre>
 *
 * @param <T> result type
 * @author Jukebox Team
 * @since 1.0.0
 */
public final class ScriptedExecutor<T> implements RequestExecutor<T> {

    private final Deque<Supplier<CompletableFuture<T>>> script = new ArrayDeque<>();
    private final List<CompletableFuture<T>> pendingFutures = new ArrayList<>();
    private Supplier<CompletableFuture<T>> lastOutcome;
    private Runnable onInvoke = () -> { };
    private int invocationCount;

    private ScriptedExecutor() {
    }

    public static <T> ScriptedExecutor<T> create() {
        return new ScriptedExecutor<>();
    }

    public static <T> ScriptedExecutor<T> succeeding(T value) {
        return ScriptedExecutor.<T>create().thenSucceed(value);
    }

    public static <T> ScriptedExecutor<T> failing(Throwable error) {
        return ScriptedExecutor.<T>create().thenFail(error);
    }

    public synchronized ScriptedExecutor<T> thenSucceed(T value) {
        script.add(() -> CompletableFuture.completedFuture(value));
        return this;
    }

    public synchronized ScriptedExecutor<T> thenFail(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        script.add(() -> CompletableFuture.failedFuture(error));
        return this;
    }

    /**
     * Returns a future that only completes when the test completes it.
     *
     * @return this executor
     * @see #pendingFutures()
     */
    public synchronized ScriptedExecutor<T> thenHang() {
        script.add(() -> {
            CompletableFuture<T> future = new CompletableFuture<>();
            pendingFutures.add(future);
            return future;
        });
        return this;
    }

    /**
     * Hook run at the start of every invocation, before the outcome is produced.
     *
     * @param hook hook to run
     * @return this executor
     */
    public synchronized ScriptedExecutor<T> onInvoke(Runnable hook) {
        if (hook == null) {
            throw new IllegalArgumentException("hook cannot be null");
        }
        this.onInvoke = hook;
        return this;
    }

    @Override
    public CompletionStage<T> execute() {
        Supplier<CompletableFuture<T>> outcome;
        Runnable hook;
        synchronized (this) {
            invocationCount++;
            Supplier<CompletableFuture<T>> next = script.poll();
            if (next != null) {
                lastOutcome = next;
            }
            outcome = lastOutcome;
            hook = onInvoke;
        }
        if (outcome == null) {
            throw new IllegalStateException("No scripted outcome");
        }
        hook.run();
        return outcome.get();
    }

    public synchronized int invocationCount() {
        return invocationCount;
    }

    public synchronized List<CompletableFuture<T>> pendingFutures() {
        return List.copyOf(pendingFutures);
    }
}
