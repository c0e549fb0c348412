package com.ryuqq.jukebox.adapter.runner;

import com.ryuqq.jukebox.application.orchestrator.FailureListener;
import com.ryuqq.jukebox.application.orchestrator.QueueStatus;
import com.ryuqq.jukebox.application.orchestrator.RequestOrchestrator;
import com.ryuqq.jukebox.core.executor.RequestExecutor;
import com.ryuqq.jukebox.core.failure.ClassifiedFailure;
import com.ryuqq.jukebox.core.failure.DefaultFailureClassifier;
import com.ryuqq.jukebox.core.failure.DuplicateRequestException;
import com.ryuqq.jukebox.core.failure.FailureClassifier;
import com.ryuqq.jukebox.core.failure.FailureKind;
import com.ryuqq.jukebox.core.model.DedupKey;
import com.ryuqq.jukebox.core.model.Priority;
import com.ryuqq.jukebox.core.model.RequestParams;
import com.ryuqq.jukebox.core.model.RequestType;
import com.ryuqq.jukebox.core.model.ServiceName;
import com.ryuqq.jukebox.core.protection.RateLimiter;
import com.ryuqq.jukebox.core.spi.DispatchScheduler;
import com.ryuqq.jukebox.core.statemachine.WorkItemState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 우선순위 / 중복 제거 / 재시도를 갖춘 {@link RequestOrchestrator} 구현체.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * enqueue()
 *   ↓ DedupKey 예약 (이미 있으면 DuplicateRequestException으로 즉시 실패)
 * pending 추가 → drain 요청
 *   ↓ (DispatchScheduler 스레드)
 * dispatchNext():
 *   1. pending을 우선순위로 안정 정렬 (HIGH &gt; NORMAL &gt; LOW, 같은 순위는 FIFO)
 *   2. 맨 앞 항목에 대해 RateLimiter.canMakeRequest()
 *      - 거부 → 맨 앞으로 되돌리고 getWaitTime() 후 재개
 *   3. executor.execute() → 완료 시 스케줄러 스레드로 복귀
 *      - 성공 → future 완료, DedupKey 해제
 *      - 실패 → FailureListener 통지 후
 *               재시도 가능 &amp;&amp; retryCount &lt; maxRetries → LOW로 강등, backoff 후 재투입
 *               그 외 → 원래 오류로 future 실패, DedupKey 해제
 *   4. 다음 항목으로 계속
 * </pre>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>drain loop는 {@link AtomicBoolean} 가드로 하나만 실행되고, 한 번에 하나만 dispatch합니다.</li>
 *   <li>pending 목록과 예약된 DedupKey 집합은 하나의 모니터로 보호됩니다.</li>
 *   <li>enqueue는 어느 스레드에서든 호출할 수 있습니다.</li>
 *   <li>재시도 대기 중인 항목은 drain loop를 막지 않습니다.</li>
 * </ul>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public final class PriorityRequestQueue implements RequestOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PriorityRequestQueue.class);

    private static final Comparator<WorkItem<?>> BY_PRIORITY =
        Comparator.comparingInt((WorkItem<?> item) -> item.priority().rank()).reversed();

    private final RateLimiter rateLimiter;
    private final DispatchScheduler scheduler;
    private final FailureClassifier classifier;
    private final RequestQueueConfig config;
    private final BackoffCalculator backoffCalculator;
    private final List<FailureListener> failureListeners = new CopyOnWriteArrayList<>();

    private final Object lock = new Object();
    private final List<WorkItem<?>> pending = new ArrayList<>();
    private final List<WorkItem<?>> waitingRetry = new ArrayList<>();
    private final Set<DedupKey> reservedKeys = new HashSet<>();
    private boolean shutdown;

    private final AtomicBoolean draining = new AtomicBoolean(false);

    /**
     * 생성자 (기본 FailureClassifier 사용).
     *
     * @param rateLimiter admission 제어
     * @param scheduler drain loop 실행 스케줄러
     * @param config 재시도 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public PriorityRequestQueue(RateLimiter rateLimiter, DispatchScheduler scheduler, RequestQueueConfig config) {
        this(rateLimiter, scheduler, new DefaultFailureClassifier(), config);
    }

    /**
     * 생성자 (커스텀 FailureClassifier 주입).
     *
     * @param rateLimiter admission 제어
     * @param scheduler drain loop 실행 스케줄러
     * @param classifier 실패 분류기
     * @param config 재시도 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public PriorityRequestQueue(
        RateLimiter rateLimiter,
        DispatchScheduler scheduler,
        FailureClassifier classifier,
        RequestQueueConfig config
    ) {
        if (rateLimiter == null) {
            throw new IllegalArgumentException("rateLimiter cannot be null");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        if (classifier == null) {
            throw new IllegalArgumentException("classifier cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        this.rateLimiter = rateLimiter;
        this.scheduler = scheduler;
        this.classifier = classifier;
        this.config = config;
        this.backoffCalculator = config.backoffCalculator();
    }

    @Override
    public <T> CompletableFuture<T> enqueue(
        RequestType type,
        ServiceName serviceName,
        RequestParams params,
        RequestExecutor<T> executor,
        Priority priority
    ) {
        if (type == null || serviceName == null || params == null || executor == null || priority == null) {
            throw new IllegalArgumentException("type, serviceName, params, executor and priority are required");
        }

        DedupKey dedupKey = DedupKey.of(type, params);
        WorkItem<T> item = new WorkItem<>(dedupKey, type, serviceName, executor, priority);

        synchronized (lock) {
            if (shutdown) {
                return CompletableFuture.failedFuture(new RejectedExecutionException("Request queue is shut down"));
            }
            if (!reservedKeys.add(dedupKey)) {
                log.debug("Duplicate request rejected: {}", dedupKey);
                return CompletableFuture.failedFuture(new DuplicateRequestException(dedupKey));
            }
            pending.add(item);
        }

        log.info("Request queued: {} (service: {}, priority: {})", dedupKey, serviceName, priority);
        requestDrain();
        return item.future();
    }

    @Override
    public QueueStatus getStatus() {
        synchronized (lock) {
            return new QueueStatus(pending.size(), reservedKeys.size(), draining.get());
        }
    }

    /**
     * 대기 중이거나 재시도를 기다리는 요청을 모두 취소합니다.
     *
     * <p>취소된 요청의 future는 {@link CancellationException}으로 실패합니다.
     * 실행 중인 요청은 그대로 완료되며, 완료될 때까지 DedupKey를 유지합니다.</p>
     */
    @Override
    public void clear() {
        List<WorkItem<?>> cancelled = drainWaitingItems();
        cancelled.forEach(item -> item.future().completeExceptionally(
            new CancellationException("Request queue cleared: " + item.dedupKey())
        ));
        log.info("Request queue cleared ({} requests cancelled)", cancelled.size());
    }

    @Override
    public void addFailureListener(FailureListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        failureListeners.add(listener);
    }

    /**
     * 큐 종료.
     *
     * <p>이후 enqueue는 거부되고, 대기 중인 요청은 취소되며, 스케줄러가 종료됩니다.</p>
     */
    public void shutdown() {
        synchronized (lock) {
            if (shutdown) {
                return;
            }
            shutdown = true;
        }
        List<WorkItem<?>> cancelled = drainWaitingItems();
        cancelled.forEach(item -> item.future().completeExceptionally(
            new CancellationException("Request queue shut down: " + item.dedupKey())
        ));
        scheduler.shutdown();
        log.info("Request queue shut down ({} requests cancelled)", cancelled.size());
    }

    private List<WorkItem<?>> drainWaitingItems() {
        List<WorkItem<?>> cancelled = new ArrayList<>();
        synchronized (lock) {
            cancelled.addAll(pending);
            cancelled.addAll(waitingRetry);
            pending.clear();
            waitingRetry.clear();
            for (WorkItem<?> item : cancelled) {
                item.transitionTo(WorkItemState.FAILED);
                reservedKeys.remove(item.dedupKey());
            }
        }
        return cancelled;
    }

    private void requestDrain() {
        resumeOnScheduler(this::drain);
    }

    private void drain() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        dispatchNext();
    }

    /**
     * drain loop 한 단계. draining=true 상태에서만 호출됩니다.
     */
    private void dispatchNext() {
        WorkItem<?> next;
        synchronized (lock) {
            if (pending.isEmpty() || shutdown) {
                // 모니터 안에서 해제해야 enqueue와 경합하지 않음
                draining.set(false);
                return;
            }

            pending.sort(BY_PRIORITY);
            next = pending.remove(0);

            if (!rateLimiter.canMakeRequest(next.serviceName())) {
                pending.add(0, next);
                long waitMs = Math.max(1L, rateLimiter.getWaitTime(next.serviceName()).toMillis());
                log.warn("Rate limited for {}, waiting {}ms before next dispatch", next.serviceName(), waitMs);
                scheduleOrStop(this::dispatchNext, waitMs);
                return;
            }

            next.transitionTo(WorkItemState.DISPATCHING);
        }
        dispatch(next);
    }

    private <T> void dispatch(WorkItem<T> item) {
        log.debug("Dispatching {} (attempt {})", item.dedupKey(), item.attempt());

        CompletionStage<T> stage;
        try {
            stage = item.executor().execute();
        } catch (Throwable t) {
            // Error도 실패로 넘겨야 draining 플래그가 해제됨
            stage = CompletableFuture.failedFuture(t);
        }
        if (stage == null) {
            stage = CompletableFuture.failedFuture(
                new IllegalStateException("Executor returned no result for " + item.dedupKey())
            );
        }

        stage.whenComplete((value, error) -> {
            if (!resumeOnScheduler(() -> onComplete(item, value, error))) {
                settleWithoutRetry(item, value, error);
            }
        });
    }

    private <T> void onComplete(WorkItem<T> item, T value, Throwable error) {
        try {
            if (error == null) {
                onSuccess(item, value);
            } else {
                onFailure(item, error);
            }
        } finally {
            dispatchNext();
        }
    }

    private <T> void onSuccess(WorkItem<T> item, T value) {
        synchronized (lock) {
            item.transitionTo(WorkItemState.SUCCEEDED);
            reservedKeys.remove(item.dedupKey());
        }
        log.debug("Request succeeded: {} (attempt {})", item.dedupKey(), item.attempt());
        item.future().complete(value);
    }

    private void onFailure(WorkItem<?> item, Throwable error) {
        Throwable cause = DefaultFailureClassifier.unwrap(error);
        FailureKind kind = classifier.classify(cause);

        notifyListeners(new ClassifiedFailure(kind, item.serviceName(), item.dedupKey(), item.attempt(), cause));

        if (kind.isRetryable() && item.retryCount() < config.maxRetries()) {
            scheduleRetry(item, kind);
            return;
        }

        synchronized (lock) {
            item.transitionTo(WorkItemState.FAILED);
            reservedKeys.remove(item.dedupKey());
        }
        if (kind.isRetryable()) {
            log.warn("Request failed after {} attempts: {} ({}: {})",
                item.attempt(), item.dedupKey(), kind, cause.getMessage());
        } else {
            log.warn("Request failed without retry: {} ({}: {})", item.dedupKey(), kind, cause.getMessage());
        }
        item.future().completeExceptionally(cause);
    }

    private void scheduleRetry(WorkItem<?> item, FailureKind kind) {
        long delayMs;
        synchronized (lock) {
            if (shutdown) {
                item.transitionTo(WorkItemState.FAILED);
                reservedKeys.remove(item.dedupKey());
                item.future().completeExceptionally(
                    new CancellationException("Request queue shut down: " + item.dedupKey())
                );
                return;
            }
            item.markRetrying();
            waitingRetry.add(item);
            delayMs = backoffCalculator.calculate(item.retryCount());
        }
        log.warn("Request {} failed ({}), retry {}/{} in {}ms",
            item.dedupKey(), kind, item.retryCount(), config.maxRetries(), delayMs);
        scheduleOrStop(() -> requeue(item), delayMs);
    }

    private void requeue(WorkItem<?> item) {
        synchronized (lock) {
            // clear()/shutdown()으로 이미 취소된 경우
            if (!waitingRetry.remove(item)) {
                return;
            }
            item.transitionTo(WorkItemState.PENDING);
            pending.add(item);
        }
        drain();
    }

    /**
     * 스케줄러가 종료되어 복귀할 수 없을 때 재시도 없이 결과만 전달.
     */
    private <T> void settleWithoutRetry(WorkItem<T> item, T value, Throwable error) {
        synchronized (lock) {
            item.transitionTo(error == null ? WorkItemState.SUCCEEDED : WorkItemState.FAILED);
            reservedKeys.remove(item.dedupKey());
        }
        if (error == null) {
            item.future().complete(value);
        } else {
            item.future().completeExceptionally(DefaultFailureClassifier.unwrap(error));
        }
    }

    private void notifyListeners(ClassifiedFailure failure) {
        for (FailureListener listener : failureListeners) {
            try {
                listener.onFailure(failure);
            } catch (RuntimeException e) {
                log.error("Failure listener {} threw for {}; continuing", listener, failure.dedupKey(), e);
            }
        }
    }

    private boolean resumeOnScheduler(Runnable task) {
        try {
            scheduler.execute(task);
            return true;
        } catch (RuntimeException e) {
            log.warn("Dispatch scheduler rejected task; queue is shutting down: {}", e.getMessage());
            return false;
        }
    }

    private void scheduleOrStop(Runnable task, long delayMs) {
        try {
            scheduler.schedule(task, delayMs);
        } catch (RuntimeException e) {
            draining.set(false);
            log.warn("Dispatch scheduler rejected delayed task; queue is shutting down: {}", e.getMessage());
        }
    }
}
