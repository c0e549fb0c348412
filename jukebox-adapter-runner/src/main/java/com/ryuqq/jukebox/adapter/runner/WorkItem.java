package com.ryuqq.jukebox.adapter.runner;

import com.ryuqq.jukebox.core.executor.RequestExecutor;
import com.ryuqq.jukebox.core.model.DedupKey;
import com.ryuqq.jukebox.core.model.Priority;
import com.ryuqq.jukebox.core.model.RequestType;
import com.ryuqq.jukebox.core.model.ServiceName;
import com.ryuqq.jukebox.core.statemachine.StateTransition;
import com.ryuqq.jukebox.core.statemachine.WorkItemState;

import java.util.concurrent.CompletableFuture;

/**
 * 대기열에 들어간 단일 요청.
 *
 * <p>호출자에게 돌려준 CompletableFuture를 소유하며, 상태 변경은 모두
 * {@link StateTransition}으로 검증합니다. 큐의 모니터 또는 dispatch 스레드에서만 변경됩니다.</p>
 *
 * @param <T> 결과 타입
 * @author Jukebox Team
 * @since 1.0.0
 */
final class WorkItem<T> {

    private final DedupKey dedupKey;
    private final RequestType type;
    private final ServiceName serviceName;
    private final RequestExecutor<T> executor;
    private final CompletableFuture<T> future = new CompletableFuture<>();

    private Priority priority;
    private int retryCount;
    private WorkItemState state = WorkItemState.PENDING;

    WorkItem(DedupKey dedupKey, RequestType type, ServiceName serviceName, RequestExecutor<T> executor, Priority priority) {
        this.dedupKey = dedupKey;
        this.type = type;
        this.serviceName = serviceName;
        this.executor = executor;
        this.priority = priority;
    }

    DedupKey dedupKey() {
        return dedupKey;
    }

    RequestType type() {
        return type;
    }

    ServiceName serviceName() {
        return serviceName;
    }

    RequestExecutor<T> executor() {
        return executor;
    }

    CompletableFuture<T> future() {
        return future;
    }

    Priority priority() {
        return priority;
    }

    int retryCount() {
        return retryCount;
    }

    /**
     * 지금까지의 시도 횟수 (첫 시도 = 1).
     */
    int attempt() {
        return retryCount + 1;
    }

    WorkItemState state() {
        return state;
    }

    void transitionTo(WorkItemState next) {
        state = StateTransition.transition(state, next);
    }

    /**
     * 재시도 예약: 횟수 증가, LOW로 강등, RETRYING 전이.
     */
    void markRetrying() {
        transitionTo(WorkItemState.RETRYING);
        retryCount++;
        priority = Priority.LOW;
    }

    @Override
    public String toString() {
        return "WorkItem{" + dedupKey + ", service=" + serviceName + ", priority=" + priority
            + ", retryCount=" + retryCount + ", state=" + state + '}';
    }
}
