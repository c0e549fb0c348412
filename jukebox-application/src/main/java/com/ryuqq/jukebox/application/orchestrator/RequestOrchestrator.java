package com.ryuqq.jukebox.application.orchestrator;

import com.ryuqq.jukebox.core.executor.RequestExecutor;
import com.ryuqq.jukebox.core.model.Priority;
import com.ryuqq.jukebox.core.model.RequestParams;
import com.ryuqq.jukebox.core.model.RequestType;
import com.ryuqq.jukebox.core.model.ServiceName;

import java.util.concurrent.CompletableFuture;

/**
 * 외부 호출 요청 조정자.
 *
 * <p>요청을 우선순위 대기열에 넣고, 서비스별 rate limit을 지키며 하나씩 dispatch하고,
 * 실패 시 지수 백오프로 재시도한 뒤 최종 결과를 호출자에게 전달합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * CompletableFuture&lt;List&lt;Video&gt;&gt; result = orchestrator.enqueue(
 *     RequestType.SEARCH,
 *     ServiceName.YOUTUBE_API,
 *     RequestParams.of("q", "lofi", "maxResults", 25),
 *     () -&gt; backend.search("lofi", 25, pool.activeKey()),
 *     Priority.HIGH
 * );
 *
 * result.whenComplete((videos, error) -&gt; {
 *     if (error instanceof DuplicateRequestException) {
 *         // 같은 요청이 이미 진행 중 (무시)
 *     }
 * });
 * </pre>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public interface RequestOrchestrator {

    /**
     * 요청 등록.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>DedupKey 도출 (type + 정렬된 params)</li>
     *   <li>같은 키가 이미 대기/실행/재시도 대기 중이면 DuplicateRequestException으로 즉시 실패한 future 반환</li>
     *   <li>대기열에 추가 후 drain loop가 멈춰 있으면 시작</li>
     *   <li>성공 시 executor 결과로, 재시도 소진 시 마지막 원본 오류로 future 완료</li>
     * </ol>
     *
     * @param type 요청 유형
     * @param serviceName rate limit 적용 대상 서비스
     * @param params 요청 파라미터
     * @param executor 실제 호출 작업
     * @param priority 우선순위
     * @param <T> 결과 타입
     * @return 결과 future
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    <T> CompletableFuture<T> enqueue(
        RequestType type,
        ServiceName serviceName,
        RequestParams params,
        RequestExecutor<T> executor,
        Priority priority
    );

    /**
     * NORMAL 우선순위로 요청 등록.
     *
     * @see #enqueue(RequestType, ServiceName, RequestParams, RequestExecutor, Priority)
     */
    default <T> CompletableFuture<T> enqueue(
        RequestType type,
        ServiceName serviceName,
        RequestParams params,
        RequestExecutor<T> executor
    ) {
        return enqueue(type, serviceName, params, executor, Priority.NORMAL);
    }

    /**
     * 대기열 상태 조회.
     *
     * @return 대기 작업 수, 예약된 DedupKey 수, drain loop 실행 여부
     */
    QueueStatus getStatus();

    /**
     * 대기 중인 작업 모두 제거.
     *
     * <p>제거된 작업의 future는 {@link java.util.concurrent.CancellationException}으로 완료됩니다.
     * 이미 dispatch 중인 작업은 영향을 받지 않습니다.</p>
     */
    void clear();

    /**
     * 실패 리스너 등록.
     *
     * @param listener 리스너
     * @throws IllegalArgumentException listener가 null인 경우
     */
    void addFailureListener(FailureListener listener);
}
