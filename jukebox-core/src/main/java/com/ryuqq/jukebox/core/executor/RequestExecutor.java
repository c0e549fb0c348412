package com.ryuqq.jukebox.core.executor;

import java.util.concurrent.CompletionStage;

/**
 * 실제 외부 호출을 수행하는 비동기 작업.
 *
 * <p>RequestQueue는 admission 통과 후 이 작업을 호출하며, 재시도 시 같은 인스턴스를
 * 다시 호출합니다. 따라서 자격 증명처럼 호출 시점에 달라질 수 있는 값은
 * 생성 시점이 아니라 {@link #execute()} 안에서 읽어야 합니다.</p>
 *
 * <p><strong>실패 표현:</strong></p>
 * <ul>
 *   <li>동기 예외: execute()에서 직접 던짐</li>
 *   <li>비동기 실패: 예외로 완료된 CompletionStage 반환</li>
 * </ul>
 * <p>두 경우 모두 같은 실패로 취급됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * RequestExecutor<List<Video>> executor = () -> backend.search(query, pool.activeKey());
 * queue.enqueue(RequestType.SEARCH, ServiceName.YOUTUBE_API, params, executor, Priority.HIGH);
 * }</pre>
 *
 * @param <T> 결과 타입
 * @author Jukebox Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RequestExecutor<T> {

    /**
     * 외부 호출 수행.
     *
     * @return 결과를 담은 CompletionStage
     * @throws Exception 호출을 시작하지 못한 경우
     */
    CompletionStage<T> execute() throws Exception;
}
