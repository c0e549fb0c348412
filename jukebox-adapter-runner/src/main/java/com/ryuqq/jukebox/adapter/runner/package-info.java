/**
 * Runner Adapter Layer - 요청 대기열과 실행 구성.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.jukebox.adapter.runner.PriorityRequestQueue} - 우선순위 / 중복 제거 / 재시도 drain loop</li>
 *   <li>{@link com.ryuqq.jukebox.adapter.runner.QuotaErrorHandler} - 쿼터 소진 시 자격 증명 교체</li>
 *   <li>{@link com.ryuqq.jukebox.adapter.runner.SingleThreadDispatchScheduler} - 단일 스레드 dispatch</li>
 *   <li>{@link com.ryuqq.jukebox.adapter.runner.JukeboxContext} - 프로세스 단위 구성</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (PriorityRequestQueue, JukeboxContext)
 *   ↓ implements
 * application (RequestOrchestrator, FailureListener)
 *   ↓ depends on
 * core (DedupKey, FailureKind, RateLimiter, DispatchScheduler, WorkItemState)
 * </pre>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
package com.ryuqq.jukebox.adapter.runner;
