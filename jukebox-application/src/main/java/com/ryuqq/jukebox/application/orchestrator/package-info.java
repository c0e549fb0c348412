/**
 * 요청 조정 계약.
 *
 * <p>UI 계층이 사용하는 진입점입니다.</p>
 * <ul>
 *   <li>{@link com.ryuqq.jukebox.application.orchestrator.RequestOrchestrator}: 요청 등록 및 상태 조회</li>
 *   <li>{@link com.ryuqq.jukebox.application.orchestrator.FailureListener}: 실패 관찰 (쿼터 처리 등)</li>
 * </ul>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
package com.ryuqq.jukebox.application.orchestrator;
