/**
 * Core 값 타입 패키지.
 *
 * <p>요청을 식별하고 분류하는 불변 값 객체들을 정의합니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.jukebox.core.model.RequestType} - 요청 유형 (search, playlist, validation)</li>
 *   <li>{@link com.ryuqq.jukebox.core.model.ServiceName} - Rate Limit 단위가 되는 외부 서비스</li>
 *   <li>{@link com.ryuqq.jukebox.core.model.RequestParams} - 키 정렬된 요청 파라미터</li>
 *   <li>{@link com.ryuqq.jukebox.core.model.DedupKey} - 유형 + 정규형 파라미터로 만든 중복 제거 키</li>
 *   <li>{@link com.ryuqq.jukebox.core.model.Priority} - HIGH / NORMAL / LOW</li>
 * </ul>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
package com.ryuqq.jukebox.core.model;
