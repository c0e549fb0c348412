/**
 * 실패 분류 및 예외 계층.
 *
 * <p>업스트림 오류는 경계에서 {@link com.ryuqq.jukebox.core.failure.FailureKind}로
 * 한 번만 분류되며, 이후 재시도 / 자격 증명 교체 / 종료 판단은 태그로만 이루어집니다.</p>
 *
 * <p><strong>주요 타입:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.jukebox.core.failure.JukeboxException}: 태그를 가진 비검사 예외의 상위 타입</li>
 *   <li>{@link com.ryuqq.jukebox.core.failure.FailureClassifier}: 원시 오류 → 태그 매핑 SPI</li>
 *   <li>{@link com.ryuqq.jukebox.core.failure.ClassifiedFailure}: 리스너에 전달되는 분류 결과</li>
 * </ul>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
package com.ryuqq.jukebox.core.failure;
