/**
 * 자격 증명(API Key) 모델.
 *
 * <p>{@link com.ryuqq.jukebox.core.credential.Credential}은 키와 관측된 쿼터 사용률을,
 * {@link com.ryuqq.jukebox.core.credential.RotationEvent}는 교체 이력을,
 * {@link com.ryuqq.jukebox.core.credential.CredentialState}는 재시작 간 유지되는 스냅샷을 나타냅니다.</p>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
package com.ryuqq.jukebox.core.credential;
