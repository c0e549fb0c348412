/**
 * 외부 서비스 보호 정책 (Rate Limiting).
 *
 * <p>구현체는 {@code jukebox-adapter-inmemory}의 슬라이딩 윈도우 구현을 사용하며,
 * {@link com.ryuqq.jukebox.core.protection.noop} 패키지는 제한 없는 구현을 제공합니다.</p>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
package com.ryuqq.jukebox.core.protection;
