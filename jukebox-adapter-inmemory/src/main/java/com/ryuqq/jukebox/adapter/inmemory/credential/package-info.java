/**
 * 프로세스 로컬 자격 증명 풀과 저장소.
 *
 * <p>API Key는 로그와 교체 이력에 마지막 8자만 남깁니다.</p>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
package com.ryuqq.jukebox.adapter.inmemory.credential;
