/**
 * 프로세스 로컬 응답 캐시.
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
package com.ryuqq.jukebox.adapter.inmemory.cache;
