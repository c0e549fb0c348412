/**
 * 프로세스 로컬 rate limiter.
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
package com.ryuqq.jukebox.adapter.inmemory.ratelimit;
