/**
 * 외부 호출 작업 추상화.
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
package com.ryuqq.jukebox.core.executor;
