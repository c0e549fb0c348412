/**
 * 시간 소스.
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
package com.ryuqq.jukebox.core.clock;
