/**
 * 대기열 작업의 상태 머신.
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
package com.ryuqq.jukebox.core.statemachine;
