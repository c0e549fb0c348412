/**
 * Abstract contract tests for adapter implementations.
 *
 * <p>Each adapter module extends these classes in its own test sources and only
 * supplies a factory method. The scenarios cover the behavior callers rely on:
 * sliding-window admission, TTL validity and credential selection / rotation.</p>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
package com.ryuqq.jukebox.testkit.contract;
