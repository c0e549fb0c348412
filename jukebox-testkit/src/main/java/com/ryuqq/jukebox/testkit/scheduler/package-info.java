/**
 * Deterministic dispatch scheduler for drain-loop, backoff and rate-limit tests.
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
package com.ryuqq.jukebox.testkit.scheduler;
