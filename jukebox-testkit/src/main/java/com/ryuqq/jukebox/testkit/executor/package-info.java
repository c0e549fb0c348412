/**
 * Scripted request executors.
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
package com.ryuqq.jukebox.testkit.executor;
