/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the interfaces that adapters implement to give the request
 * layer its collaborators.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.jukebox.core.spi.DispatchScheduler} - Serial executor for the drain loop</li>
 *   <li>{@link com.ryuqq.jukebox.core.spi.ResponseCache} - TTL-keyed response cache</li>
 *   <li>{@link com.ryuqq.jukebox.core.spi.CredentialSource} - Candidate API keys</li>
 *   <li>{@link com.ryuqq.jukebox.core.spi.QuotaProbe} - Observed quota usage per key</li>
 *   <li>{@link com.ryuqq.jukebox.core.spi.CredentialStateStore} - Selected key and rotation history</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>jukebox-adapter-inmemory and jukebox-adapter-runner provide the process-local
 * implementations; jukebox-testkit provides deterministic doubles.</p>
 *
 * @since 1.0.0
 * @author Jukebox Team
 */
package com.ryuqq.jukebox.core.spi;
