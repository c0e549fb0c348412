package com.ryuqq.jukebox.core.spi;

import com.ryuqq.jukebox.core.credential.CredentialState;

/**
 * Credential State Store SPI.
 *
 * <p>Persists the selected credential and the rotation history so that a restart
 * of the kiosk resumes with the same key.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>{@link #load()} returns {@link CredentialState#empty()} when nothing was saved</li>
 *   <li>{@link #save} replaces the whole state atomically</li>
 * </ul>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public interface CredentialStateStore {

    /**
     * Loads the last saved state.
     *
     * @return saved state, or an empty state
     */
    CredentialState load();

    /**
     * Saves the state, replacing any previous one.
     *
     * @param state the state to save
     * @throws IllegalArgumentException if state is null
     */
    void save(CredentialState state);
}
