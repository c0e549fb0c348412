package com.ryuqq.jukebox.adapter.inmemory.credential;

import com.ryuqq.jukebox.core.credential.CredentialState;
import com.ryuqq.jukebox.core.spi.CredentialStateStore;

import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory implementation of {@link CredentialStateStore}.
 *
 * <p>Holds the last saved state for the lifetime of the process.</p>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public class InMemoryCredentialStateStore implements CredentialStateStore {

    private final AtomicReference<CredentialState> state;

    /**
     * Creates an empty store.
     */
    public InMemoryCredentialStateStore() {
        this(CredentialState.empty());
    }

    /**
     * Creates a store seeded with a previously saved state.
     *
     * @param initial initial state
     * @throws IllegalArgumentException if initial is null
     */
    public InMemoryCredentialStateStore(CredentialState initial) {
        if (initial == null) {
            throw new IllegalArgumentException("initial state cannot be null");
        }
        this.state = new AtomicReference<>(initial);
    }

    @Override
    public CredentialState load() {
        return state.get();
    }

    @Override
    public void save(CredentialState newState) {
        if (newState == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        state.set(newState);
    }
}
