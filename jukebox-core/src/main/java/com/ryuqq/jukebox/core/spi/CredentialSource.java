package com.ryuqq.jukebox.core.spi;

import com.ryuqq.jukebox.core.credential.Credential;

import java.util.List;

/**
 * Credential Source SPI.
 *
 * <p>Supplies the candidate credential set: keys configured at deploy time plus
 * any custom key entered by the operator.</p>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CredentialSource {

    /**
     * Loads the candidate credentials.
     *
     * <p>Quota usage on the returned credentials is the initial observation; the pool
     * replaces it with {@link QuotaProbe} values on each refresh.</p>
     *
     * @return candidate credentials in configuration order (never null)
     */
    List<Credential> loadCandidates();
}
