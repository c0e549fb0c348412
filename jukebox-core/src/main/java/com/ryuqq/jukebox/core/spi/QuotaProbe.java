package com.ryuqq.jukebox.core.spi;

/**
 * Quota Probe SPI.
 *
 * <p>Reports the observed quota usage of a credential. Observations can be stale or
 * missing; callers treat a failed probe as 0 % usage.</p>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface QuotaProbe {

    /**
     * Probes the quota usage of the given key.
     *
     * @param key the raw API key
     * @return usage percentage in the range 0.0 ~ 100.0
     * @throws Exception if the usage could not be observed
     */
    double quotaUsedPercent(String key) throws Exception;
}
