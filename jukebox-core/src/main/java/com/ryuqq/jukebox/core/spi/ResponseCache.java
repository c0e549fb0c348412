package com.ryuqq.jukebox.core.spi;

import java.time.Duration;
import java.util.Optional;

/**
 * Response Cache SPI.
 *
 * <p>TTL-keyed cache of upstream responses. Keys are produced from normalized request
 * parameters, so equivalent requests share one entry.</p>
 *
 * <p><strong>Expiry Semantics:</strong></p>
 * <ul>
 *   <li>An entry is valid while {@code now - storedAt <= ttl}</li>
 *   <li>Reads of an expired entry remove it and report a miss</li>
 *   <li>Implementations may additionally sweep expired entries periodically</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * Optional&lt;SearchResult&gt; hit = cache.get(key, SearchResult.class);
 * if (hit.isEmpty()) {
 *     SearchResult fresh = fetch();
 *     cache.set(key, fresh, Duration.ofMinutes(15));
 * }
 * </pre>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public interface ResponseCache {

    /**
     * Returns the cached value when present and not expired.
     *
     * @param key cache key
     * @param type expected value type
     * @param <T> value type
     * @return the value, or empty on a miss, an expired entry, or a type mismatch
     */
    <T> Optional<T> get(String key, Class<T> type);

    /**
     * Stores a value with the default TTL.
     *
     * @param key cache key
     * @param data value (not null)
     */
    void set(String key, Object data);

    /**
     * Stores a value with an explicit TTL, overwriting any existing entry.
     *
     * @param key cache key
     * @param data value (not null)
     * @param ttl time to live (positive)
     */
    void set(String key, Object data, Duration ttl);

    /**
     * Checks whether a valid entry exists. Expired entries are removed.
     *
     * @param key cache key
     * @return true if a valid entry exists
     */
    boolean has(String key);

    /**
     * Removes an entry.
     *
     * @param key cache key
     * @return true if an entry was removed
     */
    boolean delete(String key);

    /**
     * Removes all entries.
     */
    void clear();
}
