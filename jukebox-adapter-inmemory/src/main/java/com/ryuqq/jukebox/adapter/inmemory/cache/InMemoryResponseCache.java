package com.ryuqq.jukebox.adapter.inmemory.cache;

import com.ryuqq.jukebox.core.clock.Clock;
import com.ryuqq.jukebox.core.spi.ResponseCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * In-memory implementation of {@link ResponseCache}.
 *
 * <p>Entries expire lazily on read. {@link #startPeriodicSweep()} additionally starts a
 * daemon timer that removes expired entries every {@code sweepInterval}; the timer is
 * stopped by {@link #close()}.</p>
 *
 * <p><strong>Thread Safety:</strong></p>
 * <ul>
 *   <li>Backed by {@link ConcurrentHashMap}</li>
 *   <li>Expired entries are removed with {@code remove(key, entry)} so a concurrent
 *       {@code set} of a fresh value is never lost</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryResponseCache cache = new InMemoryResponseCache(new ResponseCacheConfig(), SystemClock.INSTANCE);
 * cache.startPeriodicSweep();
 *
 * cache.set("youtube:videos:id=abc", videoJson);
 * Optional&lt;JsonNode&gt; hit = cache.get("youtube:videos:id=abc", JsonNode.class);
 * </pre>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public class InMemoryResponseCache implements ResponseCache, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InMemoryResponseCache.class);

    private final ResponseCacheConfig config;
    private final Clock clock;
    private final ConcurrentHashMap<String, CacheEntry> entries = new ConcurrentHashMap<>();

    private ScheduledExecutorService sweeper;

    /**
     * Creates a cache without a running sweeper.
     *
     * @param config cache configuration
     * @param clock time source
     * @throws IllegalArgumentException if any argument is null
     */
    public InMemoryResponseCache(ResponseCacheConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        requireKey(key);
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }

        CacheEntry entry = entries.get(key);
        if (entry == null) {
            log.debug("Cache miss: {}", key);
            return Optional.empty();
        }
        if (!entry.isValidAt(clock.currentTimeMillis())) {
            entries.remove(key, entry);
            log.debug("Cache expired: {}", key);
            return Optional.empty();
        }
        if (!type.isInstance(entry.data())) {
            log.warn("Cache type mismatch for {}: expected {}, found {}",
                key, type.getName(), entry.data().getClass().getName());
            return Optional.empty();
        }

        log.debug("Cache hit: {}", key);
        return Optional.of(type.cast(entry.data()));
    }

    @Override
    public void set(String key, Object data) {
        set(key, data, config.defaultTtl());
    }

    @Override
    public void set(String key, Object data, Duration ttl) {
        requireKey(key);
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
        ResponseCacheConfig.requirePositive(ttl, "ttl");

        entries.put(key, new CacheEntry(data, clock.currentTimeMillis(), ttl.toMillis()));
        log.debug("Cache set: {} (ttl: {}ms)", key, ttl.toMillis());
    }

    @Override
    public boolean has(String key) {
        requireKey(key);
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return false;
        }
        if (!entry.isValidAt(clock.currentTimeMillis())) {
            entries.remove(key, entry);
            return false;
        }
        return true;
    }

    @Override
    public boolean delete(String key) {
        requireKey(key);
        return entries.remove(key) != null;
    }

    @Override
    public void clear() {
        entries.clear();
        log.info("Response cache cleared");
    }

    /**
     * Returns the current size and keys.
     *
     * @return cache statistics
     */
    public CacheStats getStats() {
        return new CacheStats(entries.size(), new ArrayList<>(entries.keySet()));
    }

    /**
     * Removes every expired entry.
     *
     * @return number of removed entries
     */
    public int cleanExpired() {
        long now = clock.currentTimeMillis();
        int removed = 0;
        for (Map.Entry<String, CacheEntry> entry : entries.entrySet()) {
            if (!entry.getValue().isValidAt(now) && entries.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Cleaned {} expired cache entries", removed);
        }
        return removed;
    }

    /**
     * Starts the periodic sweep on a daemon thread. Calling it twice has no effect.
     */
    public synchronized void startPeriodicSweep() {
        if (sweeper != null) {
            return;
        }
        sweeper = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "jukebox-cache-sweeper");
            thread.setDaemon(true);
            return thread;
        });
        long intervalMs = config.sweepInterval().toMillis();
        sweeper.scheduleAtFixedRate(this::sweepSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Response cache sweep started (interval: {}ms)", intervalMs);
    }

    /**
     * Stops the periodic sweep if running.
     */
    @Override
    public synchronized void close() {
        if (sweeper != null) {
            sweeper.shutdownNow();
            sweeper = null;
            log.info("Response cache sweep stopped");
        }
    }

    private void sweepSafely() {
        try {
            cleanExpired();
        } catch (RuntimeException e) {
            // 다음 주기에 다시 시도
            log.error("Response cache sweep failed", e);
        }
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
    }
}
