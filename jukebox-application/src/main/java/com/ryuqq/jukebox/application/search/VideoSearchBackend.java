package com.ryuqq.jukebox.application.search;

import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * Video Search Backend SPI.
 *
 * <p>An opaque remote service that accepts a query and returns matching videos.
 * Calls are asynchronous and may fail; the exact HTTP/JSON shape is an
 * implementation concern.</p>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public interface VideoSearchBackend {

    /**
     * Searches videos.
     *
     * @param query search query
     * @param maxResults maximum number of results
     * @param apiKey raw API key, or null for keyless backends
     * @return stage completing with the matching videos
     */
    CompletionStage<List<Video>> search(String query, int maxResults, String apiKey);

    /**
     * Whether the backend is currently reachable.
     *
     * <p>The fallback chain skips unavailable backends without calling {@link #search}.</p>
     *
     * @return true if reachable
     */
    default boolean isAvailable() {
        return true;
    }
}
