package com.ryuqq.jukebox.adapter.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.jukebox.application.search.Video;
import com.ryuqq.jukebox.application.search.VideoSearchBackend;
import com.ryuqq.jukebox.core.failure.NoCredentialAvailableException;
import com.ryuqq.jukebox.core.model.CacheKeys;
import com.ryuqq.jukebox.core.model.RequestParams;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * YouTube Data API v3 검색 백엔드.
 *
 * <p>{@code GET <baseUrl>/search?part=snippet&type=video&videoCategoryId=10&q=..&maxResults=..&key=..}
 * 응답의 {@code items}를 {@link Video}로 변환합니다. 원시 응답은 API 키를 제외한 파라미터로
 * 만든 키({@link CacheKeys#forVideoSearch})로 15분간 캐시됩니다.</p>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public class YouTubeSearchBackend implements VideoSearchBackend {

    public static final URI DEFAULT_BASE_URL = URI.create("https://www.googleapis.com/youtube/v3");

    static final String SEARCH_ENDPOINT = "search";
    static final String MUSIC_CATEGORY_ID = "10";
    static final Duration RESPONSE_TTL = Duration.ofMinutes(15);

    private final CachedHttpFetcher fetcher;
    private final URI baseUrl;

    public YouTubeSearchBackend(CachedHttpFetcher fetcher) {
        this(fetcher, DEFAULT_BASE_URL);
    }

    public YouTubeSearchBackend(CachedHttpFetcher fetcher, URI baseUrl) {
        if (fetcher == null || baseUrl == null) {
            throw new IllegalArgumentException("fetcher and baseUrl cannot be null");
        }
        this.fetcher = fetcher;
        this.baseUrl = baseUrl;
    }

    @Override
    public CompletionStage<List<Video>> search(String query, int maxResults, String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            return CompletableFuture.failedFuture(new NoCredentialAvailableException("YouTube Data API requires an API key"));
        }

        RequestParams params = RequestParams.of(
            "part", "snippet",
            "q", query,
            "type", "video",
            "maxResults", maxResults,
            "videoCategoryId", MUSIC_CATEGORY_ID
        );
        URI url = buildUrl(SEARCH_ENDPOINT, params, apiKey);
        String cacheKey = CacheKeys.forVideoSearch(SEARCH_ENDPOINT, params);

        return fetcher.cachedFetch(url, new HttpFetchOptions(), cacheKey, RESPONSE_TTL, JsonNode.class)
            .thenApply(YouTubeSearchBackend::toVideos);
    }

    URI buildUrl(String endpoint, RequestParams params, String apiKey) {
        StringBuilder url = new StringBuilder(baseUrl.toString()).append('/').append(endpoint).append('?');
        for (Map.Entry<String, String> entry : params.asMap().entrySet()) {
            url.append(encode(entry.getKey())).append('=').append(encode(entry.getValue())).append('&');
        }
        url.append("key=").append(encode(apiKey));
        return URI.create(url.toString());
    }

    static List<Video> toVideos(JsonNode response) {
        List<Video> videos = new ArrayList<>();
        for (JsonNode item : response.path("items")) {
            String videoId = item.path("id").path("videoId").asText("");
            if (videoId.isEmpty()) {
                // 채널/플레이리스트 결과
                continue;
            }
            JsonNode snippet = item.path("snippet");
            JsonNode thumbnail = snippet.path("thumbnails").path("high").path("url");
            videos.add(new Video(
                videoId,
                snippet.path("title").asText(""),
                snippet.path("channelTitle").asText(""),
                thumbnail.isTextual() ? thumbnail.asText() : null,
                null
            ));
        }
        return videos;
    }

    private static String encode(String raw) {
        return URLEncoder.encode(raw, StandardCharsets.UTF_8);
    }
}
