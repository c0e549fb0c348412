package com.ryuqq.jukebox.application.search;

/**
 * 검색 결과 영상.
 *
 * @param videoId 영상 ID
 * @param title 제목
 * @param channelTitle 채널 이름
 * @param thumbnailUrl 썸네일 URL (nullable)
 * @param duration 재생 시간 표기 (nullable, 예: "PT3M20S")
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public record Video(
    String videoId,
    String title,
    String channelTitle,
    String thumbnailUrl,
    String duration
) {

    public Video {
        if (videoId == null || videoId.isBlank()) {
            throw new IllegalArgumentException("videoId cannot be null or blank");
        }
        if (title == null) {
            throw new IllegalArgumentException("title cannot be null");
        }
        if (channelTitle == null) {
            channelTitle = "";
        }
    }

    public static Video of(String videoId, String title, String channelTitle) {
        return new Video(videoId, title, channelTitle, null, null);
    }
}
