package com.ryuqq.jukebox.core.model;

/**
 * 외부 서비스 식별자.
 *
 * <p>RateLimiter의 윈도우 단위이며, QuotaErrorHandler가 과금(metered) 서비스를
 * 판별할 때도 사용합니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~100자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_), 점(.)만 허용</li>
 * </ul>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public final class ServiceName {

    /**
     * 스크래핑 백엔드 (10 req / 60s).
     */
    public static final ServiceName YOUTUBE_SCRAPER = new ServiceName("youtube-scraper");

    /**
     * 쿼터 과금되는 YouTube Data API (100 req / 60s).
     */
    public static final ServiceName YOUTUBE_API = new ServiceName("youtube-api");

    /**
     * 일반 검색 (20 req / 60s).
     */
    public static final ServiceName SEARCH = new ServiceName("search");

    /**
     * 플레이리스트 로드 (5 req / 300s).
     */
    public static final ServiceName PLAYLIST = new ServiceName("playlist");

    private final String value;

    private ServiceName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ServiceName cannot be null or blank");
        }
        if (value.length() > 100) {
            throw new IllegalArgumentException("ServiceName length cannot exceed 100 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_.]+$")) {
            throw new IllegalArgumentException("ServiceName contains invalid characters: " + value);
        }
        this.value = value;
    }

    /**
     * ServiceName 생성.
     *
     * @param value 서비스 이름
     * @return ServiceName 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ServiceName of(String value) {
        return new ServiceName(value);
    }

    /**
     * 서비스 이름 조회.
     *
     * @return 서비스 이름
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ServiceName that = (ServiceName) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
