package com.ryuqq.jukebox.core.model;

/**
 * 요청 유형.
 *
 * <p>중복 제거 키({@link DedupKey})의 접두어로 사용됩니다.
 * 같은 파라미터라도 유형이 다르면 서로 다른 논리적 요청입니다.</p>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public enum RequestType {

    /**
     * 영상 검색.
     */
    SEARCH("search"),

    /**
     * 플레이리스트 로드.
     */
    PLAYLIST("playlist"),

    /**
     * API 키 검증 등 상태 확인 호출.
     */
    VALIDATION("validation");

    private final String key;

    RequestType(String key) {
        this.key = key;
    }

    /**
     * 키 생성에 사용하는 소문자 식별자.
     *
     * @return 식별자 (예: "search")
     */
    public String key() {
        return key;
    }
}
