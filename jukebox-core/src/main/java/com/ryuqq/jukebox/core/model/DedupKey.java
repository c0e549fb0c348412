package com.ryuqq.jukebox.core.model;

/**
 * 중복 제거 키.
 *
 * <p>(RequestType, RequestParams)로부터 결정적으로 도출되며,
 * 같은 키를 가진 두 요청은 같은 논리적 요청으로 간주됩니다.</p>
 *
 * <p><strong>불변식:</strong> 같은 DedupKey를 가진 작업은 대기열, dispatch 중,
 * 재시도 대기 상태를 통틀어 최대 하나만 존재할 수 있습니다.</p>
 *
 * <pre>
 * DedupKey.of(RequestType.SEARCH, RequestParams.of("q", "lofi"))
 *   → "search-q=lofi"
 * </pre>
 *
 * @param value 키 값
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public record DedupKey(String value) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException value가 null이거나 빈 문자열인 경우
     */
    public DedupKey {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("DedupKey value cannot be null or blank");
        }
    }

    /**
     * 요청 유형과 파라미터로부터 키 도출.
     *
     * @param type 요청 유형
     * @param params 요청 파라미터
     * @return DedupKey
     * @throws IllegalArgumentException type 또는 params가 null인 경우
     */
    public static DedupKey of(RequestType type, RequestParams params) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (params == null) {
            throw new IllegalArgumentException("params cannot be null");
        }
        return new DedupKey(type.key() + "-" + params.canonical());
    }

    @Override
    public String toString() {
        return value;
    }
}
