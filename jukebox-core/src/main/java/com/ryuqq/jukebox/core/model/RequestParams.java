package com.ryuqq.jukebox.core.model;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 요청 파라미터 (불변, 키 정렬).
 *
 * <p>파라미터는 키 기준으로 정렬되어 저장되므로, 입력 순서가 달라도
 * {@link #canonical()} 결과가 같습니다. 중복 제거 키와 캐시 키 모두
 * 이 정규형을 사용합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * RequestParams a = RequestParams.of("q", "lofi", "maxResults", 10);
 * RequestParams b = RequestParams.of("maxResults", 10, "q", "lofi");
 *
 * a.canonical(); // "maxResults=10&amp;q=lofi"
 * a.equals(b);   // true
 * </pre>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public final class RequestParams {

    private static final RequestParams EMPTY = new RequestParams(new TreeMap<>());

    private final SortedMap<String, String> values;

    private RequestParams(SortedMap<String, String> values) {
        this.values = Collections.unmodifiableSortedMap(values);
    }

    /**
     * 빈 파라미터.
     *
     * @return 빈 RequestParams
     */
    public static RequestParams empty() {
        return EMPTY;
    }

    /**
     * Map으로부터 생성.
     *
     * @param values 파라미터 (값은 {@code String.valueOf}로 변환)
     * @return RequestParams
     * @throws IllegalArgumentException values가 null이거나 null 키/값을 포함하는 경우
     */
    public static RequestParams from(Map<String, ?> values) {
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        SortedMap<String, String> sorted = new TreeMap<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            put(sorted, entry.getKey(), entry.getValue());
        }
        return new RequestParams(sorted);
    }

    /**
     * 키/값 쌍 목록으로부터 생성.
     *
     * @param keyValues key1, value1, key2, value2, ...
     * @return RequestParams
     * @throws IllegalArgumentException 인자 개수가 홀수이거나 키가 문자열이 아닌 경우
     */
    public static RequestParams of(Object... keyValues) {
        if (keyValues == null || keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("keyValues must contain key/value pairs");
        }
        SortedMap<String, String> sorted = new TreeMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            if (!(keyValues[i] instanceof String key)) {
                throw new IllegalArgumentException("parameter key must be a String (index " + i + ")");
            }
            put(sorted, key, keyValues[i + 1]);
        }
        return new RequestParams(sorted);
    }

    private static void put(SortedMap<String, String> target, String key, Object value) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("parameter key cannot be null or blank");
        }
        if (value == null) {
            throw new IllegalArgumentException("parameter value cannot be null (key: " + key + ")");
        }
        target.put(key, String.valueOf(value));
    }

    /**
     * 새 파라미터를 추가한 사본 생성.
     *
     * @param key 키
     * @param value 값
     * @return 새 RequestParams
     */
    public RequestParams with(String key, Object value) {
        SortedMap<String, String> copy = new TreeMap<>(values);
        put(copy, key, value);
        return new RequestParams(copy);
    }

    /**
     * 파라미터 값 조회.
     *
     * @param key 키
     * @return 값, 없으면 null
     */
    public String get(String key) {
        return values.get(key);
    }

    /**
     * 정렬된 읽기 전용 Map 조회.
     *
     * @return 파라미터 Map
     */
    public SortedMap<String, String> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * 정규형 문자열.
     *
     * <p>키 정렬 후 {@code key=value}를 {@code &}로 연결합니다.
     * 값은 URL 인코딩되어 구분자와 충돌하지 않습니다.</p>
     *
     * @return 정규형 (빈 파라미터는 빈 문자열)
     */
    public String canonical() {
        return values.entrySet().stream()
            .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
            .collect(Collectors.joining("&"));
    }

    private static String encode(String raw) {
        return URLEncoder.encode(raw, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RequestParams that = (RequestParams) o;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "RequestParams{" + canonical() + '}';
    }
}
