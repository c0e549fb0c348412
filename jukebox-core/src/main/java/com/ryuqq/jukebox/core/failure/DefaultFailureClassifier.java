package com.ryuqq.jukebox.core.failure;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * 기본 실패 분류기.
 *
 * <p><strong>분류 순서:</strong></p>
 * <ol>
 *   <li>CompletionException / ExecutionException 래핑 해제</li>
 *   <li>{@link JukeboxException}이면 자신의 태그 사용</li>
 *   <li>메시지에 quotaExceeded / QUOTA_EXCEEDED / quota / 403 포함 → QUOTA_EXHAUSTED</li>
 *   <li>메시지에 rate limit / 429 포함 → RATE_LIMITED</li>
 *   <li>그 외 → TRANSIENT</li>
 * </ol>
 *
 * <p>문자열 매칭은 타입 정보가 없는 오류(서드파티 클라이언트 등)에만 적용되는
 * 마지막 수단입니다.</p>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public final class DefaultFailureClassifier implements FailureClassifier {

    private static final List<String> QUOTA_MARKERS = List.of("quotaexceeded", "quota_exceeded", "quota", "403");
    private static final List<String> RATE_LIMIT_MARKERS = List.of("rate limit", "ratelimit", "429");

    @Override
    public FailureKind classify(Throwable error) {
        Throwable root = unwrap(error);
        if (root == null) {
            return FailureKind.TRANSIENT;
        }
        if (root instanceof JukeboxException jukeboxException) {
            return jukeboxException.getKind();
        }

        String message = root.getMessage();
        if (message == null) {
            return FailureKind.TRANSIENT;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        if (containsAny(normalized, QUOTA_MARKERS)) {
            return FailureKind.QUOTA_EXHAUSTED;
        }
        if (containsAny(normalized, RATE_LIMIT_MARKERS)) {
            return FailureKind.RATE_LIMITED;
        }
        return FailureKind.TRANSIENT;
    }

    /**
     * 비동기 래퍼 예외를 벗겨 실제 원인 반환.
     *
     * @param error 오류 (null 허용)
     * @return 래핑 해제된 오류
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static boolean containsAny(String message, List<String> markers) {
        for (String marker : markers) {
            if (message.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
