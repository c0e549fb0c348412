package com.ryuqq.jukebox.adapter.inmemory.credential;

import com.ryuqq.jukebox.core.credential.Credential;
import com.ryuqq.jukebox.core.spi.CredentialSource;

import java.util.ArrayList;
import java.util.List;

/**
 * 고정된 자격 증명 목록.
 *
 * <p>배포 시 설정한 콤마 구분 키 목록과 관리자가 입력한 사용자 지정 키를 제공합니다.</p>
 *
 * <pre>
 * CredentialSource source = StaticCredentialSource
 *     .fromCommaSeparated(System.getenv("YOUTUBE_API_KEYS"))
 *     .withCustomKey(savedCustomKey);
 * </pre>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public final class StaticCredentialSource implements CredentialSource {

    private final List<Credential> credentials;

    public StaticCredentialSource(List<Credential> credentials) {
        if (credentials == null) {
            throw new IllegalArgumentException("credentials cannot be null");
        }
        this.credentials = List.copyOf(credentials);
    }

    /**
     * 콤마 구분 키 목록으로 생성. 공백 항목은 무시합니다.
     *
     * @param commaSeparatedKeys "key1,key2,..." (null이면 빈 목록)
     * @return StaticCredentialSource
     */
    public static StaticCredentialSource fromCommaSeparated(String commaSeparatedKeys) {
        List<Credential> parsed = new ArrayList<>();
        if (commaSeparatedKeys != null) {
            for (String raw : commaSeparatedKeys.split(",")) {
                String key = raw.trim();
                if (!key.isEmpty()) {
                    parsed.add(Credential.of(key));
                }
            }
        }
        return new StaticCredentialSource(parsed);
    }

    /**
     * 사용자 지정 키를 추가한 사본 생성.
     *
     * @param customKey 사용자 지정 키 (null 또는 공백이면 변경 없음)
     * @return 새 StaticCredentialSource
     */
    public StaticCredentialSource withCustomKey(String customKey) {
        if (customKey == null || customKey.isBlank()) {
            return this;
        }
        List<Credential> copy = new ArrayList<>(credentials);
        copy.add(Credential.custom(customKey.trim()));
        return new StaticCredentialSource(copy);
    }

    @Override
    public List<Credential> loadCandidates() {
        return credentials;
    }
}
