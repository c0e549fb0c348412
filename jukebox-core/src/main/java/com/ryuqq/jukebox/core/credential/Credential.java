package com.ryuqq.jukebox.core.credential;

/**
 * API 자격 증명 (API Key + 관측된 쿼터 사용률).
 *
 * <p>quotaUsedPercent는 외부 probe로 주기적으로 갱신되는 관측값이며,
 * 오래되었거나 누락될 수 있습니다. 누락은 0%(가장 선호)로 취급합니다.</p>
 *
 * <p><strong>키 형식 검증 ({@link #looksValid()}):</strong></p>
 * <ul>
 *   <li>기본 키: "AIza" 접두어 + 20자 이상</li>
 *   <li>사용자 지정 키(custom): 공백이 아니면 허용</li>
 * </ul>
 *
 * @param key API Key (비밀값, 로그에는 {@link #maskedKey()}만 사용)
 * @param quotaUsedPercent 쿼터 사용률 (0.0 ~ 100.0)
 * @param custom 사용자가 직접 입력한 키인지 여부
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public record Credential(
    String key,
    double quotaUsedPercent,
    boolean custom
) {

    private static final String KEY_PREFIX = "AIza";
    private static final int MIN_KEY_LENGTH = 20;
    private static final int MASK_VISIBLE_CHARS = 8;

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException key가 null이거나 사용률이 범위를 벗어난 경우
     */
    public Credential {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (Double.isNaN(quotaUsedPercent) || quotaUsedPercent < 0.0 || quotaUsedPercent > 100.0) {
            throw new IllegalArgumentException(
                "quotaUsedPercent must be between 0 and 100 (current: " + quotaUsedPercent + ")"
            );
        }
    }

    /**
     * 사용률 0%의 기본 키 생성.
     *
     * @param key API Key
     * @return Credential
     */
    public static Credential of(String key) {
        return new Credential(key, 0.0, false);
    }

    /**
     * 사용률 0%의 사용자 지정 키 생성.
     *
     * @param key API Key
     * @return Credential (custom=true)
     */
    public static Credential custom(String key) {
        return new Credential(key, 0.0, true);
    }

    /**
     * 사용률만 변경한 사본 생성.
     *
     * <p>probe 값이 범위를 벗어나면 0~100으로 보정합니다.</p>
     *
     * @param quotaUsedPercent 새 사용률
     * @return 새 Credential
     */
    public Credential withQuotaUsedPercent(double quotaUsedPercent) {
        double clamped = Double.isNaN(quotaUsedPercent) ? 0.0 : Math.max(0.0, Math.min(100.0, quotaUsedPercent));
        return new Credential(key, clamped, custom);
    }

    /**
     * 유효해 보이는 키인지 확인 (실제 API 호출 없이 형식만 검사).
     *
     * @return 형식이 유효하면 true
     */
    public boolean looksValid() {
        if (key.isBlank()) {
            return false;
        }
        if (custom) {
            return true;
        }
        return key.startsWith(KEY_PREFIX) && key.length() >= MIN_KEY_LENGTH;
    }

    /**
     * 쿼터를 모두 소진했는지 확인.
     *
     * @return 사용률 100% 이상이면 true
     */
    public boolean isExhausted() {
        return quotaUsedPercent >= 100.0;
    }

    /**
     * 로그/이력용 마스킹된 키 (마지막 8자).
     *
     * @return 마스킹된 키
     */
    public String maskedKey() {
        return mask(key);
    }

    /**
     * 임의 키 문자열 마스킹.
     *
     * @param key API Key (null 허용)
     * @return 마지막 8자, null이면 "none"
     */
    public static String mask(String key) {
        if (key == null) {
            return "none";
        }
        return key.length() <= MASK_VISIBLE_CHARS ? key : key.substring(key.length() - MASK_VISIBLE_CHARS);
    }

    @Override
    public String toString() {
        return "Credential{key=..." + maskedKey() + ", quotaUsedPercent=" + quotaUsedPercent + ", custom=" + custom + '}';
    }
}
