package com.ryuqq.jukebox.adapter.inmemory.credential;

import com.ryuqq.jukebox.core.model.ServiceName;

/**
 * 자격 증명 풀 설정.
 *
 * @param rotationThresholdPercent 이 사용률 이상이면 교체 후보를 찾음 (기본값: 90.0)
 * @param historySize 보관할 교체 이력 수 (기본값: 10)
 * @param meteredService 쿼터가 과금되는 서비스 (기본값: youtube-api)
 * @author Jukebox Team
 * @since 1.0.0
 */
public record CredentialPoolConfig(
    double rotationThresholdPercent,
    int historySize,
    ServiceName meteredService
) {

    public CredentialPoolConfig {
        if (Double.isNaN(rotationThresholdPercent) || rotationThresholdPercent <= 0.0 || rotationThresholdPercent > 100.0) {
            throw new IllegalArgumentException(
                "rotationThresholdPercent must be in (0, 100] (current: " + rotationThresholdPercent + ")"
            );
        }
        if (historySize <= 0) {
            throw new IllegalArgumentException("historySize must be positive (current: " + historySize + ")");
        }
        if (meteredService == null) {
            throw new IllegalArgumentException("meteredService cannot be null");
        }
    }

    /**
     * 기본 설정으로 생성.
     */
    public CredentialPoolConfig() {
        this(90.0, 10, ServiceName.YOUTUBE_API);
    }

    public CredentialPoolConfig withRotationThresholdPercent(double rotationThresholdPercent) {
        return new CredentialPoolConfig(rotationThresholdPercent, historySize, meteredService);
    }

    public CredentialPoolConfig withHistorySize(int historySize) {
        return new CredentialPoolConfig(rotationThresholdPercent, historySize, meteredService);
    }

    public CredentialPoolConfig withMeteredService(ServiceName meteredService) {
        return new CredentialPoolConfig(rotationThresholdPercent, historySize, meteredService);
    }
}
