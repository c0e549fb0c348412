package com.ryuqq.jukebox.adapter.runner;

import com.ryuqq.jukebox.application.credential.CredentialPool;
import com.ryuqq.jukebox.application.orchestrator.FailureListener;
import com.ryuqq.jukebox.core.credential.RotationEvent;
import com.ryuqq.jukebox.core.failure.ClassifiedFailure;
import com.ryuqq.jukebox.core.failure.NoCredentialAvailableException;
import com.ryuqq.jukebox.core.model.ServiceName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * 쿼터 소진 실패를 관찰해 자격 증명을 교체하는 {@link FailureListener}.
 *
 * <p>계량 대상 서비스(기본: youtube-api)에서 {@code QUOTA_EXHAUSTED}로 분류된 실패가
 * 보고되면 {@link CredentialPool#refreshQuota()}로 사용률을 다시 읽은 뒤
 * {@link CredentialPool#rotate(String)}를 호출합니다. 재시도 자체는 하지 않으며,
 * 큐의 다음 시도가 새 자격 증명을 사용합니다.</p>
 *
 * <p>교체할 자격 증명이 없으면 ERROR를 남기고 수동 설정이 필요하다고 표시합니다.
 * 이 상태는 이후 교체가 성공하면 해제됩니다.</p>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public class QuotaErrorHandler implements FailureListener {

    private static final Logger log = LoggerFactory.getLogger(QuotaErrorHandler.class);

    static final String ROTATION_REASON = "quota exhausted";

    private final CredentialPool credentialPool;
    private final ServiceName meteredService;
    private volatile boolean manualConfigurationRequired;

    /**
     * 생성자.
     *
     * @param credentialPool 교체 대상 풀
     * @param meteredService 쿼터가 적용되는 서비스
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public QuotaErrorHandler(CredentialPool credentialPool, ServiceName meteredService) {
        if (credentialPool == null) {
            throw new IllegalArgumentException("credentialPool cannot be null");
        }
        if (meteredService == null) {
            throw new IllegalArgumentException("meteredService cannot be null");
        }
        this.credentialPool = credentialPool;
        this.meteredService = meteredService;
    }

    @Override
    public void onFailure(ClassifiedFailure failure) {
        if (!failure.isQuotaExhausted() || !meteredService.equals(failure.serviceName())) {
            return;
        }

        log.warn("Quota exhausted on {} (request: {}, attempt {}); rotating credential",
            failure.serviceName(), failure.dedupKey(), failure.attempt());

        try {
            credentialPool.refreshQuota();
            Optional<RotationEvent> event = credentialPool.rotate(ROTATION_REASON);
            manualConfigurationRequired = false;
            if (event.isEmpty()) {
                log.info("Credential rotation kept the current credential");
            }
        } catch (NoCredentialAvailableException e) {
            manualConfigurationRequired = true;
            log.error("No credential available after quota exhaustion; manual configuration required", e);
        }
    }

    /**
     * 마지막 교체 시도에서 사용할 자격 증명이 없었는지 확인.
     *
     * @return 수동 설정이 필요하면 true
     */
    public boolean isManualConfigurationRequired() {
        return manualConfigurationRequired;
    }
}
