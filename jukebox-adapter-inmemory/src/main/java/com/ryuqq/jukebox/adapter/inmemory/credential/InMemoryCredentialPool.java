package com.ryuqq.jukebox.adapter.inmemory.credential;

import com.ryuqq.jukebox.application.credential.CredentialPool;
import com.ryuqq.jukebox.core.clock.Clock;
import com.ryuqq.jukebox.core.credential.Credential;
import com.ryuqq.jukebox.core.credential.CredentialState;
import com.ryuqq.jukebox.core.credential.RotationEvent;
import com.ryuqq.jukebox.core.failure.NoCredentialAvailableException;
import com.ryuqq.jukebox.core.spi.CredentialSource;
import com.ryuqq.jukebox.core.spi.CredentialStateStore;
import com.ryuqq.jukebox.core.spi.QuotaProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 프로세스 로컬 {@link CredentialPool} 구현.
 *
 * <p><strong>초기화 순서:</strong></p>
 * <ol>
 *   <li>CredentialSource에서 후보 로드 (같은 키는 처음 것만 유지)</li>
 *   <li>CredentialStateStore에서 이전 활성 키와 교체 이력 복원
 *       (알려지지 않았거나 형식이 맞지 않는 키는 버림)</li>
 *   <li>복원할 활성 키가 없으면 선택 규칙으로 초기 키 지정 (이력 없음)</li>
 * </ol>
 *
 * <p>모든 상태 변경 메서드는 인스턴스 모니터로 직렬화되며, 변경 후 상태를
 * CredentialStateStore에 저장합니다.</p>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public class InMemoryCredentialPool implements CredentialPool {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCredentialPool.class);

    static final String MANUAL_SELECTION_REASON = "manual selection";

    private final QuotaProbe quotaProbe;
    private final CredentialStateStore stateStore;
    private final CredentialPoolConfig config;
    private final Clock clock;

    private final Map<String, Credential> credentials = new LinkedHashMap<>();
    private final LinkedList<RotationEvent> history = new LinkedList<>();
    private String activeKey;

    /**
     * 생성자.
     *
     * @param source 후보 자격 증명
     * @param quotaProbe 쿼터 사용률 probe
     * @param stateStore 활성 키 / 이력 저장소
     * @param config 풀 설정
     * @param clock 이력 타임스탬프용 시간 소스
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public InMemoryCredentialPool(
        CredentialSource source,
        QuotaProbe quotaProbe,
        CredentialStateStore stateStore,
        CredentialPoolConfig config,
        Clock clock
    ) {
        if (source == null || quotaProbe == null || stateStore == null || config == null || clock == null) {
            throw new IllegalArgumentException("All arguments are required for InMemoryCredentialPool");
        }
        this.quotaProbe = quotaProbe;
        this.stateStore = stateStore;
        this.config = config;
        this.clock = clock;

        for (Credential candidate : source.loadCandidates()) {
            credentials.putIfAbsent(candidate.key(), candidate);
        }
        restore(stateStore.load());
    }

    private void restore(CredentialState saved) {
        history.addAll(saved.rotationHistory());
        trimHistory();

        Credential savedActive = saved.hasActiveKey() ? credentials.get(saved.activeKey()) : null;
        if (savedActive != null && savedActive.looksValid()) {
            activeKey = savedActive.key();
            log.info("Restored active credential ...{}", savedActive.maskedKey());
            return;
        }
        if (savedActive != null) {
            log.warn("Saved credential ...{} does not look like a valid key", savedActive.maskedKey());
        } else if (saved.hasActiveKey()) {
            log.warn("Saved credential ...{} is no longer configured", Credential.mask(saved.activeKey()));
        }

        Optional<Credential> initial = lowestUsageCandidate();
        if (initial.isPresent()) {
            activeKey = initial.get().key();
            log.info("Initial credential selected ...{}", initial.get().maskedKey());
        } else {
            log.warn("No valid credential configured; manual configuration required");
        }
        persist();
    }

    @Override
    public synchronized Optional<Credential> selectActive() {
        Credential active = activeKey == null ? null : credentials.get(activeKey);
        if (active != null && active.looksValid()
            && active.quotaUsedPercent() < config.rotationThresholdPercent()) {
            return Optional.of(active);
        }
        return lowestUsageCandidate();
    }

    @Override
    public synchronized Optional<RotationEvent> rotate(String reason) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }

        Credential next = selectActive().orElseThrow(() -> {
            log.error("Credential rotation failed ({}): no valid credential available", reason);
            return new NoCredentialAvailableException("No credential with a valid key is configured");
        });

        if (next.key().equals(activeKey)) {
            log.info("Credential rotation ({}) kept ...{} ({}% used)",
                reason, next.maskedKey(), next.quotaUsedPercent());
            return Optional.empty();
        }
        return Optional.of(switchTo(next.key(), reason));
    }

    @Override
    public synchronized void refreshQuota() {
        for (Map.Entry<String, Credential> entry : credentials.entrySet()) {
            Credential credential = entry.getValue();
            double observed;
            try {
                observed = quotaProbe.quotaUsedPercent(credential.key());
            } catch (Exception e) {
                log.warn("Quota probe failed for ...{}, treating as 0%: {}", credential.maskedKey(), e.getMessage());
                observed = 0.0;
            }
            entry.setValue(credential.withQuotaUsedPercent(observed));
        }
        log.debug("Quota refreshed for {} credentials", credentials.size());
    }

    @Override
    public synchronized Optional<Credential> activeCredential() {
        return activeKey == null ? Optional.empty() : Optional.ofNullable(credentials.get(activeKey));
    }

    @Override
    public synchronized Optional<RotationEvent> setActive(String key) {
        if (key == null || !credentials.containsKey(key)) {
            throw new IllegalArgumentException("Unknown credential: ..." + Credential.mask(key));
        }
        if (key.equals(activeKey)) {
            return Optional.empty();
        }
        return Optional.of(switchTo(key, MANUAL_SELECTION_REASON));
    }

    @Override
    public synchronized List<Credential> getCredentials() {
        return List.copyOf(credentials.values());
    }

    @Override
    public synchronized List<RotationEvent> getRotationHistory() {
        return List.copyOf(history);
    }

    @Override
    public synchronized boolean requiresManualConfiguration() {
        return credentials.values().stream().noneMatch(Credential::looksValid);
    }

    private RotationEvent switchTo(String nextKey, String reason) {
        RotationEvent event = RotationEvent.of(
            Instant.ofEpochMilli(clock.currentTimeMillis()), activeKey, nextKey, reason
        );
        activeKey = nextKey;
        history.addFirst(event);
        trimHistory();
        persist();
        log.info("Credential rotated ({}): ...{} → ...{}", reason, event.fromKey(), event.toKey());
        return event;
    }

    /**
     * 유효한 키 중 사용률 최저 (동률이면 설정 순서가 앞선 키).
     */
    private Optional<Credential> lowestUsageCandidate() {
        Credential best = null;
        for (Credential candidate : credentials.values()) {
            if (!candidate.looksValid()) {
                continue;
            }
            if (best == null || candidate.quotaUsedPercent() < best.quotaUsedPercent()) {
                best = candidate;
            }
        }
        return Optional.ofNullable(best);
    }

    private void trimHistory() {
        while (history.size() > config.historySize()) {
            history.removeLast();
        }
    }

    private void persist() {
        stateStore.save(new CredentialState(activeKey, new ArrayList<>(history)));
    }
}
