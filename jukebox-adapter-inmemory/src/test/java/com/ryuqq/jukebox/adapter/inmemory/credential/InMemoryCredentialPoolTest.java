package com.ryuqq.jukebox.adapter.inmemory.credential;

import com.ryuqq.jukebox.core.credential.Credential;
import com.ryuqq.jukebox.core.credential.CredentialState;
import com.ryuqq.jukebox.core.credential.RotationEvent;
import com.ryuqq.jukebox.core.spi.QuotaProbe;
import com.ryuqq.jukebox.testkit.clock.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("InMemoryCredentialPool 테스트")
class InMemoryCredentialPoolTest {

    private static final String KEY_A = "AIzaSy" + "A".repeat(20);
    private static final String KEY_B = "AIzaSy" + "B".repeat(20);

    @Mock
    private QuotaProbe quotaProbe;

    private ManualClock clock;
    private InMemoryCredentialStateStore stateStore;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(Instant.parse("2026-01-01T00:00:00Z").toEpochMilli());
        stateStore = new InMemoryCredentialStateStore();
    }

    private InMemoryCredentialPool createPool(String... keys) {
        StaticCredentialSource source = StaticCredentialSource.fromCommaSeparated(String.join(",", keys));
        return new InMemoryCredentialPool(source, quotaProbe, stateStore, new CredentialPoolConfig(), clock);
    }

    @Test
    @DisplayName("저장소에 남은 활성 키와 이력을 복원한다")
    void 상태_복원() {
        // given
        RotationEvent previous = RotationEvent.of(Instant.EPOCH, KEY_A, KEY_B, "quota exhausted");
        stateStore = new InMemoryCredentialStateStore(new CredentialState(KEY_B, List.of(previous)));

        // when
        InMemoryCredentialPool pool = createPool(KEY_A, KEY_B);

        // then
        assertThat(pool.activeCredential()).map(Credential::key).contains(KEY_B);
        assertThat(pool.getRotationHistory()).containsExactly(previous);
    }

    @Test
    @DisplayName("설정에서 사라진 저장 키는 버리고 초기 선택을 다시 한다")
    void 사라진_키_무시() {
        // given
        stateStore = new InMemoryCredentialStateStore(new CredentialState("AIzaSy-removed-key-0000000", List.of()));

        // when
        InMemoryCredentialPool pool = createPool(KEY_A, KEY_B);

        // then
        assertThat(pool.activeCredential()).map(Credential::key).contains(KEY_A);
        assertThat(stateStore.load().activeKey()).isEqualTo(KEY_A);
    }

    @Test
    @DisplayName("저장된 활성 키가 형식에 맞지 않으면 복원하지 않고 유효한 키를 고른다")
    void 형식_불일치_키_무시() {
        // given
        stateStore = new InMemoryCredentialStateStore(new CredentialState("legacy-key", List.of()));

        // when
        InMemoryCredentialPool pool = createPool("legacy-key", KEY_A);

        // then
        assertThat(pool.activeCredential()).map(Credential::key).contains(KEY_A);
        assertThat(stateStore.load().activeKey()).isEqualTo(KEY_A);
    }

    @Test
    @DisplayName("교체 결과는 저장소에 기록된다")
    void 교체_저장() throws Exception {
        // given
        InMemoryCredentialPool pool = createPool(KEY_A, KEY_B);
        when(quotaProbe.quotaUsedPercent(KEY_A)).thenReturn(95.0);
        when(quotaProbe.quotaUsedPercent(KEY_B)).thenReturn(5.0);
        pool.refreshQuota();

        // when
        Optional<RotationEvent> event = pool.rotate("quota exhausted");

        // then
        assertThat(event).isPresent();
        assertThat(stateStore.load().activeKey()).isEqualTo(KEY_B);
        assertThat(stateStore.load().rotationHistory()).containsExactly(event.get());
    }

    @Test
    @DisplayName("probe 실패는 사용률 0%로 취급한다")
    void probe_실패() throws Exception {
        // given
        InMemoryCredentialPool pool = createPool(KEY_A);
        when(quotaProbe.quotaUsedPercent(anyString())).thenThrow(new IOException("quota endpoint unreachable"));

        // when
        pool.refreshQuota();

        // then
        assertThat(pool.getCredentials()).extracting(Credential::quotaUsedPercent).containsExactly(0.0);
    }

    @Test
    @DisplayName("범위를 벗어난 probe 값은 0~100으로 보정한다")
    void probe_보정() throws Exception {
        // given
        InMemoryCredentialPool pool = createPool(KEY_A, KEY_B);
        when(quotaProbe.quotaUsedPercent(KEY_A)).thenReturn(130.0);
        when(quotaProbe.quotaUsedPercent(KEY_B)).thenReturn(-5.0);

        // when
        pool.refreshQuota();

        // then
        assertThat(pool.getCredentials()).extracting(Credential::quotaUsedPercent).containsExactly(100.0, 0.0);
    }

    @Test
    @DisplayName("중복 키는 처음 것만 남긴다")
    void 중복_키() {
        // when
        InMemoryCredentialPool pool = createPool(KEY_A, KEY_B, KEY_A);

        // then
        assertThat(pool.getCredentials()).extracting(Credential::key).containsExactly(KEY_A, KEY_B);
    }

    @Test
    @DisplayName("키가 하나도 없으면 수동 설정이 필요하다")
    void 빈_설정() {
        // when
        InMemoryCredentialPool pool = createPool();

        // then
        assertThat(pool.requiresManualConfiguration()).isTrue();
        assertThat(pool.activeCredential()).isEmpty();
        assertThat(pool.selectActive()).isEmpty();
    }

    @Test
    @DisplayName("수동 선택은 manual selection 사유로 기록된다")
    void 수동_선택() {
        // given
        InMemoryCredentialPool pool = createPool(KEY_A, KEY_B);

        // when
        Optional<RotationEvent> event = pool.setActive(KEY_B);

        // then
        assertThat(event).map(RotationEvent::reason).contains(InMemoryCredentialPool.MANUAL_SELECTION_REASON);
        assertThat(event).map(RotationEvent::toKey).contains("BBBBBBBB");
    }
}
