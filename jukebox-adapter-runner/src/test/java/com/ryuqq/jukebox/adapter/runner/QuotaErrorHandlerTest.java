package com.ryuqq.jukebox.adapter.runner;

import com.ryuqq.jukebox.application.credential.CredentialPool;
import com.ryuqq.jukebox.core.credential.RotationEvent;
import com.ryuqq.jukebox.core.failure.ClassifiedFailure;
import com.ryuqq.jukebox.core.failure.FailureKind;
import com.ryuqq.jukebox.core.failure.NoCredentialAvailableException;
import com.ryuqq.jukebox.core.model.DedupKey;
import com.ryuqq.jukebox.core.model.RequestParams;
import com.ryuqq.jukebox.core.model.RequestType;
import com.ryuqq.jukebox.core.model.ServiceName;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * QuotaErrorHandler 테스트.
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("QuotaErrorHandler 테스트")
class QuotaErrorHandlerTest {

    private static final DedupKey KEY = DedupKey.of(RequestType.SEARCH, RequestParams.of("q", "lofi"));

    @Mock
    private CredentialPool credentialPool;

    private QuotaErrorHandler handler;

    @BeforeEach
    void setUp() {
        handler = new QuotaErrorHandler(credentialPool, ServiceName.YOUTUBE_API);
    }

    private static ClassifiedFailure failure(FailureKind kind, ServiceName serviceName) {
        return new ClassifiedFailure(kind, serviceName, KEY, 1, new RuntimeException("HTTP 403 quotaExceeded"));
    }

    @Test
    @DisplayName("계량 서비스의 쿼터 소진이면 'quota exhausted' 사유로 교체한다")
    void 쿼터_소진_교체() {
        // given
        RotationEvent event = RotationEvent.of(Instant.EPOCH, "AIzaSyAAAAAAAAAAAAAAAAAAAA", "AIzaSyCCCCCCCCCCCCCCCCCCCC", "quota exhausted");
        when(credentialPool.rotate("quota exhausted")).thenReturn(Optional.of(event));

        // when
        handler.onFailure(failure(FailureKind.QUOTA_EXHAUSTED, ServiceName.YOUTUBE_API));

        // then
        verify(credentialPool, times(1)).rotate("quota exhausted");
        assertThat(handler.isManualConfigurationRequired()).isFalse();
    }

    @Test
    @DisplayName("교체 전에 쿼터 사용률을 다시 읽는다")
    void 교체_전_쿼터_갱신() {
        // given
        when(credentialPool.rotate("quota exhausted")).thenReturn(Optional.empty());

        // when
        handler.onFailure(failure(FailureKind.QUOTA_EXHAUSTED, ServiceName.YOUTUBE_API));

        // then
        InOrder inOrder = inOrder(credentialPool);
        inOrder.verify(credentialPool).refreshQuota();
        inOrder.verify(credentialPool).rotate("quota exhausted");
    }

    @Test
    @DisplayName("다른 서비스의 쿼터 오류는 무시한다")
    void 다른_서비스_무시() {
        // when
        handler.onFailure(failure(FailureKind.QUOTA_EXHAUSTED, ServiceName.YOUTUBE_SCRAPER));

        // then
        verify(credentialPool, never()).rotate(anyString());
    }

    @Test
    @DisplayName("쿼터 소진이 아닌 실패는 무시한다")
    void 다른_분류_무시() {
        // when
        handler.onFailure(failure(FailureKind.TRANSIENT, ServiceName.YOUTUBE_API));
        handler.onFailure(failure(FailureKind.RATE_LIMITED, ServiceName.YOUTUBE_API));

        // then
        verify(credentialPool, never()).rotate(anyString());
    }

    @Test
    @DisplayName("교체할 자격 증명이 없으면 예외를 삼키지 않고 수동 설정 필요 상태로 표시한다")
    void 자격증명_없음() {
        // given
        when(credentialPool.rotate("quota exhausted"))
            .thenThrow(new NoCredentialAvailableException("No credential with a valid key is configured"));

        // when
        handler.onFailure(failure(FailureKind.QUOTA_EXHAUSTED, ServiceName.YOUTUBE_API));

        // then
        assertThat(handler.isManualConfigurationRequired()).isTrue();
    }

    @Test
    @DisplayName("이후 교체가 성공하면 수동 설정 필요 상태가 해제된다")
    void 수동_설정_해제() {
        // given
        when(credentialPool.rotate("quota exhausted"))
            .thenThrow(new NoCredentialAvailableException("No credential with a valid key is configured"))
            .thenReturn(Optional.empty());
        handler.onFailure(failure(FailureKind.QUOTA_EXHAUSTED, ServiceName.YOUTUBE_API));

        // when
        handler.onFailure(failure(FailureKind.QUOTA_EXHAUSTED, ServiceName.YOUTUBE_API));

        // then
        assertThat(handler.isManualConfigurationRequired()).isFalse();
    }
}
