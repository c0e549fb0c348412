package com.ryuqq.jukebox.testkit.contract;

import com.ryuqq.jukebox.application.credential.CredentialPool;
import com.ryuqq.jukebox.core.clock.Clock;
import com.ryuqq.jukebox.core.credential.Credential;
import com.ryuqq.jukebox.core.credential.CredentialState;
import com.ryuqq.jukebox.core.credential.RotationEvent;
import com.ryuqq.jukebox.core.failure.NoCredentialAvailableException;
import com.ryuqq.jukebox.testkit.clock.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract every {@link CredentialPool} implementation must satisfy.
 *
 * <p>Implementations are created with a rotation threshold of 90% and a rotation
 * history bounded at 10 entries.</p>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public abstract class AbstractCredentialPoolContractTest {

    protected static final String KEY_A = apiKey('A');
    protected static final String KEY_B = apiKey('B');
    protected static final String KEY_C = apiKey('C');
    protected static final String QUOTA_EXHAUSTED = "quota exhausted";

    protected ManualClock clock;

    /**
     * Creates the pool under test.
     *
     * @param candidates credentials in configuration order, with their observed usage
     * @param savedState previously persisted active key and history
     * @param clock time source for rotation timestamps
     * @return fresh pool
     */
    protected abstract CredentialPool createPool(List<Credential> candidates, CredentialState savedState, Clock clock);

    /**
     * Builds a key that passes the format check, ending in eight copies of {@code marker}.
     *
     * @param marker distinguishing character
     * @return API key
     */
    protected static String apiKey(char marker) {
        return "AIzaSy" + String.valueOf(marker).repeat(20);
    }

    protected static Credential credential(String key, double quotaUsedPercent) {
        return new Credential(key, quotaUsedPercent, false);
    }

    protected static CredentialState activeState(String key) {
        return new CredentialState(key, List.of());
    }

    @BeforeEach
    void setUpClock() {
        clock = new ManualClock(Instant.parse("2026-01-01T00:00:00Z").toEpochMilli());
    }

    @Test
    void selectActive_ActiveUnderThreshold_KeepsActive() {
        // Given
        CredentialPool pool = createPool(
            List.of(credential(KEY_A, 50.0), credential(KEY_B, 10.0)), activeState(KEY_A), clock
        );

        // When
        Optional<Credential> selected = pool.selectActive();

        // Then
        assertEquals(KEY_A, selected.orElseThrow().key());
    }

    @Test
    void rotate_ActiveOverThreshold_SwitchesToLowestUsage() {
        // Given
        CredentialPool pool = createPool(
            List.of(credential(KEY_A, 95.0), credential(KEY_B, 40.0), credential(KEY_C, 10.0)),
            activeState(KEY_A),
            clock
        );

        // When
        Optional<RotationEvent> event = pool.rotate(QUOTA_EXHAUSTED);

        // Then
        assertTrue(event.isPresent());
        assertEquals(Credential.mask(KEY_A), event.get().fromKey());
        assertEquals(Credential.mask(KEY_C), event.get().toKey());
        assertEquals(QUOTA_EXHAUSTED, event.get().reason());
        assertEquals(Instant.ofEpochMilli(clock.currentTimeMillis()), event.get().timestamp());
        assertEquals(KEY_C, pool.activeCredential().orElseThrow().key());
        assertEquals(List.of(event.get()), pool.getRotationHistory());
    }

    @Test
    void rotate_SelectionUnchanged_ReturnsEmptyWithoutHistory() {
        // Given
        CredentialPool pool = createPool(
            List.of(credential(KEY_A, 50.0), credential(KEY_B, 10.0)), activeState(KEY_A), clock
        );

        // When
        Optional<RotationEvent> event = pool.rotate(QUOTA_EXHAUSTED);

        // Then
        assertTrue(event.isEmpty());
        assertTrue(pool.getRotationHistory().isEmpty());
        assertEquals(KEY_A, pool.activeCredential().orElseThrow().key());
    }

    @Test
    void rotate_NoValidKey_ThrowsNoCredentialAvailable() {
        // Given
        CredentialPool pool = createPool(
            List.of(credential("not-a-key", 0.0), credential("AIza-short", 0.0)), CredentialState.empty(), clock
        );

        // When & Then
        assertTrue(pool.selectActive().isEmpty());
        assertTrue(pool.requiresManualConfiguration());
        assertThrows(NoCredentialAvailableException.class, () -> pool.rotate(QUOTA_EXHAUSTED));
        assertTrue(pool.getRotationHistory().isEmpty());
    }

    @Test
    void selectActive_InvalidLookingKey_IsSkippedEvenWithLowestUsage() {
        // Given
        CredentialPool pool = createPool(
            List.of(credential("AIza-short", 0.0), credential(KEY_A, 95.0), credential(KEY_B, 60.0)),
            activeState(KEY_A),
            clock
        );

        // When & Then
        assertEquals(KEY_B, pool.selectActive().orElseThrow().key());
        assertFalse(pool.requiresManualConfiguration());
    }

    @Test
    void selectActive_EqualUsage_PrefersConfigurationOrder() {
        // Given
        CredentialPool pool = createPool(
            List.of(credential(KEY_A, 95.0), credential(KEY_B, 20.0), credential(KEY_C, 20.0)),
            activeState(KEY_A),
            clock
        );

        // When & Then
        assertEquals(KEY_B, pool.selectActive().orElseThrow().key());
    }

    @Test
    void selectActive_CustomKey_AcceptedWithoutFormatCheck() {
        // Given
        CredentialPool pool = createPool(
            List.of(credential(KEY_A, 95.0), new Credential("my-private-key", 0.0, true)),
            activeState(KEY_A),
            clock
        );

        // When & Then
        assertEquals("my-private-key", pool.selectActive().orElseThrow().key());
    }

    @Test
    void selectActive_DoesNotChangeActiveCredential() {
        // Given
        CredentialPool pool = createPool(
            List.of(credential(KEY_A, 95.0), credential(KEY_B, 10.0)), activeState(KEY_A), clock
        );

        // When
        pool.selectActive();

        // Then
        assertEquals(KEY_A, pool.activeCredential().orElseThrow().key());
    }

    @Test
    void activeCredential_NoSavedSelection_StartsWithLowestUsage() {
        // Given
        CredentialPool pool = createPool(
            List.of(credential(KEY_A, 70.0), credential(KEY_B, 30.0)), CredentialState.empty(), clock
        );

        // When & Then
        assertEquals(KEY_B, pool.activeCredential().orElseThrow().key());
        assertTrue(pool.getRotationHistory().isEmpty());
    }

    @Test
    void getRotationHistory_ManyRotations_KeepsTenMostRecentFirst() {
        // Given
        CredentialPool pool = createPool(
            List.of(credential(KEY_A, 0.0), credential(KEY_B, 0.0)), activeState(KEY_A), clock
        );

        // When
        for (int i = 0; i < 12; i++) {
            clock.advanceMillis(1_000);
            pool.setActive(i % 2 == 0 ? KEY_B : KEY_A);
        }

        // Then
        List<RotationEvent> history = pool.getRotationHistory();
        assertEquals(10, history.size());
        assertEquals(Instant.ofEpochMilli(clock.currentTimeMillis()), history.get(0).timestamp());
        assertEquals(Credential.mask(KEY_A), history.get(0).toKey());
        assertTrue(history.get(0).timestamp().isAfter(history.get(9).timestamp()));
    }

    @Test
    void setActive_UnknownKey_ThrowsException() {
        // Given
        CredentialPool pool = createPool(List.of(credential(KEY_A, 0.0)), CredentialState.empty(), clock);

        // When & Then
        assertThrows(IllegalArgumentException.class, () -> pool.setActive(KEY_C));
    }

    @Test
    void setActive_SameKey_ReturnsEmpty() {
        // Given
        CredentialPool pool = createPool(List.of(credential(KEY_A, 0.0)), activeState(KEY_A), clock);

        // When & Then
        assertTrue(pool.setActive(KEY_A).isEmpty());
    }

    @Test
    void rotate_BlankReason_ThrowsException() {
        // Given
        CredentialPool pool = createPool(List.of(credential(KEY_A, 0.0)), activeState(KEY_A), clock);

        // When & Then
        assertThrows(IllegalArgumentException.class, () -> pool.rotate(" "));
    }
}
