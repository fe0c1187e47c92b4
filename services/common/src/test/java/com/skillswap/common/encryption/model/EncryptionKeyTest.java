package com.skillswap.common.encryption.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for key record state rules and usage rollups.
 *
 * Tests cover:
 * - Encryption and decryption eligibility per status
 * - Rotation due dates
 * - Classification floors
 * - Daily usage retention
 * - Metadata snapshots
 */
@DisplayName("EncryptionKey Unit Tests")
class EncryptionKeyTest {

    private static final Instant NOW = Instant.parse("2024-03-04T10:15:30Z");

    @Test
    @DisplayName("Should allow encryption only with active unexpired keys")
    void shouldLimitEncryptionToActiveKeys() {
        assertThat(key(KeyStatus.ACTIVE, null).isUsableForEncryptionAt(NOW)).isTrue();
        assertThat(key(KeyStatus.ACTIVE, NOW).isUsableForEncryptionAt(NOW)).isFalse();
        assertThat(key(KeyStatus.ARCHIVED, null).isUsableForEncryptionAt(NOW)).isFalse();
        assertThat(key(KeyStatus.DISABLED, null).isUsableForEncryptionAt(NOW)).isFalse();
    }

    @Test
    @DisplayName("Should allow decryption with archived, disabled and rotating keys")
    void shouldAllowDecryptionWithRetiredKeys() {
        assertThat(key(KeyStatus.ARCHIVED, NOW.minusSeconds(60)).isUsableForDecryptionAt(NOW)).isTrue();
        assertThat(key(KeyStatus.DISABLED, null).isUsableForDecryptionAt(NOW)).isTrue();
        assertThat(key(KeyStatus.ROTATING, null).isUsableForDecryptionAt(NOW)).isTrue();
        assertThat(key(KeyStatus.ACTIVE, NOW.minusSeconds(60)).isUsableForDecryptionAt(NOW)).isFalse();
        assertThat(key(KeyStatus.EXPIRED, null).isUsableForDecryptionAt(NOW)).isFalse();
        assertThat(key(KeyStatus.COMPROMISED, null).isUsableForDecryptionAt(NOW)).isFalse();
        assertThat(key(KeyStatus.DESTROYED, null).isUsableForDecryptionAt(NOW)).isFalse();
    }

    @Test
    @DisplayName("Should be due for rotation when scheduled, too old or expired")
    void shouldComputeRotationDue() {
        // Given
        EncryptionKey scheduled = key(KeyStatus.ACTIVE, null);
        scheduled.setRotationSchedule(KeyRotationSchedule.builder()
            .autoRotate(true).nextRotation(NOW).maxKeyAge(Duration.ofDays(365)).build());
        EncryptionKey manual = key(KeyStatus.ACTIVE, null);
        manual.setRotationSchedule(KeyRotationSchedule.builder()
            .autoRotate(false).nextRotation(NOW.minusSeconds(1)).maxKeyAge(Duration.ofDays(365)).build());
        EncryptionKey old = key(KeyStatus.ACTIVE, null);
        old.setCreatedAt(NOW.minus(Duration.ofDays(400)));
        old.setRotationSchedule(KeyRotationSchedule.builder().maxKeyAge(Duration.ofDays(365)).build());

        // Then
        assertThat(scheduled.isDueForRotationAt(NOW)).isTrue();
        assertThat(manual.isDueForRotationAt(NOW)).isFalse();
        assertThat(old.isDueForRotationAt(NOW)).isTrue();
        assertThat(key(KeyStatus.ACTIVE, NOW).isDueForRotationAt(NOW)).isTrue();
    }

    @Test
    @DisplayName("Should apply minimum key sizes per classification")
    void shouldApplyClassificationFloors() {
        assertThat(DataClassification.PUBLIC.isSatisfiedBy(128)).isTrue();
        assertThat(DataClassification.CONFIDENTIAL.isSatisfiedBy(128)).isFalse();
        assertThat(DataClassification.CONFIDENTIAL.isSatisfiedBy(192)).isTrue();
        assertThat(DataClassification.TOP_SECRET.isSatisfiedBy(192)).isFalse();
        assertThat(DataClassification.TOP_SECRET.isSatisfiedBy(256)).isTrue();
    }

    @Test
    @DisplayName("Should keep daily usage for ninety days")
    void shouldPruneOldDailyUsage() {
        // Given
        KeyUsageStatistics usage = new KeyUsageStatistics();
        usage.record(KeyOperation.ENCRYPT, 10, NOW);

        // When
        usage.record(KeyOperation.DECRYPT, 5, NOW.plus(Duration.ofDays(91)));

        // Then
        assertThat(usage.getTotalOperations()).isEqualTo(2);
        assertThat(usage.getTotalBytesProcessed()).isEqualTo(15);
        assertThat(usage.getFirstUsed()).isEqualTo(NOW);
        assertThat(usage.getDailyUsage()).hasSize(1);
        assertThat(usage.operationsOn(LocalDate.of(2024, 3, 4))).isZero();
    }

    @Test
    @DisplayName("Should hand out metadata that cannot change the key")
    void shouldSnapshotMutableStateInMetadata() {
        // Given
        EncryptionKey key = key(KeyStatus.ACTIVE, null);
        key.setUsageRestrictions(KeyUsageRestrictions.builder().maxOperations(5L).build());
        key.setRotationSchedule(KeyRotationSchedule.builder().autoRotate(true).nextRotation(NOW).build());
        key.setBackupInfo(KeyBackupInfo.builder().backupId("backup_1").status(BackupStatus.VALID).build());

        // When
        KeyMetadata metadata = key.toMetadata();
        metadata.getUsageRestrictions().setMaxOperations(500L);
        metadata.getUsageRestrictions().getAllowedUserIds().add("mallory");
        metadata.getRotationSchedule().setAutoRotate(false);
        metadata.getBackupInfo().setStatus(BackupStatus.VERIFICATION_FAILED);

        // Then
        assertThat(key.getUsageRestrictions().getMaxOperations()).isEqualTo(5L);
        assertThat(key.getUsageRestrictions().getAllowedUserIds()).isEmpty();
        assertThat(key.getRotationSchedule().isAutoRotate()).isTrue();
        assertThat(key.getBackupInfo().getStatus()).isEqualTo(BackupStatus.VALID);
    }

    private static EncryptionKey key(KeyStatus status, Instant expiresAt) {
        return EncryptionKey.builder()
            .id("key_1")
            .status(status)
            .createdAt(NOW.minus(Duration.ofDays(1)))
            .expiresAt(expiresAt)
            .build();
    }
}
