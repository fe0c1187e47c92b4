package com.skillswap.common.encryption.scheduling;

import com.skillswap.common.encryption.KeyManagementService;
import com.skillswap.common.encryption.model.KeyGenerationOptions;
import com.skillswap.common.encryption.model.KeyOperation;
import com.skillswap.common.encryption.model.KeyPurpose;
import com.skillswap.common.encryption.model.KeyRotationResult;
import com.skillswap.common.encryption.model.KeyStatus;
import com.skillswap.common.encryption.model.KeyType;
import com.skillswap.common.encryption.model.KeyUsageRestrictions;
import com.skillswap.common.encryption.support.EncryptionTestFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for KeyMaintenanceScheduler.
 *
 * Tests cover:
 * - Destruction of retired keys after retention
 * - Version pruning along a rotation lineage
 * - Backup creation and verification
 * - Usage spike, usage limit and rotation warnings
 * - Step isolation and shutdown
 */
@DisplayName("KeyMaintenanceScheduler Unit Tests")
class KeyMaintenanceSchedulerTest {

    @Test
    @DisplayName("Should destroy disabled keys once the retention period has passed")
    void shouldDestroyKeysPastRetention() {
        // Given
        EncryptionTestFixture fixture = EncryptionTestFixture.create(p -> p.getKeyManagement().setRetentionPeriod(Duration.ofDays(30)));
        KeyManagementService keyManagementService = fixture.getKeyManagementService();
        String keyId = fixture.createDataKey(256);
        keyManagementService.disableKey(keyId);
        KeyMaintenanceScheduler scheduler = schedulerFor(fixture);

        // When
        KeyMaintenanceReport early = scheduler.performMaintenance();
        fixture.getClock().advance(Duration.ofDays(31));
        KeyMaintenanceReport late = scheduler.performMaintenance();

        // Then
        assertThat(early.getDestroyedKeys()).isZero();
        assertThat(late.getDestroyedKeys()).isEqualTo(1);
        assertThat(keyManagementService.getKeyMetadata(keyId).orElseThrow().getStatus()).isEqualTo(KeyStatus.DESTROYED);
    }

    @Test
    @DisplayName("Should destroy ancestors beyond the configured number of versions")
    void shouldPruneOldVersions() {
        // Given
        EncryptionTestFixture fixture = EncryptionTestFixture.create(p -> p.getKeyManagement().setMaxKeyVersions(2));
        KeyManagementService keyManagementService = fixture.getKeyManagementService();
        String v1 = fixture.createDataKey(256);
        String v2 = keyManagementService.rotateKey(v1).getNewKeyId();
        String v3 = keyManagementService.rotateKey(v2).getNewKeyId();
        KeyRotationResult last = keyManagementService.rotateKey(v3);

        // When
        KeyMaintenanceReport report = schedulerFor(fixture).performMaintenance();

        // Then
        assertThat(last.getNewVersion()).isEqualTo(4);
        assertThat(report.getPrunedVersions()).isEqualTo(2);
        assertThat(keyManagementService.getKeyMetadata(v3).orElseThrow().getStatus()).isEqualTo(KeyStatus.ARCHIVED);
        assertThat(keyManagementService.getKeyMetadata(v2).orElseThrow().getStatus()).isEqualTo(KeyStatus.DESTROYED);
        assertThat(keyManagementService.getKeyMetadata(v1).orElseThrow().getStatus()).isEqualTo(KeyStatus.DESTROYED);
    }

    @Test
    @DisplayName("Should back up unprotected keys and verify existing backups")
    void shouldMaintainBackups() {
        // Given
        EncryptionTestFixture fixture = EncryptionTestFixture.create();
        String backedUp = fixture.createDataKey(256);
        String rotatedFrom = fixture.createKey(KeyType.SYMMETRIC, KeyPurpose.KEY_ENCRYPTION, KeyGenerationOptions.defaults());
        String successor = fixture.getKeyManagementService().rotateKey(rotatedFrom).getNewKeyId();

        // When
        KeyMaintenanceReport report = schedulerFor(fixture).performMaintenance();

        // Then
        assertThat(report.getBackupsCreated()).isEqualTo(1);
        assertThat(report.getBackupsVerified()).isEqualTo(2);
        assertThat(report.getBackupFailures()).isZero();
        assertThat(fixture.getKeyManagementService().getKeyMetadata(successor).orElseThrow().getBackupInfo()).isNotNull();
        assertThat(fixture.getKeyManagementService().getKeyMetadata(backedUp).orElseThrow().getBackupInfo()).isNotNull();
    }

    @Test
    @DisplayName("Should warn about a usage spike against the daily average")
    void shouldReportUsageSpike() {
        // Given
        EncryptionTestFixture fixture = EncryptionTestFixture.create();
        KeyManagementService keyManagementService = fixture.getKeyManagementService();
        String keyId = fixture.createDataKey(256);
        for (int day = 0; day < 3; day++) {
            keyManagementService.recordUsage(keyId, KeyOperation.ENCRYPT, 10);
            fixture.getClock().advance(Duration.ofDays(1));
        }
        for (int i = 0; i < 10; i++) {
            keyManagementService.recordUsage(keyId, KeyOperation.ENCRYPT, 10);
        }

        // When
        KeyMaintenanceReport report = schedulerFor(fixture).performMaintenance();

        // Then
        assertThat(report.getUsageWarnings())
            .anySatisfy(warning -> assertThat(warning).contains(keyId).contains("usage spike"));
    }

    @Test
    @DisplayName("Should warn when a key nears its operation limit or rotation time")
    void shouldReportLimitAndRotationWarnings() {
        // Given
        EncryptionTestFixture fixture = EncryptionTestFixture.create();
        KeyManagementService keyManagementService = fixture.getKeyManagementService();
        String limited = fixture.createKey(KeyType.SYMMETRIC, KeyPurpose.DATA_ENCRYPTION, KeyGenerationOptions.builder()
            .usageRestrictions(KeyUsageRestrictions.builder().maxOperations(10L).build())
            .build());
        for (int i = 0; i < 9; i++) {
            keyManagementService.recordUsage(limited, KeyOperation.ENCRYPT, 1);
        }
        String rotating = fixture.createKey(KeyType.SYMMETRIC, KeyPurpose.SIGNING, KeyGenerationOptions.defaults());
        keyManagementService.scheduleRotation(rotating, fixture.getClock().instant().plus(Duration.ofDays(3)));

        // When
        KeyMaintenanceReport report = schedulerFor(fixture).performMaintenance();

        // Then
        assertThat(report.getUsageWarnings())
            .anySatisfy(warning -> assertThat(warning).contains(limited).contains("9 of 10"))
            .anySatisfy(warning -> assertThat(warning).contains(rotating).contains("due for rotation"));
    }

    @Test
    @DisplayName("Should run remaining steps when one step fails")
    void shouldIsolateFailingStep() {
        // Given
        EncryptionTestFixture fixture = EncryptionTestFixture.create();
        KeyManagementService keyManagementService = mock(KeyManagementService.class);
        when(keyManagementService.recoverIncompleteRotations()).thenThrow(new IllegalStateException("store unavailable"));
        KeyMaintenanceScheduler scheduler = new KeyMaintenanceScheduler(keyManagementService, fixture.getProperties(),
            fixture.getClock());

        // When
        KeyMaintenanceReport report = scheduler.performMaintenance();

        // Then
        assertThat(report.isSkipped()).isFalse();
        verify(keyManagementService).getRetiredKeys();
        verify(keyManagementService, atLeastOnce()).getActiveKeys(KeyPurpose.DATA_ENCRYPTION);
    }

    @Test
    @DisplayName("Should not touch keys after shutdown")
    void shouldDoNothingAfterStop() {
        // Given
        EncryptionTestFixture fixture = EncryptionTestFixture.create();
        KeyManagementService keyManagementService = mock(KeyManagementService.class);
        KeyMaintenanceScheduler scheduler = new KeyMaintenanceScheduler(keyManagementService, fixture.getProperties(),
            fixture.getClock());
        scheduler.stop();

        // When
        scheduler.performMaintenance();

        // Then
        verifyNoInteractions(keyManagementService);
    }

    private static KeyMaintenanceScheduler schedulerFor(EncryptionTestFixture fixture) {
        return new KeyMaintenanceScheduler(fixture.getKeyManagementService(), fixture.getProperties(), fixture.getClock());
    }
}
