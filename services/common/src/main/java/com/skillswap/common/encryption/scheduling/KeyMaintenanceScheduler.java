package com.skillswap.common.encryption.scheduling;

import com.skillswap.common.config.EncryptionProperties;
import com.skillswap.common.encryption.KeyManagementService;
import com.skillswap.common.encryption.model.DailyUsageStatistics;
import com.skillswap.common.encryption.model.KeyBackupResult;
import com.skillswap.common.encryption.model.KeyMetadata;
import com.skillswap.common.encryption.model.KeyPurpose;
import com.skillswap.common.encryption.model.KeyRotationSchedule;
import com.skillswap.common.encryption.model.KeyStatus;
import com.skillswap.common.encryption.model.KeyUsageStatistics;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic key housekeeping. Each run:
 * <ol>
 *   <li>completes rotations left half-done</li>
 *   <li>destroys retired keys whose retention period has elapsed</li>
 *   <li>destroys lineage ancestors beyond the configured version count</li>
 *   <li>backs up active keys that have no backup (when auto-backup is on)</li>
 *   <li>verifies existing backups</li>
 *   <li>reports usage anomalies and upcoming rotations</li>
 * </ol>
 * A failing step is logged and does not stop the remaining steps.
 */
@Component
@Slf4j
public class KeyMaintenanceScheduler {

    private final KeyManagementService keyManagementService;
    private final EncryptionProperties properties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    public KeyMaintenanceScheduler(KeyManagementService keyManagementService, EncryptionProperties properties, Clock clock) {
        this.keyManagementService = keyManagementService;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${skillswap.encryption.scheduling.maintenance-interval:PT6H}",
               initialDelayString = "${skillswap.encryption.scheduling.maintenance-interval:PT6H}")
    public KeyMaintenanceReport performMaintenance() {
        KeyMaintenanceReport report = new KeyMaintenanceReport();
        if (!running.compareAndSet(false, true)) {
            log.debug("Key maintenance already in progress, skipping");
            report.setSkipped(true);
            return report;
        }
        try {
            log.info("Starting key maintenance");
            runStep("rotation recovery", () -> report.setRecoveredRotations(keyManagementService.recoverIncompleteRotations()));
            runStep("retention cleanup", () -> destroyKeysPastRetention(report));
            runStep("version pruning", () -> pruneKeyVersions(report));
            runStep("backup creation", () -> createMissingBackups(report));
            runStep("backup verification", () -> verifyBackups(report));
            runStep("usage monitoring", () -> monitorUsage(report));
            log.info("Key maintenance finished: {}", report);
        } finally {
            running.set(false);
        }
        return report;
    }

    @PreDestroy
    public void stop() {
        stopRequested.set(true);
    }

    private void runStep(String name, Runnable step) {
        if (stopRequested.get()) {
            return;
        }
        try {
            step.run();
        } catch (Exception e) {
            log.error("Key maintenance step '{}' failed", name, e);
        }
    }

    private void destroyKeysPastRetention(KeyMaintenanceReport report) {
        Instant cutoff = clock.instant().minus(properties.getKeyManagement().getRetentionPeriod());
        for (KeyMetadata key : keyManagementService.getRetiredKeys()) {
            if (stopRequested.get()) {
                return;
            }
            Instant retiredAt = key.getStatusChangedAt() != null ? key.getStatusChangedAt() : key.getCreatedAt();
            if (retiredAt != null && retiredAt.isBefore(cutoff) && keyManagementService.destroyKey(key.getId())) {
                log.info("Destroyed {} key {} after retention period", key.getStatus(), key.getId());
                report.setDestroyedKeys(report.getDestroyedKeys() + 1);
            }
        }
    }

    private void pruneKeyVersions(KeyMaintenanceReport report) {
        int maxVersions = properties.getKeyManagement().getMaxKeyVersions();
        for (KeyMetadata active : activeKeys()) {
            Set<String> visited = new HashSet<>();
            visited.add(active.getId());
            String parentId = active.getParentKeyId();
            int depth = 1;
            while (parentId != null && visited.add(parentId) && !stopRequested.get()) {
                Optional<KeyMetadata> parent = keyManagementService.getKeyMetadata(parentId);
                if (parent.isEmpty()) {
                    break;
                }
                KeyStatus status = parent.get().getStatus();
                if (depth >= maxVersions && status != KeyStatus.DESTROYED && status != KeyStatus.ACTIVE
                        && keyManagementService.destroyKey(parentId)) {
                    log.info("Destroyed key {} beyond {} retained versions of {}", parentId, maxVersions, active.getId());
                    report.setPrunedVersions(report.getPrunedVersions() + 1);
                }
                parentId = parent.get().getParentKeyId();
                depth++;
            }
        }
    }

    private void createMissingBackups(KeyMaintenanceReport report) {
        if (!properties.getKeyManagement().isAutoCreateBackups()) {
            return;
        }
        for (KeyMetadata key : activeKeys()) {
            if (stopRequested.get()) {
                return;
            }
            if (key.getBackupInfo() == null) {
                KeyBackupResult backup = keyManagementService.backupKey(key.getId());
                if (backup.isSuccess()) {
                    report.setBackupsCreated(report.getBackupsCreated() + 1);
                } else {
                    log.warn("Could not back up key {}: {}", key.getId(), backup.getErrorMessage());
                }
            }
        }
    }

    private void verifyBackups(KeyMaintenanceReport report) {
        for (KeyMetadata key : activeKeys()) {
            if (stopRequested.get()) {
                return;
            }
            if (key.getBackupInfo() == null) {
                continue;
            }
            if (keyManagementService.verifyBackup(key.getId())) {
                report.setBackupsVerified(report.getBackupsVerified() + 1);
            } else {
                report.setBackupFailures(report.getBackupFailures() + 1);
            }
        }
    }

    private void monitorUsage(KeyMaintenanceReport report) {
        if (!properties.getKeyManagement().isEnableUsageMonitoring()) {
            return;
        }
        EncryptionProperties.Scheduling config = properties.getScheduling();
        Instant now = clock.instant();
        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);

        for (KeyMetadata key : activeKeys()) {
            Optional<KeyUsageStatistics> usage = keyManagementService.getKeyUsage(key.getId());
            if (usage.isPresent()) {
                checkDailySpike(key, usage.get(), today, config.getUsageSpikeFactor(), report);
                Long maxOperations = key.getUsageRestrictions() != null ? key.getUsageRestrictions().getMaxOperations() : null;
                if (maxOperations != null && usage.get().getTotalOperations() >= maxOperations * config.getUsageLimitWarningRatio()) {
                    warn(report, String.format("Key %s has used %d of %d permitted operations",
                        key.getId(), usage.get().getTotalOperations(), maxOperations));
                }
            }

            KeyRotationSchedule schedule = key.getRotationSchedule();
            if (schedule != null && schedule.getWarningThreshold() != null) {
                Instant warnFrom = now.plus(schedule.getWarningThreshold());
                if (schedule.isAutoRotate() && schedule.getNextRotation() != null && !schedule.getNextRotation().isAfter(warnFrom)) {
                    warn(report, String.format("Key %s is due for rotation at %s", key.getId(), schedule.getNextRotation()));
                }
                if (key.getExpiresAt() != null && !key.getExpiresAt().isAfter(warnFrom)) {
                    warn(report, String.format("Key %s expires at %s", key.getId(), key.getExpiresAt()));
                }
            }
        }
    }

    private void checkDailySpike(KeyMetadata key, KeyUsageStatistics usage, LocalDate today, double factor,
                                 KeyMaintenanceReport report) {
        if (usage.getDailyUsage() == null) {
            return;
        }
        long todayOperations = usage.operationsOn(today);
        long previousTotal = 0;
        int previousDays = 0;
        for (Map.Entry<String, DailyUsageStatistics> day : usage.getDailyUsage().entrySet()) {
            if (!day.getKey().equals(today.toString())) {
                previousTotal += day.getValue().getOperationCount();
                previousDays++;
            }
        }
        if (previousDays == 0) {
            return;
        }
        double average = (double) previousTotal / previousDays;
        if (todayOperations > average * factor) {
            warn(report, String.format("Key %s usage spike: %d operations today against a daily average of %.1f",
                key.getId(), todayOperations, average));
        }
    }

    private List<KeyMetadata> activeKeys() {
        List<KeyMetadata> keys = new ArrayList<>();
        for (KeyPurpose purpose : KeyPurpose.values()) {
            keys.addAll(keyManagementService.getActiveKeys(purpose));
        }
        return keys;
    }

    private static void warn(KeyMaintenanceReport report, String message) {
        log.warn(message);
        report.getUsageWarnings().add(message);
    }
}
