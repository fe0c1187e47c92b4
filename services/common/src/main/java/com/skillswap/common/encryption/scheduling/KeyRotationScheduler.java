package com.skillswap.common.encryption.scheduling;

import com.skillswap.common.config.EncryptionProperties;
import com.skillswap.common.encryption.KeyManagementService;
import com.skillswap.common.encryption.model.KeyRotationResult;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically rotates keys that are expired, past their maximum age, or at their scheduled
 * rotation time. Does nothing unless {@code skillswap.encryption.key-management.auto-rotate-keys}
 * is on. Failed rotations are logged and picked up again on the next run.
 */
@Component
@Slf4j
public class KeyRotationScheduler {

    private final KeyManagementService keyManagementService;
    private final EncryptionProperties properties;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    public KeyRotationScheduler(KeyManagementService keyManagementService, EncryptionProperties properties) {
        this.keyManagementService = keyManagementService;
        this.properties = properties;
    }

    /**
     * @return number of keys rotated in this run
     */
    @Scheduled(fixedDelayString = "${skillswap.encryption.scheduling.rotation-check-interval:PT1H}",
               initialDelayString = "${skillswap.encryption.scheduling.rotation-check-interval:PT1H}")
    public int checkAndRotateKeys() {
        if (!properties.getKeyManagement().isAutoRotateKeys()) {
            log.debug("Automatic key rotation is disabled");
            return 0;
        }
        if (!running.compareAndSet(false, true)) {
            log.debug("Key rotation check already in progress, skipping");
            return 0;
        }
        int rotated = 0;
        try {
            List<String> dueKeys = keyManagementService.getKeysDueForRotation();
            if (!dueKeys.isEmpty()) {
                log.info("Found {} keys due for rotation", dueKeys.size());
            }
            for (String keyId : dueKeys) {
                if (stopRequested.get()) {
                    log.info("Key rotation check stopped after {} rotations", rotated);
                    break;
                }
                try {
                    KeyRotationResult result = keyManagementService.rotateKey(keyId);
                    if (result.isSuccess()) {
                        rotated++;
                    } else {
                        log.warn("Scheduled rotation of key {} failed: {} {}", keyId, result.getErrorCode(), result.getErrorMessage());
                    }
                } catch (Exception e) {
                    log.error("Scheduled rotation of key {} failed", keyId, e);
                }
            }
        } catch (Exception e) {
            log.error("Key rotation check failed", e);
        } finally {
            running.set(false);
        }
        return rotated;
    }

    @PreDestroy
    public void stop() {
        stopRequested.set(true);
    }
}
