package com.skillswap.common.encryption;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillswap.common.config.EncryptionProperties;
import com.skillswap.common.encryption.model.EncryptionAuditEvent;
import com.skillswap.common.encryption.model.KeyManagementAuditEvent;
import com.skillswap.common.encryption.store.KeyStore;
import com.skillswap.common.encryption.store.KeyStoreKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Audit trail for encryption operations and key lifecycle events.
 *
 * <p>Entries are JSON, appended to daily lists in the {@link KeyStore}: {@code encryption_log:yyyyMMdd}
 * for data operations (only when operation logging is enabled) and {@code key_rotation_log:yyyyMMdd}
 * for key lifecycle events. Audit failures are logged and never fail the calling operation.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EncryptionAuditService {

    private final KeyStore keyStore;
    private final ObjectMapper objectMapper;
    private final EncryptionProperties properties;
    private final Clock clock;

    public void auditEncryptionOperation(EncryptionAuditEvent event) {
        EncryptionProperties.DataEncryption config = properties.getDataEncryption();
        if (!config.isLogOperations()) {
            return;
        }
        try {
            if (event.getTimestamp() == null) {
                event.setTimestamp(clock.instant());
            }
            keyStore.appendToList(KeyStoreKeys.encryptionLog(today()),
                objectMapper.writeValueAsString(event), config.getOperationLogRetention());
        } catch (Exception e) {
            log.error("Failed to audit {} operation for key {}", event.getOperation(), event.getKeyId(), e);
        }
    }

    public void auditKeyManagementOperation(KeyManagementAuditEvent event) {
        try {
            if (event.getTimestamp() == null) {
                event.setTimestamp(clock.instant());
            }
            keyStore.appendToList(KeyStoreKeys.rotationLog(today()),
                objectMapper.writeValueAsString(event),
                properties.getDataEncryption().getRotationLogRetention());
            log.info("Key management event: operation={}, keyId={}, relatedKeyId={}",
                event.getOperation(), event.getKeyId(), event.getRelatedKeyId());
        } catch (Exception e) {
            log.error("Failed to audit key management operation {} for key {}",
                event.getOperation(), event.getKeyId(), e);
        }
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
    }
}
