package com.skillswap.common.encryption;

import com.skillswap.common.config.EncryptionProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Holds the master key (wraps key material at rest) and the backup key (seals key backups).
 *
 * <p>Both are read from configuration as base64 AES-256 keys. A missing key is replaced with a
 * random one for the lifetime of the process; anything wrapped under it becomes unreadable after a
 * restart.
 */
@Component
@Slf4j
public class MasterKeyProvider {

    private static final int KEY_LENGTH = 32;

    private final byte[] masterKey;
    private final byte[] backupKey;

    public MasterKeyProvider(EncryptionProperties properties) {
        EncryptionProperties.KeyManagement config = properties.getKeyManagement();
        this.masterKey = resolve("master-key", config.getMasterKey());
        this.backupKey = resolve("backup-encryption-key", config.getBackupEncryptionKey());
    }

    byte[] masterKey() {
        return masterKey.clone();
    }

    byte[] backupKey() {
        return backupKey.clone();
    }

    private static byte[] resolve(String name, String configured) {
        if (!StringUtils.hasText(configured)) {
            log.warn("No {} configured, generating an ephemeral key. Persisted keys will not survive a restart", name);
            byte[] generated = new byte[KEY_LENGTH];
            new SecureRandom().nextBytes(generated);
            return generated;
        }
        byte[] decoded = Base64.getDecoder().decode(configured.trim());
        if (decoded.length != KEY_LENGTH) {
            throw new IllegalStateException(name + " must be a base64 encoded 256-bit key");
        }
        return decoded;
    }
}
