package com.skillswap.common.encryption.store;

import com.skillswap.common.encryption.model.KeyPurpose;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Key layout used in the {@link KeyStore}.
 */
public final class KeyStoreKeys {

    public static final String ARCHIVED = "keys:archived";
    public static final String DISABLED = "keys:disabled";
    public static final String ROTATING = "keys:rotating";
    public static final String EXPIRATION_TRACKING = "keys:expiration_tracking";
    public static final String ROTATION_TRACKING = "keys:rotation_tracking";
    public static final String BACKUP_INDEX = "keys:backup_index";

    private static final DateTimeFormatter DAY = DateTimeFormatter.BASIC_ISO_DATE;

    private KeyStoreKeys() {
    }

    public static String keyData(String keyId) {
        return "keys:data:" + keyId;
    }

    public static String activeKeys(KeyPurpose purpose) {
        return "keys:active:" + purpose.name().toLowerCase();
    }

    public static String backup(String backupId) {
        return "keys:backup:" + backupId;
    }

    public static String encryptionLog(LocalDate day) {
        return "encryption_log:" + DAY.format(day);
    }

    public static String rotationLog(LocalDate day) {
        return "key_rotation_log:" + DAY.format(day);
    }
}
