package com.skillswap.common.encryption.model;

/**
 * Why data is being encrypted.
 */
public enum EncryptionPurpose {
    STORAGE,
    TRANSIT,
    BACKUP,
    ARCHIVE,
    PROCESSING,
    SHARING
}
