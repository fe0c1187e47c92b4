package com.skillswap.common.encryption.exception;

/**
 * Categorized failure reported by encryption and key management operations.
 */
public enum EncryptionErrorCode {
    KEY_NOT_FOUND,
    KEY_INVALID,
    NO_SUITABLE_KEY,
    INVALID_ENVELOPE,
    UNSUPPORTED_ALGORITHM,
    OPERATION_FAILED,
    INVALID_INPUT,
    AUTHENTICATION_FAILED,
    INVALID_KEY_SIZE,
    ALREADY_ROTATED,
    BACKUP_NOT_FOUND,
    BACKUP_CORRUPTED
}
