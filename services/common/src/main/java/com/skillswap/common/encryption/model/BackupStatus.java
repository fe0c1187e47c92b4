package com.skillswap.common.encryption.model;

public enum BackupStatus {
    VALID,
    NEEDS_VERIFICATION,
    VERIFICATION_FAILED,
    CORRUPTED,
    EXPIRED,
    MISSING
}
