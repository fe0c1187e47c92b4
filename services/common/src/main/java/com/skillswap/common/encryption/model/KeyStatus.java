package com.skillswap.common.encryption.model;

/**
 * Lifecycle state of a key record.
 *
 * <p>Only {@link #ACTIVE} keys are selected for new encryption. Archived and disabled keys stay
 * readable so historical ciphertext can still be decrypted.
 */
public enum KeyStatus {
    ACTIVE,
    DISABLED,
    EXPIRED,
    PENDING_ROTATION,
    ROTATING,
    COMPROMISED,
    ARCHIVED,
    DESTROYED;

    public boolean isDecryptCapable() {
        switch (this) {
            case ACTIVE:
            case ARCHIVED:
            case DISABLED:
            case PENDING_ROTATION:
            case ROTATING:
                return true;
            default:
                return false;
        }
    }

    public boolean isRetired() {
        return this == ARCHIVED || this == DISABLED || this == EXPIRED;
    }
}
