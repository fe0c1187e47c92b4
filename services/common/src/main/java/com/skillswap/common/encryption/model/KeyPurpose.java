package com.skillswap.common.encryption.model;

/**
 * Intended use of a key. Keys are not interchangeable across purposes.
 */
public enum KeyPurpose {
    DATA_ENCRYPTION,
    KEY_ENCRYPTION,
    SIGNING,
    AUTHENTICATION,
    DERIVED
}
