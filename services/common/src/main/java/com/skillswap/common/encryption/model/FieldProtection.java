package com.skillswap.common.encryption.model;

/**
 * How a sensitive field is protected at rest.
 */
public enum FieldProtection {
    ENCRYPT,
    HASH
}
