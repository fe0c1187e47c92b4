package com.skillswap.common.encryption.model;

/**
 * Operation counted against a key's usage statistics.
 */
public enum KeyOperation {
    ENCRYPT,
    DECRYPT
}
