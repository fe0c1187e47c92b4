package com.skillswap.common.encryption.model;

/**
 * Kind of key material held by a key record.
 */
public enum KeyType {
    SYMMETRIC,
    ASYMMETRIC,
    HYBRID
}
