package com.skillswap.common.encryption.model;

/**
 * Sensitivity tier of data. Drives the minimum key strength used to protect it.
 */
public enum DataClassification {
    PUBLIC(0),
    INTERNAL(0),
    CONFIDENTIAL(192),
    RESTRICTED(256),
    TOP_SECRET(256);

    private final int minimumKeySize;

    DataClassification(int minimumKeySize) {
        this.minimumKeySize = minimumKeySize;
    }

    public int getMinimumKeySize() {
        return minimumKeySize;
    }

    public boolean isSatisfiedBy(int keySize) {
        return keySize >= minimumKeySize;
    }
}
