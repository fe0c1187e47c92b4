package com.skillswap.common.encryption.model;

public enum HashingAlgorithm {
    ARGON2ID,
    BCRYPT,
    PBKDF2,
    SHA256,
    SHA512
}
