package com.skillswap.common.encryption.model;

import com.skillswap.common.encryption.exception.EncryptionErrorCode;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class KeyGenerationResult {

    private boolean success;
    private String keyId;
    private KeyType keyType;
    private KeyPurpose purpose;
    private int keySize;
    private Instant createdAt;
    private Instant expiresAt;
    private EncryptionErrorCode errorCode;
    private String errorMessage;

    public static KeyGenerationResult failure(EncryptionErrorCode errorCode, String errorMessage) {
        return KeyGenerationResult.builder()
            .success(false)
            .errorCode(errorCode)
            .errorMessage(errorMessage)
            .build();
    }
}
