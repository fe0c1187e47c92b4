package com.skillswap.common.encryption.model;

import com.skillswap.common.encryption.exception.EncryptionErrorCode;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class EncryptionResult {

    private boolean success;
    private String envelope;
    private String keyId;
    private String algorithm;
    private Instant encryptedAt;
    private EncryptionErrorCode errorCode;
    private String errorMessage;

    public static EncryptionResult failure(EncryptionErrorCode errorCode, String errorMessage) {
        return EncryptionResult.builder()
            .success(false)
            .errorCode(errorCode)
            .errorMessage(errorMessage)
            .build();
    }
}
