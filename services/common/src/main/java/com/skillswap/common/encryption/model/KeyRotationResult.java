package com.skillswap.common.encryption.model;

import com.skillswap.common.encryption.exception.EncryptionErrorCode;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Outcome of rotating a key. {@code alreadyRotated} is set when the call resolved to a successor
 * produced by an earlier rotation.
 */
@Data
@Builder
public class KeyRotationResult {

    private boolean success;
    private String oldKeyId;
    private String newKeyId;
    private int newVersion;
    private Instant rotatedAt;
    private boolean alreadyRotated;
    private EncryptionErrorCode errorCode;
    private String errorMessage;

    public static KeyRotationResult failure(String oldKeyId, EncryptionErrorCode errorCode, String errorMessage) {
        return KeyRotationResult.builder()
            .success(false)
            .oldKeyId(oldKeyId)
            .errorCode(errorCode)
            .errorMessage(errorMessage)
            .build();
    }
}
