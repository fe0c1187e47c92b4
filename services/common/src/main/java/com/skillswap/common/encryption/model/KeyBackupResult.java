package com.skillswap.common.encryption.model;

import com.skillswap.common.encryption.exception.EncryptionErrorCode;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class KeyBackupResult {

    private boolean success;
    private String backupId;
    private String keyId;
    private String backupLocation;
    private String backupHash;
    private Instant backupTimestamp;
    private EncryptionErrorCode errorCode;
    private String errorMessage;

    public static KeyBackupResult failure(String keyId, EncryptionErrorCode errorCode, String errorMessage) {
        return KeyBackupResult.builder()
            .success(false)
            .keyId(keyId)
            .errorCode(errorCode)
            .errorMessage(errorMessage)
            .build();
    }
}
