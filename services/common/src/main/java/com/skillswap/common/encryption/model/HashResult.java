package com.skillswap.common.encryption.model;

import com.skillswap.common.encryption.exception.EncryptionErrorCode;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class HashResult {

    private boolean success;
    private HashRecord record;
    private EncryptionErrorCode errorCode;
    private String errorMessage;

    public static HashResult failure(EncryptionErrorCode errorCode, String errorMessage) {
        return HashResult.builder()
            .success(false)
            .errorCode(errorCode)
            .errorMessage(errorMessage)
            .build();
    }
}
