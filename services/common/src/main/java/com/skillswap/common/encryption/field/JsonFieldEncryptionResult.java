package com.skillswap.common.encryption.field;

import com.skillswap.common.encryption.exception.EncryptionErrorCode;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class JsonFieldEncryptionResult {

    private boolean success;
    private String fieldPath;
    private String keyId;

    /** Set when the field already held the expected form and was left untouched. */
    private boolean skipped;

    private EncryptionErrorCode errorCode;
    private String errorMessage;

    static JsonFieldEncryptionResult failure(String fieldPath, EncryptionErrorCode errorCode, String errorMessage) {
        return JsonFieldEncryptionResult.builder()
            .success(false)
            .fieldPath(fieldPath)
            .errorCode(errorCode)
            .errorMessage(errorMessage)
            .build();
    }
}
