package com.skillswap.common.encryption.model;

import com.skillswap.common.encryption.exception.EncryptionErrorCode;
import lombok.Builder;
import lombok.Data;
import lombok.ToString;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * Outcome of a decryption. {@code integrityVerified} is false only when the envelope carried an
 * integrity hash that did not match the recovered plaintext.
 */
@Data
@Builder
public class DecryptionResult {

    private boolean success;

    @ToString.Exclude
    private byte[] data;

    private String keyId;
    private String algorithm;
    private boolean integrityVerified;
    private Instant decryptedAt;
    private EncryptionErrorCode errorCode;
    private String errorMessage;

    public String getDataAsString() {
        return data == null ? null : new String(data, StandardCharsets.UTF_8);
    }

    public static DecryptionResult failure(EncryptionErrorCode errorCode, String errorMessage) {
        return DecryptionResult.builder()
            .success(false)
            .errorCode(errorCode)
            .errorMessage(errorMessage)
            .build();
    }
}
