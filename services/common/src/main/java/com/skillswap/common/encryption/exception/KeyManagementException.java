package com.skillswap.common.encryption.exception;

/**
 * Raised inside the key management service when a lifecycle operation cannot proceed.
 */
public class KeyManagementException extends EncryptionException {

    private final String keyId;

    public KeyManagementException(EncryptionErrorCode errorCode, String keyId, String message) {
        super(errorCode, message, null, true);
        this.keyId = keyId;
    }

    public KeyManagementException(EncryptionErrorCode errorCode, String keyId, String message, Throwable cause) {
        super(errorCode, message, cause, true);
        this.keyId = keyId;
    }

    public String getKeyId() {
        return keyId;
    }

    public static KeyManagementException notFound(String keyId) {
        return new KeyManagementException(EncryptionErrorCode.KEY_NOT_FOUND, keyId, "Key not found: " + keyId);
    }

    public static KeyManagementException invalidKeySize(int keySize) {
        return new KeyManagementException(EncryptionErrorCode.INVALID_KEY_SIZE, null, "Unsupported key size: " + keySize);
    }
}
