package com.skillswap.common.encryption.exception;

/**
 * Encryption-specific exception
 */
public class EncryptionException extends RuntimeException {

    private final EncryptionErrorCode errorCode;
    private final boolean isSecurityCritical;

    public EncryptionException(EncryptionErrorCode errorCode, String message) {
        this(errorCode, message, null, false);
    }

    public EncryptionException(EncryptionErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, cause, false);
    }

    public EncryptionException(EncryptionErrorCode errorCode, String message, Throwable cause, boolean isSecurityCritical) {
        super(message, cause);
        this.errorCode = errorCode;
        this.isSecurityCritical = isSecurityCritical;
    }

    public EncryptionErrorCode getErrorCode() {
        return errorCode;
    }

    public boolean isSecurityCritical() {
        return isSecurityCritical;
    }

    /**
     * Ciphertext failed authentication: tampered data, wrong key or wrong associated data.
     */
    public static EncryptionException authenticationFailed(String message, Throwable cause) {
        return new EncryptionException(EncryptionErrorCode.AUTHENTICATION_FAILED, message, cause, true);
    }

    public static EncryptionException invalidEnvelope(String message, Throwable cause) {
        return new EncryptionException(EncryptionErrorCode.INVALID_ENVELOPE, message, cause);
    }

    public static EncryptionException unsupportedAlgorithm(String algorithm) {
        return new EncryptionException(EncryptionErrorCode.UNSUPPORTED_ALGORITHM, "Unsupported algorithm: " + algorithm);
    }

    public static EncryptionException invalidInput(String message) {
        return new EncryptionException(EncryptionErrorCode.INVALID_INPUT, message);
    }
}
