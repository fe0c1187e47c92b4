package com.skillswap.common.encryption.cipher;

/**
 * Authenticated encryption with associated data. One implementation per algorithm, looked up by
 * the tag stored in each envelope.
 */
public interface AeadCipher {

    /**
     * Tag written into envelopes, e.g. {@code AES256GCM}.
     */
    String algorithmTag();

    /**
     * Minimum key material length in bytes. Longer material is truncated to this length.
     */
    int keyLength();

    int nonceLength();

    int tagLength();

    SealedPayload encrypt(byte[] key, byte[] plaintext, byte[] associatedData);

    /**
     * @throws com.skillswap.common.encryption.exception.EncryptionException with
     *         {@code AUTHENTICATION_FAILED} when the tag does not verify
     */
    byte[] decrypt(byte[] key, SealedPayload payload, byte[] associatedData);
}
