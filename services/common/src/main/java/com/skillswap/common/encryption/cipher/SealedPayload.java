package com.skillswap.common.encryption.cipher;

/**
 * Output of an AEAD seal: nonce, ciphertext and authentication tag held separately.
 */
public record SealedPayload(byte[] iv, byte[] ciphertext, byte[] authTag) {
}
