package com.skillswap.common.encryption.cipher;

import com.skillswap.common.encryption.exception.EncryptionErrorCode;
import com.skillswap.common.encryption.exception.EncryptionException;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.spec.AlgorithmParameterSpec;
import java.util.Arrays;

/**
 * Base for AEAD ciphers provided by the JDK. JCA appends the tag to the ciphertext; this class
 * splits and rejoins it.
 */
abstract class JcaAeadCipher implements AeadCipher {

    private final SecureRandom secureRandom = new SecureRandom();

    protected abstract String transformation();

    protected abstract SecretKey secretKey(byte[] keyBytes);

    protected abstract AlgorithmParameterSpec parameterSpec(byte[] nonce);

    @Override
    public SealedPayload encrypt(byte[] key, byte[] plaintext, byte[] associatedData) {
        byte[] nonce = new byte[nonceLength()];
        secureRandom.nextBytes(nonce);
        try {
            Cipher cipher = Cipher.getInstance(transformation());
            cipher.init(Cipher.ENCRYPT_MODE, secretKey(keyBytes(key)), parameterSpec(nonce));
            if (associatedData != null) {
                cipher.updateAAD(associatedData);
            }
            byte[] sealed = cipher.doFinal(plaintext);
            int split = sealed.length - tagLength();
            return new SealedPayload(nonce, Arrays.copyOfRange(sealed, 0, split),
                Arrays.copyOfRange(sealed, split, sealed.length));
        } catch (GeneralSecurityException e) {
            throw new EncryptionException(EncryptionErrorCode.OPERATION_FAILED,
                algorithmTag() + " encryption failed", e);
        }
    }

    @Override
    public byte[] decrypt(byte[] key, SealedPayload payload, byte[] associatedData) {
        if (payload.iv() == null || payload.iv().length != nonceLength()
                || payload.authTag() == null || payload.authTag().length != tagLength()) {
            throw EncryptionException.invalidEnvelope("Malformed " + algorithmTag() + " nonce or tag", null);
        }
        byte[] sealed = new byte[payload.ciphertext().length + payload.authTag().length];
        System.arraycopy(payload.ciphertext(), 0, sealed, 0, payload.ciphertext().length);
        System.arraycopy(payload.authTag(), 0, sealed, payload.ciphertext().length, payload.authTag().length);
        try {
            Cipher cipher = Cipher.getInstance(transformation());
            cipher.init(Cipher.DECRYPT_MODE, secretKey(keyBytes(key)), parameterSpec(payload.iv()));
            if (associatedData != null) {
                cipher.updateAAD(associatedData);
            }
            return cipher.doFinal(sealed);
        } catch (AEADBadTagException e) {
            throw EncryptionException.authenticationFailed(algorithmTag() + " authentication failed", e);
        } catch (GeneralSecurityException e) {
            throw new EncryptionException(EncryptionErrorCode.OPERATION_FAILED,
                algorithmTag() + " decryption failed", e);
        }
    }

    private byte[] keyBytes(byte[] key) {
        if (key == null || key.length < keyLength()) {
            throw new EncryptionException(EncryptionErrorCode.KEY_INVALID,
                algorithmTag() + " requires a key of at least " + (keyLength() * 8) + " bits");
        }
        return key.length == keyLength() ? key : Arrays.copyOf(key, keyLength());
    }
}
