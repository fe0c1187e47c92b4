package com.skillswap.common.encryption;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillswap.common.encryption.cipher.AeadCipher;
import com.skillswap.common.encryption.cipher.AesGcmCipher;
import com.skillswap.common.encryption.cipher.SealedPayload;
import com.skillswap.common.encryption.exception.EncryptionErrorCode;
import com.skillswap.common.encryption.exception.KeyManagementException;
import com.skillswap.common.encryption.model.EncryptionKey;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Serializes key records to JSON, wrapping key material under the master key.
 */
@Component
public class KeyRecordCodec {

    private final ObjectMapper objectMapper;
    private final MasterKeyProvider masterKeyProvider;
    private final AeadCipher wrapCipher = AesGcmCipher.aes256();

    public KeyRecordCodec(ObjectMapper objectMapper, MasterKeyProvider masterKeyProvider) {
        this.objectMapper = objectMapper;
        this.masterKeyProvider = masterKeyProvider;
    }

    public String encode(EncryptionKey key) {
        byte[] material = key.getKeyMaterial();
        key.setWrappedKeyMaterial(material == null || material.length == 0 ? null : wrap(key.getId(), material));
        try {
            return objectMapper.writeValueAsString(key);
        } catch (JsonProcessingException e) {
            throw new KeyManagementException(EncryptionErrorCode.OPERATION_FAILED, key.getId(),
                "Failed to serialize key record", e);
        }
    }

    public EncryptionKey decode(String json) {
        EncryptionKey key;
        try {
            key = objectMapper.readValue(json, EncryptionKey.class);
        } catch (JsonProcessingException e) {
            throw new KeyManagementException(EncryptionErrorCode.OPERATION_FAILED, null,
                "Failed to parse key record", e);
        }
        if (key.getWrappedKeyMaterial() != null) {
            key.setKeyMaterial(unwrap(key.getId(), key.getWrappedKeyMaterial()));
        }
        return key;
    }

    private String wrap(String keyId, byte[] material) {
        SealedPayload sealed = wrapCipher.encrypt(masterKeyProvider.masterKey(), material, aad(keyId));
        ByteBuffer buffer = ByteBuffer.allocate(sealed.iv().length + sealed.ciphertext().length + sealed.authTag().length);
        buffer.put(sealed.iv()).put(sealed.ciphertext()).put(sealed.authTag());
        return Base64.getEncoder().encodeToString(buffer.array());
    }

    private byte[] unwrap(String keyId, String wrapped) {
        byte[] bytes = Base64.getDecoder().decode(wrapped);
        int ivLength = wrapCipher.nonceLength();
        int tagLength = wrapCipher.tagLength();
        if (bytes.length < ivLength + tagLength) {
            throw new KeyManagementException(EncryptionErrorCode.KEY_INVALID, keyId, "Wrapped key material is truncated");
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        byte[] iv = new byte[ivLength];
        byte[] ciphertext = new byte[bytes.length - ivLength - tagLength];
        byte[] tag = new byte[tagLength];
        buffer.get(iv).get(ciphertext).get(tag);
        return wrapCipher.decrypt(masterKeyProvider.masterKey(), new SealedPayload(iv, ciphertext, tag), aad(keyId));
    }

    private static byte[] aad(String keyId) {
        return ("key:" + keyId).getBytes(StandardCharsets.UTF_8);
    }
}
