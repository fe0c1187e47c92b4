package com.skillswap.common.encryption.cipher;

import com.skillswap.common.encryption.exception.EncryptionException;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves the {@link AeadCipher} for an algorithm tag.
 */
public class AeadCipherRegistry {

    private final Map<String, AeadCipher> ciphers = new LinkedHashMap<>();

    public AeadCipherRegistry(Collection<? extends AeadCipher> ciphers) {
        for (AeadCipher cipher : ciphers) {
            AeadCipher previous = this.ciphers.putIfAbsent(cipher.algorithmTag(), cipher);
            if (previous != null) {
                throw new IllegalStateException("Duplicate AEAD cipher for tag " + cipher.algorithmTag());
            }
        }
    }

    public static AeadCipherRegistry withDefaults() {
        return new AeadCipherRegistry(List.of(
            AesGcmCipher.aes256(),
            AesGcmCipher.aes192(),
            AesGcmCipher.aes128(),
            new ChaCha20Poly1305Cipher()));
    }

    public Optional<AeadCipher> find(String algorithmTag) {
        return Optional.ofNullable(algorithmTag).map(ciphers::get);
    }

    public AeadCipher require(String algorithmTag) {
        return find(algorithmTag).orElseThrow(() -> EncryptionException.unsupportedAlgorithm(algorithmTag));
    }

    public Set<String> supportedAlgorithms() {
        return ciphers.keySet();
    }
}
