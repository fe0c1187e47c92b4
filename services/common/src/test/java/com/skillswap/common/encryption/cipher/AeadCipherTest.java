package com.skillswap.common.encryption.cipher;

import com.skillswap.common.encryption.exception.EncryptionErrorCode;
import com.skillswap.common.encryption.exception.EncryptionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the AEAD ciphers and their registry.
 *
 * Tests cover:
 * - Sealing and opening with associated data
 * - Tag, nonce and associated-data tampering
 * - Key length handling
 * - Registry lookup
 */
@DisplayName("AeadCipher Unit Tests")
class AeadCipherTest {

    private static final byte[] PLAINTEXT = "card=4111111111111111".getBytes(StandardCharsets.UTF_8);
    private static final byte[] AAD = "1.0:key_1:test".getBytes(StandardCharsets.UTF_8);

    static Stream<AeadCipher> ciphers() {
        return Stream.of(AesGcmCipher.aes256(), AesGcmCipher.aes192(), AesGcmCipher.aes128(), new ChaCha20Poly1305Cipher());
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("ciphers")
    @DisplayName("Should open what it sealed")
    void shouldOpenSealedPayload(AeadCipher cipher) {
        // Given
        byte[] key = randomKey(cipher.keyLength());

        // When
        SealedPayload sealed = cipher.encrypt(key, PLAINTEXT, AAD);
        byte[] opened = cipher.decrypt(key, sealed, AAD);

        // Then
        assertThat(sealed.iv()).hasSize(cipher.nonceLength());
        assertThat(sealed.authTag()).hasSize(cipher.tagLength());
        assertThat(sealed.ciphertext()).hasSameSizeAs(PLAINTEXT).isNotEqualTo(PLAINTEXT);
        assertThat(opened).isEqualTo(PLAINTEXT);
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("ciphers")
    @DisplayName("Should reject modified tag")
    void shouldRejectModifiedTag(AeadCipher cipher) {
        // Given
        byte[] key = randomKey(cipher.keyLength());
        SealedPayload sealed = cipher.encrypt(key, PLAINTEXT, AAD);
        byte[] tag = sealed.authTag().clone();
        tag[tag.length - 1] ^= 0x01;

        // When / Then
        assertThatThrownBy(() -> cipher.decrypt(key, new SealedPayload(sealed.iv(), sealed.ciphertext(), tag), AAD))
            .isInstanceOf(EncryptionException.class)
            .satisfies(e -> {
                EncryptionException ex = (EncryptionException) e;
                assertThat(ex.getErrorCode()).isEqualTo(EncryptionErrorCode.AUTHENTICATION_FAILED);
                assertThat(ex.isSecurityCritical()).isTrue();
            });
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("ciphers")
    @DisplayName("Should reject different associated data")
    void shouldRejectDifferentAssociatedData(AeadCipher cipher) {
        // Given
        byte[] key = randomKey(cipher.keyLength());
        SealedPayload sealed = cipher.encrypt(key, PLAINTEXT, AAD);

        // When / Then
        assertThatThrownBy(() -> cipher.decrypt(key, sealed, "1.0:key_2:test".getBytes(StandardCharsets.UTF_8)))
            .isInstanceOf(EncryptionException.class)
            .extracting(e -> ((EncryptionException) e).getErrorCode())
            .isEqualTo(EncryptionErrorCode.AUTHENTICATION_FAILED);
    }

    @Test
    @DisplayName("Should reject nonce of the wrong length as malformed")
    void shouldRejectMalformedNonce() {
        // Given
        AeadCipher cipher = AesGcmCipher.aes256();
        byte[] key = randomKey(32);
        SealedPayload sealed = cipher.encrypt(key, PLAINTEXT, AAD);

        // When / Then
        assertThatThrownBy(() -> cipher.decrypt(key, new SealedPayload(new byte[8], sealed.ciphertext(), sealed.authTag()), AAD))
            .isInstanceOf(EncryptionException.class)
            .extracting(e -> ((EncryptionException) e).getErrorCode())
            .isEqualTo(EncryptionErrorCode.INVALID_ENVELOPE);
    }

    @Test
    @DisplayName("Should reject key shorter than the cipher needs")
    void shouldRejectShortKey() {
        assertThatThrownBy(() -> AesGcmCipher.aes256().encrypt(randomKey(16), PLAINTEXT, AAD))
            .isInstanceOf(EncryptionException.class)
            .extracting(e -> ((EncryptionException) e).getErrorCode())
            .isEqualTo(EncryptionErrorCode.KEY_INVALID);
    }

    @Test
    @DisplayName("Should use the leading bytes of a longer key")
    void shouldTruncateLongerKey() {
        // Given
        byte[] key = randomKey(32);
        byte[] prefix = Arrays.copyOf(key, 16);
        AeadCipher cipher = AesGcmCipher.aes128();

        // When
        SealedPayload sealed = cipher.encrypt(key, PLAINTEXT, AAD);

        // Then
        assertThat(cipher.decrypt(prefix, sealed, AAD)).isEqualTo(PLAINTEXT);
    }

    @Test
    @DisplayName("Should resolve registered tags and reject unknown ones")
    void shouldResolveCiphersByTag() {
        // Given
        AeadCipherRegistry registry = AeadCipherRegistry.withDefaults();

        // Then
        assertThat(registry.supportedAlgorithms())
            .containsExactly(AesGcmCipher.AES_256_GCM, AesGcmCipher.AES_192_GCM, AesGcmCipher.AES_128_GCM, ChaCha20Poly1305Cipher.CHACHA20_POLY1305);
        assertThat(registry.require("ChaCha20Poly1305").keyLength()).isEqualTo(32);
        assertThat(registry.find(null)).isEmpty();
        assertThatThrownBy(() -> registry.require("AES256CBC"))
            .isInstanceOf(EncryptionException.class)
            .extracting(e -> ((EncryptionException) e).getErrorCode())
            .isEqualTo(EncryptionErrorCode.UNSUPPORTED_ALGORITHM);
    }

    @Test
    @DisplayName("Should refuse duplicate algorithm tags")
    void shouldRefuseDuplicateTags() {
        assertThatThrownBy(() -> new AeadCipherRegistry(List.of(AesGcmCipher.aes256(), AesGcmCipher.aes256())))
            .isInstanceOf(IllegalStateException.class);
    }

    private static byte[] randomKey(int length) {
        byte[] key = new byte[length];
        new SecureRandom().nextBytes(key);
        return key;
    }
}
