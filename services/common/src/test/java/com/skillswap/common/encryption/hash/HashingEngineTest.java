package com.skillswap.common.encryption.hash;

import com.skillswap.common.config.EncryptionProperties;
import com.skillswap.common.encryption.exception.EncryptionException;
import com.skillswap.common.encryption.model.HashRecord;
import com.skillswap.common.encryption.model.HashingAlgorithm;
import com.skillswap.common.encryption.model.HashingOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for HashingEngine.
 *
 * Tests cover:
 * - Hash and verify for every algorithm
 * - Salting and peppering
 * - Recorded parameters
 * - Long BCrypt inputs
 */
@DisplayName("HashingEngine Unit Tests")
class HashingEngineTest {

    private static final Instant NOW = Instant.parse("2024-03-04T10:15:30Z");
    private static final byte[] PASSWORD = "correct horse battery staple".getBytes(StandardCharsets.UTF_8);

    private HashingEngine hashingEngine;

    @BeforeEach
    void setUp() {
        hashingEngine = new HashingEngine(propertiesWithPepper("pepper-1"));
    }

    @ParameterizedTest
    @EnumSource(HashingAlgorithm.class)
    @DisplayName("Should verify the original input and reject a different one")
    void shouldHashAndVerify(HashingAlgorithm algorithm) {
        // Given
        HashingOptions options = fastOptions(algorithm);

        // When
        HashRecord record = hashingEngine.hash(PASSWORD, options, NOW);

        // Then
        assertThat(record.getAlgorithm()).isEqualTo(algorithm);
        assertThat(record.getCreatedAt()).isEqualTo(NOW);
        assertThat(record.getParameters().isPeppered()).isTrue();
        assertThat(hashingEngine.verify(PASSWORD, record)).isTrue();
        assertThat(hashingEngine.verify("wrong".getBytes(StandardCharsets.UTF_8), record)).isFalse();
    }

    @Test
    @DisplayName("Should salt each hash independently")
    void shouldUseFreshSalt() {
        // When
        HashRecord first = hashingEngine.hash(PASSWORD, fastOptions(HashingAlgorithm.SHA256), NOW);
        HashRecord second = hashingEngine.hash(PASSWORD, fastOptions(HashingAlgorithm.SHA256), NOW);

        // Then
        assertThat(first.getSalt()).isNotEqualTo(second.getSalt());
        assertThat(first.getHash()).isNotEqualTo(second.getHash());
        assertThat(Base64.getDecoder().decode(first.getSalt())).hasSize(32);
    }

    @Test
    @DisplayName("Should record Argon2 cost parameters")
    void shouldRecordArgon2Parameters() {
        // When
        HashRecord record = hashingEngine.hash(PASSWORD, fastOptions(HashingAlgorithm.ARGON2ID), NOW);

        // Then
        assertThat(record.getParameters().getMemoryCost()).isEqualTo(1024);
        assertThat(record.getParameters().getTimeCost()).isEqualTo(2);
        assertThat(record.getParameters().getParallelism()).isEqualTo(1);
        assertThat(Base64.getDecoder().decode(record.getHash())).hasSize(32);
    }

    @Test
    @DisplayName("Should fail verification under a different pepper")
    void shouldDependOnPepper() {
        // Given
        HashRecord record = hashingEngine.hash(PASSWORD, fastOptions(HashingAlgorithm.PBKDF2), NOW);
        HashingEngine otherEngine = new HashingEngine(propertiesWithPepper("pepper-2"));
        HashingEngine noPepperEngine = new HashingEngine(new EncryptionProperties());

        // Then
        assertThat(otherEngine.verify(PASSWORD, record)).isFalse();
        assertThat(noPepperEngine.verify(PASSWORD, record)).isFalse();
    }

    @Test
    @DisplayName("Should skip the pepper when the caller opts out")
    void shouldHonourPepperOptOut() {
        // Given
        HashingOptions options = fastOptions(HashingAlgorithm.SHA512);
        options.setUsePepper(false);

        // When
        HashRecord record = hashingEngine.hash(PASSWORD, options, NOW);

        // Then
        assertThat(record.getParameters().isPeppered()).isFalse();
        assertThat(new HashingEngine(new EncryptionProperties()).verify(PASSWORD, record)).isTrue();
    }

    @Test
    @DisplayName("Should distinguish BCrypt inputs that differ after 72 bytes")
    void shouldPreHashLongBcryptInput() {
        // Given
        byte[] longInput = "a".repeat(100).getBytes(StandardCharsets.UTF_8);
        byte[] variant = ("a".repeat(99) + "b").getBytes(StandardCharsets.UTF_8);

        // When
        HashRecord record = hashingEngine.hash(longInput, fastOptions(HashingAlgorithm.BCRYPT), NOW);

        // Then
        assertThat(hashingEngine.verify(longInput, record)).isTrue();
        assertThat(hashingEngine.verify(variant, record)).isFalse();
    }

    @Test
    @DisplayName("Should use the configured default algorithm")
    void shouldUseDefaultAlgorithm() {
        // Given
        EncryptionProperties properties = propertiesWithPepper("pepper-1");
        properties.getDataEncryption().setDefaultHashingAlgorithm(HashingAlgorithm.SHA256);

        // When
        HashRecord record = new HashingEngine(properties).hash(PASSWORD, HashingOptions.builder().build(), NOW);

        // Then
        assertThat(record.getAlgorithm()).isEqualTo(HashingAlgorithm.SHA256);
    }

    @Test
    @DisplayName("Should reject null input and tolerate null records")
    void shouldHandleNulls() {
        assertThatThrownBy(() -> hashingEngine.hash(null, HashingOptions.builder().build(), NOW))
            .isInstanceOf(EncryptionException.class);
        assertThat(hashingEngine.verify(PASSWORD, null)).isFalse();
    }

    private static HashingOptions fastOptions(HashingAlgorithm algorithm) {
        return HashingOptions.builder()
            .algorithm(algorithm)
            .memoryCost(1024)
            .timeCost(2)
            .iterations(1_000)
            .cost(4)
            .build();
    }

    private static EncryptionProperties propertiesWithPepper(String pepper) {
        EncryptionProperties properties = new EncryptionProperties();
        properties.getDataEncryption().setDefaultPepper(pepper);
        return properties;
    }
}
