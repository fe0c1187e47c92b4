package com.skillswap.common.encryption.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillswap.common.config.EncryptionConfiguration;
import com.skillswap.common.config.EncryptionProperties;
import com.skillswap.common.encryption.DataEncryptionService;
import com.skillswap.common.encryption.EncryptionAuditService;
import com.skillswap.common.encryption.EnvelopeCodec;
import com.skillswap.common.encryption.KeyManagementService;
import com.skillswap.common.encryption.KeyRecordCodec;
import com.skillswap.common.encryption.KeyUsagePolicy;
import com.skillswap.common.encryption.MasterKeyProvider;
import com.skillswap.common.encryption.cipher.AeadCipherRegistry;
import com.skillswap.common.encryption.hash.HashingEngine;
import com.skillswap.common.encryption.model.KeyGenerationOptions;
import com.skillswap.common.encryption.model.KeyGenerationResult;
import com.skillswap.common.encryption.model.KeyPurpose;
import com.skillswap.common.encryption.model.KeyType;
import com.skillswap.common.encryption.store.InMemoryKeyStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.Getter;

import java.time.Clock;
import java.time.Instant;
import java.util.function.Consumer;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Wires the encryption services by hand over an in-memory store and a {@link MutableClock}.
 */
@Getter
public class EncryptionTestFixture {

    public static final Instant START = Instant.parse("2024-03-04T10:15:30Z");
    public static final String MASTER_KEY = "AAECAwQFBgcICQoLDA0ODxAREhMUFRYXGBkaGxwdHh8=";
    public static final String BACKUP_KEY = "HxwdHhsaGRgXFhUUExIREA8ODQwLCgkIBwYFBAMCAQA=";

    private final MutableClock clock;
    private final EncryptionProperties properties;
    private final InMemoryKeyStore keyStore;
    private final ObjectMapper objectMapper;
    private final SimpleMeterRegistry meterRegistry;
    private final EncryptionAuditService auditService;
    private final KeyManagementService keyManagementService;
    private final EnvelopeCodec envelopeCodec;
    private final HashingEngine hashingEngine;
    private final DataEncryptionService dataEncryptionService;

    private EncryptionTestFixture(Consumer<EncryptionProperties> customizer, Function<Clock, InMemoryKeyStore> storeFactory) {
        this.clock = new MutableClock(START);
        this.properties = new EncryptionProperties();
        properties.getKeyManagement().setMasterKey(MASTER_KEY);
        properties.getKeyManagement().setBackupEncryptionKey(BACKUP_KEY);
        properties.getDataEncryption().setDefaultPepper("test-pepper");
        customizer.accept(properties);

        this.keyStore = storeFactory.apply(clock);
        this.objectMapper = new EncryptionConfiguration().objectMapper();
        this.meterRegistry = new SimpleMeterRegistry();
        this.auditService = new EncryptionAuditService(keyStore, objectMapper, properties, clock);

        MasterKeyProvider masterKeyProvider = new MasterKeyProvider(properties);
        this.keyManagementService = new KeyManagementService(keyStore,
            new KeyRecordCodec(objectMapper, masterKeyProvider), masterKeyProvider, auditService,
            properties, objectMapper, meterRegistry, clock);
        this.envelopeCodec = new EnvelopeCodec(objectMapper);
        this.hashingEngine = new HashingEngine(properties);
        this.dataEncryptionService = new DataEncryptionService(keyManagementService,
            AeadCipherRegistry.withDefaults(), envelopeCodec, hashingEngine, new KeyUsagePolicy(),
            auditService, properties, meterRegistry, clock);
    }

    public static EncryptionTestFixture create() {
        return create(properties -> { });
    }

    public static EncryptionTestFixture create(Consumer<EncryptionProperties> customizer) {
        return new EncryptionTestFixture(customizer, InMemoryKeyStore::new);
    }

    public static EncryptionTestFixture create(Consumer<EncryptionProperties> customizer,
                                               Function<Clock, InMemoryKeyStore> storeFactory) {
        return new EncryptionTestFixture(customizer, storeFactory);
    }

    public String createDataKey(int keySize) {
        return createKey(KeyType.SYMMETRIC, KeyPurpose.DATA_ENCRYPTION, KeyGenerationOptions.builder().keySize(keySize).build());
    }

    public String createKey(KeyType type, KeyPurpose purpose, KeyGenerationOptions options) {
        KeyGenerationResult result = keyManagementService.createKey(type, purpose, options);
        assertThat(result.isSuccess()).as("key creation: %s", result.getErrorMessage()).isTrue();
        return result.getKeyId();
    }
}
