package com.skillswap.common.encryption;

import com.skillswap.common.config.EncryptionProperties;
import com.skillswap.common.encryption.cipher.AeadCipher;
import com.skillswap.common.encryption.cipher.AeadCipherRegistry;
import com.skillswap.common.encryption.cipher.AesGcmCipher;
import com.skillswap.common.encryption.cipher.SealedPayload;
import com.skillswap.common.encryption.exception.EncryptionErrorCode;
import com.skillswap.common.encryption.exception.EncryptionException;
import com.skillswap.common.encryption.hash.HashingEngine;
import com.skillswap.common.encryption.model.DecryptionResult;
import com.skillswap.common.encryption.model.EncryptedEnvelope;
import com.skillswap.common.encryption.model.EncryptionAuditEvent;
import com.skillswap.common.encryption.model.EncryptionContext;
import com.skillswap.common.encryption.model.EncryptionKey;
import com.skillswap.common.encryption.model.EncryptionOptions;
import com.skillswap.common.encryption.model.EncryptionPurpose;
import com.skillswap.common.encryption.model.EncryptionResult;
import com.skillswap.common.encryption.model.HashRecord;
import com.skillswap.common.encryption.model.HashResult;
import com.skillswap.common.encryption.model.HashingOptions;
import com.skillswap.common.encryption.model.KeyMetadata;
import com.skillswap.common.encryption.model.KeyOperation;
import com.skillswap.common.encryption.model.KeyPurpose;
import com.skillswap.common.encryption.model.KeyType;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Encryption engine: key selection, AEAD encryption and decryption, re-encryption and hashing.
 *
 * <p>Expected failures come back as result objects carrying an {@link EncryptionErrorCode}. Unexpected
 * faults are logged here in full and reported to callers only as {@code OPERATION_FAILED} with a
 * generic message. This service never creates or rotates keys.
 */
@Service
@Slf4j
public class DataEncryptionService {

    private static final String REDACTED_MESSAGE = "Encryption operation failed";

    private final KeyManagementService keyManagementService;
    private final AeadCipherRegistry cipherRegistry;
    private final EnvelopeCodec envelopeCodec;
    private final HashingEngine hashingEngine;
    private final KeyUsagePolicy keyUsagePolicy;
    private final EncryptionAuditService auditService;
    private final EncryptionProperties.DataEncryption config;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    // Metrics
    private final Counter encryptionCounter;
    private final Counter decryptionCounter;
    private final Counter reEncryptionCounter;

    public DataEncryptionService(KeyManagementService keyManagementService,
                                 AeadCipherRegistry cipherRegistry,
                                 EnvelopeCodec envelopeCodec,
                                 HashingEngine hashingEngine,
                                 KeyUsagePolicy keyUsagePolicy,
                                 EncryptionAuditService auditService,
                                 EncryptionProperties properties,
                                 MeterRegistry meterRegistry,
                                 Clock clock) {
        this.keyManagementService = keyManagementService;
        this.cipherRegistry = cipherRegistry;
        this.envelopeCodec = envelopeCodec;
        this.hashingEngine = hashingEngine;
        this.keyUsagePolicy = keyUsagePolicy;
        this.auditService = auditService;
        this.config = properties.getDataEncryption();
        this.meterRegistry = meterRegistry;
        this.clock = clock;

        this.encryptionCounter = Counter.builder("encryption_operations")
            .description("Number of data encryption operations")
            .tag("operation", "encrypt")
            .register(meterRegistry);
        this.decryptionCounter = Counter.builder("encryption_operations")
            .description("Number of data encryption operations")
            .tag("operation", "decrypt")
            .register(meterRegistry);
        this.reEncryptionCounter = Counter.builder("encryption_operations")
            .description("Number of data encryption operations")
            .tag("operation", "reencrypt")
            .register(meterRegistry);
    }

    /**
     * Picks the newest active data-encryption key that satisfies the context.
     *
     * <p>A key qualifies when it carries every compliance tag the context asks for, it has no
     * geographic restriction or allows the context's region, and its size meets the classification
     * floor.
     */
    public Optional<String> selectKey(EncryptionContext context) {
        return selectKeyMetadata(context).map(KeyMetadata::getId);
    }

    @Timed(value = "data_encryption_duration", description = "Time taken to encrypt data")
    public EncryptionResult encrypt(byte[] data, EncryptionContext context) {
        Optional<KeyMetadata> selected = selectKeyMetadata(context);
        if (selected.isEmpty()) {
            log.warn("No suitable key for classification {} and purpose {}",
                context != null ? context.getClassification() : null, context != null ? context.getPurpose() : null);
            recordError(EncryptionErrorCode.NO_SUITABLE_KEY);
            return EncryptionResult.failure(EncryptionErrorCode.NO_SUITABLE_KEY, "No suitable encryption key available");
        }
        KeyMetadata key = selected.get();
        EncryptionOptions options = EncryptionOptions.builder()
            .algorithm(algorithmFor(key))
            .includeIntegrityCheck(true)
            .compress(context != null && context.getPurpose() == EncryptionPurpose.ARCHIVE)
            .build();
        return encryptWithKey(data, key.getId(), options, context);
    }

    public EncryptionResult encrypt(String data, EncryptionContext context) {
        return encrypt(data == null ? null : data.getBytes(StandardCharsets.UTF_8), context);
    }

    public EncryptionResult encryptWithKey(byte[] data, String keyId, EncryptionOptions options) {
        return encryptWithKey(data, keyId, options, null);
    }

    /**
     * Encrypts under a specific key, which must be active and unexpired.
     */
    public EncryptionResult encryptWithKey(byte[] data, String keyId, EncryptionOptions options, EncryptionContext context) {
        EncryptionOptions opts = options != null ? options : EncryptionOptions.builder().build();
        String algorithm = opts.getAlgorithm() != null ? opts.getAlgorithm() : config.getDefaultAlgorithm();
        try {
            validateInput(data);
            Instant now = clock.instant();

            EncryptionKey key = keyManagementService.getKey(keyId)
                .filter(k -> k.isUsableForEncryptionAt(now))
                .orElseThrow(() -> new EncryptionException(EncryptionErrorCode.KEY_INVALID,
                    "Key " + keyId + " is missing, inactive or expired"));
            AeadCipher cipher = cipherRegistry.require(algorithm);

            Optional<String> violation = keyUsagePolicy.checkUsage(key, context, data.length, now);
            if (violation.isPresent()) {
                throw new EncryptionException(EncryptionErrorCode.KEY_INVALID, violation.get());
            }
            if (cipher.keyLength() * 8 > key.getKeySize()) {
                throw new EncryptionException(EncryptionErrorCode.KEY_INVALID,
                    algorithm + " needs a " + (cipher.keyLength() * 8) + "-bit key, key " + keyId
                        + " has " + key.getKeySize() + " bits");
            }

            boolean compressed = opts.isCompress() && data.length >= config.getCompressionThreshold().toBytes();
            byte[] payload = compressed ? compress(data) : data;

            Map<String, String> metadata = new HashMap<>();
            metadata.put(EncryptedEnvelope.META_COMPRESSED, String.valueOf(compressed));
            metadata.put(EncryptedEnvelope.META_KEY_VERSION, String.valueOf(key.getVersion()));

            SealedPayload sealed = cipher.encrypt(key.getKeyMaterial(), payload,
                associatedData(EncryptedEnvelope.CURRENT_VERSION, keyId, algorithm));

            EncryptedEnvelope envelope = EncryptedEnvelope.builder()
                .version(EncryptedEnvelope.CURRENT_VERSION)
                .keyId(keyId)
                .algorithm(algorithm)
                .iv(encode(sealed.iv()))
                .authTag(encode(sealed.authTag()))
                .data(encode(sealed.ciphertext()))
                .timestamp(now)
                .integrityHash(opts.isIncludeIntegrityCheck() ? EncryptionDigests.sha256Base64(data) : null)
                .metadata(metadata)
                .build();
            String encoded = envelopeCodec.encode(envelope);

            // limits again, atomically with the count
            Optional<String> refused = keyManagementService.reserveUsage(keyId, KeyOperation.ENCRYPT, data.length,
                current -> keyUsagePolicy.checkLimits(current, data.length));
            if (refused.isPresent()) {
                throw new EncryptionException(EncryptionErrorCode.KEY_INVALID, refused.get());
            }
            audit("ENCRYPT", keyId, algorithm, data.length, true, null, context, null);
            encryptionCounter.increment();
            log.debug("Encrypted {} bytes with key {} using {}", data.length, keyId, algorithm);

            return EncryptionResult.builder()
                .success(true)
                .envelope(encoded)
                .keyId(keyId)
                .algorithm(algorithm)
                .encryptedAt(now)
                .build();
        } catch (EncryptionException e) {
            log.warn("Encryption with key {} failed: {} {}", keyId, e.getErrorCode(), e.getMessage());
            recordError(e.getErrorCode());
            audit("ENCRYPT", keyId, algorithm, data == null ? 0 : data.length, false, e.getErrorCode(), context, null);
            return EncryptionResult.failure(e.getErrorCode(), e.getMessage());
        } catch (Exception e) {
            log.error("Unexpected failure encrypting with key {}", keyId, e);
            recordError(EncryptionErrorCode.OPERATION_FAILED);
            audit("ENCRYPT", keyId, algorithm, data == null ? 0 : data.length, false,
                EncryptionErrorCode.OPERATION_FAILED, context, null);
            return EncryptionResult.failure(EncryptionErrorCode.OPERATION_FAILED, REDACTED_MESSAGE);
        }
    }

    /**
     * Decrypts an envelope using the key id it carries.
     *
     * <p>{@code KEY_NOT_FOUND} means no record exists for that id; {@code INVALID_ENVELOPE} means the
     * value itself is unreadable.
     */
    @Timed(value = "data_decryption_duration", description = "Time taken to decrypt data")
    public DecryptionResult decrypt(String envelope, EncryptionContext context) {
        EncryptedEnvelope parsed;
        try {
            parsed = envelopeCodec.decode(envelope);
        } catch (EncryptionException e) {
            log.warn("Rejected envelope: {}", e.getMessage());
            recordError(e.getErrorCode());
            return DecryptionResult.failure(e.getErrorCode(), e.getMessage());
        }
        if (!keyManagementService.keyExists(parsed.getKeyId())) {
            log.warn("Envelope references unknown key {}", parsed.getKeyId());
            recordError(EncryptionErrorCode.KEY_NOT_FOUND);
            return DecryptionResult.failure(EncryptionErrorCode.KEY_NOT_FOUND, "Key not found: " + parsed.getKeyId());
        }
        return decryptWithKey(parsed, parsed.getKeyId(), context);
    }

    public DecryptionResult decryptWithKey(String envelope, String keyId) {
        try {
            return decryptWithKey(envelopeCodec.decode(envelope), keyId, null);
        } catch (EncryptionException e) {
            log.warn("Rejected envelope: {}", e.getMessage());
            recordError(e.getErrorCode());
            return DecryptionResult.failure(e.getErrorCode(), e.getMessage());
        }
    }

    /**
     * Re-encrypts under {@code newKeyId}. A failure to decrypt is returned as-is and the new key is
     * never touched.
     */
    public EncryptionResult reEncrypt(String envelope, String oldKeyId, String newKeyId) {
        DecryptionResult decrypted = decryptWithKey(envelope, oldKeyId);
        if (!decrypted.isSuccess()) {
            return EncryptionResult.failure(decrypted.getErrorCode(), decrypted.getErrorMessage());
        }
        EncryptedEnvelope previous = envelopeCodec.decode(envelope);
        EncryptionOptions options = EncryptionOptions.builder()
            .algorithm(previous.getAlgorithm())
            .includeIntegrityCheck(true)
            .compress(previous.isCompressed())
            .build();
        EncryptionResult result = encryptWithKey(decrypted.getData(), newKeyId, options);
        if (result.isSuccess()) {
            reEncryptionCounter.increment();
            log.info("Re-encrypted data from key {} to key {}", oldKeyId, newKeyId);
        }
        return result;
    }

    /**
     * Disables the key and drops it from the in-process key cache.
     *
     * <p>Durable backups of the key are kept for their compliance retention period; this does not
     * erase them. Data encrypted under the key stays decryptable until the key is destroyed.
     */
    public boolean secureDelete(String keyId) {
        boolean disabled = keyManagementService.disableKey(keyId);
        keyManagementService.evictFromCache(keyId);
        if (disabled) {
            log.info("Securely deleted key {} (backups retained)", keyId);
        }
        return disabled;
    }

    public HashResult hash(byte[] data, HashingOptions options) {
        try {
            return HashResult.builder()
                .success(true)
                .record(hashingEngine.hash(data, options, clock.instant()))
                .build();
        } catch (EncryptionException e) {
            log.warn("Hashing failed: {}", e.getMessage());
            return HashResult.failure(e.getErrorCode(), e.getMessage());
        } catch (Exception e) {
            log.error("Unexpected hashing failure", e);
            return HashResult.failure(EncryptionErrorCode.OPERATION_FAILED, REDACTED_MESSAGE);
        }
    }

    public HashResult hash(String data, HashingOptions options) {
        return hash(data == null ? null : data.getBytes(StandardCharsets.UTF_8), options);
    }

    public boolean verifyHash(byte[] data, HashRecord record) {
        try {
            return hashingEngine.verify(data, record);
        } catch (Exception e) {
            log.error("Hash verification failed for {} record", record != null ? record.getAlgorithm() : null, e);
            return false;
        }
    }

    public boolean verifyHash(String data, HashRecord record) {
        return verifyHash(data == null ? null : data.getBytes(StandardCharsets.UTF_8), record);
    }

    private DecryptionResult decryptWithKey(EncryptedEnvelope envelope, String keyId, EncryptionContext context) {
        String algorithm = envelope.getAlgorithm();
        try {
            EncryptionKey key = keyManagementService.getKeyForDecryption(keyId)
                .orElseThrow(() -> new EncryptionException(EncryptionErrorCode.KEY_INVALID,
                    "Key " + keyId + " is not available for decryption"));
            AeadCipher cipher = cipherRegistry.require(algorithm);

            SealedPayload sealed = new SealedPayload(decode(envelope.getIv()), decode(envelope.getData()),
                decode(envelope.getAuthTag()));
            byte[] payload = cipher.decrypt(key.getKeyMaterial(), sealed,
                associatedData(envelope.getVersion(), envelope.getKeyId(), algorithm));
            byte[] plaintext = envelope.isCompressed()
                ? decompress(payload, config.getMaxDataSize().toBytes()) : payload;

            boolean integrityVerified = true;
            if (envelope.getIntegrityHash() != null) {
                integrityVerified = EncryptionDigests.matches(envelope.getIntegrityHash(),
                    EncryptionDigests.sha256Base64(plaintext));
                if (!integrityVerified) {
                    log.warn("Integrity hash mismatch for data decrypted with key {}", keyId);
                }
            }

            keyManagementService.recordUsage(keyId, KeyOperation.DECRYPT, plaintext.length);
            audit("DECRYPT", keyId, algorithm, plaintext.length, true, null, context, integrityVerified);
            decryptionCounter.increment();

            return DecryptionResult.builder()
                .success(true)
                .data(plaintext)
                .keyId(keyId)
                .algorithm(algorithm)
                .integrityVerified(integrityVerified)
                .decryptedAt(clock.instant())
                .build();
        } catch (EncryptionException e) {
            log.warn("Decryption with key {} failed: {} {}", keyId, e.getErrorCode(), e.getMessage());
            recordError(e.getErrorCode());
            audit("DECRYPT", keyId, algorithm, 0, false, e.getErrorCode(), context, null);
            return DecryptionResult.failure(e.getErrorCode(), e.getMessage());
        } catch (IllegalArgumentException e) {
            log.warn("Envelope for key {} has malformed fields: {}", keyId, e.getMessage());
            recordError(EncryptionErrorCode.INVALID_ENVELOPE);
            return DecryptionResult.failure(EncryptionErrorCode.INVALID_ENVELOPE, "Envelope fields are not valid base64");
        } catch (Exception e) {
            log.error("Unexpected failure decrypting with key {}", keyId, e);
            recordError(EncryptionErrorCode.OPERATION_FAILED);
            audit("DECRYPT", keyId, algorithm, 0, false, EncryptionErrorCode.OPERATION_FAILED, context, null);
            return DecryptionResult.failure(EncryptionErrorCode.OPERATION_FAILED, REDACTED_MESSAGE);
        }
    }

    private void validateInput(byte[] data) {
        if (data == null) {
            throw EncryptionException.invalidInput("Data to encrypt cannot be null");
        }
        if (data.length > config.getMaxDataSize().toBytes()) {
            throw EncryptionException.invalidInput("Data exceeds maximum size of " + config.getMaxDataSize());
        }
    }

    private Optional<KeyMetadata> selectKeyMetadata(EncryptionContext context) {
        EncryptionContext ctx = context != null ? context : EncryptionContext.builder().build();
        return keyManagementService.getActiveKeys(KeyPurpose.DATA_ENCRYPTION).stream()
            .filter(key -> key.getKeyType() != KeyType.ASYMMETRIC)
            .filter(key -> ctx.getComplianceRequirements() == null
                || key.getComplianceRequirements().containsAll(ctx.getComplianceRequirements()))
            .filter(key -> isGeographicallyCompatible(key, ctx.getGeographicRestriction()))
            .filter(key -> ctx.getClassification() == null || ctx.getClassification().isSatisfiedBy(key.getKeySize()))
            .findFirst();
    }

    /**
     * The default algorithm when the key is long enough for it, otherwise AES-GCM at the key's own
     * strength.
     */
    private String algorithmFor(KeyMetadata key) {
        String preferred = config.getDefaultAlgorithm();
        int keyBytes = key.getKeySize() / 8;
        Optional<AeadCipher> cipher = cipherRegistry.find(preferred);
        if (cipher.isEmpty() || cipher.get().keyLength() <= keyBytes) {
            return preferred;
        }
        if (keyBytes >= 32) {
            return AesGcmCipher.AES_256_GCM;
        }
        return keyBytes >= 24 ? AesGcmCipher.AES_192_GCM : AesGcmCipher.AES_128_GCM;
    }

    private static boolean isGeographicallyCompatible(KeyMetadata key, String region) {
        if (key.getGeographicRestrictions() == null || key.getGeographicRestrictions().isEmpty()) {
            return true;
        }
        return region != null && key.getGeographicRestrictions().contains(region);
    }

    private void audit(String operation, String keyId, String algorithm, long size, boolean success,
                       EncryptionErrorCode errorCode, EncryptionContext context, Boolean integrityVerified) {
        auditService.auditEncryptionOperation(EncryptionAuditEvent.builder()
            .operation(operation)
            .keyId(keyId)
            .algorithm(algorithm)
            .dataSize(size)
            .success(success)
            .errorCode(errorCode != null ? errorCode.name() : null)
            .userId(context != null ? context.getUserId() : null)
            .organizationId(context != null ? context.getOrganizationId() : null)
            .classification(context != null ? context.getClassification() : null)
            .integrityVerified(integrityVerified)
            .build());
    }

    private void recordError(EncryptionErrorCode errorCode) {
        Counter.builder("encryption_errors")
            .description("Number of failed encryption operations")
            .tag("code", errorCode.name())
            .register(meterRegistry)
            .increment();
    }

    private static byte[] associatedData(String version, String keyId, String algorithm) {
        return (version + ":" + keyId + ":" + algorithm).getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] compress(byte[] data) throws IOException {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        try (GZIPOutputStream gzos = new GZIPOutputStream(bos)) {
            gzos.write(data);
        }
        return bos.toByteArray();
    }

    private static byte[] decompress(byte[] data, long limit) throws IOException {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        byte[] buffer = new byte[8192];
        try (InputStream gzis = new GZIPInputStream(new ByteArrayInputStream(data))) {
            int read;
            while ((read = gzis.read(buffer)) != -1) {
                if (bos.size() + (long) read > limit) {
                    throw EncryptionException.invalidEnvelope(
                        "Compressed payload expands beyond the maximum size of " + limit + " bytes", null);
                }
                bos.write(buffer, 0, read);
            }
        }
        return bos.toByteArray();
    }

    private static String encode(byte[] bytes) {
        return Base64.getEncoder().encodeToString(bytes);
    }

    private static byte[] decode(String value) {
        if (value == null) {
            throw EncryptionException.invalidEnvelope("Envelope field is missing", null);
        }
        return Base64.getDecoder().decode(value);
    }
}
