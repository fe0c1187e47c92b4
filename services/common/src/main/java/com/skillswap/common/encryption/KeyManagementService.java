package com.skillswap.common.encryption;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillswap.common.config.EncryptionProperties;
import com.skillswap.common.encryption.cipher.AeadCipher;
import com.skillswap.common.encryption.cipher.AesGcmCipher;
import com.skillswap.common.encryption.cipher.SealedPayload;
import com.skillswap.common.encryption.exception.EncryptionErrorCode;
import com.skillswap.common.encryption.exception.EncryptionException;
import com.skillswap.common.encryption.exception.KeyManagementException;
import com.skillswap.common.encryption.model.BackupStatus;
import com.skillswap.common.encryption.model.EncryptionKey;
import com.skillswap.common.encryption.model.KeyBackupInfo;
import com.skillswap.common.encryption.model.KeyBackupPayload;
import com.skillswap.common.encryption.model.KeyBackupRecord;
import com.skillswap.common.encryption.model.KeyBackupResult;
import com.skillswap.common.encryption.model.KeyGenerationOptions;
import com.skillswap.common.encryption.model.KeyGenerationResult;
import com.skillswap.common.encryption.model.KeyManagementAuditEvent;
import com.skillswap.common.encryption.model.KeyMetadata;
import com.skillswap.common.encryption.model.KeyOperation;
import com.skillswap.common.encryption.model.KeyPurpose;
import com.skillswap.common.encryption.model.KeyRotationResult;
import com.skillswap.common.encryption.model.KeyRotationSchedule;
import com.skillswap.common.encryption.model.KeyStatus;
import com.skillswap.common.encryption.model.KeyType;
import com.skillswap.common.encryption.model.KeyUsageRestrictions;
import com.skillswap.common.encryption.model.KeyUsageStatistics;
import com.skillswap.common.encryption.store.KeyStore;
import com.skillswap.common.encryption.store.KeyStoreKeys;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Key lifecycle service: creation, lookup, rotation, disabling, backup, restore and destruction.
 *
 * <p>This is the only component that generates or unwraps raw key material. Records live in the
 * {@link KeyStore} with a short-lived write-through cache in front.
 *
 * <p>Locking:
 * <ul>
 *   <li>creation is serialized per {@link KeyPurpose}</li>
 *   <li>rotation, usage updates and other read-modify-write operations are serialized per key</li>
 * </ul>
 * Store writes are not transactional across records. A rotation interrupted halfway leaves the
 * predecessor in {@link KeyStatus#ROTATING}; {@link #recoverIncompleteRotations()} finishes it.
 */
@Service
@Slf4j
public class KeyManagementService {

    public static final String META_ROTATED_FROM = "rotated_from";
    public static final String META_ROTATED_TO = "rotated_to";
    public static final String META_ROTATION_TIMESTAMP = "rotation_timestamp";
    public static final String META_RESTORED_FROM = "restored_from";
    public static final String META_ORIGINAL_CREATED_AT = "original_created_at";
    public static final String META_RESTORATION_TIMESTAMP = "restoration_timestamp";
    public static final String META_PUBLIC_KEY = "public_key";

    private static final Set<Integer> SYMMETRIC_KEY_SIZES = Set.of(128, 192, 256);
    private static final Set<Integer> RSA_KEY_SIZES = Set.of(2048, 3072, 4096);

    private final KeyStore keyStore;
    private final KeyRecordCodec keyRecordCodec;
    private final MasterKeyProvider masterKeyProvider;
    private final EncryptionAuditService auditService;
    private final EncryptionProperties.KeyManagement config;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    // Metrics
    private final Counter keyCreationCounter;
    private final Counter keyRotationCounter;
    private final Counter keyDisableCounter;
    private final Counter keyBackupCounter;
    private final Counter keyRestoreCounter;
    private final Counter keyDestroyCounter;

    private final Map<String, CachedKey> keyCache = new ConcurrentHashMap<>();
    private final Map<KeyPurpose, ReentrantLock> purposeLocks = new EnumMap<>(KeyPurpose.class);
    private final Map<String, ReentrantLock> keyLocks = new ConcurrentHashMap<>();

    private final SecureRandom secureRandom = new SecureRandom();
    private final AeadCipher backupCipher = AesGcmCipher.aes256();

    public KeyManagementService(KeyStore keyStore,
                                KeyRecordCodec keyRecordCodec,
                                MasterKeyProvider masterKeyProvider,
                                EncryptionAuditService auditService,
                                EncryptionProperties properties,
                                ObjectMapper objectMapper,
                                MeterRegistry meterRegistry,
                                Clock clock) {
        this.keyStore = keyStore;
        this.keyRecordCodec = keyRecordCodec;
        this.masterKeyProvider = masterKeyProvider;
        this.auditService = auditService;
        this.config = properties.getKeyManagement();
        this.objectMapper = objectMapper;
        this.clock = clock;

        for (KeyPurpose purpose : KeyPurpose.values()) {
            purposeLocks.put(purpose, new ReentrantLock());
        }

        this.keyCreationCounter = operationCounter(meterRegistry, "create");
        this.keyRotationCounter = operationCounter(meterRegistry, "rotate");
        this.keyDisableCounter = operationCounter(meterRegistry, "disable");
        this.keyBackupCounter = operationCounter(meterRegistry, "backup");
        this.keyRestoreCounter = operationCounter(meterRegistry, "restore");
        this.keyDestroyCounter = operationCounter(meterRegistry, "destroy");
    }

    /**
     * Generates a key of the requested type and size and registers it as active for its purpose.
     *
     * <p>Symmetric and hybrid keys accept 128, 192 or 256 bits. Asymmetric keys are RSA with 2048,
     * 3072 or 4096 bits; the PKCS#8 private key is the material and the X.509 public key is published
     * in metadata under {@value #META_PUBLIC_KEY}.
     */
    @Timed(value = "key_creation_duration", description = "Time taken to create an encryption key")
    public KeyGenerationResult createKey(KeyType keyType, KeyPurpose purpose, KeyGenerationOptions options) {
        if (keyType == null || purpose == null) {
            return KeyGenerationResult.failure(EncryptionErrorCode.INVALID_INPUT, "Key type and purpose are required");
        }
        KeyGenerationOptions opts = options != null ? options : KeyGenerationOptions.defaults();

        KeyGenerationResult result;
        ReentrantLock lock = purposeLocks.get(purpose);
        lock.lock();
        try {
            Instant now = clock.instant();
            GeneratedMaterial material = generateMaterial(keyType, opts.getKeySize());

            Map<String, String> metadata = new HashMap<>(opts.getMetadata() != null ? opts.getMetadata() : Map.of());
            if (material.publicKey() != null) {
                metadata.put(META_PUBLIC_KEY, material.publicKey());
            }

            EncryptionKey key = EncryptionKey.builder()
                .id(newKeyId())
                .keyType(keyType)
                .purpose(purpose)
                .keyMaterial(material.keyMaterial())
                .keySize(opts.getKeySize())
                .status(KeyStatus.ACTIVE)
                .statusChangedAt(now)
                .version(1)
                .createdAt(now)
                .expiresAt(opts.getExpiresIn() != null ? now.plus(opts.getExpiresIn()) : null)
                .usageRestrictions(opts.getUsageRestrictions() != null
                    ? opts.getUsageRestrictions().copy() : new KeyUsageRestrictions())
                .geographicRestrictions(copyOf(opts.getGeographicRestrictions()))
                .complianceRequirements(opts.getComplianceRequirements() != null
                    ? new HashSet<>(opts.getComplianceRequirements()) : new HashSet<>())
                .metadata(metadata)
                .usageStatistics(new KeyUsageStatistics())
                .rotationSchedule(newRotationSchedule(opts.getRotationInterval(), opts.getAutoRotate(), now))
                .build();

            persistNewKey(key);
            keyCreationCounter.increment();
            audit("CREATE", key, null, Map.of("keyType", keyType.name(), "keySize", String.valueOf(key.getKeySize())));
            log.info("Created {} key {} for purpose {} ({} bits)", keyType, key.getId(), purpose, key.getKeySize());

            result = KeyGenerationResult.builder()
                .success(true)
                .keyId(key.getId())
                .keyType(keyType)
                .purpose(purpose)
                .keySize(key.getKeySize())
                .createdAt(key.getCreatedAt())
                .expiresAt(key.getExpiresAt())
                .build();
        } catch (EncryptionException e) {
            log.warn("Key creation rejected for purpose {}: {}", purpose, e.getMessage());
            return KeyGenerationResult.failure(e.getErrorCode(), e.getMessage());
        } catch (Exception e) {
            log.error("Failed to create {} key for purpose {}", keyType, purpose, e);
            return KeyGenerationResult.failure(EncryptionErrorCode.OPERATION_FAILED, "Key creation failed");
        } finally {
            lock.unlock();
        }

        if (config.isAutoCreateBackups()) {
            KeyBackupResult backup = backupKey(result.getKeyId());
            if (!backup.isSuccess()) {
                log.warn("Automatic backup of key {} failed: {}", result.getKeyId(), backup.getErrorMessage());
            }
        }
        return result;
    }

    /**
     * Returns the key if it exists and is neither expired nor destroyed. An active key found past its
     * expiration is moved to {@link KeyStatus#EXPIRED} and dropped from the active index.
     */
    public Optional<EncryptionKey> getKey(String keyId) {
        Optional<EncryptionKey> loaded = loadKey(keyId);
        if (loaded.isEmpty()) {
            return Optional.empty();
        }
        EncryptionKey key = loaded.get();
        if (key.getStatus() == KeyStatus.DESTROYED || key.getStatus() == KeyStatus.EXPIRED) {
            return Optional.empty();
        }
        if (key.getStatus() == KeyStatus.ACTIVE && key.isExpiredAt(clock.instant())) {
            expireKey(keyId);
            return Optional.empty();
        }
        return Optional.of(key);
    }

    /**
     * Returns the key if its material may be used to decrypt: active and unexpired, archived,
     * disabled, or mid-rotation.
     */
    public Optional<EncryptionKey> getKeyForDecryption(String keyId) {
        return getKey(keyId).filter(key -> key.isUsableForDecryptionAt(clock.instant()));
    }

    /**
     * True when any record exists for the id, whatever its status.
     */
    public boolean keyExists(String keyId) {
        return loadKey(keyId).isPresent();
    }

    public Optional<KeyMetadata> getKeyMetadata(String keyId) {
        return loadKey(keyId).map(EncryptionKey::toMetadata);
    }

    /**
     * Active, unexpired keys for a purpose, newest first.
     */
    public List<KeyMetadata> getActiveKeys(KeyPurpose purpose) {
        Instant now = clock.instant();
        return keyStore.setMembers(KeyStoreKeys.activeKeys(purpose)).stream()
            .map(this::getKey)
            .flatMap(Optional::stream)
            .filter(key -> key.getPurpose() == purpose && key.isUsableForEncryptionAt(now))
            .sorted(Comparator.comparing(EncryptionKey::getCreatedAt)
                .thenComparingInt(EncryptionKey::getVersion)
                .reversed())
            .map(EncryptionKey::toMetadata)
            .collect(Collectors.toList());
    }

    /**
     * Replaces a key with a freshly generated successor and archives the predecessor.
     *
     * <p>Safe to re-run. An archived key resolves to its recorded successor; a key left
     * {@link KeyStatus#ROTATING} by an interrupted run has that rotation completed.
     */
    @Timed(value = "key_rotation_duration", description = "Time taken to rotate an encryption key")
    public KeyRotationResult rotateKey(String keyId) {
        ReentrantLock lock = keyLock(keyId);
        lock.lock();
        try {
            Optional<EncryptionKey> loaded = loadKey(keyId);
            if (loaded.isEmpty()) {
                return KeyRotationResult.failure(keyId, EncryptionErrorCode.KEY_NOT_FOUND, "Key not found: " + keyId);
            }
            EncryptionKey key = loaded.get();
            Instant now = clock.instant();

            switch (key.getStatus()) {
                case DISABLED:
                case COMPROMISED:
                case DESTROYED:
                    return KeyRotationResult.failure(keyId, EncryptionErrorCode.KEY_INVALID,
                        "Key " + keyId + " cannot be rotated in status " + key.getStatus());
                case ARCHIVED:
                    return resolveExistingSuccessor(key);
                case ROTATING:
                    Optional<EncryptionKey> pending = loadKey(key.getMetadata().get(META_ROTATED_TO));
                    if (pending.isPresent()) {
                        log.info("Completing interrupted rotation of key {} -> {}", keyId, pending.get().getId());
                        completeRotation(key, pending.get(), now);
                        return rotated(key, pending.get(), now);
                    }
                    break;
                default:
                    break;
            }

            EncryptionKey successor = buildSuccessor(key, now);

            // Mark the predecessor first so an interrupted run is discoverable
            keyStore.addToSet(KeyStoreKeys.ROTATING, keyId);
            key.changeStatus(KeyStatus.ROTATING, now);
            key.getMetadata().put(META_ROTATED_TO, successor.getId());
            saveKey(key);

            persistNewKey(successor);
            completeRotation(key, successor, now);

            keyRotationCounter.increment();
            audit("ROTATE", key, successor.getId(), Map.of("newVersion", String.valueOf(successor.getVersion())));
            log.info("Rotated key {} -> {} (version {})", keyId, successor.getId(), successor.getVersion());
            return rotated(key, successor, now);
        } catch (EncryptionException e) {
            log.warn("Rotation of key {} rejected: {}", keyId, e.getMessage());
            return KeyRotationResult.failure(keyId, e.getErrorCode(), e.getMessage());
        } catch (Exception e) {
            log.error("Failed to rotate key {}", keyId, e);
            return KeyRotationResult.failure(keyId, EncryptionErrorCode.OPERATION_FAILED, "Key rotation failed");
        } finally {
            lock.unlock();
        }
    }

    /**
     * Finishes every rotation left in {@link KeyStatus#ROTATING}.
     *
     * @return number of rotations completed
     */
    public int recoverIncompleteRotations() {
        int recovered = 0;
        for (String keyId : keyStore.setMembers(KeyStoreKeys.ROTATING)) {
            Optional<EncryptionKey> key = loadKey(keyId);
            if (key.isEmpty() || key.get().getStatus() != KeyStatus.ROTATING) {
                keyStore.removeFromSet(KeyStoreKeys.ROTATING, keyId);
                continue;
            }
            KeyRotationResult result = rotateKey(keyId);
            if (result.isSuccess()) {
                recovered++;
            } else {
                log.warn("Could not recover rotation of key {}: {}", keyId, result.getErrorMessage());
            }
        }
        if (recovered > 0) {
            log.info("Recovered {} incomplete key rotations", recovered);
        }
        return recovered;
    }

    /**
     * Takes a key out of new-encryption selection. Its material stays available for decryption.
     */
    public boolean disableKey(String keyId) {
        ReentrantLock lock = keyLock(keyId);
        lock.lock();
        try {
            Optional<EncryptionKey> loaded = loadKey(keyId);
            if (loaded.isEmpty() || loaded.get().getStatus() == KeyStatus.DESTROYED) {
                log.warn("Cannot disable missing key {}", keyId);
                return false;
            }
            EncryptionKey key = loaded.get();
            key.changeStatus(KeyStatus.DISABLED, clock.instant());
            saveKey(key);
            keyStore.removeFromSet(KeyStoreKeys.activeKeys(key.getPurpose()), keyId);
            keyStore.addToSet(KeyStoreKeys.DISABLED, keyId);
            keyStore.removeFromSortedSet(KeyStoreKeys.ROTATION_TRACKING, keyId);

            keyDisableCounter.increment();
            audit("DISABLE", key, null, null);
            log.info("Disabled key {}", keyId);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Purges a key's material and marks it destroyed. The record stays as a tombstone.
     */
    public boolean destroyKey(String keyId) {
        ReentrantLock lock = keyLock(keyId);
        lock.lock();
        try {
            Optional<EncryptionKey> loaded = loadKey(keyId);
            if (loaded.isEmpty()) {
                return false;
            }
            EncryptionKey key = loaded.get();
            if (key.getStatus() == KeyStatus.DESTROYED) {
                return true;
            }
            key.setKeyMaterial(null);
            key.changeStatus(KeyStatus.DESTROYED, clock.instant());
            saveKey(key);
            keyStore.removeFromSet(KeyStoreKeys.activeKeys(key.getPurpose()), keyId);
            keyStore.removeFromSet(KeyStoreKeys.ARCHIVED, keyId);
            keyStore.removeFromSet(KeyStoreKeys.DISABLED, keyId);
            keyStore.removeFromSet(KeyStoreKeys.ROTATING, keyId);
            keyStore.removeFromSortedSet(KeyStoreKeys.EXPIRATION_TRACKING, keyId);
            keyStore.removeFromSortedSet(KeyStoreKeys.ROTATION_TRACKING, keyId);
            evictFromCache(keyId);

            keyDestroyCounter.increment();
            audit("DESTROY", key, null, null);
            log.info("Destroyed key {}", keyId);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Seals the key's material and identity under the backup key and stores it with the configured
     * backup retention.
     */
    public KeyBackupResult backupKey(String keyId) {
        ReentrantLock lock = keyLock(keyId);
        lock.lock();
        try {
            Optional<EncryptionKey> loaded = loadKey(keyId).filter(k -> k.getStatus() != KeyStatus.DESTROYED);
            if (loaded.isEmpty()) {
                return KeyBackupResult.failure(keyId, EncryptionErrorCode.KEY_NOT_FOUND, "Key not found: " + keyId);
            }
            EncryptionKey key = loaded.get();
            Instant now = clock.instant();
            String backupId = "backup_" + UUID.randomUUID().toString().replace("-", "");

            KeyBackupPayload payload = KeyBackupPayload.builder()
                .keyId(key.getId())
                .keyType(key.getKeyType())
                .purpose(key.getPurpose())
                .keySize(key.getKeySize())
                .version(key.getVersion())
                .createdAt(key.getCreatedAt())
                .expiresAt(key.getExpiresAt())
                .keyMaterial(Base64.getEncoder().encodeToString(key.getKeyMaterial()))
                .usageRestrictions(key.getUsageRestrictions())
                .geographicRestrictions(copyOf(key.getGeographicRestrictions()))
                .complianceRequirements(new HashSet<>(key.getComplianceRequirements()))
                .metadata(new HashMap<>(key.getMetadata()))
                .build();
            byte[] plain = objectMapper.writeValueAsBytes(payload);
            String payloadHash = EncryptionDigests.sha256Base64(plain);
            SealedPayload sealed = backupCipher.encrypt(masterKeyProvider.backupKey(), plain, backupAad(backupId));

            KeyBackupRecord record = KeyBackupRecord.builder()
                .backupId(backupId)
                .keyId(keyId)
                .iv(encode(sealed.iv()))
                .data(encode(sealed.ciphertext()))
                .authTag(encode(sealed.authTag()))
                .payloadHash(payloadHash)
                .createdAt(now)
                .build();
            String location = KeyStoreKeys.backup(backupId);
            keyStore.set(location, objectMapper.writeValueAsString(record), config.getBackupRetentionPeriod());
            keyStore.addToSet(KeyStoreKeys.BACKUP_INDEX, backupId);

            key.setBackupInfo(KeyBackupInfo.builder()
                .backupId(backupId)
                .backupTimestamp(now)
                .backupLocation(location)
                .verificationHash(payloadHash)
                .status(BackupStatus.VALID)
                .lastVerified(now)
                .build());
            saveKey(key);

            keyBackupCounter.increment();
            audit("BACKUP", key, backupId, null);
            log.info("Backed up key {} as {}", keyId, backupId);

            return KeyBackupResult.builder()
                .success(true)
                .backupId(backupId)
                .keyId(keyId)
                .backupLocation(location)
                .backupHash(payloadHash)
                .backupTimestamp(now)
                .build();
        } catch (Exception e) {
            log.error("Failed to back up key {}", keyId, e);
            return KeyBackupResult.failure(keyId, EncryptionErrorCode.OPERATION_FAILED, "Key backup failed");
        } finally {
            lock.unlock();
        }
    }

    /**
     * Recreates a key from a backup under a new id, registered active at version 1.
     */
    public KeyGenerationResult restoreKey(String backupId) {
        Optional<String> stored = keyStore.get(KeyStoreKeys.backup(backupId));
        if (stored.isEmpty()) {
            return KeyGenerationResult.failure(EncryptionErrorCode.BACKUP_NOT_FOUND, "Backup not found: " + backupId);
        }
        KeyBackupPayload payload;
        try {
            payload = openBackup(objectMapper.readValue(stored.get(), KeyBackupRecord.class));
        } catch (EncryptionException e) {
            log.error("Backup {} failed verification", backupId, e);
            return KeyGenerationResult.failure(EncryptionErrorCode.BACKUP_CORRUPTED, "Backup is corrupted: " + backupId);
        } catch (Exception e) {
            log.error("Failed to read backup {}", backupId, e);
            return KeyGenerationResult.failure(EncryptionErrorCode.BACKUP_CORRUPTED, "Backup is corrupted: " + backupId);
        }

        if (payload.getPurpose() == null || payload.getKeyType() == null || payload.getKeyMaterial() == null) {
            return KeyGenerationResult.failure(EncryptionErrorCode.BACKUP_CORRUPTED, "Backup is incomplete: " + backupId);
        }

        ReentrantLock lock = purposeLocks.get(payload.getPurpose());
        lock.lock();
        try {
            Instant now = clock.instant();
            Map<String, String> metadata = new HashMap<>(payload.getMetadata());
            metadata.remove(META_ROTATED_TO);
            metadata.put(META_RESTORED_FROM, backupId);
            metadata.put(META_ORIGINAL_CREATED_AT, String.valueOf(payload.getCreatedAt()));
            metadata.put(META_RESTORATION_TIMESTAMP, now.toString());

            EncryptionKey key = EncryptionKey.builder()
                .id(newKeyId())
                .keyType(payload.getKeyType())
                .purpose(payload.getPurpose())
                .keyMaterial(Base64.getDecoder().decode(payload.getKeyMaterial()))
                .keySize(payload.getKeySize())
                .status(KeyStatus.ACTIVE)
                .statusChangedAt(now)
                .version(1)
                .createdAt(now)
                .expiresAt(restoredExpiry(payload, now))
                .usageRestrictions(payload.getUsageRestrictions() != null
                    ? payload.getUsageRestrictions().copy() : new KeyUsageRestrictions())
                .geographicRestrictions(copyOf(payload.getGeographicRestrictions()))
                .complianceRequirements(new HashSet<>(payload.getComplianceRequirements()))
                .metadata(metadata)
                .usageStatistics(new KeyUsageStatistics())
                .rotationSchedule(newRotationSchedule(null, null, now))
                .build();
            persistNewKey(key);

            keyRestoreCounter.increment();
            audit("RESTORE", key, payload.getKeyId(), Map.of("backupId", backupId));
            log.info("Restored backup {} of key {} as {}", backupId, payload.getKeyId(), key.getId());

            return KeyGenerationResult.builder()
                .success(true)
                .keyId(key.getId())
                .keyType(key.getKeyType())
                .purpose(key.getPurpose())
                .keySize(key.getKeySize())
                .createdAt(now)
                .expiresAt(key.getExpiresAt())
                .build();
        } catch (Exception e) {
            log.error("Failed to restore backup {}", backupId, e);
            return KeyGenerationResult.failure(EncryptionErrorCode.OPERATION_FAILED, "Key restore failed");
        } finally {
            lock.unlock();
        }
    }

    /**
     * Re-reads the key's latest backup, recomputes its hash and records the outcome in the key's
     * backup info.
     */
    public boolean verifyBackup(String keyId) {
        ReentrantLock lock = keyLock(keyId);
        lock.lock();
        try {
            Optional<EncryptionKey> loaded = loadKey(keyId);
            if (loaded.isEmpty() || loaded.get().getBackupInfo() == null) {
                return false;
            }
            EncryptionKey key = loaded.get();
            KeyBackupInfo info = key.getBackupInfo();
            BackupStatus status;

            Optional<String> stored = keyStore.get(KeyStoreKeys.backup(info.getBackupId()));
            if (stored.isEmpty()) {
                status = BackupStatus.MISSING;
            } else {
                try {
                    KeyBackupRecord record = objectMapper.readValue(stored.get(), KeyBackupRecord.class);
                    openBackup(record);
                    status = EncryptionDigests.matches(info.getVerificationHash(), record.getPayloadHash())
                        ? BackupStatus.VALID : BackupStatus.VERIFICATION_FAILED;
                } catch (Exception e) {
                    log.warn("Backup {} of key {} failed verification: {}", info.getBackupId(), keyId, e.getMessage());
                    status = BackupStatus.VERIFICATION_FAILED;
                }
            }

            info.setStatus(status);
            info.setLastVerified(clock.instant());
            saveKey(key);
            if (status != BackupStatus.VALID) {
                log.warn("Backup {} of key {} is {}", info.getBackupId(), keyId, status);
            }
            return status == BackupStatus.VALID;
        } finally {
            lock.unlock();
        }
    }

    public boolean scheduleRotation(String keyId, Instant rotateAt) {
        ReentrantLock lock = keyLock(keyId);
        lock.lock();
        try {
            Optional<EncryptionKey> loaded = loadKey(keyId).filter(k -> k.getStatus() == KeyStatus.ACTIVE);
            if (loaded.isEmpty()) {
                return false;
            }
            EncryptionKey key = loaded.get();
            if (key.getRotationSchedule() == null) {
                key.setRotationSchedule(newRotationSchedule(null, true, clock.instant()));
            }
            key.getRotationSchedule().setNextRotation(rotateAt);
            key.getRotationSchedule().setAutoRotate(true);
            saveKey(key);
            keyStore.addToSortedSet(KeyStoreKeys.ROTATION_TRACKING, keyId, rotateAt.toEpochMilli());
            log.info("Scheduled rotation of key {} at {}", keyId, rotateAt);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public Optional<KeyUsageStatistics> getKeyUsage(String keyId) {
        return loadKey(keyId).map(EncryptionKey::getUsageStatistics);
    }

    /**
     * Counts one operation against the key. No-op when usage monitoring is disabled.
     */
    public void recordUsage(String keyId, KeyOperation operation, long bytes) {
        if (!config.isEnableUsageMonitoring()) {
            return;
        }
        ReentrantLock lock = keyLock(keyId);
        lock.lock();
        try {
            loadKey(keyId).ifPresent(key -> {
                if (key.getUsageStatistics() == null) {
                    key.setUsageStatistics(new KeyUsageStatistics());
                }
                key.getUsageStatistics().record(operation, bytes, clock.instant());
                saveKey(key);
            });
        } finally {
            lock.unlock();
        }
    }

    /**
     * Checks the key's limits and counts the operation in one step under the key's lock, so
     * concurrent callers cannot overrun a limit. Nothing is recorded when the check refuses.
     *
     * @return the refusal reason, or empty when the operation was counted
     */
    public Optional<String> reserveUsage(String keyId, KeyOperation operation, long bytes,
                                         Function<EncryptionKey, Optional<String>> limitCheck) {
        ReentrantLock lock = keyLock(keyId);
        lock.lock();
        try {
            Optional<EncryptionKey> loaded = loadKey(keyId);
            if (loaded.isEmpty()) {
                return Optional.of("Key not found: " + keyId);
            }
            EncryptionKey key = loaded.get();
            Optional<String> refused = limitCheck.apply(key);
            if (refused.isPresent() || !config.isEnableUsageMonitoring()) {
                return refused;
            }
            if (key.getUsageStatistics() == null) {
                key.setUsageStatistics(new KeyUsageStatistics());
            }
            key.getUsageStatistics().record(operation, bytes, clock.instant());
            saveKey(key);
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Keys that are due for rotation now: expired, past their maximum age, or at their scheduled
     * rotation time.
     */
    public List<String> getKeysDueForRotation() {
        Instant now = clock.instant();
        Set<String> candidates = new LinkedHashSet<>();
        for (KeyPurpose purpose : KeyPurpose.values()) {
            candidates.addAll(keyStore.setMembers(KeyStoreKeys.activeKeys(purpose)));
        }
        candidates.addAll(keyStore.rangeByScore(KeyStoreKeys.ROTATION_TRACKING, 0, now.toEpochMilli()));
        candidates.addAll(keyStore.rangeByScore(KeyStoreKeys.EXPIRATION_TRACKING, 0, now.toEpochMilli()));

        Set<KeyStatus> rotatable = EnumSet.of(KeyStatus.ACTIVE, KeyStatus.EXPIRED, KeyStatus.PENDING_ROTATION);
        return candidates.stream()
            .map(this::loadKey)
            .flatMap(Optional::stream)
            .filter(key -> rotatable.contains(key.getStatus()) && key.isDueForRotationAt(now))
            .map(EncryptionKey::getId)
            .collect(Collectors.toList());
    }

    /**
     * Archived, disabled and expired keys.
     */
    public List<KeyMetadata> getRetiredKeys() {
        Set<String> candidates = new LinkedHashSet<>(keyStore.setMembers(KeyStoreKeys.ARCHIVED));
        candidates.addAll(keyStore.setMembers(KeyStoreKeys.DISABLED));
        candidates.addAll(keyStore.rangeByScore(KeyStoreKeys.EXPIRATION_TRACKING, 0, clock.instant().toEpochMilli()));
        return candidates.stream()
            .map(this::loadKey)
            .flatMap(Optional::stream)
            .filter(key -> key.getStatus().isRetired())
            .map(EncryptionKey::toMetadata)
            .collect(Collectors.toList());
    }

    public void evictFromCache(String keyId) {
        keyCache.remove(keyId);
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * The restored key gets the original's lifetime counted from the restore, not its absolute
     * expiry, which may long have passed.
     */
    private static Instant restoredExpiry(KeyBackupPayload payload, Instant now) {
        if (payload.getExpiresAt() == null || payload.getCreatedAt() == null) {
            return null;
        }
        return now.plus(Duration.between(payload.getCreatedAt(), payload.getExpiresAt()));
    }

    private KeyRotationResult resolveExistingSuccessor(EncryptionKey key) {
        String successorId = key.getMetadata().get(META_ROTATED_TO);
        Optional<EncryptionKey> successor = loadKey(successorId);
        if (successor.isEmpty()) {
            return KeyRotationResult.failure(key.getId(), EncryptionErrorCode.ALREADY_ROTATED,
                "Key " + key.getId() + " is archived and has no known successor");
        }
        log.debug("Key {} already rotated to {}", key.getId(), successorId);
        return KeyRotationResult.builder()
            .success(true)
            .oldKeyId(key.getId())
            .newKeyId(successorId)
            .newVersion(successor.get().getVersion())
            .rotatedAt(key.getStatusChangedAt())
            .alreadyRotated(true)
            .build();
    }

    private void completeRotation(EncryptionKey predecessor, EncryptionKey successor, Instant now) {
        if (successor.getStatus() == KeyStatus.ACTIVE) {
            registerIndexes(successor);
        }
        predecessor.changeStatus(KeyStatus.ARCHIVED, now);
        if (predecessor.getRotationSchedule() != null) {
            predecessor.getRotationSchedule().setLastRotation(now);
        }
        saveKey(predecessor);

        String keyId = predecessor.getId();
        keyStore.removeFromSet(KeyStoreKeys.activeKeys(predecessor.getPurpose()), keyId);
        keyStore.addToSet(KeyStoreKeys.ARCHIVED, keyId);
        keyStore.removeFromSet(KeyStoreKeys.ROTATING, keyId);
        keyStore.removeFromSortedSet(KeyStoreKeys.ROTATION_TRACKING, keyId);
        keyStore.removeFromSortedSet(KeyStoreKeys.EXPIRATION_TRACKING, keyId);
    }

    private KeyRotationResult rotated(EncryptionKey predecessor, EncryptionKey successor, Instant now) {
        return KeyRotationResult.builder()
            .success(true)
            .oldKeyId(predecessor.getId())
            .newKeyId(successor.getId())
            .newVersion(successor.getVersion())
            .rotatedAt(now)
            .build();
    }

    private EncryptionKey buildSuccessor(EncryptionKey predecessor, Instant now) {
        GeneratedMaterial material = generateMaterial(predecessor.getKeyType(), predecessor.getKeySize());

        Map<String, String> metadata = new HashMap<>(predecessor.getMetadata());
        metadata.remove(META_ROTATED_TO);
        metadata.put(META_ROTATED_FROM, predecessor.getId());
        metadata.put(META_ROTATION_TIMESTAMP, now.toString());
        if (material.publicKey() != null) {
            metadata.put(META_PUBLIC_KEY, material.publicKey());
        }

        Instant expiresAt = null;
        if (predecessor.getExpiresAt() != null && predecessor.getCreatedAt() != null) {
            expiresAt = now.plus(Duration.between(predecessor.getCreatedAt(), predecessor.getExpiresAt()));
        }

        KeyRotationSchedule previous = predecessor.getRotationSchedule();
        KeyRotationSchedule schedule = previous != null
            ? newRotationSchedule(previous.getRotationInterval(), previous.isAutoRotate(), now)
            : newRotationSchedule(null, null, now);

        return EncryptionKey.builder()
            .id(newKeyId())
            .keyType(predecessor.getKeyType())
            .purpose(predecessor.getPurpose())
            .keyMaterial(material.keyMaterial())
            .keySize(predecessor.getKeySize())
            .status(KeyStatus.ACTIVE)
            .statusChangedAt(now)
            .version(predecessor.getVersion() + 1)
            .parentKeyId(predecessor.getId())
            .createdAt(now)
            .expiresAt(expiresAt)
            .usageRestrictions(predecessor.getUsageRestrictions() != null
                ? predecessor.getUsageRestrictions().copy() : new KeyUsageRestrictions())
            .geographicRestrictions(copyOf(predecessor.getGeographicRestrictions()))
            .complianceRequirements(new HashSet<>(predecessor.getComplianceRequirements()))
            .metadata(metadata)
            .usageStatistics(new KeyUsageStatistics())
            .rotationSchedule(schedule)
            .build();
    }

    private void expireKey(String keyId) {
        ReentrantLock lock = keyLock(keyId);
        lock.lock();
        try {
            loadKey(keyId)
                .filter(key -> key.getStatus() == KeyStatus.ACTIVE && key.isExpiredAt(clock.instant()))
                .ifPresent(key -> {
                    key.changeStatus(KeyStatus.EXPIRED, clock.instant());
                    saveKey(key);
                    keyStore.removeFromSet(KeyStoreKeys.activeKeys(key.getPurpose()), keyId);
                    audit("EXPIRE", key, null, null);
                    log.info("Key {} expired at {}", keyId, key.getExpiresAt());
                });
        } finally {
            lock.unlock();
        }
    }

    private KeyBackupPayload openBackup(KeyBackupRecord record) throws IOException {
        SealedPayload sealed = new SealedPayload(decode(record.getIv()), decode(record.getData()), decode(record.getAuthTag()));
        byte[] plain = backupCipher.decrypt(masterKeyProvider.backupKey(), sealed, backupAad(record.getBackupId()));
        if (!EncryptionDigests.matches(record.getPayloadHash(), EncryptionDigests.sha256Base64(plain))) {
            throw new KeyManagementException(EncryptionErrorCode.BACKUP_CORRUPTED, record.getKeyId(),
                "Backup hash mismatch for " + record.getBackupId());
        }
        return objectMapper.readValue(plain, KeyBackupPayload.class);
    }

    private void persistNewKey(EncryptionKey key) {
        saveKey(key);
        registerIndexes(key);
    }

    private void registerIndexes(EncryptionKey key) {
        keyStore.addToSet(KeyStoreKeys.activeKeys(key.getPurpose()), key.getId());
        if (key.getExpiresAt() != null) {
            keyStore.addToSortedSet(KeyStoreKeys.EXPIRATION_TRACKING, key.getId(), key.getExpiresAt().toEpochMilli());
        }
        KeyRotationSchedule schedule = key.getRotationSchedule();
        if (schedule != null && schedule.isAutoRotate() && schedule.getNextRotation() != null) {
            keyStore.addToSortedSet(KeyStoreKeys.ROTATION_TRACKING, key.getId(), schedule.getNextRotation().toEpochMilli());
        }
    }

    private void saveKey(EncryptionKey key) {
        keyStore.set(KeyStoreKeys.keyData(key.getId()), keyRecordCodec.encode(key));
        keyCache.put(key.getId(), new CachedKey(key, clock.instant().plus(config.getKeyCacheTtl())));
    }

    private Optional<EncryptionKey> loadKey(String keyId) {
        if (keyId == null) {
            return Optional.empty();
        }
        CachedKey cached = keyCache.get(keyId);
        if (cached != null && !cached.isExpired(clock.instant())) {
            return Optional.of(cached.getKey());
        }
        Optional<EncryptionKey> loaded = keyStore.get(KeyStoreKeys.keyData(keyId)).map(keyRecordCodec::decode);
        if (loaded.isEmpty()) {
            return loaded;
        }
        // a concurrent saveKey may have cached a newer instance since the store read
        Instant now = clock.instant();
        CachedKey current = keyCache.compute(keyId, (id, existing) -> existing != null && !existing.isExpired(now)
            ? existing : new CachedKey(loaded.get(), now.plus(config.getKeyCacheTtl())));
        return Optional.of(current.getKey());
    }

    private KeyRotationSchedule newRotationSchedule(Duration interval, Boolean autoRotate, Instant now) {
        Duration rotationInterval = interval != null ? interval : config.getDefaultRotationInterval();
        return KeyRotationSchedule.builder()
            .rotationInterval(rotationInterval)
            .nextRotation(now.plus(rotationInterval))
            .autoRotate(autoRotate != null ? autoRotate : config.isAutoRotateKeys())
            .warningThreshold(config.getRotationWarningThreshold())
            .maxKeyAge(config.getMaxKeyAge())
            .build();
    }

    private GeneratedMaterial generateMaterial(KeyType keyType, int keySize) {
        switch (keyType) {
            case SYMMETRIC:
            case HYBRID:
                if (!SYMMETRIC_KEY_SIZES.contains(keySize)) {
                    throw KeyManagementException.invalidKeySize(keySize);
                }
                byte[] material = new byte[keySize / 8];
                secureRandom.nextBytes(material);
                return new GeneratedMaterial(material, null);
            case ASYMMETRIC:
                if (!RSA_KEY_SIZES.contains(keySize)) {
                    throw KeyManagementException.invalidKeySize(keySize);
                }
                try {
                    KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
                    generator.initialize(keySize, secureRandom);
                    KeyPair pair = generator.generateKeyPair();
                    return new GeneratedMaterial(pair.getPrivate().getEncoded(), encode(pair.getPublic().getEncoded()));
                } catch (GeneralSecurityException e) {
                    throw new KeyManagementException(EncryptionErrorCode.OPERATION_FAILED, null, "RSA key generation failed", e);
                }
            default:
                throw new KeyManagementException(EncryptionErrorCode.INVALID_INPUT, null, "Unsupported key type: " + keyType);
        }
    }

    private void audit(String operation, EncryptionKey key, String relatedKeyId, Map<String, String> details) {
        auditService.auditKeyManagementOperation(KeyManagementAuditEvent.builder()
            .operation(operation)
            .keyId(key.getId())
            .relatedKeyId(relatedKeyId)
            .purpose(key.getPurpose())
            .version(key.getVersion())
            .details(details)
            .build());
    }

    private ReentrantLock keyLock(String keyId) {
        return keyLocks.computeIfAbsent(String.valueOf(keyId), id -> new ReentrantLock());
    }

    private static Counter operationCounter(MeterRegistry meterRegistry, String operation) {
        return Counter.builder("key_management_operations")
            .description("Number of key management operations")
            .tag("operation", operation)
            .register(meterRegistry);
    }

    private static String newKeyId() {
        return "key_" + UUID.randomUUID().toString().replace("-", "");
    }

    private static byte[] backupAad(String backupId) {
        return ("backup:" + backupId).getBytes(StandardCharsets.UTF_8);
    }

    private static Set<String> copyOf(Set<String> values) {
        return values == null ? new HashSet<>() : new HashSet<>(values);
    }

    private static String encode(byte[] bytes) {
        return Base64.getEncoder().encodeToString(bytes);
    }

    private static byte[] decode(String value) {
        return Base64.getDecoder().decode(value);
    }

    private record GeneratedMaterial(byte[] keyMaterial, String publicKey) {
    }

    private static class CachedKey {
        private final EncryptionKey key;
        private final Instant expiresAt;

        CachedKey(EncryptionKey key, Instant expiresAt) {
            this.key = key;
            this.expiresAt = expiresAt;
        }

        EncryptionKey getKey() {
            return key;
        }

        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
