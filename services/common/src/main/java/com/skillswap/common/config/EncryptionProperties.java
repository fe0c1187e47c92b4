package com.skillswap.common.config;

import com.skillswap.common.encryption.cipher.AesGcmCipher;
import com.skillswap.common.encryption.model.HashingAlgorithm;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for key management and data encryption.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "skillswap.encryption")
public class EncryptionProperties {

    @Valid
    private KeyManagement keyManagement = new KeyManagement();

    @Valid
    private DataEncryption dataEncryption = new DataEncryption();

    @Valid
    private Scheduling scheduling = new Scheduling();

    @Data
    public static class KeyManagement {
        private boolean autoRotateKeys = false;

        @NotNull
        private Duration defaultRotationInterval = Duration.ofDays(90);

        /** Base64 AES key used to wrap key material at rest. Generated per process when absent. */
        private String masterKey;

        /** Base64 AES key used to seal key backups. Generated per process when absent. */
        private String backupEncryptionKey;

        private boolean enableUsageMonitoring = true;

        /** How long archived, disabled or expired keys are kept before they are destroyed. */
        @NotNull
        private Duration retentionPeriod = Duration.ofDays(365);

        @Min(1)
        private int maxKeyVersions = 10;

        private boolean autoCreateBackups = true;

        @NotNull
        private Duration backupRetentionPeriod = Duration.ofDays(2555);

        @NotNull
        private Duration keyCacheTtl = Duration.ofMinutes(5);

        @NotNull
        private Duration rotationWarningThreshold = Duration.ofDays(7);

        @NotNull
        private Duration maxKeyAge = Duration.ofDays(365);
    }

    @Data
    public static class DataEncryption {
        @NotBlank
        private String defaultAlgorithm = AesGcmCipher.AES_256_GCM;

        @NotNull
        private HashingAlgorithm defaultHashingAlgorithm = HashingAlgorithm.ARGON2ID;

        /** Application-wide secret appended before hashing. Never stored with hashes. */
        private String defaultPepper;

        private boolean logOperations = true;

        @NotNull
        private DataSize maxDataSize = DataSize.ofMegabytes(100);

        @NotNull
        private DataSize compressionThreshold = DataSize.ofKilobytes(1);

        @NotNull
        private Duration operationLogRetention = Duration.ofDays(90);

        @NotNull
        private Duration rotationLogRetention = Duration.ofDays(365);
    }

    @Data
    public static class Scheduling {
        @NotNull
        private Duration rotationCheckInterval = Duration.ofHours(1);

        @NotNull
        private Duration maintenanceInterval = Duration.ofHours(6);

        /** A key whose daily operations exceed this multiple of its average is reported. */
        private double usageSpikeFactor = 3.0;

        /** Fraction of {@code maxOperations} at which a key is reported as nearly exhausted. */
        private double usageLimitWarningRatio = 0.9;
    }
}
