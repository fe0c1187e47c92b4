package com.skillswap.common.encryption.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Key record owned by the key management service.
 *
 * <p>{@code keyMaterial} is never serialized; the persisted form carries {@code wrappedKeyMaterial}
 * instead, sealed under the master key.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class EncryptionKey {

    private String id;

    private KeyType keyType;

    private KeyPurpose purpose;

    @JsonIgnore
    @ToString.Exclude
    private byte[] keyMaterial;

    @ToString.Exclude
    private String wrappedKeyMaterial;

    private int keySize;

    private KeyStatus status;

    private Instant statusChangedAt;

    @Builder.Default
    private int version = 1;

    private String parentKeyId;

    private Instant createdAt;

    private Instant expiresAt;

    @Builder.Default
    private KeyUsageRestrictions usageRestrictions = new KeyUsageRestrictions();

    @Builder.Default
    private Set<String> geographicRestrictions = new HashSet<>();

    @Builder.Default
    private Set<ComplianceRequirement> complianceRequirements = EnumSet.noneOf(ComplianceRequirement.class);

    @Builder.Default
    private Map<String, String> metadata = new HashMap<>();

    @Builder.Default
    private KeyUsageStatistics usageStatistics = new KeyUsageStatistics();

    private KeyRotationSchedule rotationSchedule;

    private KeyBackupInfo backupInfo;

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    public boolean isUsableForEncryptionAt(Instant now) {
        return status == KeyStatus.ACTIVE && !isExpiredAt(now);
    }

    public boolean isUsableForDecryptionAt(Instant now) {
        if (status == KeyStatus.ACTIVE) {
            return !isExpiredAt(now);
        }
        return status != null && status.isDecryptCapable();
    }

    /**
     * True once the key has expired, outlived its maximum age, or (when auto-rotation is on)
     * reached its scheduled rotation time.
     */
    public boolean isDueForRotationAt(Instant now) {
        if (isExpiredAt(now)) {
            return true;
        }
        if (rotationSchedule == null) {
            return false;
        }
        if (rotationSchedule.isAutoRotate() && rotationSchedule.getNextRotation() != null
                && !rotationSchedule.getNextRotation().isAfter(now)) {
            return true;
        }
        Duration maxAge = rotationSchedule.getMaxKeyAge();
        return maxAge != null && createdAt != null && createdAt.plus(maxAge).isBefore(now);
    }

    public void changeStatus(KeyStatus newStatus, Instant now) {
        this.status = newStatus;
        this.statusChangedAt = now;
    }

    public KeyMetadata toMetadata() {
        return KeyMetadata.builder()
            .id(id)
            .keyType(keyType)
            .purpose(purpose)
            .keySize(keySize)
            .status(status)
            .statusChangedAt(statusChangedAt)
            .version(version)
            .parentKeyId(parentKeyId)
            .createdAt(createdAt)
            .expiresAt(expiresAt)
            .usageRestrictions(usageRestrictions == null ? null : usageRestrictions.copy())
            .geographicRestrictions(geographicRestrictions == null ? Set.of() : Set.copyOf(geographicRestrictions))
            .complianceRequirements(complianceRequirements == null ? Set.of() : Set.copyOf(complianceRequirements))
            .metadata(metadata == null ? Map.of() : Map.copyOf(metadata))
            .rotationSchedule(rotationSchedule == null ? null : rotationSchedule.copy())
            .backupInfo(backupInfo == null ? null : backupInfo.copy())
            .build();
    }
}
