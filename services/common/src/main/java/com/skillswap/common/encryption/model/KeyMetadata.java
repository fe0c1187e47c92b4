package com.skillswap.common.encryption.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Public projection of a key record. Carries identity and lifecycle facts, never material.
 */
@Value
@Builder
public class KeyMetadata {

    String id;
    KeyType keyType;
    KeyPurpose purpose;
    int keySize;
    KeyStatus status;
    Instant statusChangedAt;
    int version;
    String parentKeyId;
    Instant createdAt;
    Instant expiresAt;
    KeyUsageRestrictions usageRestrictions;
    Set<String> geographicRestrictions;
    Set<ComplianceRequirement> complianceRequirements;
    Map<String, String> metadata;
    KeyRotationSchedule rotationSchedule;
    KeyBackupInfo backupInfo;
}
