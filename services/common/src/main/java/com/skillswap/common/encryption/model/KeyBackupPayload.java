package com.skillswap.common.encryption.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class KeyBackupPayload {

    private String keyId;
    private KeyType keyType;
    private KeyPurpose purpose;
    private int keySize;
    private int version;
    private Instant createdAt;
    private Instant expiresAt;

    @ToString.Exclude
    private String keyMaterial;

    private KeyUsageRestrictions usageRestrictions;

    @Builder.Default
    private Set<String> geographicRestrictions = new HashSet<>();

    @Builder.Default
    private Set<ComplianceRequirement> complianceRequirements = new HashSet<>();

    @Builder.Default
    private Map<String, String> metadata = new HashMap<>();
}
