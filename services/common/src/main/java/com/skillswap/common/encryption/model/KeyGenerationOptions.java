package com.skillswap.common.encryption.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Options for creating a key. Null values fall back to configured defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KeyGenerationOptions {

    @Builder.Default
    private int keySize = 256;

    /** Lifetime after which the key expires. Null means the key never expires. */
    private Duration expiresIn;

    private Duration rotationInterval;

    private Boolean autoRotate;

    private KeyUsageRestrictions usageRestrictions;

    @Builder.Default
    private Set<String> geographicRestrictions = new HashSet<>();

    @Builder.Default
    private Set<ComplianceRequirement> complianceRequirements = EnumSet.noneOf(ComplianceRequirement.class);

    @Builder.Default
    private Map<String, String> metadata = new HashMap<>();

    public static KeyGenerationOptions defaults() {
        return KeyGenerationOptions.builder().build();
    }
}
