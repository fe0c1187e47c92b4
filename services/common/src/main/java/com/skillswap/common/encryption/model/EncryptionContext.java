package com.skillswap.common.encryption.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Describes the data being protected. Drives key selection and usage checks.
 *
 * <p>{@code metadata} may carry {@value #IP_ADDRESS} and {@value #ROLE} entries, which are checked
 * against a key's usage restrictions.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EncryptionContext {

    public static final String IP_ADDRESS = "ip_address";
    public static final String ROLE = "role";

    @Builder.Default
    private DataClassification classification = DataClassification.INTERNAL;

    @Builder.Default
    private EncryptionPurpose purpose = EncryptionPurpose.STORAGE;

    private String userId;

    private String organizationId;

    @Builder.Default
    private Set<ComplianceRequirement> complianceRequirements = EnumSet.noneOf(ComplianceRequirement.class);

    private Duration retentionPeriod;

    private String geographicRestriction;

    @Builder.Default
    private Map<String, String> metadata = new HashMap<>();
}
