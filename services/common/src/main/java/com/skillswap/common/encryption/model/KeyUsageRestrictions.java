package com.skillswap.common.encryption.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Limits on how a key may be used. Empty collections and null limits mean unrestricted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KeyUsageRestrictions {

    private Long maxOperations;

    private Long maxDataBytes;

    @Builder.Default
    private Set<String> allowedUserIds = new HashSet<>();

    /** CIDR notation, e.g. {@code 10.0.0.0/8}. A bare address matches only itself. */
    @Builder.Default
    private List<String> allowedIpRanges = new ArrayList<>();

    @Builder.Default
    private Set<String> allowedRoles = new HashSet<>();

    @Builder.Default
    private List<TimeWindowRestriction> timeWindows = new ArrayList<>();

    public KeyUsageRestrictions copy() {
        return KeyUsageRestrictions.builder()
            .maxOperations(maxOperations)
            .maxDataBytes(maxDataBytes)
            .allowedUserIds(allowedUserIds == null ? new HashSet<>() : new HashSet<>(allowedUserIds))
            .allowedIpRanges(allowedIpRanges == null ? new ArrayList<>() : new ArrayList<>(allowedIpRanges))
            .allowedRoles(allowedRoles == null ? new HashSet<>() : new HashSet<>(allowedRoles))
            .timeWindows(timeWindows == null ? new ArrayList<>() : new ArrayList<>(timeWindows))
            .build();
    }
}
