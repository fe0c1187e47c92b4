package com.skillswap.common.encryption.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Hashing parameters. A null algorithm selects the configured default.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HashingOptions {

    private HashingAlgorithm algorithm;

    @Builder.Default
    private int saltSize = 32;

    @Builder.Default
    private int hashSize = 32;

    /** Argon2 memory in KiB. */
    @Builder.Default
    private int memoryCost = 65536;

    @Builder.Default
    private int timeCost = 3;

    @Builder.Default
    private int parallelism = 1;

    @Builder.Default
    private int iterations = 100_000;

    /** BCrypt log2 cost. */
    @Builder.Default
    private int cost = 12;

    @Builder.Default
    private boolean usePepper = true;

    public static HashingOptions defaults() {
        return HashingOptions.builder().build();
    }
}
