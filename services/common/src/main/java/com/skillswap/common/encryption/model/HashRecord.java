package com.skillswap.common.encryption.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Stored hash. {@code hash} and {@code salt} are base64. The pepper is never part of the record.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class HashRecord {

    private String hash;
    private String salt;
    private HashingAlgorithm algorithm;
    private HashParameters parameters;
    private Instant createdAt;
}
