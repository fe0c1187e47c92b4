package com.skillswap.common.encryption.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Persisted backup: the sealed {@link KeyBackupPayload} plus the SHA-256 of its plaintext form.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class KeyBackupRecord {

    private String backupId;
    private String keyId;
    private String iv;
    private String data;
    private String authTag;
    private String payloadHash;
    private Instant createdAt;
}
