package com.skillswap.common.encryption.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Audit entry for a single encrypt, decrypt or re-encrypt call. Never carries data or key bytes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EncryptionAuditEvent {

    private Instant timestamp;
    private String operation;
    private String keyId;
    private String algorithm;
    private long dataSize;
    private boolean success;
    private String errorCode;
    private String userId;
    private String organizationId;
    private DataClassification classification;
    private Boolean integrityVerified;
}
