package com.skillswap.common.encryption.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class KeyManagementAuditEvent {

    private Instant timestamp;
    private String operation;
    private String keyId;
    private String relatedKeyId;
    private KeyPurpose purpose;
    private Integer version;
    private Map<String, String> details;
}
