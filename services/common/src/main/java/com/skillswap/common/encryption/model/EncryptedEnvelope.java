package com.skillswap.common.encryption.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Self-describing ciphertext record. Binary fields are base64 encoded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class EncryptedEnvelope {

    public static final String CURRENT_VERSION = "1.0";
    public static final String META_COMPRESSED = "compressed";
    public static final String META_KEY_VERSION = "keyVersion";

    @Builder.Default
    private String version = CURRENT_VERSION;

    private String keyId;

    private String algorithm;

    private String iv;

    private String authTag;

    private String data;

    private Instant timestamp;

    private String integrityHash;

    @Builder.Default
    private Map<String, String> metadata = new HashMap<>();

    @JsonIgnore
    public boolean isCompressed() {
        return metadata != null && Boolean.parseBoolean(metadata.get(META_COMPRESSED));
    }
}
