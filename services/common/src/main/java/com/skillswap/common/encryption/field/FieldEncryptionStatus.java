package com.skillswap.common.encryption.field;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class FieldEncryptionStatus {

    private String recordType;
    private int totalSensitiveFields;
    private int encryptedFields;
    private int hashedFields;
    private double coverage;
    private boolean compliant;

    /** Sensitive fields holding plaintext. */
    private List<String> violations;
}
