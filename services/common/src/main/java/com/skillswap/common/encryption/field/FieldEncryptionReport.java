package com.skillswap.common.encryption.field;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-field outcome of an encrypt or decrypt pass. Fields processed before a failure are not rolled
 * back, so a report can be partially successful.
 */
@Data
@Builder
public class FieldEncryptionReport {

    private String recordType;

    @Builder.Default
    private List<String> processedFields = new ArrayList<>();

    @Builder.Default
    private List<String> skippedFields = new ArrayList<>();

    /** Field name to error code. */
    @Builder.Default
    private Map<String, String> failedFields = new LinkedHashMap<>();

    public boolean isSuccess() {
        return failedFields.isEmpty();
    }

    public boolean isPartial() {
        return !failedFields.isEmpty() && !processedFields.isEmpty();
    }
}
