package com.skillswap.common.encryption.field;

import com.skillswap.common.encryption.model.EncryptionContext;
import com.skillswap.common.encryption.model.HashingOptions;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashSet;
import java.util.Set;

/**
 * Caller overrides for a field encryption pass. {@code context} supplies user, organization,
 * retention and any extra compliance tags; per-field declarations supply classification and
 * purpose.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldEncryptionOptions {

    @Builder.Default
    private Set<String> excludedFields = new HashSet<>();

    private EncryptionContext context;

    private HashingOptions hashingOptions;

    public static FieldEncryptionOptions defaults() {
        return FieldEncryptionOptions.builder().build();
    }
}
