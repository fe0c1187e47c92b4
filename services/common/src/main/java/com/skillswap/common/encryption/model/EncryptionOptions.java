package com.skillswap.common.encryption.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EncryptionOptions {

    /** Wire tag of the AEAD algorithm. Null selects the configured default. */
    private String algorithm;

    @Builder.Default
    private boolean includeIntegrityCheck = true;

    private boolean compress;
}
