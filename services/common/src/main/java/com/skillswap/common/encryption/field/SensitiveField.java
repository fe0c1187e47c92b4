package com.skillswap.common.encryption.field;

import com.skillswap.common.encryption.model.ComplianceRequirement;
import com.skillswap.common.encryption.model.DataClassification;
import com.skillswap.common.encryption.model.EncryptionPurpose;
import com.skillswap.common.encryption.model.FieldProtection;
import lombok.Builder;
import lombok.Getter;

import java.util.EnumSet;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * One sensitive member of a record type: how to read and write it and how it must be protected.
 */
@Getter
@Builder
public class SensitiveField<T> {

    private final String name;
    private final Function<T, String> getter;
    private final BiConsumer<T, String> setter;

    @Builder.Default
    private final FieldProtection protection = FieldProtection.ENCRYPT;

    @Builder.Default
    private final DataClassification classification = DataClassification.CONFIDENTIAL;

    @Builder.Default
    private final EncryptionPurpose purpose = EncryptionPurpose.STORAGE;

    @Builder.Default
    private final Set<ComplianceRequirement> complianceRequirements = EnumSet.noneOf(ComplianceRequirement.class);

    private final String geographicRestriction;
}
