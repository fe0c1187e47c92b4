package com.skillswap.common.encryption.field;

import com.skillswap.common.encryption.model.ComplianceRequirement;
import com.skillswap.common.encryption.model.DataClassification;
import com.skillswap.common.encryption.model.EncryptionPurpose;
import com.skillswap.common.encryption.model.FieldProtection;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Declares the sensitive members of a record type. Register one as a bean per type:
 *
 * <pre>{@code
 * @Bean
 * FieldEncryptionSchema<UserProfile> userProfileSchema() {
 *     return FieldEncryptionSchema.forType(UserProfile.class)
 *         .encrypted("email", UserProfile::getEmail, UserProfile::setEmail,
 *             DataClassification.CONFIDENTIAL, ComplianceRequirement.GDPR)
 *         .hashed("nationalId", UserProfile::getNationalId, UserProfile::setNationalId)
 *         .build();
 * }
 * }</pre>
 */
public final class FieldEncryptionSchema<T> {

    private final Class<T> type;
    private final List<SensitiveField<T>> fields;

    private FieldEncryptionSchema(Class<T> type, List<SensitiveField<T>> fields) {
        this.type = type;
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    }

    public static <T> Builder<T> forType(Class<T> type) {
        return new Builder<>(type);
    }

    public Class<T> getType() {
        return type;
    }

    public List<SensitiveField<T>> getFields() {
        return fields;
    }

    public static final class Builder<T> {
        private final Class<T> type;
        private final List<SensitiveField<T>> fields = new ArrayList<>();

        private Builder(Class<T> type) {
            this.type = Objects.requireNonNull(type, "type");
        }

        public Builder<T> encrypted(String name, Function<T, String> getter, BiConsumer<T, String> setter,
                                    DataClassification classification, ComplianceRequirement... compliance) {
            return field(SensitiveField.<T>builder()
                .name(name)
                .getter(getter)
                .setter(setter)
                .protection(FieldProtection.ENCRYPT)
                .classification(classification)
                .complianceRequirements(toSet(compliance))
                .build());
        }

        public Builder<T> hashed(String name, Function<T, String> getter, BiConsumer<T, String> setter,
                                 ComplianceRequirement... compliance) {
            return field(SensitiveField.<T>builder()
                .name(name)
                .getter(getter)
                .setter(setter)
                .protection(FieldProtection.HASH)
                .classification(DataClassification.RESTRICTED)
                .purpose(EncryptionPurpose.STORAGE)
                .complianceRequirements(toSet(compliance))
                .build());
        }

        public Builder<T> field(SensitiveField<T> field) {
            Objects.requireNonNull(field.getName(), "field name");
            Objects.requireNonNull(field.getGetter(), "getter for " + field.getName());
            Objects.requireNonNull(field.getSetter(), "setter for " + field.getName());
            if (fields.stream().anyMatch(f -> f.getName().equals(field.getName()))) {
                throw new IllegalArgumentException("Field " + field.getName() + " declared twice for " + type.getName());
            }
            fields.add(field);
            return this;
        }

        public FieldEncryptionSchema<T> build() {
            return new FieldEncryptionSchema<>(type, fields);
        }

        private static EnumSet<ComplianceRequirement> toSet(ComplianceRequirement... compliance) {
            EnumSet<ComplianceRequirement> set = EnumSet.noneOf(ComplianceRequirement.class);
            if (compliance != null) {
                set.addAll(Arrays.asList(compliance));
            }
            return set;
        }
    }
}
