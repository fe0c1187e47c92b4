package com.skillswap.common.encryption.field;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.skillswap.common.encryption.DataEncryptionService;
import com.skillswap.common.encryption.EnvelopeCodec;
import com.skillswap.common.encryption.exception.EncryptionErrorCode;
import com.skillswap.common.encryption.model.ComplianceRequirement;
import com.skillswap.common.encryption.model.DecryptionResult;
import com.skillswap.common.encryption.model.EncryptionContext;
import com.skillswap.common.encryption.model.EncryptionResult;
import com.skillswap.common.encryption.model.FieldProtection;
import com.skillswap.common.encryption.model.HashRecord;
import com.skillswap.common.encryption.model.HashResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Field-level encryption over records described by a registered {@link FieldEncryptionSchema}.
 *
 * Features:
 * - encrypts or hashes each declared sensitive field in place
 * - leaves values that are already envelopes or hash records untouched
 * - single-field encryption inside JSON documents ({@code field} or {@code parent.field})
 * - compliance coverage reporting per record
 *
 * Individual field failures are reported, not thrown, and earlier fields are not rolled back.
 */
@Service
@Slf4j
public class FieldLevelEncryptionService {

    private final DataEncryptionService dataEncryptionService;
    private final FieldEncryptionSchemaRegistry schemaRegistry;
    private final EnvelopeCodec envelopeCodec;
    private final ObjectMapper objectMapper;

    // Metrics
    private final Counter fieldEncryptionCounter;
    private final Counter fieldDecryptionCounter;
    private final Counter fieldErrorCounter;

    public FieldLevelEncryptionService(DataEncryptionService dataEncryptionService,
                                       FieldEncryptionSchemaRegistry schemaRegistry,
                                       EnvelopeCodec envelopeCodec,
                                       ObjectMapper objectMapper,
                                       MeterRegistry meterRegistry) {
        this.dataEncryptionService = dataEncryptionService;
        this.schemaRegistry = schemaRegistry;
        this.envelopeCodec = envelopeCodec;
        this.objectMapper = objectMapper;

        this.fieldEncryptionCounter = Counter.builder("field_encryption_operations")
            .description("Number of field encryption operations")
            .tag("operation", "encrypt")
            .register(meterRegistry);
        this.fieldDecryptionCounter = Counter.builder("field_encryption_operations")
            .description("Number of field decryption operations")
            .tag("operation", "decrypt")
            .register(meterRegistry);
        this.fieldErrorCounter = Counter.builder("field_encryption_errors")
            .description("Number of field encryption errors")
            .register(meterRegistry);
    }

    /**
     * Encrypts or hashes every eligible sensitive field of the record in place.
     *
     * @throws IllegalArgumentException if no schema is registered for the record's type
     */
    public <T> FieldEncryptionReport encryptFields(T record, FieldEncryptionOptions options) {
        Objects.requireNonNull(record, "record");
        FieldEncryptionSchema<T> schema = schemaFor(record);
        FieldEncryptionOptions opts = options != null ? options : FieldEncryptionOptions.defaults();
        FieldEncryptionReport report = FieldEncryptionReport.builder().recordType(schema.getType().getSimpleName()).build();

        for (SensitiveField<T> field : schema.getFields()) {
            String name = field.getName();
            String value = field.getGetter().apply(record);
            if ((opts.getExcludedFields() != null && opts.getExcludedFields().contains(name))
                    || !StringUtils.hasText(value)) {
                report.getSkippedFields().add(name);
                continue;
            }
            try {
                if (field.getProtection() == FieldProtection.HASH) {
                    if (isHashRecord(value)) {
                        report.getSkippedFields().add(name);
                        continue;
                    }
                    HashResult hashed = dataEncryptionService.hash(value, opts.getHashingOptions());
                    if (!hashed.isSuccess()) {
                        fail(report, name, hashed.getErrorCode());
                        continue;
                    }
                    field.getSetter().accept(record, objectMapper.writeValueAsString(hashed.getRecord()));
                } else {
                    if (envelopeCodec.isEnvelope(value)) {
                        report.getSkippedFields().add(name);
                        continue;
                    }
                    EncryptionResult encrypted = dataEncryptionService.encrypt(value, contextFor(field, opts.getContext()));
                    if (!encrypted.isSuccess()) {
                        fail(report, name, encrypted.getErrorCode());
                        continue;
                    }
                    field.getSetter().accept(record, encrypted.getEnvelope());
                }
                report.getProcessedFields().add(name);
                fieldEncryptionCounter.increment();
            } catch (Exception e) {
                log.error("Failed to protect field {} of {}", name, report.getRecordType(), e);
                fail(report, name, EncryptionErrorCode.OPERATION_FAILED);
            }
        }

        if (report.isPartial()) {
            log.warn("Partially encrypted {}: {} fields processed, failures {}",
                report.getRecordType(), report.getProcessedFields().size(), report.getFailedFields());
        }
        return report;
    }

    public <T> FieldEncryptionReport encryptFields(T record) {
        return encryptFields(record, FieldEncryptionOptions.defaults());
    }

    /**
     * Decrypts every encrypted field that holds a recognizable envelope. Plain values and hashed
     * fields are left as they are.
     */
    public <T> FieldEncryptionReport decryptFields(T record, EncryptionContext context) {
        Objects.requireNonNull(record, "record");
        FieldEncryptionSchema<T> schema = schemaFor(record);
        FieldEncryptionReport report = FieldEncryptionReport.builder().recordType(schema.getType().getSimpleName()).build();

        for (SensitiveField<T> field : schema.getFields()) {
            String name = field.getName();
            String value = field.getGetter().apply(record);
            if (field.getProtection() != FieldProtection.ENCRYPT || !envelopeCodec.isEnvelope(value)) {
                report.getSkippedFields().add(name);
                continue;
            }
            try {
                DecryptionResult decrypted = dataEncryptionService.decrypt(value, contextFor(field, context));
                if (!decrypted.isSuccess()) {
                    fail(report, name, decrypted.getErrorCode());
                    continue;
                }
                if (!decrypted.isIntegrityVerified()) {
                    log.warn("Integrity check failed for field {} of {}", name, report.getRecordType());
                }
                field.getSetter().accept(record, decrypted.getDataAsString());
                report.getProcessedFields().add(name);
                fieldDecryptionCounter.increment();
            } catch (Exception e) {
                log.error("Failed to decrypt field {} of {}", name, report.getRecordType(), e);
                fail(report, name, EncryptionErrorCode.OPERATION_FAILED);
            }
        }
        return report;
    }

    public <T> FieldEncryptionReport decryptFields(T record) {
        return decryptFields(record, null);
    }

    /**
     * Checks a candidate value against a hashed field.
     */
    public <T> boolean verifyHashedField(T record, String fieldName, String candidate) {
        FieldEncryptionSchema<T> schema = schemaFor(record);
        SensitiveField<T> field = schema.getFields().stream()
            .filter(f -> f.getName().equals(fieldName) && f.getProtection() == FieldProtection.HASH)
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("No hashed field " + fieldName + " on " + schema.getType().getName()));
        String stored = field.getGetter().apply(record);
        if (!isHashRecord(stored)) {
            return false;
        }
        try {
            return dataEncryptionService.verifyHash(candidate, objectMapper.readValue(stored, HashRecord.class));
        } catch (Exception e) {
            log.error("Stored hash for field {} is unreadable", fieldName, e);
            return false;
        }
    }

    public JsonFieldEncryptionResult encryptJsonField(ObjectNode document, String fieldPath, EncryptionContext context) {
        FieldTarget target = resolve(document, fieldPath);
        if (target == null) {
            return JsonFieldEncryptionResult.failure(fieldPath, EncryptionErrorCode.INVALID_INPUT, "Field not found: " + fieldPath);
        }
        JsonNode node = target.parent().get(target.field());
        if (!node.isValueNode()) {
            return JsonFieldEncryptionResult.failure(fieldPath, EncryptionErrorCode.INVALID_INPUT,
                "Only scalar fields can be encrypted: " + fieldPath);
        }
        String value = node.asText();
        if (envelopeCodec.isEnvelope(value)) {
            return JsonFieldEncryptionResult.builder().success(true).skipped(true).fieldPath(fieldPath).build();
        }
        EncryptionResult encrypted = dataEncryptionService.encrypt(value, context);
        if (!encrypted.isSuccess()) {
            fieldErrorCounter.increment();
            return JsonFieldEncryptionResult.failure(fieldPath, encrypted.getErrorCode(), encrypted.getErrorMessage());
        }
        target.parent().put(target.field(), encrypted.getEnvelope());
        fieldEncryptionCounter.increment();
        return JsonFieldEncryptionResult.builder()
            .success(true)
            .fieldPath(fieldPath)
            .keyId(encrypted.getKeyId())
            .build();
    }

    public JsonFieldEncryptionResult decryptJsonField(ObjectNode document, String fieldPath, EncryptionContext context) {
        FieldTarget target = resolve(document, fieldPath);
        if (target == null) {
            return JsonFieldEncryptionResult.failure(fieldPath, EncryptionErrorCode.INVALID_INPUT, "Field not found: " + fieldPath);
        }
        String value = target.parent().get(target.field()).asText();
        if (!envelopeCodec.isEnvelope(value)) {
            return JsonFieldEncryptionResult.builder().success(true).skipped(true).fieldPath(fieldPath).build();
        }
        DecryptionResult decrypted = dataEncryptionService.decrypt(value, context);
        if (!decrypted.isSuccess()) {
            fieldErrorCounter.increment();
            return JsonFieldEncryptionResult.failure(fieldPath, decrypted.getErrorCode(), decrypted.getErrorMessage());
        }
        target.parent().put(target.field(), decrypted.getDataAsString());
        fieldDecryptionCounter.increment();
        return JsonFieldEncryptionResult.builder()
            .success(true)
            .fieldPath(fieldPath)
            .keyId(decrypted.getKeyId())
            .build();
    }

    /**
     * Reports how many sensitive fields are protected. Any sensitive field holding plaintext is a
     * violation; empty fields are neither covered nor violations.
     */
    public <T> FieldEncryptionStatus getFieldEncryptionStatus(T record) {
        Objects.requireNonNull(record, "record");
        FieldEncryptionSchema<T> schema = schemaFor(record);
        int encrypted = 0;
        int hashed = 0;
        List<String> violations = new ArrayList<>();

        for (SensitiveField<T> field : schema.getFields()) {
            String value = field.getGetter().apply(record);
            if (field.getProtection() == FieldProtection.ENCRYPT && envelopeCodec.isEnvelope(value)) {
                encrypted++;
            } else if (field.getProtection() == FieldProtection.HASH && isHashRecord(value)) {
                hashed++;
            } else if (StringUtils.hasText(value)) {
                violations.add(field.getName());
            }
        }

        int total = schema.getFields().size();
        double coverage = total == 0 ? 100.0 : (encrypted + hashed) * 100.0 / total;
        return FieldEncryptionStatus.builder()
            .recordType(schema.getType().getSimpleName())
            .totalSensitiveFields(total)
            .encryptedFields(encrypted)
            .hashedFields(hashed)
            .coverage(coverage)
            .compliant(violations.isEmpty())
            .violations(violations)
            .build();
    }

    @SuppressWarnings("unchecked")
    private <T> FieldEncryptionSchema<T> schemaFor(T record) {
        return schemaRegistry.require((Class<T>) record.getClass());
    }

    private static <T> EncryptionContext contextFor(SensitiveField<T> field, EncryptionContext callerContext) {
        EncryptionContext.EncryptionContextBuilder builder = callerContext != null
            ? callerContext.toBuilder() : EncryptionContext.builder();

        Set<ComplianceRequirement> compliance = EnumSet.noneOf(ComplianceRequirement.class);
        compliance.addAll(field.getComplianceRequirements());
        if (callerContext != null && callerContext.getComplianceRequirements() != null) {
            compliance.addAll(callerContext.getComplianceRequirements());
        }
        builder.classification(field.getClassification())
            .purpose(field.getPurpose())
            .complianceRequirements(compliance)
            .metadata(callerContext != null && callerContext.getMetadata() != null
                ? new HashMap<>(callerContext.getMetadata()) : new HashMap<>());
        if (field.getGeographicRestriction() != null) {
            builder.geographicRestriction(field.getGeographicRestriction());
        }
        return builder.build();
    }

    private boolean isHashRecord(String value) {
        if (!StringUtils.hasText(value) || !value.trim().startsWith("{")) {
            return false;
        }
        try {
            JsonNode node = objectMapper.readTree(value);
            return node.isObject() && node.hasNonNull("hash") && node.hasNonNull("salt") && node.hasNonNull("algorithm");
        } catch (Exception e) {
            log.trace("Value is not a hash record: {}", e.getMessage());
            return false;
        }
    }

    private void fail(FieldEncryptionReport report, String field, EncryptionErrorCode errorCode) {
        log.warn("Field {} of {} failed: {}", field, report.getRecordType(), errorCode);
        report.getFailedFields().put(field, errorCode != null ? errorCode.name() : EncryptionErrorCode.OPERATION_FAILED.name());
        fieldErrorCounter.increment();
    }

    private static FieldTarget resolve(ObjectNode document, String fieldPath) {
        if (document == null || !StringUtils.hasText(fieldPath)) {
            return null;
        }
        String[] segments = fieldPath.split("\\.");
        ObjectNode parent = document;
        if (segments.length == 2) {
            JsonNode nested = document.get(segments[0]);
            if (!(nested instanceof ObjectNode)) {
                return null;
            }
            parent = (ObjectNode) nested;
        } else if (segments.length != 1) {
            return null;
        }
        String field = segments[segments.length - 1];
        JsonNode node = parent.get(field);
        return node == null || node.isNull() ? null : new FieldTarget(parent, field);
    }

    private record FieldTarget(ObjectNode parent, String field) {
    }
}
