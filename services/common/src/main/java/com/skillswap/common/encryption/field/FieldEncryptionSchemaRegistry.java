package com.skillswap.common.encryption.field;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registered field schemas, built once at startup. Lookups walk the superclass chain so a subtype
 * inherits its parent's schema; resolved lookups are cached per class.
 */
@Slf4j
public class FieldEncryptionSchemaRegistry {

    private final Map<Class<?>, FieldEncryptionSchema<?>> schemas = new HashMap<>();
    private final Map<Class<?>, Optional<FieldEncryptionSchema<?>>> resolved = new ConcurrentHashMap<>();

    public FieldEncryptionSchemaRegistry(Collection<? extends FieldEncryptionSchema<?>> schemas) {
        for (FieldEncryptionSchema<?> schema : schemas) {
            if (this.schemas.putIfAbsent(schema.getType(), schema) != null) {
                throw new IllegalStateException("Duplicate field encryption schema for " + schema.getType().getName());
            }
            log.info("Registered field encryption schema for {} ({} sensitive fields)",
                schema.getType().getSimpleName(), schema.getFields().size());
        }
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<FieldEncryptionSchema<T>> find(Class<T> type) {
        Optional<FieldEncryptionSchema<?>> schema = resolved.computeIfAbsent(type, this::resolve);
        return schema.map(s -> (FieldEncryptionSchema<T>) s);
    }

    /**
     * @throws IllegalArgumentException when no schema is registered for the type or its superclasses
     */
    public <T> FieldEncryptionSchema<T> require(Class<T> type) {
        return find(type).orElseThrow(() ->
            new IllegalArgumentException("No field encryption schema registered for " + type.getName()));
    }

    private Optional<FieldEncryptionSchema<?>> resolve(Class<?> type) {
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            FieldEncryptionSchema<?> schema = schemas.get(current);
            if (schema != null) {
                return Optional.of(schema);
            }
        }
        return Optional.empty();
    }
}
