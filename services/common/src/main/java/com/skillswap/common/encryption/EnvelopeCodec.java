package com.skillswap.common.encryption;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillswap.common.encryption.exception.EncryptionException;
import com.skillswap.common.encryption.model.EncryptedEnvelope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Envelope wire format: base64 of compact JSON.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EnvelopeCodec {

    private final ObjectMapper objectMapper;

    public String encode(EncryptedEnvelope envelope) {
        try {
            return Base64.getEncoder().encodeToString(objectMapper.writeValueAsBytes(envelope));
        } catch (Exception e) {
            throw EncryptionException.invalidEnvelope("Failed to encode envelope", e);
        }
    }

    /**
     * @throws EncryptionException with {@code INVALID_ENVELOPE} when the value is not base64 JSON
     *         carrying a key id, algorithm and data
     */
    public EncryptedEnvelope decode(String encoded) {
        if (!StringUtils.hasText(encoded)) {
            throw EncryptionException.invalidEnvelope("Envelope is empty", null);
        }
        EncryptedEnvelope envelope;
        try {
            byte[] json = Base64.getDecoder().decode(encoded.trim());
            envelope = objectMapper.readValue(json, EncryptedEnvelope.class);
        } catch (Exception e) {
            throw EncryptionException.invalidEnvelope("Envelope cannot be parsed", e);
        }
        if (!StringUtils.hasText(envelope.getKeyId()) || !StringUtils.hasText(envelope.getAlgorithm())
                || envelope.getData() == null) {
            throw EncryptionException.invalidEnvelope("Envelope is missing keyId, algorithm or data", null);
        }
        return envelope;
    }

    /**
     * True when the value decodes to an envelope with key id, algorithm and data fields.
     */
    public boolean isEnvelope(String value) {
        if (!StringUtils.hasText(value)) {
            return false;
        }
        try {
            byte[] json = Base64.getDecoder().decode(value.trim());
            JsonNode node = objectMapper.readTree(new String(json, StandardCharsets.UTF_8));
            return node != null && node.isObject()
                && node.hasNonNull("keyId") && node.hasNonNull("algorithm") && node.hasNonNull("data");
        } catch (Exception e) {
            log.trace("Value is not an envelope: {}", e.getMessage());
            return false;
        }
    }
}
