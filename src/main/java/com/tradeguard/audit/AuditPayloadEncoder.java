package com.tradeguard.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tradeguard.domain.enums.AuditEventType;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Canonical JSON for audit payloads. The same logical content always encodes to the same
 * bytes: properties and map keys sorted, decimals written plain, instants as ISO-8601 text.
 * Hashes are computed over this text, so changing the encoding breaks existing chains.
 */
@Component
public class AuditPayloadEncoder {

    private static final JsonMapper CANONICAL = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    /** Encodes the {type, recordedAt, body} envelope. */
    public String encode(AuditEventType type, Instant recordedAt, Object body) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("type", type.name());
        envelope.put("recordedAt", recordedAt);
        envelope.put("body", body);
        try {
            return CANONICAL.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Audit body of type " + type + " is not serializable", e);
        }
    }

    /** Reads the body of an encoded payload back as {@code bodyType}. */
    public <T> T decodeBody(String payload, Class<T> bodyType) {
        try {
            JsonNode body = CANONICAL.readTree(payload).get("body");
            return CANONICAL.treeToValue(body, bodyType);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Audit payload cannot be decoded as " + bodyType.getSimpleName(), e);
        }
    }
}
