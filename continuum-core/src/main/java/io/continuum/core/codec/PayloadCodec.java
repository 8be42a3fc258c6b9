package io.continuum.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.continuum.core.error.ValidationException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON codec for the opaque {@code value} and {@code metadata} payloads.
 *
 * <p>Stores persist the encoded text as-is and never look inside it. Only the caller that wrote a payload
 * decodes it, using the {@value #SCHEMA_VERSION_KEY} tag it placed in the metadata to pick a shape.</p>
 */
public final class PayloadCodec {
    private static final Logger LOG = LoggerFactory.getLogger(PayloadCodec.class);
    public static final String SCHEMA_VERSION_KEY = "schemaVersion";
    public static final int CURRENT_SCHEMA_VERSION = 1;

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public PayloadCodec() {
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Strings pass through untouched; anything else is written as JSON.
     */
    public String encode(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String text) {
            return text;
        }
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ValidationException("value is not serializable: " + e.getOriginalMessage());
        }
    }

    public <T> T decode(String payload, Class<T> type) {
        try {
            return mapper.readValue(payload, type);
        } catch (JsonProcessingException e) {
            throw new ValidationException("payload does not decode as " + type.getSimpleName() + ": " + e.getOriginalMessage());
        }
    }

    public Map<String, Object> decodeMap(String payload) {
        try {
            return mapper.readValue(payload, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new ValidationException("payload is not a JSON object: " + e.getOriginalMessage());
        }
    }

    /**
     * Copies the metadata and stamps the current schema version unless the caller already set one.
     */
    public Map<String, Object> tag(Map<String, Object> metadata) {
        Map<String, Object> tagged = new LinkedHashMap<>();
        if (metadata != null) {
            tagged.putAll(metadata);
        }
        tagged.putIfAbsent(SCHEMA_VERSION_KEY, CURRENT_SCHEMA_VERSION);
        return tagged;
    }

    public String writeMetadata(Map<String, Object> metadata) {
        try {
            return mapper.writeValueAsString(metadata == null ? Map.of() : metadata);
        } catch (JsonProcessingException e) {
            throw new ValidationException("metadata is not serializable: " + e.getOriginalMessage());
        }
    }

    public Map<String, Object> readMetadata(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return mapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            LOG.warn("Ignoring unreadable metadata: {}", e.getOriginalMessage());
            return Map.of();
        }
    }
}
