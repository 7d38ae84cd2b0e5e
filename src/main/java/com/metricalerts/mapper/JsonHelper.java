package com.metricalerts.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static utility for JSON serialization used by MapStruct mappers and the alert trigger.
 *
 * <p>Alert context and alert history metadata are structured payloads stored as JSON
 * text columns. This helper converts between those columns and {@code Map<String, Object>}.
 */
public final class JsonHelper {

    private static final Logger log = LoggerFactory.getLogger(JsonHelper.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    static {
        OBJECT_MAPPER.findAndRegisterModules();
    }

    private JsonHelper() {}

    /** Serialize an object to JSON string. Returns null if input is null. */
    public static String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize to JSON: {}", value.getClass().getSimpleName(), e);
            throw new IllegalStateException("JSON serialization failed", e);
        }
    }

    /** Deserialize a JSON object string to a map. Returns null if input is null or empty. */
    public static Map<String, Object> toMap(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return OBJECT_MAPPER.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize JSON object: {}", json, e);
            throw new IllegalStateException("JSON deserialization failed", e);
        }
    }
}
