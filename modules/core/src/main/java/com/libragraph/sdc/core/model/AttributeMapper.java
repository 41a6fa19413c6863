package com.libragraph.sdc.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Map;

/**
 * Converts attribute records to and from the plain JSON maps stored as
 * {@code content.json} and {@code meta.json}.
 */
public final class AttributeMapper {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .build();

    private AttributeMapper() {
    }

    /**
     * Returns a new mutable map view of an attribute record, timestamps as ISO-8601 strings.
     */
    public static Map<String, Object> toMap(Object attributes) {
        return MAPPER.convertValue(attributes, MAP_TYPE);
    }

    /**
     * Accepts a {@link ContentAttributes} or a JSON map.
     *
     * @throws SchemaViolationException if the value is missing or has the wrong shape
     */
    public static ContentAttributes content(Object value) {
        return convert(value, ContentAttributes.class, "content.json");
    }

    /**
     * Accepts a {@link MetaAttributes} or a JSON map.
     *
     * @throws SchemaViolationException if the value is missing or has the wrong shape
     */
    public static MetaAttributes meta(Object value) {
        return convert(value, MetaAttributes.class, "meta.json");
    }

    private static <T> T convert(Object value, Class<T> type, String entry) {
        if (value == null) {
            throw new SchemaViolationException("Missing required " + entry);
        }
        if (type.isInstance(value)) {
            return type.cast(value);
        }
        if (!(value instanceof Map)) {
            throw new SchemaViolationException(entry + " must be a JSON object, got "
                    + value.getClass().getSimpleName());
        }
        try {
            return MAPPER.convertValue(value, type);
        } catch (IllegalArgumentException e) {
            throw new SchemaViolationException("Malformed " + entry + ": " + e.getMessage(), e);
        }
    }
}
