package com.libragraph.sdc.formats.codecs;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.libragraph.sdc.formats.api.CodecException;
import com.libragraph.sdc.formats.api.ItemCodec;
import com.libragraph.sdc.util.ContentHash;

import java.io.IOException;
import java.util.Collection;
import java.util.Map;

/**
 * Codec for JSON items (.json).
 *
 * <p>Decodes to {@link Map}, {@link java.util.List}, {@link String},
 * {@link Number} or {@link Boolean}. Encodes pretty-printed UTF-8 with map
 * keys sorted, so equal values always produce equal bytes.
 */
public class JsonCodec implements ItemCodec<Object> {

    private final ObjectMapper pretty = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private final ObjectMapper compact = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    @Override
    public Class<Object> valueType() {
        return Object.class;
    }

    @Override
    public boolean accepts(Object value) {
        return value instanceof Map
                || value instanceof Collection
                || value instanceof String
                || value instanceof Number
                || value instanceof Boolean;
    }

    @Override
    public byte[] encode(Object value) {
        try {
            return pretty.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new CodecException("Failed to encode JSON", e);
        }
    }

    @Override
    public Object decode(byte[] data) {
        try {
            return pretty.readValue(data, Object.class);
        } catch (IOException e) {
            throw new CodecException("Failed to decode JSON", e);
        }
    }

    /**
     * Digests the compact canonical form, independent of whitespace and key order.
     */
    @Override
    public ContentHash hash(byte[] data) {
        try {
            return ContentHash.of(compact.writeValueAsBytes(decode(data)));
        } catch (JsonProcessingException e) {
            throw new CodecException("Failed to canonicalize JSON", e);
        }
    }
}
