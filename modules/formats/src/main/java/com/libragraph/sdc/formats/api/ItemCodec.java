package com.libragraph.sdc.formats.api;

import com.libragraph.sdc.util.ContentHash;

/**
 * Bidirectional converter between a typed in-memory item value and its byte stream.
 *
 * <p>Codecs are registered against a file extension in the
 * {@link com.libragraph.sdc.formats.registry.CodecRegistry}, optionally as the
 * default codec for a value type. Implementations must be stateless and
 * thread-safe.
 *
 * @param <T> decoded value type
 */
public interface ItemCodec<T> {

    /**
     * Value type produced by {@link #decode(byte[])}.
     */
    Class<T> valueType();

    /**
     * Encodes a value.
     *
     * @throws CodecException if the value cannot be represented in this format
     */
    byte[] encode(T value);

    /**
     * Decodes a byte stream into a new value instance.
     *
     * @throws CodecException if the bytes are not valid for this format
     */
    T decode(byte[] data);

    /**
     * Digest of encoded data. Codecs override this so that semantically
     * equivalent encodings produce the same digest.
     */
    default ContentHash hash(byte[] data) {
        return ContentHash.of(data);
    }

    /**
     * Whether {@link #encode} can handle the value.
     */
    default boolean accepts(Object value) {
        return valueType().isInstance(value);
    }
}
