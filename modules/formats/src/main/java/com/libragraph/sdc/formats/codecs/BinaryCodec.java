package com.libragraph.sdc.formats.codecs;

import com.libragraph.sdc.formats.api.ItemCodec;

import java.util.Arrays;

/**
 * Codec for raw binary items (.bin). Copies on both directions so callers
 * never share a buffer with the container.
 */
public class BinaryCodec implements ItemCodec<byte[]> {

    @Override
    public Class<byte[]> valueType() {
        return byte[].class;
    }

    @Override
    public byte[] encode(byte[] value) {
        return Arrays.copyOf(value, value.length);
    }

    @Override
    public byte[] decode(byte[] data) {
        return Arrays.copyOf(data, data.length);
    }
}
