package com.libragraph.sdc.formats.codecs;

import com.libragraph.sdc.formats.api.CodecException;
import com.libragraph.sdc.formats.api.ItemCodec;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Codec for plain text items (.txt, .log, .pgm).
 */
public class TextCodec implements ItemCodec<String> {

    private final Charset charset;

    public TextCodec() {
        this(StandardCharsets.UTF_8);
    }

    public TextCodec(Charset charset) {
        this.charset = charset;
    }

    @Override
    public Class<String> valueType() {
        return String.class;
    }

    @Override
    public byte[] encode(String value) {
        return value.getBytes(charset);
    }

    @Override
    public String decode(byte[] data) {
        try {
            return charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(data))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new CodecException("Text is not valid " + charset.name(), e);
        }
    }
}
