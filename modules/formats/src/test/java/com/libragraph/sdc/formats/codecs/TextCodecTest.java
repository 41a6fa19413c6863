package com.libragraph.sdc.formats.codecs;

import com.libragraph.sdc.formats.api.CodecException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class TextCodecTest {

    private final TextCodec codec = new TextCodec();

    @Test
    void shouldRoundTripUnicode() {
        String text = "Größe: 5 µm\nline two";

        assertThat(codec.decode(codec.encode(text))).isEqualTo(text);
    }

    @Test
    void shouldRejectInvalidUtf8() {
        byte[] invalid = {(byte) 0xC3, (byte) 0x28};

        assertThatThrownBy(() -> codec.decode(invalid))
                .isInstanceOf(CodecException.class)
                .hasMessageContaining("UTF-8");
    }
}
