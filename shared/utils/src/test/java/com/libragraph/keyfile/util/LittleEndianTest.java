package com.libragraph.keyfile.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class LittleEndianTest {

    @Test
    void shouldReadLowByteFirst() {
        byte[] data = {0x03, (byte) 0xD9, (byte) 0xA2, (byte) 0x9A};

        assertThat(LittleEndian.readUInt32(data, 0)).isEqualTo(0x9AA2D903L);
    }

    @Test
    void shouldReadAtOffsetWithoutSignExtension() {
        byte[] data = {0, 0, 0, 0, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF};

        assertThat(LittleEndian.readUInt32(data, 4)).isEqualTo(0xFFFFFFFFL);
    }

    @Test
    void shouldRejectShortInput() {
        assertThatThrownBy(() -> LittleEndian.readUInt32(new byte[6], 4))
                .isInstanceOf(IndexOutOfBoundsException.class);
    }
}
