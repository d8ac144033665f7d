/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.internal.encoding;

import org.junit.jupiter.api.Test;

import dev.lamina.EncodingNotSupportedException;
import dev.lamina.MalformedEncodingException;
import dev.lamina.metadata.Encoding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for repetition and definition level encoding.
 */
class LevelEncodingTest {

    @Test
    void testRleLevelsRoundTrip() throws Exception {
        int[] levels = { 0, 1, 2, 2, 2, 2, 2, 2, 2, 2, 2, 1, 0, 0, 1 };
        byte[] bytes = LevelEncoder.encode(Encoding.RLE, levels, 0, levels.length, 2);

        assertThat(LevelDecoder.decode(Encoding.RLE, bytes, 0, bytes.length, levels.length, 2))
                .containsExactly(levels);
    }

    @Test
    void testBitPackedLevelsAreMsbFirst() throws Exception {
        int[] levels = { 1, 2, 3 };
        byte[] bytes = LevelEncoder.encode(Encoding.BIT_PACKED, levels, 0, levels.length, 3);

        // 01 10 11 00
        assertThat(bytes).containsExactly((byte) 0x6C);
        assertThat(LevelDecoder.decode(Encoding.BIT_PACKED, bytes, 0, bytes.length, 3, 3)).containsExactly(levels);
    }

    @Test
    void testBitPackedSizeIsExact() {
        int[] levels = new int[17];
        byte[] bytes = LevelEncoder.encode(Encoding.BIT_PACKED, levels, 0, levels.length, 5);

        // 17 levels of 3 bits
        assertThat(bytes).hasSize(7);
    }

    @Test
    void testEncodesSlice() throws Exception {
        int[] levels = { 9, 9, 1, 0, 1, 9 };
        byte[] bytes = LevelEncoder.encode(Encoding.RLE, levels, 2, 3, 1);

        assertThat(LevelDecoder.decode(Encoding.RLE, bytes, 0, bytes.length, 3, 1)).containsExactly(1, 0, 1);
    }

    @Test
    void testZeroMaxLevelStoresNothing() throws Exception {
        assertThat(LevelEncoder.encode(Encoding.RLE, new int[4], 0, 4, 0)).isEmpty();
        assertThat(LevelDecoder.decode(Encoding.RLE, new byte[0], 0, 0, 4, 0)).isNull();
    }

    @Test
    void testTruncatedBitPackedLevelsAreMalformed() {
        byte[] bytes = LevelEncoder.encode(Encoding.BIT_PACKED, new int[16], 0, 16, 1);

        assertThatThrownBy(() -> LevelDecoder.decode(Encoding.BIT_PACKED, bytes, 0, 1, 16, 1))
                .isInstanceOf(MalformedEncodingException.class);
    }

    @Test
    void testUnsupportedLevelEncoding() {
        assertThatThrownBy(() -> LevelDecoder.decode(Encoding.PLAIN, new byte[4], 0, 4, 4, 1))
                .isInstanceOf(EncodingNotSupportedException.class);
    }
}
