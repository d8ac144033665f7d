/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.internal.encoding;

import java.io.ByteArrayInputStream;
import java.util.Arrays;
import java.util.Random;

import org.apache.parquet.bytes.HeapByteBufferAllocator;
import org.apache.parquet.column.values.rle.RunLengthBitPackingHybridDecoder;
import org.apache.parquet.column.values.rle.RunLengthBitPackingHybridEncoder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import dev.lamina.MalformedEncodingException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the RLE / bit-packing hybrid encoder and decoder.
 */
class RleBitPackingHybridTest {

    @Test
    void testRepeatedValueBecomesSingleRleRun() throws Exception {
        RleBitPackingHybridEncoder encoder = new RleBitPackingHybridEncoder(3);
        for (int i = 0; i < 100; i++) {
            encoder.writeInt(5);
        }
        byte[] bytes = encoder.toBytes();

        // varint header (100 << 1) followed by one value byte
        assertThat(bytes).containsExactly((byte) 0xC8, (byte) 0x01, (byte) 0x05);

        int[] decoded = new int[100];
        new RleBitPackingHybridDecoder(bytes, 3).readInts(decoded, 0, 100);
        assertThat(decoded).containsOnly(5);
    }

    @Test
    void testShortSequenceIsBitPacked() throws Exception {
        RleBitPackingHybridEncoder encoder = new RleBitPackingHybridEncoder(3);
        for (int value : new int[]{ 0, 1, 2, 3, 4, 5, 6, 7 }) {
            encoder.writeInt(value);
        }
        byte[] bytes = encoder.toBytes();

        // one group of 8 values: header (1 << 1) | 1, then 3 bytes of LSB-first packed data
        assertThat(bytes).containsExactly((byte) 0x03, (byte) 0x88, (byte) 0xC6, (byte) 0xFA);
    }

    @ParameterizedTest
    @ValueSource(ints = { 1, 2, 3, 7, 8, 13, 16, 20, 31, 32 })
    void testRoundTripMixedRuns(int bitWidth) throws Exception {
        int[] values = mixedValues(bitWidth, 5_000, 42);
        RleBitPackingHybridEncoder encoder = new RleBitPackingHybridEncoder(bitWidth);
        for (int value : values) {
            encoder.writeInt(value);
        }
        byte[] bytes = encoder.toBytes();

        int[] decoded = new int[values.length];
        new RleBitPackingHybridDecoder(bytes, bitWidth).readInts(decoded, 0, values.length);
        assertThat(decoded).containsExactly(values);
    }

    @ParameterizedTest
    @ValueSource(ints = { 1, 3, 8, 17, 32 })
    void testOutputReadableByReferenceDecoder(int bitWidth) throws Exception {
        int[] values = mixedValues(bitWidth, 3_000, 7);
        RleBitPackingHybridEncoder encoder = new RleBitPackingHybridEncoder(bitWidth);
        for (int value : values) {
            encoder.writeInt(value);
        }

        RunLengthBitPackingHybridDecoder reference = new RunLengthBitPackingHybridDecoder(bitWidth,
                new ByteArrayInputStream(encoder.toBytes()));
        for (int value : values) {
            assertThat(reference.readInt()).isEqualTo(value);
        }
    }

    @ParameterizedTest
    @ValueSource(ints = { 1, 4, 9, 24 })
    void testDecodesReferenceEncoderOutput(int bitWidth) throws Exception {
        int[] values = mixedValues(bitWidth, 2_000, 99);
        RunLengthBitPackingHybridEncoder reference = new RunLengthBitPackingHybridEncoder(bitWidth, 64, 1024 * 1024,
                new HeapByteBufferAllocator());
        for (int value : values) {
            reference.writeInt(value);
        }
        byte[] bytes = reference.toBytes().toByteArray();

        int[] decoded = new int[values.length];
        new RleBitPackingHybridDecoder(bytes, bitWidth).readInts(decoded, 0, values.length);
        assertThat(decoded).containsExactly(values);
    }

    @Test
    void testZeroBitWidth() throws Exception {
        RleBitPackingHybridEncoder encoder = new RleBitPackingHybridEncoder(0);
        for (int i = 0; i < 10; i++) {
            encoder.writeInt(0);
        }
        int[] decoded = new int[10];
        new RleBitPackingHybridDecoder(encoder.toBytes(), 0).readInts(decoded, 0, 10);
        assertThat(decoded).containsOnly(0);
    }

    @Test
    void testEmptyInput() throws Exception {
        RleBitPackingHybridEncoder encoder = new RleBitPackingHybridEncoder(4);
        assertThat(encoder.toBytes()).isEmpty();
    }

    @Test
    void testResetStartsOver() throws Exception {
        RleBitPackingHybridEncoder encoder = new RleBitPackingHybridEncoder(2);
        encoder.writeInt(3);
        encoder.toBytes();
        encoder.reset();
        encoder.writeInt(1);
        int[] decoded = new int[1];
        new RleBitPackingHybridDecoder(encoder.toBytes(), 2).readInts(decoded, 0, 1);
        assertThat(decoded).containsExactly(1);
    }

    @Test
    void testTruncatedDataIsMalformed() throws Exception {
        RleBitPackingHybridEncoder encoder = new RleBitPackingHybridEncoder(5);
        int[] values = mixedValues(5, 200, 3);
        for (int value : values) {
            encoder.writeInt(value);
        }
        byte[] bytes = encoder.toBytes();
        byte[] truncated = Arrays.copyOf(bytes, bytes.length / 2);

        assertThatThrownBy(() -> new RleBitPackingHybridDecoder(truncated, 5).readInts(new int[200], 0, 200))
                .isInstanceOf(MalformedEncodingException.class);
    }

    @Test
    void testMoreValuesRequestedThanPresentIsMalformed() throws Exception {
        RleBitPackingHybridEncoder encoder = new RleBitPackingHybridEncoder(1);
        encoder.writeInt(1);
        encoder.writeInt(1);
        byte[] bytes = encoder.toBytes();

        assertThatThrownBy(() -> new RleBitPackingHybridDecoder(bytes, 1).readInts(new int[100], 0, 100))
                .isInstanceOf(MalformedEncodingException.class);
    }

    @Test
    void testRleValueWiderThanBitWidthIsMalformed() throws Exception {
        // RLE run of 4 values with value 0xFF, which does not fit in 2 bits
        byte[] bytes = { (byte) 0x08, (byte) 0xFF };

        assertThatThrownBy(() -> new RleBitPackingHybridDecoder(bytes, 2).readInts(new int[4], 0, 4))
                .isInstanceOf(MalformedEncodingException.class);
    }

    @Test
    void testOverlongRunHeaderIsMalformed() throws Exception {
        byte[] bytes = { (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0x01 };

        assertThatThrownBy(() -> new RleBitPackingHybridDecoder(bytes, 1).readInts(new int[1], 0, 1))
                .isInstanceOf(MalformedEncodingException.class);
    }

    @Test
    void testBitWidthAbove32IsRejected() {
        assertThatThrownBy(() -> new RleBitPackingHybridDecoder(new byte[0], 33))
                .isInstanceOf(MalformedEncodingException.class);
    }

    private static int[] mixedValues(int bitWidth, int count, long seed) {
        Random random = new Random(seed);
        long bound = 1L << bitWidth;
        int[] values = new int[count];
        int i = 0;
        while (i < count) {
            int runLength = 1 + random.nextInt(40);
            boolean repeat = random.nextBoolean();
            int repeated = (int) (random.nextLong() & (bound - 1));
            for (int j = 0; j < runLength && i < count; j++, i++) {
                values[i] = repeat ? repeated : (int) (random.nextLong() & (bound - 1));
            }
        }
        return values;
    }
}
