/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.internal.encoding;

import java.io.ByteArrayOutputStream;

/**
 * Packs unsigned values of a fixed bit width into bytes.
 * <p>
 * The hybrid and delta encodings fill each byte starting at the least significant bit.
 * The legacy BIT_PACKED level encoding fills bytes starting at the most significant bit.
 * </p>
 */
public final class BitPacking {

    private BitPacking() {
    }

    /**
     * Packs {@code count} values LSB first. The output is padded to a whole number of bytes.
     */
    public static void packLsbFirst(long[] values, int offset, int count, int bitWidth, ByteArrayOutputStream out) {
        if (bitWidth == 0) {
            return;
        }
        long buffer = 0;
        int bitsInBuffer = 0;
        for (int i = offset; i < offset + count; i++) {
            long value = values[i];
            int remaining = bitWidth;
            while (remaining > 0) {
                int take = Math.min(remaining, 64 - bitsInBuffer);
                long bits = take == 64 ? value : value & ((1L << take) - 1);
                buffer |= bits << bitsInBuffer;
                bitsInBuffer += take;
                remaining -= take;
                value = take == 64 ? 0 : value >>> take;
                while (bitsInBuffer >= 8) {
                    out.write((int) (buffer & 0xFF));
                    buffer >>>= 8;
                    bitsInBuffer -= 8;
                }
                if (bitsInBuffer == 0) {
                    buffer = 0;
                }
            }
        }
        if (bitsInBuffer > 0) {
            out.write((int) (buffer & 0xFF));
        }
    }

    /**
     * Packs exactly 8 values LSB first, producing {@code bitWidth} bytes.
     */
    public static void pack8LsbFirst(int[] values, int bitWidth, ByteArrayOutputStream out) {
        long buffer = 0;
        int bitsInBuffer = 0;
        long mask = bitWidth == 32 ? 0xFFFFFFFFL : (1L << bitWidth) - 1;
        for (int i = 0; i < 8; i++) {
            buffer |= (values[i] & mask) << bitsInBuffer;
            bitsInBuffer += bitWidth;
            while (bitsInBuffer >= 8) {
                out.write((int) (buffer & 0xFF));
                buffer >>>= 8;
                bitsInBuffer -= 8;
            }
        }
    }

    /**
     * Packs {@code count} values MSB first, padding the last byte with zero bits.
     */
    public static byte[] packMsbFirst(int[] values, int offset, int count, int bitWidth) {
        byte[] packed = new byte[(count * bitWidth + 7) / 8];
        int bitPosition = 0;
        for (int i = offset; i < offset + count; i++) {
            int value = values[i];
            for (int bit = bitWidth - 1; bit >= 0; bit--) {
                if (((value >>> bit) & 1) != 0) {
                    packed[bitPosition >>> 3] |= (byte) (0x80 >>> (bitPosition & 7));
                }
                bitPosition++;
            }
        }
        return packed;
    }

    /**
     * Unpacks {@code count} values packed MSB first.
     */
    public static void unpackMsbFirst(byte[] data, int offset, int[] output, int count, int bitWidth) {
        int bitPosition = 0;
        for (int i = 0; i < count; i++) {
            int value = 0;
            for (int bit = 0; bit < bitWidth; bit++) {
                int b = data[offset + (bitPosition >>> 3)] & 0xFF;
                value = (value << 1) | ((b >>> (7 - (bitPosition & 7))) & 1);
                bitPosition++;
            }
            output[i] = value;
        }
    }
}
