/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.internal.encoding;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

import dev.lamina.MalformedEncodingException;

/**
 * Decoder for RLE/Bit-Packing Hybrid encoding.
 * Used for definition/repetition levels, dictionary indices and RLE-encoded booleans.
 */
public class RleBitPackingHybridDecoder {

    private final byte[] data;
    private final ByteBuffer dataBuffer;
    private final int limit;
    private final int bitWidth;
    private final int bitMask;
    private int pos;

    // Run state
    private int currentValue;
    private int remainingInRun;
    private boolean isRleRun;

    // Bit buffer for packed values
    private long bitBuffer;
    private int bitsInBuffer;

    public RleBitPackingHybridDecoder(byte[] data, int bitWidth) throws MalformedEncodingException {
        this(data, 0, data.length, bitWidth);
    }

    public RleBitPackingHybridDecoder(byte[] data, int offset, int length, int bitWidth) throws MalformedEncodingException {
        if (bitWidth < 0 || bitWidth > 32) {
            throw new MalformedEncodingException("Invalid bit width for RLE/bit-packed hybrid data: " + bitWidth);
        }
        if (offset < 0 || length < 0 || offset + length > data.length) {
            throw new MalformedEncodingException("RLE/bit-packed hybrid data of " + length + " bytes at offset "
                    + offset + " exceeds buffer of " + data.length + " bytes");
        }
        this.data = data;
        this.dataBuffer = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
        this.pos = offset;
        this.limit = offset + length;
        this.bitWidth = bitWidth;
        this.bitMask = bitWidth == 32 ? -1 : (1 << bitWidth) - 1;
    }

    /**
     * Decodes exactly {@code count} values into the buffer.
     *
     * @throws MalformedEncodingException if the data ends before {@code count} values were decoded
     */
    public void readInts(int[] buffer, int offset, int count) throws MalformedEncodingException {
        if (bitWidth == 0) {
            Arrays.fill(buffer, offset, offset + count, 0);
            return;
        }

        int outPos = offset;
        int remaining = count;

        while (remaining > 0) {
            if (remainingInRun == 0) {
                readNextRun();
            }

            int toRead = Math.min(remaining, remainingInRun);

            if (isRleRun) {
                Arrays.fill(buffer, outPos, outPos + toRead, currentValue);
            }
            else {
                decodeBitPacked(buffer, outPos, toRead);
            }

            outPos += toRead;
            remainingInRun -= toRead;
            remaining -= toRead;
        }
    }

    public int readInt() throws MalformedEncodingException {
        int[] single = new int[1];
        readInts(single, 0, 1);
        return single[0];
    }

    public void readBooleans(boolean[] output, int[] defLevels, int maxDef) throws MalformedEncodingException {
        int nonNullCount = ValueDecoder.countNonNulls(defLevels, output.length, maxDef);
        int[] values = new int[nonNullCount];
        readInts(values, 0, nonNullCount);
        int idx = 0;
        for (int i = 0; i < output.length; i++) {
            if (defLevels == null || defLevels[i] == maxDef) {
                output[i] = values[idx++] != 0;
            }
        }
    }

    private void readNextRun() throws MalformedEncodingException {
        if (pos >= limit) {
            throw new MalformedEncodingException("RLE/bit-packed hybrid data ended before all values were decoded");
        }

        long header = readUnsignedVarInt();

        if ((header & 1) == 1) {
            // Bit-packed: header >> 1 = number of 8-value groups
            long groups = header >> 1;
            if (groups == 0 || groups * 8 > Integer.MAX_VALUE) {
                throw new MalformedEncodingException("Invalid bit-packed run of " + groups + " groups");
            }
            remainingInRun = (int) groups * 8;
            isRleRun = false;
        }
        else {
            // RLE: header >> 1 = repeat count
            long runLength = header >> 1;
            if (runLength == 0 || runLength > Integer.MAX_VALUE) {
                throw new MalformedEncodingException("Invalid RLE run length: " + runLength);
            }
            remainingInRun = (int) runLength;
            currentValue = readRleValue();
            isRleRun = true;
        }
    }

    private int readRleValue() throws MalformedEncodingException {
        int bytesNeeded = (bitWidth + 7) / 8;
        if (pos + bytesNeeded > limit) {
            throw new MalformedEncodingException("Unexpected EOF reading RLE run value");
        }
        int value = 0;
        for (int i = 0; i < bytesNeeded; i++) {
            value |= (data[pos++] & 0xFF) << (i * 8);
        }
        if ((value & ~bitMask) != 0) {
            throw new MalformedEncodingException("RLE run value " + Integer.toUnsignedString(value)
                    + " does not fit bit width " + bitWidth);
        }
        return value;
    }

    /**
     * Batch decode bit-packed values. Optimized paths for common bit widths.
     */
    private void decodeBitPacked(int[] output, int outPos, int count) throws MalformedEncodingException {
        final int width = bitWidth;
        final long mask = bitMask & 0xFFFFFFFFL;

        // Drain leftover bits first
        while (bitsInBuffer >= width && count > 0) {
            output[outPos++] = (int) (bitBuffer & mask);
            bitBuffer >>>= width;
            bitsInBuffer -= width;
            count--;
        }

        // Fast path for bit width 1 (common for definition levels)
        if (width == 1 && bitsInBuffer == 0) {
            while (count >= 8 && pos < limit) {
                int b = data[pos++] & 0xFF;
                output[outPos]     = b & 1;
                output[outPos + 1] = (b >> 1) & 1;
                output[outPos + 2] = (b >> 2) & 1;
                output[outPos + 3] = (b >> 3) & 1;
                output[outPos + 4] = (b >> 4) & 1;
                output[outPos + 5] = (b >> 5) & 1;
                output[outPos + 6] = (b >> 6) & 1;
                output[outPos + 7] = (b >> 7) & 1;
                outPos += 8;
                count -= 8;
            }
        }
        // For widths 2-8: read 8 bytes at once when possible, extract 8 values
        else if (width <= 8 && bitsInBuffer == 0) {
            while (count >= 8 && pos + 8 <= limit) {
                long bits = dataBuffer.getLong(pos);
                pos += width; // Only consume 'width' bytes for 8 values
                for (int i = 0; i < 8; i++) {
                    output[outPos + i] = (int) (bits & mask);
                    bits >>>= width;
                }
                outPos += 8;
                count -= 8;
            }
        }

        // Handle remaining values
        while (count > 0) {
            while (bitsInBuffer < width && pos < limit) {
                bitBuffer |= ((long) (data[pos++] & 0xFF)) << bitsInBuffer;
                bitsInBuffer += 8;
            }
            if (bitsInBuffer < width) {
                throw new MalformedEncodingException("Unexpected EOF in bit-packed run");
            }
            output[outPos++] = (int) (bitBuffer & mask);
            bitBuffer >>>= width;
            bitsInBuffer -= width;
            count--;
        }
    }

    private long readUnsignedVarInt() throws MalformedEncodingException {
        long result = 0;
        int shift = 0;
        while (true) {
            if (pos >= limit) {
                throw new MalformedEncodingException("Unexpected EOF in run header");
            }
            if (shift > 28) {
                throw new MalformedEncodingException("Run header is longer than 5 bytes");
            }
            int b = data[pos++] & 0xFF;
            result |= (long) (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                return result;
            }
            shift += 7;
        }
    }
}
