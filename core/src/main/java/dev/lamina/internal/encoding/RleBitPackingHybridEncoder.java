/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.internal.encoding;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;

/**
 * Encoder for the RLE/Bit-Packing Hybrid encoding.
 * <p>
 * Values are buffered in groups of eight. A value repeated at least eight times is written as
 * an RLE run; everything else goes into bit-packed runs of at most 63 groups, so that the
 * run header always fits into the single byte reserved for it.
 * </p>
 */
public class RleBitPackingHybridEncoder {

    private static final int MAX_GROUPS_PER_BIT_PACKED_RUN = 63;

    private final int bitWidth;
    private final int[] bufferedValues = new int[8];
    private final ByteArrayOutputStream packScratch = new ByteArrayOutputStream(32);

    private byte[] buffer = new byte[64];
    private int size;

    private int previousValue;
    private int repeatCount;
    private int numBufferedValues;

    private int bitPackedGroupCount;
    private int bitPackedRunHeaderPointer = -1;

    public RleBitPackingHybridEncoder(int bitWidth) {
        if (bitWidth < 0 || bitWidth > 32) {
            throw new IllegalArgumentException("Bit width must be between 0 and 32: " + bitWidth);
        }
        this.bitWidth = bitWidth;
    }

    public void writeInt(int value) {
        if (bitWidth < 32 && (value >>> bitWidth) != 0) {
            throw new IllegalArgumentException("Value " + value + " does not fit bit width " + bitWidth);
        }
        if (value == previousValue) {
            repeatCount++;
            if (repeatCount >= 8) {
                // extending the current RLE run, nothing to buffer
                return;
            }
        }
        else {
            if (repeatCount >= 8) {
                writeRleRun();
            }
            repeatCount = 1;
            previousValue = value;
        }

        bufferedValues[numBufferedValues++] = value;
        if (numBufferedValues == 8) {
            writeOrAppendBitPackedRun();
        }
    }

    /**
     * Finishes all pending runs and returns the encoded bytes. The encoder must be
     * {@link #reset()} before it is used again.
     */
    public byte[] toBytes() {
        if (repeatCount >= 8) {
            writeRleRun();
        }
        else if (numBufferedValues > 0) {
            Arrays.fill(bufferedValues, numBufferedValues, 8, 0);
            writeOrAppendBitPackedRun();
            endPreviousBitPackedRun();
        }
        else {
            endPreviousBitPackedRun();
        }
        return Arrays.copyOf(buffer, size);
    }

    /**
     * Upper bound of the encoded size of everything written so far.
     */
    public int getEstimatedSize() {
        return size + 1 + (numBufferedValues * bitWidth + 7) / 8 + 5 + 4;
    }

    public void reset() {
        size = 0;
        previousValue = 0;
        repeatCount = 0;
        numBufferedValues = 0;
        bitPackedGroupCount = 0;
        bitPackedRunHeaderPointer = -1;
    }

    private void writeOrAppendBitPackedRun() {
        if (bitPackedGroupCount >= MAX_GROUPS_PER_BIT_PACKED_RUN) {
            endPreviousBitPackedRun();
        }
        if (bitPackedRunHeaderPointer == -1) {
            // placeholder for the run header, patched in endPreviousBitPackedRun()
            bitPackedRunHeaderPointer = size;
            append((byte) 0);
        }
        packScratch.reset();
        BitPacking.pack8LsbFirst(bufferedValues, bitWidth, packScratch);
        append(packScratch.toByteArray());

        numBufferedValues = 0;
        repeatCount = 0;
        bitPackedGroupCount++;
    }

    private void endPreviousBitPackedRun() {
        if (bitPackedRunHeaderPointer == -1) {
            return;
        }
        buffer[bitPackedRunHeaderPointer] = (byte) ((bitPackedGroupCount << 1) | 1);
        bitPackedRunHeaderPointer = -1;
        bitPackedGroupCount = 0;
    }

    private void writeRleRun() {
        endPreviousBitPackedRun();

        ByteArrayOutputStream run = new ByteArrayOutputStream(9);
        BytesUtils.writeUnsignedVarInt(run, repeatCount << 1);
        BytesUtils.writeIntLittleEndianPadded(run, previousValue, (bitWidth + 7) / 8);
        append(run.toByteArray());

        repeatCount = 0;
        numBufferedValues = 0;
    }

    private void append(byte b) {
        ensureCapacity(size + 1);
        buffer[size++] = b;
    }

    private void append(byte[] bytes) {
        ensureCapacity(size + bytes.length);
        System.arraycopy(bytes, 0, buffer, size, bytes.length);
        size += bytes.length;
    }

    private void ensureCapacity(int required) {
        if (required > buffer.length) {
            buffer = Arrays.copyOf(buffer, Math.max(required, buffer.length * 2));
        }
    }
}
