/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.internal.encoding;

import java.io.ByteArrayOutputStream;

import dev.lamina.metadata.Encoding;

/**
 * Encoder for DELTA_BINARY_PACKED encoding, the counterpart of {@link DeltaBinaryPackedDecoder}.
 * <p>
 * Blocks hold 128 deltas split into 4 miniblocks of 32. Miniblocks after the last value
 * of the final block are omitted; the last written miniblock is padded with zero bits.
 * INT32 deltas are computed with 32-bit wrap-around, INT64 deltas with 64-bit wrap-around.
 * </p>
 */
public class DeltaBinaryPackedEncoder implements ValueEncoder {

    static final int BLOCK_SIZE = 128;
    static final int MINIBLOCK_COUNT = 4;
    static final int MINIBLOCK_SIZE = BLOCK_SIZE / MINIBLOCK_COUNT;

    private final boolean int32;
    private final ByteArrayOutputStream blocks = new ByteArrayOutputStream();
    private final long[] deltas = new long[BLOCK_SIZE];
    private final long[] packed = new long[MINIBLOCK_SIZE];

    private int deltasInBlock;
    private int totalValueCount;
    private long firstValue;
    private long previousValue;

    /**
     * @param int32 whether the values are INT32, which determines the overflow behaviour of deltas
     */
    public DeltaBinaryPackedEncoder(boolean int32) {
        this.int32 = int32;
    }

    @Override
    public void writeInt(int value) {
        if (!int32) {
            throw new UnsupportedOperationException("Encoder was created for INT64 values");
        }
        add(value);
    }

    @Override
    public void writeLong(long value) {
        if (int32) {
            throw new UnsupportedOperationException("Encoder was created for INT32 values");
        }
        add(value);
    }

    private void add(long value) {
        if (totalValueCount == 0) {
            firstValue = value;
        }
        else {
            deltas[deltasInBlock++] = int32 ? (long) ((int) value - (int) previousValue) : value - previousValue;
            if (deltasInBlock == BLOCK_SIZE) {
                flushBlock();
            }
        }
        previousValue = value;
        totalValueCount++;
    }

    private void flushBlock() {
        if (deltasInBlock == 0) {
            return;
        }
        long minDelta = Long.MAX_VALUE;
        for (int i = 0; i < deltasInBlock; i++) {
            minDelta = Math.min(minDelta, deltas[i]);
        }
        BytesUtils.writeZigZagVarLong(blocks, minDelta);

        int[] bitWidths = new int[MINIBLOCK_COUNT];
        for (int m = 0; m < MINIBLOCK_COUNT; m++) {
            int start = m * MINIBLOCK_SIZE;
            int end = Math.min(start + MINIBLOCK_SIZE, deltasInBlock);
            long max = 0;
            for (int i = start; i < end; i++) {
                long relative = deltas[i] - minDelta;
                if (Long.compareUnsigned(relative, max) > 0) {
                    max = relative;
                }
            }
            bitWidths[m] = BytesUtils.bitWidth(max);
            blocks.write(bitWidths[m]);
        }

        for (int m = 0; m < MINIBLOCK_COUNT; m++) {
            int start = m * MINIBLOCK_SIZE;
            if (start >= deltasInBlock) {
                break;
            }
            int end = Math.min(start + MINIBLOCK_SIZE, deltasInBlock);
            for (int i = 0; i < MINIBLOCK_SIZE; i++) {
                packed[i] = start + i < end ? deltas[start + i] - minDelta : 0;
            }
            BitPacking.packLsbFirst(packed, 0, MINIBLOCK_SIZE, bitWidths[m], blocks);
        }
        deltasInBlock = 0;
    }

    @Override
    public int getEstimatedSize() {
        // header plus pending deltas at full width
        return 20 + blocks.size() + deltasInBlock * (int32 ? 4 : 8) + MINIBLOCK_COUNT + 10;
    }

    @Override
    public byte[] toBytes() {
        flushBlock();
        ByteArrayOutputStream out = new ByteArrayOutputStream(blocks.size() + 20);
        BytesUtils.writeUnsignedVarInt(out, BLOCK_SIZE);
        BytesUtils.writeUnsignedVarInt(out, MINIBLOCK_COUNT);
        BytesUtils.writeUnsignedVarInt(out, totalValueCount);
        BytesUtils.writeZigZagVarLong(out, firstValue);
        out.writeBytes(blocks.toByteArray());
        return out.toByteArray();
    }

    @Override
    public void reset() {
        blocks.reset();
        deltasInBlock = 0;
        totalValueCount = 0;
        firstValue = 0;
        previousValue = 0;
    }

    @Override
    public Encoding getEncoding() {
        return Encoding.DELTA_BINARY_PACKED;
    }
}
