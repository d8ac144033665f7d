/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.internal.encoding;

import java.io.IOException;
import java.io.InputStream;

import dev.lamina.MalformedEncodingException;

/**
 * Decoder for DELTA_BINARY_PACKED encoding.
 * <p>
 * This encoding stores integers as deltas from consecutive values, organized in blocks
 * and miniblocks. Each block has a minimum delta, and values are stored as
 * (actual_delta - min_delta) to ensure non-negative values that can be efficiently bit-packed.
 * <p>
 * Format:
 * <pre>
 * HEADER: block_size (ULEB128) | miniblock_count (ULEB128) | total_count (ULEB128) | first_value (zigzag)
 * BLOCK:  min_delta (zigzag) | bitwidths[miniblock_count] | miniblock_data...
 * </pre>
 * <p>
 * Supports INT32 and INT64 physical types. INT32 values are reconstructed modulo 2^32.
 *
 * @see <a href="https://github.com/apache/parquet-format/blob/master/Encodings.md">Parquet Encodings</a>
 */
public class DeltaBinaryPackedDecoder implements ValueDecoder {

    private final InputStream input;

    // Header values
    private int blockSize;
    private int miniblockCount;
    private int totalValueCount;
    private long firstValue;
    private int valuesPerMiniblock;

    // Reading state
    private int valuesRead;
    private long lastValue;
    private boolean headerRead;

    // Current block state
    private long minDelta;
    private int[] bitWidths;
    private int currentMiniblock;
    private int valuesInCurrentMiniblock;

    // Bit unpacking buffer
    private byte[] miniblockData;
    private int bitPosition;

    public DeltaBinaryPackedDecoder(InputStream input) {
        this.input = input;
        this.headerRead = false;
        this.valuesRead = 0;
    }

    /**
     * Read a single INT32 value from the stream.
     */
    public int readInt() throws IOException {
        return (int) readLongValue();
    }

    /**
     * Read a single INT64 value from the stream.
     */
    public long readLong() throws IOException {
        return readLongValue();
    }

    @Override
    public void readLongs(long[] output, int[] definitionLevels, int maxDefLevel) throws IOException {
        for (int i = 0; i < output.length; i++) {
            if (definitionLevels == null || definitionLevels[i] == maxDefLevel) {
                output[i] = readLongValue();
            }
        }
    }

    @Override
    public void readInts(int[] output, int[] definitionLevels, int maxDefLevel) throws IOException {
        for (int i = 0; i < output.length; i++) {
            if (definitionLevels == null || definitionLevels[i] == maxDefLevel) {
                output[i] = (int) readLongValue();
            }
        }
    }

    /**
     * Number of values announced by the header, reading the header if necessary.
     */
    public int getTotalValueCount() throws IOException {
        ensureHeader();
        return totalValueCount;
    }

    /**
     * Read a single value as a primitive long (no boxing).
     */
    private long readLongValue() throws IOException {
        ensureHeader();

        if (valuesRead >= totalValueCount) {
            throw new MalformedEncodingException("DELTA_BINARY_PACKED data holds only " + totalValueCount + " values");
        }

        if (valuesRead == 0) {
            valuesRead = 1;
            return firstValue;
        }

        // Check if we need to start a new block (first value after header doesn't count)
        int valuesAfterFirst = valuesRead - 1;
        if (valuesAfterFirst % blockSize == 0) {
            readBlockHeader();
        }

        // Check if we need a new miniblock
        if (valuesInCurrentMiniblock >= valuesPerMiniblock) {
            currentMiniblock++;
            valuesInCurrentMiniblock = 0;
            loadMiniblock();
        }

        // Unpack delta and reconstruct value
        long packedDelta = unpackValue(bitWidths[currentMiniblock]);
        long delta = minDelta + packedDelta;
        lastValue += delta;
        valuesInCurrentMiniblock++;
        valuesRead++;

        return lastValue;
    }

    private void ensureHeader() throws IOException {
        if (!headerRead) {
            readHeader();
            headerRead = true;
        }
    }

    private void readHeader() throws IOException {
        blockSize = BytesUtils.readUnsignedVarInt(input);
        miniblockCount = BytesUtils.readUnsignedVarInt(input);
        totalValueCount = BytesUtils.readUnsignedVarInt(input);
        firstValue = BytesUtils.readZigZagVarLong(input);

        if (blockSize <= 0 || blockSize % 128 != 0) {
            throw new MalformedEncodingException("Invalid block size: " + blockSize);
        }
        if (miniblockCount <= 0 || blockSize % miniblockCount != 0) {
            throw new MalformedEncodingException("Invalid miniblock count: " + miniblockCount);
        }
        if (totalValueCount < 0) {
            throw new MalformedEncodingException("Invalid value count: " + Integer.toUnsignedString(totalValueCount));
        }
        valuesPerMiniblock = blockSize / miniblockCount;
        if (valuesPerMiniblock % 8 != 0) {
            throw new MalformedEncodingException("Miniblock size must be a multiple of 8: " + valuesPerMiniblock);
        }
        bitWidths = new int[miniblockCount];

        lastValue = firstValue;
    }

    private void readBlockHeader() throws IOException {
        minDelta = BytesUtils.readZigZagVarLong(input);

        byte[] widths = BytesUtils.readFully(input, miniblockCount, "miniblock bit widths");
        for (int i = 0; i < miniblockCount; i++) {
            bitWidths[i] = widths[i] & 0xFF;
        }

        currentMiniblock = 0;
        valuesInCurrentMiniblock = 0;
        loadMiniblock();
    }

    private void loadMiniblock() throws IOException {
        int bitWidth = bitWidths[currentMiniblock];
        if (bitWidth > 64) {
            throw new MalformedEncodingException("Invalid miniblock bit width: " + bitWidth);
        }
        if (bitWidth == 0) {
            // All values in this miniblock have the same delta (minDelta)
            miniblockData = new byte[0];
        }
        else {
            int bytesNeeded = (valuesPerMiniblock * bitWidth + 7) / 8;
            miniblockData = BytesUtils.readFully(input, bytesNeeded, "miniblock data");
        }
        bitPosition = 0;
    }

    private long unpackValue(int bitWidth) {
        if (bitWidth == 0) {
            return 0;
        }

        long value = 0;
        int bitsRemaining = bitWidth;

        while (bitsRemaining > 0) {
            int byteOffset = bitPosition / 8;
            int bitOffset = bitPosition % 8;
            int bitsAvailable = 8 - bitOffset;
            int bitsToRead = Math.min(bitsAvailable, bitsRemaining);

            int mask = (1 << bitsToRead) - 1;
            long bits = (miniblockData[byteOffset] >>> bitOffset) & mask;
            value |= bits << (bitWidth - bitsRemaining);

            bitPosition += bitsToRead;
            bitsRemaining -= bitsToRead;
        }

        return value;
    }
}
