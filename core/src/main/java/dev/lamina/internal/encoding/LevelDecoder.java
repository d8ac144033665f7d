/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.internal.encoding;

import dev.lamina.EncodingNotSupportedException;
import dev.lamina.MalformedEncodingException;
import dev.lamina.metadata.Encoding;

/**
 * Decodes repetition or definition levels. Level values are returned as decoded;
 * checking them against the column maximum is left to record assembly.
 */
public final class LevelDecoder {

    private LevelDecoder() {
    }

    /**
     * Decodes {@code count} levels from {@code length} bytes starting at {@code offset}.
     *
     * @return the levels, or null when the maximum level is 0 and no levels are stored
     */
    public static int[] decode(Encoding encoding, byte[] data, int offset, int length, int count, int maxLevel)
            throws MalformedEncodingException, EncodingNotSupportedException {
        if (maxLevel == 0) {
            return null;
        }
        int bitWidth = BytesUtils.bitWidth(maxLevel);
        int[] levels = new int[count];
        switch (encoding) {
            case RLE -> new RleBitPackingHybridDecoder(data, offset, length, bitWidth).readInts(levels, 0, count);
            case BIT_PACKED -> {
                long needed = ((long) count * bitWidth + 7) / 8;
                if (needed > length) {
                    throw new MalformedEncodingException("BIT_PACKED levels need " + needed + " bytes, but only "
                            + length + " are present");
                }
                BitPacking.unpackMsbFirst(data, offset, levels, count, bitWidth);
            }
            default -> throw new EncodingNotSupportedException("Unsupported level encoding: " + encoding);
        }
        return levels;
    }
}
