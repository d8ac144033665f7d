/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.internal.encoding;

import dev.lamina.metadata.Encoding;

/**
 * Encodes repetition or definition levels with RLE or the legacy BIT_PACKED encoding.
 * The bit width is derived from the maximum level of the column.
 */
public final class LevelEncoder {

    private LevelEncoder() {
    }

    public static byte[] encode(Encoding encoding, int[] levels, int offset, int count, int maxLevel) {
        if (maxLevel == 0) {
            return new byte[0];
        }
        int bitWidth = BytesUtils.bitWidth(maxLevel);
        return switch (encoding) {
            case RLE -> {
                RleBitPackingHybridEncoder encoder = new RleBitPackingHybridEncoder(bitWidth);
                for (int i = offset; i < offset + count; i++) {
                    encoder.writeInt(levels[i]);
                }
                yield encoder.toBytes();
            }
            case BIT_PACKED -> BitPacking.packMsbFirst(levels, offset, count, bitWidth);
            default -> throw new IllegalArgumentException("Not a level encoding: " + encoding);
        };
    }
}
