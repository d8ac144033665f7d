/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.io;

/**
 * A contiguous range of bytes in storage.
 */
public record ByteRange(long offset, int length) {

    public ByteRange {
        if (offset < 0) {
            throw new IllegalArgumentException("Offset cannot be negative: " + offset);
        }
        if (length < 0) {
            throw new IllegalArgumentException("Length cannot be negative: " + length);
        }
    }

    /**
     * Offset of the first byte after this range.
     */
    public long end() {
        return offset + length;
    }

    /**
     * Returns the sub-range starting at the given offset relative to this range.
     */
    public ByteRange slice(int relativeOffset, int sliceLength) {
        if (relativeOffset < 0 || sliceLength < 0 || relativeOffset + sliceLength > length) {
            throw new IndexOutOfBoundsException("Slice [" + relativeOffset + ", " + (relativeOffset + sliceLength)
                    + ") outside of range of length " + length);
        }
        return new ByteRange(offset + relativeOffset, sliceLength);
    }
}
