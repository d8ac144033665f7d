/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.row;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * Immutable byte sequence used for BYTE_ARRAY, FIXED_LEN_BYTE_ARRAY and INT96 values.
 * Equality is by content; ordering is unsigned lexicographic, which is the order used
 * for column statistics.
 */
public final class Binary implements Comparable<Binary> {

    private static final Binary EMPTY = new Binary(new byte[0]);

    private final byte[] bytes;

    private Binary(byte[] bytes) {
        this.bytes = bytes;
    }

    public static Binary empty() {
        return EMPTY;
    }

    /**
     * Creates a binary holding a copy of the given bytes.
     */
    public static Binary fromBytes(byte[] bytes) {
        return new Binary(bytes.clone());
    }

    /**
     * Creates a binary backed by the given array without copying it.
     * The caller must not modify the array afterwards.
     */
    public static Binary wrap(byte[] bytes) {
        return new Binary(bytes);
    }

    public static Binary fromString(String value) {
        return new Binary(value.getBytes(StandardCharsets.UTF_8));
    }

    public int length() {
        return bytes.length;
    }

    /**
     * Returns a copy of the bytes.
     */
    public byte[] getBytes() {
        return bytes.clone();
    }

    /**
     * Returns the backing array. Callers must not modify it.
     */
    public byte[] getBytesUnsafe() {
        return bytes;
    }

    public String toStringUtf8() {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    @Override
    public int compareTo(Binary other) {
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Binary other)) {
            return false;
        }
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "Binary[" + HexFormat.of().formatHex(bytes) + "]";
    }
}
