/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.metadata;

/**
 * Encodings for values and levels stored in pages.
 */
public enum Encoding {
    PLAIN(0),
    PLAIN_DICTIONARY(2),
    RLE(3),
    BIT_PACKED(4),
    DELTA_BINARY_PACKED(5),
    DELTA_LENGTH_BYTE_ARRAY(6),
    DELTA_BYTE_ARRAY(7),
    RLE_DICTIONARY(8),
    /**
     * Placeholder for ids found in page headers that don't map to a known encoding.
     * Decoding a page with this encoding fails with an
     * {@link dev.lamina.EncodingNotSupportedException}.
     */
    UNKNOWN(-1);

    private final int id;

    Encoding(int id) {
        this.id = id;
    }

    public int getId() {
        return id;
    }

    public boolean isDictionary() {
        return this == PLAIN_DICTIONARY || this == RLE_DICTIONARY;
    }

    /**
     * Returns true if this encoding can be used for the values of a column of the given type.
     */
    public boolean supportsValuesOf(PhysicalType type) {
        return switch (this) {
            case PLAIN -> true;
            case PLAIN_DICTIONARY, RLE_DICTIONARY -> type != PhysicalType.BOOLEAN;
            case RLE -> type == PhysicalType.BOOLEAN;
            case DELTA_BINARY_PACKED -> type == PhysicalType.INT32 || type == PhysicalType.INT64;
            case DELTA_LENGTH_BYTE_ARRAY -> type == PhysicalType.BYTE_ARRAY;
            case DELTA_BYTE_ARRAY -> type == PhysicalType.BYTE_ARRAY || type == PhysicalType.FIXED_LEN_BYTE_ARRAY;
            case BIT_PACKED, UNKNOWN -> false;
        };
    }

    /**
     * Returns true if this encoding can be used for repetition and definition levels.
     */
    public boolean supportsLevels() {
        return this == RLE || this == BIT_PACKED;
    }

    public static Encoding fromId(int value) {
        for (Encoding encoding : values()) {
            if (encoding.id == value) {
                return encoding;
            }
        }
        // Unknown ids are reported when a page using them is decoded
        return UNKNOWN;
    }
}
