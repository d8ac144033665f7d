/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.metadata;

/**
 * Physical types supported by the storage format.
 * These represent how data is stored on disk.
 */
public enum PhysicalType {
    BOOLEAN(0, 0),
    INT32(1, 4),
    INT64(2, 8),
    INT96(3, 12), // Deprecated, used for legacy timestamp
    FLOAT(4, 4),
    DOUBLE(5, 8),
    BYTE_ARRAY(6, -1),
    FIXED_LEN_BYTE_ARRAY(7, -1);

    private final int id;
    private final int byteWidth;

    PhysicalType(int id, int byteWidth) {
        this.id = id;
        this.byteWidth = byteWidth;
    }

    public int getId() {
        return id;
    }

    /**
     * Returns the PLAIN encoded width in bytes, 0 for bit-packed BOOLEAN and -1 for
     * types whose width depends on the value or the column.
     */
    public int getByteWidth() {
        return byteWidth;
    }

    public static PhysicalType fromId(int value) {
        for (PhysicalType type : values()) {
            if (type.id == value) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown physical type: " + value);
    }
}
