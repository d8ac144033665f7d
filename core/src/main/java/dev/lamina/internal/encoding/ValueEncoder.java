/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.internal.encoding;

import dev.lamina.metadata.Encoding;
import dev.lamina.row.Binary;

/**
 * Counterpart of {@link ValueDecoder}: accumulates the non-null values of one page
 * and produces their encoded bytes.
 */
public interface ValueEncoder {

    default void writeBoolean(boolean value) {
        throw new UnsupportedOperationException(getEncoding() + " does not encode BOOLEAN values");
    }

    default void writeInt(int value) {
        throw new UnsupportedOperationException(getEncoding() + " does not encode INT32 values");
    }

    default void writeLong(long value) {
        throw new UnsupportedOperationException(getEncoding() + " does not encode INT64 values");
    }

    default void writeFloat(float value) {
        throw new UnsupportedOperationException(getEncoding() + " does not encode FLOAT values");
    }

    default void writeDouble(double value) {
        throw new UnsupportedOperationException(getEncoding() + " does not encode DOUBLE values");
    }

    default void writeBinary(Binary value) {
        throw new UnsupportedOperationException(getEncoding() + " does not encode binary values");
    }

    /**
     * Writes a boxed value as produced by record shredding.
     */
    default void writeValue(Object value) {
        if (value instanceof Boolean b) {
            writeBoolean(b);
        }
        else if (value instanceof Integer i) {
            writeInt(i);
        }
        else if (value instanceof Long l) {
            writeLong(l);
        }
        else if (value instanceof Float f) {
            writeFloat(f);
        }
        else if (value instanceof Double d) {
            writeDouble(d);
        }
        else if (value instanceof Binary binary) {
            writeBinary(binary);
        }
        else {
            throw new IllegalArgumentException("Cannot encode value of type "
                    + (value == null ? "null" : value.getClass().getName()));
        }
    }

    /**
     * Approximate size in bytes of the encoded values written so far.
     */
    int getEstimatedSize();

    /**
     * Returns the encoded form of all values written since the last {@link #reset()}.
     * Further values may only be written after another reset.
     */
    byte[] toBytes();

    void reset();

    Encoding getEncoding();
}
