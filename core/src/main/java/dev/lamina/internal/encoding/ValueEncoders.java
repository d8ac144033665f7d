/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.internal.encoding;

import dev.lamina.metadata.Encoding;
import dev.lamina.metadata.PhysicalType;

/**
 * Creates the non-dictionary value encoder for an encoding and column type.
 */
public final class ValueEncoders {

    private ValueEncoders() {
    }

    /**
     * @throws IllegalArgumentException if the encoding cannot encode values of the given type
     */
    public static ValueEncoder create(Encoding encoding, PhysicalType type, Integer typeLength) {
        if (!encoding.supportsValuesOf(type)) {
            throw new IllegalArgumentException("Encoding " + encoding + " cannot be used for " + type + " values");
        }
        return switch (encoding) {
            case PLAIN -> new PlainEncoder(type, typeLength);
            case RLE -> new RleBooleanEncoder();
            case DELTA_BINARY_PACKED -> new DeltaBinaryPackedEncoder(type == PhysicalType.INT32);
            case DELTA_LENGTH_BYTE_ARRAY -> new DeltaLengthByteArrayEncoder();
            case DELTA_BYTE_ARRAY -> new DeltaByteArrayEncoder();
            case PLAIN_DICTIONARY, RLE_DICTIONARY -> new DictionaryEncoder(type, typeLength);
            case BIT_PACKED, UNKNOWN -> throw new IllegalArgumentException("Not a value encoding: " + encoding);
        };
    }
}
