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
import dev.lamina.metadata.PhysicalType;
import dev.lamina.row.Binary;

/**
 * Encoder for PLAIN encoding: little-endian fixed-width numbers, booleans bit-packed LSB first,
 * BYTE_ARRAY values with a 4-byte length prefix and fixed-length values as raw bytes.
 */
public class PlainEncoder implements ValueEncoder {

    private final PhysicalType type;
    private final Integer typeLength;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    // pending bits of bit-packed booleans
    private int currentByte;
    private int bitPosition;

    public PlainEncoder(PhysicalType type, Integer typeLength) {
        this.type = type;
        this.typeLength = typeLength;
    }

    @Override
    public void writeBoolean(boolean value) {
        if (value) {
            currentByte |= 1 << bitPosition;
        }
        bitPosition++;
        if (bitPosition == 8) {
            out.write(currentByte);
            currentByte = 0;
            bitPosition = 0;
        }
    }

    @Override
    public void writeInt(int value) {
        BytesUtils.writeIntLittleEndian(out, value);
    }

    @Override
    public void writeLong(long value) {
        BytesUtils.writeLongLittleEndian(out, value);
    }

    @Override
    public void writeFloat(float value) {
        BytesUtils.writeIntLittleEndian(out, Float.floatToRawIntBits(value));
    }

    @Override
    public void writeDouble(double value) {
        BytesUtils.writeLongLittleEndian(out, Double.doubleToRawLongBits(value));
    }

    @Override
    public void writeBinary(Binary value) {
        byte[] bytes = value.getBytesUnsafe();
        switch (type) {
            case BYTE_ARRAY -> {
                BytesUtils.writeIntLittleEndian(out, bytes.length);
                out.writeBytes(bytes);
            }
            case FIXED_LEN_BYTE_ARRAY, INT96 -> {
                int expected = type == PhysicalType.INT96 ? 12 : typeLength;
                if (bytes.length != expected) {
                    throw new IllegalArgumentException("Expected " + expected + " bytes for " + type
                            + " but got " + bytes.length);
                }
                out.writeBytes(bytes);
            }
            default -> throw new UnsupportedOperationException("Binary values not supported for type: " + type);
        }
    }

    @Override
    public int getEstimatedSize() {
        return out.size() + (bitPosition > 0 ? 1 : 0);
    }

    @Override
    public byte[] toBytes() {
        if (bitPosition == 0) {
            return out.toByteArray();
        }
        ByteArrayOutputStream copy = new ByteArrayOutputStream(out.size() + 1);
        copy.writeBytes(out.toByteArray());
        copy.write(currentByte);
        return copy.toByteArray();
    }

    @Override
    public void reset() {
        out.reset();
        currentByte = 0;
        bitPosition = 0;
    }

    @Override
    public Encoding getEncoding() {
        return Encoding.PLAIN;
    }
}
