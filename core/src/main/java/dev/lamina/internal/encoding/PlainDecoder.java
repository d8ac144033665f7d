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
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import dev.lamina.MalformedEncodingException;
import dev.lamina.metadata.PhysicalType;

/**
 * Decoder for PLAIN encoding.
 * PLAIN encoding stores values in their native binary representation.
 */
public class PlainDecoder implements ValueDecoder {

    private final InputStream input;
    private final PhysicalType type;
    private final Integer typeLength;

    // For bit-packed boolean reading
    private int currentByte = 0;
    private int bitPosition = 8; // 8 means we need to read a new byte

    public PlainDecoder(InputStream input, PhysicalType type, Integer typeLength) {
        this.input = input;
        this.type = type;
        this.typeLength = typeLength;
    }

    @Override
    public void readLongs(long[] output, int[] definitionLevels, int maxDefLevel) throws IOException {
        int numDefined = ValueDecoder.countNonNulls(definitionLevels, output.length, maxDefLevel);
        var longBuffer = readValueBytes(numDefined, 8, "INT64").asLongBuffer();
        for (int i = 0; i < output.length; i++) {
            if (definitionLevels == null || definitionLevels[i] == maxDefLevel) {
                output[i] = longBuffer.get();
            }
        }
    }

    @Override
    public void readDoubles(double[] output, int[] definitionLevels, int maxDefLevel) throws IOException {
        int numDefined = ValueDecoder.countNonNulls(definitionLevels, output.length, maxDefLevel);
        var doubleBuffer = readValueBytes(numDefined, 8, "DOUBLE").asDoubleBuffer();
        for (int i = 0; i < output.length; i++) {
            if (definitionLevels == null || definitionLevels[i] == maxDefLevel) {
                output[i] = doubleBuffer.get();
            }
        }
    }

    @Override
    public void readInts(int[] output, int[] definitionLevels, int maxDefLevel) throws IOException {
        int numDefined = ValueDecoder.countNonNulls(definitionLevels, output.length, maxDefLevel);
        var intBuffer = readValueBytes(numDefined, 4, "INT32").asIntBuffer();
        for (int i = 0; i < output.length; i++) {
            if (definitionLevels == null || definitionLevels[i] == maxDefLevel) {
                output[i] = intBuffer.get();
            }
        }
    }

    @Override
    public void readFloats(float[] output, int[] definitionLevels, int maxDefLevel) throws IOException {
        int numDefined = ValueDecoder.countNonNulls(definitionLevels, output.length, maxDefLevel);
        var floatBuffer = readValueBytes(numDefined, 4, "FLOAT").asFloatBuffer();
        for (int i = 0; i < output.length; i++) {
            if (definitionLevels == null || definitionLevels[i] == maxDefLevel) {
                output[i] = floatBuffer.get();
            }
        }
    }

    @Override
    public void readBooleans(boolean[] output, int[] definitionLevels, int maxDefLevel) throws IOException {
        for (int i = 0; i < output.length; i++) {
            if (definitionLevels == null || definitionLevels[i] == maxDefLevel) {
                output[i] = readBoolean();
            }
        }
    }

    /**
     * Read BYTE_ARRAY, FIXED_LEN_BYTE_ARRAY, or INT96 values directly into a byte[][] array.
     */
    @Override
    public void readByteArrays(byte[][] output, int[] definitionLevels, int maxDefLevel) throws IOException {
        for (int i = 0; i < output.length; i++) {
            if (definitionLevels == null || definitionLevels[i] == maxDefLevel) {
                output[i] = readByteArrayValue();
            }
        }
    }

    /**
     * Read a single byte array value based on the physical type.
     */
    public byte[] readByteArrayValue() throws IOException {
        return switch (type) {
            case BYTE_ARRAY -> readByteArray();
            case FIXED_LEN_BYTE_ARRAY -> {
                if (typeLength == null) {
                    throw new MalformedEncodingException("FIXED_LEN_BYTE_ARRAY requires a type length");
                }
                yield BytesUtils.readFully(input, typeLength, "FIXED_LEN_BYTE_ARRAY");
            }
            case INT96 -> BytesUtils.readFully(input, 12, "INT96");
            default -> throw new UnsupportedOperationException("readByteArrays not supported for type: " + type);
        };
    }

    private ByteBuffer readValueBytes(int count, int width, String what) throws IOException {
        byte[] bytes = BytesUtils.readFully(input, count * width, what + " values");
        return ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    }

    private boolean readBoolean() throws IOException {
        // Booleans are bit-packed in PLAIN encoding (8 values per byte, LSB first)
        if (bitPosition == 8) {
            currentByte = input.read();
            if (currentByte == -1) {
                throw new MalformedEncodingException("Unexpected EOF while reading boolean");
            }
            bitPosition = 0;
        }

        boolean value = ((currentByte >> bitPosition) & 1) != 0;
        bitPosition++;
        return value;
    }

    private byte[] readByteArray() throws IOException {
        int length = BytesUtils.readIntLittleEndian(input);
        if (length < 0) {
            throw new MalformedEncodingException("Invalid BYTE_ARRAY length: " + length);
        }
        return BytesUtils.readFully(input, length, "BYTE_ARRAY data");
    }
}
