/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.internal.page;

import java.io.ByteArrayInputStream;
import java.io.IOException;

import dev.lamina.EncodingNotSupportedException;
import dev.lamina.MalformedEncodingException;
import dev.lamina.internal.encoding.PlainDecoder;
import dev.lamina.internal.encoding.RleBitPackingHybridDecoder;
import dev.lamina.internal.encoding.ValueDecoder;
import dev.lamina.metadata.PhysicalType;

/**
 * Typed dictionary for dictionary-encoded columns.
 * Each variant holds a primitive array of dictionary values.
 */
public sealed interface Dictionary {

    int size();

    /**
     * Parse dictionary values from decompressed data.
     *
     * @param data decompressed dictionary page data
     * @param numValues number of dictionary entries
     * @param type physical type of the column
     * @param typeLength type length for fixed-length types (may be null for variable-length types)
     * @return typed dictionary
     * @throws MalformedEncodingException if the data cannot hold {@code numValues} entries
     */
    static Dictionary parse(byte[] data, int numValues, PhysicalType type, Integer typeLength) throws IOException {
        if (numValues < 0) {
            throw new MalformedEncodingException("Negative dictionary size: " + numValues);
        }
        long minimumBytes = (long) numValues * PageReader.minimumPlainWidth(type, typeLength);
        if (minimumBytes > data.length) {
            throw new MalformedEncodingException("Dictionary of " + numValues + " " + type + " entries needs at least "
                    + minimumBytes + " bytes, page holds " + data.length);
        }
        ByteArrayInputStream dataStream = new ByteArrayInputStream(data);
        PlainDecoder decoder = new PlainDecoder(dataStream, type, typeLength);

        return switch (type) {
            case INT32 -> {
                int[] values = new int[numValues];
                decoder.readInts(values, null, 0);
                yield new IntDictionary(values);
            }
            case INT64 -> {
                long[] values = new long[numValues];
                decoder.readLongs(values, null, 0);
                yield new LongDictionary(values);
            }
            case FLOAT -> {
                float[] values = new float[numValues];
                decoder.readFloats(values, null, 0);
                yield new FloatDictionary(values);
            }
            case DOUBLE -> {
                double[] values = new double[numValues];
                decoder.readDoubles(values, null, 0);
                yield new DoubleDictionary(values);
            }
            case BYTE_ARRAY, FIXED_LEN_BYTE_ARRAY, INT96 -> {
                byte[][] values = new byte[numValues][];
                decoder.readByteArrays(values, null, 0);
                yield new ByteArrayDictionary(values);
            }
            case BOOLEAN -> throw new EncodingNotSupportedException(
                    "Dictionary encoding not supported for BOOLEAN type");
        };
    }

    /**
     * Decodes the dictionary indexes of a data page and resolves them into a typed page.
     *
     * @throws MalformedEncodingException if an index is outside of the dictionary
     */
    default Page decodePage(RleBitPackingHybridDecoder indexDecoder, int numValues, int[] definitionLevels,
                            int[] repetitionLevels, int maxDefLevel) throws MalformedEncodingException {
        int nonNullCount = ValueDecoder.countNonNulls(definitionLevels, numValues, maxDefLevel);
        int[] indices = new int[nonNullCount];
        indexDecoder.readInts(indices, 0, nonNullCount);
        int size = size();
        for (int index : indices) {
            if (index < 0 || index >= size) {
                throw new MalformedEncodingException("Dictionary index " + Integer.toUnsignedString(index)
                        + " out of range for dictionary of size " + size);
            }
        }

        int idx = 0;
        if (this instanceof IntDictionary dict) {
            int[] values = new int[numValues];
            for (int i = 0; i < numValues; i++) {
                if (definitionLevels == null || definitionLevels[i] == maxDefLevel) {
                    values[i] = dict.values()[indices[idx++]];
                }
            }
            return new Page.IntPage(values, definitionLevels, repetitionLevels, maxDefLevel, numValues);
        }
        if (this instanceof LongDictionary dict) {
            long[] values = new long[numValues];
            for (int i = 0; i < numValues; i++) {
                if (definitionLevels == null || definitionLevels[i] == maxDefLevel) {
                    values[i] = dict.values()[indices[idx++]];
                }
            }
            return new Page.LongPage(values, definitionLevels, repetitionLevels, maxDefLevel, numValues);
        }
        if (this instanceof FloatDictionary dict) {
            float[] values = new float[numValues];
            for (int i = 0; i < numValues; i++) {
                if (definitionLevels == null || definitionLevels[i] == maxDefLevel) {
                    values[i] = dict.values()[indices[idx++]];
                }
            }
            return new Page.FloatPage(values, definitionLevels, repetitionLevels, maxDefLevel, numValues);
        }
        if (this instanceof DoubleDictionary dict) {
            double[] values = new double[numValues];
            for (int i = 0; i < numValues; i++) {
                if (definitionLevels == null || definitionLevels[i] == maxDefLevel) {
                    values[i] = dict.values()[indices[idx++]];
                }
            }
            return new Page.DoublePage(values, definitionLevels, repetitionLevels, maxDefLevel, numValues);
        }
        ByteArrayDictionary dict = (ByteArrayDictionary) this;
        byte[][] values = new byte[numValues][];
        for (int i = 0; i < numValues; i++) {
            if (definitionLevels == null || definitionLevels[i] == maxDefLevel) {
                values[i] = dict.values()[indices[idx++]];
            }
        }
        return new Page.ByteArrayPage(values, definitionLevels, repetitionLevels, maxDefLevel, numValues);
    }

    record IntDictionary(int[] values) implements Dictionary {
        @Override
        public int size() {
            return values.length;
        }
    }

    record LongDictionary(long[] values) implements Dictionary {
        @Override
        public int size() {
            return values.length;
        }
    }

    record FloatDictionary(float[] values) implements Dictionary {
        @Override
        public int size() {
            return values.length;
        }
    }

    record DoubleDictionary(double[] values) implements Dictionary {
        @Override
        public int size() {
            return values.length;
        }
    }

    record ByteArrayDictionary(byte[][] values) implements Dictionary {
        @Override
        public int size() {
            return values.length;
        }
    }
}
