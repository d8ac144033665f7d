/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.internal.encoding;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import dev.lamina.metadata.Encoding;
import dev.lamina.metadata.PhysicalType;
import dev.lamina.row.Binary;

/**
 * Dictionary encoder for one column chunk.
 * <p>
 * Distinct values receive indexes in order of first occurrence. Data pages are encoded as one
 * byte holding the index bit width followed by the indexes in RLE/bit-packed hybrid encoding.
 * The dictionary itself is written PLAIN encoded by {@link #dictionaryPageBytes(int)}.
 * </p>
 * <p>
 * Floating point values are keyed by their raw bit pattern, so {@code -0.0} and {@code 0.0}
 * are distinct entries and NaN payloads survive the round trip.
 * </p>
 */
public class DictionaryEncoder implements ValueEncoder {

    private final PhysicalType type;
    private final Integer typeLength;
    private final Map<Object, Integer> indexes = new HashMap<>();
    private final List<Object> entries = new ArrayList<>();

    private int[] bufferedIndexes = new int[256];
    private int bufferedCount;
    private long dictionaryByteSize;

    public DictionaryEncoder(PhysicalType type, Integer typeLength) {
        if (type == PhysicalType.BOOLEAN) {
            throw new IllegalArgumentException("BOOLEAN columns cannot be dictionary encoded");
        }
        this.type = type;
        this.typeLength = typeLength;
    }

    /**
     * Appends the value to the current page, adding it to the dictionary if it is new.
     */
    @Override
    public void writeValue(Object value) {
        Object key = key(value);
        Integer index = indexes.get(key);
        if (index == null) {
            index = entries.size();
            indexes.put(key, index);
            entries.add(value);
            dictionaryByteSize += plainSize(value);
        }
        if (bufferedCount == bufferedIndexes.length) {
            bufferedIndexes = Arrays.copyOf(bufferedIndexes, bufferedCount * 2);
        }
        bufferedIndexes[bufferedCount++] = index;
    }

    @Override
    public void writeInt(int value) {
        writeValue(value);
    }

    @Override
    public void writeLong(long value) {
        writeValue(value);
    }

    @Override
    public void writeFloat(float value) {
        writeValue(value);
    }

    @Override
    public void writeDouble(double value) {
        writeValue(value);
    }

    @Override
    public void writeBinary(Binary value) {
        writeValue(value);
    }

    public int getDictionarySize() {
        return entries.size();
    }

    /**
     * Size of the dictionary when written PLAIN encoded.
     */
    public long getDictionaryByteSize() {
        return dictionaryByteSize;
    }

    /**
     * Bit width used for indexes into a dictionary of the given size.
     */
    public static int indexBitWidth(int dictionarySize) {
        if (dictionarySize == 0) {
            return 0;
        }
        return Math.max(1, BytesUtils.bitWidth(dictionarySize - 1));
    }

    @Override
    public int getEstimatedSize() {
        return 1 + (bufferedCount * indexBitWidth(entries.size()) + 7) / 8;
    }

    @Override
    public byte[] toBytes() {
        int bitWidth = indexBitWidth(entries.size());
        RleBitPackingHybridEncoder encoder = new RleBitPackingHybridEncoder(bitWidth);
        for (int i = 0; i < bufferedCount; i++) {
            encoder.writeInt(bufferedIndexes[i]);
        }
        byte[] runs = encoder.toBytes();
        byte[] result = new byte[runs.length + 1];
        result[0] = (byte) bitWidth;
        System.arraycopy(runs, 0, result, 1, runs.length);
        return result;
    }

    /**
     * Drops the indexes buffered for the current page. Dictionary entries are kept.
     */
    @Override
    public void reset() {
        bufferedCount = 0;
    }

    /**
     * Removes all entries added after the dictionary held {@code size} entries.
     */
    public void truncate(int size) {
        while (entries.size() > size) {
            Object removed = entries.remove(entries.size() - 1);
            indexes.remove(key(removed));
            dictionaryByteSize -= plainSize(removed);
        }
    }

    /**
     * PLAIN encoding of the first {@code entryCount} dictionary entries.
     */
    public byte[] dictionaryPageBytes(int entryCount) {
        PlainEncoder plain = new PlainEncoder(type, typeLength);
        for (int i = 0; i < entryCount; i++) {
            plain.writeValue(entries.get(i));
        }
        return plain.toBytes();
    }

    @Override
    public Encoding getEncoding() {
        return Encoding.RLE_DICTIONARY;
    }

    private static Object key(Object value) {
        if (value instanceof Float f) {
            return Float.floatToRawIntBits(f);
        }
        if (value instanceof Double d) {
            return Double.doubleToRawLongBits(d);
        }
        return value;
    }

    private int plainSize(Object value) {
        if (value instanceof Binary binary) {
            return type == PhysicalType.BYTE_ARRAY ? 4 + binary.length() : binary.length();
        }
        return type.getByteWidth();
    }
}
