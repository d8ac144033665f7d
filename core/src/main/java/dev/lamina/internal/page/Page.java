/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.internal.page;

import dev.lamina.row.Binary;

/**
 * Sealed interface for decoded column page data with primitive arrays.
 * <p>
 * Values are stored in typed arrays with one slot per level entry; slots whose definition
 * level is below the maximum hold no value.
 * </p>
 * <ul>
 *   <li>{@link BooleanPage} - BOOLEAN</li>
 *   <li>{@link IntPage} - INT32</li>
 *   <li>{@link LongPage} - INT64</li>
 *   <li>{@link FloatPage} - FLOAT</li>
 *   <li>{@link DoublePage} - DOUBLE</li>
 *   <li>{@link ByteArrayPage} - BYTE_ARRAY, FIXED_LEN_BYTE_ARRAY, INT96</li>
 * </ul>
 */
public sealed interface Page {

    int size();

    int maxDefinitionLevel();

    /**
     * Definition levels, or null for columns whose maximum definition level is 0.
     */
    int[] definitionLevels();

    /**
     * Repetition levels, or null for columns whose maximum repetition level is 0.
     */
    int[] repetitionLevels();

    /**
     * The value at the given slot boxed the way record shredding produces it, or null.
     */
    Object getValue(int index);

    default boolean isNull(int index) {
        int[] defLevels = definitionLevels();
        if (defLevels == null) {
            return false;
        }
        return defLevels[index] < maxDefinitionLevel();
    }

    default int getDefinitionLevel(int index) {
        int[] defLevels = definitionLevels();
        return defLevels == null ? 0 : defLevels[index];
    }

    default int getRepetitionLevel(int index) {
        int[] repLevels = repetitionLevels();
        return repLevels == null ? 0 : repLevels[index];
    }

    record BooleanPage(boolean[] values, int[] definitionLevels, int[] repetitionLevels, int maxDefinitionLevel, int size)
            implements Page {
        public boolean get(int index) {
            return values[index];
        }

        @Override
        public Object getValue(int index) {
            return isNull(index) ? null : values[index];
        }
    }

    record IntPage(int[] values, int[] definitionLevels, int[] repetitionLevels, int maxDefinitionLevel, int size)
            implements Page {
        public int get(int index) {
            return values[index];
        }

        @Override
        public Object getValue(int index) {
            return isNull(index) ? null : values[index];
        }
    }

    record LongPage(long[] values, int[] definitionLevels, int[] repetitionLevels, int maxDefinitionLevel, int size)
            implements Page {
        public long get(int index) {
            return values[index];
        }

        @Override
        public Object getValue(int index) {
            return isNull(index) ? null : values[index];
        }
    }

    record FloatPage(float[] values, int[] definitionLevels, int[] repetitionLevels, int maxDefinitionLevel, int size)
            implements Page {
        public float get(int index) {
            return values[index];
        }

        @Override
        public Object getValue(int index) {
            return isNull(index) ? null : values[index];
        }
    }

    record DoublePage(double[] values, int[] definitionLevels, int[] repetitionLevels, int maxDefinitionLevel, int size)
            implements Page {
        public double get(int index) {
            return values[index];
        }

        @Override
        public Object getValue(int index) {
            return isNull(index) ? null : values[index];
        }
    }

    record ByteArrayPage(byte[][] values, int[] definitionLevels, int[] repetitionLevels, int maxDefinitionLevel, int size)
            implements Page {
        public byte[] get(int index) {
            return values[index];
        }

        @Override
        public Object getValue(int index) {
            return isNull(index) ? null : Binary.wrap(values[index]);
        }
    }
}
