/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.writer;

import dev.lamina.metadata.PhysicalType;
import dev.lamina.metadata.Statistics;
import dev.lamina.row.Binary;

/**
 * Running min, max and null count of a column chunk, compared by the physical ordering of the type.
 */
final class StatisticsAccumulator {

    private final PhysicalType type;
    private Object min;
    private Object max;
    private long nullCount;

    StatisticsAccumulator(PhysicalType type) {
        this.type = type;
    }

    void addNull() {
        nullCount++;
    }

    void add(Object value) {
        if (isNaN(value)) {
            return;
        }
        if (min == null || compare(value, min) < 0) {
            min = value;
        }
        if (max == null || compare(value, max) > 0) {
            max = value;
        }
    }

    long getNullCount() {
        return nullCount;
    }

    Statistics freeze(Long distinctCount) {
        return new Statistics(min, max, nullCount, distinctCount);
    }

    private static boolean isNaN(Object value) {
        if (value instanceof Float f) {
            return f.isNaN();
        }
        if (value instanceof Double d) {
            return d.isNaN();
        }
        return false;
    }

    private int compare(Object left, Object right) {
        return switch (type) {
            case BOOLEAN -> Boolean.compare((Boolean) left, (Boolean) right);
            case INT32 -> Integer.compare((Integer) left, (Integer) right);
            case INT64 -> Long.compare((Long) left, (Long) right);
            case FLOAT -> Float.compare((Float) left, (Float) right);
            case DOUBLE -> Double.compare((Double) left, (Double) right);
            case BYTE_ARRAY, FIXED_LEN_BYTE_ARRAY, INT96 -> ((Binary) left).compareTo((Binary) right);
        };
    }
}
