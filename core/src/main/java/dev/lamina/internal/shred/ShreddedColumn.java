/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.internal.shred;

import java.util.Arrays;

import dev.lamina.internal.page.Page;
import dev.lamina.schema.ColumnSchema;

/**
 * The striped form of one column: a sequence of (repetition level, definition level, value)
 * entries. The value is null exactly when the definition level is below the column maximum.
 */
public final class ShreddedColumn {

    private static final int INITIAL_CAPACITY = 64;

    private final ColumnSchema column;
    private int[] repetitionLevels = new int[INITIAL_CAPACITY];
    private int[] definitionLevels = new int[INITIAL_CAPACITY];
    private Object[] values = new Object[INITIAL_CAPACITY];
    private int size;

    public ShreddedColumn(ColumnSchema column) {
        this.column = column;
    }

    public ColumnSchema getColumn() {
        return column;
    }

    public void add(int repetitionLevel, int definitionLevel, Object value) {
        if (size == values.length) {
            int capacity = size * 2;
            repetitionLevels = Arrays.copyOf(repetitionLevels, capacity);
            definitionLevels = Arrays.copyOf(definitionLevels, capacity);
            values = Arrays.copyOf(values, capacity);
        }
        repetitionLevels[size] = repetitionLevel;
        definitionLevels[size] = definitionLevel;
        values[size] = value;
        size++;
    }

    /**
     * Appends all entries of a decoded page.
     */
    public void addPage(Page page) {
        for (int i = 0; i < page.size(); i++) {
            add(page.getRepetitionLevel(i), page.getDefinitionLevel(i), page.getValue(i));
        }
    }

    public int size() {
        return size;
    }

    public int getRepetitionLevel(int index) {
        checkIndex(index);
        return repetitionLevels[index];
    }

    public int getDefinitionLevel(int index) {
        checkIndex(index);
        return definitionLevels[index];
    }

    public Object getValue(int index) {
        checkIndex(index);
        return values[index];
    }

    /**
     * Returns true if the entry carries a value.
     */
    public boolean isDefined(int index) {
        return getDefinitionLevel(index) == column.maxDefinitionLevel();
    }

    /**
     * Number of entries that start a new record.
     */
    public int recordCount() {
        int count = 0;
        for (int i = 0; i < size; i++) {
            if (repetitionLevels[i] == 0) {
                count++;
            }
        }
        return count;
    }

    /**
     * Drops all entries from {@code newSize} on.
     */
    public void truncate(int newSize) {
        if (newSize < 0 || newSize > size) {
            throw new IndexOutOfBoundsException("Cannot truncate " + size + " entries to " + newSize);
        }
        Arrays.fill(values, newSize, size, null);
        size = newSize;
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds for " + size + " entries");
        }
    }

    @Override
    public String toString() {
        return "ShreddedColumn[" + column.path() + ", " + size + " entries]";
    }
}
