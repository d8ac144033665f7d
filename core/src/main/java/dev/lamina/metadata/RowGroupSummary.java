/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.metadata;

import java.util.List;

import dev.lamina.schema.ColumnPath;

/**
 * Metadata for a row group: one column chunk per leaf column, in schema order.
 */
public record RowGroupSummary(
        List<ColumnChunkSummary> columns,
        long numRows,
        long totalByteSize) {

    /**
     * Returns the chunk of the column with the given path.
     *
     * @throws IllegalArgumentException if the row group has no such column
     */
    public ColumnChunkSummary column(ColumnPath path) {
        for (ColumnChunkSummary column : columns) {
            if (column.path().equals(path)) {
                return column;
            }
        }
        throw new IllegalArgumentException("Column not found in row group: " + path);
    }
}
