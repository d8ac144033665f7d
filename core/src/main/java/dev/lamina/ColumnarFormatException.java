/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina;

import java.io.IOException;

import dev.lamina.schema.ColumnPath;

/**
 * Base class for errors raised while reading columnar data.
 * <p>
 * Carries the path of the column and the offset of the page that failed, when known.
 * Decoders deep in the stack usually don't know either; the page and chunk readers
 * attach them via {@link #locate(ColumnPath, long)} while the exception propagates.
 * </p>
 */
public class ColumnarFormatException extends IOException {

    public static final long UNKNOWN_OFFSET = -1;

    private ColumnPath columnPath;
    private long pageOffset = UNKNOWN_OFFSET;

    public ColumnarFormatException(String message) {
        super(message);
    }

    public ColumnarFormatException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Attaches location information, keeping any location that was set closer to the failure.
     *
     * @return this exception
     */
    public ColumnarFormatException locate(ColumnPath columnPath, long pageOffset) {
        if (this.columnPath == null) {
            this.columnPath = columnPath;
        }
        if (this.pageOffset == UNKNOWN_OFFSET) {
            this.pageOffset = pageOffset;
        }
        return this;
    }

    /**
     * The path of the affected column, or null if unknown.
     */
    public ColumnPath getColumnPath() {
        return columnPath;
    }

    /**
     * The byte offset of the affected page, or {@link #UNKNOWN_OFFSET}.
     */
    public long getPageOffset() {
        return pageOffset;
    }

    @Override
    public String getMessage() {
        String message = super.getMessage();
        if (columnPath == null && pageOffset == UNKNOWN_OFFSET) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message);
        sb.append(" [");
        if (columnPath != null) {
            sb.append("column=").append(columnPath);
        }
        if (pageOffset != UNKNOWN_OFFSET) {
            if (columnPath != null) {
                sb.append(", ");
            }
            sb.append("pageOffset=").append(pageOffset);
        }
        sb.append("]");
        return sb.toString();
    }
}
