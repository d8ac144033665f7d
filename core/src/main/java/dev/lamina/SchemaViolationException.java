/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina;

import dev.lamina.schema.ColumnPath;

/**
 * Raised when a value does not match the shape of the schema it is written against,
 * or when a schema definition itself is invalid.
 */
public class SchemaViolationException extends IllegalArgumentException {

    private final ColumnPath path;

    public SchemaViolationException(ColumnPath path, String message) {
        super(path == null ? message : message + " [field=" + path + "]");
        this.path = path;
    }

    public SchemaViolationException(String message) {
        this(null, message);
    }

    /**
     * The path of the offending field, or null if the violation is not tied to a single field.
     */
    public ColumnPath getPath() {
        return path;
    }
}
