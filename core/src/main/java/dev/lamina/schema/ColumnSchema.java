/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.schema;

import dev.lamina.metadata.LogicalType;
import dev.lamina.metadata.PhysicalType;
import dev.lamina.metadata.RepetitionType;

/**
 * Describes a leaf column of a schema. Stores computed definition
 * and repetition levels based on schema hierarchy.
 *
 * @param typeLength byte length for FIXED_LEN_BYTE_ARRAY columns, null otherwise
 */
public record ColumnSchema(
        ColumnPath path,
        PhysicalType type,
        RepetitionType repetitionType,
        Integer typeLength,
        int columnIndex,
        int maxDefinitionLevel,
        int maxRepetitionLevel,
        LogicalType logicalType) {

    /**
     * Name of the leaf field.
     */
    public String name() {
        return path.leaf();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(repetitionType.name().toLowerCase());
        sb.append(" ");
        sb.append(type.name().toLowerCase());
        if (typeLength != null) {
            sb.append("(").append(typeLength).append(")");
        }
        sb.append(" ");
        sb.append(path);
        if (logicalType != null) {
            sb.append(" (").append(logicalType).append(")");
        }
        sb.append(";");
        return sb.toString();
    }
}
