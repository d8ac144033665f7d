/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.internal.shred;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import dev.lamina.SchemaViolationException;
import dev.lamina.row.Binary;
import dev.lamina.row.PqStruct;
import dev.lamina.schema.ColumnPath;
import dev.lamina.schema.ColumnSchema;
import dev.lamina.schema.FileSchema;
import dev.lamina.schema.SchemaNode;

/**
 * Splits records into one {@link ShreddedColumn} per leaf column.
 *
 * <p>Every leaf receives at least one entry per record. A missing optional field, an empty
 * repeated field and a missing ancestor all produce a single entry without value whose
 * definition level tells how much of the path was present. Elements after the first of a
 * repeated field carry that field's repetition level.</p>
 *
 * <p>A record that violates the schema is rejected as a whole: the columns are truncated
 * back to where they were before the record.</p>
 */
public class RecordShredder {

    private final FileSchema schema;
    private final Map<SchemaNode, ColumnPath> paths = new IdentityHashMap<>();
    private List<ShreddedColumn> columns;
    private int recordCount;

    public RecordShredder(FileSchema schema) {
        this.schema = schema;
        for (SchemaNode child : schema.getRootNode().children()) {
            registerPaths(child, null);
        }
        this.columns = newColumns();
    }

    private void registerPaths(SchemaNode node, ColumnPath parent) {
        ColumnPath path = parent == null ? ColumnPath.of(node.name()) : parent.child(node.name());
        paths.put(node, path);
        if (node instanceof SchemaNode.GroupNode group) {
            for (SchemaNode child : group.children()) {
                registerPaths(child, path);
            }
        }
    }

    private List<ShreddedColumn> newColumns() {
        List<ShreddedColumn> result = new ArrayList<>(schema.getColumnCount());
        for (ColumnSchema column : schema.getColumns()) {
            result.add(new ShreddedColumn(column));
        }
        return result;
    }

    /**
     * Shreds one record, appending its entries to every column.
     *
     * @throws SchemaViolationException if the record does not match the schema; no column is modified
     */
    public void shred(PqStruct record) {
        if (record == null) {
            throw new SchemaViolationException("Record must not be null");
        }
        int[] marks = new int[columns.size()];
        for (int i = 0; i < marks.length; i++) {
            marks[i] = columns.get(i).size();
        }
        try {
            writeGroup(schema.getRootNode(), null, record, 0, 0);
        }
        catch (SchemaViolationException e) {
            for (int i = 0; i < marks.length; i++) {
                columns.get(i).truncate(marks[i]);
            }
            throw e;
        }
        recordCount++;
    }

    public int getRecordCount() {
        return recordCount;
    }

    public ShreddedColumn getColumn(int index) {
        return columns.get(index);
    }

    public List<ShreddedColumn> getColumns() {
        return columns;
    }

    /**
     * Returns the columns shredded so far and starts over with empty ones.
     */
    public List<ShreddedColumn> drain() {
        List<ShreddedColumn> drained = columns;
        columns = newColumns();
        recordCount = 0;
        return drained;
    }

    private void writeGroup(SchemaNode.GroupNode group, ColumnPath groupPath, PqStruct struct, int rep, int def) {
        for (String name : struct.fieldNames()) {
            if (group.getChild(name) == null) {
                ColumnPath path = groupPath == null ? ColumnPath.of(name) : groupPath.child(name);
                throw new SchemaViolationException(path, "Field is not part of the schema");
            }
        }
        for (SchemaNode child : group.children()) {
            writeField(child, struct.get(child.name()), rep, def);
        }
    }

    private void writeField(SchemaNode node, Object value, int rep, int def) {
        switch (node.repetitionType()) {
            case REQUIRED -> {
                if (value == null) {
                    throw new SchemaViolationException(paths.get(node), "Required field is missing");
                }
                writeNode(node, value, rep, def);
            }
            case OPTIONAL -> {
                if (value == null) {
                    writeNull(node, rep, def);
                }
                else {
                    writeNode(node, value, rep, node.maxDefinitionLevel());
                }
            }
            case REPEATED -> {
                if (value != null && !(value instanceof List)) {
                    throw new SchemaViolationException(paths.get(node),
                            "Repeated field requires a list, got " + value.getClass().getSimpleName());
                }
                List<?> elements = value == null ? List.of() : (List<?>) value;
                if (elements.isEmpty()) {
                    writeNull(node, rep, def);
                    return;
                }
                for (int i = 0; i < elements.size(); i++) {
                    Object element = elements.get(i);
                    if (element == null) {
                        throw new SchemaViolationException(paths.get(node), "Repeated field contains a null element at index " + i);
                    }
                    writeNode(node, element, i == 0 ? rep : node.maxRepetitionLevel(), node.maxDefinitionLevel());
                }
            }
        }
    }

    /**
     * Writes a present value of the node: a leaf value or the fields of a group.
     */
    private void writeNode(SchemaNode node, Object value, int rep, int def) {
        if (node instanceof SchemaNode.PrimitiveNode primitive) {
            columns.get(primitive.columnIndex()).add(rep, def, checkValue(primitive, value));
        }
        else {
            if (!(value instanceof PqStruct struct)) {
                throw new SchemaViolationException(paths.get(node),
                        "Group field requires a struct, got " + value.getClass().getSimpleName());
            }
            writeGroup((SchemaNode.GroupNode) node, paths.get(node), struct, rep, def);
        }
    }

    /**
     * Writes one entry without value to every leaf beneath the node.
     */
    private void writeNull(SchemaNode node, int rep, int def) {
        if (node instanceof SchemaNode.PrimitiveNode primitive) {
            columns.get(primitive.columnIndex()).add(rep, def, null);
        }
        else {
            for (SchemaNode child : ((SchemaNode.GroupNode) node).children()) {
                writeNull(child, rep, def);
            }
        }
    }

    private Object checkValue(SchemaNode.PrimitiveNode node, Object value) {
        boolean matches = switch (node.type()) {
            case BOOLEAN -> value instanceof Boolean;
            case INT32 -> value instanceof Integer;
            case INT64 -> value instanceof Long;
            case FLOAT -> value instanceof Float;
            case DOUBLE -> value instanceof Double;
            case BYTE_ARRAY -> value instanceof Binary || value instanceof String;
            case INT96 -> value instanceof Binary binary && binary.length() == 12;
            case FIXED_LEN_BYTE_ARRAY -> value instanceof Binary binary && binary.length() == node.typeLength();
        };
        if (!matches) {
            String actual = value instanceof Binary binary
                    ? "binary of " + binary.length() + " bytes"
                    : value.getClass().getSimpleName();
            throw new SchemaViolationException(paths.get(node), "Value of type " + actual
                    + " does not match column type " + node.type()
                    + (node.typeLength() != null ? "(" + node.typeLength() + ")" : ""));
        }
        return value instanceof String s ? Binary.fromString(s) : value;
    }
}
