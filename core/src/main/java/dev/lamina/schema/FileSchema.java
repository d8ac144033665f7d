/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import dev.lamina.metadata.RepetitionType;
import dev.lamina.schema.SchemaBuilder.FieldDefinition;

/**
 * Root schema container: the schema tree plus the flat list of leaf column descriptors
 * derived from it. Immutable and safe to share between threads.
 */
public class FileSchema {

    private final String name;
    private final List<ColumnSchema> columns;
    private final Map<String, Integer> columnPathToIndex;
    private final SchemaNode.GroupNode rootNode;

    private FileSchema(String name, List<ColumnSchema> columns, SchemaNode.GroupNode rootNode) {
        this.name = name;
        this.columns = Collections.unmodifiableList(columns);
        this.rootNode = rootNode;

        this.columnPathToIndex = new HashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            columnPathToIndex.put(columns.get(i).path().toString(), i);
        }
    }

    /**
     * Starts building a schema whose root group has the given name.
     */
    public static SchemaBuilder builder(String name) {
        return new SchemaBuilder(name);
    }

    public String getName() {
        return name;
    }

    public List<ColumnSchema> getColumns() {
        return columns;
    }

    public ColumnSchema getColumn(int index) {
        return columns.get(index);
    }

    /**
     * Returns the leaf column with the given dotted path.
     */
    public ColumnSchema getColumn(String path) {
        Integer index = columnPathToIndex.get(path);
        if (index == null) {
            throw new IllegalArgumentException("Column not found: " + path);
        }
        return columns.get(index);
    }

    public ColumnSchema getColumn(ColumnPath path) {
        return getColumn(path.toString());
    }

    public int getColumnCount() {
        return columns.size();
    }

    /**
     * Returns the hierarchical schema tree representation.
     */
    public SchemaNode.GroupNode getRootNode() {
        return rootNode;
    }

    /**
     * Finds a top-level field by name in the schema tree.
     */
    public SchemaNode getField(String name) {
        SchemaNode child = rootNode.getChild(name);
        if (child == null) {
            throw new IllegalArgumentException("Field not found: " + name);
        }
        return child;
    }

    /**
     * Returns true if no column is nested in a group or repeated.
     */
    public boolean isFlatSchema() {
        for (SchemaNode child : rootNode.children()) {
            if (child instanceof SchemaNode.GroupNode) {
                return false;
            }
        }
        for (ColumnSchema col : columns) {
            if (col.maxRepetitionLevel() > 0) {
                return false;
            }
        }
        return true;
    }

    static FileSchema fromDefinitions(String name, List<FieldDefinition> fields) {
        // Build hierarchical tree and flat column list simultaneously
        List<ColumnSchema> columns = new ArrayList<>();
        int[] columnIndex = { 0 }; // Mutable counter for column indexing

        List<SchemaNode> rootChildren = buildChildren(fields, null, 0, 0, columns, columnIndex);

        SchemaNode.GroupNode rootNode = new SchemaNode.GroupNode(
                name,
                RepetitionType.REQUIRED,
                rootChildren,
                0, // Root has def level 0
                0 // Root has rep level 0
        );

        return new FileSchema(name, columns, rootNode);
    }

    /**
     * Build children nodes from field definitions.
     */
    private static List<SchemaNode> buildChildren(
                                                  List<FieldDefinition> fields,
                                                  ColumnPath parentPath,
                                                  int parentDefLevel,
                                                  int parentRepLevel,
                                                  List<ColumnSchema> columns,
                                                  int[] columnIndex) {

        List<SchemaNode> children = new ArrayList<>();

        for (FieldDefinition field : fields) {
            RepetitionType repType = field.repetition();
            ColumnPath path = parentPath == null ? ColumnPath.of(field.name()) : parentPath.child(field.name());

            // Calculate levels for this node
            int defLevel = parentDefLevel + (repType != RepetitionType.REQUIRED ? 1 : 0);
            int repLevel = parentRepLevel + (repType == RepetitionType.REPEATED ? 1 : 0);

            if (!field.isGroup()) {
                // Primitive node - represents an actual column
                int colIdx = columnIndex[0]++;
                columns.add(new ColumnSchema(
                        path,
                        field.type(),
                        repType,
                        field.typeLength(),
                        colIdx,
                        defLevel,
                        repLevel,
                        field.logicalType()));

                children.add(new SchemaNode.PrimitiveNode(
                        field.name(),
                        field.type(),
                        field.typeLength(),
                        repType,
                        field.logicalType(),
                        colIdx,
                        defLevel,
                        repLevel));
            }
            else {
                // Group node - recurse into children
                List<SchemaNode> groupChildren = buildChildren(
                        field.children(),
                        path,
                        defLevel,
                        repLevel,
                        columns,
                        columnIndex);

                children.add(new SchemaNode.GroupNode(
                        field.name(),
                        repType,
                        groupChildren,
                        defLevel,
                        repLevel));
            }
        }

        return children;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("message ").append(name).append(" {\n");
        for (SchemaNode child : rootNode.children()) {
            appendNode(sb, child, 1);
        }
        sb.append("}");
        return sb.toString();
    }

    private void appendNode(StringBuilder sb, SchemaNode node, int indent) {
        String prefix = "  ".repeat(indent);
        sb.append(prefix);
        sb.append(node.repetitionType().name().toLowerCase());
        if (node instanceof SchemaNode.GroupNode group) {
            sb.append(" group ").append(group.name());
            sb.append(" {\n");
            for (SchemaNode child : group.children()) {
                appendNode(sb, child, indent + 1);
            }
            sb.append(prefix).append("}\n");
        }
        else {
            SchemaNode.PrimitiveNode prim = (SchemaNode.PrimitiveNode) node;
            sb.append(" ").append(prim.type().name().toLowerCase());
            if (prim.typeLength() != null) {
                sb.append("(").append(prim.typeLength()).append(")");
            }
            sb.append(" ").append(prim.name());
            if (prim.logicalType() != null) {
                sb.append(" (").append(prim.logicalType()).append(")");
            }
            sb.append(";\n");
        }
    }
}
