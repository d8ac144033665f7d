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
import java.util.List;

import dev.lamina.reader.ColumnProjection;

/**
 * Represents a projected view of a schema containing only selected columns.
 *
 * <p>The projected tree keeps the original column indexes and levels of the retained
 * leaves, so level streams read from storage can be assembled against it directly.
 * Groups left without any projected leaf are dropped.</p>
 *
 * <p>Projecting a group includes all columns beneath it. For example, if "address" is a
 * group containing "city" and "street", projecting "address" includes both child columns.</p>
 */
public final class ProjectedSchema {

    private final FileSchema originalSchema;
    private final boolean[] projected;
    private final List<ColumnSchema> projectedColumns;
    private final SchemaNode.GroupNode rootNode;

    private ProjectedSchema(FileSchema originalSchema, boolean[] projected, List<ColumnSchema> projectedColumns,
                            SchemaNode.GroupNode rootNode) {
        this.originalSchema = originalSchema;
        this.projected = projected;
        this.projectedColumns = projectedColumns;
        this.rootNode = rootNode;
    }

    /**
     * Creates a projected schema from the given full schema and projection.
     *
     * @param schema the original schema
     * @param projection the column projection specifying which columns to include
     * @return a projected schema containing only the selected columns
     * @throws IllegalArgumentException if a projected column name is not found in the schema
     */
    public static ProjectedSchema create(FileSchema schema, ColumnProjection projection) {
        boolean[] projected = projection.selectColumns(schema);
        if (projection.projectsAll()) {
            return new ProjectedSchema(schema, projected, schema.getColumns(), schema.getRootNode());
        }

        List<ColumnSchema> projectedColumns = new ArrayList<>();
        for (ColumnSchema column : schema.getColumns()) {
            if (projected[column.columnIndex()]) {
                projectedColumns.add(column);
            }
        }

        SchemaNode.GroupNode root = schema.getRootNode();
        SchemaNode.GroupNode prunedRoot = new SchemaNode.GroupNode(root.name(), root.repetitionType(),
                pruneChildren(root, projected), root.maxDefinitionLevel(), root.maxRepetitionLevel());

        return new ProjectedSchema(schema, projected, Collections.unmodifiableList(projectedColumns), prunedRoot);
    }

    private static List<SchemaNode> pruneChildren(SchemaNode.GroupNode group, boolean[] projected) {
        List<SchemaNode> kept = new ArrayList<>();
        for (SchemaNode child : group.children()) {
            if (child instanceof SchemaNode.PrimitiveNode primitive) {
                if (projected[primitive.columnIndex()]) {
                    kept.add(primitive);
                }
            }
            else {
                SchemaNode.GroupNode childGroup = (SchemaNode.GroupNode) child;
                List<SchemaNode> grandChildren = pruneChildren(childGroup, projected);
                if (!grandChildren.isEmpty()) {
                    kept.add(new SchemaNode.GroupNode(childGroup.name(), childGroup.repetitionType(), grandChildren,
                            childGroup.maxDefinitionLevel(), childGroup.maxRepetitionLevel()));
                }
            }
        }
        return kept;
    }

    public FileSchema getOriginalSchema() {
        return originalSchema;
    }

    /**
     * Returns the projected columns in schema order.
     */
    public List<ColumnSchema> getProjectedColumns() {
        return projectedColumns;
    }

    public int getProjectedColumnCount() {
        return projectedColumns.size();
    }

    /**
     * Returns true if the column with the given original index is part of the projection.
     */
    public boolean isProjected(int originalIndex) {
        return projected[originalIndex];
    }

    /**
     * Returns the pruned schema tree.
     */
    public SchemaNode.GroupNode getRootNode() {
        return rootNode;
    }
}
