/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.schema;

import java.util.List;

import dev.lamina.metadata.LogicalType;
import dev.lamina.metadata.PhysicalType;
import dev.lamina.metadata.RepetitionType;

/**
 * Tree-based representation of a schema for nested data support.
 * Each node represents either a primitive column or a group.
 * <p>
 * Levels are computed when the tree is built: the maximum repetition level is the number of
 * REPEATED nodes from the root down to and including the node, the maximum definition level
 * the number of OPTIONAL or REPEATED ones.
 * </p>
 */
public sealed interface SchemaNode {

    String name();

    RepetitionType repetitionType();

    int maxDefinitionLevel();

    int maxRepetitionLevel();

    /**
     * Primitive leaf node representing an actual data column.
     */
    record PrimitiveNode(
            String name,
            PhysicalType type,
            Integer typeLength,
            RepetitionType repetitionType,
            LogicalType logicalType,
            int columnIndex,
            int maxDefinitionLevel,
            int maxRepetitionLevel) implements SchemaNode {
    }

    /**
     * Group node representing a struct, or a list of structs when repeated.
     */
    record GroupNode(
            String name,
            RepetitionType repetitionType,
            List<SchemaNode> children,
            int maxDefinitionLevel,
            int maxRepetitionLevel) implements SchemaNode {

        public GroupNode {
            children = List.copyOf(children);
        }

        /**
         * Returns the child with the given name, or null if there is none.
         */
        public SchemaNode getChild(String name) {
            for (SchemaNode child : children) {
                if (child.name().equals(name)) {
                    return child;
                }
            }
            return null;
        }

        /**
         * Returns the column index of the first leaf beneath this group, in schema order.
         */
        public int firstColumnIndex() {
            SchemaNode first = children.get(0);
            if (first instanceof PrimitiveNode primitive) {
                return primitive.columnIndex();
            }
            return ((GroupNode) first).firstColumnIndex();
        }

        /**
         * Returns the number of leaf columns beneath this group.
         */
        public int leafCount() {
            int count = 0;
            for (SchemaNode child : children) {
                if (child instanceof GroupNode group) {
                    count += group.leafCount();
                }
                else {
                    count++;
                }
            }
            return count;
        }
    }
}
