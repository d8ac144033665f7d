/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.schema;

import org.junit.jupiter.api.Test;

import dev.lamina.SchemaViolationException;
import dev.lamina.metadata.LogicalType;
import dev.lamina.metadata.PhysicalType;
import dev.lamina.metadata.RepetitionType;
import dev.lamina.reader.ColumnProjection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for building, navigating and projecting schemas.
 */
class FileSchemaTest {

    private static FileSchema nested() {
        return FileSchema.builder("person")
                .required("id", PhysicalType.INT64)
                .optional("name", PhysicalType.BYTE_ARRAY, new LogicalType.StringType())
                .group("address", RepetitionType.OPTIONAL, address -> address
                        .required("city", PhysicalType.BYTE_ARRAY)
                        .optional("zip", PhysicalType.INT32))
                .group("phones", RepetitionType.REPEATED, phones -> phones
                        .required("number", PhysicalType.BYTE_ARRAY)
                        .repeated("tags", PhysicalType.BYTE_ARRAY))
                .build();
    }

    @Test
    void testColumnsInSchemaOrder() {
        FileSchema schema = nested();

        assertThat(schema.getColumns()).extracting(c -> c.path().toString())
                .containsExactly("id", "name", "address.city", "address.zip", "phones.number", "phones.tags");
        assertThat(schema.getColumns()).extracting(ColumnSchema::columnIndex).containsExactly(0, 1, 2, 3, 4, 5);
        assertThat(schema.isFlatSchema()).isFalse();
    }

    @Test
    void testLevelsCountOptionalAndRepeatedAncestors() {
        FileSchema schema = nested();

        assertThat(levels(schema.getColumn("id"))).containsExactly(0, 0);
        assertThat(levels(schema.getColumn("name"))).containsExactly(1, 0);
        assertThat(levels(schema.getColumn("address.city"))).containsExactly(1, 0);
        assertThat(levels(schema.getColumn("address.zip"))).containsExactly(2, 0);
        assertThat(levels(schema.getColumn("phones.number"))).containsExactly(1, 1);
        assertThat(levels(schema.getColumn("phones.tags"))).containsExactly(2, 2);
    }

    @Test
    void testLookupByPath() {
        FileSchema schema = nested();

        assertThat(schema.getColumn(ColumnPath.of("address", "zip")).type()).isEqualTo(PhysicalType.INT32);
        assertThat(schema.getField("address")).isInstanceOf(SchemaNode.GroupNode.class);
        assertThat(((SchemaNode.GroupNode) schema.getField("phones")).leafCount()).isEqualTo(2);
        assertThat(((SchemaNode.GroupNode) schema.getField("phones")).firstColumnIndex()).isEqualTo(4);
        assertThatThrownBy(() -> schema.getColumn("address.street"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testFlatSchema() {
        FileSchema schema = FileSchema.builder("flat")
                .required("a", PhysicalType.INT32)
                .optional("b", PhysicalType.DOUBLE)
                .build();

        assertThat(schema.isFlatSchema()).isTrue();
    }

    @Test
    void testInvalidDefinitionsAreRejected() {
        assertThatThrownBy(() -> FileSchema.builder("t")
                .required("a", PhysicalType.INT32)
                .optional("a", PhysicalType.INT64))
                .isInstanceOf(SchemaViolationException.class)
                .hasMessageContaining("Duplicate");
        assertThatThrownBy(() -> FileSchema.builder("t").group("g", RepetitionType.OPTIONAL, g -> {
        })).isInstanceOf(SchemaViolationException.class);
        assertThatThrownBy(() -> FileSchema.builder("t").build())
                .isInstanceOf(SchemaViolationException.class);
        assertThatThrownBy(() -> FileSchema.builder("t").required("x", PhysicalType.FIXED_LEN_BYTE_ARRAY))
                .isInstanceOf(SchemaViolationException.class);
        assertThatThrownBy(() -> FileSchema.builder("t").fixed("x", 0, RepetitionType.REQUIRED))
                .isInstanceOf(SchemaViolationException.class);
        assertThatThrownBy(() -> FileSchema.builder("t").required("a.b", PhysicalType.INT32))
                .isInstanceOf(SchemaViolationException.class);
        assertThatThrownBy(() -> FileSchema.builder("t").required("s", PhysicalType.INT32, new LogicalType.StringType()))
                .isInstanceOf(SchemaViolationException.class);
    }

    @Test
    void testSiblingsInDifferentGroupsMayShareNames() {
        FileSchema schema = FileSchema.builder("t")
                .group("a", RepetitionType.REQUIRED, a -> a.required("x", PhysicalType.INT32))
                .group("b", RepetitionType.REQUIRED, b -> b.required("x", PhysicalType.INT32))
                .build();

        assertThat(schema.getColumnCount()).isEqualTo(2);
    }

    @Test
    void testProjectionOfLeafAndGroup() {
        FileSchema schema = nested();
        ProjectedSchema projected = ProjectedSchema.create(schema, ColumnProjection.columns("name", "phones"));

        assertThat(projected.getProjectedColumns()).extracting(c -> c.path().toString())
                .containsExactly("name", "phones.number", "phones.tags");
        assertThat(projected.isProjected(0)).isFalse();
        assertThat(projected.isProjected(4)).isTrue();
        assertThat(projected.getRootNode().children()).extracting(SchemaNode::name)
                .containsExactly("name", "phones");
    }

    @Test
    void testProjectionKeepsOriginalIndexesAndLevels() {
        FileSchema schema = nested();
        ProjectedSchema projected = ProjectedSchema.create(schema, ColumnProjection.columns("address.zip"));

        SchemaNode.GroupNode address = (SchemaNode.GroupNode) projected.getRootNode().getChild("address");
        assertThat(address.children()).hasSize(1);
        SchemaNode.PrimitiveNode zip = (SchemaNode.PrimitiveNode) address.getChild("zip");
        assertThat(zip.columnIndex()).isEqualTo(3);
        assertThat(zip.maxDefinitionLevel()).isEqualTo(2);
    }

    @Test
    void testProjectAll() {
        FileSchema schema = nested();
        ProjectedSchema projected = ProjectedSchema.create(schema, ColumnProjection.all());

        assertThat(projected.getProjectedColumnCount()).isEqualTo(6);
        assertThat(projected.getRootNode()).isSameAs(schema.getRootNode());
    }

    @Test
    void testProjectionByPath() {
        FileSchema schema = nested();
        ColumnProjection projection = ColumnProjection.paths(ColumnPath.of("address", "city"), ColumnPath.of("phones"));

        assertThat(projection.projectsAll()).isFalse();
        assertThat(projection.getPaths()).containsExactly(ColumnPath.of("address", "city"), ColumnPath.of("phones"));
        assertThat(projection.selectColumns(schema)).containsExactly(false, false, true, false, true, true);
        assertThat(ColumnProjection.columns("address.city", "phones").getPaths())
                .isEqualTo(projection.getPaths());
        assertThat(ColumnProjection.all().getPaths()).isEmpty();
        assertThat(ColumnProjection.all().selectColumns(schema)).containsOnly(true);
    }

    @Test
    void testProjectionOfUnknownField() {
        FileSchema schema = nested();

        assertThatThrownBy(() -> ProjectedSchema.create(schema, ColumnProjection.columns("missing")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("missing");
        assertThatThrownBy(() -> ProjectedSchema.create(schema, ColumnProjection.columns("id.sub")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ColumnProjection.columns())
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static int[] levels(ColumnSchema column) {
        return new int[]{ column.maxDefinitionLevel(), column.maxRepetitionLevel() };
    }
}
