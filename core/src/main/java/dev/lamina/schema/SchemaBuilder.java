/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.schema;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

import dev.lamina.SchemaViolationException;
import dev.lamina.metadata.LogicalType;
import dev.lamina.metadata.PhysicalType;
import dev.lamina.metadata.RepetitionType;

/**
 * Fluent builder for schemas.
 *
 * <pre>{@code
 * FileSchema schema = FileSchema.builder("Document")
 *         .required("DocId", PhysicalType.INT64)
 *         .group("Name", RepetitionType.REPEATED, name -> name
 *                 .optional("Url", PhysicalType.BYTE_ARRAY, new LogicalType.StringType()))
 *         .build();
 * }</pre>
 *
 * Invalid definitions (duplicate sibling names, empty groups, a missing length for
 * FIXED_LEN_BYTE_ARRAY, logical types not matching the physical type) are rejected
 * with a {@link SchemaViolationException}.
 */
public final class SchemaBuilder {

    private final String name;
    private final List<FieldDefinition> fields = new ArrayList<>();
    private final Set<String> names = new HashSet<>();

    SchemaBuilder(String name) {
        this.name = name;
    }

    public SchemaBuilder required(String name, PhysicalType type) {
        return primitive(name, type, RepetitionType.REQUIRED, null);
    }

    public SchemaBuilder required(String name, PhysicalType type, LogicalType logicalType) {
        return primitive(name, type, RepetitionType.REQUIRED, logicalType);
    }

    public SchemaBuilder optional(String name, PhysicalType type) {
        return primitive(name, type, RepetitionType.OPTIONAL, null);
    }

    public SchemaBuilder optional(String name, PhysicalType type, LogicalType logicalType) {
        return primitive(name, type, RepetitionType.OPTIONAL, logicalType);
    }

    public SchemaBuilder repeated(String name, PhysicalType type) {
        return primitive(name, type, RepetitionType.REPEATED, null);
    }

    public SchemaBuilder repeated(String name, PhysicalType type, LogicalType logicalType) {
        return primitive(name, type, RepetitionType.REPEATED, logicalType);
    }

    public SchemaBuilder primitive(String name, PhysicalType type, RepetitionType repetition, LogicalType logicalType) {
        if (type == PhysicalType.FIXED_LEN_BYTE_ARRAY) {
            throw new SchemaViolationException("FIXED_LEN_BYTE_ARRAY field '" + name + "' requires a length, use fixed()");
        }
        return add(new FieldDefinition(name, repetition, type, null, logicalType, null));
    }

    /**
     * Adds a FIXED_LEN_BYTE_ARRAY field of the given byte length.
     */
    public SchemaBuilder fixed(String name, int length, RepetitionType repetition, LogicalType logicalType) {
        if (length <= 0) {
            throw new SchemaViolationException("Length of FIXED_LEN_BYTE_ARRAY field '" + name + "' must be positive: " + length);
        }
        return add(new FieldDefinition(name, repetition, PhysicalType.FIXED_LEN_BYTE_ARRAY, length, logicalType, null));
    }

    public SchemaBuilder fixed(String name, int length, RepetitionType repetition) {
        return fixed(name, length, repetition, null);
    }

    /**
     * Adds a group field whose children are defined by the given callback.
     */
    public SchemaBuilder group(String name, RepetitionType repetition, Consumer<SchemaBuilder> children) {
        SchemaBuilder nested = new SchemaBuilder(name);
        children.accept(nested);
        if (nested.fields.isEmpty()) {
            throw new SchemaViolationException("Group '" + name + "' must have at least one field");
        }
        return add(new FieldDefinition(name, repetition, null, null, null, List.copyOf(nested.fields)));
    }

    public FileSchema build() {
        if (fields.isEmpty()) {
            throw new SchemaViolationException("Schema '" + name + "' must have at least one field");
        }
        return FileSchema.fromDefinitions(name, fields);
    }

    private SchemaBuilder add(FieldDefinition field) {
        if (field.name() == null || field.name().isEmpty() || field.name().contains(".")) {
            throw new SchemaViolationException("Invalid field name: '" + field.name() + "'");
        }
        if (field.repetition() == null) {
            throw new SchemaViolationException("Field '" + field.name() + "' has no repetition type");
        }
        if (field.logicalType() != null && !field.logicalType().appliesTo(field.type())) {
            throw new SchemaViolationException("Logical type " + field.logicalType() + " cannot annotate "
                    + field.type() + " field '" + field.name() + "'");
        }
        if (!names.add(field.name())) {
            throw new SchemaViolationException("Duplicate field name '" + field.name() + "' in group '" + name + "'");
        }
        fields.add(field);
        return this;
    }

    /**
     * A field as declared, before levels and column indexes are assigned.
     * Groups have a null type and a non-null list of children.
     */
    record FieldDefinition(
            String name,
            RepetitionType repetition,
            PhysicalType type,
            Integer typeLength,
            LogicalType logicalType,
            List<FieldDefinition> children) {

        boolean isGroup() {
            return children != null;
        }
    }
}
