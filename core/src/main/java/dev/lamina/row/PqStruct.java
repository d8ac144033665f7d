/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.row;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable nested record: an ordered mapping from field names to values.
 * <p>
 * Values use the boxed physical representation: {@code Boolean}, {@code Integer}, {@code Long},
 * {@code Float}, {@code Double} and {@link Binary} for leaves, {@code PqStruct} for groups and
 * {@code List} for repeated fields. Absent fields are not stored; setting a field to null
 * removes it.
 * </p>
 *
 * <pre>{@code
 * PqStruct doc = PqStruct.builder()
 *         .set("DocId", 10L)
 *         .set("Name", List.of(
 *                 PqStruct.builder().set("Url", Binary.fromString("http://A")).build()))
 *         .build();
 * }</pre>
 */
public final class PqStruct {

    private static final PqStruct EMPTY = new PqStruct(Collections.emptyMap());

    private final Map<String, Object> fields;

    private PqStruct(Map<String, Object> fields) {
        this.fields = fields;
    }

    public static PqStruct empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the value of the field, or null if it is absent.
     */
    public Object get(String name) {
        return fields.get(name);
    }

    /**
     * Returns true if the field is present.
     */
    public boolean has(String name) {
        return fields.containsKey(name);
    }

    /**
     * Returns the names of the present fields, in insertion order.
     */
    public Set<String> fieldNames() {
        return fields.keySet();
    }

    public int size() {
        return fields.size();
    }

    // ==================== Primitive Types ====================

    /**
     * Get an INT32 field value by name.
     *
     * @throws NullPointerException if the field is absent
     * @throws IllegalArgumentException if the field does not hold an INT32 value
     */
    public int getInt(String name) {
        return require(name, Integer.class);
    }

    public long getLong(String name) {
        return require(name, Long.class);
    }

    public float getFloat(String name) {
        return require(name, Float.class);
    }

    public double getDouble(String name) {
        return require(name, Double.class);
    }

    public boolean getBoolean(String name) {
        return require(name, Boolean.class);
    }

    public Binary getBinary(String name) {
        return require(name, Binary.class);
    }

    /**
     * Get a BYTE_ARRAY field decoded as UTF-8.
     */
    public String getString(String name) {
        return require(name, Binary.class).toStringUtf8();
    }

    // ==================== Nested Types ====================

    public PqStruct getStruct(String name) {
        return require(name, PqStruct.class);
    }

    /**
     * Get a repeated field. Returns an empty list if the field is absent.
     */
    @SuppressWarnings("unchecked")
    public List<Object> getList(String name) {
        Object value = fields.get(name);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?>)) {
            throw new IllegalArgumentException("Field '" + name + "' is not a list: " + value.getClass().getSimpleName());
        }
        return (List<Object>) value;
    }

    /**
     * Get a repeated group field as structs.
     */
    public List<PqStruct> getStructs(String name) {
        List<Object> values = getList(name);
        List<PqStruct> structs = new ArrayList<>(values.size());
        for (Object value : values) {
            structs.add((PqStruct) value);
        }
        return structs;
    }

    private <T> T require(String name, Class<T> type) {
        Object value = fields.get(name);
        if (value == null) {
            throw new NullPointerException("Field '" + name + "' is absent");
        }
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException("Field '" + name + "' is not of type " + type.getSimpleName()
                    + ": " + value.getClass().getSimpleName());
        }
        return type.cast(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof PqStruct other && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return fields.toString();
    }

    /**
     * Builder for {@link PqStruct}. Lists passed to {@link #set(String, Object)} are copied.
     */
    public static final class Builder {

        private final Map<String, Object> fields = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder set(String name, Object value) {
            if (value == null) {
                fields.remove(name);
            }
            else if (value instanceof List<?> list) {
                fields.put(name, Collections.unmodifiableList(new ArrayList<Object>(list)));
            }
            else {
                fields.put(name, value);
            }
            return this;
        }

        public PqStruct build() {
            return new PqStruct(Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
        }
    }
}
