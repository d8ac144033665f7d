/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.schema;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Path of a field from the schema root (exclusive) down to the field itself,
 * rendered in dot notation, e.g. {@code Name.Language.Code}.
 */
public record ColumnPath(List<String> segments) {

    public ColumnPath {
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("Column path must have at least one segment");
        }
        segments = List.copyOf(segments);
    }

    public static ColumnPath of(String... segments) {
        return new ColumnPath(Arrays.asList(segments));
    }

    /**
     * Parses a path in dot notation.
     */
    public static ColumnPath parse(String dotted) {
        if (dotted == null || dotted.isEmpty()) {
            throw new IllegalArgumentException("Column path cannot be null or empty");
        }
        return new ColumnPath(Arrays.asList(dotted.split("\\.")));
    }

    /**
     * Returns the path of the child field with the given name.
     */
    public ColumnPath child(String name) {
        List<String> childSegments = new ArrayList<>(segments.size() + 1);
        childSegments.addAll(segments);
        childSegments.add(name);
        return new ColumnPath(childSegments);
    }

    /**
     * Name of the last segment.
     */
    public String leaf() {
        return segments.get(segments.size() - 1);
    }

    public int depth() {
        return segments.size();
    }

    /**
     * Returns true if this path equals the given path or lies beneath it.
     */
    public boolean startsWith(ColumnPath prefix) {
        return prefix.segments.size() <= segments.size()
                && segments.subList(0, prefix.segments.size()).equals(prefix.segments);
    }

    @Override
    public String toString() {
        return String.join(".", segments);
    }
}
