/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.reader;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import dev.lamina.schema.ColumnPath;
import dev.lamina.schema.ColumnSchema;
import dev.lamina.schema.FileSchema;

/**
 * Selects the fields of a row group to read, as {@link ColumnPath}s. A path naming a group selects
 * every leaf column beneath it; column chunks outside of the selection are never fetched.
 *
 * <pre>{@code
 * ColumnProjection.all()
 * ColumnProjection.columns("Links.Forward", "Name")
 * ColumnProjection.paths(ColumnPath.of("Name", "Language", "Code"))
 * }</pre>
 */
public final class ColumnProjection {

    private static final ColumnProjection ALL = new ColumnProjection(List.of());

    private final List<ColumnPath> paths;

    private ColumnProjection(List<ColumnPath> paths) {
        this.paths = paths;
    }

    public static ColumnProjection all() {
        return ALL;
    }

    /**
     * Selects fields given in dot notation.
     *
     * @throws IllegalArgumentException if no path or an empty path is given
     */
    public static ColumnProjection columns(String... dottedPaths) {
        if (dottedPaths == null || dottedPaths.length == 0) {
            throw new IllegalArgumentException("At least one column must be selected");
        }
        List<ColumnPath> parsed = new ArrayList<>(dottedPaths.length);
        for (String dotted : dottedPaths) {
            parsed.add(ColumnPath.parse(dotted));
        }
        return new ColumnProjection(List.copyOf(parsed));
    }

    public static ColumnProjection paths(ColumnPath... paths) {
        if (paths == null || paths.length == 0) {
            throw new IllegalArgumentException("At least one column must be selected");
        }
        return new ColumnProjection(List.of(paths));
    }

    public boolean projectsAll() {
        return paths.isEmpty();
    }

    /**
     * Returns the selected paths; empty when all columns are projected.
     */
    public List<ColumnPath> getPaths() {
        return paths;
    }

    /**
     * Resolves the selection against a schema.
     *
     * @return one flag per leaf column of the schema, indexed by column index
     * @throws IllegalArgumentException if a selected path names no field of the schema
     */
    public boolean[] selectColumns(FileSchema schema) {
        boolean[] selected = new boolean[schema.getColumnCount()];
        if (projectsAll()) {
            Arrays.fill(selected, true);
            return selected;
        }
        for (ColumnPath path : paths) {
            boolean matched = false;
            for (ColumnSchema column : schema.getColumns()) {
                if (column.path().startsWith(path)) {
                    selected[column.columnIndex()] = true;
                    matched = true;
                }
            }
            if (!matched) {
                throw new IllegalArgumentException("Column not found in schema " + schema.getName() + ": " + path);
            }
        }
        return selected;
    }

    @Override
    public String toString() {
        return projectsAll() ? "ColumnProjection[all]" : "ColumnProjection" + paths;
    }
}
