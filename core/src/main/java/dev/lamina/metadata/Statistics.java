/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.metadata;

/**
 * Statistics of a column chunk, frozen when the chunk is closed.
 * <p>
 * Min and max hold the boxed physical value ({@code Integer}, {@code Long}, {@code Float},
 * {@code Double}, {@code Boolean} or {@link dev.lamina.row.Binary}) and are null when the
 * chunk holds no non-null value.
 * </p>
 *
 * @param distinctCount number of distinct values when known exactly, null otherwise
 */
public record Statistics(
        Object min,
        Object max,
        long nullCount,
        Long distinctCount) {

    public boolean hasMinMax() {
        return min != null && max != null;
    }
}
