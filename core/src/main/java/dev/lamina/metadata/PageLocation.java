/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.metadata;

/**
 * Location of a data page within the storage.
 *
 * @param offset absolute offset of the page header
 * @param compressedPageSize size of the page including its header
 * @param firstRowIndex index of the first record of the page, relative to the row group
 */
public record PageLocation(
        long offset,
        int compressedPageSize,
        long firstRowIndex) {
}
