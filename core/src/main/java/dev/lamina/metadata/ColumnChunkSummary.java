/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.metadata;

import java.util.List;

import dev.lamina.io.ByteRange;
import dev.lamina.schema.ColumnPath;

/**
 * Metadata for a column chunk that has been written to storage.
 *
 * @param range byte range covering the dictionary page (if any) and all data pages
 * @param dictionaryPageOffset absolute offset of the dictionary page, or null if the chunk has none
 * @param numValues number of level slots in the chunk, including nulls
 */
public record ColumnChunkSummary(
        ColumnPath path,
        PhysicalType type,
        CompressionCodec codec,
        List<Encoding> encodings,
        long numValues,
        long totalUncompressedSize,
        long totalCompressedSize,
        ByteRange range,
        long dataPageOffset,
        Long dictionaryPageOffset,
        Statistics statistics,
        List<PageLocation> pageLocations) {

    public boolean hasDictionaryPage() {
        return dictionaryPageOffset != null;
    }
}
