/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.writer;

import java.util.ArrayList;
import java.util.List;

import dev.lamina.io.ByteRange;
import dev.lamina.metadata.ColumnChunkSummary;
import dev.lamina.metadata.CompressionCodec;
import dev.lamina.metadata.Encoding;
import dev.lamina.metadata.PageLocation;
import dev.lamina.metadata.Statistics;
import dev.lamina.schema.ColumnSchema;

/**
 * A closed column chunk: the serialized pages and the metadata describing them.
 * Offsets are relative to the start of {@code bytes}.
 *
 * @param dictionaryPageOffset offset of the dictionary page, or null if the chunk has none
 * @param numValues number of level slots, including nulls
 * @param numRows number of records
 * @param totalUncompressedSize size of all pages with uncompressed bodies, headers included
 */
public record ColumnChunk(
        ColumnSchema column,
        CompressionCodec codec,
        byte[] bytes,
        List<Encoding> encodings,
        long numValues,
        long numRows,
        long totalUncompressedSize,
        Integer dictionaryPageOffset,
        int dataPageOffset,
        Statistics statistics,
        List<PageLocation> pageLocations) {

    /**
     * Describes this chunk as written to the given range of the storage.
     */
    public ColumnChunkSummary toSummary(ByteRange range) {
        if (range.length() != bytes.length) {
            throw new IllegalArgumentException("Range " + range + " does not match chunk of " + bytes.length + " bytes");
        }
        long base = range.offset();
        List<PageLocation> locations = new ArrayList<>(pageLocations.size());
        for (PageLocation location : pageLocations) {
            locations.add(new PageLocation(base + location.offset(), location.compressedPageSize(),
                    location.firstRowIndex()));
        }
        return new ColumnChunkSummary(column.path(), column.type(), codec, encodings, numValues,
                totalUncompressedSize, bytes.length, range, base + dataPageOffset,
                dictionaryPageOffset == null ? null : base + dictionaryPageOffset,
                statistics, List.copyOf(locations));
    }
}
