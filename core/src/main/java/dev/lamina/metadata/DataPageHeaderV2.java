/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.metadata;

/**
 * Header of a version 2 data page. Its repetition and definition levels are RLE encoded and stored
 * uncompressed ahead of the values; only the values section is subject to compression.
 *
 * @param numRows number of records starting in the page
 * @param isCompressed whether the values section is compressed with the chunk codec
 */
public record DataPageHeaderV2(
        int numValues,
        int numNulls,
        int numRows,
        Encoding encoding,
        int definitionLevelsByteLength,
        int repetitionLevelsByteLength,
        boolean isCompressed) {

    /**
     * Returns the equivalent version 1 view: both level sections are RLE encoded.
     */
    public DataPageHeader toDataPageHeader() {
        return new DataPageHeader(numValues, numNulls, numRows, encoding, Encoding.RLE, Encoding.RLE,
                repetitionLevelsByteLength, definitionLevelsByteLength);
    }
}
