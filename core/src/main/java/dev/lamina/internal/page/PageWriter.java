/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.internal.page;

import java.io.IOException;
import java.util.zip.CRC32;

import dev.lamina.internal.compression.Compressor;
import dev.lamina.metadata.DataPageHeader;
import dev.lamina.metadata.DataPageHeaderV2;
import dev.lamina.metadata.DictionaryPageHeader;
import dev.lamina.metadata.Encoding;
import dev.lamina.metadata.PageHeader;

/**
 * Assembles data and dictionary pages: concatenates the body sections, compresses the body
 * and computes the optional CRC-32 over the bytes as stored.
 */
public class PageWriter {

    private final Compressor compressor;
    private final boolean writeChecksums;

    public PageWriter(Compressor compressor, boolean writeChecksums) {
        this.compressor = compressor;
        this.writeChecksums = writeChecksums;
    }

    /**
     * Builds a data page whose body is repetition levels, definition levels and values, in this order.
     */
    public EncodedPage writeDataPage(int numValues, int numNulls, int numRows, Encoding valueEncoding,
                                     Encoding levelEncoding, byte[] repetitionLevels, byte[] definitionLevels,
                                     byte[] values) throws IOException {
        byte[] body = new byte[repetitionLevels.length + definitionLevels.length + values.length];
        System.arraycopy(repetitionLevels, 0, body, 0, repetitionLevels.length);
        System.arraycopy(definitionLevels, 0, body, repetitionLevels.length, definitionLevels.length);
        System.arraycopy(values, 0, body, repetitionLevels.length + definitionLevels.length, values.length);

        byte[] compressed = compressor.compress(body);
        DataPageHeader dataHeader = new DataPageHeader(numValues, numNulls, numRows, valueEncoding,
                levelEncoding, levelEncoding, repetitionLevels.length, definitionLevels.length);
        PageHeader header = new PageHeader(PageHeader.PageType.DATA_PAGE, body.length, compressed.length,
                checksum(compressed), dataHeader, null, null);
        return new EncodedPage(header, compressed);
    }

    /**
     * Builds a version 2 data page. The RLE encoded level sections are stored uncompressed, followed by
     * the values, which are compressed unless that does not make them smaller.
     */
    public EncodedPage writeDataPageV2(int numValues, int numNulls, int numRows, Encoding valueEncoding,
                                       byte[] repetitionLevels, byte[] definitionLevels, byte[] values)
            throws IOException {
        byte[] compressedValues = compressor.compress(values);
        boolean compressed = compressedValues.length < values.length;
        byte[] storedValues = compressed ? compressedValues : values;
        int levelsLength = repetitionLevels.length + definitionLevels.length;

        byte[] body = new byte[levelsLength + storedValues.length];
        System.arraycopy(repetitionLevels, 0, body, 0, repetitionLevels.length);
        System.arraycopy(definitionLevels, 0, body, repetitionLevels.length, definitionLevels.length);
        System.arraycopy(storedValues, 0, body, levelsLength, storedValues.length);

        DataPageHeaderV2 dataHeader = new DataPageHeaderV2(numValues, numNulls, numRows, valueEncoding,
                definitionLevels.length, repetitionLevels.length, compressed);
        PageHeader header = new PageHeader(PageHeader.PageType.DATA_PAGE_V2, levelsLength + values.length,
                body.length, checksum(body), null, null, dataHeader);
        return new EncodedPage(header, body);
    }

    /**
     * Builds a dictionary page from PLAIN encoded entries.
     */
    public EncodedPage writeDictionaryPage(int numValues, byte[] plainValues) throws IOException {
        byte[] compressed = compressor.compress(plainValues);
        PageHeader header = new PageHeader(PageHeader.PageType.DICTIONARY_PAGE, plainValues.length,
                compressed.length, checksum(compressed), null,
                new DictionaryPageHeader(numValues, Encoding.PLAIN, false), null);
        return new EncodedPage(header, compressed);
    }

    private Integer checksum(byte[] compressed) {
        if (!writeChecksums) {
            return null;
        }
        CRC32 crc = new CRC32();
        crc.update(compressed);
        return (int) crc.getValue();
    }
}
