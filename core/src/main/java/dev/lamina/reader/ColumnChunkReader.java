/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.reader;

import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

import dev.lamina.ColumnarFormatException;
import dev.lamina.MalformedEncodingException;
import dev.lamina.internal.compression.Decompressor;
import dev.lamina.internal.page.Dictionary;
import dev.lamina.internal.page.Page;
import dev.lamina.internal.page.PageReader;
import dev.lamina.internal.shred.ShreddedColumn;
import dev.lamina.metadata.ColumnChunkSummary;
import dev.lamina.metadata.PageHeader;
import dev.lamina.schema.ColumnSchema;

/**
 * Reads the pages of one column chunk in order.
 * <p>
 * A dictionary page, if present, must precede the first data page and is parsed before any data
 * page is decoded. Reading stops once the value count recorded for the chunk has been reached.
 * Errors are reported with the column path and the absolute offset of the failing page.
 * </p>
 */
public class ColumnChunkReader {

    private static final Logger LOG = System.getLogger(ColumnChunkReader.class.getName());

    private final ColumnSchema column;
    private final ColumnChunkSummary chunk;
    private final byte[] data;
    private final PageReader pageReader;
    private final BooleanSupplier cancelled;

    /**
     * @param data the bytes of the chunk's range
     * @param cancelled consulted before every page; when it returns true the reader throws
     *                  {@link CancellationException}
     */
    public ColumnChunkReader(ColumnSchema column, ColumnChunkSummary chunk, byte[] data, Decompressor decompressor,
                             ReaderOptions options, BooleanSupplier cancelled) {
        if (data.length != chunk.range().length()) {
            throw new IllegalArgumentException("Expected " + chunk.range().length() + " bytes for column chunk "
                    + column.path() + ", got " + data.length);
        }
        this.column = column;
        this.chunk = chunk;
        this.data = data;
        this.pageReader = new PageReader(column, decompressor, options.verifyChecksums());
        this.cancelled = cancelled;
    }

    /**
     * Decodes all data pages of the chunk.
     */
    public List<Page> readPages() throws IOException {
        List<Page> pages = new ArrayList<>();
        long valuesRead = 0;
        int position = 0;
        Dictionary dictionary = null;

        while (valuesRead < chunk.numValues()) {
            if (cancelled.getAsBoolean()) {
                throw new CancellationException("Reading column chunk " + column.path() + " was cancelled");
            }
            long pageOffset = chunk.range().offset() + position;
            try {
                if (position >= data.length) {
                    throw new MalformedEncodingException("Column chunk ends after " + valuesRead + " of "
                            + chunk.numValues() + " values");
                }
                PageReader.RawPage raw = pageReader.readPage(data, position);
                PageHeader header = raw.header();

                if (header.type() == PageHeader.PageType.DICTIONARY_PAGE) {
                    if (dictionary != null || !pages.isEmpty()) {
                        throw new MalformedEncodingException("Dictionary page must be the first page of a column chunk");
                    }
                    dictionary = pageReader.readDictionary(raw);
                    LOG.log(Level.DEBUG, "Read dictionary of {0} entries for column {1}",
                            dictionary.size(), column.path());
                }
                else {
                    if (header.numValues() > chunk.numValues() - valuesRead) {
                        throw new MalformedEncodingException("Data page declares " + header.numValues()
                                + " values, but only " + (chunk.numValues() - valuesRead) + " of the "
                                + chunk.numValues() + " values of the column chunk remain");
                    }
                    Page page = pageReader.decodeDataPage(raw, dictionary);
                    valuesRead += page.size();
                    pages.add(page);
                }
                position += raw.storedSize();
            }
            catch (ColumnarFormatException e) {
                throw e.locate(column.path(), pageOffset);
            }
        }
        return pages;
    }

    /**
     * Decodes all data pages into one striped column.
     */
    public ShreddedColumn readAll() throws IOException {
        ShreddedColumn result = new ShreddedColumn(column);
        for (Page page : readPages()) {
            result.addPage(page);
        }
        return result;
    }
}
