/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.writer;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

import dev.lamina.internal.compression.Compressor;
import dev.lamina.internal.encoding.BytesUtils;
import dev.lamina.internal.encoding.DictionaryEncoder;
import dev.lamina.internal.encoding.LevelEncoder;
import dev.lamina.internal.encoding.ValueEncoder;
import dev.lamina.internal.encoding.ValueEncoders;
import dev.lamina.internal.page.EncodedPage;
import dev.lamina.internal.page.PageHeaderCodec;
import dev.lamina.internal.page.PageWriter;
import dev.lamina.internal.shred.ShreddedColumn;
import dev.lamina.metadata.Encoding;
import dev.lamina.metadata.PageLocation;
import dev.lamina.metadata.PhysicalType;
import dev.lamina.schema.ColumnSchema;

/**
 * Writes the pages of one column chunk.
 * <p>
 * Entries are buffered until the pending page reaches the slot limit or the estimated size
 * configured in {@link WriterOptions}; pages are only cut at record boundaries. Columns start
 * out dictionary encoded where the options allow it. Once the dictionary grows beyond its
 * limits the writer switches to the fallback encoding of the column type for the rest of the
 * chunk: pages already written keep the dictionary as it was when they were flushed, the
 * pending page is re-encoded.
 * </p>
 */
public class ColumnChunkWriter {

    private static final Logger LOG = System.getLogger(ColumnChunkWriter.class.getName());

    private static final int INITIAL_CAPACITY = 1024;

    private final ColumnSchema column;
    private final WriterOptions options;
    private final PageWriter pageWriter;
    private final BooleanSupplier cancelled;
    private final StatisticsAccumulator statistics;
    private final int levelBitsPerEntry;

    private DictionaryEncoder dictionary;
    private ValueEncoder fallbackEncoder;
    private int dictionaryEntriesInPages;
    private boolean dictionaryUsed;
    private boolean fallenBack;

    private int[] pendingRepetitionLevels = new int[INITIAL_CAPACITY];
    private int[] pendingDefinitionLevels = new int[INITIAL_CAPACITY];
    private Object[] pendingValues = new Object[INITIAL_CAPACITY];
    private int pendingCount;

    private final List<EncodedPage> dataPages = new ArrayList<>();
    private final List<Long> pageFirstRows = new ArrayList<>();
    private final Set<Encoding> encodings = EnumSet.noneOf(Encoding.class);
    private long numValues;
    private long numRows;
    private boolean closed;

    /**
     * @param cancelled consulted before every page flush; when it returns true the writer throws
     *                  {@link CancellationException}
     */
    public ColumnChunkWriter(ColumnSchema column, WriterOptions options, Compressor compressor,
                             BooleanSupplier cancelled) {
        this.column = column;
        this.options = options;
        this.pageWriter = new PageWriter(compressor, options.isWriteChecksums());
        this.cancelled = cancelled;
        this.statistics = new StatisticsAccumulator(column.type());
        this.levelBitsPerEntry = BytesUtils.bitWidth(column.maxRepetitionLevel())
                + BytesUtils.bitWidth(column.maxDefinitionLevel());
        if (options.isDictionaryEnabled() && column.type() != PhysicalType.BOOLEAN) {
            this.dictionary = new DictionaryEncoder(column.type(), column.typeLength());
        }
        else {
            this.fallbackEncoder = newFallbackEncoder();
        }
    }

    public ColumnSchema getColumn() {
        return column;
    }

    /**
     * Writes all entries of the given column.
     */
    public void write(ShreddedColumn entries) throws IOException {
        write(entries, 0, entries.size());
    }

    /**
     * Writes the entries {@code from} (inclusive) to {@code to} (exclusive) of the given column.
     * The range must consist of whole records.
     */
    public void write(ShreddedColumn entries, int from, int to) throws IOException {
        if (closed) {
            throw new IllegalStateException("Column chunk writer for " + column.path() + " is closed");
        }
        if (!entries.getColumn().path().equals(column.path())) {
            throw new IllegalArgumentException("Entries of column " + entries.getColumn().path()
                    + " cannot be written to column " + column.path());
        }
        for (int i = from; i < to; i++) {
            int repetitionLevel = entries.getRepetitionLevel(i);
            if (repetitionLevel == 0) {
                if (pendingCount > 0 && isPageFull()) {
                    flushPage();
                }
            }
            else if (pendingCount == 0 && dataPages.isEmpty()) {
                throw new IllegalArgumentException("Column " + column.path()
                        + " must start at a record boundary, found repetition level " + repetitionLevel);
            }
            append(repetitionLevel, entries.getDefinitionLevel(i), entries.getValue(i));
        }
    }

    /**
     * Flushes the pending page and serializes the chunk. The dictionary page, if any page used it, comes first.
     */
    public ColumnChunk close() throws IOException {
        if (closed) {
            throw new IllegalStateException("Column chunk writer for " + column.path() + " is already closed");
        }
        if (pendingCount > 0) {
            flushPage();
        }
        checkCancelled();
        closed = true;

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        long uncompressedSize = 0;
        Integer dictionaryPageOffset = null;
        if (dictionaryUsed) {
            EncodedPage dictionaryPage = pageWriter.writeDictionaryPage(dictionaryEntriesInPages,
                    dictionary.dictionaryPageBytes(dictionaryEntriesInPages));
            dictionaryPageOffset = 0;
            dictionaryPage.writeTo(out);
            uncompressedSize += PageHeaderCodec.HEADER_SIZE + dictionaryPage.header().uncompressedPageSize();
            encodings.add(Encoding.PLAIN);
        }

        int dataPageOffset = out.size();
        List<PageLocation> locations = new ArrayList<>(dataPages.size());
        for (int i = 0; i < dataPages.size(); i++) {
            EncodedPage page = dataPages.get(i);
            locations.add(new PageLocation(out.size(), page.size(), pageFirstRows.get(i)));
            page.writeTo(out);
            uncompressedSize += PageHeaderCodec.HEADER_SIZE + page.header().uncompressedPageSize();
        }
        dataPages.clear();

        Long distinctCount = dictionary != null && !fallenBack ? Long.valueOf(dictionary.getDictionarySize()) : null;
        ColumnChunk chunk = new ColumnChunk(column, options.getCodec(), out.toByteArray(), List.copyOf(encodings),
                numValues, numRows, uncompressedSize, dictionaryPageOffset, dataPageOffset,
                statistics.freeze(distinctCount), List.copyOf(locations));
        LOG.log(Level.DEBUG, "Closed column chunk {0}: {1} values, {2} pages, {3} bytes",
                column.path(), numValues, locations.size(), chunk.bytes().length);
        return chunk;
    }

    private void append(int repetitionLevel, int definitionLevel, Object value) throws IOException {
        if (pendingCount == pendingValues.length) {
            int capacity = pendingCount * 2;
            pendingRepetitionLevels = Arrays.copyOf(pendingRepetitionLevels, capacity);
            pendingDefinitionLevels = Arrays.copyOf(pendingDefinitionLevels, capacity);
            pendingValues = Arrays.copyOf(pendingValues, capacity);
        }
        pendingRepetitionLevels[pendingCount] = repetitionLevel;
        pendingDefinitionLevels[pendingCount] = definitionLevel;
        pendingValues[pendingCount] = value;
        pendingCount++;

        if (definitionLevel < column.maxDefinitionLevel()) {
            statistics.addNull();
            return;
        }
        statistics.add(value);
        if (fallenBack || dictionary == null) {
            fallbackEncoder.writeValue(value);
            return;
        }
        dictionary.writeValue(value);
        if (dictionary.getDictionarySize() > options.getDictionaryMaxEntries()
                || dictionary.getDictionaryByteSize() > options.getDictionaryPageSizeLimit()) {
            fallBack();
        }
    }

    private void fallBack() {
        LOG.log(Level.DEBUG, "Dictionary of column {0} exceeded its limits at {1} entries ({2} bytes), "
                + "falling back to {3}", column.path(), dictionary.getDictionarySize(),
                dictionary.getDictionaryByteSize(), options.getFallbackEncoding(column.type()));
        fallenBack = true;
        dictionary.reset();
        dictionary.truncate(dictionaryEntriesInPages);
        fallbackEncoder = newFallbackEncoder();
        for (int i = 0; i < pendingCount; i++) {
            if (pendingDefinitionLevels[i] == column.maxDefinitionLevel()) {
                fallbackEncoder.writeValue(pendingValues[i]);
            }
        }
    }

    private ValueEncoder newFallbackEncoder() {
        return ValueEncoders.create(options.getFallbackEncoding(column.type()), column.type(), column.typeLength());
    }

    private ValueEncoder currentEncoder() {
        return fallenBack || dictionary == null ? fallbackEncoder : dictionary;
    }

    private boolean isPageFull() {
        if (pendingCount >= options.getPageValueCountLimit()) {
            return true;
        }
        long levelBytes = ((long) pendingCount * levelBitsPerEntry + 7) / 8;
        return levelBytes + currentEncoder().getEstimatedSize() >= options.getPageSizeBytes();
    }

    private void flushPage() throws IOException {
        checkCancelled();

        int nulls = 0;
        int rows = 0;
        for (int i = 0; i < pendingCount; i++) {
            if (pendingDefinitionLevels[i] < column.maxDefinitionLevel()) {
                nulls++;
            }
            if (pendingRepetitionLevels[i] == 0) {
                rows++;
            }
        }

        Encoding levelEncoding = options.getLevelEncoding();
        byte[] repetitionLevels = LevelEncoder.encode(levelEncoding, pendingRepetitionLevels, 0, pendingCount,
                column.maxRepetitionLevel());
        byte[] definitionLevels = LevelEncoder.encode(levelEncoding, pendingDefinitionLevels, 0, pendingCount,
                column.maxDefinitionLevel());
        ValueEncoder encoder = currentEncoder();
        byte[] values = encoder.toBytes();
        encoder.reset();

        EncodedPage page = options.getDataPageVersion() == DataPageVersion.V2
                ? pageWriter.writeDataPageV2(pendingCount, nulls, rows, encoder.getEncoding(),
                        repetitionLevels, definitionLevels, values)
                : pageWriter.writeDataPage(pendingCount, nulls, rows, encoder.getEncoding(), levelEncoding,
                        repetitionLevels, definitionLevels, values);
        dataPages.add(page);
        pageFirstRows.add(numRows);
        encodings.add(encoder.getEncoding());
        if (column.maxRepetitionLevel() > 0 || column.maxDefinitionLevel() > 0) {
            encodings.add(levelEncoding);
        }
        if (encoder == dictionary) {
            dictionaryUsed = true;
            dictionaryEntriesInPages = dictionary.getDictionarySize();
        }

        LOG.log(Level.DEBUG, "Flushed {0} page for column {1}: {2} values, {3} rows, {4} bytes",
                encoder.getEncoding(), column.path(), pendingCount, rows, page.size());

        numValues += pendingCount;
        numRows += rows;
        Arrays.fill(pendingValues, 0, pendingCount, null);
        pendingCount = 0;
    }

    private void checkCancelled() {
        if (cancelled.getAsBoolean()) {
            throw new CancellationException("Writing column chunk " + column.path() + " was cancelled");
        }
    }
}
