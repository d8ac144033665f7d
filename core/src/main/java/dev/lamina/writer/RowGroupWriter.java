/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.writer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.BooleanSupplier;

import dev.lamina.LaminaContext;
import dev.lamina.internal.compression.CodecFactory;
import dev.lamina.internal.shred.RecordShredder;
import dev.lamina.internal.shred.ShreddedColumn;
import dev.lamina.io.ByteRange;
import dev.lamina.io.MetadataSerializer;
import dev.lamina.io.StorageSink;
import dev.lamina.metadata.ColumnChunkSummary;
import dev.lamina.metadata.RowGroupSummary;
import dev.lamina.row.Binary;
import dev.lamina.row.PqStruct;
import dev.lamina.schema.FileSchema;

/**
 * Writes records as row groups: one column chunk per leaf column, all covering the same records.
 * <p>
 * Records are shredded as they arrive. When the buffered records reach the row count or size
 * configured in {@link WriterOptions}, or on {@link #flush()}, the column chunks are encoded
 * (concurrently on the context's executor if {@link WriterOptions#isParallel()} is set) and
 * written one after another through the {@link StorageSink}. Nothing of a row group reaches the
 * sink before all of its chunks have been encoded.
 * </p>
 * <p>
 * Instances are not thread-safe.
 * </p>
 */
public class RowGroupWriter implements AutoCloseable {

    private static final Logger LOG = System.getLogger(RowGroupWriter.class.getName());

    private static final int LEVEL_BYTES_PER_ENTRY = 2;

    private final FileSchema schema;
    private final StorageSink sink;
    private final WriterOptions options;
    private final LaminaContext context;
    private final CodecFactory codecFactory;
    private final BooleanSupplier cancelled;
    private final RecordShredder shredder;
    private final List<RowGroupSummary> rowGroups = new ArrayList<>();

    private long nextOffset;
    private long bufferedBytes;
    private boolean closed;
    private boolean footerWritten;

    public RowGroupWriter(FileSchema schema, StorageSink sink, WriterOptions options) {
        this(schema, sink, options, null, () -> false);
    }

    /**
     * @param context provides the executor for parallel chunk encoding; may be null, in which case
     *                chunks are always encoded on the calling thread
     * @param cancelled consulted between pages; when it returns true the current flush is abandoned
     *                  with a {@link java.util.concurrent.CancellationException}
     */
    public RowGroupWriter(FileSchema schema, StorageSink sink, WriterOptions options, LaminaContext context,
                          BooleanSupplier cancelled) {
        this.schema = schema;
        this.sink = sink;
        this.options = options;
        this.context = context;
        this.codecFactory = context != null ? context.codecFactory() : new CodecFactory();
        this.cancelled = cancelled;
        this.shredder = new RecordShredder(schema);
    }

    public FileSchema getSchema() {
        return schema;
    }

    /**
     * Shreds one record into the current row group, flushing the group if it is full.
     *
     * @throws dev.lamina.SchemaViolationException if the record does not match the schema;
     *         the row group is left unchanged
     */
    public void write(PqStruct record) throws IOException {
        checkOpen();
        List<ShreddedColumn> columns = shredder.getColumns();
        int[] marks = new int[columns.size()];
        for (int i = 0; i < marks.length; i++) {
            marks[i] = columns.get(i).size();
        }
        shredder.shred(record);
        for (int i = 0; i < marks.length; i++) {
            bufferedBytes += estimateSize(columns.get(i), marks[i]);
        }

        if (shredder.getRecordCount() >= options.getRowGroupRowCount()
                || bufferedBytes >= options.getRowGroupSizeBytes()) {
            flush();
        }
    }

    /**
     * Number of records buffered for the current row group.
     */
    public int getBufferedRecordCount() {
        return shredder.getRecordCount();
    }

    /**
     * Closes the current row group, if it holds any record, and writes it to the sink.
     *
     * @return the summary of the written row group, or null if no record was buffered
     */
    public RowGroupSummary flush() throws IOException {
        checkOpen();
        int numRows = shredder.getRecordCount();
        if (numRows == 0) {
            return null;
        }
        List<ShreddedColumn> columns = shredder.drain();
        bufferedBytes = 0;

        List<ColumnChunk> chunks = encodeChunks(columns);

        List<ColumnChunkSummary> summaries = new ArrayList<>(chunks.size());
        long totalByteSize = 0;
        for (ColumnChunk chunk : chunks) {
            ByteRange range = sink.write(nextOffset, chunk.bytes());
            nextOffset = range.end();
            summaries.add(chunk.toSummary(range));
            totalByteSize += chunk.totalUncompressedSize();
        }

        RowGroupSummary summary = new RowGroupSummary(List.copyOf(summaries), numRows, totalByteSize);
        rowGroups.add(summary);
        LOG.log(Level.DEBUG, "Closed row group {0}: {1} rows, {2} columns, {3} bytes",
                rowGroups.size() - 1, numRows, summaries.size(), totalByteSize);
        return summary;
    }

    /**
     * Summaries of all row groups written so far.
     */
    public List<RowGroupSummary> getRowGroups() {
        return List.copyOf(rowGroups);
    }

    /**
     * Flushes buffered records unless the writer is closed, then serializes the schema and all
     * row group summaries with the given serializer and writes the blob after the last row group.
     *
     * @return the range the metadata blob was written to
     */
    public ByteRange writeFooter(MetadataSerializer serializer) throws IOException {
        if (footerWritten) {
            throw new IllegalStateException("Footer has already been written");
        }
        if (!closed) {
            flush();
        }
        byte[] footer = serializer.serialize(schema, getRowGroups());
        ByteRange range = sink.write(nextOffset, footer);
        nextOffset = range.end();
        closed = true;
        footerWritten = true;
        LOG.log(Level.DEBUG, "Wrote footer of {0} bytes for {1} row groups", footer.length, rowGroups.size());
        return range;
    }

    /**
     * Flushes the final row group. Does nothing if the writer is already closed.
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        flush();
        closed = true;
    }

    private List<ColumnChunk> encodeChunks(List<ShreddedColumn> columns) throws IOException {
        List<ColumnChunk> chunks = new ArrayList<>(columns.size());
        if (!options.isParallel() || context == null) {
            for (ShreddedColumn column : columns) {
                chunks.add(encodeChunk(column));
            }
            return chunks;
        }

        @SuppressWarnings("unchecked")
        CompletableFuture<ColumnChunk>[] futures = new CompletableFuture[columns.size()];
        for (int i = 0; i < futures.length; i++) {
            ShreddedColumn column = columns.get(i);
            futures[i] = CompletableFuture.supplyAsync(() -> {
                try {
                    return encodeChunk(column);
                }
                catch (IOException e) {
                    throw new UncheckedIOException("Failed to encode column chunk " + column.getColumn().path(), e);
                }
            }, context.executor());
        }

        try {
            CompletableFuture.allOf(futures).join();
        }
        catch (CompletionException e) {
            throw unwrap(e);
        }
        for (CompletableFuture<ColumnChunk> future : futures) {
            chunks.add(future.join());
        }
        return chunks;
    }

    private ColumnChunk encodeChunk(ShreddedColumn column) throws IOException {
        ColumnChunkWriter writer = new ColumnChunkWriter(column.getColumn(), options,
                codecFactory.getCompressor(options.getCodec(), options.getCompressionLevel()), cancelled);
        writer.write(column);
        return writer.close();
    }

    private static IOException unwrap(CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof UncheckedIOException unchecked) {
            return unchecked.getCause();
        }
        if (cause instanceof RuntimeException runtime) {
            throw runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IOException("Failed to encode row group", cause);
    }

    private static long estimateSize(ShreddedColumn column, int from) {
        long size = 0;
        for (int i = from; i < column.size(); i++) {
            Object value = column.getValue(i);
            size += LEVEL_BYTES_PER_ENTRY;
            if (value instanceof Binary binary) {
                size += 4 + binary.length();
            }
            else if (value instanceof Long || value instanceof Double) {
                size += 8;
            }
            else if (value instanceof Boolean) {
                size += 1;
            }
            else if (value != null) {
                size += 4;
            }
        }
        return size;
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Row group writer is closed");
        }
    }
}
