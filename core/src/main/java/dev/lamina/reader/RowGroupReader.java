/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.reader;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.BooleanSupplier;

import dev.lamina.ColumnarFormatException;
import dev.lamina.LaminaContext;
import dev.lamina.StructuralCorruptionException;
import dev.lamina.internal.compression.CodecFactory;
import dev.lamina.internal.compression.Decompressor;
import dev.lamina.internal.shred.RecordAssembler;
import dev.lamina.internal.shred.ShreddedColumn;
import dev.lamina.io.StorageSource;
import dev.lamina.metadata.ColumnChunkSummary;
import dev.lamina.metadata.RowGroupSummary;
import dev.lamina.row.PqStruct;
import dev.lamina.schema.ColumnPath;
import dev.lamina.schema.ColumnSchema;
import dev.lamina.schema.FileSchema;
import dev.lamina.schema.ProjectedSchema;

/**
 * Reads one row group. Only the column chunks selected by the {@link ColumnProjection} are
 * fetched from the {@link StorageSource} and decoded.
 * <p>
 * Instances are not thread-safe.
 * </p>
 */
public class RowGroupReader {

    private static final Logger LOG = System.getLogger(RowGroupReader.class.getName());

    private final StorageSource source;
    private final FileSchema schema;
    private final RowGroupSummary rowGroup;
    private final ProjectedSchema projectedSchema;
    private final ReaderOptions options;
    private final LaminaContext context;
    private final CodecFactory codecFactory;
    private final BooleanSupplier cancelled;

    public RowGroupReader(StorageSource source, FileSchema schema, RowGroupSummary rowGroup,
                          ColumnProjection projection) {
        this(source, schema, rowGroup, projection, ReaderOptions.defaults(), null, () -> false);
    }

    /**
     * @param context provides the executor for parallel chunk decoding; may be null, in which case
     *                chunks are always decoded on the calling thread
     * @param cancelled consulted between pages; when it returns true reading is abandoned with a
     *                  {@link java.util.concurrent.CancellationException}
     * @throws IllegalArgumentException if the projection names a field that is not part of the schema,
     *         or the row group does not hold one chunk per column of the schema
     */
    public RowGroupReader(StorageSource source, FileSchema schema, RowGroupSummary rowGroup,
                          ColumnProjection projection, ReaderOptions options, LaminaContext context,
                          BooleanSupplier cancelled) {
        if (rowGroup.columns().size() != schema.getColumnCount()) {
            throw new IllegalArgumentException("Row group has " + rowGroup.columns().size()
                    + " column chunks, schema has " + schema.getColumnCount() + " columns");
        }
        this.source = source;
        this.schema = schema;
        this.rowGroup = rowGroup;
        this.projectedSchema = ProjectedSchema.create(schema, projection);
        this.options = options;
        this.context = context;
        this.codecFactory = context != null ? context.codecFactory() : new CodecFactory();
        this.cancelled = cancelled;
    }

    public ProjectedSchema getProjectedSchema() {
        return projectedSchema;
    }

    public long getRowCount() {
        return rowGroup.numRows();
    }

    /**
     * Reads and decodes the chunk of a projected column.
     *
     * @throws IllegalArgumentException if the column does not exist or is not projected
     */
    public ShreddedColumn readColumn(String path) throws IOException {
        return readColumn(ColumnPath.parse(path));
    }

    public ShreddedColumn readColumn(ColumnPath path) throws IOException {
        ColumnSchema column = schema.getColumn(path);
        if (!projectedSchema.isProjected(column.columnIndex())) {
            throw new IllegalArgumentException("Column " + path + " is not part of the projection");
        }
        return readChunk(column);
    }

    /**
     * Reads all projected columns, in schema order.
     */
    public List<ShreddedColumn> readColumns() throws IOException {
        List<ColumnSchema> columns = projectedSchema.getProjectedColumns();
        List<ShreddedColumn> result = new ArrayList<>(columns.size());
        if (!options.parallel() || context == null) {
            for (ColumnSchema column : columns) {
                result.add(readChunk(column));
            }
            return result;
        }

        @SuppressWarnings("unchecked")
        CompletableFuture<ShreddedColumn>[] futures = new CompletableFuture[columns.size()];
        for (int i = 0; i < futures.length; i++) {
            ColumnSchema column = columns.get(i);
            futures[i] = CompletableFuture.supplyAsync(() -> {
                try {
                    return readChunk(column);
                }
                catch (IOException e) {
                    throw new UncheckedIOException("Failed to read column chunk " + column.path(), e);
                }
            }, context.executor());
        }

        try {
            CompletableFuture.allOf(futures).join();
        }
        catch (CompletionException e) {
            throw unwrap(e);
        }
        for (CompletableFuture<ShreddedColumn> future : futures) {
            result.add(future.join());
        }
        return result;
    }

    /**
     * Reads the projected columns and assembles them into records. Records contain the projected
     * fields only.
     *
     * @throws StructuralCorruptionException if the level streams do not describe the row group's records
     */
    public List<PqStruct> readRecords() throws IOException {
        ShreddedColumn[] columnsByIndex = new ShreddedColumn[schema.getColumnCount()];
        for (ShreddedColumn column : readColumns()) {
            columnsByIndex[column.getColumn().columnIndex()] = column;
        }
        List<PqStruct> records = new RecordAssembler(projectedSchema.getRootNode(), columnsByIndex).readAll();
        if (records.size() != rowGroup.numRows()) {
            throw new StructuralCorruptionException("Assembled " + records.size() + " records, row group declares "
                    + rowGroup.numRows());
        }
        return records;
    }

    private ShreddedColumn readChunk(ColumnSchema column) throws IOException {
        ColumnChunkSummary chunk = rowGroup.columns().get(column.columnIndex());
        if (!chunk.path().equals(column.path())) {
            throw new StructuralCorruptionException("Column chunk " + column.columnIndex() + " belongs to "
                    + chunk.path() + ", expected " + column.path());
        }
        if (chunk.type() != column.type()) {
            throw new StructuralCorruptionException("Column chunk " + column.path() + " holds " + chunk.type()
                    + " values, schema declares " + column.type());
        }
        byte[] data = source.read(chunk.range());
        LOG.log(Level.DEBUG, "Read column chunk {0}: {1} bytes at offset {2}",
                column.path(), data.length, chunk.range().offset());
        Decompressor decompressor;
        try {
            decompressor = codecFactory.getDecompressor(chunk.codec());
        }
        catch (ColumnarFormatException e) {
            throw e.locate(column.path(), chunk.range().offset());
        }
        return new ColumnChunkReader(column, chunk, data, decompressor, options, cancelled).readAll();
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
        return new IOException("Failed to read row group", cause);
    }
}
