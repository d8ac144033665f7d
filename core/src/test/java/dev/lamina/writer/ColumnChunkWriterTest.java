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
import java.util.concurrent.CancellationException;

import org.junit.jupiter.api.Test;

import dev.lamina.internal.compression.CodecFactory;
import dev.lamina.internal.page.PageHeaderCodec;
import dev.lamina.internal.shred.ShreddedColumn;
import dev.lamina.io.ByteRange;
import dev.lamina.metadata.ColumnChunkSummary;
import dev.lamina.metadata.CompressionCodec;
import dev.lamina.metadata.Encoding;
import dev.lamina.metadata.PageHeader;
import dev.lamina.metadata.PhysicalType;
import dev.lamina.reader.ColumnChunkReader;
import dev.lamina.reader.ReaderOptions;
import dev.lamina.row.Binary;
import dev.lamina.schema.ColumnSchema;
import dev.lamina.schema.FileSchema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ColumnChunkWriter}.
 */
class ColumnChunkWriterTest {

    private static final FileSchema SCHEMA = FileSchema.builder("t")
            .required("id", PhysicalType.INT64)
            .optional("score", PhysicalType.INT32)
            .repeated("tags", PhysicalType.INT32)
            .required("flag", PhysicalType.BOOLEAN)
            .optional("name", PhysicalType.BYTE_ARRAY)
            .optional("ratio", PhysicalType.DOUBLE)
            .build();

    private final CodecFactory codecs = new CodecFactory();

    @Test
    void testPagesAreCutAtRecordBoundaries() throws Exception {
        ColumnSchema tags = SCHEMA.getColumn("tags");
        ShreddedColumn entries = new ShreddedColumn(tags);
        for (int record = 0; record < 5; record++) {
            for (int element = 0; element < 3; element++) {
                entries.add(element == 0 ? 0 : 1, 1, record * 10 + element);
            }
        }
        WriterOptions options = WriterOptions.builder().pageValueCountLimit(4).build();

        ColumnChunk chunk = write(tags, options, entries);

        List<PageHeader> dataPages = dataPageHeaders(chunk);
        assertThat(dataPages).extracting(h -> h.dataPageHeader().numValues()).containsExactly(6, 6, 3);
        assertThat(dataPages).extracting(h -> h.dataPageHeader().numRows()).containsExactly(2, 2, 1);
        assertThat(chunk.pageLocations()).extracting(l -> l.firstRowIndex()).containsExactly(0L, 2L, 4L);
        assertThat(chunk.numValues()).isEqualTo(15);
        assertThat(chunk.numRows()).isEqualTo(5);
        assertThat(chunk.encodings()).contains(Encoding.RLE);

        assertThat(readBack(chunk, CompressionCodec.UNCOMPRESSED).size()).isEqualTo(15);
    }

    @Test
    void testPageSizeLimit() throws Exception {
        ColumnSchema id = SCHEMA.getColumn("id");
        ShreddedColumn entries = new ShreddedColumn(id);
        for (long i = 0; i < 1_000; i++) {
            entries.add(0, 0, i * 7919);
        }
        WriterOptions options = WriterOptions.builder()
                .dictionaryEnabled(false)
                .pageSizeBytes(800)
                .build();

        ColumnChunk chunk = write(id, options, entries);

        List<PageHeader> dataPages = dataPageHeaders(chunk);
        assertThat(dataPages).hasSizeGreaterThan(5);
        assertThat(dataPages).allSatisfy(h -> assertThat(h.uncompressedPageSize()).isLessThanOrEqualTo(800));
        ShreddedColumn read = readBack(chunk, CompressionCodec.UNCOMPRESSED);
        assertThat(read.getValue(999)).isEqualTo(999L * 7919);
    }

    @Test
    void testDictionaryPageComesFirst() throws Exception {
        ColumnSchema name = SCHEMA.getColumn("name");
        ShreddedColumn entries = new ShreddedColumn(name);
        String[] values = { "b", null, "a", "b", "b", null, "c" };
        for (String value : values) {
            entries.add(0, value == null ? 0 : 1, value == null ? null : Binary.fromString(value));
        }

        ColumnChunk chunk = write(name, WriterOptions.defaults(), entries);

        assertThat(chunk.dictionaryPageOffset()).isZero();
        assertThat(chunk.dataPageOffset()).isGreaterThan(0);
        PageHeader first = PageHeaderCodec.decode(chunk.bytes(), 0);
        assertThat(first.type()).isEqualTo(PageHeader.PageType.DICTIONARY_PAGE);
        assertThat(first.dictionaryPageHeader().numValues()).isEqualTo(3);
        assertThat(chunk.encodings()).containsExactlyInAnyOrder(Encoding.PLAIN, Encoding.RLE_DICTIONARY, Encoding.RLE);
        assertThat(chunk.statistics().distinctCount()).isEqualTo(3L);
        assertThat(chunk.statistics().nullCount()).isEqualTo(2);
        assertThat(chunk.statistics().min()).isEqualTo(Binary.fromString("a"));
        assertThat(chunk.statistics().max()).isEqualTo(Binary.fromString("c"));

        ShreddedColumn read = readBack(chunk, CompressionCodec.UNCOMPRESSED);
        for (int i = 0; i < values.length; i++) {
            assertThat(read.getValue(i)).isEqualTo(values[i] == null ? null : Binary.fromString(values[i]));
        }
    }

    @Test
    void testDictionaryFallsBackWhenFull() throws Exception {
        ColumnSchema id = SCHEMA.getColumn("id");
        ShreddedColumn entries = new ShreddedColumn(id);
        for (long i = 0; i < 30; i++) {
            entries.add(0, 0, i);
        }
        WriterOptions options = WriterOptions.builder()
                .pageValueCountLimit(5)
                .dictionaryMaxEntries(10)
                .fallbackEncoding(PhysicalType.INT64, Encoding.DELTA_BINARY_PACKED)
                .build();

        ColumnChunk chunk = write(id, options, entries);

        List<PageHeader> headers = pageHeaders(chunk);
        assertThat(headers.get(0).type()).isEqualTo(PageHeader.PageType.DICTIONARY_PAGE);
        assertThat(headers.get(0).dictionaryPageHeader().numValues()).isEqualTo(10);
        assertThat(headers.subList(1, headers.size()))
                .extracting(h -> h.dataPageHeader().encoding())
                .containsExactly(Encoding.RLE_DICTIONARY, Encoding.RLE_DICTIONARY,
                        Encoding.DELTA_BINARY_PACKED, Encoding.DELTA_BINARY_PACKED,
                        Encoding.DELTA_BINARY_PACKED, Encoding.DELTA_BINARY_PACKED);
        assertThat(chunk.encodings())
                .containsExactlyInAnyOrder(Encoding.PLAIN, Encoding.RLE_DICTIONARY, Encoding.DELTA_BINARY_PACKED);
        assertThat(chunk.statistics().distinctCount()).isNull();

        ShreddedColumn read = readBack(chunk, CompressionCodec.UNCOMPRESSED);
        for (int i = 0; i < 30; i++) {
            assertThat(read.getValue(i)).isEqualTo((long) i);
        }
    }

    @Test
    void testFallbackBeforeFirstPageWritesNoDictionary() throws Exception {
        ColumnSchema name = SCHEMA.getColumn("name");
        ShreddedColumn entries = new ShreddedColumn(name);
        for (int i = 0; i < 100; i++) {
            entries.add(0, 1, Binary.fromString("value-" + i));
        }
        WriterOptions options = WriterOptions.builder().dictionaryPageSizeLimit(64).build();

        ColumnChunk chunk = write(name, options, entries);

        assertThat(chunk.dictionaryPageOffset()).isNull();
        assertThat(pageHeaders(chunk)).allSatisfy(h -> {
            assertThat(h.type()).isEqualTo(PageHeader.PageType.DATA_PAGE);
            assertThat(h.dataPageHeader().encoding()).isEqualTo(Encoding.PLAIN);
        });
        assertThat(readBack(chunk, CompressionCodec.UNCOMPRESSED).getValue(99)).isEqualTo(Binary.fromString("value-99"));
    }

    @Test
    void testBooleanColumnIsNeverDictionaryEncoded() throws Exception {
        ColumnSchema flag = SCHEMA.getColumn("flag");
        ShreddedColumn entries = new ShreddedColumn(flag);
        for (int i = 0; i < 50; i++) {
            entries.add(0, 0, i % 3 == 0);
        }

        ColumnChunk plain = write(flag, WriterOptions.defaults(), entries);
        assertThat(plain.dictionaryPageOffset()).isNull();
        assertThat(plain.encodings()).containsExactly(Encoding.PLAIN);
        assertThat(plain.statistics().min()).isEqualTo(false);
        assertThat(plain.statistics().max()).isEqualTo(true);

        WriterOptions rle = WriterOptions.builder().fallbackEncoding(PhysicalType.BOOLEAN, Encoding.RLE).build();
        ColumnChunk chunk = write(flag, rle, entries);
        assertThat(chunk.encodings()).containsExactly(Encoding.RLE);
        ShreddedColumn read = readBack(chunk, CompressionCodec.UNCOMPRESSED);
        for (int i = 0; i < 50; i++) {
            assertThat(read.getValue(i)).isEqualTo(i % 3 == 0);
        }
    }

    @Test
    void testDeltaByteArrayFallback() throws Exception {
        ColumnSchema name = SCHEMA.getColumn("name");
        ShreddedColumn entries = new ShreddedColumn(name);
        entries.add(0, 1, Binary.fromString("prefix-alpha"));
        entries.add(0, 0, null);
        entries.add(0, 1, Binary.fromString("prefix-beta"));
        WriterOptions options = WriterOptions.builder()
                .dictionaryEnabled(false)
                .fallbackEncoding(PhysicalType.BYTE_ARRAY, Encoding.DELTA_BYTE_ARRAY)
                .codec(CompressionCodec.ZSTD)
                .build();

        ColumnChunk chunk = write(name, options, entries);

        assertThat(chunk.encodings()).contains(Encoding.DELTA_BYTE_ARRAY);
        ShreddedColumn read = readBack(chunk, CompressionCodec.ZSTD);
        assertThat(read.getValue(0)).isEqualTo(Binary.fromString("prefix-alpha"));
        assertThat(read.getValue(1)).isNull();
        assertThat(read.getValue(2)).isEqualTo(Binary.fromString("prefix-beta"));
    }

    @Test
    void testStatisticsIgnoreNaN() throws Exception {
        ColumnSchema ratio = SCHEMA.getColumn("ratio");
        ShreddedColumn entries = new ShreddedColumn(ratio);
        entries.add(0, 1, Double.NaN);
        entries.add(0, 1, 2.5);
        entries.add(0, 0, null);
        entries.add(0, 1, -1.0);

        ColumnChunk chunk = write(ratio, WriterOptions.defaults(), entries);

        assertThat(chunk.statistics().min()).isEqualTo(-1.0);
        assertThat(chunk.statistics().max()).isEqualTo(2.5);
        assertThat(chunk.statistics().nullCount()).isEqualTo(1);
    }

    @Test
    void testAllNullColumn() throws Exception {
        ColumnSchema score = SCHEMA.getColumn("score");
        ShreddedColumn entries = new ShreddedColumn(score);
        entries.add(0, 0, null);
        entries.add(0, 0, null);

        ColumnChunk chunk = write(score, WriterOptions.defaults(), entries);

        assertThat(chunk.statistics().hasMinMax()).isFalse();
        assertThat(chunk.statistics().nullCount()).isEqualTo(2);
        ShreddedColumn read = readBack(chunk, CompressionCodec.UNCOMPRESSED);
        assertThat(read.size()).isEqualTo(2);
        assertThat(read.isDefined(0)).isFalse();
    }

    @Test
    void testEmptyChunkHasNoPages() throws Exception {
        ColumnSchema score = SCHEMA.getColumn("score");

        ColumnChunk chunk = write(score, WriterOptions.defaults(), new ShreddedColumn(score));

        assertThat(chunk.bytes()).isEmpty();
        assertThat(chunk.numValues()).isZero();
        assertThat(readBack(chunk, CompressionCodec.UNCOMPRESSED).size()).isZero();
    }

    @Test
    void testChecksumsCanBeDisabled() throws Exception {
        ColumnSchema score = SCHEMA.getColumn("score");
        ShreddedColumn entries = new ShreddedColumn(score);
        entries.add(0, 1, 1);

        ColumnChunk chunk = write(score, WriterOptions.builder().writeChecksums(false).build(), entries);

        assertThat(pageHeaders(chunk)).allSatisfy(h -> assertThat(h.hasCrc()).isFalse());
    }

    @Test
    void testCancellation() throws Exception {
        ColumnSchema score = SCHEMA.getColumn("score");
        ShreddedColumn entries = new ShreddedColumn(score);
        entries.add(0, 1, 1);
        ColumnChunkWriter writer = new ColumnChunkWriter(score, WriterOptions.defaults(),
                codecs.getCompressor(CompressionCodec.UNCOMPRESSED, 0), () -> true);
        writer.write(entries);

        assertThatThrownBy(writer::close).isInstanceOf(CancellationException.class);
    }

    @Test
    void testInvalidInput() throws Exception {
        ColumnSchema tags = SCHEMA.getColumn("tags");
        ColumnChunkWriter writer = new ColumnChunkWriter(tags, WriterOptions.defaults(),
                codecs.getCompressor(CompressionCodec.UNCOMPRESSED, 0), () -> false);

        ShreddedColumn continuation = new ShreddedColumn(tags);
        continuation.add(1, 1, 5);
        assertThatThrownBy(() -> writer.write(continuation))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("record boundary");

        ShreddedColumn other = new ShreddedColumn(SCHEMA.getColumn("score"));
        assertThatThrownBy(() -> writer.write(other))
                .isInstanceOf(IllegalArgumentException.class);

        writer.close();
        assertThatThrownBy(writer::close).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testSummaryOffsetsAreAbsolute() throws Exception {
        ColumnSchema name = SCHEMA.getColumn("name");
        ShreddedColumn entries = new ShreddedColumn(name);
        entries.add(0, 1, Binary.fromString("x"));

        ColumnChunk chunk = write(name, WriterOptions.defaults(), entries);
        ColumnChunkSummary summary = chunk.toSummary(new ByteRange(1_000, chunk.bytes().length));

        assertThat(summary.dictionaryPageOffset()).isEqualTo(1_000L);
        assertThat(summary.dataPageOffset()).isEqualTo(1_000L + chunk.dataPageOffset());
        assertThat(summary.pageLocations().get(0).offset()).isEqualTo(summary.dataPageOffset());
        assertThatThrownBy(() -> chunk.toSummary(new ByteRange(0, 1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private ColumnChunk write(ColumnSchema column, WriterOptions options, ShreddedColumn entries) throws Exception {
        ColumnChunkWriter writer = new ColumnChunkWriter(column, options,
                codecs.getCompressor(options.getCodec(), options.getCompressionLevel()), () -> false);
        writer.write(entries);
        return writer.close();
    }

    private ShreddedColumn readBack(ColumnChunk chunk, CompressionCodec codec) throws Exception {
        ColumnChunkSummary summary = chunk.toSummary(new ByteRange(0, chunk.bytes().length));
        return new ColumnChunkReader(chunk.column(), summary, chunk.bytes(), codecs.getDecompressor(codec),
                ReaderOptions.defaults(), () -> false).readAll();
    }

    private static List<PageHeader> pageHeaders(ColumnChunk chunk) throws Exception {
        List<PageHeader> headers = new ArrayList<>();
        int position = 0;
        while (position < chunk.bytes().length) {
            PageHeader header = PageHeaderCodec.decode(chunk.bytes(), position);
            headers.add(header);
            position += PageHeaderCodec.HEADER_SIZE + header.compressedPageSize();
        }
        return headers;
    }

    private static List<PageHeader> dataPageHeaders(ColumnChunk chunk) throws Exception {
        List<PageHeader> headers = new ArrayList<>(pageHeaders(chunk));
        headers.removeIf(h -> h.type() != PageHeader.PageType.DATA_PAGE);
        return headers;
    }
}
