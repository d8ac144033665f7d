/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.internal.page;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;

import org.junit.jupiter.api.Test;

import dev.lamina.ChecksumMismatchException;
import dev.lamina.EncodingNotSupportedException;
import dev.lamina.MalformedEncodingException;
import dev.lamina.internal.compression.CodecFactory;
import dev.lamina.internal.encoding.DictionaryEncoder;
import dev.lamina.internal.encoding.LevelEncoder;
import dev.lamina.internal.encoding.PlainEncoder;
import dev.lamina.metadata.CompressionCodec;
import dev.lamina.metadata.DataPageHeader;
import dev.lamina.metadata.DataPageHeaderV2;
import dev.lamina.metadata.DictionaryPageHeader;
import dev.lamina.metadata.Encoding;
import dev.lamina.metadata.PageHeader;
import dev.lamina.metadata.PhysicalType;
import dev.lamina.schema.ColumnSchema;
import dev.lamina.schema.FileSchema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for writing and reading pages.
 */
class PageCodecTest {

    private static final ColumnSchema COLUMN = FileSchema.builder("test")
            .optional("x", PhysicalType.INT32)
            .build()
            .getColumn("x");

    private final CodecFactory codecs = new CodecFactory();

    @Test
    void testHeaderRoundTrip() throws Exception {
        PageHeader header = new PageHeader(PageHeader.PageType.DATA_PAGE, 100, 80, 0xCAFEBABE,
                new DataPageHeader(10, 2, 7, Encoding.DELTA_BINARY_PACKED, Encoding.RLE, Encoding.BIT_PACKED, 3, 5),
                null, null);
        byte[] bytes = PageHeaderCodec.encode(header);

        assertThat(bytes).hasSize(PageHeaderCodec.HEADER_SIZE);
        assertThat(PageHeaderCodec.decode(bytes, 0)).isEqualTo(header);

        PageHeader dictionary = new PageHeader(PageHeader.PageType.DICTIONARY_PAGE, 12, 12, null, null,
                new DictionaryPageHeader(3, Encoding.PLAIN, false), null);
        assertThat(PageHeaderCodec.decode(PageHeaderCodec.encode(dictionary), 0)).isEqualTo(dictionary);

        PageHeader v2 = new PageHeader(PageHeader.PageType.DATA_PAGE_V2, 90, 60, null, null, null,
                new DataPageHeaderV2(10, 2, 7, Encoding.RLE_DICTIONARY, 5, 3, true));
        assertThat(PageHeaderCodec.decode(PageHeaderCodec.encode(v2), 0)).isEqualTo(v2);
    }

    @Test
    void testSortedFlagMustBeZeroOrOne() {
        byte[] bytes = PageHeaderCodec.encode(new PageHeader(PageHeader.PageType.DICTIONARY_PAGE, 12, 12, null,
                null, new DictionaryPageHeader(3, Encoding.PLAIN, true), null));
        bytes[28] = 2;

        assertThatThrownBy(() -> PageHeaderCodec.decode(bytes, 0))
                .isInstanceOf(MalformedEncodingException.class)
                .hasMessageContaining("sorted flag");
    }

    @Test
    void testReservedSlotsMustBeZero() {
        PageHeader dictionary = new PageHeader(PageHeader.PageType.DICTIONARY_PAGE, 12, 12, null, null,
                new DictionaryPageHeader(3, Encoding.PLAIN, false), null);
        for (int slot = 32; slot < PageHeaderCodec.HEADER_SIZE; slot += 4) {
            byte[] bytes = PageHeaderCodec.encode(dictionary);
            bytes[slot] = 1;

            assertThatThrownBy(() -> PageHeaderCodec.decode(bytes, 0))
                    .isInstanceOf(MalformedEncodingException.class)
                    .hasMessageContaining("Reserved page header slot " + slot);
        }

        // crc slot of a page without checksum
        byte[] data = PageHeaderCodec.encode(new PageHeader(PageHeader.PageType.DATA_PAGE, 8, 8, null,
                new DataPageHeader(2, 0, 2, Encoding.PLAIN, Encoding.RLE, Encoding.RLE, 0, 0), null, null));
        data[16] = 7;
        assertThatThrownBy(() -> PageHeaderCodec.decode(data, 0))
                .isInstanceOf(MalformedEncodingException.class)
                .hasMessageContaining("slot 16");

        byte[] v2 = PageHeaderCodec.encode(new PageHeader(PageHeader.PageType.DATA_PAGE_V2, 8, 8, null, null, null,
                new DataPageHeaderV2(2, 0, 2, Encoding.PLAIN, 0, 0, false)));
        v2[40] = 1;
        assertThatThrownBy(() -> PageHeaderCodec.decode(v2, 0))
                .isInstanceOf(MalformedEncodingException.class)
                .hasMessageContaining("slot 40");
    }

    @Test
    void testRowCountAboveValueCountIsMalformed() {
        byte[] bytes = PageHeaderCodec.encode(new PageHeader(PageHeader.PageType.DATA_PAGE, 8, 8, null,
                new DataPageHeader(2, 0, 2, Encoding.PLAIN, Encoding.RLE, Encoding.RLE, 0, 0), null, null));
        bytes[28] = 3;

        assertThatThrownBy(() -> PageHeaderCodec.decode(bytes, 0))
                .isInstanceOf(MalformedEncodingException.class)
                .hasMessageContaining("Row count 3");
    }

    @Test
    void testTruncatedHeaderIsMalformed() {
        assertThatThrownBy(() -> PageHeaderCodec.decode(new byte[40], 0))
                .isInstanceOf(MalformedEncodingException.class)
                .hasMessageContaining("Truncated page header");
    }

    @Test
    void testUnknownPageTypeIsMalformed() {
        byte[] bytes = new byte[PageHeaderCodec.HEADER_SIZE];
        bytes[0] = 9;

        assertThatThrownBy(() -> PageHeaderCodec.decode(bytes, 0))
                .isInstanceOf(MalformedEncodingException.class);
    }

    @Test
    void testDataPageRoundTripWithCompression() throws Exception {
        int[] defs = { 1, 0, 1, 1, 0 };
        byte[] chunk = writeIntPage(defs, new int[]{ 10, 30, 40 }, CompressionCodec.SNAPPY, true);

        PageReader reader = new PageReader(COLUMN, codecs.getDecompressor(CompressionCodec.SNAPPY), true);
        PageReader.RawPage raw = reader.readPage(chunk, 0);
        assertThat(raw.storedSize()).isEqualTo(chunk.length);
        assertThat(raw.header().hasCrc()).isTrue();

        Page page = reader.decodeDataPage(raw, null);
        assertThat(page.size()).isEqualTo(5);
        assertThat(page.getValue(0)).isEqualTo(10);
        assertThat(page.isNull(1)).isTrue();
        assertThat(page.getValue(1)).isNull();
        assertThat(page.getValue(2)).isEqualTo(30);
        assertThat(page.getValue(3)).isEqualTo(40);
        assertThat(page.isNull(4)).isTrue();
    }

    @Test
    void testDictionaryEncodedPage() throws Exception {
        DictionaryEncoder encoder = new DictionaryEncoder(PhysicalType.INT32, null);
        for (int value : new int[]{ 7, 7, 9, 7 }) {
            encoder.writeInt(value);
        }
        PageWriter writer = new PageWriter(codecs.getCompressor(CompressionCodec.UNCOMPRESSED, 0), true);
        EncodedPage dictionaryPage = writer.writeDictionaryPage(encoder.getDictionarySize(),
                encoder.dictionaryPageBytes(encoder.getDictionarySize()));
        int[] defs = { 1, 1, 1, 1 };
        EncodedPage dataPage = writer.writeDataPage(4, 0, 4, Encoding.RLE_DICTIONARY, Encoding.RLE, new byte[0],
                LevelEncoder.encode(Encoding.RLE, defs, 0, 4, 1), encoder.toBytes());
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        dictionaryPage.writeTo(out);
        dataPage.writeTo(out);
        byte[] chunk = out.toByteArray();

        PageReader reader = new PageReader(COLUMN, codecs.getDecompressor(CompressionCodec.UNCOMPRESSED), true);
        PageReader.RawPage rawDictionary = reader.readPage(chunk, 0);
        Dictionary dictionary = reader.readDictionary(rawDictionary);
        assertThat(dictionary.size()).isEqualTo(2);

        Page page = reader.decodeDataPage(reader.readPage(chunk, rawDictionary.storedSize()), dictionary);
        assertThat(page.getValue(0)).isEqualTo(7);
        assertThat(page.getValue(2)).isEqualTo(9);
        assertThat(page.getValue(3)).isEqualTo(7);
    }

    @Test
    void testDictionaryEncodedPageWithoutDictionaryIsMalformed() throws Exception {
        PageWriter writer = new PageWriter(codecs.getCompressor(CompressionCodec.UNCOMPRESSED, 0), false);
        EncodedPage dataPage = writer.writeDataPage(1, 0, 1, Encoding.RLE_DICTIONARY, Encoding.RLE, new byte[0],
                LevelEncoder.encode(Encoding.RLE, new int[]{ 1 }, 0, 1, 1), new byte[]{ 1, 2, 0 });
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        dataPage.writeTo(out);

        PageReader reader = new PageReader(COLUMN, codecs.getDecompressor(CompressionCodec.UNCOMPRESSED), true);
        PageReader.RawPage raw = reader.readPage(out.toByteArray(), 0);
        assertThatThrownBy(() -> reader.decodeDataPage(raw, null))
                .isInstanceOf(MalformedEncodingException.class);
    }

    @Test
    void testCorruptedBodyFailsChecksum() throws Exception {
        int[] defs = new int[64];
        int[] values = new int[48];
        for (int i = 0; i < defs.length; i++) {
            defs[i] = i % 4 == 3 ? 0 : 1;
        }
        for (int i = 0; i < values.length; i++) {
            values[i] = i % 5;
        }

        for (CompressionCodec codec : new CompressionCodec[]{ CompressionCodec.SNAPPY, CompressionCodec.GZIP }) {
            assertEveryBodyByteFailsChecksum(writeIntPage(defs, values, codec, true), codec);
            assertEveryBodyByteFailsChecksum(writeIntPageV2(defs, values, codec), codec);
        }
    }

    private void assertEveryBodyByteFailsChecksum(byte[] chunk, CompressionCodec codec) throws Exception {
        PageReader reader = new PageReader(COLUMN, codecs.getDecompressor(codec), true);
        assertThat(reader.readPage(chunk, 0).header().hasCrc()).isTrue();

        for (int i = PageHeaderCodec.HEADER_SIZE; i < chunk.length; i++) {
            byte[] corrupted = chunk.clone();
            corrupted[i] ^= 0x01;

            assertThatThrownBy(() -> reader.readPage(corrupted, 0))
                    .as("%s page with byte %d flipped", codec, i)
                    .isInstanceOf(ChecksumMismatchException.class);
        }
    }

    @Test
    void testVersion2PageRoundTrip() throws Exception {
        int[] defs = new int[200];
        int[] values = new int[150];
        for (int i = 0; i < defs.length; i++) {
            defs[i] = i % 4 == 1 ? 0 : 1;
        }
        Arrays.fill(values, 7);
        values[0] = 3;
        byte[] chunk = writeIntPageV2(defs, values, CompressionCodec.SNAPPY);

        PageReader reader = new PageReader(COLUMN, codecs.getDecompressor(CompressionCodec.SNAPPY), true);
        PageReader.RawPage raw = reader.readPage(chunk, 0);
        PageHeader header = raw.header();
        assertThat(header.type()).isEqualTo(PageHeader.PageType.DATA_PAGE_V2);
        assertThat(header.isDataPage()).isTrue();
        assertThat(header.numValues()).isEqualTo(200);
        assertThat(header.dataPageHeaderV2().isCompressed()).isTrue();
        assertThat(header.compressedPageSize()).isLessThan(header.uncompressedPageSize());
        assertThat(raw.body()).hasSize(header.uncompressedPageSize());

        Page page = reader.decodeDataPage(raw, null);
        assertThat(page.size()).isEqualTo(200);
        assertThat(page.getValue(0)).isEqualTo(3);
        assertThat(page.isNull(1)).isTrue();
        assertThat(page.getValue(2)).isEqualTo(7);
        assertThat(page.getValue(199)).isEqualTo(7);
    }

    @Test
    void testVersion2PageKeepsIncompressibleValuesUncompressed() throws Exception {
        byte[] chunk = writeIntPageV2(new int[]{ 1, 0 }, new int[]{ 42 }, CompressionCodec.SNAPPY);

        PageReader reader = new PageReader(COLUMN, codecs.getDecompressor(CompressionCodec.SNAPPY), true);
        PageReader.RawPage raw = reader.readPage(chunk, 0);
        assertThat(raw.header().dataPageHeaderV2().isCompressed()).isFalse();
        assertThat(raw.header().compressedPageSize()).isEqualTo(raw.header().uncompressedPageSize());

        Page page = reader.decodeDataPage(raw, null);
        assertThat(page.getValue(0)).isEqualTo(42);
        assertThat(page.isNull(1)).isTrue();
    }

    @Test
    void testDictionaryCountBeyondDataIsMalformed() throws Exception {
        DictionaryEncoder encoder = new DictionaryEncoder(PhysicalType.INT32, null);
        encoder.writeInt(1);
        encoder.writeInt(2);
        PageWriter writer = new PageWriter(codecs.getCompressor(CompressionCodec.UNCOMPRESSED, 0), true);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writer.writeDictionaryPage(encoder.getDictionarySize(), encoder.dictionaryPageBytes(encoder.getDictionarySize()))
                .writeTo(out);
        byte[] chunk = out.toByteArray();
        // high byte of the value count
        chunk[23] ^= 0x40;

        PageReader reader = new PageReader(COLUMN, codecs.getDecompressor(CompressionCodec.UNCOMPRESSED), true);
        PageReader.RawPage raw = reader.readPage(chunk, 0);
        assertThat(raw.header().numValues()).isEqualTo(0x40000002);
        assertThatThrownBy(() -> reader.readDictionary(raw))
                .isInstanceOf(MalformedEncodingException.class)
                .hasMessageContaining("needs at least");
    }

    @Test
    void testRowCountMismatchIsMalformed() throws Exception {
        PageWriter writer = new PageWriter(codecs.getCompressor(CompressionCodec.UNCOMPRESSED, 0), false);
        PlainEncoder values = new PlainEncoder(PhysicalType.INT32, null);
        values.writeInt(1);
        values.writeInt(2);
        EncodedPage page = writer.writeDataPage(2, 0, 1, Encoding.PLAIN, Encoding.RLE, new byte[0],
                LevelEncoder.encode(Encoding.RLE, new int[]{ 1, 1 }, 0, 2, 1), values.toBytes());
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        page.writeTo(out);

        PageReader reader = new PageReader(COLUMN, codecs.getDecompressor(CompressionCodec.UNCOMPRESSED), true);
        PageReader.RawPage raw = reader.readPage(out.toByteArray(), 0);
        assertThatThrownBy(() -> reader.decodeDataPage(raw, null))
                .isInstanceOf(MalformedEncodingException.class)
                .hasMessageContaining("1 rows");
    }

    @Test
    void testPlainValuesShorterThanCountIsMalformed() throws Exception {
        PageWriter writer = new PageWriter(codecs.getCompressor(CompressionCodec.UNCOMPRESSED, 0), false);
        PlainEncoder values = new PlainEncoder(PhysicalType.INT32, null);
        values.writeInt(1);
        EncodedPage page = writer.writeDataPage(3, 0, 3, Encoding.PLAIN, Encoding.RLE, new byte[0],
                LevelEncoder.encode(Encoding.RLE, new int[]{ 1, 1, 1 }, 0, 3, 1), values.toBytes());
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        page.writeTo(out);

        PageReader reader = new PageReader(COLUMN, codecs.getDecompressor(CompressionCodec.UNCOMPRESSED), true);
        PageReader.RawPage raw = reader.readPage(out.toByteArray(), 0);
        assertThatThrownBy(() -> reader.decodeDataPage(raw, null))
                .isInstanceOf(MalformedEncodingException.class)
                .hasMessageContaining("need at least 12 bytes");
    }

    @Test
    void testChecksumVerificationCanBeDisabled() throws Exception {
        byte[] chunk = writeIntPage(new int[]{ 1, 1 }, new int[]{ 1, 2 }, CompressionCodec.UNCOMPRESSED, true);
        chunk[chunk.length - 1] ^= 0x01;

        PageReader reader = new PageReader(COLUMN, codecs.getDecompressor(CompressionCodec.UNCOMPRESSED), false);
        Page page = reader.decodeDataPage(reader.readPage(chunk, 0), null);
        assertThat(page.getValue(1)).isEqualTo(2 ^ (1 << 24));
    }

    @Test
    void testPageWithoutChecksum() throws Exception {
        byte[] chunk = writeIntPage(new int[]{ 1 }, new int[]{ 5 }, CompressionCodec.GZIP, false);

        PageReader reader = new PageReader(COLUMN, codecs.getDecompressor(CompressionCodec.GZIP), true);
        PageReader.RawPage raw = reader.readPage(chunk, 0);
        assertThat(raw.header().hasCrc()).isFalse();
        assertThat(reader.decodeDataPage(raw, null).getValue(0)).isEqualTo(5);
    }

    @Test
    void testUnknownValueEncodingIsNotSupported() throws Exception {
        byte[] chunk = writeIntPage(new int[]{ 1 }, new int[]{ 5 }, CompressionCodec.UNCOMPRESSED, false);
        // value encoding slot
        chunk[32] = 42;

        PageReader reader = new PageReader(COLUMN, codecs.getDecompressor(CompressionCodec.UNCOMPRESSED), true);
        PageReader.RawPage raw = reader.readPage(chunk, 0);
        assertThat(raw.header().dataPageHeader().encoding()).isEqualTo(Encoding.UNKNOWN);
        assertThatThrownBy(() -> reader.decodeDataPage(raw, null))
                .isInstanceOf(EncodingNotSupportedException.class);
    }

    @Test
    void testEncodingNotValidForTypeIsNotSupported() throws Exception {
        byte[] chunk = writeIntPage(new int[]{ 1 }, new int[]{ 5 }, CompressionCodec.UNCOMPRESSED, false);
        chunk[32] = (byte) Encoding.DELTA_LENGTH_BYTE_ARRAY.getId();

        PageReader reader = new PageReader(COLUMN, codecs.getDecompressor(CompressionCodec.UNCOMPRESSED), true);
        assertThatThrownBy(() -> reader.decodeDataPage(reader.readPage(chunk, 0), null))
                .isInstanceOf(EncodingNotSupportedException.class);
    }

    @Test
    void testBodyBeyondChunkIsMalformed() throws Exception {
        byte[] chunk = writeIntPage(new int[]{ 1, 1, 1 }, new int[]{ 1, 2, 3 }, CompressionCodec.UNCOMPRESSED, false);
        byte[] truncated = Arrays.copyOf(chunk, chunk.length - 2);

        PageReader reader = new PageReader(COLUMN, codecs.getDecompressor(CompressionCodec.UNCOMPRESSED), true);
        assertThatThrownBy(() -> reader.readPage(truncated, 0))
                .isInstanceOf(MalformedEncodingException.class);
    }

    @Test
    void testNullCountMismatchIsMalformed() throws Exception {
        PageWriter writer = new PageWriter(codecs.getCompressor(CompressionCodec.UNCOMPRESSED, 0), false);
        PlainEncoder values = new PlainEncoder(PhysicalType.INT32, null);
        values.writeInt(1);
        EncodedPage page = writer.writeDataPage(2, 0, 2, Encoding.PLAIN, Encoding.RLE, new byte[0],
                LevelEncoder.encode(Encoding.RLE, new int[]{ 1, 0 }, 0, 2, 1), values.toBytes());
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        page.writeTo(out);

        PageReader reader = new PageReader(COLUMN, codecs.getDecompressor(CompressionCodec.UNCOMPRESSED), true);
        PageReader.RawPage raw = reader.readPage(out.toByteArray(), 0);
        assertThatThrownBy(() -> reader.decodeDataPage(raw, null))
                .isInstanceOf(MalformedEncodingException.class)
                .hasMessageContaining("nulls");
    }

    private byte[] writeIntPage(int[] defs, int[] nonNullValues, CompressionCodec codec, boolean checksums)
            throws Exception {
        PlainEncoder values = new PlainEncoder(PhysicalType.INT32, null);
        for (int value : nonNullValues) {
            values.writeInt(value);
        }
        int nulls = defs.length - nonNullValues.length;
        PageWriter writer = new PageWriter(codecs.getCompressor(codec, 0), checksums);
        EncodedPage page = writer.writeDataPage(defs.length, nulls, defs.length, Encoding.PLAIN, Encoding.RLE,
                new byte[0], LevelEncoder.encode(Encoding.RLE, defs, 0, defs.length, 1), values.toBytes());
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        page.writeTo(out);
        return out.toByteArray();
    }

    private byte[] writeIntPageV2(int[] defs, int[] nonNullValues, CompressionCodec codec) throws Exception {
        PlainEncoder values = new PlainEncoder(PhysicalType.INT32, null);
        for (int value : nonNullValues) {
            values.writeInt(value);
        }
        int nulls = defs.length - nonNullValues.length;
        PageWriter writer = new PageWriter(codecs.getCompressor(codec, 0), true);
        EncodedPage page = writer.writeDataPageV2(defs.length, nulls, defs.length, Encoding.PLAIN, new byte[0],
                LevelEncoder.encode(Encoding.RLE, defs, 0, defs.length, 1), values.toBytes());
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        page.writeTo(out);
        return out.toByteArray();
    }
}
