/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.internal.page;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.zip.CRC32;

import dev.lamina.ChecksumMismatchException;
import dev.lamina.EncodingNotSupportedException;
import dev.lamina.MalformedEncodingException;
import dev.lamina.internal.compression.Decompressor;
import dev.lamina.internal.encoding.BytesUtils;
import dev.lamina.internal.encoding.DeltaBinaryPackedDecoder;
import dev.lamina.internal.encoding.DeltaByteArrayDecoder;
import dev.lamina.internal.encoding.DeltaLengthByteArrayDecoder;
import dev.lamina.internal.encoding.LevelDecoder;
import dev.lamina.internal.encoding.PlainDecoder;
import dev.lamina.internal.encoding.RleBitPackingHybridDecoder;
import dev.lamina.internal.encoding.ValueDecoder;
import dev.lamina.metadata.DataPageHeader;
import dev.lamina.metadata.DataPageHeaderV2;
import dev.lamina.metadata.Encoding;
import dev.lamina.metadata.PageHeader;
import dev.lamina.metadata.PhysicalType;
import dev.lamina.schema.ColumnSchema;

/**
 * Decoder for individual pages of a column chunk.
 * <p>
 * {@link #readPage(byte[], int)} parses the header at a position of the chunk, verifies the
 * checksum and decompresses the body. Dictionary and data pages are then decoded via
 * {@link #readDictionary} and {@link #decodeDataPage}.
 * </p>
 * <p>
 * Version 2 data pages store their levels uncompressed ahead of the values. Their body is
 * reassembled into the same levels-then-values layout as a version 1 body.
 * </p>
 */
public class PageReader {

    /**
     * A page whose body has been verified and decompressed.
     *
     * @param header the page header
     * @param body the uncompressed body: repetition levels, definition levels and values for data pages
     * @param storedSize bytes the page occupies in the chunk, header included
     */
    public record RawPage(PageHeader header, byte[] body, int storedSize) {
    }

    private final ColumnSchema column;
    private final Decompressor decompressor;
    private final boolean verifyChecksums;

    public PageReader(ColumnSchema column, Decompressor decompressor, boolean verifyChecksums) {
        this.column = column;
        this.decompressor = decompressor;
        this.verifyChecksums = verifyChecksums;
    }

    public RawPage readPage(byte[] chunk, int position) throws IOException {
        PageHeader header = PageHeaderCodec.decode(chunk, position);
        int bodyOffset = position + PageHeaderCodec.HEADER_SIZE;
        int compressedSize = header.compressedPageSize();
        if (compressedSize > chunk.length - bodyOffset) {
            throw new MalformedEncodingException("Page body of " + compressedSize + " bytes exceeds column chunk; "
                    + (chunk.length - bodyOffset) + " bytes remaining");
        }
        byte[] compressed = Arrays.copyOfRange(chunk, bodyOffset, bodyOffset + compressedSize);

        if (verifyChecksums && header.hasCrc()) {
            CRC32 crc = new CRC32();
            crc.update(compressed);
            int actual = (int) crc.getValue();
            if (actual != header.crc()) {
                throw new ChecksumMismatchException(header.crc(), actual);
            }
        }

        byte[] body = header.type() == PageHeader.PageType.DATA_PAGE_V2
                ? assembleV2Body(header, compressed)
                : decompressor.decompress(compressed, header.uncompressedPageSize());
        return new RawPage(header, body, PageHeaderCodec.HEADER_SIZE + compressedSize);
    }

    private byte[] assembleV2Body(PageHeader header, byte[] stored) throws IOException {
        DataPageHeaderV2 dataHeader = header.dataPageHeaderV2();
        if (!dataHeader.isCompressed()) {
            return stored;
        }
        int levelsLength = dataHeader.repetitionLevelsByteLength() + dataHeader.definitionLevelsByteLength();
        byte[] values = decompressor.decompress(Arrays.copyOfRange(stored, levelsLength, stored.length),
                header.uncompressedPageSize() - levelsLength);
        byte[] body = Arrays.copyOf(stored, levelsLength + values.length);
        System.arraycopy(values, 0, body, levelsLength, values.length);
        return body;
    }

    public Dictionary readDictionary(RawPage page) throws IOException {
        Encoding encoding = page.header().dictionaryPageHeader().encoding();
        if (encoding != Encoding.PLAIN && encoding != Encoding.PLAIN_DICTIONARY) {
            throw new EncodingNotSupportedException("Unsupported dictionary page encoding: " + encoding);
        }
        return Dictionary.parse(page.body(), page.header().dictionaryPageHeader().numValues(),
                column.type(), column.typeLength());
    }

    /**
     * Decode a data page.
     *
     * @param dictionary dictionary of the column chunk, or null if there is none
     */
    public Page decodeDataPage(RawPage page, Dictionary dictionary) throws IOException {
        PageHeader pageHeader = page.header();
        DataPageHeader header = switch (pageHeader.type()) {
            case DATA_PAGE -> pageHeader.dataPageHeader();
            case DATA_PAGE_V2 -> pageHeader.dataPageHeaderV2().toDataPageHeader();
            case DICTIONARY_PAGE -> throw new IllegalArgumentException("Not a data page: " + pageHeader.type());
        };
        byte[] data = page.body();
        int numValues = header.numValues();

        int repLength = header.repetitionLevelsByteLength();
        int defLength = header.definitionLevelsByteLength();
        if ((long) repLength + defLength > data.length) {
            throw new MalformedEncodingException("Level sections of " + (repLength + defLength)
                    + " bytes exceed page body of " + data.length + " bytes");
        }

        int[] repetitionLevels = null;
        if (column.maxRepetitionLevel() > 0) {
            repetitionLevels = LevelDecoder.decode(checkLevelEncoding(header.repetitionLevelEncoding()),
                    data, 0, repLength, numValues, column.maxRepetitionLevel());
        }

        int[] definitionLevels = null;
        if (column.maxDefinitionLevel() > 0) {
            definitionLevels = LevelDecoder.decode(checkLevelEncoding(header.definitionLevelEncoding()),
                    data, repLength, defLength, numValues, column.maxDefinitionLevel());
        }

        int nonNulls = ValueDecoder.countNonNulls(definitionLevels, numValues, column.maxDefinitionLevel());
        if (numValues - nonNulls != header.numNulls()) {
            throw new MalformedEncodingException("Page declares " + header.numNulls() + " nulls, but definition levels "
                    + "describe " + (numValues - nonNulls));
        }
        int rows = countRows(repetitionLevels, numValues);
        if (rows != header.numRows()) {
            throw new MalformedEncodingException("Page declares " + header.numRows() + " rows, but repetition levels "
                    + "describe " + rows);
        }

        int valuesOffset = repLength + defLength;
        long minimumValueBytes = (long) nonNulls * minimumPlainWidth(column.type(), column.typeLength());
        if (header.encoding() == Encoding.PLAIN && minimumValueBytes > data.length - valuesOffset) {
            throw new MalformedEncodingException(nonNulls + " PLAIN " + column.type() + " values need at least "
                    + minimumValueBytes + " bytes, page holds " + (data.length - valuesOffset));
        }
        ByteArrayInputStream dataStream = new ByteArrayInputStream(data, valuesOffset, data.length - valuesOffset);
        return decodeTypedValues(header.encoding(), dataStream, data, valuesOffset, numValues,
                definitionLevels, repetitionLevels, dictionary);
    }

    private static int countRows(int[] repetitionLevels, int numValues) {
        if (repetitionLevels == null) {
            return numValues;
        }
        int rows = 0;
        for (int i = 0; i < numValues; i++) {
            if (repetitionLevels[i] == 0) {
                rows++;
            }
        }
        return rows;
    }

    /**
     * Smallest number of bytes a single non-null value occupies in PLAIN encoding.
     */
    static int minimumPlainWidth(PhysicalType type, Integer typeLength) {
        return switch (type) {
            case BOOLEAN -> 0;
            case BYTE_ARRAY -> 4;
            case FIXED_LEN_BYTE_ARRAY -> typeLength == null ? 0 : typeLength;
            default -> type.getByteWidth();
        };
    }

    private static Encoding checkLevelEncoding(Encoding encoding) throws EncodingNotSupportedException {
        if (!encoding.supportsLevels()) {
            throw new EncodingNotSupportedException("Unsupported level encoding: " + encoding);
        }
        return encoding;
    }

    /**
     * Decode values into Page using primitive arrays.
     */
    private Page decodeTypedValues(Encoding encoding, ByteArrayInputStream dataStream, byte[] data, int valuesOffset,
                                   int numValues, int[] definitionLevels, int[] repetitionLevels,
                                   Dictionary dictionary) throws IOException {
        int maxDefLevel = column.maxDefinitionLevel();
        PhysicalType type = column.type();

        if (encoding.isDictionary()) {
            if (type == PhysicalType.BOOLEAN) {
                throw new EncodingNotSupportedException(encoding + " is not supported for BOOLEAN columns");
            }
            if (dictionary == null) {
                throw new MalformedEncodingException("Dictionary page not found for " + encoding + " encoding");
            }
            int bitWidth = dataStream.read();
            if (bitWidth < 0) {
                throw new MalformedEncodingException("Failed to read bit width for dictionary indices");
            }
            RleBitPackingHybridDecoder indexDecoder = new RleBitPackingHybridDecoder(
                    data, valuesOffset + 1, data.length - valuesOffset - 1, bitWidth);
            return dictionary.decodePage(indexDecoder, numValues, definitionLevels, repetitionLevels, maxDefLevel);
        }

        if (!encoding.supportsValuesOf(type)) {
            throw new EncodingNotSupportedException("Encoding " + encoding + " is not supported for " + type + " columns");
        }

        switch (encoding) {
            case PLAIN -> {
                return decodeWith(new PlainDecoder(dataStream, type, column.typeLength()), numValues,
                        definitionLevels, repetitionLevels);
            }
            case DELTA_BINARY_PACKED -> {
                return decodeWith(new DeltaBinaryPackedDecoder(dataStream), numValues,
                        definitionLevels, repetitionLevels);
            }
            case RLE -> {
                // RLE encoding for boolean values uses bit-width of 1
                int rleLength = BytesUtils.readIntLittleEndian(dataStream);
                int available = data.length - valuesOffset - 4;
                if (rleLength < 0 || rleLength > available) {
                    throw new MalformedEncodingException("Invalid RLE data length " + rleLength + ", "
                            + available + " bytes available");
                }
                RleBitPackingHybridDecoder decoder = new RleBitPackingHybridDecoder(
                        data, valuesOffset + 4, rleLength, 1);
                boolean[] values = new boolean[numValues];
                decoder.readBooleans(values, definitionLevels, maxDefLevel);
                return new Page.BooleanPage(values, definitionLevels, repetitionLevels, maxDefLevel, numValues);
            }
            case DELTA_LENGTH_BYTE_ARRAY -> {
                DeltaLengthByteArrayDecoder decoder = new DeltaLengthByteArrayDecoder(dataStream);
                decoder.initialize(ValueDecoder.countNonNulls(definitionLevels, numValues, maxDefLevel));
                return decodeWith(decoder, numValues, definitionLevels, repetitionLevels);
            }
            case DELTA_BYTE_ARRAY -> {
                DeltaByteArrayDecoder decoder = new DeltaByteArrayDecoder(dataStream);
                decoder.initialize(ValueDecoder.countNonNulls(definitionLevels, numValues, maxDefLevel));
                return decodeWith(decoder, numValues, definitionLevels, repetitionLevels);
            }
            default -> throw new EncodingNotSupportedException("Encoding not supported: " + encoding);
        }
    }

    private Page decodeWith(ValueDecoder decoder, int numValues, int[] definitionLevels, int[] repetitionLevels)
            throws IOException {
        int maxDefLevel = column.maxDefinitionLevel();
        return switch (column.type()) {
            case INT64 -> {
                long[] values = new long[numValues];
                decoder.readLongs(values, definitionLevels, maxDefLevel);
                yield new Page.LongPage(values, definitionLevels, repetitionLevels, maxDefLevel, numValues);
            }
            case DOUBLE -> {
                double[] values = new double[numValues];
                decoder.readDoubles(values, definitionLevels, maxDefLevel);
                yield new Page.DoublePage(values, definitionLevels, repetitionLevels, maxDefLevel, numValues);
            }
            case INT32 -> {
                int[] values = new int[numValues];
                decoder.readInts(values, definitionLevels, maxDefLevel);
                yield new Page.IntPage(values, definitionLevels, repetitionLevels, maxDefLevel, numValues);
            }
            case FLOAT -> {
                float[] values = new float[numValues];
                decoder.readFloats(values, definitionLevels, maxDefLevel);
                yield new Page.FloatPage(values, definitionLevels, repetitionLevels, maxDefLevel, numValues);
            }
            case BOOLEAN -> {
                boolean[] values = new boolean[numValues];
                decoder.readBooleans(values, definitionLevels, maxDefLevel);
                yield new Page.BooleanPage(values, definitionLevels, repetitionLevels, maxDefLevel, numValues);
            }
            case BYTE_ARRAY, FIXED_LEN_BYTE_ARRAY, INT96 -> {
                byte[][] values = new byte[numValues][];
                decoder.readByteArrays(values, definitionLevels, maxDefLevel);
                yield new Page.ByteArrayPage(values, definitionLevels, repetitionLevels, maxDefLevel, numValues);
            }
        };
    }
}
