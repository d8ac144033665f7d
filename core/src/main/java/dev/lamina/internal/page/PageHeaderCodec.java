/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.internal.page;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import dev.lamina.MalformedEncodingException;
import dev.lamina.metadata.DataPageHeader;
import dev.lamina.metadata.DataPageHeaderV2;
import dev.lamina.metadata.DictionaryPageHeader;
import dev.lamina.metadata.Encoding;
import dev.lamina.metadata.PageHeader;

/**
 * Fixed-width binary form of {@link PageHeader}.
 * <p>
 * The header consists of 13 little-endian int32 slots:
 * </p>
 * <pre>
 *  0 page type          4 uncompressed size   8 compressed size   12 crc present (0/1)   16 crc
 * 20 value count
 * data pages:        24 null count  28 row count  32 encoding  36 def level encoding
 *                    40 rep level encoding  44 rep levels byte length  48 def levels byte length
 * data pages v2:     24 null count  28 row count  32 encoding  36 values compressed (0/1)
 *                    40 reserved (0)  44 rep levels byte length  48 def levels byte length
 * dictionary pages:  24 encoding  28 sorted (0/1); remaining slots are zero
 * </pre>
 * <p>
 * Sizes count the page body only. For version 2 data pages they include the uncompressed level
 * sections.
 * </p>
 */
public final class PageHeaderCodec {

    public static final int HEADER_SIZE = 52;

    private PageHeaderCodec() {
    }

    public static byte[] encode(PageHeader header) {
        ByteBuffer buffer = ByteBuffer.allocate(HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        buffer.putInt(header.type().getId());
        buffer.putInt(header.uncompressedPageSize());
        buffer.putInt(header.compressedPageSize());
        buffer.putInt(header.hasCrc() ? 1 : 0);
        buffer.putInt(header.hasCrc() ? header.crc() : 0);
        switch (header.type()) {
            case DATA_PAGE -> {
                DataPageHeader data = header.dataPageHeader();
                buffer.putInt(data.numValues());
                buffer.putInt(data.numNulls());
                buffer.putInt(data.numRows());
                buffer.putInt(data.encoding().getId());
                buffer.putInt(data.definitionLevelEncoding().getId());
                buffer.putInt(data.repetitionLevelEncoding().getId());
                buffer.putInt(data.repetitionLevelsByteLength());
                buffer.putInt(data.definitionLevelsByteLength());
            }
            case DICTIONARY_PAGE -> {
                DictionaryPageHeader dictionary = header.dictionaryPageHeader();
                buffer.putInt(dictionary.numValues());
                buffer.putInt(dictionary.encoding().getId());
                buffer.putInt(dictionary.isSorted() ? 1 : 0);
            }
            case DATA_PAGE_V2 -> {
                DataPageHeaderV2 data = header.dataPageHeaderV2();
                buffer.putInt(data.numValues());
                buffer.putInt(data.numNulls());
                buffer.putInt(data.numRows());
                buffer.putInt(data.encoding().getId());
                buffer.putInt(data.isCompressed() ? 1 : 0);
                buffer.putInt(0);
                buffer.putInt(data.repetitionLevelsByteLength());
                buffer.putInt(data.definitionLevelsByteLength());
            }
        }
        return buffer.array();
    }

    /**
     * Reads a header starting at {@code offset}.
     *
     * @throws MalformedEncodingException if fewer than {@link #HEADER_SIZE} bytes remain or a field is out of range
     */
    public static PageHeader decode(byte[] data, int offset) throws MalformedEncodingException {
        if (offset < 0 || data.length - offset < HEADER_SIZE) {
            throw new MalformedEncodingException("Truncated page header: " + (data.length - offset)
                    + " bytes remaining, " + HEADER_SIZE + " required");
        }
        ByteBuffer buffer = ByteBuffer.wrap(data, offset, HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);

        int typeId = buffer.getInt();
        PageHeader.PageType type;
        try {
            type = PageHeader.PageType.fromId(typeId);
        }
        catch (IllegalArgumentException e) {
            throw new MalformedEncodingException("Unknown page type: " + typeId, e);
        }
        int uncompressedSize = nonNegative(buffer.getInt(), "uncompressed page size");
        int compressedSize = nonNegative(buffer.getInt(), "compressed page size");
        boolean hasCrc = flag(buffer.getInt(), "checksum flag");
        int crcValue = buffer.getInt();
        if (!hasCrc) {
            reserved(crcValue, 16);
        }
        Integer crc = hasCrc ? crcValue : null;
        int numValues = nonNegative(buffer.getInt(), "value count");

        return switch (type) {
            case DATA_PAGE -> {
                int numNulls = nonNegative(buffer.getInt(), "null count");
                int numRows = nonNegative(buffer.getInt(), "row count");
                Encoding encoding = Encoding.fromId(buffer.getInt());
                Encoding defEncoding = Encoding.fromId(buffer.getInt());
                Encoding repEncoding = Encoding.fromId(buffer.getInt());
                int repLength = nonNegative(buffer.getInt(), "repetition levels length");
                int defLength = nonNegative(buffer.getInt(), "definition levels length");
                checkCounts(numValues, numNulls, numRows);
                yield new PageHeader(type, uncompressedSize, compressedSize, crc,
                        new DataPageHeader(numValues, numNulls, numRows, encoding, defEncoding, repEncoding,
                                repLength, defLength),
                        null, null);
            }
            case DICTIONARY_PAGE -> {
                Encoding encoding = Encoding.fromId(buffer.getInt());
                boolean sorted = flag(buffer.getInt(), "sorted flag");
                for (int slot = 32; slot < HEADER_SIZE; slot += 4) {
                    reserved(buffer.getInt(), slot);
                }
                yield new PageHeader(type, uncompressedSize, compressedSize, crc, null,
                        new DictionaryPageHeader(numValues, encoding, sorted), null);
            }
            case DATA_PAGE_V2 -> {
                int numNulls = nonNegative(buffer.getInt(), "null count");
                int numRows = nonNegative(buffer.getInt(), "row count");
                Encoding encoding = Encoding.fromId(buffer.getInt());
                boolean compressed = flag(buffer.getInt(), "compressed flag");
                reserved(buffer.getInt(), 40);
                int repLength = nonNegative(buffer.getInt(), "repetition levels length");
                int defLength = nonNegative(buffer.getInt(), "definition levels length");
                checkCounts(numValues, numNulls, numRows);
                if ((long) repLength + defLength > compressedSize || (long) repLength + defLength > uncompressedSize) {
                    throw new MalformedEncodingException("Level sections of " + ((long) repLength + defLength)
                            + " bytes exceed page body sizes " + compressedSize + "/" + uncompressedSize);
                }
                if (!compressed && compressedSize != uncompressedSize) {
                    throw new MalformedEncodingException("Uncompressed page declares differing sizes: "
                            + compressedSize + " stored, " + uncompressedSize + " uncompressed");
                }
                yield new PageHeader(type, uncompressedSize, compressedSize, crc, null, null,
                        new DataPageHeaderV2(numValues, numNulls, numRows, encoding, defLength, repLength, compressed));
            }
        };
    }

    private static void checkCounts(int numValues, int numNulls, int numRows) throws MalformedEncodingException {
        if (numNulls > numValues) {
            throw new MalformedEncodingException("Null count " + numNulls + " exceeds value count " + numValues);
        }
        if (numRows > numValues) {
            throw new MalformedEncodingException("Row count " + numRows + " exceeds value count " + numValues);
        }
    }

    private static boolean flag(int value, String field) throws MalformedEncodingException {
        if (value != 0 && value != 1) {
            throw new MalformedEncodingException("Invalid " + field + " in page header: " + value);
        }
        return value == 1;
    }

    private static void reserved(int value, int slot) throws MalformedEncodingException {
        if (value != 0) {
            throw new MalformedEncodingException("Reserved page header slot " + slot + " must be zero, found " + value);
        }
    }

    private static int nonNegative(int value, String field) throws MalformedEncodingException {
        if (value < 0) {
            throw new MalformedEncodingException("Negative " + field + " in page header: " + value);
        }
        return value;
    }
}
