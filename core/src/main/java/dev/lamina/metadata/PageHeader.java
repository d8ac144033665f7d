/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.metadata;

/**
 * Header for a page.
 *
 * @param crc CRC-32 of the page body as stored (compressed), or null if the page carries no checksum
 */
public record PageHeader(
        PageType type,
        int uncompressedPageSize,
        int compressedPageSize,
        Integer crc,
        DataPageHeader dataPageHeader,
        DictionaryPageHeader dictionaryPageHeader,
        DataPageHeaderV2 dataPageHeaderV2) {

    public enum PageType {
        DATA_PAGE(0),
        DICTIONARY_PAGE(2),
        DATA_PAGE_V2(3);

        private final int id;

        PageType(int id) {
            this.id = id;
        }

        public int getId() {
            return id;
        }

        public static PageType fromId(int value) {
            for (PageType type : values()) {
                if (type.id == value) {
                    return type;
                }
            }
            throw new IllegalArgumentException("Unknown page type: " + value);
        }
    }

    public boolean hasCrc() {
        return crc != null;
    }

    public boolean isDataPage() {
        return type != PageType.DICTIONARY_PAGE;
    }

    /**
     * Number of level slots of a data page, or number of entries of a dictionary page.
     */
    public int numValues() {
        return switch (type) {
            case DATA_PAGE -> dataPageHeader.numValues();
            case DICTIONARY_PAGE -> dictionaryPageHeader.numValues();
            case DATA_PAGE_V2 -> dataPageHeaderV2.numValues();
        };
    }
}
