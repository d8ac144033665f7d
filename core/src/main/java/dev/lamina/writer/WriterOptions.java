/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.writer;

import java.util.EnumMap;
import java.util.Map;

import dev.lamina.metadata.CompressionCodec;
import dev.lamina.metadata.Encoding;
import dev.lamina.metadata.PhysicalType;

/**
 * Immutable settings for writing row groups. Obtain instances through {@link #builder()};
 * {@link #defaults()} returns the default configuration.
 */
public final class WriterOptions {

    public static final int DEFAULT_PAGE_SIZE_BYTES = 1024 * 1024;
    public static final int DEFAULT_PAGE_VALUE_COUNT_LIMIT = 20_000;
    public static final long DEFAULT_ROW_GROUP_ROW_COUNT = 1_000_000;
    public static final long DEFAULT_ROW_GROUP_SIZE_BYTES = 128L * 1024 * 1024;
    public static final int DEFAULT_DICTIONARY_MAX_ENTRIES = 1 << 16;
    public static final int DEFAULT_DICTIONARY_PAGE_SIZE_LIMIT = 1024 * 1024;

    private static final WriterOptions DEFAULTS = builder().build();

    private final int pageSizeBytes;
    private final int pageValueCountLimit;
    private final long rowGroupRowCount;
    private final long rowGroupSizeBytes;
    private final boolean dictionaryEnabled;
    private final int dictionaryMaxEntries;
    private final int dictionaryPageSizeLimit;
    private final Map<PhysicalType, Encoding> fallbackEncodings;
    private final Encoding levelEncoding;
    private final DataPageVersion dataPageVersion;
    private final CompressionCodec codec;
    private final int compressionLevel;
    private final boolean writeChecksums;
    private final boolean parallel;

    private WriterOptions(Builder builder) {
        this.pageSizeBytes = builder.pageSizeBytes;
        this.pageValueCountLimit = builder.pageValueCountLimit;
        this.rowGroupRowCount = builder.rowGroupRowCount;
        this.rowGroupSizeBytes = builder.rowGroupSizeBytes;
        this.dictionaryEnabled = builder.dictionaryEnabled;
        this.dictionaryMaxEntries = builder.dictionaryMaxEntries;
        this.dictionaryPageSizeLimit = builder.dictionaryPageSizeLimit;
        this.fallbackEncodings = new EnumMap<>(builder.fallbackEncodings);
        this.levelEncoding = builder.levelEncoding;
        this.dataPageVersion = builder.dataPageVersion;
        this.codec = builder.codec;
        this.compressionLevel = builder.compressionLevel;
        this.writeChecksums = builder.writeChecksums;
        this.parallel = builder.parallel;
    }

    public static WriterOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Estimated encoded size at which a data page is flushed.
     */
    public int getPageSizeBytes() {
        return pageSizeBytes;
    }

    /**
     * Number of level slots (values including nulls) at which a data page is flushed.
     */
    public int getPageValueCountLimit() {
        return pageValueCountLimit;
    }

    public long getRowGroupRowCount() {
        return rowGroupRowCount;
    }

    public long getRowGroupSizeBytes() {
        return rowGroupSizeBytes;
    }

    public boolean isDictionaryEnabled() {
        return dictionaryEnabled;
    }

    public int getDictionaryMaxEntries() {
        return dictionaryMaxEntries;
    }

    public int getDictionaryPageSizeLimit() {
        return dictionaryPageSizeLimit;
    }

    /**
     * Encoding used for columns of the given type when no dictionary is used.
     */
    public Encoding getFallbackEncoding(PhysicalType type) {
        return fallbackEncodings.getOrDefault(type, Encoding.PLAIN);
    }

    public Encoding getLevelEncoding() {
        return levelEncoding;
    }

    public DataPageVersion getDataPageVersion() {
        return dataPageVersion;
    }

    public CompressionCodec getCodec() {
        return codec;
    }

    /**
     * Codec specific compression level; 0 selects the codec's default.
     */
    public int getCompressionLevel() {
        return compressionLevel;
    }

    public boolean isWriteChecksums() {
        return writeChecksums;
    }

    /**
     * Whether the column chunks of a row group are encoded concurrently.
     */
    public boolean isParallel() {
        return parallel;
    }

    @Override
    public String toString() {
        return "WriterOptions[pageSizeBytes=" + pageSizeBytes +
                ", pageValueCountLimit=" + pageValueCountLimit +
                ", rowGroupRowCount=" + rowGroupRowCount +
                ", rowGroupSizeBytes=" + rowGroupSizeBytes +
                ", dictionaryEnabled=" + dictionaryEnabled +
                ", dictionaryMaxEntries=" + dictionaryMaxEntries +
                ", dictionaryPageSizeLimit=" + dictionaryPageSizeLimit +
                ", fallbackEncodings=" + fallbackEncodings +
                ", levelEncoding=" + levelEncoding +
                ", dataPageVersion=" + dataPageVersion +
                ", codec=" + codec +
                ", compressionLevel=" + compressionLevel +
                ", writeChecksums=" + writeChecksums +
                ", parallel=" + parallel + "]";
    }

    public static final class Builder {

        private int pageSizeBytes = DEFAULT_PAGE_SIZE_BYTES;
        private int pageValueCountLimit = DEFAULT_PAGE_VALUE_COUNT_LIMIT;
        private long rowGroupRowCount = DEFAULT_ROW_GROUP_ROW_COUNT;
        private long rowGroupSizeBytes = DEFAULT_ROW_GROUP_SIZE_BYTES;
        private boolean dictionaryEnabled = true;
        private int dictionaryMaxEntries = DEFAULT_DICTIONARY_MAX_ENTRIES;
        private int dictionaryPageSizeLimit = DEFAULT_DICTIONARY_PAGE_SIZE_LIMIT;
        private final Map<PhysicalType, Encoding> fallbackEncodings = new EnumMap<>(PhysicalType.class);
        private Encoding levelEncoding = Encoding.RLE;
        private DataPageVersion dataPageVersion = DataPageVersion.V1;
        private CompressionCodec codec = CompressionCodec.UNCOMPRESSED;
        private int compressionLevel;
        private boolean writeChecksums = true;
        private boolean parallel;

        private Builder() {
        }

        public Builder pageSizeBytes(int pageSizeBytes) {
            this.pageSizeBytes = requirePositive(pageSizeBytes, "pageSizeBytes");
            return this;
        }

        public Builder pageValueCountLimit(int pageValueCountLimit) {
            this.pageValueCountLimit = requirePositive(pageValueCountLimit, "pageValueCountLimit");
            return this;
        }

        public Builder rowGroupRowCount(long rowGroupRowCount) {
            this.rowGroupRowCount = requirePositive(rowGroupRowCount, "rowGroupRowCount");
            return this;
        }

        public Builder rowGroupSizeBytes(long rowGroupSizeBytes) {
            this.rowGroupSizeBytes = requirePositive(rowGroupSizeBytes, "rowGroupSizeBytes");
            return this;
        }

        public Builder dictionaryEnabled(boolean dictionaryEnabled) {
            this.dictionaryEnabled = dictionaryEnabled;
            return this;
        }

        /**
         * Number of distinct values above which a column chunk falls back to its non-dictionary encoding.
         */
        public Builder dictionaryMaxEntries(int dictionaryMaxEntries) {
            this.dictionaryMaxEntries = requirePositive(dictionaryMaxEntries, "dictionaryMaxEntries");
            return this;
        }

        /**
         * PLAIN encoded dictionary size above which a column chunk falls back to its non-dictionary encoding.
         */
        public Builder dictionaryPageSizeLimit(int dictionaryPageSizeLimit) {
            this.dictionaryPageSizeLimit = requirePositive(dictionaryPageSizeLimit, "dictionaryPageSizeLimit");
            return this;
        }

        /**
         * Sets the non-dictionary encoding for columns of the given type.
         *
         * @throws IllegalArgumentException if the encoding cannot encode values of that type
         */
        public Builder fallbackEncoding(PhysicalType type, Encoding encoding) {
            if (encoding.isDictionary() || !encoding.supportsValuesOf(type)) {
                throw new IllegalArgumentException("Encoding " + encoding + " cannot be used for " + type + " values");
            }
            fallbackEncodings.put(type, encoding);
            return this;
        }

        public Builder levelEncoding(Encoding levelEncoding) {
            if (!levelEncoding.supportsLevels()) {
                throw new IllegalArgumentException("Encoding " + levelEncoding + " cannot be used for levels");
            }
            this.levelEncoding = levelEncoding;
            return this;
        }

        public Builder dataPageVersion(DataPageVersion dataPageVersion) {
            this.dataPageVersion = dataPageVersion;
            return this;
        }

        public Builder codec(CompressionCodec codec) {
            this.codec = codec;
            return this;
        }

        public Builder compressionLevel(int compressionLevel) {
            this.compressionLevel = compressionLevel;
            return this;
        }

        public Builder writeChecksums(boolean writeChecksums) {
            this.writeChecksums = writeChecksums;
            return this;
        }

        public Builder parallel(boolean parallel) {
            this.parallel = parallel;
            return this;
        }

        /**
         * @throws IllegalArgumentException if version 2 data pages are combined with a level encoding other than RLE
         */
        public WriterOptions build() {
            if (dataPageVersion == DataPageVersion.V2 && levelEncoding != Encoding.RLE) {
                throw new IllegalArgumentException("Data page version V2 requires RLE levels, not " + levelEncoding);
            }
            return new WriterOptions(this);
        }

        private static long requirePositive(long value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive: " + value);
            }
            return value;
        }

        private static int requirePositive(int value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive: " + value);
            }
            return value;
        }
    }
}
