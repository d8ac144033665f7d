/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.writer;

/**
 * Layout of the data pages a writer produces.
 */
public enum DataPageVersion {

    /**
     * Levels and values are compressed together; levels may be RLE or BIT_PACKED encoded.
     */
    V1,

    /**
     * RLE encoded levels are stored uncompressed ahead of the compressed values.
     */
    V2
}
