/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.metadata;

/**
 * Data page header.
 *
 * @param numValues number of level slots in the page, including nulls and empty lists
 * @param numNulls number of slots whose definition level is below the column maximum
 * @param numRows number of records starting in the page
 */
public record DataPageHeader(
        int numValues,
        int numNulls,
        int numRows,
        Encoding encoding,
        Encoding definitionLevelEncoding,
        Encoding repetitionLevelEncoding,
        int repetitionLevelsByteLength,
        int definitionLevelsByteLength) {
}
