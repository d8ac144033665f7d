/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina;

/**
 * Raised during record assembly when the level streams of the columns cannot describe
 * a valid sequence of records: misaligned repetition levels, levels out of range,
 * or columns that disagree on the number of records.
 */
public class StructuralCorruptionException extends ColumnarFormatException {

    public StructuralCorruptionException(String message) {
        super(message);
    }
}
