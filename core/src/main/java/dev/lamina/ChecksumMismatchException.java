/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina;

/**
 * Raised when the CRC-32 stored in a page header does not match the page payload.
 */
public class ChecksumMismatchException extends ColumnarFormatException {

    private final int expected;
    private final int actual;

    public ChecksumMismatchException(int expected, int actual) {
        super(String.format("Page checksum mismatch: expected %08x, computed %08x", expected, actual));
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
