/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina;

/**
 * Raised when a page references an encoding or compression codec this library cannot handle,
 * either because the id is unknown or because the encoding does not apply to the column type.
 */
public class EncodingNotSupportedException extends ColumnarFormatException {

    public EncodingNotSupportedException(String message) {
        super(message);
    }
}
