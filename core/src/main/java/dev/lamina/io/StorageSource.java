/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.io;

import java.io.IOException;

/**
 * Source of previously written bytes.
 */
public interface StorageSource {

    /**
     * Reads exactly the bytes of the given range.
     *
     * @throws java.io.EOFException if the range extends beyond the stored data
     */
    byte[] read(ByteRange range) throws IOException;
}
