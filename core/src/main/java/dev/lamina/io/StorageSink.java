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
 * Destination for encoded column chunks and metadata.
 */
public interface StorageSink {

    /**
     * Writes the given bytes.
     *
     * @param offsetHint the offset the writer expects the bytes to land at; implementations may
     *                   place them elsewhere and report the actual location
     * @return the range the bytes were written to
     */
    ByteRange write(long offsetHint, byte[] bytes) throws IOException;
}
