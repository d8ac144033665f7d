/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.reader;

/**
 * Settings for reading row groups.
 *
 * @param verifyChecksums whether page checksums are verified when present
 * @param parallel whether the projected column chunks of a row group are decoded concurrently
 */
public record ReaderOptions(boolean verifyChecksums, boolean parallel) {

    private static final ReaderOptions DEFAULTS = new ReaderOptions(true, false);

    public static ReaderOptions defaults() {
        return DEFAULTS;
    }

    public ReaderOptions withVerifyChecksums(boolean verifyChecksums) {
        return new ReaderOptions(verifyChecksums, parallel);
    }

    public ReaderOptions withParallel(boolean parallel) {
        return new ReaderOptions(verifyChecksums, parallel);
    }
}
