/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.internal.compression;

import dev.lamina.MalformedEncodingException;

/**
 * Pass-through codec for uncompressed pages.
 */
public class UncompressedCodec implements Compressor, Decompressor {

    @Override
    public byte[] compress(byte[] uncompressed) {
        return uncompressed;
    }

    @Override
    public byte[] decompress(byte[] compressed, int uncompressedSize) throws MalformedEncodingException {
        if (compressed.length != uncompressedSize) {
            throw new MalformedEncodingException("Uncompressed page size mismatch: header says " + uncompressedSize
                    + ", body has " + compressed.length + " bytes");
        }
        return compressed;
    }

    @Override
    public String getName() {
        return "UNCOMPRESSED";
    }
}
