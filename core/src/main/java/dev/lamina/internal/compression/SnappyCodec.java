/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.internal.compression;

import java.io.IOException;

import org.xerial.snappy.Snappy;

import dev.lamina.MalformedEncodingException;

/**
 * Codec for Snappy compressed data. The length recorded at the start of the stream must match the
 * declared size before anything is decompressed.
 */
public class SnappyCodec implements Compressor, Decompressor {

    @Override
    public byte[] compress(byte[] uncompressed) throws IOException {
        return Snappy.compress(uncompressed);
    }

    @Override
    public byte[] decompress(byte[] compressed, int uncompressedSize) throws IOException {
        int declared;
        byte[] uncompressed;
        try {
            declared = Snappy.uncompressedLength(compressed);
            uncompressed = declared == uncompressedSize ? Snappy.uncompress(compressed) : null;
        }
        catch (IOException e) {
            throw new MalformedEncodingException("Snappy decompression failed", e);
        }
        if (uncompressed == null) {
            throw new MalformedEncodingException("Snappy data holds " + declared + " bytes, expected " + uncompressedSize);
        }

        if (uncompressed.length != uncompressedSize) {
            throw new MalformedEncodingException(
                    "Snappy decompression size mismatch: expected " + uncompressedSize + ", got " + uncompressed.length);
        }
        return uncompressed;
    }

    @Override
    public String getName() {
        return "SNAPPY";
    }
}
