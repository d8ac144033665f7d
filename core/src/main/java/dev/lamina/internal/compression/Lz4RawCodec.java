/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.internal.compression;

import java.io.IOException;

import net.jpountz.lz4.LZ4Compressor;
import net.jpountz.lz4.LZ4Exception;
import net.jpountz.lz4.LZ4Factory;
import net.jpountz.lz4.LZ4SafeDecompressor;

import dev.lamina.MalformedEncodingException;

/**
 * Codec for LZ4_RAW compressed data (standard LZ4 block format, no framing).
 */
public class Lz4RawCodec implements Compressor, Decompressor {

    // an LZ4 sequence expands to at most 255 bytes per input byte
    private static final long MAX_RATIO = 255;

    private final LZ4Compressor compressor;
    private final LZ4SafeDecompressor decompressor;

    public Lz4RawCodec() {
        LZ4Factory factory = LZ4Factory.fastestInstance();
        this.compressor = factory.fastCompressor();
        this.decompressor = factory.safeDecompressor();
    }

    @Override
    public byte[] compress(byte[] uncompressed) throws IOException {
        try {
            return compressor.compress(uncompressed);
        }
        catch (LZ4Exception e) {
            throw new IOException("LZ4 compression failed", e);
        }
    }

    @Override
    public byte[] decompress(byte[] compressed, int uncompressedSize) throws IOException {
        try {
            return decompressBlock(decompressor, compressed, uncompressedSize);
        }
        catch (LZ4Exception e) {
            throw new MalformedEncodingException("LZ4_RAW decompression failed", e);
        }
    }

    static byte[] decompressBlock(LZ4SafeDecompressor decompressor, byte[] compressed, int uncompressedSize)
            throws MalformedEncodingException {
        checkRatio(compressed.length, uncompressedSize);
        byte[] uncompressed = new byte[uncompressedSize];
        int actualSize = decompressor.decompress(compressed, 0, compressed.length, uncompressed, 0, uncompressedSize);
        if (actualSize != uncompressedSize) {
            throw new MalformedEncodingException(
                    "LZ4 decompression size mismatch: expected " + uncompressedSize + ", got " + actualSize);
        }
        return uncompressed;
    }

    static void checkRatio(int compressedSize, long uncompressedSize) throws MalformedEncodingException {
        if (uncompressedSize > compressedSize * MAX_RATIO + 16) {
            throw new MalformedEncodingException("LZ4 block of " + compressedSize + " bytes cannot decompress to "
                    + uncompressedSize + " bytes");
        }
    }

    @Override
    public String getName() {
        return "LZ4_RAW";
    }
}
