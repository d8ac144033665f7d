/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.internal.compression;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Arrays;

import com.github.luben.zstd.Zstd;
import com.github.luben.zstd.ZstdException;
import com.github.luben.zstd.ZstdInputStream;

import dev.lamina.MalformedEncodingException;

/**
 * Codec for ZSTD compressed data.
 * <p>
 * The declared size is checked against the content size recorded in the frame header before any
 * output is allocated. Frames without a recorded size are decompressed as a stream.
 * </p>
 */
public class ZstdCodec implements Compressor, Decompressor {

    public static final int DEFAULT_LEVEL = 3;

    private final int level;

    public ZstdCodec(int level) {
        this.level = level;
    }

    @Override
    public byte[] compress(byte[] uncompressed) throws IOException {
        try {
            return Zstd.compress(uncompressed, level);
        }
        catch (ZstdException e) {
            throw new IOException("ZSTD compression failed", e);
        }
    }

    @Override
    public byte[] decompress(byte[] compressed, int uncompressedSize) throws IOException {
        long frameSize = Zstd.decompressedSize(compressed);
        if (frameSize == 0 && uncompressedSize > 0) {
            return decompressStream(compressed, uncompressedSize);
        }
        if (frameSize != uncompressedSize) {
            throw new MalformedEncodingException(
                    "ZSTD frame holds " + frameSize + " bytes, expected " + uncompressedSize);
        }
        byte[] uncompressed = new byte[uncompressedSize];
        long actualSize;
        try {
            actualSize = Zstd.decompress(uncompressed, compressed);
        }
        catch (ZstdException e) {
            throw new MalformedEncodingException("ZSTD decompression failed", e);
        }
        if (Zstd.isError(actualSize)) {
            throw new MalformedEncodingException("ZSTD decompression failed: " + Zstd.getErrorName(actualSize));
        }

        if (actualSize != uncompressedSize) {
            throw new MalformedEncodingException(
                    "ZSTD decompression size mismatch: expected " + uncompressedSize + ", got " + actualSize);
        }

        return uncompressed;
    }

    private static byte[] decompressStream(byte[] compressed, int uncompressedSize)
            throws MalformedEncodingException {
        byte[] result = new byte[Math.min(uncompressedSize, Math.max(64 * 1024, compressed.length * 4))];
        int total = 0;
        boolean overflow = false;
        try (ZstdInputStream in = new ZstdInputStream(new ByteArrayInputStream(compressed))) {
            while (true) {
                if (total == result.length) {
                    if (total == uncompressedSize) {
                        overflow = in.read() != -1;
                        break;
                    }
                    result = Arrays.copyOf(result, (int) Math.min(uncompressedSize, result.length * 2L));
                }
                int read = in.read(result, total, result.length - total);
                if (read < 0) {
                    break;
                }
                total += read;
            }
        }
        catch (IOException | ZstdException e) {
            throw new MalformedEncodingException("ZSTD decompression failed", e);
        }
        if (overflow || total != uncompressedSize) {
            throw new MalformedEncodingException("ZSTD decompression size mismatch: expected " + uncompressedSize
                    + ", got " + (overflow ? "more" : String.valueOf(total)));
        }
        return result;
    }

    @Override
    public String getName() {
        return "ZSTD";
    }
}
