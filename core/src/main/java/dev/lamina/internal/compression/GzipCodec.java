/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.internal.compression;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.GZIPOutputStream;
import java.util.zip.Inflater;

import dev.lamina.MalformedEncodingException;

/**
 * Codec for GZIP compressed data.
 * <p>
 * Decompression uses Inflater directly and handles concatenated GZIP members. The output buffer
 * grows with the inflated data up to the declared size, so a corrupt size cannot force a large
 * allocation.
 */
public class GzipCodec implements Compressor, Decompressor {

    private static final int GZIP_MAGIC = 0x8b1f;
    private static final int FHCRC = 2;
    private static final int FEXTRA = 4;
    private static final int FNAME = 8;
    private static final int FCOMMENT = 16;

    // deflate cannot expand beyond 1032:1
    private static final long MAX_RATIO = 1032;
    private static final int INITIAL_CAPACITY = 64 * 1024;

    private final int level;

    public GzipCodec(int level) {
        this.level = level;
    }

    @Override
    public byte[] compress(byte[] uncompressed) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream(uncompressed.length / 2 + 32);
        try (GZIPOutputStream gzip = new LevelGzipOutputStream(out, level)) {
            gzip.write(uncompressed);
        }
        return out.toByteArray();
    }

    @Override
    public byte[] decompress(byte[] compressedBytes, int uncompressedSize) throws IOException {
        if (uncompressedSize > compressedBytes.length * MAX_RATIO) {
            throw new MalformedEncodingException("GZIP data of " + compressedBytes.length
                    + " bytes cannot inflate to " + uncompressedSize + " bytes");
        }
        ByteBuffer compressed = ByteBuffer.wrap(compressedBytes);
        byte[] result = new byte[Math.min(uncompressedSize, Math.max(INITIAL_CAPACITY, compressedBytes.length * 4))];
        int totalDecompressed = 0;

        // Handle concatenated GZIP members
        while (totalDecompressed < uncompressedSize && compressed.hasRemaining()) {
            int headerEnd = skipGzipHeader(compressed);

            Inflater inflater = new Inflater(true); // true = nowrap (raw deflate)
            try {
                ByteBuffer dataSlice = compressed.slice(compressed.position() + headerEnd, compressed.remaining() - headerEnd);
                inflater.setInput(dataSlice);

                while (totalDecompressed < uncompressedSize) {
                    if (totalDecompressed == result.length) {
                        result = Arrays.copyOf(result, (int) Math.min(uncompressedSize, result.length * 2L));
                    }
                    int decompressed = inflater.inflate(result, totalDecompressed, result.length - totalDecompressed);
                    if (decompressed == 0) {
                        if (inflater.finished()) {
                            break;
                        }
                        if (inflater.needsInput()) {
                            throw new MalformedEncodingException("Truncated GZIP data");
                        }
                        if (inflater.needsDictionary()) {
                            throw new MalformedEncodingException("GZIP stream requires dictionary");
                        }
                    }
                    totalDecompressed += decompressed;
                }
                // Move past consumed input + 8-byte trailer for next member
                int consumed = dataSlice.capacity() - inflater.getRemaining() + 8;
                compressed.position(Math.min(compressed.limit(), compressed.position() + headerEnd + consumed));
            }
            catch (DataFormatException e) {
                throw new MalformedEncodingException("GZIP decompression failed", e);
            }
            finally {
                inflater.end();
            }
        }

        if (totalDecompressed != uncompressedSize) {
            throw new MalformedEncodingException("Decompressed size mismatch: expected " + uncompressedSize +
                    " but got " + totalDecompressed);
        }

        return result;
    }

    private int skipGzipHeader(ByteBuffer buffer) throws MalformedEncodingException {
        int start = buffer.position();
        if (buffer.remaining() < 10) {
            throw new MalformedEncodingException("GZIP data too short for header");
        }

        int magic = (buffer.get(start) & 0xff) | ((buffer.get(start + 1) & 0xff) << 8);
        if (magic != GZIP_MAGIC) {
            throw new MalformedEncodingException("Not in GZIP format");
        }

        // Compression method must be 8 = deflate
        if (buffer.get(start + 2) != 8) {
            throw new MalformedEncodingException("Unsupported compression method: " + buffer.get(start + 2));
        }

        int flags = buffer.get(start + 3) & 0xff;
        int offset = 10;

        if ((flags & FEXTRA) != 0) {
            if (offset + 2 > buffer.remaining()) {
                throw new MalformedEncodingException("Truncated GZIP extra field");
            }
            int extraLen = (buffer.get(start + offset) & 0xff) | ((buffer.get(start + offset + 1) & 0xff) << 8);
            offset += 2 + extraLen;
        }

        if ((flags & FNAME) != 0) {
            while (offset < buffer.remaining() && buffer.get(start + offset) != 0) {
                offset++;
            }
            offset++;
        }

        if ((flags & FCOMMENT) != 0) {
            while (offset < buffer.remaining() && buffer.get(start + offset) != 0) {
                offset++;
            }
            offset++;
        }

        if ((flags & FHCRC) != 0) {
            offset += 2;
        }

        if (offset >= buffer.remaining()) {
            throw new MalformedEncodingException("GZIP header extends beyond data");
        }

        return offset;
    }

    @Override
    public String getName() {
        return "GZIP";
    }

    private static final class LevelGzipOutputStream extends GZIPOutputStream {

        LevelGzipOutputStream(ByteArrayOutputStream out, int level) throws IOException {
            super(out);
            def.setLevel(level == 0 ? Deflater.DEFAULT_COMPRESSION : level);
        }
    }
}
