/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.internal.compression;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import net.jpountz.lz4.LZ4Compressor;
import net.jpountz.lz4.LZ4Exception;
import net.jpountz.lz4.LZ4Factory;
import net.jpountz.lz4.LZ4SafeDecompressor;

import dev.lamina.MalformedEncodingException;

/**
 * Codec for the legacy LZ4 codec, which uses Hadoop's block framing.
 * <p>
 * Written data is a single Hadoop block. When reading, the Hadoop framing is tried first and
 * raw LZ4 block data is accepted as a fallback, since writers disagree on the framing.
 * </p>
 */
public class Lz4Codec implements Compressor, Decompressor {

    private final LZ4Compressor compressor;
    private final LZ4SafeDecompressor safeDecompressor;

    public Lz4Codec() {
        LZ4Factory factory = LZ4Factory.fastestInstance();
        this.compressor = factory.fastCompressor();
        this.safeDecompressor = factory.safeDecompressor();
    }

    @Override
    public byte[] compress(byte[] uncompressed) throws IOException {
        byte[] block;
        try {
            block = compressor.compress(uncompressed);
        }
        catch (LZ4Exception e) {
            throw new IOException("LZ4 compression failed", e);
        }
        ByteBuffer framed = ByteBuffer.allocate(8 + block.length).order(ByteOrder.BIG_ENDIAN);
        framed.putInt(uncompressed.length);
        framed.putInt(block.length);
        framed.put(block);
        return framed.array();
    }

    @Override
    public byte[] decompress(byte[] compressed, int uncompressedSize) throws IOException {
        try {
            return decompressHadoopFormat(compressed, uncompressedSize);
        }
        catch (MalformedEncodingException | LZ4Exception e) {
            try {
                return decompressRaw(compressed, uncompressedSize);
            }
            catch (MalformedEncodingException | LZ4Exception e2) {
                MalformedEncodingException failure = new MalformedEncodingException(
                        "LZ4 decompression failed (tried both Hadoop and raw formats): " + e.getMessage(), e);
                failure.addSuppressed(e2);
                throw failure;
            }
        }
    }

    /**
     * Decompress using Hadoop's native LZ4 block format.
     * <p>
     * Format: [4-byte uncompressed_len, BE][4-byte compressed_len, BE][compressed data]...
     */
    private byte[] decompressHadoopFormat(byte[] compressed, int uncompressedSize) throws MalformedEncodingException {
        ByteBuffer buffer = ByteBuffer.wrap(compressed).order(ByteOrder.BIG_ENDIAN);
        checkHadoopBlocks(buffer, compressed.length, uncompressedSize);

        byte[] uncompressed = new byte[uncompressedSize];
        int srcOffset = 0;
        int destOffset = 0;

        while (destOffset < uncompressedSize && srcOffset < compressed.length) {
            if (srcOffset + 8 > compressed.length) {
                throw new MalformedEncodingException("Truncated LZ4 Hadoop block header");
            }

            int blockUncompressedSize = buffer.getInt(srcOffset);
            srcOffset += 4;
            int blockCompressedSize = buffer.getInt(srcOffset);
            srcOffset += 4;

            if (blockUncompressedSize < 0 || blockCompressedSize < 0
                    || blockUncompressedSize > uncompressedSize - destOffset) {
                throw new MalformedEncodingException("Invalid LZ4 Hadoop block sizes: uncompressed=" +
                        blockUncompressedSize + ", compressed=" + blockCompressedSize);
            }
            if (blockUncompressedSize == 0) {
                continue;
            }
            if (srcOffset + blockCompressedSize > compressed.length) {
                throw new MalformedEncodingException("LZ4 compressed block extends beyond buffer");
            }

            int decompressedLen = safeDecompressor.decompress(
                    compressed, srcOffset, blockCompressedSize,
                    uncompressed, destOffset, blockUncompressedSize);
            if (decompressedLen != blockUncompressedSize) {
                throw new MalformedEncodingException("LZ4 block size mismatch: expected " +
                        blockUncompressedSize + ", got " + decompressedLen);
            }
            destOffset += decompressedLen;
            srcOffset += blockCompressedSize;
        }

        if (destOffset != uncompressedSize || srcOffset != compressed.length) {
            throw new MalformedEncodingException(
                    "LZ4 Hadoop decompression size mismatch: expected " + uncompressedSize +
                            ", got " + destOffset);
        }

        return uncompressed;
    }

    /**
     * Walks the block headers and checks that they add up to the declared size, so that a corrupt
     * size is rejected before the output is allocated.
     */
    private static void checkHadoopBlocks(ByteBuffer buffer, int length, int uncompressedSize)
            throws MalformedEncodingException {
        long total = 0;
        int offset = 0;
        while (offset < length) {
            if (offset + 8 > length) {
                throw new MalformedEncodingException("Truncated LZ4 Hadoop block header");
            }
            int blockUncompressedSize = buffer.getInt(offset);
            int blockCompressedSize = buffer.getInt(offset + 4);
            offset += 8;
            if (blockUncompressedSize < 0 || blockCompressedSize < 0 || blockCompressedSize > length - offset) {
                throw new MalformedEncodingException("Invalid LZ4 Hadoop block sizes: uncompressed=" +
                        blockUncompressedSize + ", compressed=" + blockCompressedSize);
            }
            Lz4RawCodec.checkRatio(blockCompressedSize, blockUncompressedSize);
            total += blockUncompressedSize;
            offset += blockCompressedSize;
        }
        if (total != uncompressedSize) {
            throw new MalformedEncodingException("LZ4 Hadoop blocks hold " + total + " bytes, expected "
                    + uncompressedSize);
        }
    }

    private byte[] decompressRaw(byte[] compressed, int uncompressedSize) throws MalformedEncodingException {
        return Lz4RawCodec.decompressBlock(safeDecompressor, compressed, uncompressedSize);
    }

    @Override
    public String getName() {
        return "LZ4";
    }
}
