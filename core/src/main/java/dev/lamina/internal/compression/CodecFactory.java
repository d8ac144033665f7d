/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.internal.compression;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;

import dev.lamina.EncodingNotSupportedException;
import dev.lamina.metadata.CompressionCodec;

/**
 * Creates compressors and decompressors for page bodies.
 * <p>
 * Codecs backed by optional libraries are only available when the library is on the class path.
 * </p>
 */
public class CodecFactory {

    private static final Logger LOG = System.getLogger(CodecFactory.class.getName());

    /**
     * Get a decompressor for the given compression codec.
     *
     * @throws EncodingNotSupportedException if the codec is not supported or the required library is missing
     */
    public Decompressor getDecompressor(CompressionCodec codec) throws EncodingNotSupportedException {
        return switch (codec) {
            case UNCOMPRESSED -> new UncompressedCodec();
            case GZIP -> new GzipCodec(0);
            default -> (Decompressor) createLibraryCodec(codec, 0);
        };
    }

    /**
     * Get a compressor for the given compression codec.
     *
     * @param level codec specific compression level; 0 selects the codec's default
     * @throws EncodingNotSupportedException if the codec is not supported or the required library is missing
     */
    public Compressor getCompressor(CompressionCodec codec, int level) throws EncodingNotSupportedException {
        return switch (codec) {
            case UNCOMPRESSED -> new UncompressedCodec();
            case GZIP -> new GzipCodec(level);
            default -> (Compressor) createLibraryCodec(codec, level);
        };
    }

    private Object createLibraryCodec(CompressionCodec codec, int level) throws EncodingNotSupportedException {
        Object created = switch (codec) {
            case SNAPPY -> {
                checkClassAvailable("org.xerial.snappy.Snappy",
                        "SNAPPY",
                        "org.xerial.snappy:snappy-java");
                yield new SnappyCodec();
            }
            case ZSTD -> {
                checkClassAvailable("com.github.luben.zstd.Zstd",
                        "ZSTD",
                        "com.github.luben:zstd-jni");
                yield new ZstdCodec(level == 0 ? ZstdCodec.DEFAULT_LEVEL : level);
            }
            case LZ4 -> {
                checkClassAvailable("net.jpountz.lz4.LZ4Factory",
                        "LZ4",
                        "org.lz4:lz4-java");
                yield new Lz4Codec();
            }
            case LZ4_RAW -> {
                checkClassAvailable("net.jpountz.lz4.LZ4Factory",
                        "LZ4_RAW",
                        "org.lz4:lz4-java");
                yield new Lz4RawCodec();
            }
            case BROTLI -> {
                checkClassAvailable("com.aayushatharva.brotli4j.Brotli4jLoader",
                        "BROTLI",
                        "com.aayushatharva.brotli4j:brotli4j");
                yield new BrotliCodec();
            }
            case LZO -> throw new EncodingNotSupportedException("LZO compression is not supported");
            case UNCOMPRESSED, GZIP -> throw new IllegalArgumentException("Not a library codec: " + codec);
        };
        LOG.log(Level.DEBUG, "Created {0} codec", codec);
        return created;
    }

    private static void checkClassAvailable(String className, String codecName, String dependency)
            throws EncodingNotSupportedException {
        try {
            Class.forName(className);
        }
        catch (ClassNotFoundException e) {
            EncodingNotSupportedException unsupported = new EncodingNotSupportedException(
                    "Cannot handle " + codecName + "-compressed pages: required library not found. " +
                            "Add the following dependency to your project: " + dependency);
            unsupported.initCause(e);
            throw unsupported;
        }
    }
}
