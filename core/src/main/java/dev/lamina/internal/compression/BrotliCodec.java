/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.internal.compression;

import java.io.IOException;

import com.aayushatharva.brotli4j.Brotli4jLoader;
import com.aayushatharva.brotli4j.decoder.Decoder;
import com.aayushatharva.brotli4j.decoder.DecoderJNI;
import com.aayushatharva.brotli4j.decoder.DirectDecompress;
import com.aayushatharva.brotli4j.encoder.Encoder;

import dev.lamina.MalformedEncodingException;

/**
 * Codec for Brotli compressed data, backed by the brotli4j native library.
 */
public class BrotliCodec implements Compressor, Decompressor {

    private static volatile boolean initialized = false;

    private static synchronized void ensureInitialized() throws IOException {
        if (!initialized) {
            try {
                Brotli4jLoader.ensureAvailability();
                initialized = true;
            }
            catch (UnsatisfiedLinkError e) {
                throw new IOException("Failed to load Brotli native library: " + e.getMessage(), e);
            }
        }
    }

    @Override
    public byte[] compress(byte[] uncompressed) throws IOException {
        ensureInitialized();
        return Encoder.compress(uncompressed);
    }

    @Override
    public byte[] decompress(byte[] compressed, int uncompressedSize) throws IOException {
        ensureInitialized();

        DirectDecompress result = Decoder.decompress(compressed);
        if (result.getResultStatus() != DecoderJNI.Status.DONE) {
            throw new MalformedEncodingException("Brotli decompression failed: " + result.getResultStatus());
        }

        byte[] decompressed = result.getDecompressedData();
        if (decompressed.length != uncompressedSize) {
            throw new MalformedEncodingException(
                    "Brotli decompression size mismatch: expected " + uncompressedSize +
                            ", got " + decompressed.length);
        }
        return decompressed;
    }

    @Override
    public String getName() {
        return "BROTLI";
    }
}
