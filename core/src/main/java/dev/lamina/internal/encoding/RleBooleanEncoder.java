/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.internal.encoding;

import java.io.ByteArrayOutputStream;

import dev.lamina.metadata.Encoding;

/**
 * RLE value encoding for BOOLEAN columns: a 4-byte little-endian length followed by
 * RLE/bit-packed hybrid data of bit width 1.
 */
public class RleBooleanEncoder implements ValueEncoder {

    private final RleBitPackingHybridEncoder encoder = new RleBitPackingHybridEncoder(1);

    @Override
    public void writeBoolean(boolean value) {
        encoder.writeInt(value ? 1 : 0);
    }

    @Override
    public int getEstimatedSize() {
        return 4 + encoder.getEstimatedSize();
    }

    @Override
    public byte[] toBytes() {
        byte[] runs = encoder.toBytes();
        ByteArrayOutputStream out = new ByteArrayOutputStream(runs.length + 4);
        BytesUtils.writeIntLittleEndian(out, runs.length);
        out.writeBytes(runs);
        return out.toByteArray();
    }

    @Override
    public void reset() {
        encoder.reset();
    }

    @Override
    public Encoding getEncoding() {
        return Encoding.RLE;
    }
}
