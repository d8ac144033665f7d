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
import dev.lamina.row.Binary;

/**
 * Encoder for DELTA_LENGTH_BYTE_ARRAY: delta-encoded lengths followed by the concatenated bytes.
 */
public class DeltaLengthByteArrayEncoder implements ValueEncoder {

    private final DeltaBinaryPackedEncoder lengths = new DeltaBinaryPackedEncoder(true);
    private final ByteArrayOutputStream data = new ByteArrayOutputStream();

    @Override
    public void writeBinary(Binary value) {
        write(value.getBytesUnsafe(), 0, value.length());
    }

    void write(byte[] bytes, int offset, int length) {
        lengths.writeInt(length);
        data.write(bytes, offset, length);
    }

    @Override
    public int getEstimatedSize() {
        return lengths.getEstimatedSize() + data.size();
    }

    @Override
    public byte[] toBytes() {
        byte[] encodedLengths = lengths.toBytes();
        ByteArrayOutputStream out = new ByteArrayOutputStream(encodedLengths.length + data.size());
        out.writeBytes(encodedLengths);
        out.writeBytes(data.toByteArray());
        return out.toByteArray();
    }

    @Override
    public void reset() {
        lengths.reset();
        data.reset();
    }

    @Override
    public Encoding getEncoding() {
        return Encoding.DELTA_LENGTH_BYTE_ARRAY;
    }
}
