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
 * Encoder for DELTA_BYTE_ARRAY (front compression): the length of the prefix shared with the
 * previous value is delta encoded, the remaining suffixes are written as DELTA_LENGTH_BYTE_ARRAY.
 */
public class DeltaByteArrayEncoder implements ValueEncoder {

    private final DeltaBinaryPackedEncoder prefixLengths = new DeltaBinaryPackedEncoder(true);
    private final DeltaLengthByteArrayEncoder suffixes = new DeltaLengthByteArrayEncoder();

    private byte[] previousValue = new byte[0];

    @Override
    public void writeBinary(Binary value) {
        byte[] bytes = value.getBytesUnsafe();
        int limit = Math.min(bytes.length, previousValue.length);
        int prefix = 0;
        while (prefix < limit && bytes[prefix] == previousValue[prefix]) {
            prefix++;
        }
        prefixLengths.writeInt(prefix);
        suffixes.write(bytes, prefix, bytes.length - prefix);
        previousValue = bytes;
    }

    @Override
    public int getEstimatedSize() {
        return prefixLengths.getEstimatedSize() + suffixes.getEstimatedSize();
    }

    @Override
    public byte[] toBytes() {
        byte[] prefixes = prefixLengths.toBytes();
        byte[] suffixBytes = suffixes.toBytes();
        ByteArrayOutputStream out = new ByteArrayOutputStream(prefixes.length + suffixBytes.length);
        out.writeBytes(prefixes);
        out.writeBytes(suffixBytes);
        return out.toByteArray();
    }

    @Override
    public void reset() {
        prefixLengths.reset();
        suffixes.reset();
        previousValue = new byte[0];
    }

    @Override
    public Encoding getEncoding() {
        return Encoding.DELTA_BYTE_ARRAY;
    }
}
