/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.io;

import java.io.EOFException;
import java.util.Arrays;

/**
 * Append-only storage held in a growable byte array. Writes ignore the offset hint
 * and always land at the current end.
 */
public class InMemoryStorage implements StorageSink, StorageSource {

    private byte[] data = new byte[1024];
    private int size;

    @Override
    public synchronized ByteRange write(long offsetHint, byte[] bytes) {
        ensureCapacity(size + bytes.length);
        System.arraycopy(bytes, 0, data, size, bytes.length);
        ByteRange range = new ByteRange(size, bytes.length);
        size += bytes.length;
        return range;
    }

    @Override
    public synchronized byte[] read(ByteRange range) throws EOFException {
        if (range.end() > size) {
            throw new EOFException("Range " + range + " extends beyond end of storage at " + size);
        }
        return Arrays.copyOfRange(data, (int) range.offset(), (int) range.end());
    }

    public synchronized long size() {
        return size;
    }

    /**
     * Returns a copy of all bytes written so far.
     */
    public synchronized byte[] toByteArray() {
        return Arrays.copyOf(data, size);
    }

    private void ensureCapacity(int required) {
        if (required > data.length) {
            data = Arrays.copyOf(data, Math.max(required, data.length * 2));
        }
    }
}
