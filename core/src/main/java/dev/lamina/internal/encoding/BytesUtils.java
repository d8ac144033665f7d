/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.internal.encoding;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;

import dev.lamina.MalformedEncodingException;

/**
 * Little-endian integers, ULEB128 varints and zigzag helpers shared by the encoders and decoders.
 */
public final class BytesUtils {

    private BytesUtils() {
    }

    /**
     * Number of bits needed to represent the given non-negative value; 0 for 0.
     */
    public static int bitWidth(int maxValue) {
        return 32 - Integer.numberOfLeadingZeros(maxValue);
    }

    /**
     * Number of bits needed to represent the given value interpreted as unsigned.
     */
    public static int bitWidth(long maxValue) {
        return 64 - Long.numberOfLeadingZeros(maxValue);
    }

    public static void writeIntLittleEndian(ByteArrayOutputStream out, int value) {
        out.write(value & 0xFF);
        out.write((value >>> 8) & 0xFF);
        out.write((value >>> 16) & 0xFF);
        out.write((value >>> 24) & 0xFF);
    }

    public static void writeLongLittleEndian(ByteArrayOutputStream out, long value) {
        writeIntLittleEndian(out, (int) value);
        writeIntLittleEndian(out, (int) (value >>> 32));
    }

    /**
     * Writes the low {@code byteCount} bytes of the value, least significant first.
     */
    public static void writeIntLittleEndianPadded(ByteArrayOutputStream out, int value, int byteCount) {
        for (int i = 0; i < byteCount; i++) {
            out.write((value >>> (i * 8)) & 0xFF);
        }
    }

    public static void writeUnsignedVarInt(ByteArrayOutputStream out, int value) {
        writeUnsignedVarLong(out, value & 0xFFFFFFFFL);
    }

    public static void writeUnsignedVarLong(ByteArrayOutputStream out, long value) {
        while ((value & ~0x7FL) != 0) {
            out.write((int) ((value & 0x7F) | 0x80));
            value >>>= 7;
        }
        out.write((int) value);
    }

    public static void writeZigZagVarLong(ByteArrayOutputStream out, long value) {
        writeUnsignedVarLong(out, (value << 1) ^ (value >> 63));
    }

    public static int readIntLittleEndian(InputStream in) throws IOException {
        byte[] bytes = readFully(in, 4, "INT32");
        return (bytes[0] & 0xFF) | (bytes[1] & 0xFF) << 8 | (bytes[2] & 0xFF) << 16 | (bytes[3] & 0xFF) << 24;
    }

    public static int readIntLittleEndian(byte[] data, int offset) {
        return (data[offset] & 0xFF) | (data[offset + 1] & 0xFF) << 8
                | (data[offset + 2] & 0xFF) << 16 | (data[offset + 3] & 0xFF) << 24;
    }

    /**
     * Reads a ULEB128 value that must fit into 32 bits.
     */
    public static int readUnsignedVarInt(InputStream in) throws IOException {
        long value = readUnsignedVarLong(in);
        if ((value & ~0xFFFFFFFFL) != 0) {
            throw new MalformedEncodingException("ULEB128 value exceeds 32 bits: " + Long.toUnsignedString(value));
        }
        return (int) value;
    }

    public static long readUnsignedVarLong(InputStream in) throws IOException {
        long result = 0;
        int shift = 0;
        int b;
        do {
            if (shift >= 64) {
                throw new MalformedEncodingException("ULEB128 value is longer than 10 bytes");
            }
            b = in.read();
            if (b < 0) {
                throw new MalformedEncodingException("Unexpected EOF in ULEB128");
            }
            result |= (long) (b & 0x7F) << shift;
            shift += 7;
        } while ((b & 0x80) != 0);
        return result;
    }

    public static long readZigZagVarLong(InputStream in) throws IOException {
        long encoded = readUnsignedVarLong(in);
        // Zigzag decode: (n >>> 1) ^ -(n & 1)
        return (encoded >>> 1) ^ -(encoded & 1);
    }

    /**
     * Reads exactly {@code length} bytes.
     *
     * @param what description of the value being read, for the error message
     */
    public static byte[] readFully(InputStream in, int length, String what) throws IOException {
        if (length < 0) {
            throw new MalformedEncodingException("Negative length for " + what + ": " + length);
        }
        byte[] bytes = in.readNBytes(length);
        if (bytes.length != length) {
            throw new MalformedEncodingException("Unexpected EOF while reading " + what + ": expected " + length
                    + " bytes, got " + bytes.length);
        }
        return bytes;
    }
}
