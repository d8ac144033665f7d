/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.internal.encoding;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.junit.jupiter.api.Test;

import dev.lamina.MalformedEncodingException;
import dev.lamina.row.Binary;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for DELTA_LENGTH_BYTE_ARRAY and DELTA_BYTE_ARRAY encoding.
 */
class DeltaByteArrayTest {

    private static final String[] WORDS = {
            "apple", "application", "apply", "banana", "bandana", "band", "bandwidth", "ban", "", "zebra"
    };

    @Test
    void testDeltaLengthByteArrayRoundTrip() throws Exception {
        DeltaLengthByteArrayEncoder encoder = new DeltaLengthByteArrayEncoder();
        for (String word : WORDS) {
            encoder.writeBinary(Binary.fromString(word));
        }

        DeltaLengthByteArrayDecoder decoder = new DeltaLengthByteArrayDecoder(
                new ByteArrayInputStream(encoder.toBytes()));
        decoder.initialize(WORDS.length);
        for (String word : WORDS) {
            assertThat(new String(decoder.readValue(), StandardCharsets.UTF_8)).isEqualTo(word);
        }
    }

    @Test
    void testDeltaLengthByteArrayLayout() throws Exception {
        DeltaLengthByteArrayEncoder encoder = new DeltaLengthByteArrayEncoder();
        encoder.writeBinary(Binary.fromString("Hello"));
        encoder.writeBinary(Binary.fromString("World"));
        byte[] bytes = encoder.toBytes();

        // concatenated data follows the delta encoded lengths
        assertThat(new String(bytes, bytes.length - 10, 10, StandardCharsets.UTF_8)).isEqualTo("HelloWorld");
    }

    @Test
    void testDeltaByteArrayRoundTrip() throws Exception {
        DeltaByteArrayEncoder encoder = new DeltaByteArrayEncoder();
        for (String word : WORDS) {
            encoder.writeBinary(Binary.fromString(word));
        }

        DeltaByteArrayDecoder decoder = new DeltaByteArrayDecoder(new ByteArrayInputStream(encoder.toBytes()));
        decoder.initialize(WORDS.length);
        byte[][] decoded = new byte[WORDS.length][];
        decoder.readByteArrays(decoded, null, 0);
        for (int i = 0; i < WORDS.length; i++) {
            assertThat(new String(decoded[i], StandardCharsets.UTF_8)).isEqualTo(WORDS[i]);
        }
    }

    @Test
    void testDeltaByteArrayStoresSharedPrefixOnce() throws Exception {
        DeltaByteArrayEncoder encoder = new DeltaByteArrayEncoder();
        byte[] prefix = new byte[1_000];
        Arrays.fill(prefix, (byte) 'x');
        for (int i = 0; i < 50; i++) {
            byte[] value = Arrays.copyOf(prefix, prefix.length + 1);
            value[prefix.length] = (byte) i;
            encoder.writeBinary(Binary.wrap(value));
        }

        assertThat(encoder.toBytes().length).isLessThan(2_000);
    }

    @Test
    void testEmptyValueCount() throws Exception {
        DeltaByteArrayDecoder decoder = new DeltaByteArrayDecoder(new ByteArrayInputStream(new byte[0]));
        decoder.initialize(0);

        assertThatThrownBy(decoder::readValue).isInstanceOf(MalformedEncodingException.class);
    }

    @Test
    void testPrefixLongerThanPreviousValueIsMalformed() throws Exception {
        DeltaBinaryPackedEncoder prefixes = new DeltaBinaryPackedEncoder(true);
        prefixes.writeInt(0);
        prefixes.writeInt(5);
        DeltaLengthByteArrayEncoder suffixes = new DeltaLengthByteArrayEncoder();
        suffixes.writeBinary(Binary.fromString("ab"));
        suffixes.writeBinary(Binary.fromString("c"));
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(prefixes.toBytes());
        out.writeBytes(suffixes.toBytes());

        DeltaByteArrayDecoder decoder = new DeltaByteArrayDecoder(new ByteArrayInputStream(out.toByteArray()));
        decoder.initialize(2);
        decoder.readValue();
        assertThatThrownBy(decoder::readValue)
                .isInstanceOf(MalformedEncodingException.class)
                .hasMessageContaining("Prefix length 5");
    }

    @Test
    void testNegativeLengthIsMalformed() throws Exception {
        DeltaBinaryPackedEncoder lengths = new DeltaBinaryPackedEncoder(true);
        lengths.writeInt(3);
        lengths.writeInt(-1);

        DeltaLengthByteArrayDecoder decoder = new DeltaLengthByteArrayDecoder(
                new ByteArrayInputStream(lengths.toBytes()));
        assertThatThrownBy(() -> decoder.initialize(2))
                .isInstanceOf(MalformedEncodingException.class);
    }

    @Test
    void testMissingDataIsMalformed() throws Exception {
        DeltaLengthByteArrayEncoder encoder = new DeltaLengthByteArrayEncoder();
        encoder.writeBinary(Binary.fromString("truncated value"));
        byte[] bytes = encoder.toBytes();

        DeltaLengthByteArrayDecoder decoder = new DeltaLengthByteArrayDecoder(
                new ByteArrayInputStream(Arrays.copyOf(bytes, bytes.length - 3)));
        decoder.initialize(1);
        assertThatThrownBy(decoder::readValue).isInstanceOf(MalformedEncodingException.class);
    }
}
