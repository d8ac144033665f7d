/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.internal.page;

import java.io.ByteArrayOutputStream;

import dev.lamina.metadata.PageHeader;

/**
 * A page ready to be stored: its header and the compressed body.
 */
public record EncodedPage(PageHeader header, byte[] body) {

    /**
     * Total size of the page in storage, header included.
     */
    public int size() {
        return PageHeaderCodec.HEADER_SIZE + body.length;
    }

    public void writeTo(ByteArrayOutputStream out) {
        out.writeBytes(PageHeaderCodec.encode(header));
        out.writeBytes(body);
    }
}
