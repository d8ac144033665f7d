/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.io;

import java.io.IOException;
import java.util.List;

import dev.lamina.metadata.RowGroupSummary;
import dev.lamina.schema.FileSchema;

/**
 * Turns the schema and the row group summaries into an opaque footer blob.
 * The format of the blob is owned by the implementation.
 */
@FunctionalInterface
public interface MetadataSerializer {

    byte[] serialize(FileSchema schema, List<RowGroupSummary> rowGroups) throws IOException;
}
