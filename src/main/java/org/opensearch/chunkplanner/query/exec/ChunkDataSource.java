/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.query.exec;

import org.opensearch.chunkplanner.core.model.ChunkMetadata;

import java.io.IOException;
import java.util.Iterator;

/**
 * Storage boundary of plan execution: reads the stored rows of a chunk.
 */
public interface ChunkDataSource {

    /**
     * Opens the rows of a chunk. Each row holds one value per column of {@link ChunkMetadata#getColumns()}, in that
     * order, null for a missing value.
     *
     * @param chunk the chunk to read
     * @return the stored rows
     * @throws IOException if the chunk cannot be read
     */
    Iterator<Object[]> readRows(ChunkMetadata chunk) throws IOException;
}
