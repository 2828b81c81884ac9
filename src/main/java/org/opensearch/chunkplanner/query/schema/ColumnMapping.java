/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.query.schema;

import org.opensearch.chunkplanner.core.model.ChunkMetadata;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Presence matrix of chunk x logical column.
 *
 * <p>Each cell holds the chunk-local column index of a logical column, or {@link #ABSENT} when the chunk does not
 * store the column and a scan has to synthesize nulls of the logical type for it. The matrix is computed once per
 * planning call; every scan of the plan reads its column layout from here.</p>
 */
public final class ColumnMapping {

    /** Marker for a logical column the chunk does not store. */
    public static final int ABSENT = -1;

    private final LogicalSchema schema;
    private final Map<String, Integer> rowsByChunk;
    private final int[][] matrix;

    /**
     * Computes the presence matrix of the given chunks.
     *
     * @param schema the logical schema
     * @param chunks the chunks, each becoming one row of the matrix
     */
    public ColumnMapping(LogicalSchema schema, List<ChunkMetadata> chunks) {
        this.schema = schema;
        Map<String, Integer> rows = new HashMap<>();
        this.matrix = new int[chunks.size()][];
        for (int c = 0; c < chunks.size(); c++) {
            ChunkMetadata chunk = chunks.get(c);
            if (rows.putIfAbsent(chunk.getId(), c) != null) {
                throw new IllegalArgumentException("Chunk [" + chunk.getId() + "] is listed more than once");
            }
            int[] row = new int[schema.size()];
            for (int l = 0; l < schema.size(); l++) {
                row[l] = chunk.localIndexOf(schema.getColumns().get(l).name());
            }
            matrix[c] = row;
        }
        this.rowsByChunk = Collections.unmodifiableMap(rows);
    }

    public LogicalSchema getSchema() {
        return schema;
    }

    /**
     * Gets the chunk-local index of a logical column.
     *
     * @param chunkId the chunk
     * @param column the logical column name
     * @return the local index or {@link #ABSENT}
     */
    public int localIndex(String chunkId, String column) {
        int position = schema.indexOf(column);
        if (position < 0) {
            throw new IllegalArgumentException("Column [" + column + "] is not part of the schema");
        }
        return row(chunkId)[position];
    }

    /**
     * Whether the chunk stores the column.
     *
     * @param chunkId the chunk
     * @param column the logical column name
     * @return true if present
     */
    public boolean isPresent(String chunkId, String column) {
        return localIndex(chunkId, column) != ABSENT;
    }

    /**
     * Gets the local indexes for a list of logical columns, the layout a scan uses to fill its output rows.
     *
     * @param chunkId the chunk
     * @param columns logical column names
     * @return local index per requested column, {@link #ABSENT} for missing ones
     */
    public int[] localIndexes(String chunkId, List<String> columns) {
        int[] result = new int[columns.size()];
        for (int i = 0; i < columns.size(); i++) {
            result[i] = localIndex(chunkId, columns.get(i));
        }
        return result;
    }

    /**
     * Counts the chunks covered by the matrix.
     * @return number of rows
     */
    public int chunkCount() {
        return matrix.length;
    }

    private int[] row(String chunkId) {
        Integer row = rowsByChunk.get(chunkId);
        if (row == null) {
            throw new IllegalArgumentException("Chunk [" + chunkId + "] is not part of the mapping");
        }
        return matrix[row];
    }
}
