/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.core.catalog;

import org.opensearch.chunkplanner.core.model.ChunkMetadata;
import org.opensearch.chunkplanner.core.model.ColumnType;
import org.opensearch.chunkplanner.core.model.Tombstone;

import java.util.List;
import java.util.Map;

/**
 * Read access to the catalog that records the chunks, tombstones and schema of every table.
 *
 * <p>The catalog is owned and mutated elsewhere. The planner only reads it through
 * {@link CatalogSnapshot#capture(ChunkCatalog, String)}, which copies what one planning call needs.</p>
 */
public interface ChunkCatalog {

    /**
     * Lists all chunks of a table, including soft-deleted ones.
     *
     * @param table the table name
     * @return the chunk metadata, in no particular order
     */
    List<ChunkMetadata> listChunks(String table);

    /**
     * Lists the tombstones recorded against a table.
     *
     * @param table the table name
     * @return the tombstones, in no particular order
     */
    default List<Tombstone> listTombstones(String table) {
        return List.of();
    }

    /**
     * Gets the primary key of a table: tag columns followed by the timestamp column.
     *
     * @param table the table name
     * @return the ordered primary key column names
     */
    List<String> tablePrimaryKey(String table);

    /**
     * Gets the declared schema of a table.
     *
     * @param table the table name
     * @return column name to type
     */
    Map<String, ColumnType> tableSchema(String table);
}
