/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.core.catalog;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.chunkplanner.core.model.ChunkMetadata;
import org.opensearch.chunkplanner.core.model.ColumnType;
import org.opensearch.chunkplanner.core.model.Tombstone;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Owned copy of the catalog state of one table, taken at the start of a planning call.
 *
 * <p>Soft-deleted chunks are dropped while copying. The snapshot holds no reference into catalog storage, so a
 * catalog that keeps changing while the plan is built does not affect it.</p>
 */
public final class CatalogSnapshot {

    private static final Logger logger = LogManager.getLogger(CatalogSnapshot.class);

    private final String table;
    private final List<ChunkMetadata> chunks;
    private final List<Tombstone> tombstones;
    private final List<String> primaryKey;
    private final Map<String, ColumnType> tableSchema;

    /**
     * Constructor for CatalogSnapshot. Deleted chunks in {@code chunks} are discarded.
     *
     * @param table the table name
     * @param chunks chunk metadata as listed by the catalog
     * @param tombstones tombstones of the table
     * @param primaryKey ordered primary key columns
     * @param tableSchema declared table schema
     */
    public CatalogSnapshot(
        String table,
        List<ChunkMetadata> chunks,
        List<Tombstone> tombstones,
        List<String> primaryKey,
        Map<String, ColumnType> tableSchema
    ) {
        if (table == null || table.isEmpty()) {
            throw new IllegalArgumentException("Table name cannot be null or empty");
        }
        List<ChunkMetadata> live = new ArrayList<>();
        int deleted = 0;
        for (ChunkMetadata chunk : chunks == null ? List.<ChunkMetadata>of() : chunks) {
            if (chunk.isDeleted()) {
                deleted++;
            } else {
                live.add(chunk);
            }
        }
        if (deleted > 0) {
            logger.debug("Skipped {} soft-deleted chunks of table [{}]", deleted, table);
        }
        this.table = table;
        this.chunks = Collections.unmodifiableList(live);
        this.tombstones = tombstones == null ? List.of() : List.copyOf(tombstones);
        this.primaryKey = primaryKey == null ? List.of() : List.copyOf(primaryKey);
        this.tableSchema = tableSchema == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tableSchema));
    }

    /**
     * Copies the state of one table out of the catalog.
     *
     * @param catalog the catalog to read
     * @param table the table name
     * @return an owned snapshot
     */
    public static CatalogSnapshot capture(ChunkCatalog catalog, String table) {
        if (catalog == null) {
            throw new IllegalArgumentException("Catalog cannot be null");
        }
        return new CatalogSnapshot(
            table,
            catalog.listChunks(table),
            catalog.listTombstones(table),
            catalog.tablePrimaryKey(table),
            catalog.tableSchema(table)
        );
    }

    public String getTable() {
        return table;
    }

    /**
     * Gets the live (not soft-deleted) chunks.
     * @return immutable chunk list
     */
    public List<ChunkMetadata> getChunks() {
        return chunks;
    }

    public List<Tombstone> getTombstones() {
        return tombstones;
    }

    public List<String> getPrimaryKey() {
        return primaryKey;
    }

    public Map<String, ColumnType> getTableSchema() {
        return tableSchema;
    }
}
