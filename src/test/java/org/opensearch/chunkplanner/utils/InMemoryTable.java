/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.utils;

import org.opensearch.chunkplanner.core.catalog.ChunkCatalog;
import org.opensearch.chunkplanner.core.model.ChunkMetadata;
import org.opensearch.chunkplanner.core.model.ColumnType;
import org.opensearch.chunkplanner.core.model.Tombstone;
import org.opensearch.chunkplanner.query.exec.ChunkDataSource;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single table held in memory, serving both as catalog and as chunk storage in tests.
 */
public class InMemoryTable implements ChunkCatalog, ChunkDataSource {

    private final String name;
    private final List<String> primaryKey;
    private final Map<String, ColumnType> schema = new LinkedHashMap<>();
    private final List<ChunkMetadata> chunks = new ArrayList<>();
    private final List<Tombstone> tombstones = new ArrayList<>();
    private final Map<String, List<Object[]>> rows = new HashMap<>();

    public InMemoryTable(String name, String... primaryKey) {
        this.name = name;
        this.primaryKey = List.of(primaryKey);
    }

    /**
     * The table used by most tests: primary key (tag, time).
     */
    public static InMemoryTable cpu() {
        return new InMemoryTable("cpu", "tag", "time").declare("tag", ColumnType.TAG).declare("time", ColumnType.TIMESTAMP);
    }

    public InMemoryTable declare(String column, ColumnType type) {
        schema.put(column, type);
        return this;
    }

    /**
     * Adds a chunk. Each row holds one value per chunk column, in chunk column order.
     */
    public InMemoryTable addChunk(ChunkMetadata chunk, Object[]... chunkRows) {
        chunks.add(chunk);
        List<Object[]> stored = new ArrayList<>();
        for (Object[] row : chunkRows) {
            stored.add(row.clone());
        }
        rows.put(chunk.getId(), stored);
        return this;
    }

    public InMemoryTable addTombstone(Tombstone tombstone) {
        tombstones.add(tombstone);
        return this;
    }

    /**
     * Replaces a chunk by its soft-deleted copy.
     */
    public InMemoryTable markDeleted(String chunkId) {
        for (int i = 0; i < chunks.size(); i++) {
            if (chunks.get(i).getId().equals(chunkId)) {
                chunks.set(i, chunks.get(i).markDeleted());
            }
        }
        return this;
    }

    public String getName() {
        return name;
    }

    @Override
    public List<ChunkMetadata> listChunks(String table) {
        checkTable(table);
        return chunks;
    }

    @Override
    public List<Tombstone> listTombstones(String table) {
        checkTable(table);
        return tombstones;
    }

    @Override
    public List<String> tablePrimaryKey(String table) {
        checkTable(table);
        return primaryKey;
    }

    @Override
    public Map<String, ColumnType> tableSchema(String table) {
        checkTable(table);
        return schema;
    }

    @Override
    public Iterator<Object[]> readRows(ChunkMetadata chunk) throws IOException {
        List<Object[]> stored = rows.get(chunk.getId());
        if (stored == null) {
            throw new IOException("No data stored for chunk [" + chunk.getId() + "]");
        }
        return stored.iterator();
    }

    private void checkTable(String table) {
        if (!name.equals(table)) {
            throw new IllegalArgumentException("Unknown table [" + table + "]");
        }
    }

    public static Object[] row(Object... values) {
        return values;
    }
}
