/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.query.schema;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.chunkplanner.core.model.ChunkMetadata;
import org.opensearch.chunkplanner.core.model.ColumnDefinition;
import org.opensearch.chunkplanner.core.model.ColumnType;
import org.opensearch.chunkplanner.query.errors.EmptyPrimaryKeyException;
import org.opensearch.chunkplanner.query.errors.SchemaConflictException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Merges the column sets of a table's chunks into one {@link LogicalSchema} and computes the {@link ColumnMapping}
 * presence matrix.
 *
 * <p>A column must have the same type in the table schema and in every chunk that stores it. The first
 * disagreement aborts planning with a {@link SchemaConflictException}; there is no partial result. Columns the table
 * schema declares but no chunk stores are kept in the logical schema and read as nulls.</p>
 */
public class SchemaReconciler {

    private static final Logger logger = LogManager.getLogger(SchemaReconciler.class);

    /**
     * Reconciles the schemas of the given chunks.
     *
     * @param table the table name, used in error messages
     * @param chunks the chunks selected for the query
     * @param primaryKey ordered primary key: tag columns, then the timestamp column
     * @param tableSchema declared types of the table's columns
     * @return the logical schema and presence matrix
     * @throws EmptyPrimaryKeyException if the primary key is empty or has no timestamp column
     * @throws SchemaConflictException if a column is declared with two different types
     */
    public ReconciledSchema reconcile(String table, List<ChunkMetadata> chunks, List<String> primaryKey, Map<String, ColumnType> tableSchema) {
        if (primaryKey == null || primaryKey.isEmpty()) {
            throw new EmptyPrimaryKeyException(table, "no primary key columns are declared");
        }

        Map<String, ColumnType> keyTypes = new LinkedHashMap<>();
        String timeColumn = null;
        for (int i = 0; i < primaryKey.size(); i++) {
            String name = primaryKey.get(i);
            ColumnType implied = i == primaryKey.size() - 1 ? ColumnType.TIMESTAMP : ColumnType.TAG;
            ColumnType declared = tableSchema.getOrDefault(name, implied);
            if (!declared.isPrimaryKeyType()) {
                throw new SchemaConflictException(name, implied, declared, null);
            }
            if (keyTypes.put(name, declared) != null) {
                throw new IllegalArgumentException("Primary key of table [" + table + "] lists column [" + name + "] twice");
            }
            if (declared == ColumnType.TIMESTAMP) {
                timeColumn = name;
            }
        }
        if (timeColumn == null) {
            throw new EmptyPrimaryKeyException(table, "the primary key " + primaryKey + " has no timestamp column");
        }

        Map<String, ColumnType> merged = new LinkedHashMap<>(keyTypes);
        for (Map.Entry<String, ColumnType> entry : tableSchema.entrySet()) {
            merged.putIfAbsent(entry.getKey(), entry.getValue());
        }
        for (ChunkMetadata chunk : chunks) {
            for (ColumnDefinition column : chunk.getColumns()) {
                ColumnType existing = merged.putIfAbsent(column.name(), column.type());
                if (existing != null && existing != column.type()) {
                    throw new SchemaConflictException(column.name(), existing, column.type(), chunk.getId());
                }
            }
        }

        List<ColumnDefinition> ordered = new ArrayList<>(merged.size());
        Set<String> keySet = new HashSet<>(primaryKey);
        for (String name : primaryKey) {
            ordered.add(new ColumnDefinition(name, merged.get(name)));
        }
        Map<String, ColumnType> others = new TreeMap<>();
        for (Map.Entry<String, ColumnType> entry : merged.entrySet()) {
            if (!keySet.contains(entry.getKey())) {
                others.put(entry.getKey(), entry.getValue());
            }
        }
        for (Map.Entry<String, ColumnType> entry : others.entrySet()) {
            ordered.add(new ColumnDefinition(entry.getKey(), entry.getValue()));
        }

        LogicalSchema schema = new LogicalSchema(ordered, primaryKey, timeColumn);
        logger.debug("Reconciled {} chunks of table [{}] into {}", chunks.size(), table, schema);
        return new ReconciledSchema(schema, new ColumnMapping(schema, chunks));
    }

    /**
     * Result of schema reconciliation.
     *
     * @param schema the logical schema
     * @param mapping the chunk x column presence matrix
     */
    public record ReconciledSchema(LogicalSchema schema, ColumnMapping mapping) {
    }
}
