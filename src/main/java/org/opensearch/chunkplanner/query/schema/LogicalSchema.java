/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.query.schema;

import org.opensearch.chunkplanner.core.model.ColumnDefinition;
import org.opensearch.chunkplanner.core.model.ColumnType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The schema of a table as one logical relation over all of its chunks.
 *
 * <p>Columns are ordered deterministically: primary key columns first in the declared primary key order, then every
 * other column sorted by name. Sort and merge comparators rely on this order being the same for every plan built
 * from the same chunk set.</p>
 */
public final class LogicalSchema {

    private final List<ColumnDefinition> columns;
    private final Map<String, Integer> positions;
    private final List<String> primaryKey;
    private final String timeColumn;

    /**
     * Constructor for LogicalSchema.
     *
     * @param columns columns in logical order, primary key first
     * @param primaryKey ordered primary key column names; must be a prefix of {@code columns}
     * @param timeColumn the timestamp column of the primary key
     */
    public LogicalSchema(List<ColumnDefinition> columns, List<String> primaryKey, String timeColumn) {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            index.put(columns.get(i).name(), i);
        }
        for (int i = 0; i < primaryKey.size(); i++) {
            if (!primaryKey.get(i).equals(columns.get(i).name())) {
                throw new IllegalArgumentException("Primary key column [" + primaryKey.get(i) + "] must be at logical position " + i);
            }
        }
        if (!index.containsKey(timeColumn)) {
            throw new IllegalArgumentException("Time column [" + timeColumn + "] is not part of the schema");
        }
        this.columns = List.copyOf(columns);
        this.positions = Collections.unmodifiableMap(index);
        this.primaryKey = List.copyOf(primaryKey);
        this.timeColumn = timeColumn;
    }

    public List<ColumnDefinition> getColumns() {
        return columns;
    }

    /**
     * Gets all column names in logical order.
     * @return the column names
     */
    public List<String> getColumnNames() {
        List<String> names = new ArrayList<>(columns.size());
        for (ColumnDefinition column : columns) {
            names.add(column.name());
        }
        return names;
    }

    public List<String> getPrimaryKey() {
        return primaryKey;
    }

    public String getTimeColumn() {
        return timeColumn;
    }

    public int size() {
        return columns.size();
    }

    public boolean contains(String column) {
        return positions.containsKey(column);
    }

    /**
     * Gets the logical position of a column.
     * @param column the column name
     * @return its position, or -1 if unknown
     */
    public int indexOf(String column) {
        Integer position = positions.get(column);
        return position == null ? -1 : position;
    }

    /**
     * Gets the type of a column.
     * @param column the column name
     * @return the type, or null if unknown
     */
    public ColumnType typeOf(String column) {
        int position = indexOf(column);
        return position < 0 ? null : columns.get(position).type();
    }

    public boolean isPrimaryKey(String column) {
        int position = indexOf(column);
        return position >= 0 && position < primaryKey.size();
    }

    /**
     * Orders a set of column names by logical position. Unknown names are rejected.
     *
     * @param names the names to order
     * @return the names in logical order, without duplicates
     */
    public List<String> inLogicalOrder(Collection<String> names) {
        boolean[] wanted = new boolean[columns.size()];
        for (String name : names) {
            int position = indexOf(name);
            if (position < 0) {
                throw new IllegalArgumentException("Column [" + name + "] is not part of the schema");
            }
            wanted[position] = true;
        }
        List<String> ordered = new ArrayList<>();
        for (int i = 0; i < wanted.length; i++) {
            if (wanted[i]) {
                ordered.add(columns.get(i).name());
            }
        }
        return ordered;
    }

    @Override
    public String toString() {
        return "LogicalSchema" + columns + " pk=" + primaryKey;
    }
}
