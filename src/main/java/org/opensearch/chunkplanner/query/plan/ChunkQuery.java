/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.query.plan;

import org.opensearch.chunkplanner.core.predicate.Predicate;
import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.common.io.stream.StreamOutput;
import org.opensearch.core.common.io.stream.Writeable;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * A read of one table: the columns to return, in order, and a conjunctive filter.
 *
 * <p>Repeated projection names collapse to their first occurrence. An empty projection selects every column of the
 * table in logical order.</p>
 */
public final class ChunkQuery implements Writeable {

    private final String table;
    private final List<String> projection;
    private final Predicate predicate;

    /**
     * Constructor for ChunkQuery.
     *
     * @param table the table to read
     * @param projection output columns in caller order, empty for all columns
     * @param predicate the filter, {@link Predicate#MATCH_ALL} for none
     */
    public ChunkQuery(String table, List<String> projection, Predicate predicate) {
        if (table == null || table.isEmpty()) {
            throw new IllegalArgumentException("Table name cannot be null or empty");
        }
        this.table = table;
        this.projection = projection == null ? List.of() : List.copyOf(new LinkedHashSet<>(projection));
        this.predicate = predicate == null ? Predicate.MATCH_ALL : predicate;
    }

    public ChunkQuery(StreamInput in) throws IOException {
        this(in.readString(), in.readStringList(), new Predicate(in));
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeString(table);
        out.writeStringCollection(projection);
        predicate.writeTo(out);
    }

    /**
     * Reads every column of a table.
     * @param table the table
     * @return a query with an empty projection and no filter
     */
    public static ChunkQuery selectAll(String table) {
        return new ChunkQuery(table, List.of(), Predicate.MATCH_ALL);
    }

    /**
     * Returns a copy of this query with an additional filter.
     * @param filter the predicate to use
     * @return a new query
     */
    public ChunkQuery where(Predicate filter) {
        return new ChunkQuery(table, projection, filter);
    }

    /**
     * Returns a copy of this query restricted to the given columns.
     * @param columns output columns in order
     * @return a new query
     */
    public ChunkQuery select(String... columns) {
        return new ChunkQuery(table, new ArrayList<>(List.of(columns)), predicate);
    }

    public String getTable() {
        return table;
    }

    public List<String> getProjection() {
        return projection;
    }

    public Predicate getPredicate() {
        return predicate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ChunkQuery that = (ChunkQuery) o;
        return table.equals(that.table) && projection.equals(that.projection) && predicate.equals(that.predicate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(table, projection, predicate);
    }

    @Override
    public String toString() {
        String columns = projection.isEmpty() ? "*" : String.join(", ", projection);
        String sql = "SELECT " + columns + " FROM " + table;
        return predicate.isEmpty() ? sql : sql + " WHERE " + predicate;
    }
}
