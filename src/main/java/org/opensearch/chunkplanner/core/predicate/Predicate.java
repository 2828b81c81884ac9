/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.core.predicate;

import org.opensearch.chunkplanner.core.model.ColumnType;
import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.common.io.stream.StreamOutput;
import org.opensearch.core.common.io.stream.Writeable;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * A conjunction of {@link ColumnPredicate} clauses. An empty conjunction matches every row.
 */
public final class Predicate implements Writeable {

    /** Predicate that matches every row. */
    public static final Predicate MATCH_ALL = new Predicate(List.of());

    private final List<ColumnPredicate> clauses;

    /**
     * Constructor for Predicate.
     * @param clauses the clauses, all of which must hold
     */
    public Predicate(List<ColumnPredicate> clauses) {
        if (clauses == null) {
            throw new IllegalArgumentException("Predicate clauses cannot be null");
        }
        this.clauses = List.copyOf(clauses);
    }

    /**
     * Deserialize a predicate.
     * @param in the stream to read from
     * @throws IOException if reading fails
     */
    public Predicate(StreamInput in) throws IOException {
        this(in.readList(ColumnPredicate::new));
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeList(clauses);
    }

    /**
     * Creates a conjunction of the given clauses.
     * @param clauses the clauses
     * @return the predicate
     */
    public static Predicate and(ColumnPredicate... clauses) {
        return clauses.length == 0 ? MATCH_ALL : new Predicate(Arrays.asList(clauses));
    }

    public List<ColumnPredicate> getClauses() {
        return clauses;
    }

    public boolean isEmpty() {
        return clauses.isEmpty();
    }

    /**
     * Gets the distinct columns referenced by any clause, in clause order.
     * @return referenced column names
     */
    public Set<String> referencedColumns() {
        Set<String> columns = new LinkedHashSet<>();
        for (ColumnPredicate clause : clauses) {
            columns.add(clause.getColumn());
        }
        return columns;
    }

    /**
     * Returns a predicate that additionally requires the given clause.
     * @param clause the clause to add
     * @return a new predicate
     */
    public Predicate with(ColumnPredicate clause) {
        List<ColumnPredicate> combined = new ArrayList<>(clauses);
        combined.add(clause);
        return new Predicate(combined);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return clauses.equals(((Predicate) o).clauses);
    }

    @Override
    public int hashCode() {
        return clauses.hashCode();
    }

    /**
     * Renders the predicate with each literal formatted for the type of its column.
     *
     * @param typeOf column type lookup, returning null for unknown columns
     * @return the predicate text
     */
    public String toString(Function<String, ColumnType> typeOf) {
        if (clauses.isEmpty()) {
            return "true";
        }
        return clauses.stream().map(c -> c.toString(typeOf.apply(c.getColumn()))).collect(Collectors.joining(" AND "));
    }

    @Override
    public String toString() {
        if (clauses.isEmpty()) {
            return "true";
        }
        return clauses.stream().map(ColumnPredicate::toString).collect(Collectors.joining(" AND "));
    }
}
