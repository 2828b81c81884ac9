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
import java.util.Locale;
import java.util.Objects;

/**
 * A single {@code column operator literal} clause of a conjunctive predicate.
 */
public final class ColumnPredicate implements Writeable {

    private final String column;
    private final ComparisonOperator operator;
    private final Object literal;

    /**
     * Constructor for ColumnPredicate.
     *
     * @param column the referenced column
     * @param operator the comparison operator
     * @param literal the literal value; null for null-aware operators
     */
    public ColumnPredicate(String column, ComparisonOperator operator, Object literal) {
        if (column == null || column.isEmpty()) {
            throw new IllegalArgumentException("Predicate column cannot be null or empty");
        }
        if (operator == null) {
            throw new IllegalArgumentException("Predicate operator cannot be null");
        }
        this.column = column;
        this.operator = operator;
        this.literal = literal;
    }

    /**
     * Deserialize a clause.
     * @param in the stream to read from
     * @throws IOException if reading fails
     */
    public ColumnPredicate(StreamInput in) throws IOException {
        this(in.readString(), in.readEnum(ComparisonOperator.class), in.readGenericValue());
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeString(column);
        out.writeEnum(operator);
        out.writeGenericValue(literal);
    }

    public static ColumnPredicate eq(String column, Object literal) {
        return new ColumnPredicate(column, ComparisonOperator.EQ, literal);
    }

    public static ColumnPredicate neq(String column, Object literal) {
        return new ColumnPredicate(column, ComparisonOperator.NEQ, literal);
    }

    public static ColumnPredicate lt(String column, Object literal) {
        return new ColumnPredicate(column, ComparisonOperator.LT, literal);
    }

    public static ColumnPredicate lte(String column, Object literal) {
        return new ColumnPredicate(column, ComparisonOperator.LTE, literal);
    }

    public static ColumnPredicate gt(String column, Object literal) {
        return new ColumnPredicate(column, ComparisonOperator.GT, literal);
    }

    public static ColumnPredicate gte(String column, Object literal) {
        return new ColumnPredicate(column, ComparisonOperator.GTE, literal);
    }

    public static ColumnPredicate isNull(String column) {
        return new ColumnPredicate(column, ComparisonOperator.IS_NULL, null);
    }

    public static ColumnPredicate isNotNull(String column) {
        return new ColumnPredicate(column, ComparisonOperator.IS_NOT_NULL, null);
    }

    public String getColumn() {
        return column;
    }

    public ComparisonOperator getOperator() {
        return operator;
    }

    public Object getLiteral() {
        return literal;
    }

    /**
     * Whether the clause gives a defined answer on a missing value.
     * @return true for IS NULL and IS NOT NULL clauses
     */
    public boolean isNullAware() {
        return operator.isNullAware();
    }

    /**
     * Evaluates the clause against a column value.
     *
     * @param value the column value, null if missing
     * @param type the type of the column the value comes from
     * @return true if the value satisfies the clause
     */
    public boolean test(Object value, ColumnType type) {
        return operator.apply(value, literal, type);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ColumnPredicate that = (ColumnPredicate) o;
        return column.equals(that.column) && operator == that.operator && Objects.equals(literal, that.literal);
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, operator, literal);
    }

    @Override
    public String toString() {
        if (operator.isNullAware()) {
            return column + " " + operator.getSymbol();
        }
        String rendered = literal instanceof String ? "'" + literal + "'" : String.valueOf(literal);
        return String.format(Locale.ROOT, "%s %s %s", column, operator.getSymbol(), rendered);
    }

    /**
     * Renders the clause with the literal formatted for the given column type.
     *
     * @param type the type of the referenced column
     * @return the clause text
     */
    public String toString(ColumnType type) {
        if (type == ColumnType.UNSIGNED && literal instanceof Long value) {
            return String.format(Locale.ROOT, "%s %s %s", column, operator.getSymbol(), Long.toUnsignedString(value));
        }
        return toString();
    }
}
