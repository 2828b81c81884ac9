/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.core.predicate;

import org.opensearch.chunkplanner.core.model.ColumnType;

/**
 * Enumeration of the operators a predicate clause can apply between a column and a literal.
 * {@link #IS_NULL} and {@link #IS_NOT_NULL} are null-aware and take no literal; every other operator
 * evaluates to false when the column value is null.
 */
public enum ComparisonOperator {

    /** Equality. */
    EQ("="),

    /** Inequality. */
    NEQ("!="),

    /** Strictly less than. */
    LT("<"),

    /** Less than or equal. */
    LTE("<="),

    /** Strictly greater than. */
    GT(">"),

    /** Greater than or equal. */
    GTE(">="),

    /** Value is missing. */
    IS_NULL("IS NULL"),

    /** Value is present. */
    IS_NOT_NULL("IS NOT NULL");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Gets the string representation of this operator
     * @return The operator symbol (e.g., "=", "IS NULL")
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * Whether this operator has defined results on null values.
     * @return true for IS NULL and IS NOT NULL
     */
    public boolean isNullAware() {
        return this == IS_NULL || this == IS_NOT_NULL;
    }

    /**
     * Whether this operator needs an ordered column type.
     * @return true for the range operators
     */
    public boolean isRange() {
        return this == LT || this == LTE || this == GT || this == GTE;
    }

    /**
     * Applies this operator to a column value.
     *
     * @param value the column value, possibly null
     * @param literal the literal, null for null-aware operators
     * @param type the column type used for comparison
     * @return true if the condition is satisfied
     */
    public boolean apply(Object value, Object literal, ColumnType type) {
        if (this == IS_NULL) {
            return value == null;
        }
        if (this == IS_NOT_NULL) {
            return value != null;
        }
        if (value == null) {
            return false;
        }
        int cmp = type.compare(value, literal);
        return switch (this) {
            case EQ -> cmp == 0;
            case NEQ -> cmp != 0;
            case LT -> cmp < 0;
            case LTE -> cmp <= 0;
            case GT -> cmp > 0;
            case GTE -> cmp >= 0;
            default -> throw new IllegalStateException("Unexpected operator " + this);
        };
    }

    /**
     * Parse a string into a ComparisonOperator.
     *
     * @param symbol the string representation of the operator
     * @return the corresponding operator
     * @throws IllegalArgumentException if the operator is not recognized
     */
    public static ComparisonOperator fromString(String symbol) {
        if (symbol == null) {
            throw new IllegalArgumentException("Operator string cannot be null");
        }
        String trimmed = symbol.trim();
        for (ComparisonOperator operator : values()) {
            if (operator.symbol.equalsIgnoreCase(trimmed)) {
                return operator;
            }
        }
        if (trimmed.equals("<>")) {
            return NEQ;
        }
        throw new IllegalArgumentException("Unknown comparison operator: " + symbol + ". Supported operators: =, !=, <, <=, >, >=, IS NULL, IS NOT NULL");
    }
}
