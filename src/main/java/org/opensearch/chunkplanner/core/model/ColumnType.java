/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.core.model;

import java.util.Locale;

/**
 * Semantic column types of a time-series table.
 *
 * <p>Runtime values are represented as {@link Long} for {@link #INTEGER}, {@link #UNSIGNED} and {@link #TIMESTAMP},
 * {@link Double} for {@link #FLOAT}, {@link Boolean} for {@link #BOOLEAN} and {@link String} for {@link #STRING} and
 * {@link #TAG}. An {@link #UNSIGNED} value is the unsigned reading of its {@code long} bits, so values from 2^63
 * up are negative longs. {@code null} is a missing value. No implicit widening happens between the numeric types.</p>
 */
public enum ColumnType {

    /** Signed 64-bit integer field. */
    INTEGER("integer"),

    /** Unsigned 64-bit integer field, stored in a {@code long} bit pattern and compared as unsigned. */
    UNSIGNED("unsigned"),

    /** 64-bit floating point field. */
    FLOAT("float"),

    /** Boolean field. */
    BOOLEAN("boolean"),

    /** String field. */
    STRING("string"),

    /** Nanosecond timestamp; the time column of the primary key. */
    TIMESTAMP("timestamp"),

    /** Tag (series identifying) string column; part of the primary key. */
    TAG("tag");

    private final String typeName;

    ColumnType(String typeName) {
        this.typeName = typeName;
    }

    /**
     * Gets the external name of this type.
     * @return the type name (e.g., "float", "tag")
     */
    public String getTypeName() {
        return typeName;
    }

    /**
     * Whether columns of this type may belong to the primary key.
     * @return true for {@link #TAG} and {@link #TIMESTAMP}
     */
    public boolean isPrimaryKeyType() {
        return this == TAG || this == TIMESTAMP;
    }

    /**
     * Whether values of this type have a meaningful order for {@code <, <=, >, >=}.
     * @return false only for {@link #BOOLEAN}
     */
    public boolean isOrdered() {
        return this != BOOLEAN;
    }

    /**
     * Checks that a non-null value has the runtime representation of this type.
     *
     * @param value the value to check, must not be null
     * @return true if the value can be stored in a column of this type
     */
    public boolean accepts(Object value) {
        return switch (this) {
            case INTEGER, UNSIGNED, TIMESTAMP -> value instanceof Long;
            case FLOAT -> value instanceof Double;
            case BOOLEAN -> value instanceof Boolean;
            case STRING, TAG -> value instanceof String;
        };
    }

    /**
     * Compares two non-null values of this type.
     *
     * @param left the left value
     * @param right the right value
     * @return negative, zero or positive as left is less than, equal to or greater than right
     */
    public int compare(Object left, Object right) {
        return switch (this) {
            case INTEGER, TIMESTAMP -> Long.compare((Long) left, (Long) right);
            case UNSIGNED -> Long.compareUnsigned((Long) left, (Long) right);
            case FLOAT -> Double.compare((Double) left, (Double) right);
            case BOOLEAN -> Boolean.compare((Boolean) left, (Boolean) right);
            case STRING, TAG -> ((String) left).compareTo((String) right);
        };
    }

    /**
     * Parse a type name into a ColumnType.
     *
     * @param typeName the external type name
     * @return the matching column type
     * @throws IllegalArgumentException if the name is not recognized
     */
    public static ColumnType fromString(String typeName) {
        if (typeName == null) {
            throw new IllegalArgumentException("Column type cannot be null");
        }
        String normalized = typeName.trim().toLowerCase(Locale.ROOT);
        for (ColumnType type : values()) {
            if (type.typeName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown column type: " + typeName);
    }
}
