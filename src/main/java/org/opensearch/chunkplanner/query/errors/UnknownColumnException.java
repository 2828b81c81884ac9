/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.query.errors;

/**
 * Raised when a projection or predicate references a column that is not part of the logical table schema.
 */
public class UnknownColumnException extends PlanningException {

    private final String column;

    /**
     * Constructor for UnknownColumnException.
     * @param table the queried table
     * @param column the unknown column
     */
    public UnknownColumnException(String table, String column) {
        super("unknown column [{}] in table [{}]", column, table);
        this.column = column;
    }

    public String getColumn() {
        return column;
    }
}
