/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.query.errors;

/**
 * Raised when a table declares no primary key, or a primary key without a timestamp column.
 */
public class EmptyPrimaryKeyException extends PlanningException {

    /**
     * Constructor for EmptyPrimaryKeyException.
     * @param table the table
     * @param reason what is wrong with the primary key
     */
    public EmptyPrimaryKeyException(String table, String reason) {
        super("table [{}] has no usable primary key: {}", table, reason);
    }
}
