/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.query.errors;

/**
 * Raised when a query would read more chunks than the configured per-query limit.
 */
public class TooManyChunksException extends PlanningException {

    /**
     * Constructor for TooManyChunksException.
     * @param table the queried table
     * @param chunkCount number of chunks the plan would read
     * @param limit configured limit
     */
    public TooManyChunksException(String table, int chunkCount, int limit) {
        super("query on table [{}] would read {} chunks, more than the limit of {}", table, chunkCount, limit);
    }
}
