/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.query.errors;

import org.opensearch.chunkplanner.core.model.ColumnType;
import org.opensearch.core.rest.RestStatus;

/**
 * Raised when a column is declared with different types by two chunks, or by a chunk and the table schema.
 * This is a data integrity problem that needs operator intervention.
 */
public class SchemaConflictException extends PlanningException {

    private final String column;
    private final ColumnType existingType;
    private final ColumnType conflictingType;
    private final String chunkId;

    /**
     * Constructor for SchemaConflictException.
     *
     * @param column the conflicting column
     * @param existingType the type seen first
     * @param conflictingType the type that disagrees with it
     * @param chunkId the chunk declaring the conflicting type, or null when the conflict is in the table schema
     */
    public SchemaConflictException(String column, ColumnType existingType, ColumnType conflictingType, String chunkId) {
        super(
            "column [{}] has type [{}] but {} declares it as [{}]",
            column,
            existingType.getTypeName(),
            chunkId == null ? "the table schema" : "chunk [" + chunkId + "]",
            conflictingType.getTypeName()
        );
        this.column = column;
        this.existingType = existingType;
        this.conflictingType = conflictingType;
        this.chunkId = chunkId;
    }

    public String getColumn() {
        return column;
    }

    public ColumnType getExistingType() {
        return existingType;
    }

    public ColumnType getConflictingType() {
        return conflictingType;
    }

    public String getChunkId() {
        return chunkId;
    }

    @Override
    public RestStatus status() {
        return RestStatus.CONFLICT;
    }
}
