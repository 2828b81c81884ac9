/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.core.chunk;

import java.util.ArrayList;
import java.util.List;

/**
 * Iterator interface for reading the rows a plan node produces
 */
public interface RowIterator {

    /**
     * Advances the iterator to the next row.
     * @return true if a row is available, false if no more rows or an error is raised
     */
    boolean next();

    /**
     * Returns the current row
     * @return the row found by the last successful {@link #next()}
     */
    Row at();

    /**
     * Returns any error that occurred during iteration
     * @return error or null if no error
     */
    Exception error();

    /**
     * Returns the total number of rows this iterator will produce.
     * @return total number of rows, or -1 if unknown
     */
    default int totalRows() {
        return -1; // Unknown by default
    }

    /**
     * Drains this iterator.
     *
     * @return all remaining rows, never null but may be empty
     * @throws IllegalStateException if row data corruption is detected
     * @throws IllegalArgumentException if row data is invalid
     * @throws RuntimeException if any other error occurs during iteration
     */
    default List<Row> toList() {
        int totalRows = totalRows();
        List<Row> rows = totalRows > 0 ? new ArrayList<>(totalRows) : new ArrayList<>();

        while (next()) {
            rows.add(at());
        }

        // if an error is raised, next() will have returned false - check for any leftover error
        Exception error = error();
        if (error != null) {
            if (error instanceof IllegalStateException illegalStateException) {
                throw illegalStateException;
            } else if (error instanceof IllegalArgumentException illegalArgumentException) {
                throw illegalArgumentException;
            } else {
                throw new RuntimeException("Error during row iteration", error);
            }
        }

        return rows;
    }
}
