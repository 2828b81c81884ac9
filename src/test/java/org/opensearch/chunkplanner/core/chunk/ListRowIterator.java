/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.core.chunk;

import java.util.List;

/**
 * RowIterator over a fixed list, optionally failing after a number of rows.
 */
class ListRowIterator implements RowIterator {

    private final List<Row> rows;
    private final int failAfter;
    private int position = -1;
    private Exception error;

    ListRowIterator(List<Row> rows) {
        this(rows, Integer.MAX_VALUE);
    }

    ListRowIterator(List<Row> rows, int failAfter) {
        this.rows = rows;
        this.failAfter = failAfter;
    }

    @Override
    public boolean next() {
        if (error != null) {
            return false;
        }
        if (position + 1 >= failAfter) {
            error = new IllegalStateException("corrupt row " + (position + 1));
            return false;
        }
        if (position + 1 >= rows.size()) {
            return false;
        }
        position++;
        return true;
    }

    @Override
    public Row at() {
        return rows.get(position);
    }

    @Override
    public Exception error() {
        return error;
    }

    @Override
    public int totalRows() {
        return rows.size();
    }
}
