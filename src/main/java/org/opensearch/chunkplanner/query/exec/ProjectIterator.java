/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.query.exec;

import org.opensearch.chunkplanner.core.chunk.Row;
import org.opensearch.chunkplanner.core.chunk.RowIterator;

/**
 * Rebuilds each row of its input with a subset of its columns, in a new order.
 */
public class ProjectIterator implements RowIterator {

    private final RowIterator input;
    private final int[] inputIndexes;
    private Row current;

    public ProjectIterator(RowIterator input, int[] inputIndexes) {
        this.input = input;
        this.inputIndexes = inputIndexes.clone();
    }

    @Override
    public boolean next() {
        if (!input.next()) {
            return false;
        }
        Row row = input.at();
        Object[] values = new Object[inputIndexes.length];
        for (int i = 0; i < inputIndexes.length; i++) {
            values[i] = row.get(inputIndexes[i]);
        }
        current = new Row(values, row.getRecencyKey());
        return true;
    }

    @Override
    public Row at() {
        return current;
    }

    @Override
    public Exception error() {
        return input.error();
    }

    @Override
    public int totalRows() {
        return input.totalRows();
    }
}
