/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.query.exec;

import org.opensearch.chunkplanner.core.chunk.Row;
import org.opensearch.chunkplanner.core.chunk.RowComparator;
import org.opensearch.chunkplanner.core.chunk.RowIterator;

import java.util.List;

/**
 * Buffers every row of its input and emits them in key order. The sort is stable, so rows with equal keys keep
 * their input order.
 */
public class SortIterator implements RowIterator {

    private final RowIterator input;
    private final RowComparator keyComparator;
    private List<Row> sorted;
    private int position = -1;
    private Exception error;

    public SortIterator(RowIterator input, RowComparator keyComparator) {
        if (input == null) {
            throw new IllegalArgumentException("Input iterator cannot be null");
        }
        this.input = input;
        this.keyComparator = keyComparator;
    }

    @Override
    public boolean next() {
        if (sorted == null) {
            try {
                sorted = input.toList();
            } catch (RuntimeException e) {
                error = input.error() != null ? input.error() : e;
                sorted = List.of();
                return false;
            }
            // List.sort is a stable merge sort
            sorted.sort(keyComparator);
        }
        if (error != null || position + 1 >= sorted.size()) {
            return false;
        }
        position++;
        return true;
    }

    @Override
    public Row at() {
        return sorted.get(position);
    }

    @Override
    public Exception error() {
        return error;
    }

    @Override
    public int totalRows() {
        return input.totalRows();
    }
}
