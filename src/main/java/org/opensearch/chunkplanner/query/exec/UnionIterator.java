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

import java.util.List;

/**
 * Emits the rows of each input in turn. Stops at the first input that raises an error.
 */
public class UnionIterator implements RowIterator {

    private final List<RowIterator> inputs;
    private int position;
    private Row current;
    private Exception error;

    public UnionIterator(List<RowIterator> inputs) {
        this.inputs = List.copyOf(inputs);
    }

    @Override
    public boolean next() {
        while (error == null && position < inputs.size()) {
            RowIterator input = inputs.get(position);
            if (input.next()) {
                current = input.at();
                return true;
            }
            error = input.error();
            position++;
        }
        return false;
    }

    @Override
    public Row at() {
        return current;
    }

    @Override
    public Exception error() {
        return error;
    }

    @Override
    public int totalRows() {
        int sum = 0;
        for (RowIterator input : inputs) {
            int rows = input.totalRows();
            if (rows < 0) {
                return -1;
            }
            sum += rows;
        }
        return sum;
    }
}
