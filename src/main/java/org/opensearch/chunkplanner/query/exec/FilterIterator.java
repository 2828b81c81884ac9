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
import org.opensearch.chunkplanner.core.model.ColumnDefinition;
import org.opensearch.chunkplanner.core.model.ColumnType;
import org.opensearch.chunkplanner.core.predicate.ColumnPredicate;
import org.opensearch.chunkplanner.core.predicate.Predicate;

import java.util.List;

/**
 * Skips the rows of its input for which a predicate does not hold.
 */
public class FilterIterator implements RowIterator {

    private final RowIterator input;
    private final ColumnPredicate[] clauses;
    private final int[] columnIndexes;
    private final ColumnType[] columnTypes;
    private Row current;

    public FilterIterator(RowIterator input, Predicate predicate, List<ColumnDefinition> layout) {
        this.input = input;
        List<ColumnPredicate> list = predicate.getClauses();
        this.clauses = list.toArray(new ColumnPredicate[0]);
        this.columnIndexes = new int[clauses.length];
        this.columnTypes = new ColumnType[clauses.length];
        for (int c = 0; c < clauses.length; c++) {
            columnIndexes[c] = -1;
            for (int i = 0; i < layout.size(); i++) {
                if (layout.get(i).name().equals(clauses[c].getColumn())) {
                    columnIndexes[c] = i;
                    columnTypes[c] = layout.get(i).type();
                    break;
                }
            }
            if (columnIndexes[c] < 0) {
                throw new IllegalArgumentException("Filter column [" + clauses[c].getColumn() + "] is not part of the row layout");
            }
        }
    }

    @Override
    public boolean next() {
        while (input.next()) {
            Row row = input.at();
            if (matches(row)) {
                current = row;
                return true;
            }
        }
        return false;
    }

    private boolean matches(Row row) {
        for (int c = 0; c < clauses.length; c++) {
            if (!clauses[c].test(row.get(columnIndexes[c]), columnTypes[c])) {
                return false;
            }
        }
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
}
