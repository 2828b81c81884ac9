/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.core.chunk;

/**
 * Wrapper iterator that collapses rows sharing a primary key from an underlying iterator.
 *
 * <p>Assumes the underlying iterator produces keys in non-decreasing order and, within a run of equal keys, rows in
 * descending recency, as {@link MergeIterator} does. The output row of a run keeps the key columns and takes, for
 * every other column, the first non-null value of the run: the newest value written for it. A column that is null
 * in every row of the run stays null.</p>
 */
public class DedupIterator implements RowIterator {

    private final RowIterator underlying;
    private final RowComparator keyComparator;
    private Row pending;
    private Row current;
    private Exception error;

    public DedupIterator(RowIterator underlying, RowComparator keyComparator) {
        if (underlying == null) {
            throw new IllegalArgumentException("Underlying iterator cannot be null");
        }
        if (keyComparator == null) {
            throw new IllegalArgumentException("Key comparator cannot be null");
        }
        this.underlying = underlying;
        this.keyComparator = keyComparator;
    }

    /**
     * Read ahead to consume every row of the current key, filling null columns from older rows.
     */
    @Override
    public boolean next() {
        Row first = pending;
        pending = null;
        if (first == null) {
            if (!advanceUnderlying()) {
                return false;
            }
            first = underlying.at();
        }

        Object[] values = null;
        int missing = countFillable(first);
        while (true) {
            if (!advanceUnderlying()) {
                break;
            }
            Row row = underlying.at();
            if (keyComparator.compare(first, row) != 0) {
                pending = row; // save next
                break;
            }
            if (missing == 0) {
                continue; // nothing left to fill, skip the older duplicate
            }
            if (values == null) {
                values = first.copyValues();
            }
            for (int i = 0; i < values.length; i++) {
                if (values[i] == null && row.get(i) != null && !keyComparator.isKey(i)) {
                    values[i] = row.get(i);
                    missing--;
                }
            }
        }

        current = values == null ? first : new Row(values, first.getRecencyKey());
        return true;
    }

    private boolean advanceUnderlying() {
        boolean hasRow = underlying.next();
        Exception err = underlying.error();
        if (err != null) {
            error = err;
        }
        return hasRow;
    }

    private int countFillable(Row row) {
        int count = 0;
        for (int i = 0; i < row.size(); i++) {
            if (row.get(i) == null && !keyComparator.isKey(i)) {
                count++;
            }
        }
        return count;
    }

    @Override
    public Row at() {
        return current;
    }

    @Override
    public Exception error() {
        return error != null ? error : underlying.error();
    }

    @Override
    public int totalRows() {
        // can't predict how many duplicates will be removed
        return -1;
    }
}
