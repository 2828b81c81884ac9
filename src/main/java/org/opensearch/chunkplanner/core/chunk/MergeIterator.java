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
 * Iterator that merges multiple key-ordered RowIterators into a single key-ordered stream. Uses a min-heap to
 * efficiently merge k sorted iterators. Duplicates are preserved; rows with equal keys are emitted by descending
 * recency key, and for equal recency in the original iterator order.
 *
 * <p>The recency tie-break puts the newest row first in every run of equal keys; {@link DedupIterator} relies on it
 * when it fills each column from the first non-null value of the run.</p>
 */
public class MergeIterator implements RowIterator {

    /**
     * Entry holding iterator state.
     */
    private static class IteratorEntry {
        RowIterator iterator;
        int index;
        Row row;

        boolean advance() {
            if (!iterator.next()) {
                row = null;
                return false;
            }
            row = iterator.at();
            return true;
        }
    }

    private final RowComparator keyComparator;
    private final IteratorEntry[] heap;
    private int heapSize;
    private Row current;
    private Exception error;
    private final int totalRows;

    public MergeIterator(List<RowIterator> iterators, RowComparator keyComparator) {
        if (iterators == null || iterators.isEmpty()) {
            throw new IllegalArgumentException("Iterators list cannot be null or empty");
        }
        if (keyComparator == null) {
            throw new IllegalArgumentException("Key comparator cannot be null");
        }
        this.keyComparator = keyComparator;

        heap = new IteratorEntry[iterators.size()];
        heapSize = 0;

        int sum = 0;
        boolean allKnown = true;

        int index = 0;
        for (RowIterator iter : iterators) {
            if (iter == null) {
                index++;
                continue;
            }

            Exception err = iter.error();
            if (err != null) {
                error = err;
                totalRows = -1;
                return;
            }

            int rows = iter.totalRows();
            if (rows >= 0) {
                sum += rows;
            } else {
                allKnown = false;
            }

            IteratorEntry entry = new IteratorEntry();
            entry.iterator = iter;
            entry.index = index;
            if (entry.advance()) {
                heap[heapSize++] = entry;
                siftUp(heapSize - 1);
            }

            if (iter.error() != null) {
                error = iter.error();
                totalRows = -1;
                return;
            }

            index++;
        }

        totalRows = allKnown ? sum : -1;
    }

    @Override
    public boolean next() {
        if (error != null || heapSize == 0) {
            return false;
        }

        // for k = 1, direct delegation to single iterator
        if (heapSize == 1) {
            IteratorEntry entry = heap[0];
            current = entry.row;

            if (!entry.advance()) {
                heapSize = 0;
            }

            if (entry.iterator.error() != null) {
                error = entry.iterator.error();
            }

            return true;
        }

        // for k = 2, use simple comparison instead of heap
        if (heapSize == 2) {
            IteratorEntry entry0 = heap[0];
            IteratorEntry entry1 = heap[1];

            IteratorEntry minEntry = precedes(entry0, entry1) ? entry0 : entry1;
            current = minEntry.row;

            if (!minEntry.advance()) {
                // remove exhausted iterator
                if (minEntry == entry0) {
                    heap[0] = entry1;
                    heap[1] = null;
                } else {
                    heap[1] = null;
                }
                heapSize = 1;
            }

            if (minEntry.iterator.error() != null) {
                error = minEntry.iterator.error();
            }

            return true;
        }

        // for k >= 3, min-heap approach
        IteratorEntry minEntry = heap[0];
        current = minEntry.row;

        if (minEntry.advance()) {
            siftDown(0);
        } else {
            // remove exhausted iterator
            heapSize--;
            if (heapSize > 0) {
                heap[0] = heap[heapSize];
                heap[heapSize] = null;
                siftDown(0);
            }
        }

        if (minEntry.iterator.error() != null) {
            error = minEntry.iterator.error();
        }

        return true;
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
        return totalRows;
    }

    /**
     * Whether {@code a} is emitted before {@code b}: lower key, then higher recency, then lower input index.
     */
    private boolean precedes(IteratorEntry a, IteratorEntry b) {
        int cmp = keyComparator.compare(a.row, b.row);
        if (cmp != 0) {
            return cmp < 0;
        }
        long recencyA = a.row.getRecencyKey();
        long recencyB = b.row.getRecencyKey();
        if (recencyA != recencyB) {
            return recencyA > recencyB;
        }
        return a.index <= b.index;
    }

    private void siftUp(int index) {
        IteratorEntry entry = heap[index];

        while (index > 0) {
            int parent = (index - 1) >>> 1;
            IteratorEntry parentEntry = heap[parent];

            if (precedes(parentEntry, entry)) {
                break;
            }

            heap[index] = parentEntry;
            index = parent;
        }

        heap[index] = entry;
    }

    private void siftDown(int index) {
        IteratorEntry entry = heap[index];
        int half = heapSize >>> 1;

        while (index < half) {
            int child = (index << 1) + 1;
            IteratorEntry childEntry = heap[child];
            int right = child + 1;

            if (right < heapSize) {
                IteratorEntry rightEntry = heap[right];
                if (precedes(rightEntry, childEntry)) {
                    child = right;
                    childEntry = rightEntry;
                }
            }

            if (precedes(entry, childEntry)) {
                break;
            }

            heap[index] = childEntry;
            index = child;
        }

        heap[index] = entry;
    }
}
