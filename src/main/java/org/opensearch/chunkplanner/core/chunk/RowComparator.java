/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.core.chunk;

import org.opensearch.chunkplanner.core.model.ColumnDefinition;
import org.opensearch.chunkplanner.core.model.ColumnType;

import java.util.Comparator;
import java.util.List;

/**
 * Orders rows by a list of key columns, ascending, with nulls after every non-null value.
 */
public final class RowComparator implements Comparator<Row> {

    private final int[] keyIndexes;
    private final ColumnType[] keyTypes;

    /**
     * Constructor for RowComparator.
     *
     * @param keyIndexes positions of the key columns in the row layout
     * @param keyTypes types of the key columns
     */
    public RowComparator(int[] keyIndexes, ColumnType[] keyTypes) {
        if (keyIndexes.length != keyTypes.length) {
            throw new IllegalArgumentException("Expected one type per key column");
        }
        this.keyIndexes = keyIndexes.clone();
        this.keyTypes = keyTypes.clone();
    }

    /**
     * Creates a comparator on named columns of a row layout.
     *
     * @param layout the row layout
     * @param keys the key column names, most significant first
     * @return the comparator
     */
    public static RowComparator forKeys(List<ColumnDefinition> layout, List<String> keys) {
        int[] indexes = new int[keys.size()];
        ColumnType[] types = new ColumnType[keys.size()];
        for (int k = 0; k < keys.size(); k++) {
            indexes[k] = -1;
            for (int i = 0; i < layout.size(); i++) {
                if (layout.get(i).name().equals(keys.get(k))) {
                    indexes[k] = i;
                    types[k] = layout.get(i).type();
                    break;
                }
            }
            if (indexes[k] < 0) {
                throw new IllegalArgumentException("Key column [" + keys.get(k) + "] is not part of the row layout " + layout);
            }
        }
        return new RowComparator(indexes, types);
    }

    /**
     * Checks whether a layout position holds a key column.
     * @param index the position
     * @return true if the column is part of the key
     */
    public boolean isKey(int index) {
        for (int keyIndex : keyIndexes) {
            if (keyIndex == index) {
                return true;
            }
        }
        return false;
    }

    @Override
    public int compare(Row left, Row right) {
        for (int k = 0; k < keyIndexes.length; k++) {
            Object l = left.get(keyIndexes[k]);
            Object r = right.get(keyIndexes[k]);
            if (l == r) {
                continue;
            }
            if (l == null) {
                return 1;
            }
            if (r == null) {
                return -1;
            }
            int cmp = keyTypes[k].compare(l, r);
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }
}
