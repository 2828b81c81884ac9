/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.core.chunk;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One row of a plan node's output: a value per column of the node's layout, null for missing values, plus the
 * recency key of the chunk the row was read from.
 */
public final class Row {

    private final Object[] values;
    private final long recencyKey;

    /**
     * Constructor for Row. The array is owned by the row afterwards.
     *
     * @param values column values in layout order
     * @param recencyKey recency key of the source chunk
     */
    public Row(Object[] values, long recencyKey) {
        if (values == null) {
            throw new IllegalArgumentException("Row values cannot be null");
        }
        this.values = values;
        this.recencyKey = recencyKey;
    }

    public Object get(int index) {
        return values[index];
    }

    public int size() {
        return values.length;
    }

    public long getRecencyKey() {
        return recencyKey;
    }

    /**
     * Gets a copy of the values.
     * @return the values in layout order
     */
    public Object[] copyValues() {
        return values.clone();
    }

    /**
     * Gets a read-only view of the values.
     * @return the values in layout order
     */
    public List<Object> asList() {
        return Collections.unmodifiableList(Arrays.asList(values));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Row row = (Row) o;
        return recencyKey == row.recencyKey && Arrays.equals(values, row.values);
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(recencyKey) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return Arrays.toString(values) + "@" + recencyKey;
    }
}
