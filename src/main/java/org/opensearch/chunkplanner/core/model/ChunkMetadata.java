/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.core.model;

import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.common.io.stream.StreamOutput;
import org.opensearch.core.common.io.stream.Writeable;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Catalog metadata of one immutable chunk of a table.
 *
 * <p>A chunk covers the inclusive time interval {@code [minTime, maxTime]} and stores an ordered subset of the table
 * columns. The position of a column in {@link #getColumns()} is its chunk-local column index. The
 * {@link #getRecencyKey() recency key} increases with every chunk written and decides which chunk wins when the same
 * primary key is stored more than once.</p>
 *
 * <p>Instances are immutable; compaction replaces chunks instead of editing them.</p>
 */
public final class ChunkMetadata implements Writeable {

    private final String id;
    private final long minTime;
    private final long maxTime;
    private final List<ColumnDefinition> columns;
    private final Map<String, Integer> localIndexes;
    private final long rowCount;
    private final long recencyKey;
    private final boolean sortedByPrimaryKey;
    private final boolean deleted;

    /**
     * Constructor for ChunkMetadata.
     *
     * @param id stable chunk identifier
     * @param minTime smallest timestamp in the chunk (inclusive)
     * @param maxTime largest timestamp in the chunk (inclusive)
     * @param columns ordered chunk-local columns
     * @param rowCount number of rows
     * @param recencyKey monotonically increasing creation sequence
     * @param sortedByPrimaryKey whether the writer stored rows in primary key order
     * @param deleted soft-delete marker
     */
    public ChunkMetadata(
        String id,
        long minTime,
        long maxTime,
        List<ColumnDefinition> columns,
        long rowCount,
        long recencyKey,
        boolean sortedByPrimaryKey,
        boolean deleted
    ) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("Chunk id cannot be null or empty");
        }
        if (minTime > maxTime) {
            throw new IllegalArgumentException("Chunk [" + id + "] has minTime " + minTime + " greater than maxTime " + maxTime);
        }
        if (columns == null) {
            throw new IllegalArgumentException("Chunk [" + id + "] columns cannot be null");
        }
        if (rowCount < 0) {
            throw new IllegalArgumentException("Chunk [" + id + "] has negative row count " + rowCount);
        }
        Map<String, Integer> indexes = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            ColumnDefinition column = columns.get(i);
            if (indexes.putIfAbsent(column.name(), i) != null) {
                throw new IllegalArgumentException("Chunk [" + id + "] declares column [" + column.name() + "] more than once");
            }
        }
        this.id = id;
        this.minTime = minTime;
        this.maxTime = maxTime;
        this.columns = List.copyOf(columns);
        this.localIndexes = Collections.unmodifiableMap(indexes);
        this.rowCount = rowCount;
        this.recencyKey = recencyKey;
        this.sortedByPrimaryKey = sortedByPrimaryKey;
        this.deleted = deleted;
    }

    /**
     * Deserialize chunk metadata.
     * @param in the stream to read from
     * @throws IOException if reading fails
     */
    public ChunkMetadata(StreamInput in) throws IOException {
        this(
            in.readString(),
            in.readLong(),
            in.readLong(),
            in.readList(ColumnDefinition::readFrom),
            in.readVLong(),
            in.readLong(),
            in.readBoolean(),
            in.readBoolean()
        );
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeString(id);
        out.writeLong(minTime);
        out.writeLong(maxTime);
        out.writeList(columns);
        out.writeVLong(rowCount);
        out.writeLong(recencyKey);
        out.writeBoolean(sortedByPrimaryKey);
        out.writeBoolean(deleted);
    }

    public String getId() {
        return id;
    }

    public long getMinTime() {
        return minTime;
    }

    public long getMaxTime() {
        return maxTime;
    }

    /**
     * Gets the chunk-local columns; list position is the local column index.
     * @return immutable list of columns
     */
    public List<ColumnDefinition> getColumns() {
        return columns;
    }

    public long getRowCount() {
        return rowCount;
    }

    public long getRecencyKey() {
        return recencyKey;
    }

    public boolean isSortedByPrimaryKey() {
        return sortedByPrimaryKey;
    }

    public boolean isDeleted() {
        return deleted;
    }

    /**
     * Looks up the chunk-local index of a column.
     *
     * @param columnName the column name
     * @return the local index, or -1 if this chunk does not store the column
     */
    public int localIndexOf(String columnName) {
        Integer index = localIndexes.get(columnName);
        return index == null ? -1 : index;
    }

    /**
     * Looks up the type this chunk declares for a column.
     *
     * @param columnName the column name
     * @return the column type, or null if this chunk does not store the column
     */
    public ColumnType typeOf(String columnName) {
        int index = localIndexOf(columnName);
        return index < 0 ? null : columns.get(index).type();
    }

    /**
     * Checks whether the chunk interval intersects {@code [otherMin, otherMax]}.
     *
     * @param otherMin inclusive lower bound
     * @param otherMax inclusive upper bound
     * @return true if at least one timestamp is shared
     */
    public boolean overlaps(long otherMin, long otherMax) {
        return minTime <= otherMax && otherMin <= maxTime;
    }

    /**
     * Returns a copy of this chunk with the soft-delete marker set.
     * @return a deleted copy
     */
    public ChunkMetadata markDeleted() {
        return new ChunkMetadata(id, minTime, maxTime, columns, rowCount, recencyKey, sortedByPrimaryKey, true);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ChunkMetadata that = (ChunkMetadata) o;
        return minTime == that.minTime
            && maxTime == that.maxTime
            && rowCount == that.rowCount
            && recencyKey == that.recencyKey
            && sortedByPrimaryKey == that.sortedByPrimaryKey
            && deleted == that.deleted
            && id.equals(that.id)
            && columns.equals(that.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, minTime, maxTime, columns, rowCount, recencyKey, sortedByPrimaryKey, deleted);
    }

    @Override
    public String toString() {
        return "Chunk[" + id + ", time=[" + minTime + "," + maxTime + "], recency=" + recencyKey + ", columns=" + columns + "]";
    }

    /**
     * Creates a builder for chunk metadata.
     * @param id the chunk id
     * @return a new builder
     */
    public static Builder builder(String id) {
        return new Builder(id);
    }

    /**
     * Builder for {@link ChunkMetadata}.
     */
    public static final class Builder {
        private final String id;
        private long minTime;
        private long maxTime;
        private final List<ColumnDefinition> columns = new ArrayList<>();
        private long rowCount;
        private long recencyKey;
        private boolean sortedByPrimaryKey = true;
        private boolean deleted;

        private Builder(String id) {
            this.id = id;
        }

        public Builder timeRange(long minTime, long maxTime) {
            this.minTime = minTime;
            this.maxTime = maxTime;
            return this;
        }

        public Builder column(String name, ColumnType type) {
            columns.add(new ColumnDefinition(name, type));
            return this;
        }

        public Builder rowCount(long rowCount) {
            this.rowCount = rowCount;
            return this;
        }

        public Builder recencyKey(long recencyKey) {
            this.recencyKey = recencyKey;
            return this;
        }

        public Builder sortedByPrimaryKey(boolean sortedByPrimaryKey) {
            this.sortedByPrimaryKey = sortedByPrimaryKey;
            return this;
        }

        public Builder deleted(boolean deleted) {
            this.deleted = deleted;
            return this;
        }

        public ChunkMetadata build() {
            return new ChunkMetadata(id, minTime, maxTime, columns, rowCount, recencyKey, sortedByPrimaryKey, deleted);
        }
    }
}
