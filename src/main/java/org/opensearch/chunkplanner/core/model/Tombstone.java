/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.core.model;

import org.opensearch.chunkplanner.core.predicate.Predicate;
import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.common.io.stream.StreamOutput;
import org.opensearch.core.common.io.stream.Writeable;

import java.io.IOException;
import java.util.Objects;

/**
 * A delete request recorded against a table.
 *
 * <p>A tombstone removes the rows whose timestamp lies in {@code [minTime, maxTime]} and that satisfy its delete
 * predicate, but only from chunks written before it: it applies to a chunk when the chunk's recency key is lower
 * than the tombstone's {@link #getSequence() sequence} and the two time ranges intersect. Data written after the
 * delete is untouched.</p>
 */
public final class Tombstone implements Writeable {

    private final long id;
    private final long sequence;
    private final long minTime;
    private final long maxTime;
    private final Predicate deletePredicate;

    /**
     * Constructor for Tombstone.
     *
     * @param id tombstone identifier
     * @param sequence position in the same sequence as chunk recency keys
     * @param minTime inclusive lower time bound of the delete
     * @param maxTime inclusive upper time bound of the delete
     * @param deletePredicate additional conditions on the deleted rows; {@link Predicate#MATCH_ALL} for a pure time range
     */
    public Tombstone(long id, long sequence, long minTime, long maxTime, Predicate deletePredicate) {
        if (minTime > maxTime) {
            throw new IllegalArgumentException("Tombstone [" + id + "] has minTime " + minTime + " greater than maxTime " + maxTime);
        }
        this.id = id;
        this.sequence = sequence;
        this.minTime = minTime;
        this.maxTime = maxTime;
        this.deletePredicate = Objects.requireNonNull(deletePredicate, "Delete predicate cannot be null");
    }

    /**
     * Deserialize a tombstone.
     * @param in the stream to read from
     * @throws IOException if reading fails
     */
    public Tombstone(StreamInput in) throws IOException {
        this(in.readLong(), in.readLong(), in.readLong(), in.readLong(), new Predicate(in));
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeLong(id);
        out.writeLong(sequence);
        out.writeLong(minTime);
        out.writeLong(maxTime);
        deletePredicate.writeTo(out);
    }

    public long getId() {
        return id;
    }

    public long getSequence() {
        return sequence;
    }

    public long getMinTime() {
        return minTime;
    }

    public long getMaxTime() {
        return maxTime;
    }

    public Predicate getDeletePredicate() {
        return deletePredicate;
    }

    /**
     * Checks whether this tombstone must be applied when reading the chunk.
     *
     * @param chunk the chunk to check
     * @return true if the chunk is older than the delete and shares part of its time range
     */
    public boolean appliesTo(ChunkMetadata chunk) {
        return chunk.getRecencyKey() < sequence && chunk.overlaps(minTime, maxTime);
    }

    /**
     * Checks whether a timestamp lies inside the deleted range.
     * @param timestamp the row timestamp
     * @return true if covered
     */
    public boolean coversTime(long timestamp) {
        return timestamp >= minTime && timestamp <= maxTime;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Tombstone that = (Tombstone) o;
        return id == that.id
            && sequence == that.sequence
            && minTime == that.minTime
            && maxTime == that.maxTime
            && deletePredicate.equals(that.deletePredicate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, sequence, minTime, maxTime, deletePredicate);
    }

    @Override
    public String toString() {
        return "Tombstone[" + id + ", seq=" + sequence + ", time=[" + minTime + "," + maxTime + "], where " + deletePredicate + "]";
    }
}
