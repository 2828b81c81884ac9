/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.query.overlap;

import org.opensearch.chunkplanner.core.model.ChunkMetadata;

import java.util.List;

/**
 * Chunks whose time intervals intersect, directly or through other members, and therefore have to be merged and
 * deduplicated together. Transient: recomputed for every query.
 */
public final class OverlapGroup {

    private final List<ChunkMetadata> members;
    private final long minTime;
    private final long maxTime;

    /**
     * Constructor for OverlapGroup.
     * @param members member chunks in sweep order
     */
    public OverlapGroup(List<ChunkMetadata> members) {
        if (members == null || members.isEmpty()) {
            throw new IllegalArgumentException("Overlap group cannot be empty");
        }
        long min = Long.MAX_VALUE;
        long max = Long.MIN_VALUE;
        for (ChunkMetadata member : members) {
            min = Math.min(min, member.getMinTime());
            max = Math.max(max, member.getMaxTime());
        }
        this.members = List.copyOf(members);
        this.minTime = min;
        this.maxTime = max;
    }

    public List<ChunkMetadata> getMembers() {
        return members;
    }

    public long getMinTime() {
        return minTime;
    }

    public long getMaxTime() {
        return maxTime;
    }

    /**
     * A group with a single chunk never needs merging or deduplication: chunks are deduplicated when written.
     * @return true if the group has exactly one member
     */
    public boolean isTrivial() {
        return members.size() == 1;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Group[");
        for (int i = 0; i < members.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(members.get(i).getId());
        }
        return sb.append(", time=[").append(minTime).append(',').append(maxTime).append("]]").toString();
    }
}
