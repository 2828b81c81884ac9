/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.query.overlap;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.chunkplanner.core.model.ChunkMetadata;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Partitions chunks into {@link OverlapGroup}s by sweeping their time intervals.
 *
 * <p>Chunks are sorted by {@code minTime} (ties by chunk id) and scanned left to right while tracking the largest
 * {@code maxTime} of the open group. A chunk opens a new group only when its {@code minTime} is beyond that running
 * maximum, so a chunk that contains another one's interval pulls in everything in between. The result is the set of
 * connected components of the interval-overlap graph, computed in O(n log n).</p>
 *
 * <p>The grouping looks at time ranges only. Chunks whose ranges overlap but whose key sets are disjoint still end up
 * in one group; deduplicating them is redundant work but never wrong.</p>
 */
public class OverlapGrouper {

    private static final Logger logger = LogManager.getLogger(OverlapGrouper.class);

    /** Sweep order: start time, then chunk id. */
    static final Comparator<ChunkMetadata> SWEEP_ORDER = Comparator.comparingLong(ChunkMetadata::getMinTime)
        .thenComparing(ChunkMetadata::getId);

    /**
     * Groups the given chunks.
     *
     * @param chunks the chunks to group; not modified
     * @return groups in time order, empty for an empty input
     */
    public List<OverlapGroup> group(List<ChunkMetadata> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            return List.of();
        }

        List<ChunkMetadata> sorted = new ArrayList<>(chunks);
        sorted.sort(SWEEP_ORDER);

        List<OverlapGroup> groups = new ArrayList<>();
        List<ChunkMetadata> open = new ArrayList<>();
        long runningMax = Long.MIN_VALUE;
        for (ChunkMetadata chunk : sorted) {
            if (!open.isEmpty() && chunk.getMinTime() > runningMax) {
                groups.add(new OverlapGroup(open));
                open = new ArrayList<>();
            }
            if (open.isEmpty()) {
                runningMax = chunk.getMaxTime();
            } else {
                runningMax = Math.max(runningMax, chunk.getMaxTime());
            }
            open.add(chunk);
        }
        groups.add(new OverlapGroup(open));

        if (logger.isDebugEnabled()) {
            long trivial = groups.stream().filter(OverlapGroup::isTrivial).count();
            logger.debug("Grouped {} chunks into {} overlap groups ({} trivial)", chunks.size(), groups.size(), trivial);
        }
        return groups;
    }
}
