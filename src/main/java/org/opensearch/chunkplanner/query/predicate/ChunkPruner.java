/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.query.predicate;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.chunkplanner.core.model.ChunkMetadata;
import org.opensearch.chunkplanner.core.predicate.ColumnPredicate;
import org.opensearch.chunkplanner.core.predicate.Predicate;
import org.opensearch.chunkplanner.query.overlap.OverlapGroup;
import org.opensearch.chunkplanner.query.schema.ColumnMapping;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes chunks that cannot contribute a row to the query result, using only catalog metadata.
 */
public final class ChunkPruner {

    private static final Logger logger = LogManager.getLogger(ChunkPruner.class);

    private ChunkPruner() {}

    /**
     * Drops chunks whose time interval lies outside the range the predicate allows. The time column is part of the
     * primary key, so every row of such a chunk would be filtered out after deduplication as well.
     *
     * @param chunks the candidate chunks
     * @param range the time range implied by the predicate
     * @return the chunks that may hold matching rows
     */
    public static List<ChunkMetadata> pruneByTime(List<ChunkMetadata> chunks, TimeRange range) {
        if (range.isUnbounded()) {
            return chunks;
        }
        List<ChunkMetadata> kept = new ArrayList<>(chunks.size());
        for (ChunkMetadata chunk : chunks) {
            if (range.intersects(chunk.getMinTime(), chunk.getMaxTime())) {
                kept.add(chunk);
            } else {
                logger.trace("Pruned chunk [{}] outside time range [{}, {}]", chunk.getId(), range.minTime(), range.maxTime());
            }
        }
        if (kept.size() < chunks.size()) {
            logger.debug("Time range pruning removed {} of {} chunks", chunks.size() - kept.size(), chunks.size());
        }
        return kept;
    }

    /**
     * Drops whole overlap groups in which some non null-aware clause references a column that no member stores.
     * Every row of such a group reads null for that column after deduplication, so the clause rejects all of them.
     *
     * @param groups the overlap groups
     * @param predicate the validated predicate
     * @param mapping the presence matrix
     * @return the groups that may produce matching rows
     */
    public static List<OverlapGroup> pruneGroupsMissingColumns(List<OverlapGroup> groups, Predicate predicate, ColumnMapping mapping) {
        if (predicate.isEmpty()) {
            return groups;
        }
        List<OverlapGroup> kept = new ArrayList<>(groups.size());
        for (OverlapGroup group : groups) {
            ColumnPredicate unsatisfiable = findUnsatisfiableClause(group, predicate, mapping);
            if (unsatisfiable == null) {
                kept.add(group);
            } else {
                logger.debug("Pruned {}: no member stores column [{}] required by [{}]", group, unsatisfiable.getColumn(), unsatisfiable);
            }
        }
        return kept;
    }

    private static ColumnPredicate findUnsatisfiableClause(OverlapGroup group, Predicate predicate, ColumnMapping mapping) {
        for (ColumnPredicate clause : predicate.getClauses()) {
            if (clause.isNullAware()) {
                continue;
            }
            boolean stored = false;
            for (ChunkMetadata member : group.getMembers()) {
                if (mapping.isPresent(member.getId(), clause.getColumn())) {
                    stored = true;
                    break;
                }
            }
            if (!stored) {
                return clause;
            }
        }
        return null;
    }
}
