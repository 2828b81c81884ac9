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
import org.opensearch.chunkplanner.core.model.ChunkMetadata;
import org.opensearch.chunkplanner.core.model.Tombstone;
import org.opensearch.chunkplanner.core.predicate.ColumnPredicate;
import org.opensearch.chunkplanner.core.predicate.Predicate;
import org.opensearch.chunkplanner.query.plan.nodes.ScanPlanNode;
import org.opensearch.chunkplanner.query.schema.ColumnMapping;

import java.io.IOException;
import java.util.Iterator;
import java.util.List;

/**
 * Reads the rows of one chunk into the working column layout of a {@link ScanPlanNode}.
 *
 * <p>Rows deleted by a tombstone and rows failing the pushed predicate are skipped. Both are evaluated on chunk-local
 * values; a column the chunk does not store reads as null.</p>
 */
public class ScanIterator implements RowIterator {

    private final ChunkMetadata chunk;
    private final int[] localIndexes;
    private final Predicate predicate;
    private final List<Tombstone> tombstones;
    private final int timeIndex;
    private Iterator<Object[]> source;
    private Row current;
    private Exception error;

    public ScanIterator(ScanPlanNode node, ChunkDataSource dataSource) {
        this.chunk = node.getChunk();
        this.localIndexes = node.getLocalIndexes();
        this.predicate = node.getPushedPredicate();
        this.tombstones = node.getTombstones();
        this.timeIndex = chunk.localIndexOf(node.getTimeColumn());
        try {
            this.source = dataSource.readRows(chunk);
        } catch (IOException e) {
            this.error = e;
        }
    }

    @Override
    public boolean next() {
        if (error != null || source == null) {
            return false;
        }
        try {
            while (source.hasNext()) {
                Object[] stored = source.next();
                if (stored.length != chunk.getColumns().size()) {
                    throw new IllegalStateException("Chunk [" + chunk.getId() + "] returned a row of " + stored.length
                        + " values but declares " + chunk.getColumns().size() + " columns");
                }
                if (isDeleted(stored) || !matches(predicate, stored)) {
                    continue;
                }
                Object[] values = new Object[localIndexes.length];
                for (int i = 0; i < localIndexes.length; i++) {
                    values[i] = localIndexes[i] == ColumnMapping.ABSENT ? null : stored[localIndexes[i]];
                }
                current = new Row(values, chunk.getRecencyKey());
                return true;
            }
        } catch (RuntimeException e) {
            error = e;
        }
        return false;
    }

    private boolean isDeleted(Object[] stored) {
        if (tombstones.isEmpty()) {
            return false;
        }
        Object time = timeIndex < 0 ? null : stored[timeIndex];
        for (Tombstone tombstone : tombstones) {
            if (time != null && tombstone.coversTime((Long) time) && matches(tombstone.getDeletePredicate(), stored)) {
                return true;
            }
        }
        return false;
    }

    private boolean matches(Predicate p, Object[] stored) {
        for (ColumnPredicate clause : p.getClauses()) {
            int local = chunk.localIndexOf(clause.getColumn());
            Object value = local < 0 ? null : stored[local];
            if (!clause.test(value, chunk.typeOf(clause.getColumn()))) {
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
        return error;
    }
}
