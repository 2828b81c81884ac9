/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.query.exec;

import org.opensearch.chunkplanner.core.chunk.Row;
import org.opensearch.chunkplanner.core.model.ChunkMetadata;
import org.opensearch.chunkplanner.core.model.ColumnDefinition;
import org.opensearch.chunkplanner.core.model.ColumnType;
import org.opensearch.chunkplanner.core.model.Tombstone;
import org.opensearch.chunkplanner.core.predicate.ColumnPredicate;
import org.opensearch.chunkplanner.core.predicate.Predicate;
import org.opensearch.chunkplanner.query.plan.nodes.ScanPlanNode;
import org.opensearch.chunkplanner.query.schema.ColumnMapping;
import org.opensearch.chunkplanner.utils.InMemoryTable;
import org.opensearch.test.OpenSearchTestCase;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import static org.opensearch.chunkplanner.utils.InMemoryTable.row;
import static org.opensearch.chunkplanner.utils.TestTables.chunk;

/**
 * Unit tests for ScanIterator.
 */
public class ScanIteratorTests extends OpenSearchTestCase {

    private static final List<ColumnDefinition> LAYOUT = List.of(
        new ColumnDefinition("tag", ColumnType.TAG),
        new ColumnDefinition("time", ColumnType.TIMESTAMP),
        new ColumnDefinition("humidity", ColumnType.FLOAT),
        new ColumnDefinition("temp", ColumnType.FLOAT)
    );

    // stored layout is (temp, time, tag): local order differs from the working layout
    private static final ChunkMetadata CHUNK = ChunkMetadata.builder("C1")
        .timeRange(0, 100)
        .recencyKey(4)
        .column("temp", ColumnType.FLOAT)
        .column("time", ColumnType.TIMESTAMP)
        .column("tag", ColumnType.TAG)
        .build();

    private static final int[] LOCAL = { 2, 1, ColumnMapping.ABSENT, 0 };

    private final InMemoryTable table = InMemoryTable.cpu()
        .addChunk(CHUNK, row(1.0, 10L, "a"), row(null, 20L, "b"), row(3.0, 30L, "a"), row(4.0, 40L, "c"));

    private ScanIterator scan(Predicate predicate, List<Tombstone> tombstones) {
        return new ScanIterator(new ScanPlanNode(0, CHUNK, LAYOUT, LOCAL, predicate, "time", tombstones), table);
    }

    public void testRemapsColumnsAndFillsNulls() {
        List<Row> rows = scan(Predicate.MATCH_ALL, List.of()).toList();

        assertEquals(4, rows.size());
        assertEquals(Arrays.asList("a", 10L, null, 1.0), rows.get(0).asList());
        assertEquals(Arrays.asList("b", 20L, null, null), rows.get(1).asList());
        for (Row row : rows) {
            assertEquals(4, row.getRecencyKey());
        }
    }

    public void testPushedPredicateOnLocalValues() {
        List<Row> rows = scan(Predicate.and(ColumnPredicate.eq("tag", "a"), ColumnPredicate.gt("temp", 2.0)), List.of()).toList();

        assertEquals(1, rows.size());
        assertEquals(30L, rows.get(0).get(1));
    }

    public void testPredicateOnAbsentColumnReadsNull() {
        assertEquals(4, scan(Predicate.and(ColumnPredicate.isNull("humidity")), List.of()).toList().size());
        assertEquals(0, scan(Predicate.and(ColumnPredicate.isNotNull("humidity")), List.of()).toList().size());
    }

    public void testTombstonesRemoveCoveredRows() {
        Tombstone range = new Tombstone(1, 9, 15, 30, Predicate.MATCH_ALL);
        Tombstone onlyC = new Tombstone(2, 9, 0, 100, Predicate.and(ColumnPredicate.eq("tag", "c")));

        List<Row> rows = scan(Predicate.MATCH_ALL, List.of(range, onlyC)).toList();

        assertEquals(1, rows.size());
        assertEquals(10L, rows.get(0).get(1));
    }

    public void testReadFailureIsReported() {
        ChunkMetadata missing = chunk("C9", 0, 10, 1).build();
        ScanIterator iterator = new ScanIterator(
            new ScanPlanNode(0, missing, LAYOUT.subList(0, 2), new int[] { 0, 1 }, Predicate.MATCH_ALL, "time", List.of()),
            table
        );

        assertFalse(iterator.next());
        assertTrue(iterator.error() instanceof IOException);
        RuntimeException e = expectThrows(RuntimeException.class, iterator::toList);
        assertTrue(e.getCause() instanceof IOException);
    }

    public void testShortRowIsAnError() {
        ChunkMetadata chunk = chunk("C2", 0, 10, 1).build();
        InMemoryTable broken = InMemoryTable.cpu().addChunk(chunk, row("a", 1L), row("a"));
        ScanIterator iterator = new ScanIterator(
            new ScanPlanNode(0, chunk, LAYOUT.subList(0, 2), new int[] { 0, 1 }, Predicate.MATCH_ALL, "time", List.of()),
            broken
        );

        assertTrue(iterator.next());
        assertFalse(iterator.next());
        assertTrue(iterator.error() instanceof IllegalStateException);
        assertFalse(iterator.next());
    }
}
