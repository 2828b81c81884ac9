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
import org.opensearch.chunkplanner.core.model.ColumnType;
import org.opensearch.chunkplanner.core.model.Tombstone;
import org.opensearch.chunkplanner.core.predicate.ColumnPredicate;
import org.opensearch.chunkplanner.core.predicate.Predicate;
import org.opensearch.chunkplanner.query.plan.ChunkQuery;
import org.opensearch.chunkplanner.query.plan.PlannerConfig;
import org.opensearch.chunkplanner.query.plan.QueryPlanner;
import org.opensearch.chunkplanner.query.plan.nodes.PlanNode;
import org.opensearch.chunkplanner.utils.InMemoryTable;
import org.opensearch.chunkplanner.utils.TestTables;
import org.opensearch.test.OpenSearchTestCase;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static org.opensearch.chunkplanner.utils.InMemoryTable.row;
import static org.opensearch.chunkplanner.utils.TestTables.chunk;

/**
 * End to end tests: plan a query, execute it against in-memory chunks and check the rows.
 */
public class PlanExecutorTests extends OpenSearchTestCase {

    private static final List<String> ALL = List.of("tag", "time", "temp", "humidity");

    private static List<List<Object>> run(InMemoryTable table, ChunkQuery query) {
        return run(table, query, PlannerConfig.defaultConfig());
    }

    private static List<List<Object>> run(InMemoryTable table, ChunkQuery query, PlannerConfig config) {
        PlanNode plan = new QueryPlanner(config).plan(query, table);
        List<List<Object>> result = new ArrayList<>();
        for (Row row : PlanExecutor.execute(plan, table).toList()) {
            result.add(row.asList());
        }
        return result;
    }

    private static List<Object> values(Object... values) {
        return Arrays.asList(values);
    }

    public void testOverlappingChunksDeduplicatedAndIsolatedChunkPaddedWithNulls() {
        List<List<Object>> rows = run(TestTables.overlappingCpu(), new ChunkQuery("cpu", ALL, Predicate.MATCH_ALL));

        assertEquals(
            List.of(
                values("a", 10L, 1.0, null),
                values("a", 60L, 20.0, null),
                values("a", 120L, 4.0, null),
                values("b", 70L, 3.0, null),
                values("a", 200L, null, 5.0),
                values("b", 250L, null, 15.0)
            ),
            rows
        );
    }

    public void testResidualFilterOnColumnStoredByIsolatedChunkOnly() {
        ChunkQuery query = new ChunkQuery("cpu", ALL, Predicate.and(ColumnPredicate.gt("humidity", 10.0)));

        assertEquals(List.of(values("b", 250L, null, 15.0)), run(TestTables.overlappingCpu(), query));
    }

    public void testValueFilterAppliedAfterDedup() {
        // the newest temp of (a, 60) is 20.0; the older 2.0 must not resurface
        ChunkQuery query = new ChunkQuery("cpu", ALL, Predicate.and(ColumnPredicate.lt("temp", 10.0)));

        assertEquals(
            List.of(values("a", 10L, 1.0, null), values("a", 120L, 4.0, null), values("b", 70L, 3.0, null)),
            run(TestTables.overlappingCpu(), query)
        );
    }

    public void testPushdownDoesNotChangeResults() {
        Predicate predicate = Predicate.and(ColumnPredicate.eq("tag", "a"), ColumnPredicate.lt("temp", 10.0));
        ChunkQuery query = new ChunkQuery("cpu", ALL, predicate);

        List<List<Object>> optimized = run(TestTables.overlappingCpu(), query);
        List<List<Object>> plain = run(TestTables.overlappingCpu(), query, PlannerConfig.noOptimizations());

        assertEquals(List.of(values("a", 10L, 1.0, null), values("a", 120L, 4.0, null)), optimized);
        assertEquals(optimized, plain);
    }

    public void testProjectionInCallerOrder() {
        ChunkQuery query = new ChunkQuery("cpu", List.of("temp", "tag"), Predicate.and(ColumnPredicate.lte("time", 70L)));

        assertEquals(
            List.of(values(1.0, "a"), values(20.0, "a"), values(3.0, "b")),
            run(TestTables.overlappingCpu(), query)
        );
    }

    public void testColumnFillAcrossChunks() {
        InMemoryTable table = InMemoryTable.cpu()
            .addChunk(chunk("A", 0, 10, 1).column("x", ColumnType.INTEGER).build(), row("k", 5L, 5L))
            .addChunk(chunk("B", 0, 10, 2).column("y", ColumnType.INTEGER).build(), row("k", 5L, 7L));

        List<List<Object>> rows = run(table, ChunkQuery.selectAll("cpu"));

        assertEquals(List.of(values("k", 5L, 5L, 7L)), rows);
    }

    public void testUnsignedFilterAboveSignedRange() {
        // -1L is 2^64-1 and Long.MIN_VALUE is 2^63 when read as unsigned
        InMemoryTable table = InMemoryTable.cpu()
            .declare("n", ColumnType.UNSIGNED)
            .addChunk(chunk("A", 0, 10, 1).column("n", ColumnType.UNSIGNED).build(), row("k", 1L, -1L), row("k", 2L, 7L))
            .addChunk(chunk("B", 20, 30, 2).column("n", ColumnType.UNSIGNED).build(), row("k", 25L, Long.MAX_VALUE));

        ChunkQuery query = ChunkQuery.selectAll("cpu").where(Predicate.and(ColumnPredicate.gte("n", Long.MIN_VALUE)));

        assertEquals(List.of(values("k", 1L, -1L)), run(table, query));
        assertEquals(List.of(values("k", 1L, -1L)), run(table, query, PlannerConfig.noOptimizations()));
    }

    public void testNewestNonNullValueWins() {
        InMemoryTable table = InMemoryTable.cpu()
            .addChunk(chunk("A", 0, 10, 1).column("x", ColumnType.INTEGER).build(), row("k", 5L, 1L))
            .addChunk(chunk("B", 0, 10, 2).column("x", ColumnType.INTEGER).build(), row("k", 5L, null))
            .addChunk(chunk("C", 0, 10, 3).column("x", ColumnType.INTEGER).build(), row("k", 5L, 3L));

        assertEquals(List.of(values("k", 5L, 3L)), run(table, ChunkQuery.selectAll("cpu")));
    }

    public void testAllNullColumnStaysNull() {
        InMemoryTable table = InMemoryTable.cpu()
            .declare("x", ColumnType.INTEGER)
            .addChunk(chunk("A", 0, 10, 1).build(), row("k", 5L))
            .addChunk(chunk("B", 0, 10, 2).column("x", ColumnType.INTEGER).build(), row("k", 5L, null));

        assertEquals(List.of(values("k", 5L, null)), run(table, ChunkQuery.selectAll("cpu")));
    }

    public void testUnsortedChunkIsSorted() {
        InMemoryTable table = InMemoryTable.cpu()
            .declare("v", ColumnType.INTEGER)
            .addChunk(chunk("A", 0, 30, 1).column("v", ColumnType.INTEGER).build(), row("a", 10L, 1L), row("a", 30L, 3L))
            .addChunk(
                chunk("B", 0, 30, 2).column("v", ColumnType.INTEGER).sortedByPrimaryKey(false).build(),
                row("b", 5L, 50L),
                row("a", 20L, 20L),
                row("a", 10L, 10L)
            );

        assertEquals(
            List.of(values("a", 10L, 10L), values("a", 20L, 20L), values("a", 30L, 3L), values("b", 5L, 50L)),
            run(table, ChunkQuery.selectAll("cpu"))
        );
    }

    public void testTombstoneDeletesOnlyOlderData() {
        // sequence 2 covers C1 only: (a, 60) survives with the value of C2
        InMemoryTable table = TestTables.overlappingCpu().addTombstone(new Tombstone(1, 2, 0, 65, Predicate.MATCH_ALL));

        assertEquals(
            List.of(values("a", 60L, 20.0, null), values("a", 120L, 4.0, null), values("b", 70L, 3.0, null)),
            run(table, new ChunkQuery("cpu", ALL, Predicate.and(ColumnPredicate.lt("time", 200L))))
        );
    }

    public void testTombstoneWithPredicate() {
        InMemoryTable table = TestTables.overlappingCpu()
            .addTombstone(new Tombstone(1, 10, 0, 300, Predicate.and(ColumnPredicate.eq("tag", "b"))));

        List<List<Object>> rows = run(table, new ChunkQuery("cpu", ALL, Predicate.MATCH_ALL));

        assertEquals(
            List.of(values("a", 10L, 1.0, null), values("a", 60L, 20.0, null), values("a", 120L, 4.0, null), values("a", 200L, null, 5.0)),
            rows
        );
    }

    public void testEmptyTableProducesNoRows() {
        InMemoryTable table = InMemoryTable.cpu();
        assertTrue(run(table, ChunkQuery.selectAll("cpu")).isEmpty());
    }

    public void testReadErrorSurfaces() {
        InMemoryTable table = TestTables.overlappingCpu();
        PlanNode plan = new QueryPlanner(PlannerConfig.defaultConfig()).plan(new ChunkQuery("cpu", ALL, Predicate.MATCH_ALL), table);
        ChunkDataSource failing = chunk -> {
            if (chunk.getId().equals("C3")) {
                throw new IOException("chunk file missing");
            }
            return table.readRows(chunk);
        };

        RowIterator iterator = PlanExecutor.execute(plan, failing);
        RuntimeException e = expectThrows(RuntimeException.class, iterator::toList);
        assertTrue(e.getCause() instanceof IOException);
        assertEquals("chunk file missing", e.getCause().getMessage());
    }

    public void testCorruptRowSurfacesAsIllegalState() {
        InMemoryTable table = InMemoryTable.cpu().addChunk(chunk("A", 0, 10, 1).build(), row("a", 1L, "unexpected"));
        PlanNode plan = new QueryPlanner(PlannerConfig.defaultConfig()).plan(ChunkQuery.selectAll("cpu"), table);

        expectThrows(IllegalStateException.class, () -> PlanExecutor.execute(plan, table).toList());
    }

    /**
     * Random overlapping chunks compared against a direct computation of the newest non-null value per key and column.
     */
    public void testRandomChunksMatchReference() {
        for (int iteration = 0; iteration < 20; iteration++) {
            InMemoryTable table = InMemoryTable.cpu().declare("v1", ColumnType.INTEGER).declare("v2", ColumnType.INTEGER);
            // key -> [recency of v1, v1, recency of v2, v2]
            Map<String, long[]> newest = new TreeMap<>();
            Map<String, Object[]> expected = new TreeMap<>();
            int chunkCount = randomIntBetween(1, 8);
            for (int c = 0; c < chunkCount; c++) {
                long minTime = randomLongBetween(0, 50);
                long maxTime = minTime + randomLongBetween(0, 30);
                boolean hasV1 = randomBoolean();
                boolean hasV2 = randomBoolean();
                boolean sorted = randomBoolean();
                ChunkMetadata.Builder builder = chunk("C" + c, minTime, maxTime, c + 1).sortedByPrimaryKey(sorted);
                if (hasV1) {
                    builder.column("v1", ColumnType.INTEGER);
                }
                if (hasV2) {
                    builder.column("v2", ColumnType.INTEGER);
                }
                List<Object[]> rows = new ArrayList<>();
                Set<String> keys = new HashSet<>();
                int rowCount = randomIntBetween(0, 10);
                for (int r = 0; r < rowCount; r++) {
                    String tag = randomFrom("a", "b", "c");
                    long time = randomLongBetween(minTime, maxTime);
                    if (keys.add(tag + "/" + time) == false) {
                        continue;
                    }
                    List<Object> stored = new ArrayList<>(List.of(tag, time));
                    Long v1 = hasV1 && randomBoolean() ? randomLongBetween(0, 1000) : null;
                    Long v2 = hasV2 && randomBoolean() ? randomLongBetween(0, 1000) : null;
                    if (hasV1) {
                        stored.add(v1);
                    }
                    if (hasV2) {
                        stored.add(v2);
                    }
                    rows.add(stored.toArray());

                    String key = String.format(Locale.ROOT, "%s/%05d", tag, time);
                    Object[] out = expected.computeIfAbsent(key, k -> new Object[] { tag, time, null, null });
                    long[] recency = newest.computeIfAbsent(key, k -> new long[] { -1, -1 });
                    if (v1 != null && c + 1 > recency[0]) {
                        out[2] = v1;
                        recency[0] = c + 1;
                    }
                    if (v2 != null && c + 1 > recency[1]) {
                        out[3] = v2;
                        recency[1] = c + 1;
                    }
                }
                if (sorted) {
                    rows.sort(Comparator.comparing((Object[] stored) -> (String) stored[0]).thenComparing(stored -> (Long) stored[1]));
                } else {
                    Collections.shuffle(rows, random());
                }
                table.addChunk(builder.rowCount(rows.size()).build(), rows.toArray(new Object[0][]));
            }

            List<List<Object>> actual = run(table, ChunkQuery.selectAll("cpu"));

            Set<String> seen = new HashSet<>();
            Map<String, List<Object>> byKey = new TreeMap<>();
            for (List<Object> row : actual) {
                String key = String.format(Locale.ROOT, "%s/%05d", row.get(0), (Long) row.get(1));
                assertTrue("duplicate key " + key, seen.add(key));
                byKey.put(key, row);
            }
            assertEquals(expected.keySet(), byKey.keySet());
            for (Map.Entry<String, Object[]> entry : expected.entrySet()) {
                assertEquals(entry.getKey(), Arrays.asList(entry.getValue()), byKey.get(entry.getKey()));
            }
        }
    }
}
