/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.core.catalog;

import org.opensearch.chunkplanner.core.model.ChunkMetadata;
import org.opensearch.chunkplanner.core.model.ColumnType;
import org.opensearch.chunkplanner.core.model.Tombstone;
import org.opensearch.chunkplanner.core.predicate.Predicate;
import org.opensearch.chunkplanner.utils.InMemoryTable;
import org.opensearch.test.OpenSearchTestCase;

import java.util.List;
import java.util.Map;

public class CatalogSnapshotTests extends OpenSearchTestCase {

    public void testCaptureSkipsDeletedChunks() {
        InMemoryTable table = InMemoryTable.cpu()
            .addChunk(ChunkMetadata.builder("C1").timeRange(0, 10).build())
            .addChunk(ChunkMetadata.builder("C2").timeRange(5, 20).build())
            .markDeleted("C1");

        CatalogSnapshot snapshot = CatalogSnapshot.capture(table, "cpu");

        assertEquals("cpu", snapshot.getTable());
        assertEquals(1, snapshot.getChunks().size());
        assertEquals("C2", snapshot.getChunks().get(0).getId());
        assertEquals(List.of("tag", "time"), snapshot.getPrimaryKey());
        assertEquals(Map.of("tag", ColumnType.TAG, "time", ColumnType.TIMESTAMP), snapshot.getTableSchema());
    }

    public void testSnapshotIsIsolatedFromCatalog() {
        InMemoryTable table = InMemoryTable.cpu().addChunk(ChunkMetadata.builder("C1").timeRange(0, 10).build());
        CatalogSnapshot snapshot = CatalogSnapshot.capture(table, "cpu");

        table.addChunk(ChunkMetadata.builder("C2").timeRange(0, 10).build())
            .addTombstone(new Tombstone(1, 9, 0, 10, Predicate.MATCH_ALL))
            .declare("temp", ColumnType.FLOAT);

        assertEquals(1, snapshot.getChunks().size());
        assertTrue(snapshot.getTombstones().isEmpty());
        assertFalse(snapshot.getTableSchema().containsKey("temp"));
        expectThrows(UnsupportedOperationException.class, () -> snapshot.getChunks().clear());
    }

    public void testNullCollectionsBecomeEmpty() {
        CatalogSnapshot snapshot = new CatalogSnapshot("t", null, null, null, null);

        assertTrue(snapshot.getChunks().isEmpty());
        assertTrue(snapshot.getTombstones().isEmpty());
        assertTrue(snapshot.getPrimaryKey().isEmpty());
        assertTrue(snapshot.getTableSchema().isEmpty());
    }

    public void testValidation() {
        expectThrows(IllegalArgumentException.class, () -> new CatalogSnapshot("", List.of(), List.of(), List.of(), Map.of()));
        expectThrows(IllegalArgumentException.class, () -> CatalogSnapshot.capture(null, "cpu"));
        expectThrows(IllegalArgumentException.class, () -> CatalogSnapshot.capture(InMemoryTable.cpu(), "memory"));
    }
}
