/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.query.schema;

import org.opensearch.chunkplanner.core.model.ChunkMetadata;
import org.opensearch.chunkplanner.core.model.ColumnDefinition;
import org.opensearch.chunkplanner.core.model.ColumnType;
import org.opensearch.test.OpenSearchTestCase;

import java.util.List;

public class LogicalSchemaTests extends OpenSearchTestCase {

    private static final LogicalSchema SCHEMA = new LogicalSchema(
        List.of(
            new ColumnDefinition("tag", ColumnType.TAG),
            new ColumnDefinition("time", ColumnType.TIMESTAMP),
            new ColumnDefinition("humidity", ColumnType.FLOAT),
            new ColumnDefinition("temp", ColumnType.FLOAT)
        ),
        List.of("tag", "time"),
        "time"
    );

    public void testLookups() {
        assertEquals(List.of("tag", "time", "humidity", "temp"), SCHEMA.getColumnNames());
        assertEquals(2, SCHEMA.indexOf("humidity"));
        assertEquals(-1, SCHEMA.indexOf("pressure"));
        assertNull(SCHEMA.typeOf("pressure"));
        assertTrue(SCHEMA.isPrimaryKey("time"));
        assertFalse(SCHEMA.isPrimaryKey("temp"));
        assertFalse(SCHEMA.isPrimaryKey("pressure"));
    }

    public void testInLogicalOrder() {
        assertEquals(List.of("tag", "humidity", "temp"), SCHEMA.inLogicalOrder(List.of("temp", "tag", "humidity", "temp")));
        expectThrows(IllegalArgumentException.class, () -> SCHEMA.inLogicalOrder(List.of("pressure")));
    }

    public void testPrimaryKeyMustLeadColumns() {
        expectThrows(
            IllegalArgumentException.class,
            () -> new LogicalSchema(
                List.of(new ColumnDefinition("temp", ColumnType.FLOAT), new ColumnDefinition("time", ColumnType.TIMESTAMP)),
                List.of("time"),
                "time"
            )
        );
    }

    public void testColumnMapping() {
        ChunkMetadata c1 = ChunkMetadata.builder("C1")
            .timeRange(0, 10)
            .column("temp", ColumnType.FLOAT)
            .column("tag", ColumnType.TAG)
            .column("time", ColumnType.TIMESTAMP)
            .build();
        ChunkMetadata c2 = ChunkMetadata.builder("C2").timeRange(0, 10).column("time", ColumnType.TIMESTAMP).build();
        ColumnMapping mapping = new ColumnMapping(SCHEMA, List.of(c1, c2));

        assertEquals(2, mapping.chunkCount());
        assertArrayEquals(new int[] { 1, 2, ColumnMapping.ABSENT, 0 }, mapping.localIndexes("C1", SCHEMA.getColumnNames()));
        assertArrayEquals(new int[] { ColumnMapping.ABSENT, 0 }, mapping.localIndexes("C2", List.of("tag", "time")));
        assertFalse(mapping.isPresent("C2", "temp"));
        expectThrows(IllegalArgumentException.class, () -> mapping.localIndex("C3", "temp"));
        expectThrows(IllegalArgumentException.class, () -> mapping.localIndex("C1", "pressure"));
        expectThrows(IllegalArgumentException.class, () -> new ColumnMapping(SCHEMA, List.of(c1, c1)));
    }
}
