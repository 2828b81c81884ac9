/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.query.plan;

import org.opensearch.chunkplanner.core.predicate.ColumnPredicate;
import org.opensearch.chunkplanner.core.predicate.Predicate;
import org.opensearch.chunkplanner.core.predicate.PredicateTests;
import org.opensearch.core.common.io.stream.Writeable;
import org.opensearch.test.AbstractWireSerializingTestCase;

import java.util.Arrays;
import java.util.List;

public class ChunkQueryTests extends AbstractWireSerializingTestCase<ChunkQuery> {

    @Override
    protected ChunkQuery createTestInstance() {
        List<String> projection = randomSubsetOf(List.of("tag", "time", "temp", "humidity"));
        return new ChunkQuery(randomAlphaOfLengthBetween(1, 8), projection, PredicateTests.randomPredicate());
    }

    @Override
    protected ChunkQuery mutateInstance(ChunkQuery instance) {
        return new ChunkQuery(instance.getTable() + "_x", instance.getProjection(), instance.getPredicate());
    }

    @Override
    protected Writeable.Reader<ChunkQuery> instanceReader() {
        return ChunkQuery::new;
    }

    public void testDuplicateProjectionCollapses() {
        ChunkQuery query = new ChunkQuery("cpu", Arrays.asList("temp", "tag", "temp", "time", "tag"), null);

        assertEquals(List.of("temp", "tag", "time"), query.getProjection());
        assertSame(Predicate.MATCH_ALL, query.getPredicate());
    }

    public void testBuilders() {
        ChunkQuery query = ChunkQuery.selectAll("cpu").select("tag", "temp").where(Predicate.and(ColumnPredicate.gt("temp", 1.5)));

        assertEquals("cpu", query.getTable());
        assertEquals(List.of("tag", "temp"), query.getProjection());
        assertEquals("SELECT tag, temp FROM cpu WHERE temp > 1.5", query.toString());
        assertEquals("SELECT * FROM cpu", ChunkQuery.selectAll("cpu").toString());
    }

    public void testTableRequired() {
        expectThrows(IllegalArgumentException.class, () -> ChunkQuery.selectAll(""));
        expectThrows(IllegalArgumentException.class, () -> new ChunkQuery(null, List.of(), Predicate.MATCH_ALL));
    }
}
