/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.query.overlap;

import org.opensearch.chunkplanner.core.model.ChunkMetadata;
import org.opensearch.test.OpenSearchTestCase;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Unit tests for OverlapGrouper.
 */
public class OverlapGrouperTests extends OpenSearchTestCase {

    private final OverlapGrouper grouper = new OverlapGrouper();

    private static ChunkMetadata chunk(String id, long minTime, long maxTime) {
        return ChunkMetadata.builder(id).timeRange(minTime, maxTime).build();
    }

    private static List<List<String>> ids(List<OverlapGroup> groups) {
        List<List<String>> result = new ArrayList<>();
        for (OverlapGroup group : groups) {
            List<String> members = new ArrayList<>();
            group.getMembers().forEach(c -> members.add(c.getId()));
            result.add(members);
        }
        return result;
    }

    public void testEmptyInput() {
        assertTrue(grouper.group(List.of()).isEmpty());
    }

    public void testSingleChunkIsTrivial() {
        List<OverlapGroup> groups = grouper.group(List.of(chunk("C1", 0, 10)));

        assertEquals(1, groups.size());
        assertTrue(groups.get(0).isTrivial());
    }

    public void testOverlappingAndDisjoint() {
        List<OverlapGroup> groups = grouper.group(List.of(chunk("C3", 200, 300), chunk("C2", 50, 150), chunk("C1", 0, 100)));

        assertEquals(List.of(List.of("C1", "C2"), List.of("C3")), ids(groups));
        assertFalse(groups.get(0).isTrivial());
        assertTrue(groups.get(1).isTrivial());
        assertEquals(0, groups.get(0).getMinTime());
        assertEquals(150, groups.get(0).getMaxTime());
        assertEquals("Group[C1,C2, time=[0,150]]", groups.get(0).toString());
    }

    public void testTouchingBoundsOverlap() {
        List<OverlapGroup> groups = grouper.group(List.of(chunk("C1", 0, 100), chunk("C2", 100, 200), chunk("C3", 201, 300)));

        assertEquals(List.of(List.of("C1", "C2"), List.of("C3")), ids(groups));
    }

    public void testIdenticalBoundsGroupedTogether() {
        List<OverlapGroup> groups = grouper.group(List.of(chunk("B", 5, 5), chunk("A", 5, 5)));

        assertEquals(List.of(List.of("A", "B")), ids(groups));
    }

    public void testContainmentIsTransitive() {
        // C1 covers everything; C2..C4 are pairwise disjoint but all lie inside C1
        List<OverlapGroup> groups = grouper.group(
            List.of(chunk("C1", 0, 1000), chunk("C2", 10, 20), chunk("C3", 400, 410), chunk("C4", 900, 910), chunk("C5", 1001, 1002))
        );

        assertEquals(List.of(List.of("C1", "C2", "C3", "C4"), List.of("C5")), ids(groups));
    }

    public void testChainedOverlaps() {
        List<OverlapGroup> groups = grouper.group(List.of(chunk("C1", 0, 10), chunk("C2", 5, 20), chunk("C3", 15, 30), chunk("C4", 31, 40)));

        assertEquals(List.of(List.of("C1", "C2", "C3"), List.of("C4")), ids(groups));
    }

    public void testInputNotModified() {
        List<ChunkMetadata> chunks = new ArrayList<>(List.of(chunk("C2", 50, 60), chunk("C1", 0, 10)));
        grouper.group(chunks);
        assertEquals("C2", chunks.get(0).getId());
    }

    /**
     * Every chunk lands in exactly one group, chunks of different groups never overlap, and groups are connected.
     */
    public void testRandomGroupingIsClosed() {
        for (int iteration = 0; iteration < 50; iteration++) {
            List<ChunkMetadata> chunks = new ArrayList<>();
            int count = randomIntBetween(1, 40);
            for (int i = 0; i < count; i++) {
                long min = randomLongBetween(0, 1000);
                chunks.add(chunk("C" + i, min, min + randomLongBetween(0, 100)));
            }

            List<OverlapGroup> groups = grouper.group(chunks);

            Map<String, Integer> groupOf = new HashMap<>();
            for (int g = 0; g < groups.size(); g++) {
                for (ChunkMetadata member : groups.get(g).getMembers()) {
                    assertNull("chunk in two groups", groupOf.put(member.getId(), g));
                }
                if (g > 0) {
                    assertTrue(groups.get(g - 1).getMaxTime() < groups.get(g).getMinTime());
                }
                assertConnected(groups.get(g));
            }
            assertEquals(chunks.size(), groupOf.size());

            for (ChunkMetadata a : chunks) {
                for (ChunkMetadata b : chunks) {
                    if (a.overlaps(b.getMinTime(), b.getMaxTime())) {
                        assertEquals(groupOf.get(a.getId()), groupOf.get(b.getId()));
                    }
                }
            }
        }
    }

    private static void assertConnected(OverlapGroup group) {
        List<ChunkMetadata> members = group.getMembers();
        boolean[] reached = new boolean[members.size()];
        reached[0] = true;
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int i = 0; i < members.size(); i++) {
                if (reached[i]) {
                    continue;
                }
                for (int j = 0; j < members.size(); j++) {
                    if (reached[j] && members.get(i).overlaps(members.get(j).getMinTime(), members.get(j).getMaxTime())) {
                        reached[i] = true;
                        changed = true;
                        break;
                    }
                }
            }
        }
        for (boolean r : reached) {
            assertTrue("group " + group + " is not connected", r);
        }
    }
}
