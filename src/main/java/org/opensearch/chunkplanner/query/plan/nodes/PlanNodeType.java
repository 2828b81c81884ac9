/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.query.plan.nodes;

/**
 * Kinds of plan nodes.
 */
public enum PlanNodeType {
    /** Read one chunk. */
    SCAN("scan"),
    /** Sort rows by the primary key. */
    SORT("sort"),
    /** K-way merge of key ordered inputs. */
    MERGE("merge"),
    /** Collapse rows sharing a primary key. */
    DEDUP("dedup"),
    /** Concatenate independent inputs. */
    UNION("union"),
    /** Drop rows failing a predicate. */
    FILTER("filter"),
    /** Restrict and reorder columns. */
    PROJECT("project");

    private final String name;

    PlanNodeType(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
