/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.query.plan.nodes;

/**
 * Visitor interface for read plan nodes.
 */
public abstract class PlanVisitor<T> {

    /**
     * Process a plan node (default implementation).
     * @param node the node to process
     * @return the result of processing
     */
    public T process(PlanNode node) {
        return node.accept(this);
    }

    /**
     * Visits a scan node.
     * @param node the scan node
     * @return the result of visiting
     */
    public abstract T visit(ScanPlanNode node);

    /**
     * Visits a sort node.
     * @param node the sort node
     * @return the result of visiting
     */
    public abstract T visit(SortPlanNode node);

    /**
     * Visits a merge node.
     * @param node the merge node
     * @return the result of visiting
     */
    public abstract T visit(MergePlanNode node);

    /**
     * Visits a dedup node.
     * @param node the dedup node
     * @return the result of visiting
     */
    public abstract T visit(DedupPlanNode node);

    /**
     * Visits a union node.
     * @param node the union node
     * @return the result of visiting
     */
    public abstract T visit(UnionPlanNode node);

    /**
     * Visits a filter node.
     * @param node the filter node
     * @return the result of visiting
     */
    public abstract T visit(FilterPlanNode node);

    /**
     * Visits a project node.
     * @param node the project node
     * @return the result of visiting
     */
    public abstract T visit(ProjectPlanNode node);
}
