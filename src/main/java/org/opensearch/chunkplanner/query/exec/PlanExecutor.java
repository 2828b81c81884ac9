/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.query.exec;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.chunkplanner.core.chunk.DedupIterator;
import org.opensearch.chunkplanner.core.chunk.MergeIterator;
import org.opensearch.chunkplanner.core.chunk.RowComparator;
import org.opensearch.chunkplanner.core.chunk.RowIterator;
import org.opensearch.chunkplanner.query.plan.nodes.DedupPlanNode;
import org.opensearch.chunkplanner.query.plan.nodes.FilterPlanNode;
import org.opensearch.chunkplanner.query.plan.nodes.MergePlanNode;
import org.opensearch.chunkplanner.query.plan.nodes.PlanNode;
import org.opensearch.chunkplanner.query.plan.nodes.PlanVisitor;
import org.opensearch.chunkplanner.query.plan.nodes.ProjectPlanNode;
import org.opensearch.chunkplanner.query.plan.nodes.ScanPlanNode;
import org.opensearch.chunkplanner.query.plan.nodes.SortPlanNode;
import org.opensearch.chunkplanner.query.plan.nodes.UnionPlanNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Sequential reference executor: turns a plan into a tree of {@link RowIterator}s pulling from a
 * {@link ChunkDataSource}.
 */
public class PlanExecutor extends PlanVisitor<RowIterator> {

    private static final Logger logger = LogManager.getLogger(PlanExecutor.class);

    private final ChunkDataSource dataSource;

    /**
     * Constructor for PlanExecutor.
     * @param dataSource the storage to read chunks from
     */
    public PlanExecutor(ChunkDataSource dataSource) {
        if (dataSource == null) {
            throw new IllegalArgumentException("Data source cannot be null");
        }
        this.dataSource = dataSource;
    }

    /**
     * Executes a plan.
     *
     * @param plan the root of the plan
     * @param dataSource the storage to read chunks from
     * @return an iterator over the result rows
     */
    public static RowIterator execute(PlanNode plan, ChunkDataSource dataSource) {
        return new PlanExecutor(dataSource).process(plan);
    }

    @Override
    public RowIterator visit(ScanPlanNode node) {
        logger.trace("Opening {}", node.getExplainName());
        return new ScanIterator(node, dataSource);
    }

    @Override
    public RowIterator visit(SortPlanNode node) {
        RowComparator comparator = RowComparator.forKeys(node.getOutputColumns(), node.getSortKeys());
        return new SortIterator(process(node.getInput()), comparator);
    }

    @Override
    public RowIterator visit(MergePlanNode node) {
        List<RowIterator> inputs = new ArrayList<>(node.getChildren().size());
        for (PlanNode child : node.getChildren()) {
            inputs.add(process(child));
        }
        return new MergeIterator(inputs, RowComparator.forKeys(node.getOutputColumns(), node.getMergeKeys()));
    }

    @Override
    public RowIterator visit(DedupPlanNode node) {
        RowComparator comparator = RowComparator.forKeys(node.getOutputColumns(), node.getPrimaryKey());
        return new DedupIterator(process(node.getInput()), comparator);
    }

    @Override
    public RowIterator visit(UnionPlanNode node) {
        List<RowIterator> inputs = new ArrayList<>(node.getChildren().size());
        for (PlanNode child : node.getChildren()) {
            inputs.add(process(child));
        }
        return new UnionIterator(inputs);
    }

    @Override
    public RowIterator visit(FilterPlanNode node) {
        return new FilterIterator(process(node.getInput()), node.getPredicate(), node.getInput().getOutputColumns());
    }

    @Override
    public RowIterator visit(ProjectPlanNode node) {
        return new ProjectIterator(process(node.getInput()), node.getInputIndexes());
    }
}
