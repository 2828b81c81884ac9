/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.query.plan.nodes;

import org.opensearch.chunkplanner.core.model.ColumnDefinition;
import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.common.io.stream.StreamOutput;
import org.opensearch.core.xcontent.XContentBuilder;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Sorts the rows of a chunk that is not stored in primary key order, so it can feed a merge.
 */
public class SortPlanNode extends PlanNode {

    private final List<String> sortKeys;

    /**
     * Constructor for SortPlanNode.
     *
     * @param id unique identifier for this node
     * @param sortKeys the columns to sort by, ascending with nulls last
     * @param input the node producing the rows
     */
    public SortPlanNode(int id, List<String> sortKeys, PlanNode input) {
        super(id, single("Sort", input));
        if (sortKeys == null || sortKeys.isEmpty()) {
            throw new IllegalArgumentException("Sort requires at least one key");
        }
        this.sortKeys = List.copyOf(sortKeys);
    }

    static SortPlanNode readFrom(StreamInput in, int id) throws IOException {
        List<String> keys = in.readStringList();
        return new SortPlanNode(id, keys, readSingleChild(in));
    }

    @Override
    protected void writeNodeTo(StreamOutput out) throws IOException {
        out.writeStringCollection(sortKeys);
    }

    public List<String> getSortKeys() {
        return sortKeys;
    }

    @Override
    public List<ColumnDefinition> getOutputColumns() {
        return getInput().getOutputColumns();
    }

    @Override
    public PlanNodeType getType() {
        return PlanNodeType.SORT;
    }

    @Override
    public <T> T accept(PlanVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String getExplainName() {
        return "Sort(keys=" + sortKeys + ")";
    }

    @Override
    protected void nodeToXContent(XContentBuilder builder, Params params) throws IOException {
        builder.field("keys", sortKeys);
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && sortKeys.equals(((SortPlanNode) o).sortKeys);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), sortKeys);
    }
}
