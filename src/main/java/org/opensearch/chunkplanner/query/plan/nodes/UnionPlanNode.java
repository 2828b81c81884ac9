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
 * Concatenates the rows of independent branches. Branches never share a primary key, so no ordering or
 * deduplication is needed across them. A union without inputs produces no rows.
 */
public class UnionPlanNode extends PlanNode {

    private final List<ColumnDefinition> columns;

    /**
     * Constructor for UnionPlanNode.
     *
     * @param id unique identifier for this node
     * @param columns the working column layout
     * @param inputs the branches, possibly none
     */
    public UnionPlanNode(int id, List<ColumnDefinition> columns, List<PlanNode> inputs) {
        super(id, inputs);
        this.columns = List.copyOf(columns);
        for (PlanNode input : inputs) {
            if (!this.columns.equals(input.getOutputColumns())) {
                throw new IllegalArgumentException("Union input " + input.getExplainName() + " produces "
                    + input.getOutputColumns() + " instead of " + this.columns);
            }
        }
    }

    static UnionPlanNode readFrom(StreamInput in, int id) throws IOException {
        List<ColumnDefinition> columns = in.readList(ColumnDefinition::readFrom);
        return new UnionPlanNode(id, columns, readChildren(in));
    }

    @Override
    protected void writeNodeTo(StreamOutput out) throws IOException {
        out.writeList(columns);
    }

    @Override
    public List<ColumnDefinition> getOutputColumns() {
        return columns;
    }

    @Override
    public PlanNodeType getType() {
        return PlanNodeType.UNION;
    }

    @Override
    public <T> T accept(PlanVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String getExplainName() {
        return "Union(inputs=" + getChildren().size() + ")";
    }

    @Override
    protected void nodeToXContent(XContentBuilder builder, Params params) throws IOException {
        builder.startArray("columns");
        for (ColumnDefinition column : columns) {
            builder.value(column.toString());
        }
        builder.endArray();
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && columns.equals(((UnionPlanNode) o).columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), columns);
    }
}
