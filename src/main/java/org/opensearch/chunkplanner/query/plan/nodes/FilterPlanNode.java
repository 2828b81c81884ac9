/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.query.plan.nodes;

import org.opensearch.chunkplanner.core.model.ColumnDefinition;
import org.opensearch.chunkplanner.core.model.ColumnType;
import org.opensearch.chunkplanner.core.predicate.Predicate;
import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.common.io.stream.StreamOutput;
import org.opensearch.core.xcontent.XContentBuilder;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Drops rows for which the predicate does not hold. Evaluated on deduplicated rows.
 */
public class FilterPlanNode extends PlanNode {

    private final Predicate predicate;

    /**
     * Constructor for FilterPlanNode.
     *
     * @param id unique identifier for this node
     * @param predicate the residual predicate, never empty
     * @param input the node producing the rows
     */
    public FilterPlanNode(int id, Predicate predicate, PlanNode input) {
        super(id, single("Filter", input));
        if (predicate == null || predicate.isEmpty()) {
            throw new IllegalArgumentException("Filter requires a non-empty predicate");
        }
        List<ColumnDefinition> layout = input.getOutputColumns();
        for (String column : predicate.referencedColumns()) {
            if (layout.stream().noneMatch(c -> c.name().equals(column))) {
                throw new IllegalArgumentException("Filter references column [" + column + "] missing from its input");
            }
        }
        this.predicate = predicate;
    }

    static FilterPlanNode readFrom(StreamInput in, int id) throws IOException {
        Predicate predicate = new Predicate(in);
        return new FilterPlanNode(id, predicate, readSingleChild(in));
    }

    @Override
    protected void writeNodeTo(StreamOutput out) throws IOException {
        predicate.writeTo(out);
    }

    public Predicate getPredicate() {
        return predicate;
    }

    @Override
    public List<ColumnDefinition> getOutputColumns() {
        return getInput().getOutputColumns();
    }

    @Override
    public PlanNodeType getType() {
        return PlanNodeType.FILTER;
    }

    @Override
    public <T> T accept(PlanVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String getExplainName() {
        return "Filter(" + predicate.toString(this::typeOf) + ")";
    }

    private ColumnType typeOf(String column) {
        for (ColumnDefinition definition : getOutputColumns()) {
            if (definition.name().equals(column)) {
                return definition.type();
            }
        }
        return null;
    }

    @Override
    protected void nodeToXContent(XContentBuilder builder, Params params) throws IOException {
        builder.field("predicate", predicate.toString(this::typeOf));
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && predicate.equals(((FilterPlanNode) o).predicate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), predicate);
    }
}
