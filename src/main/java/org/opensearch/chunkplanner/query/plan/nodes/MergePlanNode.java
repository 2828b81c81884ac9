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
 * K-way merge of inputs that are each ordered by the primary key.
 *
 * <p>Rows with equal keys are emitted newest first: ties are broken by descending recency key and then by input
 * position. Children are ordered newest first as well.</p>
 */
public class MergePlanNode extends PlanNode {

    private final List<String> mergeKeys;

    /**
     * Constructor for MergePlanNode.
     *
     * @param id unique identifier for this node
     * @param mergeKeys the primary key columns
     * @param inputs the ordered inputs, at least two
     */
    public MergePlanNode(int id, List<String> mergeKeys, List<PlanNode> inputs) {
        super(id, inputs);
        if (inputs.size() < 2) {
            throw new IllegalArgumentException("Merge requires at least two inputs but got " + inputs.size());
        }
        if (mergeKeys == null || mergeKeys.isEmpty()) {
            throw new IllegalArgumentException("Merge requires at least one key");
        }
        List<ColumnDefinition> layout = inputs.get(0).getOutputColumns();
        for (PlanNode input : inputs) {
            if (!layout.equals(input.getOutputColumns())) {
                throw new IllegalArgumentException("Merge inputs must share one column layout: " + layout + " vs "
                    + input.getOutputColumns());
            }
        }
        this.mergeKeys = List.copyOf(mergeKeys);
    }

    static MergePlanNode readFrom(StreamInput in, int id) throws IOException {
        List<String> keys = in.readStringList();
        return new MergePlanNode(id, keys, readChildren(in));
    }

    @Override
    protected void writeNodeTo(StreamOutput out) throws IOException {
        out.writeStringCollection(mergeKeys);
    }

    public List<String> getMergeKeys() {
        return mergeKeys;
    }

    @Override
    public List<ColumnDefinition> getOutputColumns() {
        return getChildren().get(0).getOutputColumns();
    }

    @Override
    public PlanNodeType getType() {
        return PlanNodeType.MERGE;
    }

    @Override
    public <T> T accept(PlanVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String getExplainName() {
        return "Merge(keys=" + mergeKeys + ")";
    }

    @Override
    protected void nodeToXContent(XContentBuilder builder, Params params) throws IOException {
        builder.field("keys", mergeKeys);
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && mergeKeys.equals(((MergePlanNode) o).mergeKeys);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), mergeKeys);
    }
}
