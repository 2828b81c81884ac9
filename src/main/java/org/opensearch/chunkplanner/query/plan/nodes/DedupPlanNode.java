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
 * Collapses each run of rows sharing a primary key into one row.
 *
 * <p>The input must be a {@link MergePlanNode}, which delivers each run newest first. Every non-key column of the
 * output row takes the first non-null value of the run.</p>
 */
public class DedupPlanNode extends PlanNode {

    private final List<String> primaryKey;

    /**
     * Constructor for DedupPlanNode.
     *
     * @param id unique identifier for this node
     * @param primaryKey the key columns
     * @param input the merge producing the rows
     */
    public DedupPlanNode(int id, List<String> primaryKey, PlanNode input) {
        super(id, single("Dedup", input));
        if (!(input instanceof MergePlanNode)) {
            throw new IllegalArgumentException("Dedup input must be a Merge but was " + input.getExplainName());
        }
        if (primaryKey == null || primaryKey.isEmpty()) {
            throw new IllegalArgumentException("Dedup requires a primary key");
        }
        this.primaryKey = List.copyOf(primaryKey);
    }

    static DedupPlanNode readFrom(StreamInput in, int id) throws IOException {
        List<String> keys = in.readStringList();
        return new DedupPlanNode(id, keys, readSingleChild(in));
    }

    @Override
    protected void writeNodeTo(StreamOutput out) throws IOException {
        out.writeStringCollection(primaryKey);
    }

    public List<String> getPrimaryKey() {
        return primaryKey;
    }

    @Override
    public List<ColumnDefinition> getOutputColumns() {
        return getInput().getOutputColumns();
    }

    @Override
    public PlanNodeType getType() {
        return PlanNodeType.DEDUP;
    }

    @Override
    public <T> T accept(PlanVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String getExplainName() {
        return "Dedup(keys=" + primaryKey + ")";
    }

    @Override
    protected void nodeToXContent(XContentBuilder builder, Params params) throws IOException {
        builder.field("keys", primaryKey);
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && primaryKey.equals(((DedupPlanNode) o).primaryKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), primaryKey);
    }
}
