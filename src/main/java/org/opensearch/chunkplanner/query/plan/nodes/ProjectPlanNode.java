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
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Root node that restricts rows to the requested columns, in the requested order.
 */
public class ProjectPlanNode extends PlanNode {

    private final List<String> columns;
    private final List<ColumnDefinition> outputColumns;
    private final int[] inputIndexes;

    /**
     * Constructor for ProjectPlanNode.
     *
     * @param id unique identifier for this node
     * @param columns the output column names
     * @param input the node producing the rows
     */
    public ProjectPlanNode(int id, List<String> columns, PlanNode input) {
        super(id, single("Project", input));
        this.columns = List.copyOf(columns);
        List<ColumnDefinition> layout = input.getOutputColumns();
        List<ColumnDefinition> output = new ArrayList<>(columns.size());
        this.inputIndexes = new int[columns.size()];
        for (int i = 0; i < columns.size(); i++) {
            int index = indexOf(layout, columns.get(i));
            if (index < 0) {
                throw new IllegalArgumentException("Project column [" + columns.get(i) + "] missing from its input " + layout);
            }
            inputIndexes[i] = index;
            output.add(layout.get(index));
        }
        this.outputColumns = List.copyOf(output);
    }

    private static int indexOf(List<ColumnDefinition> layout, String name) {
        for (int i = 0; i < layout.size(); i++) {
            if (layout.get(i).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    static ProjectPlanNode readFrom(StreamInput in, int id) throws IOException {
        List<String> columns = in.readStringList();
        return new ProjectPlanNode(id, columns, readSingleChild(in));
    }

    @Override
    protected void writeNodeTo(StreamOutput out) throws IOException {
        out.writeStringCollection(columns);
    }

    public List<String> getColumns() {
        return columns;
    }

    /**
     * Gets, for each output column, its position in the input rows.
     * @return a copy of the index array
     */
    public int[] getInputIndexes() {
        return inputIndexes.clone();
    }

    @Override
    public List<ColumnDefinition> getOutputColumns() {
        return outputColumns;
    }

    @Override
    public PlanNodeType getType() {
        return PlanNodeType.PROJECT;
    }

    @Override
    public <T> T accept(PlanVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String getExplainName() {
        return "Project(columns=" + columns + ")";
    }

    @Override
    protected void nodeToXContent(XContentBuilder builder, Params params) throws IOException {
        builder.field("columns", columns);
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && columns.equals(((ProjectPlanNode) o).columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), columns);
    }
}
