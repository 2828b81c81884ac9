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
import org.opensearch.core.common.io.stream.Writeable;
import org.opensearch.core.xcontent.ToXContentObject;
import org.opensearch.core.xcontent.XContentBuilder;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Abstract class representing a node of a chunk read plan.
 *
 * <p>A plan is a tree whose root produces the query result. Nodes are immutable once built and are consumed once by
 * the execution engine. Every node reports the columns of the rows it produces; all nodes below the final
 * {@link ProjectPlanNode} share the same working column layout.</p>
 *
 * <p>Plans are {@link Writeable} so they can be shipped to the node that executes them, and
 * {@link ToXContentObject} for explain output.</p>
 */
public abstract class PlanNode implements Writeable, ToXContentObject {

    /**
     * Unique identifier for this plan node within its plan.
     */
    private final int id;

    /**
     * List of child plan nodes.
     */
    private final List<PlanNode> children;

    /**
     * Constructor for PlanNode.
     * @param id unique identifier for this node
     * @param children the input nodes
     */
    protected PlanNode(int id, List<PlanNode> children) {
        if (children == null) {
            throw new IllegalArgumentException("Children cannot be null");
        }
        this.id = id;
        this.children = List.copyOf(children);
    }

    /**
     * Gets the unique identifier of this plan node.
     * @return the plan node ID
     */
    public int getId() {
        return id;
    }

    /**
     * Gets the list of child plan nodes.
     * @return the immutable list of children
     */
    public List<PlanNode> getChildren() {
        return children;
    }

    /**
     * Gets the columns of the rows this node produces, in row order.
     * @return the output columns
     */
    public abstract List<ColumnDefinition> getOutputColumns();

    /**
     * Gets the node type tag used on the wire.
     * @return the node type
     */
    public abstract PlanNodeType getType();

    /**
     * Accepts a visitor to perform operations on this node.
     * @param visitor the visitor to accept
     * @return the result of the visitor's operation
     * @param <T> the return type of the visitor's operation
     */
    public abstract <T> T accept(PlanVisitor<T> visitor);

    /**
     * Gets a human-readable description of this node for explain output.
     * @return a descriptive name for this node
     */
    public abstract String getExplainName();

    /**
     * Write node specific fields; children are written by {@link #writeTo(StreamOutput)}.
     * @param out the output stream
     * @throws IOException if writing fails
     */
    protected abstract void writeNodeTo(StreamOutput out) throws IOException;

    /**
     * Add node specific fields to the explain document.
     * @param builder the builder
     * @param params serialization parameters
     * @throws IOException if writing fails
     */
    protected abstract void nodeToXContent(XContentBuilder builder, Params params) throws IOException;

    @Override
    public final void writeTo(StreamOutput out) throws IOException {
        out.writeEnum(getType());
        out.writeVInt(id);
        writeNodeTo(out);
        out.writeVInt(children.size());
        for (PlanNode child : children) {
            child.writeTo(out);
        }
    }

    /**
     * Reads a plan tree written by {@link #writeTo(StreamOutput)}.
     *
     * @param in the input stream
     * @return the root node of the tree
     * @throws IOException if reading fails
     */
    public static PlanNode readPlanNode(StreamInput in) throws IOException {
        PlanNodeType type = in.readEnum(PlanNodeType.class);
        int id = in.readVInt();
        return switch (type) {
            case SCAN -> ScanPlanNode.readFrom(in, id);
            case SORT -> SortPlanNode.readFrom(in, id);
            case MERGE -> MergePlanNode.readFrom(in, id);
            case DEDUP -> DedupPlanNode.readFrom(in, id);
            case UNION -> UnionPlanNode.readFrom(in, id);
            case FILTER -> FilterPlanNode.readFrom(in, id);
            case PROJECT -> ProjectPlanNode.readFrom(in, id);
        };
    }

    /**
     * Reads the children that follow the node specific fields.
     * @param in the input stream
     * @return the children
     * @throws IOException if reading fails
     */
    protected static List<PlanNode> readChildren(StreamInput in) throws IOException {
        int size = in.readVInt();
        List<PlanNode> children = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            children.add(readPlanNode(in));
        }
        return children;
    }

    /**
     * Reads exactly one child.
     * @param in the input stream
     * @return the child
     * @throws IOException if reading fails or the node does not have one child
     */
    protected static PlanNode readSingleChild(StreamInput in) throws IOException {
        List<PlanNode> children = readChildren(in);
        if (children.size() != 1) {
            throw new IOException("Expected exactly one child but found " + children.size());
        }
        return children.get(0);
    }

    @Override
    public final XContentBuilder toXContent(XContentBuilder builder, Params params) throws IOException {
        builder.startObject();
        builder.field("id", id);
        builder.field("type", getType().getName());
        nodeToXContent(builder, params);
        if (!children.isEmpty()) {
            builder.startArray("children");
            for (PlanNode child : children) {
                child.toXContent(builder, params);
            }
            builder.endArray();
        }
        return builder.endObject();
    }

    /**
     * Requires the node to have exactly one input.
     * @param name node name for the error message
     * @param child the input
     * @return a single element child list
     */
    protected static List<PlanNode> single(String name, PlanNode child) {
        if (child == null) {
            throw new IllegalArgumentException(name + " requires an input node");
        }
        return List.of(child);
    }

    /**
     * Gets the only child of a unary node.
     * @return the input node
     */
    public PlanNode getInput() {
        if (children.size() != 1) {
            throw new IllegalStateException(getExplainName() + " has " + children.size() + " inputs");
        }
        return children.get(0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PlanNode that = (PlanNode) o;
        return id == that.id && children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return 31 * id + children.hashCode();
    }

    @Override
    public String toString() {
        return getExplainName();
    }
}
