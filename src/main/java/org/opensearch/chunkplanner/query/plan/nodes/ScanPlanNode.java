/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.query.plan.nodes;

import org.opensearch.chunkplanner.core.model.ChunkMetadata;
import org.opensearch.chunkplanner.core.model.ColumnDefinition;
import org.opensearch.chunkplanner.core.model.Tombstone;
import org.opensearch.chunkplanner.core.predicate.Predicate;
import org.opensearch.chunkplanner.query.schema.ColumnMapping;
import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.common.io.stream.StreamOutput;
import org.opensearch.core.xcontent.XContentBuilder;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Leaf node that reads one chunk.
 *
 * <p>The scan emits rows in the working column layout. Columns the chunk does not store have
 * {@link ColumnMapping#ABSENT} as local index and are filled with nulls. The pushed predicate is evaluated against
 * chunk-local values and tombstones that apply to the chunk remove rows before anything else sees them.</p>
 */
public class ScanPlanNode extends PlanNode {

    private final ChunkMetadata chunk;
    private final List<ColumnDefinition> columns;
    private final int[] localIndexes;
    private final Predicate pushedPredicate;
    private final String timeColumn;
    private final List<Tombstone> tombstones;

    /**
     * Constructor for ScanPlanNode.
     *
     * @param id unique identifier for this node
     * @param chunk the chunk to read
     * @param columns the output columns
     * @param localIndexes chunk-local index per output column, or {@link ColumnMapping#ABSENT}
     * @param pushedPredicate clauses evaluated while reading
     * @param timeColumn the timestamp column tombstone ranges refer to
     * @param tombstones deletes to apply to this chunk
     */
    public ScanPlanNode(
        int id,
        ChunkMetadata chunk,
        List<ColumnDefinition> columns,
        int[] localIndexes,
        Predicate pushedPredicate,
        String timeColumn,
        List<Tombstone> tombstones
    ) {
        super(id, List.of());
        if (chunk == null) {
            throw new IllegalArgumentException("Scan requires a chunk");
        }
        if (columns.size() != localIndexes.length) {
            throw new IllegalArgumentException("Scan of chunk [" + chunk.getId() + "] has " + columns.size() + " columns but "
                + localIndexes.length + " local indexes");
        }
        this.chunk = chunk;
        this.columns = List.copyOf(columns);
        this.localIndexes = localIndexes.clone();
        this.pushedPredicate = Objects.requireNonNull(pushedPredicate);
        this.timeColumn = Objects.requireNonNull(timeColumn);
        this.tombstones = List.copyOf(tombstones);
    }

    static ScanPlanNode readFrom(StreamInput in, int id) throws IOException {
        ChunkMetadata chunk = new ChunkMetadata(in);
        List<ColumnDefinition> columns = in.readList(ColumnDefinition::readFrom);
        int[] localIndexes = in.readIntArray();
        Predicate pushed = new Predicate(in);
        String timeColumn = in.readString();
        List<Tombstone> tombstones = in.readList(Tombstone::new);
        readChildren(in);
        return new ScanPlanNode(id, chunk, columns, localIndexes, pushed, timeColumn, tombstones);
    }

    @Override
    protected void writeNodeTo(StreamOutput out) throws IOException {
        chunk.writeTo(out);
        out.writeList(columns);
        out.writeIntArray(localIndexes);
        pushedPredicate.writeTo(out);
        out.writeString(timeColumn);
        out.writeList(tombstones);
    }

    public ChunkMetadata getChunk() {
        return chunk;
    }

    public String getChunkId() {
        return chunk.getId();
    }

    @Override
    public List<ColumnDefinition> getOutputColumns() {
        return columns;
    }

    /**
     * Gets the chunk-local index of each output column.
     * @return a copy of the index array
     */
    public int[] getLocalIndexes() {
        return localIndexes.clone();
    }

    public Predicate getPushedPredicate() {
        return pushedPredicate;
    }

    public String getTimeColumn() {
        return timeColumn;
    }

    public List<Tombstone> getTombstones() {
        return tombstones;
    }

    /**
     * Gets the output columns the chunk does not store.
     * @return names of the columns read as nulls
     */
    public List<String> getSynthesizedColumns() {
        List<String> absent = new ArrayList<>();
        for (int i = 0; i < localIndexes.length; i++) {
            if (localIndexes[i] == ColumnMapping.ABSENT) {
                absent.add(columns.get(i).name());
            }
        }
        return absent;
    }

    @Override
    public PlanNodeType getType() {
        return PlanNodeType.SCAN;
    }

    @Override
    public <T> T accept(PlanVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String getExplainName() {
        StringBuilder sb = new StringBuilder("Scan(chunk=").append(chunk.getId());
        List<String> names = new ArrayList<>(columns.size());
        for (ColumnDefinition column : columns) {
            names.add(column.name());
        }
        sb.append(", columns=").append(names);
        List<String> absent = getSynthesizedColumns();
        if (!absent.isEmpty()) {
            sb.append(", nulls=").append(absent);
        }
        if (!pushedPredicate.isEmpty()) {
            sb.append(", predicate=[").append(pushedPredicate.toString(chunk::typeOf)).append(']');
        }
        if (!tombstones.isEmpty()) {
            sb.append(", tombstones=").append(tombstones.size());
        }
        return sb.append(')').toString();
    }

    @Override
    protected void nodeToXContent(XContentBuilder builder, Params params) throws IOException {
        builder.field("chunk", chunk.getId());
        builder.field("recency_key", chunk.getRecencyKey());
        builder.field("min_time", chunk.getMinTime());
        builder.field("max_time", chunk.getMaxTime());
        builder.startArray("columns");
        for (int i = 0; i < columns.size(); i++) {
            builder.startObject();
            builder.field("name", columns.get(i).name());
            builder.field("type", columns.get(i).type().getTypeName());
            builder.field("local_index", localIndexes[i]);
            builder.endObject();
        }
        builder.endArray();
        if (!pushedPredicate.isEmpty()) {
            builder.field("predicate", pushedPredicate.toString(chunk::typeOf));
        }
        if (!tombstones.isEmpty()) {
            builder.startArray("tombstones");
            for (Tombstone tombstone : tombstones) {
                builder.value(tombstone.getId());
            }
            builder.endArray();
        }
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        ScanPlanNode that = (ScanPlanNode) o;
        return chunk.equals(that.chunk)
            && columns.equals(that.columns)
            && Arrays.equals(localIndexes, that.localIndexes)
            && pushedPredicate.equals(that.pushedPredicate)
            && timeColumn.equals(that.timeColumn)
            && tombstones.equals(that.tombstones);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), chunk, columns, Arrays.hashCode(localIndexes), pushedPredicate, timeColumn, tombstones);
    }
}
