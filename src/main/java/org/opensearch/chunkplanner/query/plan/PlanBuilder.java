/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.query.plan;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.chunkplanner.core.catalog.CatalogSnapshot;
import org.opensearch.chunkplanner.core.model.ChunkMetadata;
import org.opensearch.chunkplanner.core.model.ColumnDefinition;
import org.opensearch.chunkplanner.core.model.Tombstone;
import org.opensearch.chunkplanner.core.predicate.ColumnPredicate;
import org.opensearch.chunkplanner.core.predicate.Predicate;
import org.opensearch.chunkplanner.query.errors.TooManyChunksException;
import org.opensearch.chunkplanner.query.errors.UnknownColumnException;
import org.opensearch.chunkplanner.query.overlap.OverlapGroup;
import org.opensearch.chunkplanner.query.overlap.OverlapGrouper;
import org.opensearch.chunkplanner.query.plan.nodes.DedupPlanNode;
import org.opensearch.chunkplanner.query.plan.nodes.FilterPlanNode;
import org.opensearch.chunkplanner.query.plan.nodes.MergePlanNode;
import org.opensearch.chunkplanner.query.plan.nodes.PlanNode;
import org.opensearch.chunkplanner.query.plan.nodes.ProjectPlanNode;
import org.opensearch.chunkplanner.query.plan.nodes.ScanPlanNode;
import org.opensearch.chunkplanner.query.plan.nodes.SortPlanNode;
import org.opensearch.chunkplanner.query.plan.nodes.UnionPlanNode;
import org.opensearch.chunkplanner.query.predicate.ChunkPruner;
import org.opensearch.chunkplanner.query.predicate.PredicateValidator;
import org.opensearch.chunkplanner.query.predicate.TimeRange;
import org.opensearch.chunkplanner.query.schema.ColumnMapping;
import org.opensearch.chunkplanner.query.schema.LogicalSchema;
import org.opensearch.chunkplanner.query.schema.SchemaReconciler;
import org.opensearch.chunkplanner.query.schema.SchemaReconciler.ReconciledSchema;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the read plan of a query over a catalog snapshot.
 *
 * <p>The plan has the shape {@code Project(Filter?(Union(branch...)))} where each branch is either a bare
 * {@link ScanPlanNode} for a chunk that overlaps no other chunk, or {@code Dedup(Merge(Sort?(Scan)...))} for a group of
 * time-overlapping chunks. Every node below the project produces rows in the same working column layout.</p>
 *
 * <p>Building is pure: it reads only the snapshot, and node ids come from a counter local to one call, so the same
 * inputs always produce an equal plan and concurrent calls do not interfere.</p>
 */
public class PlanBuilder {

    private static final Logger logger = LogManager.getLogger(PlanBuilder.class);

    /** Merge input order: newest chunk first, chunk id for equal recency. */
    static final Comparator<ChunkMetadata> RECENCY_ORDER = Comparator.comparingLong(ChunkMetadata::getRecencyKey)
        .reversed()
        .thenComparing(ChunkMetadata::getId);

    private final PlannerConfig config;
    private final SchemaReconciler reconciler;
    private final OverlapGrouper grouper;

    /**
     * Constructor for PlanBuilder.
     * @param config planner options
     */
    public PlanBuilder(PlannerConfig config) {
        this(config, new SchemaReconciler(), new OverlapGrouper());
    }

    PlanBuilder(PlannerConfig config, SchemaReconciler reconciler, OverlapGrouper grouper) {
        if (config == null) {
            throw new IllegalArgumentException("Planner config cannot be null");
        }
        this.config = config;
        this.reconciler = reconciler;
        this.grouper = grouper;
    }

    /**
     * Builds the plan of a query.
     *
     * @param snapshot the table state to plan over
     * @param query the query; its table must be the snapshot's table
     * @return the root of the plan, always a {@link ProjectPlanNode}
     */
    public PlanNode build(CatalogSnapshot snapshot, ChunkQuery query) {
        if (!snapshot.getTable().equals(query.getTable())) {
            throw new IllegalArgumentException("Query on table [" + query.getTable() + "] cannot be planned over a snapshot of ["
                + snapshot.getTable() + "]");
        }
        String table = query.getTable();
        List<ChunkMetadata> chunks = snapshot.getChunks();

        ReconciledSchema reconciled = reconciler.reconcile(table, chunks, snapshot.getPrimaryKey(), snapshot.getTableSchema());
        LogicalSchema schema = reconciled.schema();
        ColumnMapping mapping = reconciled.mapping();

        List<String> outputColumns = resolveProjection(table, query.getProjection(), schema);
        Predicate predicate = query.getPredicate();
        PredicateValidator.validate(table, predicate, schema);
        // delete predicates run inside scans and must fit the schema like the query predicate
        for (Tombstone tombstone : snapshot.getTombstones()) {
            PredicateValidator.validate(table, tombstone.getDeletePredicate(), schema);
        }

        if (config.timePruningEnabled()) {
            chunks = ChunkPruner.pruneByTime(chunks, TimeRange.of(predicate, schema.getTimeColumn()));
        }
        if (chunks.size() > config.maxChunksPerQuery()) {
            throw new TooManyChunksException(table, chunks.size(), config.maxChunksPerQuery());
        }

        List<OverlapGroup> groups = grouper.group(chunks);
        if (config.absentColumnPruningEnabled()) {
            groups = ChunkPruner.pruneGroupsMissingColumns(groups, predicate, mapping);
        }

        boolean deduplicates = groups.stream().anyMatch(g -> !g.isTrivial());
        Map<String, Predicate> pushed = new HashMap<>();
        for (OverlapGroup group : groups) {
            for (ChunkMetadata member : group.getMembers()) {
                pushed.put(member.getId(), pushedClauses(predicate, member, group, schema, mapping));
            }
        }
        Predicate residual = residualClauses(predicate, pushed.values());

        Set<String> working = new LinkedHashSet<>(outputColumns);
        if (deduplicates) {
            working.addAll(schema.getPrimaryKey());
        }
        working.addAll(residual.referencedColumns());
        List<String> workingNames = schema.inLogicalOrder(working);
        List<ColumnDefinition> workingColumns = new ArrayList<>(workingNames.size());
        for (String name : workingNames) {
            workingColumns.add(new ColumnDefinition(name, schema.typeOf(name)));
        }

        NodeIds ids = new NodeIds();
        List<PlanNode> branches = new ArrayList<>(groups.size());
        for (OverlapGroup group : groups) {
            if (group.isTrivial()) {
                ChunkMetadata chunk = group.getMembers().get(0);
                branches.add(scan(ids, chunk, workingColumns, workingNames, pushed.get(chunk.getId()), snapshot, mapping));
                continue;
            }
            List<ChunkMetadata> members = new ArrayList<>(group.getMembers());
            members.sort(RECENCY_ORDER);
            List<PlanNode> inputs = new ArrayList<>(members.size());
            for (ChunkMetadata member : members) {
                PlanNode input = scan(ids, member, workingColumns, workingNames, pushed.get(member.getId()), snapshot, mapping);
                if (!member.isSortedByPrimaryKey()) {
                    input = new SortPlanNode(ids.next(), schema.getPrimaryKey(), input);
                }
                inputs.add(input);
            }
            MergePlanNode merge = new MergePlanNode(ids.next(), schema.getPrimaryKey(), inputs);
            branches.add(new DedupPlanNode(ids.next(), schema.getPrimaryKey(), merge));
        }

        PlanNode root = new UnionPlanNode(ids.next(), workingColumns, branches);
        if (!residual.isEmpty()) {
            root = new FilterPlanNode(ids.next(), residual, root);
        }
        root = new ProjectPlanNode(ids.next(), outputColumns, root);

        logger.debug(
            "Planned [{}]: {} chunks in {} groups, working columns {}, residual [{}]",
            query,
            pushed.size(),
            groups.size(),
            workingNames,
            residual
        );
        return root;
    }

    private static List<String> resolveProjection(String table, List<String> projection, LogicalSchema schema) {
        if (projection.isEmpty()) {
            return schema.getColumnNames();
        }
        for (String column : projection) {
            if (!schema.contains(column)) {
                throw new UnknownColumnException(table, column);
            }
        }
        return projection;
    }

    /**
     * Selects the clauses a scan of {@code chunk} evaluates. Clauses are evaluated on chunk-local values, so a clause
     * over a column the chunk does not store is pushed only if it is null-aware. Below a dedup only primary key
     * clauses are pushed: rows sharing a key agree on them, while dropping a row on a value column would let an older
     * value win the column fill.
     */
    private Predicate pushedClauses(Predicate predicate, ChunkMetadata chunk, OverlapGroup group, LogicalSchema schema,
        ColumnMapping mapping) {
        if (!config.pushdownEnabled() || predicate.isEmpty()) {
            return Predicate.MATCH_ALL;
        }
        List<ColumnPredicate> clauses = new ArrayList<>();
        for (ColumnPredicate clause : predicate.getClauses()) {
            if (!group.isTrivial() && !schema.isPrimaryKey(clause.getColumn())) {
                continue;
            }
            if (clause.isNullAware() || mapping.isPresent(chunk.getId(), clause.getColumn())) {
                clauses.add(clause);
            }
        }
        return clauses.size() == predicate.getClauses().size() ? predicate : new Predicate(clauses);
    }

    /**
     * Gets the clauses some scan did not evaluate; they are applied once above the union.
     */
    private static Predicate residualClauses(Predicate predicate, Collection<Predicate> pushed) {
        List<ColumnPredicate> residual = new ArrayList<>();
        for (ColumnPredicate clause : predicate.getClauses()) {
            for (Predicate scanPredicate : pushed) {
                if (!scanPredicate.getClauses().contains(clause)) {
                    residual.add(clause);
                    break;
                }
            }
        }
        return residual.isEmpty() ? Predicate.MATCH_ALL : new Predicate(residual);
    }

    private static ScanPlanNode scan(
        NodeIds ids,
        ChunkMetadata chunk,
        List<ColumnDefinition> workingColumns,
        List<String> workingNames,
        Predicate pushed,
        CatalogSnapshot snapshot,
        ColumnMapping mapping
    ) {
        List<Tombstone> tombstones = new ArrayList<>();
        for (Tombstone tombstone : snapshot.getTombstones()) {
            if (tombstone.appliesTo(chunk)) {
                tombstones.add(tombstone);
            }
        }
        return new ScanPlanNode(
            ids.next(),
            chunk,
            workingColumns,
            mapping.localIndexes(chunk.getId(), workingNames),
            pushed,
            mapping.getSchema().getTimeColumn(),
            tombstones
        );
    }

    /** Node id source of one planning call. */
    private static final class NodeIds {
        private int next;

        int next() {
            return next++;
        }
    }
}
