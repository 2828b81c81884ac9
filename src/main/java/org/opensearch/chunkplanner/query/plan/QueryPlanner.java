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
import org.opensearch.chunkplanner.ChunkPlannerPlugin;
import org.opensearch.chunkplanner.core.catalog.CatalogSnapshot;
import org.opensearch.chunkplanner.core.catalog.ChunkCatalog;
import org.opensearch.chunkplanner.query.plan.nodes.PlanNode;
import org.opensearch.common.settings.ClusterSettings;
import org.opensearch.common.settings.Settings;

import java.util.List;

/**
 * Entry point for planning chunk reads.
 *
 * <p>Each call copies the table state out of the catalog into a {@link CatalogSnapshot} and builds the plan from that
 * copy alone. The current {@link PlannerConfig} is read once per call; dynamic setting updates replace it atomically
 * and affect only calls that start afterwards.</p>
 *
 * <h2>Thread Safety:</h2>
 * <p>Planning holds no locks and shares no mutable state, so {@link #plan} may be called concurrently.</p>
 */
public class QueryPlanner {

    private static final Logger logger = LogManager.getLogger(QueryPlanner.class);

    private volatile PlannerConfig config;

    /**
     * Constructor for QueryPlanner.
     * @param config initial planner options
     */
    public QueryPlanner(PlannerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Planner config cannot be null");
        }
        this.config = config;
    }

    /**
     * Creates a planner configured from node settings that follows dynamic updates of the planner settings.
     *
     * @param clusterSettings the cluster settings for registering dynamic listeners
     * @param settings the current node settings
     * @return the planner
     */
    public static QueryPlanner create(ClusterSettings clusterSettings, Settings settings) {
        QueryPlanner planner = new QueryPlanner(PlannerConfig.fromSettings(settings));
        logger.info("Initialized chunk planner config: {}", planner.config);
        // A single compound listener so that one settings update is applied as a whole
        clusterSettings.addSettingsUpdateConsumer(
            planner::updateConfig,
            List.of(
                ChunkPlannerPlugin.PREDICATE_PUSHDOWN_ENABLED,
                ChunkPlannerPlugin.TIME_PRUNING_ENABLED,
                ChunkPlannerPlugin.ABSENT_COLUMN_PRUNING_ENABLED,
                ChunkPlannerPlugin.MAX_CHUNKS_PER_QUERY
            )
        );
        return planner;
    }

    /**
     * Replaces the config with the values of the given settings. Package-private for testing.
     */
    void updateConfig(Settings settings) {
        PlannerConfig newConfig = PlannerConfig.fromSettings(settings);
        this.config = newConfig;
        logger.info("Updated chunk planner config: {}", newConfig);
    }

    public PlannerConfig getConfig() {
        return config;
    }

    /**
     * Plans a query.
     *
     * @param query the query
     * @param catalog the catalog listing the table's chunks
     * @return the root of the read plan
     * @throws org.opensearch.chunkplanner.query.errors.PlanningException if the query cannot be planned
     */
    public PlanNode plan(ChunkQuery query, ChunkCatalog catalog) {
        CatalogSnapshot snapshot = CatalogSnapshot.capture(catalog, query.getTable());
        return plan(query, snapshot);
    }

    /**
     * Plans a query over a snapshot that was already taken.
     *
     * @param query the query
     * @param snapshot the table state
     * @return the root of the read plan
     */
    public PlanNode plan(ChunkQuery query, CatalogSnapshot snapshot) {
        return new PlanBuilder(config).build(snapshot, query);
    }
}
