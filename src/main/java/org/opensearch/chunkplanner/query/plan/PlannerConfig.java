/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.query.plan;

import org.opensearch.chunkplanner.ChunkPlannerPlugin;
import org.opensearch.common.settings.Settings;

/**
 * Planner options, materialised from node settings.
 *
 * <h2>Settings:</h2>
 * <p>Settings are defined in {@link ChunkPlannerPlugin}:</p>
 * <ul>
 *   <li>{@link ChunkPlannerPlugin#PREDICATE_PUSHDOWN_ENABLED}</li>
 *   <li>{@link ChunkPlannerPlugin#TIME_PRUNING_ENABLED}</li>
 *   <li>{@link ChunkPlannerPlugin#ABSENT_COLUMN_PRUNING_ENABLED}</li>
 *   <li>{@link ChunkPlannerPlugin#MAX_CHUNKS_PER_QUERY}</li>
 * </ul>
 *
 * @param pushdownEnabled whether clauses may be evaluated inside scans
 * @param timePruningEnabled whether chunks outside the queried time range are dropped
 * @param absentColumnPruningEnabled whether groups missing a required column are dropped
 * @param maxChunksPerQuery maximum number of live chunks per query
 * @see QueryPlanner
 */
public record PlannerConfig(boolean pushdownEnabled, boolean timePruningEnabled, boolean absentColumnPruningEnabled,
    int maxChunksPerQuery) {

    public PlannerConfig {
        if (maxChunksPerQuery < 1) {
            throw new IllegalArgumentException("maxChunksPerQuery must be positive, got " + maxChunksPerQuery);
        }
    }

    /**
     * Reads the configuration from settings, falling back to the setting defaults.
     *
     * @param settings the node settings
     * @return the configuration
     */
    public static PlannerConfig fromSettings(Settings settings) {
        return new PlannerConfig(
            ChunkPlannerPlugin.PREDICATE_PUSHDOWN_ENABLED.get(settings),
            ChunkPlannerPlugin.TIME_PRUNING_ENABLED.get(settings),
            ChunkPlannerPlugin.ABSENT_COLUMN_PRUNING_ENABLED.get(settings),
            ChunkPlannerPlugin.MAX_CHUNKS_PER_QUERY.get(settings)
        );
    }

    /**
     * Default configuration for when settings are not available.
     *
     * @return default configuration
     */
    public static PlannerConfig defaultConfig() {
        return fromSettings(Settings.EMPTY);
    }

    /**
     * Configuration that never pushes clauses into scans nor prunes.
     * Useful for testing that optimisations do not change results.
     *
     * @return unoptimised configuration
     */
    public static PlannerConfig noOptimizations() {
        return new PlannerConfig(false, false, false, Integer.MAX_VALUE);
    }
}
