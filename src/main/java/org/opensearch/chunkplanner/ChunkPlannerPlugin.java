/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner;

import org.opensearch.common.settings.Setting;
import org.opensearch.plugins.Plugin;

import java.util.List;

/**
 * Plugin for the chunk read planner
 */
public class ChunkPlannerPlugin extends Plugin {

    /**
     * Whether predicate clauses may be evaluated inside chunk scans.
     */
    public static final Setting<Boolean> PREDICATE_PUSHDOWN_ENABLED = Setting.boolSetting(
        "chunk_planner.predicate_pushdown.enabled",
        true,
        Setting.Property.NodeScope,
        Setting.Property.Dynamic
    );

    /**
     * Whether chunks outside the time range implied by the predicate are dropped before grouping.
     */
    public static final Setting<Boolean> TIME_PRUNING_ENABLED = Setting.boolSetting(
        "chunk_planner.time_pruning.enabled",
        true,
        Setting.Property.NodeScope,
        Setting.Property.Dynamic
    );

    /**
     * Whether overlap groups in which no member stores a column required by the predicate are dropped.
     */
    public static final Setting<Boolean> ABSENT_COLUMN_PRUNING_ENABLED = Setting.boolSetting(
        "chunk_planner.absent_column_pruning.enabled",
        false,
        Setting.Property.NodeScope,
        Setting.Property.Dynamic
    );

    /**
     * Upper bound on the number of live chunks a single query may plan over.
     */
    public static final Setting<Integer> MAX_CHUNKS_PER_QUERY = Setting.intSetting(
        "chunk_planner.max_chunks_per_query",
        10_000,
        1,
        Setting.Property.NodeScope,
        Setting.Property.Dynamic
    );

    /**
     * Default constructor
     */
    public ChunkPlannerPlugin() {}

    @Override
    public List<Setting<?>> getSettings() {
        return List.of(PREDICATE_PUSHDOWN_ENABLED, TIME_PRUNING_ENABLED, ABSENT_COLUMN_PRUNING_ENABLED, MAX_CHUNKS_PER_QUERY);
    }
}
