/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.query.plan;

import org.opensearch.chunkplanner.query.plan.nodes.PlanNode;

/**
 * Renders a plan as an indented text tree, one node per line, children below their parent.
 *
 * <pre>
 * Project(columns=[tag, time, temp])
 *   Union(inputs=2)
 *     Dedup(keys=[tag, time])
 *       Merge(keys=[tag, time])
 *         Scan(chunk=C2, ...)
 *         Scan(chunk=C1, ...)
 *     Scan(chunk=C3, ...)
 * </pre>
 */
public final class PlanExplainer {

    private static final String INDENT = "  ";

    private PlanExplainer() {}

    /**
     * Explains a plan.
     * @param root the root node
     * @return the text tree, lines separated by {@code \n}
     */
    public static String explain(PlanNode root) {
        StringBuilder sb = new StringBuilder();
        append(sb, root, 0);
        return sb.toString();
    }

    private static void append(StringBuilder sb, PlanNode node, int depth) {
        sb.append(INDENT.repeat(depth)).append(node.getExplainName()).append('\n');
        for (PlanNode child : node.getChildren()) {
            append(sb, child, depth + 1);
        }
    }
}
