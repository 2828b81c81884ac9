/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.query.errors;

import org.opensearch.OpenSearchException;
import org.opensearch.core.rest.RestStatus;

/**
 * Base class of the errors raised while building a read plan.
 *
 * <p>Planning reads no storage, so every planning error is a deterministic function of the chunk set, the table
 * schema and the query. None of them is retryable; the query fails as a whole and no partial plan is returned.</p>
 */
public abstract class PlanningException extends OpenSearchException {

    /**
     * Constructor for PlanningException.
     * @param msg message, with {} placeholders
     * @param args placeholder arguments
     */
    protected PlanningException(String msg, Object... args) {
        super(msg, args);
    }

    @Override
    public RestStatus status() {
        return RestStatus.BAD_REQUEST;
    }
}
