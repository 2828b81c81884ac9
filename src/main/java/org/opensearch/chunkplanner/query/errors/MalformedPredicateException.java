/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.query.errors;

import org.opensearch.chunkplanner.core.predicate.ColumnPredicate;

/**
 * Raised when a predicate clause cannot be evaluated against its column, such as a literal whose type does not
 * match the declared column type.
 */
public class MalformedPredicateException extends PlanningException {

    private final ColumnPredicate clause;

    /**
     * Constructor for MalformedPredicateException.
     * @param clause the offending clause
     * @param reason why it is rejected
     */
    public MalformedPredicateException(ColumnPredicate clause, String reason) {
        super("malformed predicate [{}]: {}", clause, reason);
        this.clause = clause;
    }

    public ColumnPredicate getClause() {
        return clause;
    }
}
