/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.query.predicate;

import org.opensearch.chunkplanner.core.predicate.ColumnPredicate;
import org.opensearch.chunkplanner.core.predicate.Predicate;

/**
 * Inclusive time bounds implied by the clauses of a predicate on the timestamp column.
 *
 * @param minTime inclusive lower bound
 * @param maxTime inclusive upper bound; an empty range has {@code minTime > maxTime}
 */
public record TimeRange(long minTime, long maxTime) {

    /** Range that does not restrict time at all. */
    public static final TimeRange UNBOUNDED = new TimeRange(Long.MIN_VALUE, Long.MAX_VALUE);

    /**
     * Folds the clauses on {@code timeColumn} into a single range. Clauses that do not bound time
     * ({@code !=}, null checks, other columns) are ignored.
     *
     * @param predicate the validated query predicate
     * @param timeColumn the timestamp column of the primary key
     * @return the implied range
     */
    public static TimeRange of(Predicate predicate, String timeColumn) {
        long min = Long.MIN_VALUE;
        long max = Long.MAX_VALUE;
        boolean empty = false;
        for (ColumnPredicate clause : predicate.getClauses()) {
            if (!clause.getColumn().equals(timeColumn) || clause.isNullAware()) {
                continue;
            }
            long value = (Long) clause.getLiteral();
            switch (clause.getOperator()) {
                case EQ -> {
                    min = Math.max(min, value);
                    max = Math.min(max, value);
                }
                case LT -> {
                    if (value == Long.MIN_VALUE) {
                        empty = true;
                    } else {
                        max = Math.min(max, value - 1);
                    }
                }
                case LTE -> max = Math.min(max, value);
                case GT -> {
                    if (value == Long.MAX_VALUE) {
                        empty = true;
                    } else {
                        min = Math.max(min, value + 1);
                    }
                }
                case GTE -> min = Math.max(min, value);
                default -> {
                    // NEQ does not narrow the range
                }
            }
        }
        if (empty || min > max) {
            return new TimeRange(Long.MAX_VALUE, Long.MIN_VALUE);
        }
        return new TimeRange(min, max);
    }

    public boolean isEmpty() {
        return minTime > maxTime;
    }

    public boolean isUnbounded() {
        return minTime == Long.MIN_VALUE && maxTime == Long.MAX_VALUE;
    }

    /**
     * Whether {@code [min, max]} shares at least one timestamp with this range.
     * @param min inclusive lower bound
     * @param max inclusive upper bound
     * @return true if the ranges intersect
     */
    public boolean intersects(long min, long max) {
        return !isEmpty() && minTime <= max && min <= maxTime;
    }
}
