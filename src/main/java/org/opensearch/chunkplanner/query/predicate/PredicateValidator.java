/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.query.predicate;

import org.opensearch.chunkplanner.core.model.ColumnType;
import org.opensearch.chunkplanner.core.predicate.ColumnPredicate;
import org.opensearch.chunkplanner.core.predicate.Predicate;
import org.opensearch.chunkplanner.query.errors.MalformedPredicateException;
import org.opensearch.chunkplanner.query.errors.UnknownColumnException;
import org.opensearch.chunkplanner.query.schema.LogicalSchema;

import java.util.Locale;

/**
 * Checks a query predicate against the logical schema before any plan is built, so that invalid predicates fail at
 * plan time and never during execution.
 */
public final class PredicateValidator {

    private PredicateValidator() {}

    /**
     * Validates every clause of a predicate.
     *
     * @param table the queried table
     * @param predicate the predicate to validate
     * @param schema the logical schema
     * @throws UnknownColumnException if a clause references a column outside the schema
     * @throws MalformedPredicateException if a literal does not fit its column
     */
    public static void validate(String table, Predicate predicate, LogicalSchema schema) {
        for (ColumnPredicate clause : predicate.getClauses()) {
            ColumnType type = schema.typeOf(clause.getColumn());
            if (type == null) {
                throw new UnknownColumnException(table, clause.getColumn());
            }
            validateClause(clause, type);
        }
    }

    /**
     * Validates one clause against the type of its column.
     *
     * @param clause the clause
     * @param type the declared column type
     * @throws MalformedPredicateException if the clause is not applicable
     */
    public static void validateClause(ColumnPredicate clause, ColumnType type) {
        Object literal = clause.getLiteral();
        if (clause.isNullAware()) {
            if (literal != null) {
                throw new MalformedPredicateException(clause, "operator " + clause.getOperator().getSymbol() + " takes no literal");
            }
            return;
        }
        if (literal == null) {
            throw new MalformedPredicateException(clause, "a null literal never matches, use IS NULL or IS NOT NULL");
        }
        if (!type.accepts(literal)) {
            throw new MalformedPredicateException(
                clause,
                String.format(
                    Locale.ROOT,
                    "literal of type %s does not match column type %s",
                    literal.getClass().getSimpleName(),
                    type.getTypeName()
                )
            );
        }
        if (clause.getOperator().isRange() && !type.isOrdered()) {
            throw new MalformedPredicateException(clause, "column type " + type.getTypeName() + " has no ordering");
        }
    }
}
