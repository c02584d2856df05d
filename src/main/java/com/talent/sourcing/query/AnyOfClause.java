package com.talent.sourcing.query;

import java.util.List;
import java.util.Objects;

/**
 * Disjunction: matches when at least one nested clause matches.
 */
public record AnyOfClause(FilterDimension dimension, List<QueryClause> clauses) implements QueryClause {

    public AnyOfClause {
        Objects.requireNonNull(dimension, "dimension is required");
        clauses = List.copyOf(clauses);
        if (clauses.isEmpty()) {
            throw new IllegalArgumentException("clauses must not be empty");
        }
    }
}
