package com.talent.sourcing.query;

import java.util.List;

/**
 * Provider-neutral candidate query: hard requirements plus scoring boosts.
 *
 * @param required clauses every result must satisfy
 * @param boosts   clauses that only raise a result's rank
 */
public record StructuredQuery(List<QueryClause> required, List<QueryClause> boosts) {

    public StructuredQuery {
        required = required != null ? List.copyOf(required) : List.of();
        boosts = boosts != null ? List.copyOf(boosts) : List.of();
    }

    public boolean isRequired(FilterDimension dimension) {
        return required.stream().anyMatch(c -> c.dimension() == dimension);
    }

    public boolean isBoost(FilterDimension dimension) {
        return boosts.stream().anyMatch(c -> c.dimension() == dimension);
    }
}
