package com.talent.sourcing.query;

import java.util.Objects;

/**
 * Exact match of one field against one value.
 */
public record TermClause(FilterDimension dimension, String field, String value) implements QueryClause {

    public TermClause {
        Objects.requireNonNull(dimension, "dimension is required");
        Objects.requireNonNull(field, "field is required");
        Objects.requireNonNull(value, "value is required");
    }
}
