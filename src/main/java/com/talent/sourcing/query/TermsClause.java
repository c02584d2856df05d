package com.talent.sourcing.query;

import java.util.List;
import java.util.Objects;

/**
 * Exact match of one field against any of several values.
 */
public record TermsClause(FilterDimension dimension, String field, List<String> values) implements QueryClause {

    public TermsClause {
        Objects.requireNonNull(dimension, "dimension is required");
        Objects.requireNonNull(field, "field is required");
        values = List.copyOf(values);
        if (values.isEmpty()) {
            throw new IllegalArgumentException("values must not be empty");
        }
    }
}
