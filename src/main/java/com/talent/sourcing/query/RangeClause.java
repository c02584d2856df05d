package com.talent.sourcing.query;

import java.util.Objects;

/**
 * Numeric range on one field. Either bound may be {@code null} (open), not both.
 */
public record RangeClause(FilterDimension dimension, String field, Integer gte, Integer lte)
        implements QueryClause {

    public RangeClause {
        Objects.requireNonNull(dimension, "dimension is required");
        Objects.requireNonNull(field, "field is required");
        if (gte == null && lte == null) {
            throw new IllegalArgumentException("at least one bound is required");
        }
        if (gte != null && lte != null && gte > lte) {
            throw new IllegalArgumentException("gte must be <= lte");
        }
    }
}
