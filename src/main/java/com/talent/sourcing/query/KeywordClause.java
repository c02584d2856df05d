package com.talent.sourcing.query;

import java.util.List;
import java.util.Objects;

/**
 * Matches when any keyword occurs anywhere in any of the fields.
 * Keywords are lowercase plain text; renderers add the wildcards.
 */
public record KeywordClause(FilterDimension dimension, List<String> fields, List<String> keywords)
        implements QueryClause {

    public KeywordClause {
        Objects.requireNonNull(dimension, "dimension is required");
        fields = List.copyOf(fields);
        keywords = List.copyOf(keywords);
        if (fields.isEmpty() || keywords.isEmpty()) {
            throw new IllegalArgumentException("fields and keywords must not be empty");
        }
    }
}
