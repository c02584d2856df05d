package com.talent.sourcing.query;

/**
 * One provider-neutral condition of a {@link StructuredQuery}.
 */
public interface QueryClause {

    FilterDimension dimension();
}
