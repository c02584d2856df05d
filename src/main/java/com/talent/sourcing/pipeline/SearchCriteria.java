package com.talent.sourcing.pipeline;

import com.talent.sourcing.query.FilterSet;
import com.talent.sourcing.query.QueryStrategy;

/**
 * Candidate filters used by the preview stage. Organization filters are added
 * from the session's discovered entities.
 *
 * @param required filters the caller considers hard requirements
 * @param optional filters the caller considers nice to have
 * @param strategy placement strategy, {@link QueryStrategy#BALANCED} when {@code null}
 */
public record SearchCriteria(FilterSet required, FilterSet optional, QueryStrategy strategy) {

    public SearchCriteria {
        required = required != null ? required : FilterSet.empty();
        optional = optional != null ? optional : FilterSet.empty();
        strategy = strategy != null ? strategy : QueryStrategy.BALANCED;
    }

    public static SearchCriteria of(FilterSet required, QueryStrategy strategy) {
        return new SearchCriteria(required, FilterSet.empty(), strategy);
    }

    public static SearchCriteria defaults() {
        return new SearchCriteria(null, null, null);
    }
}
