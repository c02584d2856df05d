package com.talent.sourcing.rest.dto;

import com.talent.sourcing.pipeline.SearchCriteria;
import com.talent.sourcing.query.FilterSet;
import com.talent.sourcing.query.QueryStrategy;

/**
 * Required and optional filters plus the placement strategy (STRICT, BALANCED or BROAD).
 */
public record CriteriaRequest(FilterRequest required, FilterRequest optional, String strategy) {

    public SearchCriteria toCriteria() {
        QueryStrategy parsed = strategy == null || strategy.isBlank()
                ? QueryStrategy.BALANCED : QueryStrategy.valueOf(strategy.trim().toUpperCase());
        return new SearchCriteria(
                required != null ? required.toFilterSet() : FilterSet.empty(),
                optional != null ? optional.toFilterSet() : FilterSet.empty(),
                parsed);
    }

    public static SearchCriteria toCriteria(CriteriaRequest request) {
        return request != null ? request.toCriteria() : SearchCriteria.defaults();
    }
}
