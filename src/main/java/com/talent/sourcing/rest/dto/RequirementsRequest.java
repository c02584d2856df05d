package com.talent.sourcing.rest.dto;

import com.talent.sourcing.pipeline.Requirements;
import com.talent.sourcing.pipeline.WeightedRequirement;

import java.util.List;

/**
 * Evaluation requirements: a description plus weighted criteria in percent.
 */
public record RequirementsRequest(String description, List<Criterion> criteria) {

    public record Criterion(String name, double weight) {
    }

    public Requirements toRequirements() {
        List<WeightedRequirement> weighted = criteria == null ? List.of()
                : criteria.stream().map(c -> new WeightedRequirement(c.name(), c.weight())).toList();
        return Requirements.of(description, weighted);
    }
}
