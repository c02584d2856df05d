package com.talent.sourcing.pipeline;

import java.util.List;

/**
 * Weighted evaluation criteria. Custom weights total at most {@value #MAX_CUSTOM_WEIGHT} percent;
 * when they exceed it they are scaled down proportionally. The remainder is the
 * "general fit" weight applied to the collaborator's overall score.
 */
public final class Requirements {

    public static final double MAX_CUSTOM_WEIGHT = 95.0;
    public static final String GENERAL_FIT = "General Fit";

    private final List<WeightedRequirement> criteria;
    private final String description;

    private Requirements(List<WeightedRequirement> criteria, String description) {
        this.criteria = criteria;
        this.description = description;
    }

    public static Requirements of(String description, List<WeightedRequirement> criteria) {
        List<WeightedRequirement> copy = List.copyOf(criteria);
        double total = copy.stream().mapToDouble(WeightedRequirement::weight).sum();
        if (total > MAX_CUSTOM_WEIGHT) {
            double scale = MAX_CUSTOM_WEIGHT / total;
            copy = copy.stream()
                    .map(r -> new WeightedRequirement(r.name(), r.weight() * scale))
                    .toList();
        }
        return new Requirements(copy, description != null ? description : "");
    }

    /**
     * Requirements with no custom criteria: the overall score decides alone.
     */
    public static Requirements generalFitOnly(String description) {
        return of(description, List.of());
    }

    public List<WeightedRequirement> getCriteria() {
        return criteria;
    }

    public String getDescription() {
        return description;
    }

    public double customWeight() {
        return criteria.stream().mapToDouble(WeightedRequirement::weight).sum();
    }

    public double generalFitWeight() {
        return 100.0 - customWeight();
    }
}
