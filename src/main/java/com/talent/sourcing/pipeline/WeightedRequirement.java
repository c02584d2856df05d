package com.talent.sourcing.pipeline;

import java.util.Objects;

/**
 * One evaluation criterion and its share of the final score, in percent.
 */
public record WeightedRequirement(String name, double weight) {

    public WeightedRequirement {
        Objects.requireNonNull(name, "name is required");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (weight < 0) {
            throw new IllegalArgumentException("weight must be >= 0");
        }
    }
}
