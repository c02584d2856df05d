package com.talent.sourcing.resolver;

/**
 * Options for organization resolution.
 */
public class ResolutionOptions {

    private static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.85;
    private static final int DEFAULT_SEARCH_LIMIT = 5;
    private static final int DEFAULT_PARALLELISM = 5;

    private final double confidenceThreshold;
    private final int searchLimit;
    private final int parallelism;
    private final boolean submitUnresolvedForReview;

    private ResolutionOptions(Builder builder) {
        this.confidenceThreshold = builder.confidenceThreshold;
        this.searchLimit = builder.searchLimit;
        this.parallelism = builder.parallelism;
        this.submitUnresolvedForReview = builder.submitUnresolvedForReview;
    }

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public int getSearchLimit() {
        return searchLimit;
    }

    public int getParallelism() {
        return parallelism;
    }

    public boolean isSubmitUnresolvedForReview() {
        return submitUnresolvedForReview;
    }

    public static ResolutionOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double confidenceThreshold = DEFAULT_CONFIDENCE_THRESHOLD;
        private int searchLimit = DEFAULT_SEARCH_LIMIT;
        private int parallelism = DEFAULT_PARALLELISM;
        private boolean submitUnresolvedForReview = true;

        public Builder confidenceThreshold(double confidenceThreshold) {
            this.confidenceThreshold = confidenceThreshold;
            return this;
        }

        public Builder searchLimit(int searchLimit) {
            this.searchLimit = searchLimit;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder submitUnresolvedForReview(boolean submitUnresolvedForReview) {
            this.submitUnresolvedForReview = submitUnresolvedForReview;
            return this;
        }

        public ResolutionOptions build() {
            if (confidenceThreshold <= 0.0 || confidenceThreshold > 1.0) {
                throw new IllegalArgumentException("confidenceThreshold must be in (0, 1]");
            }
            if (searchLimit <= 0) {
                throw new IllegalArgumentException("searchLimit must be > 0");
            }
            if (parallelism <= 0) {
                throw new IllegalArgumentException("parallelism must be > 0");
            }
            return new ResolutionOptions(this);
        }
    }
}
