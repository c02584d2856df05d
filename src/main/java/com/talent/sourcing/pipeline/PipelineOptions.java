package com.talent.sourcing.pipeline;

/**
 * Limits and knobs for the stage orchestrator.
 */
public class PipelineOptions {

    private static final int DEFAULT_PREVIEW_CAP = 100;
    private static final int DEFAULT_ID_CAP = 1000;
    private static final int DEFAULT_CONCURRENCY = 5;
    private static final int DEFAULT_ORGANIZATION_BATCH_SIZE = 5;
    private static final int DEFAULT_MAX_ATTEMPTS = 2;

    private final int previewCap;
    private final int idCap;
    private final int concurrency;
    private final int organizationBatchSize;
    private final int maxAttempts;
    private final EnrichmentPolicy enrichmentPolicy;

    private PipelineOptions(Builder builder) {
        this.previewCap = builder.previewCap;
        this.idCap = builder.idCap;
        this.concurrency = builder.concurrency;
        this.organizationBatchSize = builder.organizationBatchSize;
        this.maxAttempts = builder.maxAttempts;
        this.enrichmentPolicy = builder.enrichmentPolicy;
    }

    /**
     * Maximum partial records requested from the free preview call.
     */
    public int getPreviewCap() {
        return previewCap;
    }

    /**
     * Hard cap on candidate ids stored per session.
     */
    public int getIdCap() {
        return idCap;
    }

    /**
     * Collection wave size and worker count.
     */
    public int getConcurrency() {
        return concurrency;
    }

    /**
     * Discovered organizations searched per preview batch.
     */
    public int getOrganizationBatchSize() {
        return organizationBatchSize;
    }

    /**
     * Attempts per external call, including the first.
     */
    public int getMaxAttempts() {
        return maxAttempts;
    }

    public EnrichmentPolicy getEnrichmentPolicy() {
        return enrichmentPolicy;
    }

    public static PipelineOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int previewCap = DEFAULT_PREVIEW_CAP;
        private int idCap = DEFAULT_ID_CAP;
        private int concurrency = DEFAULT_CONCURRENCY;
        private int organizationBatchSize = DEFAULT_ORGANIZATION_BATCH_SIZE;
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private EnrichmentPolicy enrichmentPolicy = EnrichmentPolicy.yearCutoff(EnrichmentPolicy.DEFAULT_MIN_YEAR);

        public Builder previewCap(int previewCap) {
            this.previewCap = previewCap;
            return this;
        }

        public Builder idCap(int idCap) {
            this.idCap = idCap;
            return this;
        }

        public Builder concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public Builder organizationBatchSize(int organizationBatchSize) {
            this.organizationBatchSize = organizationBatchSize;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder enrichmentPolicy(EnrichmentPolicy enrichmentPolicy) {
            this.enrichmentPolicy = enrichmentPolicy;
            return this;
        }

        public PipelineOptions build() {
            if (previewCap <= 0) {
                throw new IllegalArgumentException("previewCap must be > 0");
            }
            if (idCap <= 0) {
                throw new IllegalArgumentException("idCap must be > 0");
            }
            if (concurrency <= 0) {
                throw new IllegalArgumentException("concurrency must be > 0");
            }
            if (organizationBatchSize <= 0) {
                throw new IllegalArgumentException("organizationBatchSize must be > 0");
            }
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("maxAttempts must be > 0");
            }
            if (enrichmentPolicy == null) {
                throw new IllegalArgumentException("enrichmentPolicy is required");
            }
            return new PipelineOptions(this);
        }
    }
}
