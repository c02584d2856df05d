package com.talent.sourcing.review;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * An organization that no resolution tier could match, awaiting a human decision.
 */
public class ManualResolutionItem {

    private final String id;
    private final String sessionId;
    private final String queryName;
    private final String website;
    private final Instant submittedAt;
    private ManualResolutionStatus status;
    private Instant decidedAt;
    private String canonicalId;
    private String reviewerId;
    private String notes;

    private ManualResolutionItem(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.sessionId = builder.sessionId;
        this.queryName = Objects.requireNonNull(builder.queryName, "queryName is required");
        this.website = builder.website;
        this.submittedAt = builder.submittedAt != null ? builder.submittedAt : Instant.now();
        this.status = ManualResolutionStatus.PENDING;
    }

    public String getId() {
        return id;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getQueryName() {
        return queryName;
    }

    public String getWebsite() {
        return website;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public synchronized ManualResolutionStatus getStatus() {
        return status;
    }

    public synchronized Instant getDecidedAt() {
        return decidedAt;
    }

    public synchronized String getCanonicalId() {
        return canonicalId;
    }

    public synchronized String getReviewerId() {
        return reviewerId;
    }

    public synchronized String getNotes() {
        return notes;
    }

    public synchronized boolean isPending() {
        return status == ManualResolutionStatus.PENDING;
    }

    synchronized void markResolved(String canonicalId, String reviewerId) {
        this.status = ManualResolutionStatus.RESOLVED;
        this.canonicalId = canonicalId;
        this.reviewerId = reviewerId;
        this.decidedAt = Instant.now();
    }

    synchronized void markDismissed(String reviewerId, String notes) {
        this.status = ManualResolutionStatus.DISMISSED;
        this.reviewerId = reviewerId;
        this.notes = notes;
        this.decidedAt = Instant.now();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(id, ((ManualResolutionItem) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ManualResolutionItem{id='" + id + "', queryName='" + queryName
                + "', sessionId='" + sessionId + "', status=" + getStatus() + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String sessionId;
        private String queryName;
        private String website;
        private Instant submittedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder queryName(String queryName) {
            this.queryName = queryName;
            return this;
        }

        public Builder website(String website) {
            this.website = website;
            return this;
        }

        public Builder submittedAt(Instant submittedAt) {
            this.submittedAt = submittedAt;
            return this;
        }

        public ManualResolutionItem build() {
            return new ManualResolutionItem(this);
        }
    }
}
