package com.talent.sourcing.rest.dto;

/**
 * Request DTO for deciding a manual-resolution item. {@code canonicalId} is required to
 * resolve and ignored when dismissing.
 */
public record ManualResolutionRequest(String canonicalId, String reviewerId, String notes) {

    public ManualResolutionRequest {
        if (reviewerId == null || reviewerId.isBlank()) {
            throw new IllegalArgumentException("reviewerId is required");
        }
    }
}
