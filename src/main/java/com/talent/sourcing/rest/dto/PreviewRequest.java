package com.talent.sourcing.rest.dto;

/**
 * Request DTO for the preview stage. {@code nextBatch} searches the next batch of
 * discovered organizations instead of the first.
 */
public record PreviewRequest(CriteriaRequest criteria, boolean nextBatch) {
}
