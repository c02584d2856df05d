package com.talent.sourcing.rest.dto;

/**
 * Request DTO for evaluating every candidate collected so far.
 */
public record EvaluateRequest(RequirementsRequest requirements) {
}
