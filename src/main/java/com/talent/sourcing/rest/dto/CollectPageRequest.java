package com.talent.sourcing.rest.dto;

/**
 * Request DTO for one collection page.
 */
public record CollectPageRequest(int startIndex, int count, boolean bypassCache) {
}
