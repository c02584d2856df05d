package com.talent.sourcing.pipeline;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;
import java.util.Objects;

/**
 * A candidate record produced by the pipeline.
 *
 * @param id                     provider candidate id
 * @param coreFields             the record payload
 * @param cacheAgeDays           age of the payload when served; 0 when freshly fetched
 * @param source                 where the payload came from
 * @param enrichedOrganizations  organization records keyed by organization id
 */
public record CandidateRecord(String id, JsonNode coreFields, long cacheAgeDays, Source source,
                              Map<String, JsonNode> enrichedOrganizations) {

    public enum Source {
        CACHE,
        FRESH,
        PREVIEW
    }

    public CandidateRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(coreFields, "coreFields is required");
        Objects.requireNonNull(source, "source is required");
        enrichedOrganizations = enrichedOrganizations != null ? Map.copyOf(enrichedOrganizations) : Map.of();
    }

    public CandidateRecord withEnrichedOrganizations(Map<String, JsonNode> organizations) {
        return new CandidateRecord(id, coreFields, cacheAgeDays, source, organizations);
    }
}
