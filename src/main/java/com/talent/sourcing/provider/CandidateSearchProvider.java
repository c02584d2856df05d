package com.talent.sourcing.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.talent.sourcing.query.StructuredQuery;

import java.util.List;

/**
 * External candidate data provider.
 * Searching and previewing are free; fetching a full record costs one credit.
 */
public interface CandidateSearchProvider {

    /**
     * Returns up to {@code limit} candidate ids matching the query. Free.
     */
    List<String> searchIds(StructuredQuery query, int limit);

    /**
     * Returns up to {@code limit} partial candidate records matching the query. Free.
     * Each record carries its candidate id in the {@code id} field.
     */
    List<JsonNode> preview(StructuredQuery query, int limit);

    /**
     * Fetches the full record for one candidate. Costs one credit.
     */
    JsonNode fetchRecord(String candidateId);

    /**
     * Fetches the full record for one organization. Costs one credit.
     */
    JsonNode fetchOrganization(String organizationId);
}
