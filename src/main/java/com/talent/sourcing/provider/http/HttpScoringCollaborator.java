package com.talent.sourcing.provider.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.talent.sourcing.pipeline.CandidateRecord;
import com.talent.sourcing.pipeline.Requirements;
import com.talent.sourcing.pipeline.WeightedRequirement;
import com.talent.sourcing.provider.CandidateScore;
import com.talent.sourcing.provider.ExternalFetchException;
import com.talent.sourcing.provider.ScoringCollaborator;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link ScoringCollaborator} that posts the candidate and requirements to a scoring service.
 *
 * <p>Request: {@code {"candidate": {...}, "organizations": {...}, "requirements": {"description": "...",
 * "criteria": [{"name": "...", "weight": 30.0}]}}}. Response: {@code {"overall_score": 7.5,
 * "criterion_scores": {"...": 8.0}, "rationale": "..."}}.</p>
 */
public class HttpScoringCollaborator implements ScoringCollaborator {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    private final JsonHttpClient client;

    private HttpScoringCollaborator(Builder builder) {
        this.client = new JsonHttpClient(builder.baseUrl, builder.apiKey,
                builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT,
                builder.httpClient, builder.objectMapper);
    }

    @Override
    public CandidateScore score(CandidateRecord record, Requirements requirements) {
        ObjectNode body = client.objectMapper().createObjectNode();
        body.set("candidate", record.coreFields());
        ObjectNode organizations = body.putObject("organizations");
        record.enrichedOrganizations().forEach(organizations::set);
        ObjectNode req = body.putObject("requirements");
        req.put("description", requirements.getDescription());
        ArrayNode criteria = req.putArray("criteria");
        for (WeightedRequirement requirement : requirements.getCriteria()) {
            criteria.addObject()
                    .put("name", requirement.name())
                    .put("weight", requirement.weight());
        }

        JsonNode response = client.post("/score", body);
        JsonNode overall = response.get("overall_score");
        if (overall == null || !overall.isNumber()) {
            throw new ExternalFetchException("Scoring response has no numeric overall_score for " + record.id());
        }
        Map<String, Double> criterionScores = new LinkedHashMap<>();
        response.path("criterion_scores").fields()
                .forEachRemaining(entry -> criterionScores.put(entry.getKey(), entry.getValue().asDouble()));
        try {
            return new CandidateScore(overall.asDouble(), criterionScores, response.path("rationale").asText(""));
        } catch (IllegalArgumentException e) {
            throw new ExternalFetchException("Invalid score for " + record.id() + ": " + e.getMessage(), e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private String apiKey;
        private Duration timeout;
        private HttpClient httpClient;
        private ObjectMapper objectMapper;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public HttpScoringCollaborator build() {
            return new HttpScoringCollaborator(this);
        }
    }
}
