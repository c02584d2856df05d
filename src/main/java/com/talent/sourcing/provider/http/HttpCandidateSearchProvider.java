package com.talent.sourcing.provider.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.talent.sourcing.provider.CandidateSearchProvider;
import com.talent.sourcing.provider.ExternalFetchException;
import com.talent.sourcing.query.StructuredQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link CandidateSearchProvider} backed by an Elasticsearch-DSL candidate data API.
 *
 * <pre>
 * HttpCandidateSearchProvider provider = HttpCandidateSearchProvider.builder()
 *     .baseUrl("https://api.example.com/v2")
 *     .apiKey(apiKey)
 *     .build();
 * </pre>
 */
public class HttpCandidateSearchProvider implements CandidateSearchProvider {
    private static final Logger log = LoggerFactory.getLogger(HttpCandidateSearchProvider.class);

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final JsonHttpClient client;
    private final ElasticsearchQueryRenderer renderer;

    private HttpCandidateSearchProvider(Builder builder) {
        this.client = new JsonHttpClient(builder.baseUrl, builder.apiKey,
                builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT,
                builder.httpClient, builder.objectMapper);
        this.renderer = new ElasticsearchQueryRenderer(client.objectMapper());
    }

    @Override
    public List<String> searchIds(StructuredQuery query, int limit) {
        JsonNode response = client.post("/employee_clean/search/es_dsl", renderer.render(query));
        List<String> ids = new ArrayList<>();
        for (JsonNode id : response) {
            if (ids.size() >= limit) {
                break;
            }
            ids.add(id.asText());
        }
        log.debug("candidates.search ids={} limit={}", ids.size(), limit);
        return ids;
    }

    @Override
    public List<JsonNode> preview(StructuredQuery query, int limit) {
        JsonNode response = client.post("/employee_clean/search/es_dsl/preview", renderer.render(query));
        List<JsonNode> records = new ArrayList<>();
        for (JsonNode record : response) {
            if (records.size() >= limit) {
                break;
            }
            if (record.isObject() && record.has("id")) {
                ((ObjectNode) record).put("id", record.get("id").asText());
            }
            records.add(record);
        }
        log.debug("candidates.preview records={} limit={}", records.size(), limit);
        return records;
    }

    @Override
    public JsonNode fetchRecord(String candidateId) {
        return collect("/employee_clean/collect/", candidateId);
    }

    @Override
    public JsonNode fetchOrganization(String organizationId) {
        return collect("/company_base/collect/", organizationId);
    }

    private JsonNode collect(String path, String id) {
        JsonNode record = client.get(path + URLEncoder.encode(id, StandardCharsets.UTF_8));
        if (!record.isObject()) {
            throw new ExternalFetchException("Expected a JSON object from " + path + id);
        }
        return record;
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

        public HttpCandidateSearchProvider build() {
            return new HttpCandidateSearchProvider(this);
        }
    }
}
