package com.talent.sourcing.provider.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.talent.sourcing.provider.EntitySearchProvider;
import com.talent.sourcing.provider.OrganizationMatch;
import com.talent.sourcing.rules.WebsiteNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link EntitySearchProvider} backed by an organization search API.
 * Name search combines an exact phrase match with a fuzzy fallback.
 */
public class HttpEntitySearchProvider implements EntitySearchProvider {
    private static final Logger log = LoggerFactory.getLogger(HttpEntitySearchProvider.class);

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
    private static final String SEARCH_PATH = "/company_clean/search/es_dsl/preview";

    private final JsonHttpClient client;

    private HttpEntitySearchProvider(Builder builder) {
        this.client = new JsonHttpClient(builder.baseUrl, builder.apiKey,
                builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT,
                builder.httpClient, builder.objectMapper);
    }

    @Override
    public Optional<OrganizationMatch> findByWebsite(String domain) {
        ObjectNode body = client.objectMapper().createObjectNode();
        body.putObject("query").putObject("match_phrase").put("website", domain);
        return parseMatches(client.post(SEARCH_PATH, body)).stream()
                .filter(match -> match.website() != null
                        && WebsiteNormalizer.normalize(match.website()).map(domain::equals).orElse(false))
                .findFirst();
    }

    @Override
    public List<OrganizationMatch> searchByName(String name, int limit) {
        ObjectNode body = client.objectMapper().createObjectNode();
        ObjectNode bool = body.putObject("query").putObject("bool");
        ArrayNode should = bool.putArray("should");
        ObjectNode phrase = should.addObject().putObject("match_phrase").putObject("name");
        phrase.put("query", name);
        phrase.put("boost", 3.0);
        ObjectNode fuzzy = should.addObject().putObject("match").putObject("name");
        fuzzy.put("query", name);
        fuzzy.put("fuzziness", "AUTO");
        fuzzy.put("boost", 1.0);
        bool.put("minimum_should_match", 1);

        List<OrganizationMatch> matches = parseMatches(client.post(SEARCH_PATH, body));
        log.debug("organizations.search name='{}' matches={}", name, matches.size());
        return matches.size() > limit ? matches.subList(0, limit) : matches;
    }

    /**
     * Accepts either a plain array of organization objects or an Elasticsearch
     * {@code hits.hits[]._source} envelope.
     */
    private static List<OrganizationMatch> parseMatches(JsonNode response) {
        JsonNode items = response.has("hits") ? response.path("hits").path("hits") : response;
        List<OrganizationMatch> matches = new ArrayList<>();
        for (JsonNode item : items) {
            JsonNode source = item.has("_source") ? item.get("_source") : item;
            String id = source.path("id").asText("");
            String name = source.path("name").asText("");
            if (id.isEmpty() || name.isEmpty()) {
                continue;
            }
            String website = source.hasNonNull("website") ? source.get("website").asText() : null;
            double score = item.path("_score").asDouble(0.0);
            matches.add(new OrganizationMatch(id, name, website, score));
        }
        return matches;
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

        public HttpEntitySearchProvider build() {
            return new HttpEntitySearchProvider(this);
        }
    }
}
