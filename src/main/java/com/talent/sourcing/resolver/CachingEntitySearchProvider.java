package com.talent.sourcing.resolver;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.talent.sourcing.cache.CacheLookup;
import com.talent.sourcing.cache.CacheTier;
import com.talent.sourcing.cache.FreshnessPolicy;
import com.talent.sourcing.provider.EntitySearchProvider;
import com.talent.sourcing.provider.OrganizationMatch;
import com.talent.sourcing.rules.DefaultNormalizationRules;
import com.talent.sourcing.rules.NormalizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Decorates an {@link EntitySearchProvider} with the cache tier.
 * Website lookups are keyed by domain. Name searches are sent to the provider with
 * legal suffixes and punctuation stripped, and keyed by that same name lowercased,
 * so every name sharing a key produced the same provider query. Empty results are cached as well, so an unknown organization is only
 * looked up once per freshness window. Provider exceptions are not cached.
 */
public class CachingEntitySearchProvider implements EntitySearchProvider {
    private static final Logger log = LoggerFactory.getLogger(CachingEntitySearchProvider.class);

    static final String WEBSITE_PREFIX = "org:website:";
    static final String NAME_PREFIX = "org:name:";

    private final EntitySearchProvider delegate;
    private final CacheTier cache;
    private final NormalizationEngine normalizer;
    private final ObjectMapper objectMapper;
    private final FreshnessPolicy policy;

    public CachingEntitySearchProvider(EntitySearchProvider delegate, CacheTier cache) {
        this(delegate, cache, DefaultNormalizationRules.createDefaultEngine(), new ObjectMapper());
    }

    public CachingEntitySearchProvider(EntitySearchProvider delegate, CacheTier cache,
                                       NormalizationEngine normalizer, ObjectMapper objectMapper) {
        this.delegate = delegate;
        this.cache = cache;
        this.normalizer = normalizer;
        this.objectMapper = objectMapper;
        this.policy = FreshnessPolicy.organizations();
    }

    @Override
    public Optional<OrganizationMatch> findByWebsite(String domain) {
        String key = WEBSITE_PREFIX + domain.toLowerCase(Locale.ROOT);
        CacheLookup lookup = cache.get(key, policy);
        if (lookup.isHit()) {
            List<OrganizationMatch> cached = readMatches(lookup.payload());
            log.debug("org.lookup.cached key={} found={}", key, !cached.isEmpty());
            return cached.stream().findFirst();
        }
        Optional<OrganizationMatch> fetched = delegate.findByWebsite(domain);
        cache.set(key, writeMatches(fetched.map(List::of).orElse(List.of())));
        return fetched;
    }

    @Override
    public List<OrganizationMatch> searchByName(String name, int limit) {
        String normalized = normalizer.normalize(name);
        if (normalized.isEmpty()) {
            return List.of();
        }
        String key = NAME_PREFIX + normalized.toLowerCase(Locale.ROOT) + "#" + limit;
        CacheLookup lookup = cache.get(key, policy);
        if (lookup.isHit()) {
            log.debug("org.search.cached key={}", key);
            return readMatches(lookup.payload());
        }
        List<OrganizationMatch> fetched = delegate.searchByName(normalized, limit);
        cache.set(key, writeMatches(fetched));
        return fetched;
    }

    private JsonNode writeMatches(List<OrganizationMatch> matches) {
        ObjectNode payload = objectMapper.createObjectNode();
        ArrayNode array = payload.putArray("matches");
        matches.forEach(match -> array.add(objectMapper.valueToTree(match)));
        return payload;
    }

    private List<OrganizationMatch> readMatches(JsonNode payload) {
        List<OrganizationMatch> matches = new ArrayList<>();
        for (JsonNode node : payload.path("matches")) {
            try {
                matches.add(objectMapper.treeToValue(node, OrganizationMatch.class));
            } catch (JsonProcessingException e) {
                log.warn("org.cache.unreadable entry={} error={}", node, e.getMessage());
            }
        }
        return matches;
    }
}
