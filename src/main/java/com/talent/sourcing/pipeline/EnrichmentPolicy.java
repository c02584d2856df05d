package com.talent.sourcing.pipeline;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Decides whether the organization behind one experience entry is worth a metered fetch.
 */
@FunctionalInterface
public interface EnrichmentPolicy {

    int DEFAULT_MIN_YEAR = 2020;

    boolean shouldEnrich(JsonNode experience);

    /**
     * Enriches experiences that started in or after {@code minYear}. Experiences with a
     * missing or unparseable start year are enriched.
     */
    static EnrichmentPolicy yearCutoff(int minYear) {
        return experience -> {
            JsonNode year = experience.path("date_from_year");
            if (year.isMissingNode() || year.isNull()) {
                return true;
            }
            if (year.canConvertToInt()) {
                return year.asInt() >= minYear;
            }
            try {
                return Integer.parseInt(year.asText().trim()) >= minYear;
            } catch (NumberFormatException e) {
                return true;
            }
        };
    }

    static EnrichmentPolicy never() {
        return experience -> false;
    }
}
