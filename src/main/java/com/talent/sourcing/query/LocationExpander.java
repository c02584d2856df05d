package com.talent.sourcing.query;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Expands a location to the metro-area terms a candidate's location may contain.
 * Unknown locations expand to themselves.
 */
public final class LocationExpander {

    private static final List<String> BAY_AREA = List.of("san francisco", "bay area", "palo alto",
            "mountain view", "sunnyvale", "menlo park", "redwood city", "san mateo", "san jose",
            "los altos", "san carlos", "cupertino", "oakland", "berkeley", "fremont");
    private static final List<String> NEW_YORK = List.of("new york", "manhattan", "brooklyn", "nyc");

    private static final Map<String, List<String>> EXPANSIONS = new LinkedHashMap<>();

    static {
        EXPANSIONS.put("san francisco", BAY_AREA);
        EXPANSIONS.put("bay area", BAY_AREA);
        EXPANSIONS.put("silicon valley", BAY_AREA);
        EXPANSIONS.put("seattle", List.of("seattle", "bellevue", "redmond", "kirkland"));
        EXPANSIONS.put("new york", NEW_YORK);
        EXPANSIONS.put("nyc", NEW_YORK);
        EXPANSIONS.put("boston", List.of("boston", "cambridge", "somerville"));
        EXPANSIONS.put("austin", List.of("austin", "texas"));
        EXPANSIONS.put("los angeles", List.of("los angeles", "santa monica", "pasadena"));
        EXPANSIONS.put("chicago", List.of("chicago", "illinois"));
        EXPANSIONS.put("denver", List.of("denver", "colorado"));
        EXPANSIONS.put("miami", List.of("miami", "florida"));
        EXPANSIONS.put("remote", List.of("remote", "united states"));
    }

    private LocationExpander() {
    }

    /**
     * @return lowercase location terms, empty for a blank location
     */
    public static List<String> expand(String location) {
        if (location == null || location.isBlank()) {
            return List.of();
        }
        String normalized = location.trim().toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> entry : EXPANSIONS.entrySet()) {
            if (normalized.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return List.of(normalized);
    }
}
