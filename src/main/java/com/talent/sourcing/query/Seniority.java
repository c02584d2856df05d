package com.talent.sourcing.query;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Seniority bands. Management bands map to an exact management-level term;
 * individual-contributor bands match either a title keyword or a tenure range.
 */
public enum Seniority {
    INTERN(null, List.of("intern"), 0, 1),
    JUNIOR(null, List.of("junior", "associate"), 0, 3),
    MID(null, List.of(), 2, 6),
    SENIOR(null, List.of("senior", "sr"), 5, null),
    STAFF(null, List.of("staff"), 8, null),
    PRINCIPAL(null, List.of("principal"), 10, null),
    MANAGER("Manager", List.of(), null, null),
    DIRECTOR("Director", List.of(), null, null),
    EXECUTIVE("C-Level", List.of(), null, null);

    private static final Map<String, Seniority> ALIASES = Map.ofEntries(
            Map.entry("c-level", EXECUTIVE),
            Map.entry("executive", EXECUTIVE),
            Map.entry("ceo", EXECUTIVE),
            Map.entry("cto", EXECUTIVE),
            Map.entry("cfo", EXECUTIVE),
            Map.entry("vp", EXECUTIVE),
            Map.entry("vice president", EXECUTIVE),
            Map.entry("director", DIRECTOR),
            Map.entry("manager", MANAGER),
            Map.entry("principal", PRINCIPAL),
            Map.entry("staff", STAFF),
            Map.entry("senior", SENIOR),
            Map.entry("lead", SENIOR),
            Map.entry("mid", MID),
            Map.entry("mid-level", MID),
            Map.entry("mid level", MID),
            Map.entry("junior", JUNIOR),
            Map.entry("entry", JUNIOR),
            Map.entry("intern", INTERN),
            Map.entry("internship", INTERN));

    private final String managementLevel;
    private final List<String> titleKeywords;
    private final Integer minYears;
    private final Integer maxYears;

    Seniority(String managementLevel, List<String> titleKeywords, Integer minYears, Integer maxYears) {
        this.managementLevel = managementLevel;
        this.titleKeywords = titleKeywords;
        this.minYears = minYears;
        this.maxYears = maxYears;
    }

    public boolean isManagement() {
        return managementLevel != null;
    }

    /**
     * Provider management-level value; {@code null} for individual-contributor bands.
     */
    public String managementLevel() {
        return managementLevel;
    }

    public List<String> titleKeywords() {
        return titleKeywords;
    }

    public Integer minYears() {
        return minYears;
    }

    public Integer maxYears() {
        return maxYears;
    }

    /**
     * Parses a free-text seniority such as "Senior", "VP" or "mid-level".
     */
    public static Optional<Seniority> fromText(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        Seniority alias = ALIASES.get(normalized);
        if (alias != null) {
            return Optional.of(alias);
        }
        for (Seniority value : values()) {
            if (value.name().equalsIgnoreCase(normalized)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
