package com.talent.sourcing.query;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns a role title into title keywords: seniority prefixes are stripped and
 * known variations of the base role are added.
 */
public final class RoleKeywordExpander {

    private static final Pattern SENIORITY_WORDS = Pattern.compile(
            "\\b(senior|sr|junior|jr|staff|principal|lead|mid-level|entry|chief)\\b\\.?");

    private static final Map<String, List<String>> VARIATIONS = Map.of(
            "ml engineer", List.of("machine learning engineer", "ai engineer", "ml researcher"),
            "machine learning engineer", List.of("ml engineer", "ai engineer", "research scientist"),
            "data scientist", List.of("research scientist", "ml scientist", "ai scientist"),
            "research scientist", List.of("ml researcher", "ai researcher", "research engineer"),
            "software engineer", List.of("backend engineer", "full stack engineer", "platform engineer"),
            "product manager", List.of("technical product manager", "ai product manager"),
            "cto", List.of("chief technology officer", "vp engineering", "engineering director"),
            "ceo", List.of("chief executive officer", "founder", "co-founder"));

    private RoleKeywordExpander() {
    }

    /**
     * @return distinct lowercase keywords, base role first; empty for a blank title
     */
    public static List<String> expand(String roleTitle) {
        if (roleTitle == null || roleTitle.isBlank()) {
            return List.of();
        }
        String lower = roleTitle.toLowerCase(Locale.ROOT).trim();
        String base = SENIORITY_WORDS.matcher(lower).replaceAll(" ").trim().replaceAll("\\s+", " ");
        if (base.isEmpty()) {
            base = lower;
        }
        Set<String> keywords = new LinkedHashSet<>();
        keywords.add(base);
        keywords.addAll(VARIATIONS.getOrDefault(base, List.of()));
        return List.copyOf(keywords);
    }
}
