package com.talent.sourcing.similarity;

import java.util.Locale;

/**
 * Organization-name similarity used by fuzzy resolution.
 * <ul>
 *   <li>identical names score 1.0</li>
 *   <li>one name containing the other scores 0.9</li>
 *   <li>otherwise Levenshtein similarity, capped at 0.8</li>
 * </ul>
 * Names are lowercased, trimmed and whitespace-collapsed before comparison.
 */
public class OrganizationNameSimilarity implements SimilarityAlgorithm {

    static final double CONTAINMENT_SCORE = 0.9;
    static final double EDIT_DISTANCE_CAP = 0.8;

    private final LevenshteinSimilarity levenshtein = new LevenshteinSimilarity();

    @Override
    public double compute(String s1, String s2) {
        String a = clean(s1);
        String b = clean(s2);
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        if (a.equals(b)) {
            return 1.0;
        }
        if (a.contains(b) || b.contains(a)) {
            return CONTAINMENT_SCORE;
        }
        return Math.min(EDIT_DISTANCE_CAP, levenshtein.compute(a, b));
    }

    @Override
    public String getName() {
        return "OrganizationName";
    }

    private static String clean(String value) {
        if (value == null) {
            return "";
        }
        return value.toLowerCase(Locale.ROOT).trim().replaceAll("\\s+", " ");
    }
}
