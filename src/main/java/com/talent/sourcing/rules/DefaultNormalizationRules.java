package com.talent.sourcing.rules;

import java.util.List;

/**
 * Built-in organization-name rules: legal-suffix stripping, then punctuation
 * removal (hyphens kept) and whitespace collapsing.
 */
public final class DefaultNormalizationRules {

    private DefaultNormalizationRules() {
        // Utility class
    }

    public static NormalizationEngine createDefaultEngine() {
        NormalizationEngine engine = new NormalizationEngine();
        engine.addRules(getSuffixRules());
        engine.addRules(getCommonRules());
        return engine;
    }

    public static List<NormalizationRule> getSuffixRules() {
        return List.of(
                suffix("org-inc", "inc\\.?|incorporated"),
                suffix("org-llc", "llc\\.?|l\\.l\\.c\\."),
                suffix("org-ltd", "ltd\\.?|limited"),
                suffix("org-corp", "corp\\.?|corporation"),
                suffix("org-co", "co\\.?|company"),
                suffix("org-gmbh", "gmbh"),
                suffix("org-ag", "ag"),
                suffix("org-pte", "pte\\.?"),
                suffix("org-pty", "pty\\.?")
        );
    }

    public static List<NormalizationRule> getCommonRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("common-punctuation")
                        .pattern("[^\\p{L}\\p{N}\\s\\-]")
                        .replacement("")
                        .priority(100)
                        .build(),
                NormalizationRule.builder()
                        .name("common-collapse-spaces")
                        .pattern("\\s+")
                        .replacement(" ")
                        .priority(200)
                        .build()
        );
    }

    private static NormalizationRule suffix(String name, String alternatives) {
        return NormalizationRule.builder()
                .name(name)
                .pattern(",?\\s+(" + alternatives + ")$")
                .replacement("")
                .priority(10)
                .build();
    }
}
