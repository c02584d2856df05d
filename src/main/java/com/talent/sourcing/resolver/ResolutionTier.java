package com.talent.sourcing.resolver;

/**
 * Resolution tiers in the order they are attempted.
 */
public enum ResolutionTier {
    EXACT_KEY(1, ResolutionMethod.WEBSITE_LOOKUP),
    EXACT_NAME(2, ResolutionMethod.EXACT_NAME),
    FUZZY(3, ResolutionMethod.FUZZY_NAME);

    private final int number;
    private final ResolutionMethod method;

    ResolutionTier(int number, ResolutionMethod method) {
        this.number = number;
        this.method = method;
    }

    public int number() {
        return number;
    }

    public ResolutionMethod method() {
        return method;
    }
}
