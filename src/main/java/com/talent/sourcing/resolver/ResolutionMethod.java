package com.talent.sourcing.resolver;

/**
 * How an organization name was resolved to a canonical id.
 */
public enum ResolutionMethod {
    WEBSITE_LOOKUP,
    EXACT_NAME,
    FUZZY_NAME,
    /** No tier produced a match; the entity is kept for manual resolution. */
    UNRESOLVED
}
