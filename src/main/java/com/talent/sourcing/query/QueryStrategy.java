package com.talent.sourcing.query;

/**
 * How aggressively optional filters are turned into hard requirements.
 * Organization and department filters are required under every strategy.
 */
public enum QueryStrategy {
    /** Every supplied filter is required. */
    STRICT,
    /** Role required, location boosted, seniority as the caller classified it. */
    BALANCED,
    /** Role, location and seniority only boost. */
    BROAD
}
