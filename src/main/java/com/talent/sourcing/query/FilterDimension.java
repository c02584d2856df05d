package com.talent.sourcing.query;

/**
 * The requirement a query clause expresses.
 */
public enum FilterDimension {
    ORGANIZATION,
    ROLE,
    LOCATION,
    SENIORITY,
    DEPARTMENT
}
