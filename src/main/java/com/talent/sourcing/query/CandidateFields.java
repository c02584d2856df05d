package com.talent.sourcing.query;

/**
 * Candidate index field names targeted by query clauses.
 */
public final class CandidateFields {

    public static final String ORGANIZATION_ID = "last_company_id";
    public static final String ORGANIZATION_NAME = "experience.company_name";
    public static final String TITLE = "active_experience_title";
    public static final String HEADLINE = "headline";
    public static final String LOCATION = "location_full";
    public static final String MANAGEMENT_LEVEL = "active_experience_management_level";
    public static final String DEPARTMENT = "active_experience_department";
    public static final String EXPERIENCE_MONTHS = "total_experience_duration_months";

    private CandidateFields() {
    }
}
