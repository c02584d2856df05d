package com.talent.sourcing.rest.dto;

import com.talent.sourcing.query.Department;
import com.talent.sourcing.query.FilterSet;
import com.talent.sourcing.query.Seniority;

import java.util.List;

/**
 * Candidate filters as sent by clients. Seniority and department are free text.
 */
public record FilterRequest(
        List<String> organizationIds,
        List<String> organizationNames,
        String role,
        String location,
        String seniority,
        String department
) {
    /**
     * @throws IllegalArgumentException for an unknown seniority or department
     */
    public FilterSet toFilterSet() {
        FilterSet.Builder builder = FilterSet.builder()
                .role(role)
                .location(location);
        if (organizationIds != null) {
            builder.organizationIds(organizationIds);
        }
        if (organizationNames != null) {
            builder.organizationNames(organizationNames);
        }
        if (seniority != null && !seniority.isBlank()) {
            builder.seniority(Seniority.fromText(seniority)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown seniority: " + seniority)));
        }
        if (department != null && !department.isBlank()) {
            builder.department(Department.fromLabel(department)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown department: " + department)));
        }
        return builder.build();
    }
}
