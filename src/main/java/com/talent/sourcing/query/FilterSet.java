package com.talent.sourcing.query;

import java.util.ArrayList;
import java.util.List;

/**
 * Candidate filters supplied by the caller. Any field may be absent.
 */
public class FilterSet {

    private final List<String> organizationIds;
    private final List<String> organizationNames;
    private final String role;
    private final String location;
    private final Seniority seniority;
    private final Department department;

    private FilterSet(Builder builder) {
        this.organizationIds = List.copyOf(builder.organizationIds);
        this.organizationNames = List.copyOf(builder.organizationNames);
        this.role = blankToNull(builder.role);
        this.location = blankToNull(builder.location);
        this.seniority = builder.seniority;
        this.department = builder.department;
    }

    public static FilterSet empty() {
        return builder().build();
    }

    public List<String> getOrganizationIds() {
        return organizationIds;
    }

    public List<String> getOrganizationNames() {
        return organizationNames;
    }

    public String getRole() {
        return role;
    }

    public String getLocation() {
        return location;
    }

    public Seniority getSeniority() {
        return seniority;
    }

    public Department getDepartment() {
        return department;
    }

    public boolean isEmpty() {
        return organizationIds.isEmpty() && organizationNames.isEmpty()
                && role == null && location == null && seniority == null && department == null;
    }

    /**
     * A copy of these filters with the organization filters replaced.
     */
    public FilterSet withOrganizations(List<String> ids, List<String> names) {
        return builder()
                .organizationIds(ids)
                .organizationNames(names)
                .role(role)
                .location(location)
                .seniority(seniority)
                .department(department)
                .build();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<String> organizationIds = new ArrayList<>();
        private final List<String> organizationNames = new ArrayList<>();
        private String role;
        private String location;
        private Seniority seniority;
        private Department department;

        public Builder organizationId(String id) {
            this.organizationIds.add(id);
            return this;
        }

        public Builder organizationIds(List<String> ids) {
            this.organizationIds.addAll(ids);
            return this;
        }

        public Builder organizationName(String name) {
            this.organizationNames.add(name);
            return this;
        }

        public Builder organizationNames(List<String> names) {
            this.organizationNames.addAll(names);
            return this;
        }

        public Builder role(String role) {
            this.role = role;
            return this;
        }

        public Builder location(String location) {
            this.location = location;
            return this;
        }

        public Builder seniority(Seniority seniority) {
            this.seniority = seniority;
            return this;
        }

        public Builder department(Department department) {
            this.department = department;
            return this;
        }

        public FilterSet build() {
            return new FilterSet(this);
        }
    }
}
