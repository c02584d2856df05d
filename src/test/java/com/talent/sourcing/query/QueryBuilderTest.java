package com.talent.sourcing.query;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Query Building Tests")
class QueryBuilderTest {

    private final QueryBuilder builder = new QueryBuilder();

    private static final FilterSet ACME = FilterSet.builder().organizationId("org-1").build();

    private static FilterSet roleLocationSeniority() {
        return FilterSet.builder()
                .role("Senior ML Engineer")
                .location("San Francisco")
                .seniority(Seniority.SENIOR)
                .build();
    }

    private static <T extends QueryClause> T find(List<QueryClause> clauses, FilterDimension dimension, Class<T> type) {
        return clauses.stream()
                .filter(c -> c.dimension() == dimension)
                .map(type::cast)
                .findFirst()
                .orElseThrow(() -> new AssertionError("no " + dimension + " clause"));
    }

    @Nested
    @DisplayName("Strategies")
    class Strategies {

        @Test
        @DisplayName("Should require every supplied filter under STRICT")
        void strict() {
            StructuredQuery query = builder.build(ACME, roleLocationSeniority(), QueryStrategy.STRICT);

            assertTrue(query.isRequired(FilterDimension.ROLE));
            assertTrue(query.isRequired(FilterDimension.LOCATION));
            assertTrue(query.isRequired(FilterDimension.SENIORITY));
            assertTrue(query.boosts().isEmpty());
        }

        @Test
        @DisplayName("Should only boost role, location and seniority under BROAD")
        void broad() {
            FilterSet filters = roleLocationSeniority().withOrganizations(List.of("org-1"), List.of());

            StructuredQuery query = builder.build(filters, QueryStrategy.BROAD);

            assertTrue(query.isBoost(FilterDimension.ROLE));
            assertTrue(query.isBoost(FilterDimension.LOCATION));
            assertTrue(query.isBoost(FilterDimension.SENIORITY));
            assertEquals(1, query.required().size());
            assertTrue(query.isRequired(FilterDimension.ORGANIZATION));
        }

        @Test
        @DisplayName("Should require role and boost location under BALANCED")
        void balanced() {
            StructuredQuery query = builder.build(ACME, roleLocationSeniority(), QueryStrategy.BALANCED);

            assertTrue(query.isRequired(FilterDimension.ROLE));
            assertTrue(query.isBoost(FilterDimension.LOCATION));
            assertTrue(query.isBoost(FilterDimension.SENIORITY));
        }

        @Test
        @DisplayName("Should keep caller-required seniority required under BALANCED")
        void balancedRequiredSeniority() {
            FilterSet required = FilterSet.builder().organizationId("org-1").seniority(Seniority.DIRECTOR).build();

            StructuredQuery query = builder.build(required, FilterSet.empty(), QueryStrategy.BALANCED);

            TermClause seniority = find(query.required(), FilterDimension.SENIORITY, TermClause.class);
            assertEquals(CandidateFields.MANAGEMENT_LEVEL, seniority.field());
            assertEquals("Director", seniority.value());
        }

        @Test
        @DisplayName("Should require department even when optional under BROAD")
        void departmentAlwaysRequired() {
            FilterSet optional = FilterSet.builder().department(Department.DATA_SCIENCE).build();

            StructuredQuery query = builder.build(ACME, optional, QueryStrategy.BROAD);

            TermClause department = find(query.required(), FilterDimension.DEPARTMENT, TermClause.class);
            assertEquals("Data Science", department.value());
        }

        @Test
        @DisplayName("Should refuse filters that name no organization")
        void noOrganization() {
            assertThrows(IllegalArgumentException.class,
                    () -> builder.build(FilterSet.empty(), QueryStrategy.BALANCED));
            assertThrows(IllegalArgumentException.class,
                    () -> builder.build(FilterSet.empty(), roleLocationSeniority(), QueryStrategy.BROAD));
        }

        @Test
        @DisplayName("Should build an organization-only query")
        void organizationOnly() {
            StructuredQuery query = builder.build(ACME, QueryStrategy.BALANCED);

            TermsClause clause = find(query.required(), FilterDimension.ORGANIZATION, TermsClause.class);
            assertEquals(List.of("org-1"), clause.values());
            assertEquals(1, query.required().size());
            assertTrue(query.boosts().isEmpty());
        }
    }

    @Nested
    @DisplayName("Organization clause")
    class Organizations {

        @Test
        @DisplayName("Should match ids or names when both are supplied")
        void idsOrNames() {
            FilterSet required = FilterSet.builder()
                    .organizationIds(List.of("org-1", "org-2"))
                    .organizationName("Qwxzy Corp")
                    .build();

            StructuredQuery query = builder.build(required, FilterSet.empty(), QueryStrategy.BROAD);

            AnyOfClause clause = find(query.required(), FilterDimension.ORGANIZATION, AnyOfClause.class);
            TermsClause byId = (TermsClause) clause.clauses().get(0);
            TermsClause byName = (TermsClause) clause.clauses().get(1);
            assertEquals(CandidateFields.ORGANIZATION_ID, byId.field());
            assertEquals(List.of("org-1", "org-2"), byId.values());
            assertEquals(List.of("Qwxzy Corp"), byName.values());
        }

        @Test
        @DisplayName("Should merge required and optional organizations without duplicates")
        void merged() {
            FilterSet required = FilterSet.builder().organizationId("org-1").build();
            FilterSet optional = FilterSet.builder().organizationIds(List.of("org-1", "org-3")).build();

            StructuredQuery query = builder.build(required, optional, QueryStrategy.BROAD);

            TermsClause clause = find(query.required(), FilterDimension.ORGANIZATION, TermsClause.class);
            assertEquals(List.of("org-1", "org-3"), clause.values());
        }

        @Test
        @DisplayName("Should keep other filters when organizations are replaced")
        void withOrganizations() {
            FilterSet replaced = roleLocationSeniority().withOrganizations(List.of("org-9"), List.of());

            assertEquals(List.of("org-9"), replaced.getOrganizationIds());
            assertEquals("Senior ML Engineer", replaced.getRole());
            assertEquals(Seniority.SENIOR, replaced.getSeniority());
        }
    }

    @Nested
    @DisplayName("Field precedence")
    class Precedence {

        @Test
        @DisplayName("Should take a field from the required set when supplied twice")
        void requiredWins() {
            FilterSet required = FilterSet.builder().organizationId("org-1").role("Data Scientist").build();
            FilterSet optional = FilterSet.builder().role("Accountant").build();

            StructuredQuery query = builder.build(required, optional, QueryStrategy.BALANCED);

            KeywordClause role = find(query.required(), FilterDimension.ROLE, KeywordClause.class);
            assertEquals("data scientist", role.keywords().get(0));
            assertFalse(role.keywords().contains("accountant"));
        }
    }

    @Nested
    @DisplayName("Seniority clauses")
    class SeniorityClauses {

        @Test
        @DisplayName("Should combine title keywords and tenure for senior")
        void senior() {
            AnyOfClause clause = (AnyOfClause) QueryBuilder.seniorityClause(Seniority.SENIOR);

            KeywordClause keywords = (KeywordClause) clause.clauses().get(0);
            RangeClause range = (RangeClause) clause.clauses().get(1);
            assertEquals(List.of("senior", "sr"), keywords.keywords());
            assertEquals(60, range.gte());
            assertNull(range.lte());
        }

        @Test
        @DisplayName("Should use only tenure for mid-level")
        void mid() {
            AnyOfClause clause = (AnyOfClause) QueryBuilder.seniorityClause(Seniority.MID);

            assertEquals(1, clause.clauses().size());
            RangeClause range = (RangeClause) clause.clauses().get(0);
            assertEquals(24, range.gte());
            assertEquals(72, range.lte());
        }

        @Test
        @DisplayName("Should map executives to the C-Level management term")
        void executive() {
            TermClause clause = (TermClause) QueryBuilder.seniorityClause(Seniority.EXECUTIVE);
            assertEquals("C-Level", clause.value());
        }
    }

    @Nested
    @DisplayName("Expanders")
    class Expanders {

        @Test
        @DisplayName("Should strip seniority words and add role variations")
        void roleVariations() {
            assertEquals(List.of("ml engineer", "machine learning engineer", "ai engineer", "ml researcher"),
                    RoleKeywordExpander.expand("Senior ML Engineer"));
        }

        @Test
        @DisplayName("Should strip abbreviated seniority with a trailing dot")
        void abbreviatedSeniority() {
            assertEquals("software engineer", RoleKeywordExpander.expand("Sr. Software Engineer").get(0));
        }

        @Test
        @DisplayName("Should keep a title made only of seniority words")
        void onlySeniority() {
            assertEquals(List.of("lead"), RoleKeywordExpander.expand("Lead"));
            assertTrue(RoleKeywordExpander.expand(" ").isEmpty());
        }

        @Test
        @DisplayName("Should expand metro areas and pass unknown places through")
        void locations() {
            assertTrue(LocationExpander.expand("San Francisco, CA").contains("palo alto"));
            assertEquals(List.of("lisbon"), LocationExpander.expand("Lisbon"));
            assertTrue(LocationExpander.expand(null).isEmpty());
        }

        @Test
        @DisplayName("Should parse free-text seniority aliases")
        void seniorityText() {
            assertEquals(Optional.of(Seniority.EXECUTIVE), Seniority.fromText("VP"));
            assertEquals(Optional.of(Seniority.MID), Seniority.fromText("Mid-Level"));
            assertEquals(Optional.of(Seniority.PRINCIPAL), Seniority.fromText("PRINCIPAL"));
            assertTrue(Seniority.fromText("wizard").isEmpty());
        }

        @Test
        @DisplayName("Should infer departments from whole words only")
        void departments() {
            assertEquals(Optional.of(Department.ENGINEERING), Department.infer("Senior Software Engineer"));
            assertEquals(Optional.of(Department.HUMAN_RESOURCES), Department.infer("Recruiter"));
            assertEquals(Optional.of(Department.ENGINEERING), Department.infer("Technical Recruiter"));
            assertEquals(Optional.of(Department.C_SUITE), Department.infer("CFO"));
            assertTrue(Department.infer("Painter").isEmpty());
            assertEquals(Optional.of(Department.FINANCE), Department.fromLabel("finance & accounting"));
        }
    }
}
