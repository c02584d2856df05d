package com.talent.sourcing.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Builds a {@link StructuredQuery} from required and optional filters.
 *
 * <p>Placement rules:</p>
 * <ul>
 *   <li>organization membership is mandatory and always required</li>
 *   <li>department is always required</li>
 *   <li>{@link QueryStrategy#STRICT}: every supplied filter is required</li>
 *   <li>{@link QueryStrategy#BALANCED}: role required, location boosted, seniority
 *       required only when the caller put it in the required set</li>
 *   <li>{@link QueryStrategy#BROAD}: role, location and seniority are boosts</li>
 * </ul>
 * A field supplied in both sets is taken from the required set.
 */
public class QueryBuilder {
    private static final Logger log = LoggerFactory.getLogger(QueryBuilder.class);

    private static final List<String> TITLE_FIELDS = List.of(CandidateFields.TITLE, CandidateFields.HEADLINE);

    /**
     * Builds a query treating every filter as caller-required.
     */
    public StructuredQuery build(FilterSet filters, QueryStrategy strategy) {
        return build(filters, FilterSet.empty(), strategy);
    }

    /**
     * @throws IllegalArgumentException when neither set names an organization id or name
     */
    public StructuredQuery build(FilterSet required, FilterSet optional, QueryStrategy strategy) {
        Objects.requireNonNull(required, "required filters are required");
        Objects.requireNonNull(optional, "optional filters are required");
        Objects.requireNonNull(strategy, "strategy is required");

        List<QueryClause> must = new ArrayList<>();
        List<QueryClause> should = new ArrayList<>();

        must.add(organizationClause(required, optional)
                .orElseThrow(() -> new IllegalArgumentException("A candidate query needs at least one organization")));

        Department department = required.getDepartment() != null
                ? required.getDepartment() : optional.getDepartment();
        if (department != null) {
            must.add(new TermClause(FilterDimension.DEPARTMENT, CandidateFields.DEPARTMENT, department.label()));
        }

        String role = required.getRole() != null ? required.getRole() : optional.getRole();
        List<String> roleKeywords = RoleKeywordExpander.expand(role);
        if (!roleKeywords.isEmpty()) {
            QueryClause clause = new KeywordClause(FilterDimension.ROLE, TITLE_FIELDS, roleKeywords);
            (strategy == QueryStrategy.BROAD ? should : must).add(clause);
        }

        String location = required.getLocation() != null ? required.getLocation() : optional.getLocation();
        List<String> locationTerms = LocationExpander.expand(location);
        if (!locationTerms.isEmpty()) {
            QueryClause clause = new KeywordClause(FilterDimension.LOCATION,
                    List.of(CandidateFields.LOCATION), locationTerms);
            (strategy == QueryStrategy.STRICT ? must : should).add(clause);
        }

        boolean seniorityRequiredByCaller = required.getSeniority() != null;
        Seniority seniority = seniorityRequiredByCaller ? required.getSeniority() : optional.getSeniority();
        if (seniority != null) {
            boolean hard = switch (strategy) {
                case STRICT -> true;
                case BALANCED -> seniorityRequiredByCaller;
                case BROAD -> false;
            };
            (hard ? must : should).add(seniorityClause(seniority));
        }

        StructuredQuery query = new StructuredQuery(must, should);
        log.debug("query.built strategy={} required={} boosts={}", strategy, must.size(), should.size());
        return query;
    }

    private Optional<QueryClause> organizationClause(FilterSet required, FilterSet optional) {
        Set<String> ids = new LinkedHashSet<>(required.getOrganizationIds());
        ids.addAll(optional.getOrganizationIds());
        Set<String> names = new LinkedHashSet<>(required.getOrganizationNames());
        names.addAll(optional.getOrganizationNames());

        QueryClause byId = ids.isEmpty() ? null
                : new TermsClause(FilterDimension.ORGANIZATION, CandidateFields.ORGANIZATION_ID, List.copyOf(ids));
        QueryClause byName = names.isEmpty() ? null
                : new TermsClause(FilterDimension.ORGANIZATION, CandidateFields.ORGANIZATION_NAME, List.copyOf(names));

        if (byId != null && byName != null) {
            return Optional.of(new AnyOfClause(FilterDimension.ORGANIZATION, List.of(byId, byName)));
        }
        return Optional.ofNullable(byId != null ? byId : byName);
    }

    static QueryClause seniorityClause(Seniority seniority) {
        if (seniority.isManagement()) {
            return new TermClause(FilterDimension.SENIORITY, CandidateFields.MANAGEMENT_LEVEL,
                    seniority.managementLevel());
        }
        List<QueryClause> alternatives = new ArrayList<>();
        if (!seniority.titleKeywords().isEmpty()) {
            alternatives.add(new KeywordClause(FilterDimension.SENIORITY, TITLE_FIELDS, seniority.titleKeywords()));
        }
        alternatives.add(new RangeClause(FilterDimension.SENIORITY, CandidateFields.EXPERIENCE_MONTHS,
                toMonths(seniority.minYears()), toMonths(seniority.maxYears())));
        return new AnyOfClause(FilterDimension.SENIORITY, alternatives);
    }

    private static Integer toMonths(Integer years) {
        return years != null ? years * 12 : null;
    }
}
