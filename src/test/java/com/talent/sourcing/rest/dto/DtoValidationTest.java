package com.talent.sourcing.rest.dto;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.talent.sourcing.pipeline.CandidateRecord;
import com.talent.sourcing.pipeline.CollectionResult;
import com.talent.sourcing.pipeline.CreditLedger;
import com.talent.sourcing.pipeline.ItemFailure;
import com.talent.sourcing.pipeline.Requirements;
import com.talent.sourcing.pipeline.RunRequest;
import com.talent.sourcing.pipeline.SearchCriteria;
import com.talent.sourcing.query.Department;
import com.talent.sourcing.query.FilterSet;
import com.talent.sourcing.query.QueryStrategy;
import com.talent.sourcing.query.Seniority;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DtoValidationTest {

    // ========== StartRunRequest Tests ==========

    @Test
    @DisplayName("Should map seeds onto a run request")
    void testStartRunRequest() {
        StartRunRequest req = new StartRunRequest("search_1",
                List.of(new StartRunRequest.Seed("Acme", "acme.com"), new StartRunRequest.Seed("Globex", null)),
                true);

        RunRequest run = req.toRunRequest();

        assertEquals("search_1", run.getSessionId());
        assertEquals(2, run.getSeeds().size());
        assertTrue(run.isBypassCache());
    }

    @Test
    @DisplayName("Should reject StartRunRequest without seeds")
    void testStartRunRequestNoSeeds() {
        assertThrows(IllegalArgumentException.class, () -> new StartRunRequest(null, List.of(), false));
        assertThrows(IllegalArgumentException.class, () -> new StartRunRequest(null, null, false));
    }

    // ========== CriteriaRequest Tests ==========

    @Test
    @DisplayName("Should default missing criteria to BALANCED with no filters")
    void testDefaultCriteria() {
        SearchCriteria criteria = CriteriaRequest.toCriteria(null);

        assertEquals(QueryStrategy.BALANCED, criteria.strategy());
        assertTrue(criteria.required().isEmpty());
    }

    @Test
    @DisplayName("Should parse filters and strategy case-insensitively")
    void testCriteriaParsing() {
        CriteriaRequest req = new CriteriaRequest(
                new FilterRequest(List.of("o1"), null, "Data Engineer", "Berlin", "senior", "engineering"),
                null, " strict ");

        SearchCriteria criteria = req.toCriteria();
        FilterSet required = criteria.required();

        assertEquals(QueryStrategy.STRICT, criteria.strategy());
        assertEquals(List.of("o1"), required.getOrganizationIds());
        assertEquals("Data Engineer", required.getRole());
        assertEquals(Seniority.SENIOR, required.getSeniority());
        assertEquals(Department.ENGINEERING, required.getDepartment());
    }

    @Test
    @DisplayName("Should reject unknown strategy, seniority or department")
    void testCriteriaRejectsUnknownValues() {
        assertThrows(IllegalArgumentException.class,
                () -> new CriteriaRequest(null, null, "aggressive").toCriteria());
        assertThrows(IllegalArgumentException.class,
                () -> new FilterRequest(null, null, null, null, "wizard", null).toFilterSet());
        assertThrows(IllegalArgumentException.class,
                () -> new FilterRequest(null, null, null, null, null, "Astrology").toFilterSet());
    }

    // ========== RequirementsRequest Tests ==========

    @Test
    @DisplayName("Should convert criteria to weighted requirements")
    void testRequirementsRequest() {
        RequirementsRequest req = new RequirementsRequest("platform lead", List.of(
                new RequirementsRequest.Criterion("Kubernetes", 30),
                new RequirementsRequest.Criterion("Leadership", 20)));

        Requirements requirements = req.toRequirements();

        assertEquals(2, requirements.getCriteria().size());
        assertEquals(50.0, requirements.generalFitWeight(), 1e-9);
    }

    @Test
    @DisplayName("Should treat missing criteria as general fit only")
    void testRequirementsRequestWithoutCriteria() {
        assertEquals(100.0, new RequirementsRequest(null, null).toRequirements().generalFitWeight(), 1e-9);
    }

    // ========== Response Tests ==========

    @Test
    @DisplayName("Should expose credits and summary in CollectionResponse")
    void testCollectionResponse() {
        CandidateRecord record = new CandidateRecord("c1", new ObjectMapper().createObjectNode(), 3,
                CandidateRecord.Source.CACHE, Map.of());
        CollectionResult result = new CollectionResult("search_1", 0, 2, List.of(record),
                List.of(new ItemFailure("c2", 1, "ExternalFetchException", "503")), new CreditLedger(), 2, false);

        CollectionResponse response = CollectionResponse.from(result);

        assertEquals("1 of 2 collected, 1 failed", response.summary());
        assertEquals(0, response.credits().creditsSpent());
        assertEquals(2, response.nextOffset());
    }

    @Test
    @DisplayName("Should build error responses with their status")
    void testErrorResponses() {
        ErrorResponse conflict = ErrorResponse.conflict("wrong stage", "/api/v1/runs/s/collect",
                Map.of("stage", "PREVIEW"));

        assertEquals(409, conflict.status());
        assertEquals("PREVIEW", conflict.details().get("stage"));
        assertEquals(410, ErrorResponse.gone("cleared", "/p").status());
        assertNull(ErrorResponse.badRequest("bad", "/p").details());
    }
}
