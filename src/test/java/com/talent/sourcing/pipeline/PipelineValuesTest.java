package com.talent.sourcing.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Pipeline value Tests")
class PipelineValuesTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Nested
    @DisplayName("Requirements")
    class RequirementsTests {

        @Test
        @DisplayName("Should keep weights that fit and leave the rest to general fit")
        void keepsWeights() {
            Requirements requirements = Requirements.of("backend lead", List.of(
                    new WeightedRequirement("Java", 40),
                    new WeightedRequirement("Leadership", 20)));

            assertEquals(60.0, requirements.customWeight(), 1e-9);
            assertEquals(40.0, requirements.generalFitWeight(), 1e-9);
        }

        @Test
        @DisplayName("Should scale weights down when they exceed 95 percent")
        void rescales() {
            Requirements requirements = Requirements.of("", List.of(
                    new WeightedRequirement("Python", 60),
                    new WeightedRequirement("SQL", 60)));

            assertEquals(47.5, requirements.getCriteria().get(0).weight(), 1e-9);
            assertEquals(47.5, requirements.getCriteria().get(1).weight(), 1e-9);
            assertEquals(5.0, requirements.generalFitWeight(), 1e-9);
        }

        @Test
        @DisplayName("Should give general fit everything when there are no criteria")
        void generalFitOnly() {
            Requirements requirements = Requirements.generalFitOnly(null);

            assertEquals(100.0, requirements.generalFitWeight(), 1e-9);
            assertEquals("", requirements.getDescription());
        }

        @Test
        @DisplayName("Should reject blank names and negative weights")
        void invalidCriterion() {
            assertThrows(IllegalArgumentException.class, () -> new WeightedRequirement(" ", 10));
            assertThrows(IllegalArgumentException.class, () -> new WeightedRequirement("Go", -1));
        }
    }

    @Nested
    @DisplayName("EnrichmentPolicy")
    class EnrichmentPolicyTests {

        private final EnrichmentPolicy policy = EnrichmentPolicy.yearCutoff(2020);

        @Test
        @DisplayName("Should enrich experiences from the cutoff year on")
        void cutoff() {
            assertTrue(policy.shouldEnrich(experience().put("date_from_year", 2020)));
            assertTrue(policy.shouldEnrich(experience().put("date_from_year", "2023")));
            assertFalse(policy.shouldEnrich(experience().put("date_from_year", 2019)));
        }

        @Test
        @DisplayName("Should enrich when the start year is missing or unreadable")
        void unknownYear() {
            assertTrue(policy.shouldEnrich(experience()));
            assertTrue(policy.shouldEnrich(experience().putNull("date_from_year")));
            assertTrue(policy.shouldEnrich(experience().put("date_from_year", "present")));
        }

        @Test
        @DisplayName("Should never enrich with the never policy")
        void never() {
            assertFalse(EnrichmentPolicy.never().shouldEnrich(experience().put("date_from_year", 2024)));
        }

        private ObjectNode experience() {
            return mapper.createObjectNode().put("company_id", "o1");
        }
    }

    @Nested
    @DisplayName("Options and requests")
    class OptionsTests {

        @Test
        @DisplayName("Should expose the default limits")
        void defaults() {
            PipelineOptions options = PipelineOptions.defaults();

            assertEquals(100, options.getPreviewCap());
            assertEquals(1000, options.getIdCap());
            assertEquals(5, options.getConcurrency());
            assertEquals(5, options.getOrganizationBatchSize());
            assertEquals(2, options.getMaxAttempts());
        }

        @Test
        @DisplayName("Should reject non-positive limits")
        void invalid() {
            assertThrows(IllegalArgumentException.class, () -> PipelineOptions.builder().concurrency(0).build());
            assertThrows(IllegalArgumentException.class, () -> PipelineOptions.builder().idCap(-1).build());
            assertThrows(IllegalArgumentException.class, () -> PipelineOptions.builder().maxAttempts(0).build());
            assertThrows(IllegalArgumentException.class,
                    () -> PipelineOptions.builder().enrichmentPolicy(null).build());
        }

        @Test
        @DisplayName("Should require a seed and default the criteria")
        void runRequest() {
            assertThrows(IllegalArgumentException.class, () -> RunRequest.builder().sessionId("s").build());
            assertThrows(IllegalArgumentException.class,
                    () -> RunRequest.builder().sessionId(" ").seed("Acme", null).build());

            RunRequest request = RunRequest.builder().seed("Acme", "acme.com").build();

            assertNull(request.getSessionId());
            assertNotNull(request.getCriteria());
            assertNull(request.getRequirements());
            assertFalse(request.isBypassCache());
        }

        @Test
        @DisplayName("Should not allow cancelling the shared token")
        void cancellation() {
            CancellationToken token = CancellationToken.create();
            token.cancel();

            assertTrue(token.isCancelled());
            assertFalse(CancellationToken.none().isCancelled());
            assertThrows(UnsupportedOperationException.class, () -> CancellationToken.none().cancel());
        }

        @Test
        @DisplayName("Should summarize a collection page")
        void summaries() {
            CollectionResult result = new CollectionResult("s", 0, 3, List.of(),
                    List.of(new ItemFailure("c1", 1, "ExternalFetchException", "boom")),
                    new CreditLedger(), 3, false);

            assertEquals("0 of 3 collected, 1 failed", result.summary());
            assertEquals(1, result.processed());
        }
    }

    @Nested
    @DisplayName("BoundedExecutor")
    class BoundedExecutorTests {

        @Test
        @DisplayName("Should return results in input order")
        void ordered() {
            try (BoundedExecutor executor = new BoundedExecutor(4, "test")) {
                List<Integer> results = executor.mapOrdered(List.of(5, 1, 4, 2, 3), n -> {
                    sleep(n * 5L);
                    return n * 10;
                });

                assertEquals(List.of(50, 10, 40, 20, 30), results);
            }
        }

        @Test
        @DisplayName("Should run on named worker threads")
        void namedThreads() {
            Set<String> names = ConcurrentHashMap.newKeySet();
            try (BoundedExecutor executor = new BoundedExecutor(2, "collector")) {
                executor.mapOrdered(List.of(1, 2, 3, 4), n -> names.add(Thread.currentThread().getName()));
            }

            assertFalse(names.isEmpty());
            assertTrue(names.stream().allMatch(name -> name.startsWith("collector-")));
        }

        @Test
        @DisplayName("Should rethrow a task failure unwrapped")
        void failure() {
            try (BoundedExecutor executor = new BoundedExecutor(2, "test")) {
                IllegalStateException e = assertThrows(IllegalStateException.class,
                        () -> executor.mapOrdered(List.of(1, 2, 3), n -> {
                            if (n == 2) {
                                throw new IllegalStateException("task " + n);
                            }
                            return n;
                        }));
                assertEquals("task 2", e.getMessage());
            }
        }

        @Test
        @DisplayName("Should reject a non-positive parallelism")
        void invalid() {
            assertThrows(IllegalArgumentException.class, () -> new BoundedExecutor(0, "test"));
        }

        private void sleep(long millis) {
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
