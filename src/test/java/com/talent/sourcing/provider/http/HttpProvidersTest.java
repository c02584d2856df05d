package com.talent.sourcing.provider.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.talent.sourcing.pipeline.CandidateRecord;
import com.talent.sourcing.pipeline.Requirements;
import com.talent.sourcing.pipeline.WeightedRequirement;
import com.talent.sourcing.provider.CandidateScore;
import com.talent.sourcing.provider.ExternalFetchException;
import com.talent.sourcing.provider.ExternalFetchTimeoutException;
import com.talent.sourcing.provider.OrganizationMatch;
import com.talent.sourcing.query.StructuredQuery;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("HTTP provider Tests")
class HttpProvidersTest {

    private static final String BASE_URL = "https://api.test/v2";

    private final ObjectMapper mapper = new ObjectMapper();
    private HttpClient httpClient;

    @BeforeEach
    void setUp() {
        httpClient = mock(HttpClient.class);
    }

    @SuppressWarnings("unchecked")
    private void respond(int status, String body) throws Exception {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenReturn(response);
    }

    private HttpRequest sentRequest() throws Exception {
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any());
        return captor.getValue();
    }

    private JsonHttpClient client(String baseUrl, String apiKey) {
        return new JsonHttpClient(baseUrl, apiKey, Duration.ofSeconds(5), httpClient, mapper);
    }

    @Nested
    @DisplayName("JsonHttpClient")
    class JsonHttpClientTests {

        @Test
        @DisplayName("Should send a bearer token and join paths without doubled slashes")
        void bearerAuth() throws Exception {
            respond(200, "{\"ok\":true}");

            JsonNode body = client(BASE_URL + "/", "secret").get("/status");

            assertTrue(body.path("ok").asBoolean());
            HttpRequest request = sentRequest();
            assertEquals("GET", request.method());
            assertEquals(BASE_URL + "/status", request.uri().toString());
            assertEquals(Optional.of("Bearer secret"), request.headers().firstValue("Authorization"));
            assertEquals(Optional.of("application/json"), request.headers().firstValue("Accept"));
            assertEquals(Optional.of(Duration.ofSeconds(5)), request.timeout());
        }

        @Test
        @DisplayName("Should omit the authorization header without an API key")
        void noApiKey() throws Exception {
            respond(200, "[]");

            client(BASE_URL, "").post("/search", mapper.createObjectNode());

            HttpRequest request = sentRequest();
            assertEquals("POST", request.method());
            assertTrue(request.headers().firstValue("Authorization").isEmpty());
            assertEquals(Optional.of("application/json"), request.headers().firstValue("Content-Type"));
        }

        @Test
        @DisplayName("Should carry the status of a non-2xx response")
        void errorStatus() throws Exception {
            respond(429, "{\"error\":\"rate limited\"}");

            ExternalFetchException e = assertThrows(ExternalFetchException.class,
                    () -> client(BASE_URL, "k").get("/employee_clean/collect/c1"));

            assertEquals(429, e.getStatusCode());
            assertTrue(e.getMessage().contains("GET /v2/employee_clean/collect/c1"));
        }

        @Test
        @DisplayName("Should report a timeout as a timeout")
        void timeout() throws Exception {
            when(httpClient.send(any(), any())).thenThrow(new HttpTimeoutException("slow"));

            ExternalFetchTimeoutException e = assertThrows(ExternalFetchTimeoutException.class,
                    () -> client(BASE_URL, "k").get("/slow"));

            assertTrue(e.getMessage().contains("5000ms"));
        }

        @Test
        @DisplayName("Should wrap connection failures")
        void ioFailure() throws Exception {
            IOException cause = new IOException("connection reset");
            when(httpClient.send(any(), any())).thenThrow(cause);

            ExternalFetchException e = assertThrows(ExternalFetchException.class,
                    () -> client(BASE_URL, "k").get("/x"));

            assertSame(cause, e.getCause());
            assertFalse(e instanceof ExternalFetchTimeoutException);
        }

        @Test
        @DisplayName("Should reject an unreadable body")
        void badJson() throws Exception {
            respond(200, "<html>gateway</html>");

            ExternalFetchException e = assertThrows(ExternalFetchException.class,
                    () -> client(BASE_URL, "k").get("/x"));

            assertEquals(200, e.getStatusCode());
        }
    }

    @Nested
    @DisplayName("HttpCandidateSearchProvider")
    class CandidateProviderTests {

        private HttpCandidateSearchProvider provider;

        @BeforeEach
        void setUp() {
            provider = HttpCandidateSearchProvider.builder()
                    .baseUrl(BASE_URL)
                    .apiKey("k")
                    .httpClient(httpClient)
                    .build();
        }

        @Test
        @DisplayName("Should post the rendered query and cap the ids")
        void searchIds() throws Exception {
            respond(200, "[101, 102, 103, 104]");

            List<String> ids = provider.searchIds(new StructuredQuery(List.of(), List.of()), 3);

            assertEquals(List.of("101", "102", "103"), ids);
            HttpRequest request = sentRequest();
            assertEquals("POST", request.method());
            assertEquals("/v2/employee_clean/search/es_dsl", request.uri().getPath());
        }

        @Test
        @DisplayName("Should turn numeric preview ids into text")
        void preview() throws Exception {
            respond(200, "[{\"id\": 7, \"full_name\": \"Ada\"}, {\"id\": \"8\"}]");

            List<JsonNode> records = provider.preview(new StructuredQuery(List.of(), List.of()), 10);

            assertEquals(2, records.size());
            assertTrue(records.get(0).get("id").isTextual());
            assertEquals("7", records.get(0).get("id").asText());
            assertEquals("/v2/employee_clean/search/es_dsl/preview", sentRequest().uri().getPath());
        }

        @Test
        @DisplayName("Should escape ids in collect paths")
        void fetchRecord() throws Exception {
            respond(200, "{\"id\": \"abc/1\"}");

            JsonNode record = provider.fetchRecord("abc/1");

            assertEquals("abc/1", record.get("id").asText());
            assertEquals(BASE_URL + "/employee_clean/collect/abc%2F1", sentRequest().uri().toString());
        }

        @Test
        @DisplayName("Should fetch organizations from the company endpoint")
        void fetchOrganization() throws Exception {
            respond(200, "{\"id\": \"o1\", \"name\": \"Acme\"}");

            assertEquals("Acme", provider.fetchOrganization("o1").get("name").asText());
            assertEquals("/v2/company_base/collect/o1", sentRequest().uri().getPath());
        }

        @Test
        @DisplayName("Should reject a record that is not an object")
        void notAnObject() throws Exception {
            respond(200, "[]");

            assertThrows(ExternalFetchException.class, () -> provider.fetchRecord("c1"));
        }
    }

    @Nested
    @DisplayName("HttpEntitySearchProvider")
    class EntityProviderTests {

        private HttpEntitySearchProvider provider;

        @BeforeEach
        void setUp() {
            provider = HttpEntitySearchProvider.builder()
                    .baseUrl(BASE_URL)
                    .httpClient(httpClient)
                    .build();
        }

        @Test
        @DisplayName("Should return only an organization whose website matches the domain")
        void findByWebsite() throws Exception {
            respond(200, """
                    [{"id": "o2", "name": "Acme Corp", "website": "acme.co"},
                     {"id": "o1", "name": "Acme", "website": "https://www.acme.com/"}]
                    """);

            Optional<OrganizationMatch> match = provider.findByWebsite("acme.com");

            assertTrue(match.isPresent());
            assertEquals("o1", match.get().id());
        }

        @Test
        @DisplayName("Should read a hits envelope and skip entries without id or name")
        void searchByName() throws Exception {
            respond(200, """
                    {"hits": {"hits": [
                      {"_score": 12.5, "_source": {"id": "o1", "name": "Acme"}},
                      {"_score": 9.0, "_source": {"name": "No Id"}},
                      {"_score": 4.0, "_source": {"id": "o3", "name": "Acme Labs"}},
                      {"_score": 1.0, "_source": {"id": "o4", "name": "Acme Goods"}}
                    ]}}
                    """);

            List<OrganizationMatch> matches = provider.searchByName("Acme", 2);

            assertEquals(2, matches.size());
            assertEquals("o1", matches.get(0).id());
            assertEquals(12.5, matches.get(0).score());
            assertEquals("o3", matches.get(1).id());
        }
    }

    @Nested
    @DisplayName("HttpScoringCollaborator")
    class ScoringTests {

        private HttpScoringCollaborator scoring;
        private CandidateRecord record;

        @BeforeEach
        void setUp() {
            scoring = HttpScoringCollaborator.builder()
                    .baseUrl(BASE_URL)
                    .httpClient(httpClient)
                    .build();
            record = new CandidateRecord("c1", mapper.createObjectNode().put("id", "c1"), 0,
                    CandidateRecord.Source.FRESH, Map.of());
        }

        @Test
        @DisplayName("Should parse overall and per-criterion scores")
        void parses() throws Exception {
            respond(200, """
                    {"overall_score": 7.5, "criterion_scores": {"Python": 9}, "rationale": "strong"}
                    """);

            CandidateScore score = scoring.score(record, Requirements.of("ml",
                    List.of(new WeightedRequirement("Python", 40))));

            assertEquals(7.5, score.overallScore());
            assertEquals(9.0, score.criterionScores().get("Python"));
            assertEquals("strong", score.rationale());
            assertEquals("/v2/score", sentRequest().uri().getPath());
        }

        @Test
        @DisplayName("Should reject a response without an overall score")
        void missingScore() throws Exception {
            respond(200, "{\"rationale\": \"n/a\"}");

            assertThrows(ExternalFetchException.class,
                    () -> scoring.score(record, Requirements.generalFitOnly("")));
        }

        @Test
        @DisplayName("Should reject an out-of-range score")
        void outOfRange() throws Exception {
            respond(200, "{\"overall_score\": 42}");

            ExternalFetchException e = assertThrows(ExternalFetchException.class,
                    () -> scoring.score(record, Requirements.generalFitOnly("")));

            assertInstanceOf(IllegalArgumentException.class, e.getCause());
        }
    }
}
