package com.talent.sourcing.provider.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.talent.sourcing.provider.ExternalFetchException;
import com.talent.sourcing.provider.ExternalFetchTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Objects;

/**
 * JSON-over-HTTP calls with bearer authentication, shared by the HTTP providers.
 * Every failure surfaces as an {@link ExternalFetchException}.
 */
class JsonHttpClient {
    private static final Logger log = LoggerFactory.getLogger(JsonHttpClient.class);

    private final String baseUrl;
    private final String apiKey;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    JsonHttpClient(String baseUrl, String apiKey, Duration timeout, HttpClient httpClient, ObjectMapper objectMapper) {
        Objects.requireNonNull(baseUrl, "baseUrl is required");
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.timeout = Objects.requireNonNull(timeout, "timeout is required");
        this.httpClient = httpClient != null ? httpClient
                : HttpClient.newBuilder().connectTimeout(timeout).build();
        this.objectMapper = objectMapper != null ? objectMapper : new ObjectMapper();
    }

    JsonNode get(String path) {
        return send(request(path).GET().build());
    }

    JsonNode post(String path, JsonNode body) {
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ExternalFetchException("Failed to serialize request body for " + path, e);
        }
        return send(request(path)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build());
    }

    ObjectMapper objectMapper() {
        return objectMapper;
    }

    private HttpRequest.Builder request(String path) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Accept", "application/json");
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        return builder;
    }

    private JsonNode send(HttpRequest request) {
        String target = request.method() + " " + request.uri().getPath();
        log.debug("http.request target={}", target);
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ExternalFetchTimeoutException("Timed out after " + timeout.toMillis() + "ms: " + target, e);
        } catch (IOException e) {
            throw new ExternalFetchException("Request failed: " + target, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalFetchException("Interrupted: " + target, e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            log.warn("http.error target={} status={}", target, status);
            throw new ExternalFetchException(target + " returned status " + status, status, null);
        }
        try {
            return objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new ExternalFetchException("Unreadable response body from " + target, status, e);
        }
    }
}
