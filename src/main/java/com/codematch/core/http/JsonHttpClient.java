package com.codematch.core.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Minimal JSON-over-HTTP client shared by the remote service adapters.
 */
public class JsonHttpClient {

    private static final Logger log = LoggerFactory.getLogger(JsonHttpClient.class);

    private final String baseUrl;
    private final Duration requestTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public JsonHttpClient(String baseUrl, Duration requestTimeout, ObjectMapper objectMapper) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.requestTimeout = requestTimeout;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    public ObjectMapper mapper() {
        return objectMapper;
    }

    public String baseUrl() {
        return baseUrl;
    }

    public boolean isConfigured() {
        return !baseUrl.isBlank();
    }

    public JsonNode post(String path, JsonNode body) {
        requireConfigured(path);
        var request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
                .build();
        return send(request, "POST " + path);
    }

    public JsonNode get(String pathAndQuery) {
        requireConfigured(pathAndQuery);
        var request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + pathAndQuery))
                .timeout(requestTimeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        return send(request, "GET " + pathAndQuery);
    }

    public static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private JsonNode send(HttpRequest request, String description) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new RemoteCallException(description + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteCallException(description + " interrupted", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            log.debug("{} returned HTTP {}: {}", description, status, response.body());
            throw new RemoteCallException(status, errorMessage(description, status, response.body()));
        }
        try {
            String body = response.body();
            return body == null || body.isBlank()
                    ? objectMapper.createObjectNode()
                    : objectMapper.readTree(body);
        } catch (IOException e) {
            throw new RemoteCallException(description + " returned malformed JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Prefers the service's own {@code error} or {@code message} field over the raw body.
     */
    private String errorMessage(String description, int status, String body) {
        if (body != null && !body.isBlank()) {
            try {
                JsonNode json = objectMapper.readTree(body);
                if (json.hasNonNull("error")) {
                    return json.get("error").asText();
                }
                if (json.hasNonNull("message")) {
                    return json.get("message").asText();
                }
            } catch (IOException e) {
                log.trace("Error body of {} is not JSON", description);
            }
        }
        return "%s failed (HTTP %d): %s".formatted(description, status, body);
    }

    private void requireConfigured(String path) {
        if (!isConfigured()) {
            throw new RemoteCallException(RemoteCallException.NO_RESPONSE,
                    "No service URL configured for " + path);
        }
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        String trimmed = url.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}
