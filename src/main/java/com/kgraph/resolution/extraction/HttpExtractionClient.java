package com.kgraph.resolution.extraction;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link ExtractionCapability} backed by an HTTP extraction service (for example a GLiNER server).
 *
 * <p>Request: {@code POST {baseUrl}/extract} with body {@code {"text": "..."}}.<br>
 * Response: {@code {"entities": [{"text", "label", "start", "end"}],
 * "relations": [{"subject", "predicate", "object"}]}} where relation endpoints are entity indexes.</p>
 *
 * <p>Status 429 and 5xx, timeouts and connection failures are reported as
 * {@link TransientExtractionException}; other non-200 statuses fail the chunk.</p>
 *
 * <pre>
 * HttpExtractionClient client = HttpExtractionClient.builder()
 *     .baseUrl("http://localhost:6971")
 *     .timeout(Duration.ofSeconds(30))
 *     .build();
 * </pre>
 */
public class HttpExtractionClient implements ExtractionCapability {
    private static final Logger log = LoggerFactory.getLogger(HttpExtractionClient.class);

    private static final String DEFAULT_BASE_URL = "http://localhost:6971";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final String baseUrl;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private HttpExtractionClient(Builder builder) {
        String url = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.httpClient = builder.httpClient != null ? builder.httpClient
                : HttpClient.newBuilder().connectTimeout(timeout).build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public ExtractionResult extract(String text) {
        String body;
        try {
            body = objectMapper.writeValueAsString(Map.of("text", text != null ? text : ""));
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot serialize extraction request", e);
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/extract"))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new TransientExtractionException("Extraction service timed out after " + timeout.toMillis() + "ms", e);
        } catch (IOException e) {
            throw new TransientExtractionException("Extraction service unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while calling extraction service", e);
        }

        int status = response.statusCode();
        if (status == 429 || status >= 500) {
            throw new TransientExtractionException("Extraction service returned status " + status + ": " + response.body());
        }
        if (status != 200) {
            throw new IllegalStateException("Extraction service returned status " + status + ": " + response.body());
        }

        try {
            return toResult(objectMapper.readValue(response.body(), ExtractResponse.class));
        } catch (IOException e) {
            throw new IllegalStateException("Malformed extraction response: " + e.getMessage(), e);
        }
    }

    /**
     * Checks that the extraction service answers its health endpoint.
     */
    @Override
    public boolean isAvailable() {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/health"))
                    .timeout(Duration.ofSeconds(5))
                    .GET()
                    .build();
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString()).statusCode() == 200;
        } catch (IOException e) {
            log.debug("Extraction service not available: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static ExtractionResult toResult(ExtractResponse response) {
        List<ExtractedMention> mentions = new ArrayList<>();
        if (response.entities() != null) {
            for (EntityJson e : response.entities()) {
                mentions.add(new ExtractedMention(e.text(), e.label(), e.start(), e.end()));
            }
        }
        List<ExtractedRelation> relations = new ArrayList<>();
        if (response.relations() != null) {
            for (RelationJson r : response.relations()) {
                relations.add(new ExtractedRelation(r.subject(), r.predicate(), r.object()));
            }
        }
        log.debug("Extraction response: {} entities, {} relations", mentions.size(), relations.size());
        return new ExtractionResult(mentions, relations);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private Duration timeout;
        private HttpClient httpClient;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public HttpExtractionClient build() {
            return new HttpExtractionClient(this);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ExtractResponse(List<EntityJson> entities, List<RelationJson> relations) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EntityJson(String text, String label, int start, int end) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RelationJson(int subject, String predicate, int object) {
    }
}
