package com.d2stacks.portainer;

import com.d2stacks.core.metrics.ApiMetrics;
import com.d2stacks.core.result.Result;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;

/**
 * Issues single HTTP calls against the control plane and normalizes their outcome.
 *
 * <p>Statuses in {@code [200, 300)} and {@code 304} succeed with the raw response
 * body, untouched. Every other status and every transport-level failure becomes a
 * {@link Result.Failure} whose message is built by {@link ApiErrors}. There are no
 * retries and nothing is cached.
 */
public class PortainerTransport {

    private static final Logger log = LoggerFactory.getLogger(PortainerTransport.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;
    private final ApiMetrics metrics;

    public PortainerTransport(HttpClient httpClient, ObjectMapper objectMapper,
                              Duration requestTimeout, ApiMetrics metrics) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
        this.metrics = metrics;
    }

    static boolean isSuccessStatus(int status) {
        return (status >= 200 && status < 300) || status == 304;
    }

    /**
     * Performs exactly one HTTP call.
     *
     * @param method HTTP method
     * @param uri    absolute request URI
     * @param body   request payload serialized as JSON, or {@code null} for none
     * @param bearer token for the {@code Authorization} header; empty sends the request anonymously
     * @return the raw response body, or the normalized error message
     */
    public Result<String, String> send(String method, URI uri, Object body, Optional<String> bearer) {
        return buildRequest(method, uri, body, bearer)
                .flatMap(request -> execute(method, uri, request));
    }

    /**
     * Decodes a successful response body into the requested type.
     * <p>
     * A 204 or 304 carries no body: collection targets then decode to an empty collection,
     * other targets fail with {@code "Invalid response: empty body"}.
     */
    public <T> Result<T, String> decode(String body, TypeReference<T> type) {
        if (body == null || body.isBlank()) {
            var javaType = objectMapper.getTypeFactory().constructType(type);
            if (!javaType.isCollectionLikeType() && !javaType.isArrayType()) {
                return Result.failure("Invalid response: empty body");
            }
            body = "[]";
        }
        try {
            T value = objectMapper.readValue(body, type);
            return value != null ? Result.success(value) : Result.failure("Invalid response: null body");
        } catch (JsonProcessingException e) {
            log.debug("Cannot decode response body as {}", type.getType(), e);
            return Result.failure("Invalid response: " + e.getOriginalMessage());
        }
    }

    ApiMetrics metrics() {
        return metrics;
    }

    private Result<String, String> execute(String method, URI uri, HttpRequest request) {
        log.debug("{} {}", method, uri.getPath());
        long start = System.nanoTime();
        try {
            var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            var elapsed = Duration.ofNanos(System.nanoTime() - start);
            int status = response.statusCode();
            if (isSuccessStatus(status)) {
                metrics.recordRequest(method, ApiMetrics.OUTCOME_SUCCESS, elapsed);
                return Result.success(response.body() != null ? response.body() : "");
            }
            metrics.recordRequest(method, ApiMetrics.OUTCOME_HTTP_ERROR, elapsed);
            var message = ApiErrors.httpFailure(status, response.body(), objectMapper);
            log.warn("{} {} failed: {}", method, uri.getPath(), message);
            return Result.failure(message);
        } catch (IOException e) {
            return transportFailure(method, uri, e, start);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return transportFailure(method, uri, e, start);
        }
    }

    private Result<HttpRequest, String> buildRequest(String method, URI uri, Object body, Optional<String> bearer) {
        HttpRequest.Builder builder;
        try {
            builder = HttpRequest.newBuilder(uri)
                    .timeout(requestTimeout)
                    .header("Accept", "application/json");
        } catch (IllegalArgumentException e) {
            return Result.failure("Invalid URL " + uri + ": " + ApiErrors.transportFailure(e));
        }

        if (body == null) {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            try {
                var json = objectMapper.writeValueAsString(body);
                builder.header("Content-Type", "application/json")
                        .method(method, HttpRequest.BodyPublishers.ofString(json));
            } catch (JsonProcessingException e) {
                return Result.failure("Cannot serialize request: " + e.getOriginalMessage());
            }
        }
        if (bearer.isPresent()) {
            builder.header("Authorization", "Bearer " + bearer.get());
        }
        return Result.success(builder.build());
    }

    private Result<String, String> transportFailure(String method, URI uri, Exception e, long start) {
        metrics.recordRequest(method, ApiMetrics.OUTCOME_TRANSPORT_ERROR,
                Duration.ofNanos(System.nanoTime() - start));
        var message = ApiErrors.transportFailure(e);
        log.warn("{} {} failed: {}", method, uri.getPath(), message);
        return Result.failure(message);
    }
}
