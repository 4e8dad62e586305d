package com.d2stacks.portainer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Turns failed calls into the single-line messages surfaced to operators.
 *
 * <p>Response bodies are read in this order: plain text is trimmed; a JSON object
 * contributes its {@code message} and {@code details} joined with {@code ": "}, or
 * its compact serialization when both are empty; anything else is
 * {@value #UNKNOWN_ERROR}. HTTP failures are prefixed with the status code.
 */
final class ApiErrors {

    static final String UNKNOWN_ERROR = "Unknown error";

    private ApiErrors() {}

    static String transportFailure(Throwable cause) {
        var message = cause.getMessage();
        return message == null || message.isBlank() ? UNKNOWN_ERROR : message.trim();
    }

    static String httpFailure(int status, String body, ObjectMapper objectMapper) {
        return status + " - " + bodyMessage(body, objectMapper);
    }

    static String bodyMessage(String body, ObjectMapper objectMapper) {
        if (body == null || body.isBlank()) {
            return UNKNOWN_ERROR;
        }
        JsonNode node;
        try {
            node = objectMapper.reader()
                    .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                    .readTree(body);
        } catch (JsonProcessingException e) {
            // not JSON: a plain-text body
            return body.trim();
        }
        if (node.isTextual()) {
            var text = node.asText().trim();
            return text.isEmpty() ? UNKNOWN_ERROR : text;
        }
        if (node.isObject()) {
            var joined = Stream.of(field(node, "message"), field(node, "details"))
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.joining(": "));
            return joined.isEmpty() ? node.toString() : joined;
        }
        return UNKNOWN_ERROR;
    }

    private static String field(JsonNode node, String name) {
        var value = node.path(name);
        if (value.isTextual() || value.isNumber() || value.isBoolean()) {
            return value.asText().trim();
        }
        return "";
    }
}
