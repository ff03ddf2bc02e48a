package com.p14n.relay.vertx.handler;

import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.vertx.core.http.HttpServerResponse;

/**
 * Writes Jackson-encoded JSON responses.
 */
public final class JsonResponses {

    private JsonResponses() {
    }

    public static void send(HttpServerResponse response, ObjectMapper mapper, int status, Object body) {
        String json;
        try {
            json = mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode response body", e);
        }
        response.setStatusCode(status)
                .putHeader("Content-Type", "application/json")
                .end(json);
    }

    public static void error(HttpServerResponse response, ObjectMapper mapper, int status, String message) {
        send(response, mapper, status, Map.of("error", message));
    }
}
