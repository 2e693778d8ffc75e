package com.stationalmanac.service.weather;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.net.URI;
import java.util.Objects;

/**
 * One response from the weather service. Status {@code 0} marks a request that never got an HTTP answer.
 */
public record ApiResponse(URI uri, int status, JsonNode body) {
    public static final int NO_RESPONSE = 0;

    public ApiResponse {
        Objects.requireNonNull(uri, "uri is required");
        body = body == null ? MissingNode.getInstance() : body;
    }

    public static ApiResponse noResponse(URI uri) {
        return new ApiResponse(uri, NO_RESPONSE, MissingNode.getInstance());
    }

    public boolean ok() {
        return status / 100 == 2;
    }

    public String problemType() {
        JsonNode type = body.path("type");
        return type.isTextual() ? type.asText() : "";
    }
}
