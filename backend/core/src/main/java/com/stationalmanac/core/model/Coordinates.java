package com.stationalmanac.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Coordinates(
        @JsonProperty("latitude") double latitude,
        @JsonProperty("longitude") double longitude
) {
    public Coordinates {
        ValidationException.requireRange("latitude", latitude, -90, 90);
        ValidationException.requireRange("longitude", longitude, -180, 180);
    }
}
