package com.stationalmanac.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;

public record Station(
        @JsonProperty("usaf") int usafId,
        @JsonProperty("wban") int wbanId,
        @JsonProperty("station_name") String name,
        @JsonProperty("st") String state,
        @JsonProperty("call") String callSign,
        @JsonProperty("lat") double latitude,
        @JsonProperty("lon") double longitude,
        @JsonProperty("elev(m)") double elevationMeters
) {
    public Optional<String> knownCallSign() {
        return Optional.ofNullable(callSign).filter(value -> !value.isBlank());
    }

    public String archiveKey() {
        return usafId + "-" + wbanId;
    }

    // usaf digits followed by wban digits
    public long compiledId() {
        return Long.parseLong(Integer.toString(usafId) + wbanId);
    }
}
