package com.stationalmanac.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.time.MonthDay;
import java.util.Objects;

public record TemperatureRecord(
        @JsonProperty("timestamp") LocalDateTime timestamp,
        @JsonProperty("temperature") int temperatureRaw
) {
    public TemperatureRecord {
        Objects.requireNonNull(timestamp, "timestamp is required");
    }

    public MonthDay monthDay() {
        return MonthDay.from(timestamp);
    }
}
