package com.stationalmanac.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

// current* fields are copied as-is, sentinel included, and not range-checked again
public record AnnualWeather(
        @JsonProperty("current_temperature_celsius") double currentTemperatureCelsius,
        @JsonProperty("current_station") String currentStation,
        @JsonProperty("current_city") String currentCity,
        @JsonProperty("current_state") String currentState,
        @JsonProperty("current_error_message") String currentErrorMessage,
        @JsonProperty("distance_to_station_kilometers") double distanceToStationKilometers,
        @JsonProperty("annual_timestamp") List<LocalDateTime> annualTimestamp,
        @JsonProperty("annual_temperature_celsius") List<Double> annualTemperatureCelsius,
        @JsonProperty("annual_usaf_station_id") int annualUsafStationId,
        @JsonProperty("annual_wban_station_id") int annualWbanStationId,
        @JsonProperty("annual_station_name") String annualStationName,
        @JsonProperty("annual_station_state") String annualStationState,
        @JsonProperty("annual_station_call") String annualStationCall,
        @JsonProperty("annual_station_latitude") double annualStationLatitude,
        @JsonProperty("annual_station_longitude") double annualStationLongitude,
        @JsonProperty("annual_station_elevation_meters") double annualStationElevationMeters
) {
    public AnnualWeather {
        Objects.requireNonNull(currentStation, "currentStation is required");
        Objects.requireNonNull(currentCity, "currentCity is required");
        Objects.requireNonNull(currentState, "currentState is required");
        Objects.requireNonNull(currentErrorMessage, "currentErrorMessage is required");

        ValidationException.requireRange("distance_to_station_kilometers", distanceToStationKilometers, 0, 21_000);
        annualTimestamp = List.copyOf(annualTimestamp);
        annualTemperatureCelsius = List.copyOf(annualTemperatureCelsius);
        if (annualTimestamp.size() != annualTemperatureCelsius.size()) {
            throw new ValidationException("annual_timestamp and annual_temperature_celsius differ in length: "
                    + annualTimestamp.size() + " vs " + annualTemperatureCelsius.size());
        }
        ValidationException.requireRangeExclusive("annual_usaf_station_id", annualUsafStationId, 0, 1_000_000);
        ValidationException.requireRangeExclusive("annual_wban_station_id", annualWbanStationId, 0, 100_000);
        ValidationException.requireLength("annual_station_name", annualStationName, 0, 100);
        ValidationException.requireLength("annual_station_state", annualStationState, 2, 2);
        ValidationException.requireLength("annual_station_call", annualStationCall, 0, 4);
        ValidationException.requireRange("annual_station_latitude", annualStationLatitude, -90, 90);
        ValidationException.requireRange("annual_station_longitude", annualStationLongitude, -180, 180);
        // slightly above Everest and below the Dead Sea shore
        ValidationException.requireRange("annual_station_elevation_meters", annualStationElevationMeters, -440, 8850);
    }
}
