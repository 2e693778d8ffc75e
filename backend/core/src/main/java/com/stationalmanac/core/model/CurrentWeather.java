package com.stationalmanac.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.Optional;

public record CurrentWeather(
        @JsonProperty("valid_response") boolean validResponse,
        @JsonProperty("temperature_celsius") double temperatureCelsius,
        @JsonProperty("radar_station") String radarStation,
        @JsonProperty("coordinates_city") String coordinatesCity,
        @JsonProperty("coordinates_state") String coordinatesState,
        @JsonIgnore WeatherError error
) {
    public static final double UNKNOWN_TEMPERATURE = -9999;

    public CurrentWeather {
        if (temperatureCelsius != UNKNOWN_TEMPERATURE) {
            ValidationException.requireRange("temperature_celsius", temperatureCelsius, -150, 150);
        }
        radarStation = Objects.requireNonNullElse(radarStation, "");
        coordinatesCity = Objects.requireNonNullElse(coordinatesCity, "");
        coordinatesState = Objects.requireNonNullElse(coordinatesState, "");
    }

    public static CurrentWeather failed(WeatherError error) {
        return new CurrentWeather(false, UNKNOWN_TEMPERATURE, "", "", "", Objects.requireNonNull(error, "error"));
    }

    // forecast call failed: invalid, but no error category
    public static CurrentWeather forecastUnavailable() {
        return new CurrentWeather(false, UNKNOWN_TEMPERATURE, "", "", "", null);
    }

    public static CurrentWeather temperatureMissing() {
        return new CurrentWeather(true, UNKNOWN_TEMPERATURE, "", "", "", WeatherError.TEMPERATURE_MISSING);
    }

    public static CurrentWeather locationMissing(double temperatureCelsius) {
        return new CurrentWeather(true, temperatureCelsius, "", "", "", WeatherError.LOCATION_MISSING);
    }

    public static CurrentWeather complete(double temperatureCelsius, String radarStation, String city, String state) {
        return new CurrentWeather(true, temperatureCelsius, radarStation, city, state, null);
    }

    @JsonProperty("error_message")
    public String errorMessage() {
        return error == null ? "" : error.message();
    }

    public Optional<WeatherError> errorCategory() {
        return Optional.ofNullable(error);
    }

    public Optional<Double> temperature() {
        return temperatureCelsius == UNKNOWN_TEMPERATURE ? Optional.empty() : Optional.of(temperatureCelsius);
    }
}
