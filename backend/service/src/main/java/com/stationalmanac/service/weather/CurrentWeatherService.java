package com.stationalmanac.service.weather;

import com.fasterxml.jackson.databind.JsonNode;
import com.stationalmanac.core.model.Coordinates;
import com.stationalmanac.core.model.CurrentWeather;
import com.stationalmanac.core.model.WeatherError;
import com.stationalmanac.core.util.Temperatures;
import com.stationalmanac.service.retry.ResilientClient;
import com.stationalmanac.service.retry.RetryOutcome;
import com.stationalmanac.service.retry.RetryPolicy;

import java.net.URI;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.logging.Logger;

public final class CurrentWeatherService {
    private static final Logger LOGGER = Logger.getLogger(CurrentWeatherService.class.getName());

    private static final double MIN_PLAUSIBLE_CELSIUS = -150;
    private static final double MAX_PLAUSIBLE_CELSIUS = 150;

    private final WeatherApi weatherApi;
    private final ResilientClient resilientClient;
    private final RetryPolicy retryPolicy;

    public CurrentWeatherService(WeatherApi weatherApi) {
        this(weatherApi, new ResilientClient(), RetryPolicy.DEFAULT);
    }

    public CurrentWeatherService(WeatherApi weatherApi, ResilientClient resilientClient, RetryPolicy retryPolicy) {
        this.weatherApi = Objects.requireNonNull(weatherApi, "weatherApi is required");
        this.resilientClient = Objects.requireNonNull(resilientClient, "resilientClient is required");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy is required");
    }

    public CurrentWeather fetch(Coordinates coordinates) {
        return fetch(coordinates, null);
    }

    /**
     * Retries stop instead of waiting past {@code deadline}; {@code null} means no limit. The deadline
     * bounds the waits between attempts, not a request already in flight.
     */
    public CurrentWeather fetch(Coordinates coordinates, Instant deadline) {
        Objects.requireNonNull(coordinates, "coordinates is required");

        RetryOutcome<ApiResponse> stationLookup =
                resilientClient.execute(retryPolicy, () -> weatherApi.points(coordinates), ApiResponse::ok, deadline);
        if (!stationLookup.succeeded()) {
            WeatherError error = classifyStationFailure(stationLookup);
            LOGGER.warning("Station lookup for " + coordinates + " failed after " + stationLookup.attempts()
                    + " attempt(s): " + error);
            return CurrentWeather.failed(error);
        }
        JsonNode station = stationLookup.response().body();

        Optional<URI> forecastUrl = forecastUrl(station);
        if (forecastUrl.isEmpty()) {
            LOGGER.warning("Station lookup for " + coordinates + " has no forecast URL");
            return CurrentWeather.failed(WeatherError.FORECAST_URL_MISSING);
        }

        RetryOutcome<ApiResponse> forecastLookup =
                resilientClient.execute(retryPolicy, () -> weatherApi.forecast(forecastUrl.get()), ApiResponse::ok, deadline);
        if (!forecastLookup.succeeded()) {
            // TODO: give this case its own WeatherError once callers agree on a message for it
            LOGGER.warning("Forecast lookup " + forecastUrl.get() + " failed after " + forecastLookup.attempts()
                    + " attempt(s)");
            return CurrentWeather.forecastUnavailable();
        }

        OptionalDouble celsius = firstPeriodCelsius(forecastLookup.response().body());
        if (celsius.isEmpty()) {
            LOGGER.warning("Forecast " + forecastUrl.get() + " has no usable temperature");
            return CurrentWeather.temperatureMissing();
        }

        Optional<String> city = text(station.path("properties").path("relativeLocation").path("properties").path("city"));
        Optional<String> state = text(station.path("properties").path("relativeLocation").path("properties").path("state"));
        Optional<String> radarStation = text(station.path("properties").path("radarStation"));
        if (city.isEmpty() || state.isEmpty() || radarStation.isEmpty()) {
            LOGGER.warning("Station lookup for " + coordinates + " has incomplete location information");
            return CurrentWeather.locationMissing(celsius.getAsDouble());
        }

        return CurrentWeather.complete(celsius.getAsDouble(), radarStation.get(), city.get(), state.get());
    }

    private static WeatherError classifyStationFailure(RetryOutcome<ApiResponse> outcome) {
        boolean invalidPoint = outcome.lastResponse()
                .map(response -> response.problemType().toLowerCase(Locale.ROOT).contains("invalidpoint"))
                .orElse(false);
        return invalidPoint ? WeatherError.INVALID_INPUT_COORDINATES : WeatherError.INVALID_WEATHER_API_RESPONSE;
    }

    private static Optional<URI> forecastUrl(JsonNode station) {
        Optional<String> raw = text(station.path("properties").path("forecast"));
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            URI uri = URI.create(raw.get());
            return uri.isAbsolute() ? Optional.of(uri) : Optional.empty();
        } catch (IllegalArgumentException malformed) {
            LOGGER.warning("Malformed forecast URL " + raw.get() + ": " + malformed.getMessage());
            return Optional.empty();
        }
    }

    private static OptionalDouble firstPeriodCelsius(JsonNode forecast) {
        JsonNode periods = forecast.path("properties").path("periods");
        if (!periods.isArray() || periods.isEmpty()) {
            return OptionalDouble.empty();
        }
        JsonNode period = periods.get(0);
        JsonNode temperature = period.path("temperature");
        if (!temperature.isNumber()) {
            return OptionalDouble.empty();
        }
        double value = temperature.asDouble();
        double celsius = "C".equalsIgnoreCase(period.path("temperatureUnit").asText(""))
                ? value
                : Temperatures.fahrenheitToCelsius(value);
        if (!(celsius >= MIN_PLAUSIBLE_CELSIUS && celsius <= MAX_PLAUSIBLE_CELSIUS)) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(celsius);
    }

    private static Optional<String> text(JsonNode node) {
        if (!node.isTextual() || node.asText().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(node.asText());
    }
}
