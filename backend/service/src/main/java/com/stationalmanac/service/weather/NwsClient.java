package com.stationalmanac.service.weather;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.stationalmanac.core.model.Coordinates;
import com.stationalmanac.core.util.JsonUtils;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

// transport failures come back as status 0 so they are retried and classified like HTTP errors
public final class NwsClient implements WeatherApi {
    public static final String DEFAULT_POINTS_URL = "https://api.weather.gov/points/";

    private static final Logger LOGGER = Logger.getLogger(NwsClient.class.getName());

    private final HttpClient httpClient;
    private final String pointsBaseUrl;
    private final Duration timeout;
    private final String userAgent;

    public NwsClient(HttpClient httpClient, Duration timeout, String userAgent) {
        this(httpClient, DEFAULT_POINTS_URL, timeout, userAgent);
    }

    public NwsClient(HttpClient httpClient, String pointsBaseUrl, Duration timeout, String userAgent) {
        this.httpClient = httpClient;
        this.pointsBaseUrl = pointsBaseUrl;
        this.timeout = timeout;
        this.userAgent = userAgent;
    }

    @Override
    public ApiResponse points(Coordinates coordinates) {
        return get(pointsUri(coordinates));
    }

    @Override
    public ApiResponse forecast(URI forecastUrl) {
        return get(forecastUrl);
    }

    URI pointsUri(Coordinates coordinates) {
        return URI.create(pointsBaseUrl + plain(coordinates.latitude()) + "," + plain(coordinates.longitude()));
    }

    private ApiResponse get(URI uri) {
        HttpRequest request = HttpRequest.newBuilder(uri)
                .GET()
                .timeout(timeout)
                .header("Accept", "application/geo+json,application/json")
                .header("User-Agent", userAgent)
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                LOGGER.warning("Weather service returned status " + response.statusCode() + " for " + uri);
            }
            return new ApiResponse(uri, response.statusCode(), parse(uri, response.body()));
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Weather service request failed for " + uri, e);
            return ApiResponse.noResponse(uri);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while requesting " + uri, e);
        }
    }

    private static JsonNode parse(URI uri, String body) {
        if (body == null || body.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return JsonUtils.objectMapper().readTree(body);
        } catch (JsonProcessingException e) {
            LOGGER.warning("Weather service sent a non-JSON body for " + uri + ": " + e.getOriginalMessage());
            return MissingNode.getInstance();
        }
    }

    private static String plain(double degrees) {
        return BigDecimal.valueOf(degrees).toPlainString();
    }
}
