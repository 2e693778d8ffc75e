package com.stationalmanac.service.config;

import com.stationalmanac.service.retry.RetryPolicy;
import com.stationalmanac.service.weather.NwsClient;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

public record AlmanacConfig(
        String stationCatalog,
        String archiveDirectory,
        String pointsBaseUrl,
        String userAgent,
        Duration requestTimeout,
        Integer retryAttempts,
        Duration retryDelay,
        Duration requestBudget
) {
    public static final String DEFAULT_STATION_CATALOG = "output/stations_to_download.json";
    public static final String DEFAULT_ARCHIVE_DIRECTORY = "isd_lite_compiled";
    public static final String DEFAULT_USER_AGENT = "station-almanac/0.1 (contact: support@example.com)";
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(6);
    public static final Duration DEFAULT_REQUEST_BUDGET = Duration.ofSeconds(30);

    public AlmanacConfig {
        stationCatalog = Objects.requireNonNullElse(stationCatalog, DEFAULT_STATION_CATALOG);
        archiveDirectory = Objects.requireNonNullElse(archiveDirectory, DEFAULT_ARCHIVE_DIRECTORY);
        pointsBaseUrl = Objects.requireNonNullElse(pointsBaseUrl, NwsClient.DEFAULT_POINTS_URL);
        userAgent = Objects.requireNonNullElse(userAgent, DEFAULT_USER_AGENT);
        requestTimeout = Objects.requireNonNullElse(requestTimeout, DEFAULT_REQUEST_TIMEOUT);
        retryAttempts = Objects.requireNonNullElse(retryAttempts, RetryPolicy.DEFAULT.maxAttempts());
        retryDelay = Objects.requireNonNullElse(retryDelay, RetryPolicy.DEFAULT.delay());
        requestBudget = Objects.requireNonNullElse(requestBudget, DEFAULT_REQUEST_BUDGET);
        if (requestBudget.isNegative() || requestBudget.isZero()) {
            throw new IllegalArgumentException("requestBudget must be positive: " + requestBudget);
        }
    }

    public static AlmanacConfig defaults() {
        return new AlmanacConfig(null, null, null, null, null, null, null, null);
    }

    public AlmanacConfig withUserAgent(String override) {
        if (override == null || override.isBlank()) {
            return this;
        }
        return new AlmanacConfig(stationCatalog, archiveDirectory, pointsBaseUrl, override,
                requestTimeout, retryAttempts, retryDelay, requestBudget);
    }

    public Path stationCatalogPath() {
        return Path.of(stationCatalog);
    }

    public Path archiveDirectoryPath() {
        return Path.of(archiveDirectory);
    }

    // deadline for one whole request, counted from its start
    public Instant deadlineFrom(Instant start) {
        return start.plus(requestBudget);
    }

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(retryAttempts, retryDelay);
    }
}
