package com.stationalmanac.service;

import com.stationalmanac.archive.JsonStationCatalog;
import com.stationalmanac.archive.JsonlSeriesStore;
import com.stationalmanac.core.model.Coordinates;
import com.stationalmanac.core.util.JsonUtils;
import com.stationalmanac.service.annual.AnnualWeatherAssembler;
import com.stationalmanac.service.config.AlmanacConfig;
import com.stationalmanac.service.config.ConfigLoader;
import com.stationalmanac.service.retry.ResilientClient;
import com.stationalmanac.service.weather.CurrentWeatherService;
import com.stationalmanac.service.weather.NwsClient;

import java.io.PrintStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private Main() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.getenv(), System.out));
    }

    static int run(String[] args, Map<String, String> env, PrintStream out) {
        Request request;
        try {
            request = parseArgs(args);
        } catch (IllegalArgumentException e) {
            LOGGER.severe(e.getMessage());
            LOGGER.severe("Usage: station-almanac <latitude> <longitude> [--current-only]");
            return EXIT_USAGE;
        }

        try {
            AlmanacConfig config = resolveConfig(env);
            HttpClient httpClient = HttpClient.newBuilder()
                    .connectTimeout(Duration.ofSeconds(5))
                    .followRedirects(HttpClient.Redirect.NORMAL)
                    .build();
            CurrentWeatherService currentWeather = new CurrentWeatherService(
                    new NwsClient(httpClient, config.pointsBaseUrl(), config.requestTimeout(), config.userAgent()),
                    new ResilientClient(),
                    config.retryPolicy()
            );

            Clock clock = Clock.systemDefaultZone();
            Instant deadline = config.deadlineFrom(clock.instant());

            if (request.currentOnly()) {
                out.println(JsonUtils.toJson(currentWeather.fetch(request.coordinates(), deadline)));
                return EXIT_OK;
            }

            AnnualWeatherAssembler assembler = new AnnualWeatherAssembler(
                    new JsonStationCatalog(config.stationCatalogPath()),
                    new JsonlSeriesStore(config.archiveDirectoryPath()),
                    currentWeather,
                    clock
            );
            out.println(JsonUtils.toJson(assembler.assemble(request.coordinates(), deadline)));
            return EXIT_OK;
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Weather lookup failed for " + request.coordinates(), e);
            return EXIT_FAILURE;
        }
    }

    static Request parseArgs(String[] args) {
        boolean currentOnly = false;
        String[] positional = new String[2];
        int count = 0;
        for (String arg : args) {
            if ("--current-only".equals(arg)) {
                currentOnly = true;
            } else if (count < positional.length) {
                positional[count++] = arg;
            } else {
                throw new IllegalArgumentException("Unexpected argument: " + arg);
            }
        }
        if (count != 2) {
            throw new IllegalArgumentException("Expected latitude and longitude");
        }
        double latitude;
        double longitude;
        try {
            latitude = Double.parseDouble(positional[0]);
            longitude = Double.parseDouble(positional[1]);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Coordinates must be numbers: " + positional[0] + ", " + positional[1], e);
        }
        // ValidationException is an IllegalArgumentException
        return new Request(new Coordinates(latitude, longitude), currentOnly);
    }

    static AlmanacConfig resolveConfig(Map<String, String> env) {
        Path configDir = Path.of(env.getOrDefault("ALMANAC_CONFIG_DIR", "config"));
        AlmanacConfig config;
        if (Files.exists(configDir.resolve(ConfigLoader.ALMANAC_FILE))) {
            config = ConfigLoader.loadAlmanac(configDir);
        } else {
            LOGGER.info("No " + ConfigLoader.ALMANAC_FILE + " in " + configDir + "; using defaults");
            config = AlmanacConfig.defaults();
        }
        return config.withUserAgent(env.get("NWS_USER_AGENT"));
    }

    record Request(Coordinates coordinates, boolean currentOnly) {
    }
}
