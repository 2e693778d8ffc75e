package com.stationalmanac.service.annual;

import com.stationalmanac.archive.ArchivedSeriesStore;
import com.stationalmanac.archive.StationCatalog;
import com.stationalmanac.core.geo.GeoResolver;
import com.stationalmanac.core.geo.NearestStation;
import com.stationalmanac.core.model.AnnualWeather;
import com.stationalmanac.core.model.Coordinates;
import com.stationalmanac.core.model.CurrentWeather;
import com.stationalmanac.core.model.Station;
import com.stationalmanac.core.model.TemperatureRecord;
import com.stationalmanac.core.util.Temperatures;
import com.stationalmanac.core.window.WindowExtractor;
import com.stationalmanac.service.weather.CurrentWeatherService;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.MonthDay;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

public final class AnnualWeatherAssembler {
    private static final Logger LOGGER = Logger.getLogger(AnnualWeatherAssembler.class.getName());

    private final StationCatalog catalog;
    private final ArchivedSeriesStore archive;
    private final CurrentWeatherLookup currentWeatherLookup;
    private final GeoResolver geoResolver;
    private final Clock clock;

    public AnnualWeatherAssembler(
            StationCatalog catalog,
            ArchivedSeriesStore archive,
            CurrentWeatherService currentWeatherService,
            Clock clock
    ) {
        this(catalog, archive, currentWeatherService::fetch, new GeoResolver(), clock);
    }

    public AnnualWeatherAssembler(
            StationCatalog catalog,
            ArchivedSeriesStore archive,
            CurrentWeatherLookup currentWeatherLookup,
            GeoResolver geoResolver,
            Clock clock
    ) {
        this.catalog = Objects.requireNonNull(catalog, "catalog is required");
        this.archive = Objects.requireNonNull(archive, "archive is required");
        this.currentWeatherLookup = Objects.requireNonNull(currentWeatherLookup, "currentWeatherLookup is required");
        this.geoResolver = Objects.requireNonNull(geoResolver, "geoResolver is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    // today is taken in the clock's zone
    public AnnualWeather assemble(Coordinates coordinates) {
        return assemble(coordinates, (Instant) null);
    }

    public AnnualWeather assemble(Coordinates coordinates, Instant deadline) {
        return assemble(coordinates, MonthDay.from(LocalDate.now(clock)), deadline);
    }

    public AnnualWeather assemble(Coordinates coordinates, MonthDay targetDay) {
        return assemble(coordinates, targetDay, null);
    }

    public AnnualWeather assemble(Coordinates coordinates, MonthDay targetDay, Instant deadline) {
        Objects.requireNonNull(coordinates, "coordinates is required");

        List<Station> stations = catalog.stations();
        NearestStation nearest = geoResolver.resolve(coordinates, stations);
        Station station = stations.get(nearest.index());
        LOGGER.info(String.format("Nearest station to %s is %s (%s) at %.3f km",
                coordinates, station.archiveKey(), station.name(), nearest.distanceKm()));

        List<TemperatureRecord> window = WindowExtractor.extract(archive.load(station), targetDay);

        CurrentWeather current =
                currentWeatherLookup.fetch(new Coordinates(station.latitude(), station.longitude()), deadline);

        List<LocalDateTime> timestamps = new ArrayList<>(window.size());
        List<Double> temperatures = new ArrayList<>(window.size());
        for (TemperatureRecord record : window) {
            timestamps.add(record.timestamp());
            temperatures.add(Temperatures.tenthsToCelsius(record.temperatureRaw()));
        }

        return new AnnualWeather(
                current.temperatureCelsius(),
                current.radarStation(),
                current.coordinatesCity(),
                current.coordinatesState(),
                current.errorMessage(),
                nearest.distanceKm(),
                timestamps,
                temperatures,
                station.usafId(),
                station.wbanId(),
                station.name(),
                station.state(),
                station.knownCallSign().orElse(""),
                station.latitude(),
                station.longitude(),
                station.elevationMeters()
        );
    }

    @FunctionalInterface
    public interface CurrentWeatherLookup {
        CurrentWeather fetch(Coordinates coordinates, Instant deadline);
    }
}
