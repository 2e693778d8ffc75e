package com.stationalmanac.core.geo;

import com.stationalmanac.core.model.Coordinates;
import com.stationalmanac.core.model.Station;

import java.util.List;
import java.util.Objects;

// linear scan; on equal distances the earliest station wins
public final class GeoResolver {
    private final DistanceFunction distance;

    public GeoResolver() {
        this(Geodesy::distanceKm);
    }

    public GeoResolver(DistanceFunction distance) {
        this.distance = Objects.requireNonNull(distance, "distance is required");
    }

    public NearestStation resolve(Coordinates query, List<Station> stations) {
        Objects.requireNonNull(query, "query is required");
        if (stations == null || stations.isEmpty()) {
            throw new IllegalArgumentException("Station list must not be empty");
        }

        int bestIndex = -1;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (int i = 0; i < stations.size(); i++) {
            Station station = stations.get(i);
            if (!Double.isFinite(station.latitude()) || !Double.isFinite(station.longitude())) {
                throw new IllegalArgumentException("Station " + station.archiveKey() + " has non-numeric coordinates");
            }
            double km = distance.km(query.latitude(), query.longitude(), station.latitude(), station.longitude());
            if (km < bestDistance) {
                bestIndex = i;
                bestDistance = km;
            }
        }
        if (bestIndex < 0) {
            throw new IllegalStateException("No finite distance to any of " + stations.size() + " stations");
        }
        return new NearestStation(bestIndex, bestDistance);
    }

    @FunctionalInterface
    public interface DistanceFunction {
        double km(double lat1, double lon1, double lat2, double lon2);
    }
}
