package com.stationalmanac.core.geo;

public record NearestStation(int index, double distanceKm) {
}
