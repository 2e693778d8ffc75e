package com.stationalmanac.service.weather;

import com.stationalmanac.core.model.Coordinates;

import java.net.URI;

public interface WeatherApi {
    ApiResponse points(Coordinates coordinates);

    ApiResponse forecast(URI forecastUrl);
}
