package com.stationalmanac.core.model;

public enum WeatherError {
    FORECAST_URL_MISSING(
            "Valid response from current weather API, but forecast URL not in expected place in response."
    ),
    INVALID_INPUT_COORDINATES(
            "Invalid input coordinates.  The first coordinate should be latitude; "
                    + "the second should be longitude.  "
                    + "Ensure that the coordinates are within the United States."
    ),
    INVALID_WEATHER_API_RESPONSE(
            "Invalid response from current weather API."
    ),
    TEMPERATURE_MISSING(
            "Valid response from current weather API, but temperature not in expected place in response."
    ),
    LOCATION_MISSING(
            "Valid response from current weather API, but location information is incomplete."
    );

    private final String message;

    WeatherError(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
