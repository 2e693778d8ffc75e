package com.stationalmanac.core.util;

public final class Temperatures {
    private Temperatures() {
    }

    public static double fahrenheitToCelsius(double fahrenheit) {
        return (fahrenheit - 32) * 5 / 9;
    }

    // archive values are integer tenths of a degree
    public static double tenthsToCelsius(int tenths) {
        return tenths / 10.0;
    }
}
