/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.integration.weather;

/**
 * Converts OpenWeather standard units to the units the pipeline works in.
 */
public final class UnitNormalizer {

    private static final double KELVIN_OFFSET = 273.15;

    private UnitNormalizer() {
        // Utility class
    }

    /**
     * Kelvin to Celsius, rounded to two decimals.
     */
    public static double kelvinToCelsius(double kelvin) {
        return Math.round((kelvin - KELVIN_OFFSET) * 100.0) / 100.0;
    }

    /**
     * Metres to kilometres, rounded to two decimals.
     */
    public static double metresToKilometres(double metres) {
        return Math.round(metres / 10.0) / 100.0;
    }
}
