/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.services;

import java.util.function.Function;

import villagecompute.weatherinsights.api.types.WeatherSnapshotType;

/**
 * Physical plausibility bounds for the numeric snapshot fields.
 *
 * <p>
 * A value is trusted only when present, finite and inside its bounds (inclusive). The validator reports untrusted values
 * as anomalies; the analyzer reads values through {@link #trusted(WeatherSnapshotType)} so an implausible reading never
 * drives a risk signal.
 */
public enum PlausibleRange {

    TEMPERATURE("temperature", "°C", -90.0, 60.0, false, WeatherSnapshotType::temperature),
    HUMIDITY("humidity", "%", 0.0, 100.0, false, WeatherSnapshotType::humidity),
    PRESSURE("pressure", "hPa", 850.0, 1085.0, false, WeatherSnapshotType::pressure),
    WIND_SPEED("wind_speed", "m/s", 0.0, Double.POSITIVE_INFINITY, false, WeatherSnapshotType::windSpeed),
    WIND_DIRECTION("wind_direction", "°", 0.0, 360.0, false, WeatherSnapshotType::windDirection),
    VISIBILITY("visibility", "km", 0.0, Double.POSITIVE_INFINITY, false, WeatherSnapshotType::visibility),
    CLOUDINESS("cloudiness", "%", 0.0, 100.0, false, WeatherSnapshotType::cloudiness),
    RAINFALL_1H("rainfall_1h", "mm", 0.0, Double.POSITIVE_INFINITY, true, WeatherSnapshotType::rainfall1h),
    RAINFALL_3H("rainfall_3h", "mm", 0.0, Double.POSITIVE_INFINITY, true, WeatherSnapshotType::rainfall3h);

    private final String field;
    private final String unit;
    private final double min;
    private final double max;
    private final boolean optional;
    private final Function<WeatherSnapshotType, Double> accessor;

    PlausibleRange(String field, String unit, double min, double max, boolean optional,
            Function<WeatherSnapshotType, Double> accessor) {
        this.field = field;
        this.unit = unit;
        this.min = min;
        this.max = max;
        this.optional = optional;
        this.accessor = accessor;
    }

    public String field() {
        return field;
    }

    /**
     * Optional fields are only checked when reported; their absence is not a completeness gap.
     */
    public boolean isOptional() {
        return optional;
    }

    public Double read(WeatherSnapshotType snapshot) {
        return snapshot == null ? null : accessor.apply(snapshot);
    }

    public boolean accepts(double value) {
        return Double.isFinite(value) && value >= min && value <= max;
    }

    /**
     * Returns the field's value if it is trusted, else null.
     */
    public Double trusted(WeatherSnapshotType snapshot) {
        Double value = read(snapshot);
        return value != null && accepts(value) ? value : null;
    }

    /**
     * Human-readable bounds, e.g. {@code [-90, 60] °C} or {@code >= 0 m/s}.
     */
    public String describeBounds() {
        if (Double.isInfinite(max)) {
            return String.format(">= %s %s", format(min), unit);
        }
        return String.format("[%s, %s] %s", format(min), format(max), unit);
    }

    private static String format(double bound) {
        return bound == Math.rint(bound) ? String.valueOf((long) bound) : String.valueOf(bound);
    }
}
