/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.api.types;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * One weather reading, either current conditions or a single forecast step, in normalized units.
 *
 * <p>
 * Every field is nullable. Null means the provider did not report the value; zero is a real reading. Values the
 * provider sent in a non-numeric form are not coerced: the field is left null and the raw {@code field=value} pair is
 * kept in {@code malformedFields} for the data-quality validator.
 *
 * @param temperature
 *            air temperature in Celsius
 * @param humidity
 *            relative humidity percentage (0-100)
 * @param pressure
 *            sea-level pressure in hPa
 * @param windSpeed
 *            wind speed in metres per second
 * @param windDirection
 *            wind direction in degrees (0-360, where 0=North)
 * @param visibility
 *            visibility in kilometres
 * @param cloudiness
 *            cloud cover percentage (0-100)
 * @param rainfall1h
 *            rain volume for the last hour in millimetres
 * @param rainfall3h
 *            rain volume for the last (or, for forecast steps, the next) three hours in millimetres
 * @param conditionCode
 *            provider condition code (OpenWeather 2xx-8xx)
 * @param conditionDescription
 *            human-readable condition (e.g., "Thunderstorm with heavy rain")
 * @param timestamp
 *            observation or forecast-step time
 * @param malformedFields
 *            raw {@code field=value} pairs that could not be read as numbers
 */
@Schema(
        description = "Weather reading in normalized units; null fields were not reported by the provider")
public record WeatherSnapshotType(Double temperature, Double humidity, Double pressure,
        @JsonProperty("wind_speed") Double windSpeed, @JsonProperty("wind_direction") Double windDirection,
        Double visibility, Double cloudiness, @JsonProperty("rainfall_1h") Double rainfall1h,
        @JsonProperty("rainfall_3h") Double rainfall3h, @JsonProperty("condition_code") Integer conditionCode,
        @JsonProperty("condition_description") String conditionDescription, Instant timestamp,
        @JsonProperty("malformed_fields") List<String> malformedFields) {

    public WeatherSnapshotType {
        malformedFields = malformedFields == null ? List.of() : List.copyOf(malformedFields);
    }

    /**
     * A snapshot with every field absent.
     */
    public static WeatherSnapshotType empty() {
        return new WeatherSnapshotType(null, null, null, null, null, null, null, null, null, null, null, null,
                List.of());
    }
}
