/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.integration.weather;

import java.util.Optional;

import villagecompute.weatherinsights.api.types.RiskKind;

/**
 * Utility for mapping OpenWeather condition codes to human-readable conditions and hazard families.
 *
 * <h2>OpenWeather Code Ranges</h2>
 * <ul>
 * <li>2xx: Thunderstorm</li>
 * <li>3xx: Drizzle</li>
 * <li>5xx: Rain (502-504, 522, 531 heavy)</li>
 * <li>6xx: Snow</li>
 * <li>7xx: Atmosphere (mist, smoke, dust, squalls, tornado)</li>
 * <li>800: Clear sky</li>
 * <li>801-804: Clouds</li>
 * </ul>
 *
 * @see <a href="https://openweathermap.org/weather-conditions">OpenWeather weather conditions</a>
 */
public final class WeatherConditionMapper {

    private WeatherConditionMapper() {
        // Utility class
    }

    /**
     * Maps an OpenWeather condition code to human-readable condition text.
     *
     * @param code
     *            OpenWeather condition code (200-804)
     * @return condition text (e.g., "Thunderstorm with heavy rain", "Overcast clouds")
     */
    public static String describe(int code) {
        return switch (code) {
            case 200 -> "Thunderstorm with light rain";
            case 201 -> "Thunderstorm with rain";
            case 202 -> "Thunderstorm with heavy rain";
            case 210 -> "Light thunderstorm";
            case 211 -> "Thunderstorm";
            case 212 -> "Heavy thunderstorm";
            case 221 -> "Ragged thunderstorm";
            case 230, 231, 232 -> "Thunderstorm with drizzle";
            case 500 -> "Light rain";
            case 501 -> "Moderate rain";
            case 502 -> "Heavy intensity rain";
            case 503 -> "Very heavy rain";
            case 504 -> "Extreme rain";
            case 511 -> "Freezing rain";
            case 520, 521, 522, 531 -> "Shower rain";
            case 701 -> "Mist";
            case 711 -> "Smoke";
            case 721 -> "Haze";
            case 731, 761 -> "Dust";
            case 741 -> "Fog";
            case 751 -> "Sand";
            case 762 -> "Volcanic ash";
            case 771 -> "Squalls";
            case 781 -> "Tornado";
            case 800 -> "Clear sky";
            case 801 -> "Few clouds";
            case 802 -> "Scattered clouds";
            case 803 -> "Broken clouds";
            case 804 -> "Overcast clouds";
            default -> describeGroup(code);
        };
    }

    private static String describeGroup(int code) {
        return switch (code / 100) {
            case 2 -> "Thunderstorm";
            case 3 -> "Drizzle";
            case 5 -> "Rain";
            case 6 -> "Snow";
            case 7 -> "Atmospheric haze";
            case 8 -> "Clouds";
            default -> "Unknown";
        };
    }

    public static boolean isThunderstorm(int code) {
        return code >= 200 && code < 300;
    }

    public static boolean isHeavyRain(int code) {
        return code == 202 || code == 212 || code == 502 || code == 503 || code == 504 || code == 522
                || code == 531;
    }

    /**
     * Hazard family a condition code points to on its own, independent of measured values.
     *
     * @return storm for thunderstorms, flood for heavy rain, wind for squalls and tornadoes, else empty
     */
    public static Optional<RiskKind> hazardKind(int code) {
        if (isThunderstorm(code)) {
            return Optional.of(RiskKind.STORM);
        }
        if (isHeavyRain(code)) {
            return Optional.of(RiskKind.FLOOD);
        }
        if (code == 771 || code == 781) {
            return Optional.of(RiskKind.WIND);
        }
        return Optional.empty();
    }
}
