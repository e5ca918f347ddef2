/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.integration.weather;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.quarkus.cache.CacheResult;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weatherinsights.api.types.LocationType;
import villagecompute.weatherinsights.api.types.WeatherSnapshotType;
import villagecompute.weatherinsights.exceptions.InvalidLocationException;
import villagecompute.weatherinsights.exceptions.ProviderUnavailableException;

/**
 * HTTP client for the OpenWeather geocoding, current-weather and 5-day/3-hour forecast APIs.
 *
 * <p>
 * Requests are made in OpenWeather standard units (Kelvin, m/s, hPa, metres, mm) and normalized while parsing:
 * temperatures to Celsius, visibility to kilometres. Fields missing from a payload stay null. Non-numeric values are
 * never coerced; they are recorded in {@link WeatherSnapshotType#malformedFields()} for the data-quality validator.
 *
 * <h2>API Details</h2>
 * <ul>
 * <li>Geocoding: {@code GET {geocoding-url}/direct?q=&limit=1&appid=}</li>
 * <li>Current: {@code GET {base-url}/weather?lat=&lon=&appid=}</li>
 * <li>Forecast: {@code GET {base-url}/forecast?lat=&lon=&appid=} (40 steps, 3 hours apart)</li>
 * </ul>
 *
 * <h2>Error Mapping</h2>
 * <ul>
 * <li>Empty geocoding result, 400/404 on geocoding, 400 on data: {@link InvalidLocationException}</li>
 * <li>Rejected key (401/403), rate limit (429), other non-200 status, I/O error, timeout, unparseable body:
 * {@link ProviderUnavailableException}</li>
 * </ul>
 *
 * @see <a href="https://openweathermap.org/api">OpenWeather API Documentation</a>
 */
@ApplicationScoped
public class OpenWeatherClient {

    private static final Logger LOG = Logger.getLogger(OpenWeatherClient.class);

    public static final String PROVIDER = "openweather";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    @ConfigProperty(
            name = "openweather.api-key",
            defaultValue = "")
    String apiKey;

    @ConfigProperty(
            name = "openweather.base-url",
            defaultValue = "https://api.openweathermap.org/data/2.5")
    String baseUrl;

    @ConfigProperty(
            name = "openweather.geocoding-url",
            defaultValue = "https://api.openweathermap.org/geo/1.0")
    String geocodingUrl;

    @ConfigProperty(
            name = "openweather.request-timeout-seconds",
            defaultValue = "10")
    int requestTimeoutSeconds;

    @Inject
    public OpenWeatherClient(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(5)).build();
    }

    /**
     * Resolves a location name to coordinates using the first geocoding hit. Results are cached by name.
     *
     * @param name
     *            location name (e.g., "Manila" or "Manila,PH")
     * @return resolved location, keeping the caller's name
     * @throws InvalidLocationException
     *             if the name does not resolve
     * @throws ProviderUnavailableException
     *             if the geocoding service cannot be reached
     */
    @CacheResult(
            cacheName = "weather-geocoding-cache")
    public LocationType geocode(String name) {
        String url = String.format("%s/direct?q=%s&limit=1&appid=%s", geocodingUrl,
                URLEncoder.encode(name, StandardCharsets.UTF_8), requireApiKey());
        LOG.debugf("Geocoding location '%s'", name);

        HttpResponse<String> response = send(url, "geocoding");
        int status = response.statusCode();
        if (status == 400 || status == 404) {
            throw new InvalidLocationException("Location could not be resolved: " + name);
        }
        if (status != 200) {
            throw new ProviderUnavailableException(PROVIDER,
                    "OpenWeather geocoding returned status " + status + ": " + response.body());
        }
        return parseGeocoding(response.body(), name);
    }

    /**
     * Fetches current conditions for resolved coordinates.
     */
    public WeatherSnapshotType fetchCurrent(LocationType location) {
        String url = String.format(Locale.ROOT, "%s/weather?lat=%.4f&lon=%.4f&appid=%s", baseUrl, location.latitude(),
                location.longitude(), requireApiKey());
        LOG.debugf("Fetching OpenWeather current conditions for %s (%.2f,%.2f)", location.name(), location.latitude(),
                location.longitude());
        return parseCurrent(readData(url, "current weather", location));
    }

    /**
     * Fetches the 5-day/3-hour forecast for resolved coordinates, in the order the provider returned it.
     */
    public List<WeatherSnapshotType> fetchForecast(LocationType location) {
        String url = String.format(Locale.ROOT, "%s/forecast?lat=%.4f&lon=%.4f&appid=%s", baseUrl, location.latitude(),
                location.longitude(), requireApiKey());
        LOG.debugf("Fetching OpenWeather forecast for %s (%.2f,%.2f)", location.name(), location.latitude(),
                location.longitude());
        return parseForecast(readData(url, "forecast", location));
    }

    private String readData(String url, String what, LocationType location) {
        HttpResponse<String> response = send(url, what);
        int status = response.statusCode();
        if (status == 400) {
            throw new InvalidLocationException("Coordinates rejected by weather provider for " + location.name());
        }
        if (status != 200) {
            throw new ProviderUnavailableException(PROVIDER,
                    "OpenWeather " + what + " returned status " + status + ": " + response.body());
        }
        return response.body();
    }

    private HttpResponse<String> send(String url, String what) {
        try {
            HttpRequest request = HttpRequest.newBuilder().uri(URI.create(url))
                    .timeout(Duration.ofSeconds(requestTimeoutSeconds)).GET().build();
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ProviderUnavailableException(PROVIDER, "OpenWeather " + what + " request timed out", e);
        } catch (IOException e) {
            throw new ProviderUnavailableException(PROVIDER, "OpenWeather " + what + " request failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderUnavailableException(PROVIDER, "OpenWeather " + what + " request interrupted", e);
        }
    }

    private String requireApiKey() {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ProviderUnavailableException(PROVIDER, "openweather.api-key is not configured");
        }
        return apiKey;
    }

    /**
     * Parses a geocoding response array. Package-private for testing.
     */
    LocationType parseGeocoding(String json, String name) {
        JsonNode root = readTree(json);
        if (!root.isArray() || root.isEmpty()) {
            throw new InvalidLocationException("Location could not be resolved: " + name);
        }
        JsonNode hit = root.get(0);
        if (!hit.path("lat").isNumber() || !hit.path("lon").isNumber()) {
            throw new ProviderUnavailableException(PROVIDER, "Geocoding hit without coordinates for " + name);
        }
        return new LocationType(name, hit.path("lat").asDouble(), hit.path("lon").asDouble());
    }

    /**
     * Parses a {@code /weather} response body. Package-private for testing.
     */
    WeatherSnapshotType parseCurrent(String json) {
        return parseSnapshot(readTree(json));
    }

    /**
     * Parses a {@code /forecast} response body. Package-private for testing.
     */
    List<WeatherSnapshotType> parseForecast(String json) {
        JsonNode list = readTree(json).path("list");
        List<WeatherSnapshotType> steps = new ArrayList<>();
        for (JsonNode item : list) {
            steps.add(parseSnapshot(item));
        }
        return steps;
    }

    private JsonNode readTree(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ProviderUnavailableException(PROVIDER, "Unparseable OpenWeather response", e);
        }
    }

    private WeatherSnapshotType parseSnapshot(JsonNode node) {
        List<String> malformed = new ArrayList<>();
        JsonNode main = node.path("main");
        JsonNode wind = node.path("wind");
        JsonNode rain = node.path("rain");

        Double kelvin = readNumber(main, "temp", "temperature", malformed);
        Double temperature = kelvin != null ? UnitNormalizer.kelvinToCelsius(kelvin) : null;
        Double humidity = readNumber(main, "humidity", "humidity", malformed);
        Double pressure = readNumber(main, "pressure", "pressure", malformed);
        Double windSpeed = readNumber(wind, "speed", "wind_speed", malformed);
        Double windDirection = readNumber(wind, "deg", "wind_direction", malformed);
        Double metres = readNumber(node, "visibility", "visibility", malformed);
        Double visibility = metres != null ? UnitNormalizer.metresToKilometres(metres) : null;
        Double cloudiness = readNumber(node.path("clouds"), "all", "cloudiness", malformed);
        Double rainfall1h = readNumber(rain, "1h", "rainfall_1h", malformed);
        Double rainfall3h = readNumber(rain, "3h", "rainfall_3h", malformed);

        JsonNode weather = node.path("weather").path(0);
        Double code = readNumber(weather, "id", "condition_code", malformed);
        Integer conditionCode = code != null ? code.intValue() : null;
        String description = null;
        if (weather.path("description").isTextual()) {
            description = capitalize(weather.path("description").asText());
        } else if (conditionCode != null) {
            description = WeatherConditionMapper.describe(conditionCode);
        }

        Double epochSeconds = readNumber(node, "dt", "timestamp", malformed);
        Instant timestamp = epochSeconds != null ? Instant.ofEpochSecond(epochSeconds.longValue()) : null;

        return new WeatherSnapshotType(temperature, humidity, pressure, windSpeed, windDirection, visibility, cloudiness,
                rainfall1h, rainfall3h, conditionCode, description, timestamp, malformed);
    }

    /**
     * Reads a numeric field. Missing and JSON null yield null; anything else that is not a JSON number is recorded as
     * malformed and also yields null.
     */
    private static Double readNumber(JsonNode parent, String field, String label, List<String> malformed) {
        JsonNode value = parent.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        if (!value.isNumber()) {
            malformed.add(label + "=" + value.asText());
            return null;
        }
        return value.asDouble();
    }

    private static String capitalize(String text) {
        if (text.isEmpty()) {
            return text;
        }
        return Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }
}
