/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.integration.weather;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.github.tomakehurst.wiremock.client.WireMock;

import villagecompute.weatherinsights.WireMockTestBase;
import villagecompute.weatherinsights.api.types.LocationType;
import villagecompute.weatherinsights.api.types.WeatherSnapshotType;
import villagecompute.weatherinsights.exceptions.InvalidLocationException;
import villagecompute.weatherinsights.exceptions.ProviderUnavailableException;

/**
 * Tests for {@link OpenWeatherClient} against WireMock stubs of the OpenWeather API.
 */
class OpenWeatherClientTest extends WireMockTestBase {

    private static final LocationType MANILA = new LocationType("Manila", 14.5995, 120.9842);

    private OpenWeatherClient client;

    @BeforeEach
    void setUp() {
        client = TestWeatherClients.create(openWeatherBaseUrl(), openWeatherGeocodingUrl());
    }

    @Test
    void testGeocode_resolvesFirstHit() {
        // Arrange
        stubGeocoding("Manila", "wiremock/openweather/geocoding-manila.json");

        // Act
        LocationType location = client.geocode("Manila");

        // Assert
        assertEquals("Manila", location.name());
        assertEquals(14.5995, location.latitude(), 0.0001);
        assertEquals(120.9842, location.longitude(), 0.0001);
        wireMockServer.verify(WireMock.getRequestedFor(WireMock.urlPathEqualTo("/geo/1.0/direct"))
                .withQueryParam("appid", WireMock.equalTo(TestWeatherClients.API_KEY))
                .withQueryParam("limit", WireMock.equalTo("1")));
    }

    @Test
    void testGeocode_emptyResultIsInvalidLocation() {
        stubGeocoding("Atlantis", "wiremock/openweather/geocoding-empty.json");

        InvalidLocationException e = assertThrows(InvalidLocationException.class, () -> client.geocode("Atlantis"));
        assertTrue(e.getMessage().contains("Atlantis"));
    }

    @Test
    void testGeocode_notFoundIsInvalidLocation() {
        stubGeocodingStatus("Nowhere", 404);

        assertThrows(InvalidLocationException.class, () -> client.geocode("Nowhere"));
    }

    @Test
    void testGeocode_serverErrorIsProviderUnavailable() {
        stubGeocodingStatus("Manila", 500);

        ProviderUnavailableException e = assertThrows(ProviderUnavailableException.class,
                () -> client.geocode("Manila"));
        assertTrue(e.getMessage().contains("500"), e.getMessage());
    }

    @Test
    void testGeocode_rejectedKeyIsProviderUnavailable() {
        stubGeocodingStatus("Manila", 401);

        ProviderUnavailableException e = assertThrows(ProviderUnavailableException.class,
                () -> client.geocode("Manila"));
        assertTrue(e.getMessage().contains("401"), e.getMessage());
        assertEquals(OpenWeatherClient.PROVIDER, e.getProvider());
    }

    @Test
    void testGeocode_forbiddenAndRateLimitedAreProviderUnavailable() {
        stubGeocodingStatus("Manila", 403);
        stubGeocodingStatus("Cebu", 429);

        assertThrows(ProviderUnavailableException.class, () -> client.geocode("Manila"));
        assertThrows(ProviderUnavailableException.class, () -> client.geocode("Cebu"));
    }

    @Test
    void testFetchCurrent_normalizesUnits() {
        // Arrange
        stubCurrentWeather("wiremock/openweather/current-storm.json");

        // Act
        WeatherSnapshotType current = client.fetchCurrent(MANILA);

        // Assert
        assertEquals(33.0, current.temperature(), 0.01);
        assertEquals(80.0, current.humidity());
        assertEquals(1004.0, current.pressure());
        assertEquals(8.0, current.windSpeed());
        assertEquals(6.0, current.visibility(), 0.001);
        assertEquals(20.0, current.rainfall3h());
        assertNull(current.rainfall1h());
        assertEquals(211, current.conditionCode());
        assertEquals("Thunderstorm", current.conditionDescription());
        assertEquals(Instant.ofEpochSecond(1748757600L), current.timestamp());
        assertTrue(current.malformedFields().isEmpty());
    }

    @Test
    void testFetchCurrent_recordsMalformedFields() {
        stubCurrentWeather("wiremock/openweather/current-malformed.json");

        WeatherSnapshotType current = client.fetchCurrent(MANILA);

        assertNull(current.temperature());
        assertNull(current.windSpeed());
        assertEquals(55.0, current.humidity());
        assertEquals(List.of("temperature=N/A", "wind_speed=calm"), current.malformedFields());
    }

    @Test
    void testFetchForecast_keepsProviderOrder() {
        // Arrange
        stubForecast("wiremock/openweather/forecast-storm.json");

        // Act
        List<WeatherSnapshotType> forecast = client.fetchForecast(MANILA);

        // Assert
        assertEquals(8, forecast.size());
        for (int i = 1; i < forecast.size(); i++) {
            assertTrue(forecast.get(i).timestamp().isAfter(forecast.get(i - 1).timestamp()));
        }
        assertEquals(31.0, forecast.get(0).temperature(), 0.01);
        assertEquals(211, forecast.get(0).conditionCode());
        assertEquals(800, forecast.get(7).conditionCode());
        assertEquals("Clear sky", forecast.get(7).conditionDescription());
    }

    @Test
    void testFetchForecast_serviceUnavailable() {
        stubDataStatus("/data/2.5/forecast", 503);

        assertThrows(ProviderUnavailableException.class, () -> client.fetchForecast(MANILA));
    }

    @Test
    void testFetchCurrent_badRequestIsInvalidLocation() {
        stubDataStatus("/data/2.5/weather", 400);

        assertThrows(InvalidLocationException.class, () -> client.fetchCurrent(MANILA));
    }

    @Test
    void testFetchCurrent_unparseableBody() {
        wireMockServer.stubFor(WireMock.get(WireMock.urlPathEqualTo("/data/2.5/weather"))
                .willReturn(WireMock.aResponse().withStatus(200).withBody("<html>maintenance</html>")));

        assertThrows(ProviderUnavailableException.class, () -> client.fetchCurrent(MANILA));
    }

    @Test
    void testMissingApiKey_isProviderUnavailable() {
        OpenWeatherClient unconfigured = TestWeatherClients.create(openWeatherBaseUrl(), openWeatherGeocodingUrl(),
                "");

        assertThrows(ProviderUnavailableException.class, () -> unconfigured.geocode("Manila"));
        assertEquals(0, wireMockServer.getAllServeEvents().size(), "No request should be sent without a key");
    }
}
