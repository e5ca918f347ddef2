package villagecompute.weatherinsights;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.WireMock;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;

/**
 * Abstract base class for tests requiring WireMock HTTP API mocking.
 *
 * <p>
 * Starts a WireMock server on a random port before each test and stops it afterwards. Stub bodies live under
 * {@code src/test/resources/wiremock/}.
 *
 * <p>
 * <b>Usage Example:</b>
 *
 * <pre>
 * public class OpenWeatherClientTest extends WireMockTestBase {
 *     &#64;Test
 *     void testGeocode() {
 *         stubGeocoding("Manila", "wiremock/openweather/geocoding-manila.json");
 *         // ... point the client at openWeatherGeocodingUrl() and call it
 *     }
 * }
 * </pre>
 */
public abstract class WireMockTestBase {

    /** WireMock HTTP server for stubbing external API responses. */
    protected WireMockServer wireMockServer;

    @BeforeEach
    protected void startWireMock() {
        // Start WireMock server on random port to avoid conflicts
        wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMockServer.start();
        WireMock.configureFor("localhost", wireMockServer.port());
    }

    @AfterEach
    protected void stopWireMock() {
        // Stop and reset WireMock server to prevent test pollution
        if (wireMockServer != null && wireMockServer.isRunning()) {
            wireMockServer.resetAll();
            wireMockServer.stop();
        }
    }

    /** Base URL for the stubbed OpenWeather data API. */
    protected String openWeatherBaseUrl() {
        return wireMockServer.baseUrl() + "/data/2.5";
    }

    /** Base URL for the stubbed OpenWeather geocoding API. */
    protected String openWeatherGeocodingUrl() {
        return wireMockServer.baseUrl() + "/geo/1.0";
    }

    /**
     * Stubs an OpenWeather geocoding lookup.
     *
     * <p>
     * Matches requests to: GET /geo/1.0/direct?q={name}
     */
    protected void stubGeocoding(String name, String stubFile) {
        wireMockServer.stubFor(WireMock.get(WireMock.urlPathEqualTo("/geo/1.0/direct"))
                .withQueryParam("q", WireMock.equalTo(name)).willReturn(WireMock.aResponse().withStatus(200)
                        .withHeader("Content-Type", "application/json").withBody(loadStubFile(stubFile))));
    }

    /**
     * Stubs a geocoding lookup that fails with the given HTTP status.
     */
    protected void stubGeocodingStatus(String name, int status) {
        wireMockServer.stubFor(WireMock.get(WireMock.urlPathEqualTo("/geo/1.0/direct"))
                .withQueryParam("q", WireMock.equalTo(name))
                .willReturn(WireMock.aResponse().withStatus(status).withBody("{\"cod\":" + status + "}")));
    }

    /**
     * Stubs OpenWeather current conditions for any coordinates.
     *
     * <p>
     * Matches requests to: GET /data/2.5/weather
     */
    protected void stubCurrentWeather(String stubFile) {
        stubData("/data/2.5/weather", 200, loadStubFile(stubFile));
    }

    /**
     * Stubs the OpenWeather 5-day/3-hour forecast for any coordinates.
     *
     * <p>
     * Matches requests to: GET /data/2.5/forecast
     */
    protected void stubForecast(String stubFile) {
        stubData("/data/2.5/forecast", 200, loadStubFile(stubFile));
    }

    /**
     * Stubs a data endpoint ({@code /data/2.5/weather} or {@code /data/2.5/forecast}) with an error status.
     */
    protected void stubDataStatus(String path, int status) {
        stubData(path, status, "{\"cod\":" + status + ",\"message\":\"stubbed failure\"}");
    }

    private void stubData(String path, int status, String body) {
        wireMockServer.stubFor(WireMock.get(WireMock.urlPathEqualTo(path)).willReturn(
                WireMock.aResponse().withStatus(status).withHeader("Content-Type", "application/json").withBody(body)));
    }

    /**
     * Loads a stub JSON file from the test resources directory.
     *
     * @param resourcePath
     *            the path to the stub file (relative to src/test/resources/)
     * @return the stub file contents as a UTF-8 string
     * @throws RuntimeException
     *             if the file cannot be read or does not exist
     */
    protected String loadStubFile(String resourcePath) {
        try (InputStream inputStream = getClass().getClassLoader().getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new RuntimeException("Stub file not found in test resources: " + resourcePath);
            }
            return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load stub file: " + resourcePath, e);
        }
    }
}
