package villagecompute.weatherinsights.testing;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.WireMock;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;

import io.quarkus.test.common.QuarkusTestResourceLifecycleManager;

/**
 * Points the OpenWeather client of a {@code @QuarkusTest} at a WireMock server with canned responses.
 *
 * <p>
 * "Manila" geocodes to the stubbed coordinates and receives the thunderstorm current/forecast payloads. "Atlantis"
 * geocodes to an empty result. "Keyless" gets 401 from geocoding, as OpenWeather answers a rejected API key.
 */
public class OpenWeatherTestResource implements QuarkusTestResourceLifecycleManager {

    private WireMockServer wireMockServer;

    @Override
    public Map<String, String> start() {
        wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMockServer.start();

        stubGeocoding("Manila", 200, load("wiremock/openweather/geocoding-manila.json"));
        stubGeocoding("Atlantis", 200, load("wiremock/openweather/geocoding-empty.json"));
        stubGeocoding("Keyless", 401, "{\"cod\":401,\"message\":\"Invalid API key\"}");
        stubData("/data/2.5/weather", load("wiremock/openweather/current-storm.json"));
        stubData("/data/2.5/forecast", load("wiremock/openweather/forecast-storm.json"));

        return Map.of("openweather.base-url", wireMockServer.baseUrl() + "/data/2.5", "openweather.geocoding-url",
                wireMockServer.baseUrl() + "/geo/1.0");
    }

    @Override
    public void stop() {
        if (wireMockServer != null) {
            wireMockServer.stop();
        }
    }

    private void stubGeocoding(String name, int status, String body) {
        wireMockServer.stubFor(WireMock.get(WireMock.urlPathEqualTo("/geo/1.0/direct"))
                .withQueryParam("q", WireMock.equalTo(name)).willReturn(WireMock.aResponse().withStatus(status)
                        .withHeader("Content-Type", "application/json").withBody(body)));
    }

    private void stubData(String path, String body) {
        wireMockServer.stubFor(WireMock.get(WireMock.urlPathEqualTo(path)).willReturn(
                WireMock.aResponse().withStatus(200).withHeader("Content-Type", "application/json").withBody(body)));
    }

    private static String load(String resourcePath) {
        try (InputStream in = OpenWeatherTestResource.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new IllegalStateException("Stub file not found in test resources: " + resourcePath);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load stub file: " + resourcePath, e);
        }
    }
}
