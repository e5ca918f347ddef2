/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.services;

import java.util.List;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.faulttolerance.Timeout;
import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weatherinsights.api.types.LocationType;
import villagecompute.weatherinsights.api.types.WeatherObservationType;
import villagecompute.weatherinsights.api.types.WeatherSnapshotType;
import villagecompute.weatherinsights.exceptions.InvalidLocationException;
import villagecompute.weatherinsights.integration.weather.OpenWeatherClient;

/**
 * Resolves a location and retrieves current conditions plus the 5-day forecast.
 *
 * <p>
 * Caller-supplied coordinates skip geocoding but must be in range. The forecast is returned in provider order; ordering
 * problems are left for the data-quality validator to report.
 *
 * <p>
 * A whole fetch (geocoding plus both data calls) is bounded by a 15s {@code @Timeout}, overridable through
 * {@code villagecompute.weatherinsights.services.WeatherObservationFetcher/fetch/Timeout/value}.
 */
@ApplicationScoped
public class WeatherObservationFetcher {

    private static final Logger LOG = Logger.getLogger(WeatherObservationFetcher.class);

    private final OpenWeatherClient client;

    @ConfigProperty(
            name = "insights.status.check-latitude",
            defaultValue = "14.5995")
    double checkLatitude;

    @ConfigProperty(
            name = "insights.status.check-longitude",
            defaultValue = "120.9842")
    double checkLongitude;

    @Inject
    public WeatherObservationFetcher(OpenWeatherClient client) {
        this.client = client;
    }

    /**
     * Fetches observations for a location.
     *
     * @param requested
     *            location name, with optional coordinates
     * @return resolved location, current snapshot and forecast series
     * @throws InvalidLocationException
     *             if the location cannot be resolved or the coordinates are out of range
     */
    @Timeout(15000)
    public WeatherObservationType fetch(LocationType requested) {
        LocationType location = resolve(requested);
        WeatherSnapshotType current = client.fetchCurrent(location);
        List<WeatherSnapshotType> forecast = client.fetchForecast(location);
        LOG.debugf("Fetched observations for %s: forecastSteps=%d", location.name(), forecast.size());
        return new WeatherObservationType(location, current, forecast);
    }

    /**
     * Resolves a location to coordinates without fetching weather.
     */
    public LocationType resolve(LocationType requested) {
        if (requested == null) {
            throw new InvalidLocationException("No location given");
        }
        if (requested.isResolved()) {
            double lat = requested.latitude();
            double lon = requested.longitude();
            if (!Double.isFinite(lat) || !Double.isFinite(lon) || lat < -90 || lat > 90 || lon < -180 || lon > 180) {
                throw new InvalidLocationException(
                        String.format("Coordinates out of range for %s: %s,%s", requested.name(), lat, lon));
            }
            return requested;
        }
        if (requested.name() == null || requested.name().isBlank()) {
            throw new InvalidLocationException("Location name is blank");
        }
        return client.geocode(requested.name().trim());
    }

    /**
     * Checks that the weather provider answers by requesting current conditions for fixed coordinates. Goes to the
     * provider on every call; geocoding results are cached and would hide an outage.
     *
     * @return true if the provider returned current conditions
     */
    public boolean checkAvailability() {
        try {
            client.fetchCurrent(new LocationType("status-check", checkLatitude, checkLongitude));
            return true;
        } catch (RuntimeException e) {
            LOG.warnf("Weather provider availability check failed: %s", e.getMessage());
            return false;
        }
    }
}
