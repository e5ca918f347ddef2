/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.api.types;

import java.util.List;

/**
 * Raw provider output for one location: resolved location, current conditions and the forecast series in the order the
 * provider returned it.
 */
public record WeatherObservationType(LocationType location, WeatherSnapshotType current,
        List<WeatherSnapshotType> forecast) {

    public WeatherObservationType {
        forecast = forecast == null ? List.of() : List.copyOf(forecast);
    }
}
