/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.api.types;

import com.fasterxml.jackson.annotation.JsonIgnore;

import jakarta.validation.constraints.NotBlank;

/**
 * Named location, optionally with coordinates.
 *
 * <p>
 * Coordinates are null until the location is resolved. A resolved location is never changed during a pipeline run.
 *
 * @param name
 *            location name as supplied by the caller (e.g., "Manila", "Davao City")
 * @param latitude
 *            latitude in degrees (-90 to 90), null if unresolved
 * @param longitude
 *            longitude in degrees (-180 to 180), null if unresolved
 */
public record LocationType(@NotBlank String name, Double latitude, Double longitude) {

    public static LocationType named(String name) {
        return new LocationType(name, null, null);
    }

    @JsonIgnore
    public boolean isResolved() {
        return latitude != null && longitude != null;
    }
}
