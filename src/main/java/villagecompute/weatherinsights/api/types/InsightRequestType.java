/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.api.types;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;

/**
 * Request body for a single-location insight run.
 *
 * @param location
 *            location name
 * @param audience
 *            audience wire value or alias; defaults to {@code general_public}
 * @param latitude
 *            optional latitude, skips geocoding when given together with longitude
 * @param longitude
 *            optional longitude
 */
public record InsightRequestType(@NotBlank String location, String audience,
        @DecimalMin("-90.0") @DecimalMax("90.0") Double latitude,
        @DecimalMin("-180.0") @DecimalMax("180.0") Double longitude) {
}
