/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.api.types;

import java.util.List;

import jakarta.validation.constraints.NotEmpty;

/**
 * Request body for a batch run: one independent pipeline per location, same audience for all.
 */
public record BatchInsightRequestType(@NotEmpty List<String> locations, String audience) {
}
