/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * User-visible failure: the stage that failed and a human-readable cause. Never carries raw provider diagnostics.
 */
public record PipelineFailureType(PipelineStage stage, @JsonProperty("error") String cause) {
}
