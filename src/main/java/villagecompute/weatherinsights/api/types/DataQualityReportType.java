/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.api.types;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;

/**
 * Data-quality verdict for one request's observations.
 *
 * @param qualityScore
 *            share of checked fields that were present and plausible (0.0-1.0)
 * @param anomaliesDetected
 *            human-readable anomaly descriptions in detection order
 */
public record DataQualityReportType(@JsonProperty("quality_score") @DecimalMin("0.0") @DecimalMax("1.0") double qualityScore,
        @JsonProperty("anomalies_detected") List<String> anomaliesDetected) {

    public DataQualityReportType {
        anomaliesDetected = anomaliesDetected == null ? List.of() : List.copyOf(anomaliesDetected);
    }
}
