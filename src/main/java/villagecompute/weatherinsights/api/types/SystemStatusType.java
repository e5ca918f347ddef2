/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.api.types;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Health summary of the insight workflow.
 *
 * @param workflow
 *            {@code operational} or {@code degraded}
 * @param knowledgeBaseStats
 *            knowledge store statistics
 * @param weatherProvider
 *            {@code operational} or {@code error}
 * @param generationProvider
 *            {@code operational} or {@code error}
 * @param timestamp
 *            when the status was computed
 */
public record SystemStatusType(String workflow, @JsonProperty("knowledge_base_stats") KnowledgeBaseStatsType knowledgeBaseStats,
        @JsonProperty("weather_provider") String weatherProvider,
        @JsonProperty("generation_provider") String generationProvider, Instant timestamp) {
}
