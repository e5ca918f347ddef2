/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Best-practice passage retrieved from the knowledge store.
 *
 * @param text
 *            passage body
 * @param relevanceScore
 *            similarity to the query (0.0-1.0, higher is closer)
 * @param sourceTag
 *            origin of the passage (e.g., "system", "pagasa")
 * @param title
 *            short passage title
 * @param category
 *            {@code weather_advisory} or {@code best_practice}
 */
public record KnowledgePassageType(String text, @JsonProperty("relevance_score") double relevanceScore,
        @JsonProperty("source_tag") String sourceTag, String title, String category) {
}
