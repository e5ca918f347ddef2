/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.api.types;

/**
 * Knowledge base entry as stored in {@code knowledge/weather-knowledge.json}.
 *
 * @param id
 *            stable document identifier
 * @param title
 *            short title
 * @param text
 *            passage body, the text that is embedded
 * @param category
 *            {@code weather_advisory} or {@code best_practice}
 * @param source
 *            origin tag (e.g., "system", "pagasa")
 */
public record KnowledgeDocumentType(String id, String title, String text, String category, String source) {
}
