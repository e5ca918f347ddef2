/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.api.types;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

public record KnowledgeBaseStatsType(@JsonProperty("total_documents") int totalDocuments,
        @JsonProperty("vector_dimension") int vectorDimension,
        @JsonProperty("category_distribution") Map<String, Integer> categoryDistribution, String store) {

    public KnowledgeBaseStatsType {
        categoryDistribution = categoryDistribution == null ? Map.of() : Map.copyOf(categoryDistribution);
    }
}
