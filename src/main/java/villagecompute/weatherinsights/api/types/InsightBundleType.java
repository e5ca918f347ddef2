/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.api.types;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Final artifact of one pipeline run.
 *
 * <p>
 * A complete bundle has every field populated. A degraded bundle keeps whatever the stages before the failure produced
 * and leaves the rest null; nothing is back-filled with placeholder data. {@code failure} names the stage that failed.
 *
 * <p>
 * Field names and the priority/timing values inside {@code recommendations} are consumed by existing clients and must
 * not change.
 */
@Schema(
        description = "Weather insights for one location and audience")
public record InsightBundleType(LocationType location, @JsonProperty("current_weather") WeatherSnapshotType currentWeather,
        @JsonProperty("data_quality") DataQualityReportType dataQuality,
        @JsonProperty("risk_alerts") List<String> riskAlerts,
        @JsonProperty("weather_trends") List<String> weatherTrends,
        List<RecommendationType> recommendations, String summary,
        @JsonProperty("priority_summary") String prioritySummary,
        @JsonProperty("action_checklist") List<String> actionChecklist,
        @JsonProperty("contact_suggestions") List<String> contactSuggestions,
        @JsonProperty("relevant_knowledge") List<KnowledgePassageType> relevantKnowledge, Audience audience,
        InsightStatus status, PipelineFailureType failure, @JsonProperty("analysis_time") Instant analysisTime) {

    public InsightBundleType {
        riskAlerts = copyOrNull(riskAlerts);
        weatherTrends = copyOrNull(weatherTrends);
        recommendations = copyOrNull(recommendations);
        actionChecklist = copyOrNull(actionChecklist);
        contactSuggestions = copyOrNull(contactSuggestions);
        relevantKnowledge = copyOrNull(relevantKnowledge);
    }

    @JsonIgnore
    public boolean isDegraded() {
        return status == InsightStatus.DEGRADED;
    }

    private static <T> List<T> copyOrNull(List<T> list) {
        return list == null ? null : List.copyOf(list);
    }
}
