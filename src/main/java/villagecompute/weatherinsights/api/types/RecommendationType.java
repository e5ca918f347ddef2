/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.api.types;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Actionable recommendation for one audience.
 *
 * @param title
 *            short action summary
 * @param action
 *            the specific action to take
 * @param reason
 *            why the action is recommended
 * @param priority
 *            critical, high, medium or low
 * @param timing
 *            when to act
 * @param targetAudience
 *            audience the recommendation is written for; always the requested audience
 * @param resourcesNeeded
 *            what is needed to act, possibly empty
 */
@Schema(
        description = "Actionable recommendation tailored to the requested audience")
public record RecommendationType(@Schema(
        description = "Short action summary",
        example = "Secure outdoor equipment",
        required = true) @NotBlank String title,

        @Schema(
                description = "Specific action to take",
                required = true) @NotBlank String action,

        @Schema(
                description = "Why this action is recommended",
                required = true) @NotBlank String reason,

        @Schema(
                description = "Priority",
                example = "high",
                required = true) @NotNull RecommendationPriority priority,

        @Schema(
                description = "When to act",
                example = "today",
                required = true) @NotNull RecommendationTiming timing,

        @Schema(
                description = "Audience the recommendation is written for",
                example = "farmers",
                required = true) @JsonProperty("target_audience") @NotNull Audience targetAudience,

        @Schema(
                description = "Resources needed to act") @JsonProperty("resources_needed") List<String> resourcesNeeded) {

    public RecommendationType {
        resourcesNeeded = resourcesNeeded == null ? List.of() : List.copyOf(resourcesNeeded);
    }

    public RecommendationType withPriority(RecommendationPriority newPriority) {
        return new RecommendationType(title, action, reason, newPriority, timing, targetAudience, resourcesNeeded);
    }

    public RecommendationType withTargetAudience(Audience audience) {
        return new RecommendationType(title, action, reason, priority, timing, audience, resourcesNeeded);
    }
}
