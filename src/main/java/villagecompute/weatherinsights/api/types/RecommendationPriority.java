/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.api.types;

import java.util.Locale;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Priority of a recommendation. Declaration order is the sort order: {@code CRITICAL} first.
 */
public enum RecommendationPriority {

    CRITICAL("critical"), HIGH("high"), MEDIUM("medium"), LOW("low");

    private final String value;

    RecommendationPriority(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Parses a wire value, case-insensitively.
     *
     * @return the priority, or empty if {@code raw} is not one of the four recognized values
     */
    public static Optional<RecommendationPriority> fromValue(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (RecommendationPriority priority : values()) {
            if (priority.value.equals(normalized)) {
                return Optional.of(priority);
            }
        }
        return Optional.empty();
    }

    /**
     * Maps a risk severity onto the priority scale one-to-one.
     */
    public static RecommendationPriority forSeverity(RiskSeverity severity) {
        return switch (severity) {
            case CRITICAL -> CRITICAL;
            case HIGH -> HIGH;
            case MEDIUM -> MEDIUM;
            case LOW -> LOW;
        };
    }
}
