/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.api.types;

import java.util.Locale;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * When a recommended action should be taken.
 *
 * <p>
 * {@code TODAY} and {@code WITHIN_2_HOURS} share an urgency bucket: they are both recognized wire values but sort as
 * equals, so their relative order falls back to generation order.
 */
public enum RecommendationTiming {

    IMMEDIATE("immediate", 0), TODAY("today", 1), WITHIN_2_HOURS("within_2_hours", 1), THIS_WEEK("this_week", 2),
    NEXT_WEEK("next_week", 3);

    private final String value;
    private final int urgencyBucket;

    RecommendationTiming(String value, int urgencyBucket) {
        this.value = value;
        this.urgencyBucket = urgencyBucket;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Sort key, lower is more urgent.
     */
    public int urgencyBucket() {
        return urgencyBucket;
    }

    /**
     * Parses a wire value, case-insensitively.
     *
     * @return the timing, or empty if {@code raw} is not one of the recognized values
     */
    public static Optional<RecommendationTiming> fromValue(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (RecommendationTiming timing : values()) {
            if (timing.value.equals(normalized)) {
                return Optional.of(timing);
            }
        }
        return Optional.empty();
    }

    /**
     * Default timing for a signal's timeframe, used by fallback templates.
     */
    public static RecommendationTiming forTimeframe(RiskTimeframe timeframe) {
        return switch (timeframe) {
            case IMMEDIATE -> IMMEDIATE;
            case TODAY -> TODAY;
            case THIS_WEEK -> THIS_WEEK;
            case NEXT_WEEK -> NEXT_WEEK;
        };
    }
}
