/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.api.types;

import java.time.Duration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * When a hazard is expected to materialize relative to the observation time.
 */
public enum RiskTimeframe {

    IMMEDIATE("immediate"), TODAY("today"), THIS_WEEK("this_week"), NEXT_WEEK("next_week");

    private final String value;

    RiskTimeframe(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Buckets a lead time (observation time to hazard onset) into a timeframe.
     *
     * @param leadTime
     *            time until the hazard; negative values are treated as zero
     * @return {@code IMMEDIATE} under 3 hours, {@code TODAY} under 24 hours, {@code THIS_WEEK} under 7 days,
     *         {@code NEXT_WEEK} otherwise
     */
    public static RiskTimeframe fromLeadTime(Duration leadTime) {
        long hours = Math.max(0, leadTime.toHours());
        if (hours < 3) {
            return IMMEDIATE;
        }
        if (hours < 24) {
            return TODAY;
        }
        if (hours < 24 * 7) {
            return THIS_WEEK;
        }
        return NEXT_WEEK;
    }
}
