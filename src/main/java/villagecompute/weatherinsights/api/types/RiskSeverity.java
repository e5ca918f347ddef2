/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.api.types;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity of a derived risk signal, ordered from least to most severe.
 */
public enum RiskSeverity {

    LOW("low"), MEDIUM("medium"), HIGH("high"), CRITICAL("critical");

    private final String value;

    RiskSeverity(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Returns the more severe of the two severities.
     */
    public static RiskSeverity max(RiskSeverity a, RiskSeverity b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }

    /**
     * Returns this severity, lowered to {@code ceiling} if it is above it.
     */
    public RiskSeverity cappedAt(RiskSeverity ceiling) {
        return ordinal() > ceiling.ordinal() ? ceiling : this;
    }
}
