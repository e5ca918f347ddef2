/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.api.types;

import jakarta.validation.constraints.NotNull;

/**
 * A derived hazard indication.
 *
 * @param kind
 *            hazard family
 * @param severity
 *            how bad the hazard is expected to be
 * @param evidence
 *            readings that triggered the signal, human-readable
 * @param timeframe
 *            when the hazard is expected
 */
public record RiskSignalType(@NotNull RiskKind kind, @NotNull RiskSeverity severity, String evidence,
        @NotNull RiskTimeframe timeframe) {

    public RiskSignalType withSeverity(RiskSeverity newSeverity) {
        return new RiskSignalType(kind, newSeverity, evidence, timeframe);
    }

    /**
     * One-line rendering used for the bundle's risk alerts.
     */
    public String toAlert() {
        return String.format("%s (%s, %s): %s", kind.value(), severity.value(), timeframe.value(), evidence);
    }
}
