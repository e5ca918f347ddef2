/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.api.types;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Hazard family of a {@link RiskSignalType}.
 */
public enum RiskKind {

    STORM("storm"), HEAT("heat"), FLOOD("flood"), WIND("wind"), OTHER("other");

    private final String value;

    RiskKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
