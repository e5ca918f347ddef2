/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.api.types;

import com.fasterxml.jackson.annotation.JsonValue;

public enum InsightStatus {

    COMPLETE("complete"), DEGRADED("degraded");

    private final String value;

    InsightStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
