/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.api.types;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * States of a single-location insight pipeline run.
 *
 * <p>
 * Runs move {@code FETCHING -> VALIDATING -> ANALYZING -> SYNTHESIZING -> COMPLETE}; {@code DEGRADED} is terminal and
 * reachable from any working stage.
 */
public enum PipelineStage {

    FETCHING("fetching"), VALIDATING("validating"), ANALYZING("analyzing"), SYNTHESIZING("synthesizing"),
    COMPLETE("complete"), DEGRADED("degraded");

    private final String value;

    PipelineStage(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == DEGRADED;
    }

    /**
     * Next working stage after this one on the happy path.
     *
     * @throws IllegalStateException
     *             if called on a terminal stage
     */
    public PipelineStage next() {
        return switch (this) {
            case FETCHING -> VALIDATING;
            case VALIDATING -> ANALYZING;
            case ANALYZING -> SYNTHESIZING;
            case SYNTHESIZING -> COMPLETE;
            case COMPLETE, DEGRADED -> throw new IllegalStateException("No stage follows " + value);
        };
    }
}
