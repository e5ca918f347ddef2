/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.services;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import villagecompute.weatherinsights.api.types.RecommendationType;

/**
 * Final ordering of recommendations: priority (critical first), then timing urgency, then generation order.
 *
 * <p>
 * {@code today} and {@code within_2_hours} share an urgency bucket and keep their generation order.
 */
public final class RecommendationOrdering {

    public static final Comparator<RecommendationType> BY_PRIORITY_THEN_TIMING = Comparator
            .comparingInt((RecommendationType r) -> r.priority().ordinal())
            .thenComparingInt(r -> r.timing().urgencyBucket());

    private RecommendationOrdering() {
        // Utility class
    }

    /**
     * Returns a sorted copy. {@link List#sort} is stable, so equal keys keep their input order.
     */
    public static List<RecommendationType> sort(List<RecommendationType> recommendations) {
        List<RecommendationType> sorted = new ArrayList<>(recommendations);
        sorted.sort(BY_PRIORITY_THEN_TIMING);
        return sorted;
    }
}
