/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static villagecompute.weatherinsights.TestFixtures.recommendation;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import villagecompute.weatherinsights.api.types.RecommendationPriority;
import villagecompute.weatherinsights.api.types.RecommendationTiming;
import villagecompute.weatherinsights.api.types.RecommendationType;

/**
 * Unit tests for {@link RecommendationOrdering}.
 */
class RecommendationOrderingTest {

    @Test
    void testSort_priorityThenTiming() {
        List<RecommendationType> input = List.of(
                recommendation("low-week", RecommendationPriority.LOW, RecommendationTiming.THIS_WEEK),
                recommendation("high-today", RecommendationPriority.HIGH, RecommendationTiming.TODAY),
                recommendation("critical-later", RecommendationPriority.CRITICAL, RecommendationTiming.NEXT_WEEK),
                recommendation("high-now", RecommendationPriority.HIGH, RecommendationTiming.IMMEDIATE),
                recommendation("medium-week", RecommendationPriority.MEDIUM, RecommendationTiming.THIS_WEEK));

        List<String> titles = RecommendationOrdering.sort(input).stream().map(RecommendationType::title).toList();

        assertEquals(List.of("critical-later", "high-now", "high-today", "medium-week", "low-week"), titles);
    }

    @Test
    void testSort_todayAndWithinTwoHoursKeepGenerationOrder() {
        List<RecommendationType> input = List.of(
                recommendation("first-today", RecommendationPriority.HIGH, RecommendationTiming.TODAY),
                recommendation("second-2h", RecommendationPriority.HIGH, RecommendationTiming.WITHIN_2_HOURS),
                recommendation("third-today", RecommendationPriority.HIGH, RecommendationTiming.TODAY));

        List<String> titles = RecommendationOrdering.sort(input).stream().map(RecommendationType::title).toList();

        assertEquals(List.of("first-today", "second-2h", "third-today"), titles);
    }

    @Test
    void testSort_isStableForEqualKeys() {
        List<RecommendationType> input = List.of(
                recommendation("a", RecommendationPriority.MEDIUM, RecommendationTiming.THIS_WEEK),
                recommendation("b", RecommendationPriority.HIGH, RecommendationTiming.TODAY),
                recommendation("c", RecommendationPriority.MEDIUM, RecommendationTiming.THIS_WEEK),
                recommendation("d", RecommendationPriority.MEDIUM, RecommendationTiming.THIS_WEEK));

        List<String> titles = RecommendationOrdering.sort(input).stream().map(RecommendationType::title).toList();

        assertEquals(List.of("b", "a", "c", "d"), titles);
    }

    @Test
    void testSort_doesNotModifyInput() {
        List<RecommendationType> input = new ArrayList<>(List.of(
                recommendation("low", RecommendationPriority.LOW, RecommendationTiming.NEXT_WEEK),
                recommendation("high", RecommendationPriority.HIGH, RecommendationTiming.TODAY)));

        RecommendationOrdering.sort(input);

        assertEquals("low", input.get(0).title());
    }
}
