/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static villagecompute.weatherinsights.TestFixtures.recommendation;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import villagecompute.weatherinsights.api.types.RecommendationPriority;
import villagecompute.weatherinsights.api.types.RecommendationTiming;
import villagecompute.weatherinsights.api.types.RecommendationType;
import villagecompute.weatherinsights.api.types.RiskKind;
import villagecompute.weatherinsights.api.types.RiskSeverity;
import villagecompute.weatherinsights.api.types.RiskSignalType;
import villagecompute.weatherinsights.api.types.RiskTimeframe;

/**
 * Unit tests for {@link InsightReportBuilder}.
 */
class InsightReportBuilderTest {

    @Test
    void testPrioritySummary_withCritical() {
        List<RecommendationType> recommendations = List.of(
                recommendation("Evacuate", RecommendationPriority.CRITICAL, RecommendationTiming.IMMEDIATE),
                recommendation("Sandbag", RecommendationPriority.HIGH, RecommendationTiming.TODAY));

        assertEquals("Priority Overview: 1 critical actions, 1 high-priority recommendations, 1 requiring immediate "
                + "attention. Focus on critical actions first.", InsightReportBuilder.prioritySummary(recommendations));
    }

    @Test
    void testPrioritySummary_nothingUrgent() {
        String summary = InsightReportBuilder.prioritySummary(
                List.of(recommendation("Plan", RecommendationPriority.LOW, RecommendationTiming.THIS_WEEK)));

        assertTrue(summary.endsWith("No urgent actions required - focus on planning and preparation."), summary);
    }

    @Test
    void testActionChecklist_labelsAndLimit() {
        List<RecommendationType> recommendations = new ArrayList<>();
        recommendations.add(recommendation("Secure roof", RecommendationPriority.HIGH, RecommendationTiming.IMMEDIATE));
        recommendations.add(
                recommendation("Check radio", RecommendationPriority.HIGH, RecommendationTiming.WITHIN_2_HOURS));
        for (int i = 0; i < 12; i++) {
            recommendations.add(recommendation("Task " + i, RecommendationPriority.LOW, RecommendationTiming.NEXT_WEEK));
        }

        List<String> checklist = InsightReportBuilder.actionChecklist(recommendations);

        assertEquals(InsightReportBuilder.CHECKLIST_SIZE, checklist.size());
        assertEquals("NOW: Secure roof", checklist.get(0));
        assertEquals("2H: Check radio", checklist.get(1));
        assertEquals("LATER: Task 0", checklist.get(2));
    }

    @Test
    void testContactSuggestions_byHazardWithoutDuplicates() {
        List<RiskSignalType> signals = List.of(
                new RiskSignalType(RiskKind.STORM, RiskSeverity.HIGH, "thunderstorm", RiskTimeframe.TODAY),
                new RiskSignalType(RiskKind.WIND, RiskSeverity.MEDIUM, "gusts", RiskTimeframe.TODAY),
                new RiskSignalType(RiskKind.FLOOD, RiskSeverity.HIGH, "rain", RiskTimeframe.TODAY),
                new RiskSignalType(RiskKind.OTHER, RiskSeverity.MEDIUM, "Frost risk: temperature down to -2.0°C",
                        RiskTimeframe.TODAY));

        List<String> contacts = InsightReportBuilder.contactSuggestions(signals);

        assertEquals(List.of("Local emergency management office for storm preparations",
                "Agricultural extension office for flood mitigation advice",
                "Municipal engineering office for drainage concerns",
                "Agricultural extension for crop protection guidance", "Local weather service for updated forecasts",
                "Agricultural extension office for farming guidance",
                "Community emergency coordinator for disaster preparation"), contacts);
    }

    @Test
    void testContactSuggestions_generalOnlyWithoutSignals() {
        assertEquals(3, InsightReportBuilder.contactSuggestions(List.of()).size());
    }
}
