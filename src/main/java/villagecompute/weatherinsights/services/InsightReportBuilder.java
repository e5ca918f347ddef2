/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.services;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import villagecompute.weatherinsights.api.types.RecommendationPriority;
import villagecompute.weatherinsights.api.types.RecommendationTiming;
import villagecompute.weatherinsights.api.types.RecommendationType;
import villagecompute.weatherinsights.api.types.RiskKind;
import villagecompute.weatherinsights.api.types.RiskSignalType;

/**
 * Deterministic report extras derived from an ordered recommendation list and the risk signals: priority overview,
 * action checklist and contact suggestions.
 */
public final class InsightReportBuilder {

    static final int CHECKLIST_SIZE = 10;

    private static final List<String> GENERAL_CONTACTS = List.of("Local weather service for updated forecasts",
            "Agricultural extension office for farming guidance",
            "Community emergency coordinator for disaster preparation");

    private InsightReportBuilder() {
        // Utility class
    }

    /**
     * One-line count of critical, high and immediate recommendations plus a focus sentence.
     */
    public static String prioritySummary(List<RecommendationType> recommendations) {
        long critical = recommendations.stream().filter(r -> r.priority() == RecommendationPriority.CRITICAL).count();
        long high = recommendations.stream().filter(r -> r.priority() == RecommendationPriority.HIGH).count();
        long immediate = recommendations.stream().filter(r -> r.timing() == RecommendationTiming.IMMEDIATE).count();

        StringBuilder summary = new StringBuilder(String.format(
                "Priority Overview: %d critical actions, %d high-priority recommendations, %d requiring immediate "
                        + "attention.",
                critical, high, immediate));
        if (critical > 0) {
            summary.append(" Focus on critical actions first.");
        } else if (high > 0) {
            summary.append(" Address high-priority items within 24 hours.");
        } else {
            summary.append(" No urgent actions required - focus on planning and preparation.");
        }
        return summary.toString();
    }

    /**
     * Checklist lines for the first ten recommendations, e.g. {@code "NOW: Secure outdoor equipment"}.
     *
     * @param ordered
     *            recommendations already in final order
     */
    public static List<String> actionChecklist(List<RecommendationType> ordered) {
        List<String> checklist = new ArrayList<>();
        for (RecommendationType recommendation : ordered) {
            if (checklist.size() == CHECKLIST_SIZE) {
                break;
            }
            checklist.add(timingLabel(recommendation.timing()) + ": " + recommendation.title());
        }
        return checklist;
    }

    static String timingLabel(RecommendationTiming timing) {
        return switch (timing) {
            case IMMEDIATE -> "NOW";
            case TODAY -> "TODAY";
            case WITHIN_2_HOURS -> "2H";
            case THIS_WEEK -> "WEEK";
            case NEXT_WEEK -> "LATER";
        };
    }

    /**
     * Contacts suited to the detected hazards, followed by general contacts, without duplicates.
     */
    public static List<String> contactSuggestions(List<RiskSignalType> signals) {
        Set<String> contacts = new LinkedHashSet<>();
        for (RiskSignalType signal : signals) {
            RiskKind kind = signal.kind();
            String evidence = signal.evidence() == null ? "" : signal.evidence().toLowerCase(Locale.ROOT);
            if (kind == RiskKind.STORM || kind == RiskKind.WIND) {
                contacts.add("Local emergency management office for storm preparations");
            }
            if (kind == RiskKind.FLOOD) {
                contacts.add("Agricultural extension office for flood mitigation advice");
                contacts.add("Municipal engineering office for drainage concerns");
            }
            if (kind == RiskKind.HEAT || evidence.contains("dry conditions")) {
                contacts.add("Local health department for heat safety information");
            }
            if (evidence.contains("frost")) {
                contacts.add("Agricultural extension for crop protection guidance");
            }
        }
        contacts.addAll(GENERAL_CONTACTS);
        return new ArrayList<>(contacts);
    }
}
