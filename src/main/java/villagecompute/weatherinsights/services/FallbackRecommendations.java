/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.services;

import java.util.EnumMap;
import java.util.Map;

import villagecompute.weatherinsights.api.types.Audience;
import villagecompute.weatherinsights.api.types.RecommendationPriority;
import villagecompute.weatherinsights.api.types.RecommendationTiming;
import villagecompute.weatherinsights.api.types.RecommendationType;
import villagecompute.weatherinsights.api.types.RiskKind;
import villagecompute.weatherinsights.api.types.RiskSignalType;

/**
 * Deterministic recommendation templates used when generation output is unusable.
 *
 * <p>
 * Priority follows the signal severity one-to-one and timing follows the signal timeframe, so a fallback never claims
 * more urgency than the rules derived.
 */
final class FallbackRecommendations {

    private record Template(String title, String action) {
    }

    private static final Map<RiskKind, Map<Audience, Template>> TEMPLATES = new EnumMap<>(RiskKind.class);

    static {
        put(RiskKind.STORM, Audience.GENERAL_PUBLIC, "Prepare for thunderstorms",
                "Stay indoors during the storm, unplug sensitive electronics and keep away from open areas, tall trees "
                        + "and flood-prone roads.");
        put(RiskKind.STORM, Audience.FARMERS, "Secure farm before the storm",
                "Secure outdoor equipment, move livestock to sheltered areas and stop field work before the storm "
                        + "arrives.");
        put(RiskKind.STORM, Audience.OFFICIALS, "Activate storm response",
                "Issue a storm advisory, put emergency response teams on standby and check drainage and evacuation "
                        + "readiness.");
        put(RiskKind.HEAT, Audience.GENERAL_PUBLIC, "Avoid heat stress",
                "Limit outdoor activity at midday, drink water regularly and check on elderly family members and "
                        + "neighbours.");
        put(RiskKind.HEAT, Audience.FARMERS, "Protect workers and livestock from heat",
                "Schedule heavy field work for early morning or evening and provide shade and water for workers and "
                        + "livestock.");
        put(RiskKind.HEAT, Audience.OFFICIALS, "Open heat response measures",
                "Issue a heat advisory, open cooling areas and adjust outdoor activities at schools and public "
                        + "facilities.");
        put(RiskKind.FLOOD, Audience.GENERAL_PUBLIC, "Prepare for possible flooding",
                "Move valuables to higher places, avoid low-lying roads and prepare an emergency kit in case "
                        + "evacuation is needed.");
        put(RiskKind.FLOOD, Audience.FARMERS, "Protect fields from flooding",
                "Clear farm drainage canals, move livestock and stored feed to higher ground and postpone fertilizer "
                        + "application.");
        put(RiskKind.FLOOD, Audience.OFFICIALS, "Prepare flood response",
                "Clear public drainage, monitor river levels and prepare evacuation centers for low-lying areas.");
        put(RiskKind.WIND, Audience.GENERAL_PUBLIC, "Secure loose objects against strong wind",
                "Bring in or tie down loose items outdoors and stay away from weak structures, trees and power "
                        + "lines.");
        put(RiskKind.WIND, Audience.FARMERS, "Suspend wind-sensitive farm work",
                "Postpone spraying and work with tall equipment, and secure greenhouse covers and loose materials.");
        put(RiskKind.WIND, Audience.OFFICIALS, "Prepare for wind damage",
                "Inspect public signage and trees near roads and have teams ready to clear debris and restore "
                        + "access.");
        put(RiskKind.OTHER, Audience.GENERAL_PUBLIC, "Follow weather updates",
                "Check local weather advisories regularly and adjust outdoor plans to the changing conditions.");
        put(RiskKind.OTHER, Audience.FARMERS, "Adjust field management to conditions",
                "Inspect crops and livestock and adjust irrigation and protection measures to the forecast "
                        + "conditions.");
        put(RiskKind.OTHER, Audience.OFFICIALS, "Monitor developing conditions",
                "Monitor official forecasts and keep advisory channels ready to inform the community.");
    }

    private FallbackRecommendations() {
        // Utility class
    }

    private static void put(RiskKind kind, Audience audience, String title, String action) {
        TEMPLATES.computeIfAbsent(kind, k -> new EnumMap<>(Audience.class)).put(audience, new Template(title, action));
    }

    static RecommendationType forSignal(RiskSignalType signal, Audience audience) {
        Template template = TEMPLATES.get(signal.kind()).get(audience);
        String reason = String.format("%s risk (%s): %s", capitalize(signal.kind().value()), signal.severity().value(),
                signal.evidence());
        return new RecommendationType(template.title(), template.action(), reason,
                RecommendationPriority.forSeverity(signal.severity()),
                RecommendationTiming.forTimeframe(signal.timeframe()), audience,
                AudienceProfiles.forAudience(audience).defaultResources());
    }

    static RecommendationType baseline(Audience audience) {
        return new RecommendationType("Keep monitoring the forecast",
                "No weather hazards are expected. Continue normal activities and check the forecast daily.",
                "Current and forecast conditions show no hazard signals.", RecommendationPriority.LOW,
                RecommendationTiming.THIS_WEEK, audience, AudienceProfiles.forAudience(audience).defaultResources());
    }

    private static String capitalize(String text) {
        return text.isEmpty() ? text : Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }
}
