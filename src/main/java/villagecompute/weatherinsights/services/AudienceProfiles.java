/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.services;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import villagecompute.weatherinsights.api.types.Audience;

/**
 * Fixed instruction and vocabulary profile per audience, used to phrase prompts and fallback recommendations.
 *
 * <p>
 * Profiles change wording only. Risk evaluation, priority clamping and ordering are identical for every audience.
 */
public final class AudienceProfiles {

    /**
     * Phrasing policy for one audience.
     *
     * @param displayName
     *            how the audience is named in prompts
     * @param instructions
     *            framing instructions for generated recommendations
     * @param vocabulary
     *            terms recommendations should prefer
     * @param defaultResources
     *            resources listed on fallback recommendations
     */
    public record Profile(String displayName, String instructions, List<String> vocabulary,
            List<String> defaultResources) {
    }

    private static final Map<Audience, Profile> PROFILES = new EnumMap<>(Audience.class);

    static {
        PROFILES.put(Audience.GENERAL_PUBLIC, new Profile("the general public",
                "Use plain everyday language. Focus on personal and household safety, travel, health and daily "
                        + "activities. Avoid technical jargon and explain what each action protects against.",
                List.of("household", "family", "commute", "safety", "shelter"),
                List.of("Local weather advisories", "Household emergency kit")));
        PROFILES.put(Audience.FARMERS, new Profile("farmers",
                "Frame actions around crops, livestock, irrigation, field operations and farm equipment. Mention "
                        + "planting, spraying, harvest and drainage timing where relevant.",
                List.of("crops", "livestock", "irrigation", "harvest", "field", "equipment"),
                List.of("Farm labor", "Tarpaulins and covers", "Agricultural extension office")));
        PROFILES.put(Audience.OFFICIALS, new Profile("local government officials",
                "Frame actions as community-level measures: advisories, evacuation readiness, public infrastructure, "
                        + "coordination with emergency services and resource pre-positioning.",
                List.of("community", "evacuation", "advisory", "infrastructure", "coordination"),
                List.of("Disaster risk reduction office", "Emergency response teams", "Public advisory channels")));
    }

    private AudienceProfiles() {
        // Utility class
    }

    /**
     * Returns the profile for an audience; null resolves to the general public.
     */
    public static Profile forAudience(Audience audience) {
        return PROFILES.get(audience == null ? Audience.GENERAL_PUBLIC : audience);
    }
}
