/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatherinsights.api.types;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Audience a set of recommendations is written for.
 */
public enum Audience {

    GENERAL_PUBLIC("general_public", Set.of("general", "public", "general public")),
    FARMERS("farmers", Set.of("farmer", "agriculture")),
    OFFICIALS("officials", Set.of("local_officials", "local officials", "official"));

    private final String value;
    private final Set<String> aliases;

    Audience(String value, Set<String> aliases) {
        this.value = value;
        this.aliases = aliases;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Resolves a wire value or one of its aliases, case-insensitively. A null or blank value resolves to
     * {@link #GENERAL_PUBLIC}.
     *
     * @return the audience, or empty if the value is not recognized
     */
    public static Optional<Audience> fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.of(GENERAL_PUBLIC);
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (Audience audience : values()) {
            if (audience.value.equals(normalized) || audience.aliases.contains(normalized)) {
                return Optional.of(audience);
            }
        }
        return Optional.empty();
    }
}
