package com.musicgraph.harvester.model;

import java.util.Locale;

/**
 * Audio quality tiers, ordered from lowest to highest.
 */
public enum Quality {
    LOW,
    MEDIUM,
    HIGH;

    /**
     * Parses a tier name case-insensitively.
     * @param value tier name such as "high"
     * @return matching tier
     * @throws IllegalArgumentException if the name is unknown
     */
    public static Quality fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Quality cannot be empty");
        }
        return Quality.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
