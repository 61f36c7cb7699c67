package io.meld.core.model;

import java.util.Locale;

/** Risk annotation a {@code define} can attach through an {@code .risk.<level>} suffix. */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    /**
     * Parses a suffix value, case-insensitively.
     *
     * @throws IllegalArgumentException if the value is not {@code low}, {@code medium} or {@code high}
     */
    public static RiskLevel parse(String value) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "low" -> LOW;
            case "medium" -> MEDIUM;
            case "high" -> HIGH;
            default -> throw new IllegalArgumentException("Invalid risk level: " + value);
        };
    }
}
