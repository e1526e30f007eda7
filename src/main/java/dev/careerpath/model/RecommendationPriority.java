package dev.careerpath.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Priority of a readiness recommendation. Serialized in lower case, unlike milestone {@link Priority}.
 */
public enum RecommendationPriority {
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
