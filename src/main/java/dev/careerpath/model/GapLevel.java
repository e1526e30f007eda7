package dev.careerpath.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity of a skill gap. Declared in ascending order; {@link #weight()} is used by the readiness scorer.
 */
public enum GapLevel {
    LOW("Low", 1),
    MEDIUM("Medium", 2),
    HIGH("High", 3);

    private final String label;
    private final int weight;

    GapLevel(String label, int weight) {
        this.label = label;
        this.weight = weight;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public int weight() {
        return weight;
    }
}
