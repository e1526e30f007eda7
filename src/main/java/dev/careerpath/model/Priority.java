package dev.careerpath.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum Priority {
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High");

    private final String label;

    Priority(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Optional<Priority> fromLabel(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (Priority priority : values()) {
            if (priority.label.equalsIgnoreCase(trimmed)) {
                return Optional.of(priority);
            }
        }
        return Optional.empty();
    }
}
