package dev.careerpath.pipeline;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum StageStatus {
    STARTED,
    COMPLETED,
    FAILED,
    CANCELLED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
