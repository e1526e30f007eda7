package dev.careerpath.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Timeframe {
    IMMEDIATE("immediate"),
    SHORT_TERM("short-term"),
    LONG_TERM("long-term");

    private final String value;

    Timeframe(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
