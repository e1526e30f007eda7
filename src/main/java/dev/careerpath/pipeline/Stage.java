package dev.careerpath.pipeline;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Pipeline stages in execution order.
 */
public enum Stage {
    STORIES(RunState.STORIES),
    INSIGHTS(RunState.INSIGHTS),
    SKILLS(RunState.SKILLS),
    PLAN(RunState.PLAN),
    METRICS(RunState.METRICS);

    private final RunState runState;

    Stage(RunState runState) {
        this.runState = runState;
    }

    public RunState runState() {
        return runState;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
