package dev.careerpath.pipeline;

/**
 * States of one analysis run.
 *
 * Transitions (happy path):
 *   IDLE → STORIES → INSIGHTS → SKILLS → PLAN → METRICS → COMPLETE
 *
 * Any non-terminal state can move to FAILED or CANCELLED.
 */
public enum RunState {
    IDLE,
    STORIES,
    INSIGHTS,
    SKILLS,
    PLAN,
    METRICS,
    COMPLETE,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED || this == CANCELLED;
    }

    /**
     * Strictly forward along the happy path, or to a failure state from anything non-terminal.
     */
    public boolean canTransitionTo(RunState next) {
        if (isTerminal()) {
            return false;
        }
        if (next == FAILED || next == CANCELLED) {
            return true;
        }
        return next.ordinal() == ordinal() + 1;
    }
}
