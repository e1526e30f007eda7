package dev.careerpath.pipeline;

/**
 * Generic reason a stage failed. Provider details never leave the run.
 */
public enum FailureCategory {
    NO_SOURCES_FOUND,
    EXTERNAL_SERVICE,
    TIMEOUT,
    INTERNAL
}
