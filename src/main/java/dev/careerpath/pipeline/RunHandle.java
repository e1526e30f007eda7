package dev.careerpath.pipeline;

/**
 * Opaque reference to a started run. The id equals the transition id.
 */
public record RunHandle(String id) {
}
