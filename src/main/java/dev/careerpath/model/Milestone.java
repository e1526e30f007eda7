package dev.careerpath.model;

import lombok.Builder;

import java.util.List;

/**
 * One step of a development plan. {@code order} is the 0-based position in the plan.
 * Progress starts at 0 and is only ever changed outside the pipeline.
 */
@Builder(toBuilder = true)
public record Milestone(
        String title,
        String description,
        Priority priority,
        int durationWeeks,
        int order,
        int progress,
        List<Resource> resources) {

    public static final int MIN_DURATION_WEEKS = 1;
    public static final int MAX_DURATION_WEEKS = 12;

    public Milestone {
        if (durationWeeks < MIN_DURATION_WEEKS || durationWeeks > MAX_DURATION_WEEKS) {
            throw new IllegalArgumentException("durationWeeks out of range: " + durationWeeks);
        }
        if (progress < 0 || progress > 100) {
            throw new IllegalArgumentException("progress out of range: " + progress);
        }
        resources = resources == null ? List.of() : List.copyOf(resources);
    }
}
