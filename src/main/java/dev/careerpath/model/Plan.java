package dev.careerpath.model;

import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Development plan for one transition.
 *
 * @param fallback true when the generated plan was unusable and the fixed fallback plan was used
 */
@Builder
public record Plan(
        String transitionId,
        Instant createdAt,
        List<Milestone> milestones,
        boolean fallback) {

    public Plan {
        milestones = milestones == null ? List.of() : List.copyOf(milestones);
    }
}
