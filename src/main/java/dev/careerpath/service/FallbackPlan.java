package dev.careerpath.service;

import dev.careerpath.model.Milestone;
import dev.careerpath.model.Plan;
import dev.careerpath.model.Priority;

import java.time.Instant;
import java.util.List;

/**
 * Fixed three-milestone plan used whenever a generated plan is unavailable.
 */
public final class FallbackPlan {

    public static final String LEARN_CORE_CONCEPTS = "Learn Core Concepts";
    public static final String PRACTICE_THROUGH_PROJECTS = "Practice Through Projects";
    public static final String PREPARE_FOR_INTERVIEWS = "Prepare for Interviews";

    private FallbackPlan() {
    }

    public static Plan create(String transitionId, String targetRole) {
        return Plan.builder()
                .transitionId(transitionId)
                .createdAt(Instant.now())
                .fallback(true)
                .milestones(milestones(targetRole))
                .build();
    }

    static List<Milestone> milestones(String targetRole) {
        return List.of(
                Milestone.builder()
                        .title(LEARN_CORE_CONCEPTS)
                        .description("Study the fundamentals of skills needed for " + targetRole)
                        .priority(Priority.HIGH)
                        .durationWeeks(4)
                        .order(0)
                        .build(),
                Milestone.builder()
                        .title(PRACTICE_THROUGH_PROJECTS)
                        .description("Apply learned skills through hands-on projects")
                        .priority(Priority.MEDIUM)
                        .durationWeeks(3)
                        .order(1)
                        .build(),
                Milestone.builder()
                        .title(PREPARE_FOR_INTERVIEWS)
                        .description("Study common interview questions and practice responses")
                        .priority(Priority.HIGH)
                        .durationWeeks(2)
                        .order(2)
                        .build());
    }
}
