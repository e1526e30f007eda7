package dev.careerpath.model;

import lombok.Builder;

import java.util.List;

/**
 * Everything a completed run produced.
 */
@Builder
public record ArtifactBundle(
        Transition transition,
        List<ScrapedData> stories,
        List<Insight> insights,
        List<SkillGap> skillGaps,
        Plan plan,
        ReadinessScore readinessScore,
        int scrapedCount) {
}
