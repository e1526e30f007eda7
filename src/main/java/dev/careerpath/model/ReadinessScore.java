package dev.careerpath.model;

import lombok.Builder;

import java.time.Instant;

/**
 * Composite readiness assessment. All scores are integers in [0,100].
 */
@Builder
public record ReadinessScore(
        String transitionId,
        int overallScore,
        int marketDemandScore,
        int skillGapScore,
        int educationPathScore,
        int industryTrendScore,
        int geographicalFactorScore,
        Recommendations recommendations,
        Instant createdAt) {
}
