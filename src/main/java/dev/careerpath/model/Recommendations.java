package dev.careerpath.model;

import lombok.Builder;

import java.util.List;

/**
 * The six fixed recommendation categories of a readiness score.
 */
@Builder
public record Recommendations(
        List<RecommendationItem> skillDevelopment,
        List<RecommendationItem> marketPositioning,
        List<RecommendationItem> educationPaths,
        List<RecommendationItem> experienceBuilding,
        List<RecommendationItem> networkingOpportunities,
        List<RecommendationItem> nextSteps) {

    public Recommendations {
        skillDevelopment = copy(skillDevelopment);
        marketPositioning = copy(marketPositioning);
        educationPaths = copy(educationPaths);
        experienceBuilding = copy(experienceBuilding);
        networkingOpportunities = copy(networkingOpportunities);
        nextSteps = copy(nextSteps);
    }

    private static List<RecommendationItem> copy(List<RecommendationItem> items) {
        return items == null ? List.of() : List.copyOf(items);
    }
}
