package dev.careerpath.model;

import lombok.Builder;

import java.util.List;

@Builder
public record RecommendationItem(
        String title,
        String description,
        RecommendationPriority priority,
        Timeframe timeframe,
        List<RecommendationResource> resources) {

    public RecommendationItem {
        resources = resources == null ? List.of() : List.copyOf(resources);
    }
}
