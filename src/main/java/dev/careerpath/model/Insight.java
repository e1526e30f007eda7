package dev.careerpath.model;

import lombok.Builder;

@Builder
public record Insight(
        InsightType type,
        String content,
        String source,
        String date,
        Integer experienceYears,
        String url) {
}
