package dev.careerpath.model;

public record RecommendationResource(String title, String url, String type) {
}
