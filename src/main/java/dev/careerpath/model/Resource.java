package dev.careerpath.model;

import lombok.Builder;

/**
 * Learning resource attached to a milestone.
 */
@Builder
public record Resource(String title, String url, String type) {
}
