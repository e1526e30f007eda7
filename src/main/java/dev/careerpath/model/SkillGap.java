package dev.careerpath.model;

import lombok.Builder;

/**
 * A ranked deficiency for the target role.
 *
 * @param skillName       canonical skill name, unique within one transition
 * @param gapLevel        severity derived from mention count and confidence
 * @param confidenceScore 0..1, grows with distinct sources mentioning the skill
 * @param mentionCount    total normalized mentions across stories and insights
 */
@Builder
public record SkillGap(
        String skillName,
        GapLevel gapLevel,
        double confidenceScore,
        int mentionCount) {
}
