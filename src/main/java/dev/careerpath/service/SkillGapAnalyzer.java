package dev.careerpath.service;

import dev.careerpath.config.SkillsConfig;
import dev.careerpath.model.GapLevel;
import dev.careerpath.model.Insight;
import dev.careerpath.model.ScrapedData;
import dev.careerpath.model.SkillGap;
import dev.careerpath.source.SkillKeywordScanner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ranks the skills that narratives and insights keep mentioning for the target role.
 * Pure computation, no external calls.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SkillGapAnalyzer {

    private static final String UNKNOWN_SOURCE = "unknown";

    static final Comparator<SkillGap> RANKING = Comparator
            .comparing(SkillGap::gapLevel, Comparator.reverseOrder())
            .thenComparing(SkillGap::mentionCount, Comparator.reverseOrder())
            .thenComparing(SkillGap::skillName);

    private final SkillsConfig skillsConfig;
    private final SkillKeywordScanner skillScanner;

    public List<SkillGap> analyze(List<ScrapedData> stories, List<Insight> insights) {
        Map<String, Tally> tallies = new LinkedHashMap<>();

        for (ScrapedData story : stories) {
            String sourceId = sourceId(story.url(), story.source());
            for (String skill : story.skillsExtracted()) {
                record(tallies, skill, sourceId);
            }
        }

        for (Insight insight : insights) {
            String sourceId = sourceId(insight.url(), insight.source());
            for (String skill : skillScanner.scan(insight.content())) {
                record(tallies, skill, sourceId);
            }
        }

        List<SkillGap> gaps = tallies.values().stream()
                .map(this::toSkillGap)
                .sorted(RANKING)
                .limit(Math.max(0, skillsConfig.getMaxSkills()))
                .toList();

        log.info("Skill gap analysis: {} distinct skills, {} reported", tallies.size(), gaps.size());
        return gaps;
    }

    /**
     * 1 - e^-(sourceWeight * distinctSources + mentionWeight * mentions), rounded to 2 decimals.
     */
    double confidence(int distinctSources, int mentionCount) {
        double exposure = skillsConfig.getSourceWeight() * distinctSources
                + skillsConfig.getMentionWeight() * mentionCount;
        double value = 1 - Math.exp(-exposure);
        return Math.round(Math.min(1.0, Math.max(0.0, value)) * 100) / 100.0;
    }

    GapLevel level(int mentionCount, double confidence) {
        if (mentionCount >= skillsConfig.getHighMentionThreshold()
                && confidence >= skillsConfig.getConfidenceThreshold()) {
            return GapLevel.HIGH;
        }
        if (mentionCount < skillsConfig.getLowMentionThreshold()) {
            return GapLevel.LOW;
        }
        return GapLevel.MEDIUM;
    }

    private void record(Map<String, Tally> tallies, String skill, String sourceId) {
        if (skill == null || skill.isBlank()) {
            return;
        }
        String canonical = skillScanner.canonicalize(skill).orElse(skill.trim());
        Tally tally = tallies.computeIfAbsent(SkillKeywordScanner.normalize(canonical), key -> new Tally(canonical));
        tally.mentions++;
        tally.sources.add(sourceId);
    }

    private SkillGap toSkillGap(Tally tally) {
        double confidence = confidence(tally.sources.size(), tally.mentions);
        return SkillGap.builder()
                .skillName(tally.displayName)
                .mentionCount(tally.mentions)
                .confidenceScore(confidence)
                .gapLevel(level(tally.mentions, confidence))
                .build();
    }

    private String sourceId(String url, String source) {
        if (url != null && !url.isBlank()) {
            return url;
        }
        return source != null && !source.isBlank() ? source : UNKNOWN_SOURCE;
    }

    private static final class Tally {
        private final String displayName;
        private final Set<String> sources = new HashSet<>();
        private int mentions;

        private Tally(String displayName) {
            this.displayName = displayName;
        }
    }
}
