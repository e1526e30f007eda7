package dev.careerpath.service;

import com.fasterxml.jackson.databind.JsonNode;
import dev.careerpath.ai.ExternalServiceException;
import dev.careerpath.ai.GenerationOptions;
import dev.careerpath.ai.TextGenerationClient;
import dev.careerpath.config.ScoringConfig;
import dev.careerpath.model.GapLevel;
import dev.careerpath.model.ReadinessScore;
import dev.careerpath.model.SkillGap;
import dev.careerpath.pipeline.RunCancelledException;
import dev.careerpath.pipeline.RunContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Combines five sub-scores into the overall readiness score and attaches recommendations.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReadinessScorer {

    private static final int FEW_GAPS = 3;
    private static final int FEW_GAPS_CAP = 70;
    private static final int NO_GAPS_SCORE = 50;

    private final TextGenerationClient textClient;
    private final ScoringConfig scoringConfig;
    private final RecommendationService recommendationService;

    /**
     * Sub-scores in the order the weights are declared.
     */
    public record SubScores(
            int marketDemand,
            int skillGap,
            int educationPath,
            int industryTrend,
            int geographicalFactor) {
    }

    public Mono<ReadinessScore> score(RunContext context, List<SkillGap> skillGaps, Duration deadline) {
        String targetRole = context.getTargetRole();

        return marketDemandScore(context, deadline)
                .map(marketDemand -> {
                    SubScores scores = new SubScores(
                            marketDemand,
                            skillGapScore(skillGaps),
                            educationPathScore(targetRole, skillGaps),
                            industryTrendScore(targetRole),
                            geographicalFactorScore(targetRole));
                    int overall = overallScore(scores);
                    log.info("Readiness score {} (market {}, skills {}, education {}, trend {}, geography {})",
                            overall, scores.marketDemand(), scores.skillGap(), scores.educationPath(),
                            scores.industryTrend(), scores.geographicalFactor());

                    return ReadinessScore.builder()
                            .transitionId(context.getTransition().getId())
                            .overallScore(overall)
                            .marketDemandScore(scores.marketDemand())
                            .skillGapScore(scores.skillGap())
                            .educationPathScore(scores.educationPath())
                            .industryTrendScore(scores.industryTrend())
                            .geographicalFactorScore(scores.geographicalFactor())
                            .recommendations(recommendationService.build(
                                    context.getCurrentRole(), targetRole, skillGaps, scores))
                            .createdAt(Instant.now())
                            .build();
                });
    }

    /**
     * round(sum of weight * score), clamped to [0,100].
     */
    public int overallScore(SubScores scores) {
        ScoringConfig.Weights weights = scoringConfig.getWeights();
        double weighted = scores.marketDemand() * weights.getMarketDemand()
                + scores.skillGap() * weights.getSkillGap()
                + scores.educationPath() * weights.getEducationPath()
                + scores.industryTrend() * weights.getIndustryTrend()
                + scores.geographicalFactor() * weights.getGeographicalFactor();
        return clamp((int) Math.round(weighted));
    }

    Mono<Integer> marketDemandScore(RunContext context, Duration deadline) {
        int neutral = scoringConfig.getNeutralMarketScore();
        if (!scoringConfig.isMarketSignalEnabled()) {
            return Mono.just(neutral);
        }
        String prompt = buildMarketPrompt(context.getCurrentRole(), context.getTargetRole());
        return context.guard(() -> textClient.generateJson(prompt, GenerationOptions.json(512, deadline)))
                .map(this::combineMarketSignal)
                .timeout(deadline)
                .onErrorResume(e -> !(e instanceof RunCancelledException), e -> {
                    log.warn("Market signal unavailable, using neutral score: {}", e.getMessage());
                    return Mono.just(neutral);
                });
    }

    /**
     * 0.5 * posting quantity + 0.3 * salary band + 0.1 * benefits + 0.1 * remote share.
     */
    int combineMarketSignal(JsonNode signal) {
        JsonNode postings = signal.get("postingCount");
        if (postings == null || !postings.isNumber()) {
            throw new ExternalServiceException(ExternalServiceException.Kind.MALFORMED_RESPONSE,
                    "Market signal is missing postingCount");
        }
        int saturation = Math.max(1, scoringConfig.getPostingCountSaturation());
        int quantity = Math.min(100, (int) Math.round(Math.max(0, postings.asDouble()) * 100.0 / saturation));
        int salary = salaryBand(signal.path("averageSalary").asDouble(0));
        int benefits = ratioScore(signal.get("benefitsRatio"));
        int remote = ratioScore(signal.get("remoteRatio"));
        return clamp((int) Math.round(quantity * 0.5 + salary * 0.3 + benefits * 0.1 + remote * 0.1));
    }

    int salaryBand(double averageSalary) {
        if (averageSalary <= 0) {
            return 0;
        }
        if (averageSalary > 150000) {
            return 100;
        } else if (averageSalary > 120000) {
            return 90;
        } else if (averageSalary > 100000) {
            return 80;
        } else if (averageSalary > 80000) {
            return 70;
        } else if (averageSalary > 60000) {
            return 60;
        }
        return 50;
    }

    /**
     * Ratios may arrive as fractions (0.4) or percentages (40).
     */
    private int ratioScore(JsonNode node) {
        if (node == null || !node.isNumber()) {
            return 0;
        }
        double value = node.asDouble();
        double percent = value <= 1.0 ? value * 100 : value;
        return clamp((int) Math.round(percent));
    }

    /**
     * Inverse of the weighted gap as a share of the maximum (every gap High).
     */
    int skillGapScore(List<SkillGap> skillGaps) {
        if (skillGaps.isEmpty()) {
            return NO_GAPS_SCORE;
        }
        int weighted = skillGaps.stream().mapToInt(gap -> gap.gapLevel().weight()).sum();
        int max = skillGaps.size() * GapLevel.HIGH.weight();
        int score = 100 - Math.min(100, (int) Math.round(weighted * 100.0 / max));
        return skillGaps.size() < FEW_GAPS ? Math.min(score, FEW_GAPS_CAP) : score;
    }

    int educationPathScore(String targetRole, List<SkillGap> skillGaps) {
        String role = targetRole.toLowerCase(Locale.ROOT);
        int base = scoringConfig.getEducationPaths().stream()
                .filter(entry -> matches(role, entry))
                .mapToInt(ScoringConfig.RoleScore::getScore)
                .findFirst()
                .orElse(scoringConfig.getDefaultEducationPathScore());

        long toLearn = skillGaps.stream()
                .filter(gap -> gap.gapLevel() != GapLevel.LOW)
                .count();
        if (toLearn > 10) {
            return Math.max(50, base - 20);
        } else if (toLearn > 5) {
            return Math.max(60, base - 10);
        } else if (toLearn == 0) {
            return Math.min(95, base + 10);
        }
        return base;
    }

    int industryTrendScore(String targetRole) {
        return highestMatch(targetRole, scoringConfig.getIndustryTrends(), scoringConfig.getDefaultIndustryTrendScore());
    }

    int geographicalFactorScore(String targetRole) {
        return highestMatch(targetRole, scoringConfig.getRemoteFriendliness(), scoringConfig.getDefaultGeographicalScore());
    }

    private int highestMatch(String targetRole, List<ScoringConfig.RoleScore> table, int defaultScore) {
        String role = targetRole.toLowerCase(Locale.ROOT);
        return table.stream()
                .filter(entry -> matches(role, entry))
                .mapToInt(ScoringConfig.RoleScore::getScore)
                .max()
                .orElse(defaultScore);
    }

    private boolean matches(String role, ScoringConfig.RoleScore entry) {
        return entry.getRole() != null && role.contains(entry.getRole().toLowerCase(Locale.ROOT));
    }

    private int clamp(int score) {
        return Math.max(0, Math.min(100, score));
    }

    private String buildMarketPrompt(String currentRole, String targetRole) {
        return String.format("""
                Look at current job postings for %s positions that would suit someone coming from %s.
                Sample up to %d recent postings and report:
                - postingCount: how many matching postings you found in the sample
                - averageSalary: average annual salary in USD across postings that state one
                - remoteRatio: share of postings that allow remote work, between 0 and 1
                - benefitsRatio: share of postings that mention benefits (health insurance, retirement, paid time off), between 0 and 1

                Respond with JSON only:
                {"postingCount": number, "averageSalary": number, "remoteRatio": number, "benefitsRatio": number}
                """,
                targetRole, currentRole, scoringConfig.getPostingCountSaturation());
    }
}
