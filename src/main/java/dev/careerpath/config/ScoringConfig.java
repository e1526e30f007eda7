package dev.careerpath.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for the readiness score.
 * Loaded from weights.yml under 'scoring' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "scoring")
public class ScoringConfig {

    private static final double WEIGHT_TOLERANCE = 1e-6;

    private Weights weights = new Weights();

    private boolean marketSignalEnabled = false;
    private int postingCountSaturation = 10;
    private int neutralMarketScore = 50;

    private int marketDemandThreshold = 60;
    private int educationPathThreshold = 70;

    private int defaultEducationPathScore = 75;
    private int defaultIndustryTrendScore = 70;
    private int defaultGeographicalScore = 75;

    /**
     * First match wins.
     */
    private List<RoleScore> educationPaths = new ArrayList<>();

    /**
     * Highest match wins.
     */
    private List<RoleScore> industryTrends = new ArrayList<>();

    /**
     * Highest match wins.
     */
    private List<RoleScore> remoteFriendliness = new ArrayList<>();

    @PostConstruct
    void validate() {
        double sum = weights.sum();
        if (Math.abs(sum - 1.0) > WEIGHT_TOLERANCE) {
            throw new IllegalStateException("scoring.weights must sum to 1.0 but sum to " + sum);
        }
    }

    @Data
    public static class Weights {
        private double marketDemand = 0.25;
        private double skillGap = 0.30;
        private double educationPath = 0.20;
        private double industryTrend = 0.15;
        private double geographicalFactor = 0.10;

        public double sum() {
            return marketDemand + skillGap + educationPath + industryTrend + geographicalFactor;
        }
    }

    @Data
    public static class RoleScore {
        /**
         * Lower-case fragment matched against the target role.
         */
        private String role;
        private int score;
    }
}
