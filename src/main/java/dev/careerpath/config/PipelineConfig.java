package dev.careerpath.config;

import dev.careerpath.pipeline.Stage;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Orchestration settings: input limits, stage deadlines, run retention and per-stage tuning.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "pipeline")
public class PipelineConfig {

    private int maxRoleLength = 100;

    private StageDeadlines stageDeadlines = new StageDeadlines();

    /**
     * Added to each stage deadline before the orchestrator fails the stage with TIMEOUT.
     */
    private Duration deadlineGrace = Duration.ofSeconds(2);

    /**
     * How long finished runs stay queryable.
     */
    private Duration runTtl = Duration.ofMinutes(30);

    private Insights insights = new Insights();
    private PlanSettings plan = new PlanSettings();

    public Duration deadlineFor(Stage stage) {
        switch (stage) {
            case STORIES:
                return stageDeadlines.getStories();
            case INSIGHTS:
                return stageDeadlines.getInsights();
            case SKILLS:
                return stageDeadlines.getSkills();
            case PLAN:
                return stageDeadlines.getPlan();
            default:
                return stageDeadlines.getMetrics();
        }
    }

    @Data
    public static class StageDeadlines {
        private Duration stories = Duration.ofSeconds(90);
        private Duration insights = Duration.ofSeconds(120);
        private Duration skills = Duration.ofSeconds(10);
        private Duration plan = Duration.ofSeconds(60);
        private Duration metrics = Duration.ofSeconds(60);
    }

    @Data
    public static class Insights {
        private int concurrency = 3;
        private int maxPerStory = 3;
        private boolean overviewEnabled = true;
        private int maxTokens = 1024;
    }

    @Data
    public static class PlanSettings {
        private int topSkills = 5;
        private int milestoneCount = 4;
        private int maxTokens = 2048;
    }
}
