package dev.careerpath;

import dev.careerpath.model.ArtifactBundle;
import dev.careerpath.model.Milestone;
import dev.careerpath.model.SkillGap;
import dev.careerpath.pipeline.PipelineOrchestrator;
import dev.careerpath.pipeline.RunHandle;
import dev.careerpath.pipeline.StageEvent;
import dev.careerpath.pipeline.StageStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Runs one analysis for the configured roles, logs progress and the final report.
 * Separated from the Application class for testability.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineRunner {

  private static final String SEPARATOR = "========================================";

  private final PipelineOrchestrator orchestrator;

  @Value("${analysis.current-role:}")
  private String currentRole;

  @Value("${analysis.target-role:}")
  private String targetRole;

  @Value("${analysis.metrics-wait-seconds:0}")
  private int metricsWaitSeconds;

  /**
   * Executes the analysis and handles the post-execution wait.
   *
   * @return the completed artifact bundle
   * @throws IllegalStateException if the run fails or is cancelled
   */
  public ArtifactBundle execute() {
    log.info(SEPARATOR);
    log.info("Career Path Analysis Starting");
    log.info("Transition: {} -> {}", currentRole, targetRole);
    log.info(SEPARATOR);

    try {
      RunHandle handle = orchestrator.start(currentRole, targetRole);
      orchestrator.subscribe(handle).subscribe(this::logEvent);

      ArtifactBundle bundle = orchestrator.result(handle).block();
      if (bundle == null) {
        throw new IllegalStateException("Run " + handle.id() + " produced no result");
      }

      logReport(bundle);
      handleMetricsWait();

      return bundle;
    } catch (Exception e) {
      log.error("Career path analysis failed: {}", e.getMessage(), e);
      throw new IllegalStateException("Pipeline execution failed", e);
    }
  }

  private void logEvent(StageEvent event) {
    if (event.status() == StageStatus.FAILED) {
      log.warn("[{}] {} ({})", event.stage().value(), event.status(), event.category());
    } else {
      log.info("[{}] {}", event.stage().value(), event.status());
    }
  }

  private void logReport(ArtifactBundle bundle) {
    log.info(SEPARATOR);
    log.info("Analysis Completed Successfully");
    log.info("Stories: {} | Insights: {} | Skill gaps: {}",
        bundle.scrapedCount(), bundle.insights().size(), bundle.skillGaps().size());
    for (SkillGap gap : bundle.skillGaps()) {
      log.info("  - {} [{}] mentions={} confidence={}",
          gap.skillName(), gap.gapLevel().label(), gap.mentionCount(),
          String.format("%.2f", gap.confidenceScore()));
    }
    log.info("Plan{}:", bundle.plan().fallback() ? " (fallback)" : "");
    for (Milestone milestone : bundle.plan().milestones()) {
      log.info("  {}. {} ({} weeks, {})", milestone.order() + 1, milestone.title(),
          milestone.durationWeeks(), milestone.priority().label());
    }
    log.info("Readiness score: {}", bundle.readinessScore().overallScore());
    log.info(SEPARATOR);
  }

  private void handleMetricsWait() {
    if (metricsWaitSeconds > 0) {
      log.info("Keeping alive for {} seconds (metrics scrape)...", metricsWaitSeconds);
      try {
        Thread.sleep(metricsWaitSeconds * 1000L);
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        log.warn("Metrics wait interrupted");
      }
    }
  }
}
