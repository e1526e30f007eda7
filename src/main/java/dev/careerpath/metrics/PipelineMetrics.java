package dev.careerpath.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for the analysis pipeline and its external calls.
 */
@Component
public class PipelineMetrics {

    private static final String TAG_STAGE = "stage";
    private static final String TAG_PROVIDER = "provider";
    private final MeterRegistry registry;

    // Counters
    private final Counter runsStartedCounter;
    private final Counter runsCompletedCounter;
    private final Counter runsCancelledCounter;
    private final Counter storiesFoundCounter;
    private final Counter insightsExtractedCounter;
    private final Counter fallbackPlansCounter;

    // Timers (per stage)
    private final ConcurrentHashMap<String, Timer> stageTimers = new ConcurrentHashMap<>();

    // Gauges
    private final AtomicInteger activeRuns = new AtomicInteger(0);
    private final AtomicInteger lastRunStories = new AtomicInteger(0);
    private final AtomicInteger lastRunSkillGaps = new AtomicInteger(0);
    private final AtomicInteger lastRunOverallScore = new AtomicInteger(0);

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;

        // Run counters
        this.runsStartedCounter = Counter.builder("career_pipeline_runs_started_total")
                .description("Total analysis runs started")
                .register(registry);

        this.runsCompletedCounter = Counter.builder("career_pipeline_runs_completed_total")
                .description("Total analysis runs that reached the complete state")
                .register(registry);

        this.runsCancelledCounter = Counter.builder("career_pipeline_runs_cancelled_total")
                .description("Total analysis runs cancelled by their owner")
                .register(registry);

        // Artifact counters
        this.storiesFoundCounter = Counter.builder("career_pipeline_stories_found_total")
                .description("Total narratives kept after parsing and deduplication")
                .register(registry);

        this.insightsExtractedCounter = Counter.builder("career_pipeline_insights_extracted_total")
                .description("Total insights extracted from narratives")
                .register(registry);

        this.fallbackPlansCounter = Counter.builder("career_pipeline_fallback_plans_total")
                .description("Total plans replaced by the fallback plan")
                .register(registry);

        // Gauges
        Gauge.builder("career_pipeline_active_runs", activeRuns, AtomicInteger::get)
                .description("Runs currently executing")
                .register(registry);

        Gauge.builder("career_pipeline_last_run_stories", lastRunStories, AtomicInteger::get)
                .description("Narratives found in last completed run")
                .register(registry);

        Gauge.builder("career_pipeline_last_run_skill_gaps", lastRunSkillGaps, AtomicInteger::get)
                .description("Skill gaps found in last completed run")
                .register(registry);

        Gauge.builder("career_pipeline_last_run_overall_score", lastRunOverallScore, AtomicInteger::get)
                .description("Overall readiness score of last completed run")
                .register(registry);
    }

    /**
     * Get or create a timer for a pipeline stage.
     */
    public Timer getStageTimer(String stage) {
        return stageTimers.computeIfAbsent(stage, name ->
                Timer.builder("career_pipeline_stage_duration")
                        .description("Time spent in a pipeline stage")
                        .tag(TAG_STAGE, name)
                        .register(registry));
    }

    public void recordStageDuration(String stage, Duration duration) {
        getStageTimer(stage).record(duration);
    }

    public void recordRunStarted() {
        runsStartedCounter.increment();
        activeRuns.incrementAndGet();
    }

    public void recordRunCompleted(int stories, int skillGaps, int overallScore) {
        runsCompletedCounter.increment();
        activeRuns.decrementAndGet();
        lastRunStories.set(stories);
        lastRunSkillGaps.set(skillGaps);
        lastRunOverallScore.set(overallScore);
    }

    /**
     * Record a failed run, tagged with the failing stage and its category.
     */
    public void recordRunFailed(String stage, String category) {
        activeRuns.decrementAndGet();
        Counter.builder("career_pipeline_runs_failed_total")
                .tag(TAG_STAGE, stage)
                .tag("category", category)
                .register(registry)
                .increment();
    }

    public void recordRunCancelled() {
        runsCancelledCounter.increment();
        activeRuns.decrementAndGet();
    }

    public void recordStoriesFound(int count) {
        storiesFoundCounter.increment(count);
    }

    public void recordInsightsExtracted(int count) {
        insightsExtractedCounter.increment(count);
    }

    public void recordFallbackPlan() {
        fallbackPlansCounter.increment();
    }

    /**
     * Record an item dropped inside a stage (failed query, malformed extraction).
     */
    public void recordItemDropped(String stage) {
        Counter.builder("career_pipeline_items_dropped_total")
                .tag(TAG_STAGE, stage)
                .register(registry)
                .increment();
    }

    /**
     * Record an outbound call to a text-generation provider.
     */
    public void recordApiCall(String provider) {
        Counter.builder("career_pipeline_api_calls_total")
                .tag(TAG_PROVIDER, provider)
                .register(registry)
                .increment();
    }

    /**
     * Record a failed outbound call, tagged with its failure kind.
     */
    public void recordApiError(String provider, String kind) {
        Counter.builder("career_pipeline_api_errors_total")
                .tag(TAG_PROVIDER, provider)
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordApiLatency(String provider, long latencyMs) {
        Timer.builder("career_pipeline_api_call_duration")
                .description("Latency of text-generation calls")
                .tag(TAG_PROVIDER, provider)
                .register(registry)
                .record(Duration.ofMillis(latencyMs));
    }

    public int getActiveRuns() {
        return activeRuns.get();
    }
}
