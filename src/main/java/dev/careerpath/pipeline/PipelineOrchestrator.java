package dev.careerpath.pipeline;

import dev.careerpath.ai.ExternalServiceException;
import dev.careerpath.config.PipelineConfig;
import dev.careerpath.metrics.PipelineMetrics;
import dev.careerpath.model.ArtifactBundle;
import dev.careerpath.model.Transition;
import dev.careerpath.service.ArtifactStore;
import dev.careerpath.service.InsightExtractor;
import dev.careerpath.service.PlanGenerator;
import dev.careerpath.service.ReadinessScorer;
import dev.careerpath.service.SkillGapAnalyzer;
import dev.careerpath.source.NoSourcesFoundException;
import dev.careerpath.source.SourceRetriever;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Drives one run through stories, insights, skills, plan and metrics.
 *
 * Stages run strictly in order. Each stage either commits its whole artifact or nothing;
 * cancellation is checked at every boundary and raced against the stage body.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineOrchestrator {

    private final SourceRetriever sourceRetriever;
    private final InsightExtractor insightExtractor;
    private final SkillGapAnalyzer skillGapAnalyzer;
    private final PlanGenerator planGenerator;
    private final ReadinessScorer readinessScorer;
    private final ArtifactStore artifactStore;
    private final RunRegistry runRegistry;
    private final PipelineConfig pipelineConfig;
    private final PipelineMetrics metrics;

    /**
     * Validate the roles and start a run in the background.
     *
     * @throws InvalidInputException if either role is null, blank or too long
     */
    public RunHandle start(String currentRole, String targetRole) {
        String current = validateRole("currentRole", currentRole);
        String target = validateRole("targetRole", targetRole);

        Transition transition = Transition.builder()
                .id(UUID.randomUUID().toString())
                .currentRole(current)
                .targetRole(target)
                .createdAt(Instant.now())
                .complete(false)
                .build();

        PipelineRun run = runRegistry.register(new PipelineRun(new RunContext(transition)));
        metrics.recordRunStarted();
        log.info("Run {} started: {} -> {}", run.getId(), current, target);

        execute(run)
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe(
                        ignored -> { },
                        e -> log.error("Run {} terminated unexpectedly: {}", run.getId(), e.getMessage(), e));

        return new RunHandle(run.getId());
    }

    /**
     * Replaying event stream of a run. Completes once the run reaches a terminal state.
     */
    public Flux<StageEvent> subscribe(RunHandle handle) {
        return Flux.defer(() -> runRegistry.require(handle).eventStream());
    }

    /**
     * Request cancellation.
     *
     * @return true if the run was still active and this call cancelled it
     */
    public boolean cancel(RunHandle handle) {
        if (handle == null) {
            return false;
        }
        PipelineRun run = runRegistry.find(handle.id()).orElse(null);
        if (run == null || run.currentState().isTerminal()) {
            return false;
        }
        boolean cancelled = run.getContext().cancel();
        if (cancelled) {
            log.info("Cancellation requested for run {} during {}", run.getId(), run.currentState());
        }
        return cancelled;
    }

    public Mono<ArtifactBundle> result(RunHandle handle) {
        return Mono.defer(() -> runRegistry.require(handle).resultMono());
    }

    public RunState state(RunHandle handle) {
        return runRegistry.require(handle).currentState();
    }

    private String validateRole(String field, String value) {
        if (value == null) {
            throw new InvalidInputException(field + " is required");
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            throw new InvalidInputException(field + " must not be blank");
        }
        if (trimmed.length() > pipelineConfig.getMaxRoleLength()) {
            throw new InvalidInputException(field + " must be at most "
                    + pipelineConfig.getMaxRoleLength() + " characters");
        }
        return trimmed;
    }

    private Mono<Void> execute(PipelineRun run) {
        RunContext context = run.getContext();

        return runStage(run, Stage.STORIES,
                deadline -> sourceRetriever.retrieve(context, deadline),
                run::setStories)
                .then(runStage(run, Stage.INSIGHTS,
                        deadline -> insightExtractor.extract(context, run.getStories(), deadline),
                        run::setInsights))
                .then(runStage(run, Stage.SKILLS,
                        deadline -> Mono.fromCallable(() -> skillGapAnalyzer.analyze(run.getStories(), run.getInsights())),
                        run::setSkillGaps))
                .then(runStage(run, Stage.PLAN,
                        deadline -> planGenerator.generate(context, run.getSkillGaps(), deadline),
                        run::setPlan))
                .then(runStage(run, Stage.METRICS,
                        deadline -> readinessScorer.score(context, run.getSkillGaps(), deadline),
                        run::setReadinessScore))
                .then(Mono.defer(() -> finish(run)))
                .onErrorResume(e -> {
                    handleFailure(run, Exceptions.unwrap(e));
                    return Mono.empty();
                });
    }

    /**
     * Run one stage: boundary check, STARTED, body raced against cancellation and bounded by
     * deadline plus grace, boundary check again, then commit and COMPLETED.
     */
    private <T> Mono<Void> runStage(PipelineRun run, Stage stage,
                                    Function<Duration, Mono<T>> body, Consumer<T> commit) {
        return Mono.defer(() -> {
            RunContext context = run.getContext();
            if (context.isCancelled()) {
                return Mono.error(new RunCancelledException(run.getId()));
            }
            if (!run.advance(stage.runState())) {
                return Mono.error(new IllegalStateException(
                        "Illegal transition " + run.currentState() + " -> " + stage.runState()));
            }

            Duration deadline = pipelineConfig.deadlineFor(stage);
            long startNanos = System.nanoTime();
            run.stageStarted(stage);
            log.info("Run {} stage {} started (deadline {}s)", run.getId(), stage.value(), deadline.toSeconds());

            return Mono.firstWithSignal(Mono.defer(() -> body.apply(deadline)), context.<T>whenCancelled())
                    .timeout(deadline.plus(pipelineConfig.getDeadlineGrace()))
                    .switchIfEmpty(Mono.error(() -> new IllegalStateException(
                            "Stage " + stage.value() + " produced no artifact")))
                    .flatMap(artifact -> {
                        if (context.isCancelled()) {
                            return Mono.error(new RunCancelledException(run.getId()));
                        }
                        commit.accept(artifact);
                        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
                        metrics.recordStageDuration(stage.value(), elapsed);
                        run.stageCompleted(stage, artifact);
                        log.info("Run {} stage {} completed in {}ms", run.getId(), stage.value(), elapsed.toMillis());
                        return Mono.<Void>empty();
                    });
        });
    }

    private Mono<Void> finish(PipelineRun run) {
        if (run.getContext().isCancelled()) {
            return Mono.error(new RunCancelledException(run.getId()));
        }
        if (!run.advance(RunState.COMPLETE)) {
            return Mono.error(new IllegalStateException("Run " + run.getId() + " cannot complete from "
                    + run.currentState()));
        }

        Transition transition = run.getContext().getTransition();
        transition.setComplete(true);

        ArtifactBundle bundle = ArtifactBundle.builder()
                .transition(transition)
                .stories(run.getStories())
                .insights(run.getInsights())
                .skillGaps(run.getSkillGaps())
                .plan(run.getPlan())
                .readinessScore(run.getReadinessScore())
                .scrapedCount(run.getStories().size())
                .build();

        return Mono.<Void>fromRunnable(() -> artifactStore.save(bundle))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> {
                    log.error("Failed to store analysis for run {}: {}", run.getId(), e.getMessage(), e);
                    return Mono.empty();
                })
                .then(Mono.<Void>fromRunnable(() -> {
                    metrics.recordRunCompleted(bundle.scrapedCount(), bundle.skillGaps().size(),
                            bundle.readinessScore().overallScore());
                    log.info("Run {} complete: {} stories, {} insights, {} skill gaps, readiness {}",
                            run.getId(), bundle.scrapedCount(), bundle.insights().size(),
                            bundle.skillGaps().size(), bundle.readinessScore().overallScore());
                    run.succeed(bundle);
                    runRegistry.scheduleEviction(run.getId());
                }));
    }

    private void handleFailure(PipelineRun run, Throwable error) {
        if (error instanceof RunCancelledException || run.getContext().isCancelled()) {
            Stage stage = run.interruptedStage();
            run.advance(RunState.CANCELLED);
            run.emit(StageEvent.cancelled(stage));
            metrics.recordRunCancelled();
            log.info("Run {} cancelled at stage {}", run.getId(), stage.value());
            run.terminate(error instanceof RunCancelledException ? error : new RunCancelledException(run.getId()));
        } else {
            Stage stage = run.getCurrentStage() != null ? run.getCurrentStage() : Stage.STORIES;
            FailureCategory category = categorize(error);
            run.advance(RunState.FAILED);
            run.emit(StageEvent.failed(stage, category));
            metrics.recordRunFailed(stage.value(), category.name());
            log.error("Run {} failed at stage {} ({}): {}", run.getId(), stage.value(), category, error.getMessage());
            run.terminate(new StageFailureException(stage, category, error));
        }
        runRegistry.scheduleEviction(run.getId());
    }

    static FailureCategory categorize(Throwable error) {
        if (error instanceof NoSourcesFoundException) {
            return FailureCategory.NO_SOURCES_FOUND;
        }
        if (error instanceof TimeoutException) {
            return FailureCategory.TIMEOUT;
        }
        if (error instanceof ExternalServiceException) {
            ExternalServiceException external = (ExternalServiceException) error;
            return external.getKind() == ExternalServiceException.Kind.TIMEOUT
                    ? FailureCategory.TIMEOUT
                    : FailureCategory.EXTERNAL_SERVICE;
        }
        return FailureCategory.INTERNAL;
    }
}
