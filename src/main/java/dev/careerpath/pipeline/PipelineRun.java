package dev.careerpath.pipeline;

import dev.careerpath.model.ArtifactBundle;
import dev.careerpath.model.Insight;
import dev.careerpath.model.Plan;
import dev.careerpath.model.ReadinessScore;
import dev.careerpath.model.ScrapedData;
import dev.careerpath.model.SkillGap;
import lombok.Getter;
import lombok.Setter;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Mutable state of one run: current state, committed artifacts, the replaying event stream and
 * the final result. Owned by the orchestrator and never shared between runs.
 */
@Getter
class PipelineRun {

    private static final Duration EMIT_RETRY = Duration.ofSeconds(1);

    private final RunContext context;
    private final AtomicReference<RunState> state = new AtomicReference<>(RunState.IDLE);
    private final Sinks.Many<StageEvent> events = Sinks.many().replay().all();
    private final Sinks.One<ArtifactBundle> result = Sinks.one();

    /**
     * Stage most recently started, and whether it is still running.
     */
    private volatile Stage currentStage;
    private volatile boolean stageOpen;

    @Setter
    private volatile List<ScrapedData> stories;
    @Setter
    private volatile List<Insight> insights;
    @Setter
    private volatile List<SkillGap> skillGaps;
    @Setter
    private volatile Plan plan;
    @Setter
    private volatile ReadinessScore readinessScore;

    PipelineRun(RunContext context) {
        this.context = context;
    }

    String getId() {
        return context.getTransition().getId();
    }

    RunState currentState() {
        return state.get();
    }

    /**
     * Move to the next state if the state machine allows it.
     */
    boolean advance(RunState next) {
        while (true) {
            RunState current = state.get();
            if (!current.canTransitionTo(next)) {
                return false;
            }
            if (state.compareAndSet(current, next)) {
                return true;
            }
        }
    }

    void stageStarted(Stage stage) {
        currentStage = stage;
        stageOpen = true;
        emit(StageEvent.started(stage));
    }

    void stageCompleted(Stage stage, Object artifact) {
        stageOpen = false;
        emit(StageEvent.completed(stage, artifact));
    }

    /**
     * Stage to blame for a cancellation: the one running, else the one that would run next.
     */
    Stage interruptedStage() {
        if (currentStage == null) {
            return Stage.STORIES;
        }
        if (stageOpen || currentStage.ordinal() == Stage.values().length - 1) {
            return currentStage;
        }
        return Stage.values()[currentStage.ordinal() + 1];
    }

    void emit(StageEvent event) {
        events.emitNext(event, Sinks.EmitFailureHandler.busyLooping(EMIT_RETRY));
    }

    void succeed(ArtifactBundle bundle) {
        result.emitValue(bundle, Sinks.EmitFailureHandler.busyLooping(EMIT_RETRY));
        events.emitComplete(Sinks.EmitFailureHandler.busyLooping(EMIT_RETRY));
    }

    void terminate(Throwable error) {
        result.emitError(error, Sinks.EmitFailureHandler.busyLooping(EMIT_RETRY));
        events.emitComplete(Sinks.EmitFailureHandler.busyLooping(EMIT_RETRY));
    }

    Flux<StageEvent> eventStream() {
        return events.asFlux();
    }

    Mono<ArtifactBundle> resultMono() {
        return result.asMono();
    }
}
