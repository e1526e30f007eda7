package dev.careerpath.pipeline;

import dev.careerpath.ai.ExternalServiceException;
import dev.careerpath.config.PipelineConfig;
import dev.careerpath.metrics.PipelineMetrics;
import dev.careerpath.model.ArtifactBundle;
import dev.careerpath.model.GapLevel;
import dev.careerpath.model.Insight;
import dev.careerpath.model.InsightType;
import dev.careerpath.model.Plan;
import dev.careerpath.model.ReadinessScore;
import dev.careerpath.model.ScrapedData;
import dev.careerpath.model.SkillGap;
import dev.careerpath.service.ArtifactStore;
import dev.careerpath.service.FallbackPlan;
import dev.careerpath.service.InsightExtractor;
import dev.careerpath.service.PlanGenerator;
import dev.careerpath.service.ReadinessScorer;
import dev.careerpath.service.SkillGapAnalyzer;
import dev.careerpath.source.NoSourcesFoundException;
import dev.careerpath.source.SourceRetriever;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PipelineOrchestratorTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    @Mock
    private SourceRetriever sourceRetriever;
    @Mock
    private InsightExtractor insightExtractor;
    @Mock
    private SkillGapAnalyzer skillGapAnalyzer;
    @Mock
    private PlanGenerator planGenerator;
    @Mock
    private ReadinessScorer readinessScorer;
    @Mock
    private ArtifactStore artifactStore;

    private PipelineConfig pipelineConfig;
    private SimpleMeterRegistry meterRegistry;
    private PipelineOrchestrator orchestrator;

    private final List<ScrapedData> stories = List.of(ScrapedData.builder()
            .source("Reddit").url("https://reddit.com/1").content("I moved from teaching to data analysis").build());
    private final List<Insight> insights = List.of(Insight.builder()
            .type(InsightType.CHALLENGE).content("Learning SQL at night").source("Reddit").build());
    private final List<SkillGap> gaps = List.of(new SkillGap("SQL", GapLevel.HIGH, 0.8, 4));
    private final Plan plan = FallbackPlan.create("t", "Data Analyst");
    private final ReadinessScore score = ReadinessScore.builder().overallScore(64).build();

    @BeforeEach
    void setUp() {
        pipelineConfig = new PipelineConfig();
        meterRegistry = new SimpleMeterRegistry();
        orchestrator = new PipelineOrchestrator(sourceRetriever, insightExtractor, skillGapAnalyzer,
                planGenerator, readinessScorer, artifactStore, new RunRegistry(pipelineConfig), pipelineConfig,
                new PipelineMetrics(meterRegistry));
    }

    private void stubHappyPath() {
        lenient().when(sourceRetriever.retrieve(any(), any())).thenReturn(Mono.just(stories));
        lenient().when(insightExtractor.extract(any(), any(), any())).thenReturn(Mono.just(insights));
        lenient().when(skillGapAnalyzer.analyze(any(), any())).thenReturn(gaps);
        lenient().when(planGenerator.generate(any(), any(), any())).thenReturn(Mono.just(plan));
        lenient().when(readinessScorer.score(any(), any(), any())).thenReturn(Mono.just(score));
    }

    private List<StageEvent> events(RunHandle handle) {
        return orchestrator.subscribe(handle).collectList().block(WAIT);
    }

    @Nested
    @DisplayName("Happy path")
    class HappyPathTests {

        @Test
        @DisplayName("Should run every stage in order and store the bundle")
        void shouldCompleteRun() {
            stubHappyPath();

            RunHandle handle = orchestrator.start("  Teacher ", "Data Analyst");

            StepVerifier.create(orchestrator.result(handle))
                    .assertNext(bundle -> {
                        assertThat(bundle.transition().isComplete()).isTrue();
                        assertThat(bundle.transition().getCurrentRole()).isEqualTo("Teacher");
                        assertThat(bundle.transition().getId()).isEqualTo(handle.id());
                        assertThat(bundle.stories()).isEqualTo(stories);
                        assertThat(bundle.insights()).isEqualTo(insights);
                        assertThat(bundle.skillGaps()).isEqualTo(gaps);
                        assertThat(bundle.plan()).isEqualTo(plan);
                        assertThat(bundle.readinessScore()).isEqualTo(score);
                        assertThat(bundle.scrapedCount()).isEqualTo(1);
                    })
                    .verifyComplete();

            List<StageEvent> events = events(handle);
            assertThat(events).hasSize(10);
            assertThat(events).extracting(StageEvent::stage).containsExactly(
                    Stage.STORIES, Stage.STORIES, Stage.INSIGHTS, Stage.INSIGHTS, Stage.SKILLS, Stage.SKILLS,
                    Stage.PLAN, Stage.PLAN, Stage.METRICS, Stage.METRICS);
            assertThat(events.get(0).status()).isEqualTo(StageStatus.STARTED);
            assertThat(events.get(1).status()).isEqualTo(StageStatus.COMPLETED);
            assertThat(events.get(1).artifact()).isEqualTo(stories);

            assertThat(orchestrator.state(handle)).isEqualTo(RunState.COMPLETE);
            verify(artifactStore).save(any(ArtifactBundle.class));
            assertThat(meterRegistry.counter("career_pipeline_runs_completed_total").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should complete even when storing the bundle fails")
        void shouldIgnoreStorageFailure() {
            stubHappyPath();
            doThrow(new IllegalStateException("disk full")).when(artifactStore).save(any());

            RunHandle handle = orchestrator.start("Teacher", "Data Analyst");

            StepVerifier.create(orchestrator.result(handle))
                    .assertNext(bundle -> assertThat(bundle.transition().isComplete()).isTrue())
                    .expectComplete()
                    .verify(WAIT);
        }

        @Test
        @DisplayName("Should return false when cancelling a finished run")
        void shouldNotCancelFinishedRun() {
            stubHappyPath();
            RunHandle handle = orchestrator.start("Teacher", "Data Analyst");
            orchestrator.result(handle).block(WAIT);

            assertThat(orchestrator.cancel(handle)).isFalse();
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("Should fail the stories stage with NO_SOURCES_FOUND")
        void shouldFailWithoutSources() {
            when(sourceRetriever.retrieve(any(), any()))
                    .thenReturn(Mono.error(new NoSourcesFoundException("Teacher", "Astronaut")));

            RunHandle handle = orchestrator.start("Teacher", "Astronaut");

            StepVerifier.create(orchestrator.result(handle))
                    .expectErrorSatisfies(e -> {
                        assertThat(e).isInstanceOf(StageFailureException.class);
                        StageFailureException failure = (StageFailureException) e;
                        assertThat(failure.getStage()).isEqualTo(Stage.STORIES);
                        assertThat(failure.getCategory()).isEqualTo(FailureCategory.NO_SOURCES_FOUND);
                    })
                    .verify(WAIT);

            List<StageEvent> events = events(handle);
            assertThat(events).extracting(StageEvent::status)
                    .containsExactly(StageStatus.STARTED, StageStatus.FAILED);
            assertThat(events.get(1).category()).isEqualTo(FailureCategory.NO_SOURCES_FOUND);
            assertThat(orchestrator.state(handle)).isEqualTo(RunState.FAILED);
            verifyNoInteractions(insightExtractor, artifactStore);
        }

        @Test
        @DisplayName("Should fail with TIMEOUT when a stage overruns its deadline")
        void shouldTimeOutStage() {
            pipelineConfig.getStageDeadlines().setStories(Duration.ofMillis(100));
            pipelineConfig.setDeadlineGrace(Duration.ofMillis(50));
            when(sourceRetriever.retrieve(any(), any())).thenReturn(Mono.never());

            RunHandle handle = orchestrator.start("Teacher", "Data Analyst");

            StepVerifier.create(orchestrator.result(handle))
                    .expectErrorSatisfies(e -> assertThat(((StageFailureException) e).getCategory())
                            .isEqualTo(FailureCategory.TIMEOUT))
                    .verify(WAIT);
        }

        @Test
        @DisplayName("Should tag external failures and keep the failing stage")
        void shouldFailOnExternalError() {
            stubHappyPath();
            when(readinessScorer.score(any(), any(), any())).thenReturn(Mono.error(
                    new ExternalServiceException(ExternalServiceException.Kind.PROVIDER_ERROR, "502")));

            RunHandle handle = orchestrator.start("Teacher", "Data Analyst");

            StepVerifier.create(orchestrator.result(handle))
                    .expectErrorSatisfies(e -> {
                        StageFailureException failure = (StageFailureException) e;
                        assertThat(failure.getStage()).isEqualTo(Stage.METRICS);
                        assertThat(failure.getCategory()).isEqualTo(FailureCategory.EXTERNAL_SERVICE);
                    })
                    .verify(WAIT);

            verify(artifactStore, never()).save(any());
        }

        @Test
        @DisplayName("Should map unexpected errors to INTERNAL")
        void shouldCategorizeErrors() {
            assertThat(PipelineOrchestrator.categorize(new NullPointerException()))
                    .isEqualTo(FailureCategory.INTERNAL);
            assertThat(PipelineOrchestrator.categorize(
                    new ExternalServiceException(ExternalServiceException.Kind.TIMEOUT, "slow")))
                    .isEqualTo(FailureCategory.TIMEOUT);
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class CancellationTests {

        @Test
        @DisplayName("Should stop before the plan stage when cancelled during skills")
        void shouldCancelBeforePlan() {
            Sinks.One<List<Insight>> insightsGate = Sinks.one();
            AtomicReference<RunHandle> handleRef = new AtomicReference<>();
            when(sourceRetriever.retrieve(any(), any())).thenReturn(Mono.just(stories));
            when(insightExtractor.extract(any(), any(), any())).thenReturn(insightsGate.asMono());
            when(skillGapAnalyzer.analyze(any(), any())).thenAnswer(invocation -> {
                assertThat(orchestrator.cancel(handleRef.get())).isTrue();
                return gaps;
            });

            RunHandle handle = orchestrator.start("Teacher", "Data Analyst");
            handleRef.set(handle);
            insightsGate.tryEmitValue(insights);

            StepVerifier.create(orchestrator.result(handle))
                    .expectError(RunCancelledException.class)
                    .verify(WAIT);

            List<StageEvent> events = events(handle);
            StageEvent last = events.get(events.size() - 1);
            assertThat(last.stage()).isEqualTo(Stage.SKILLS);
            assertThat(last.status()).isEqualTo(StageStatus.CANCELLED);
            assertThat(events).noneMatch(event -> event.stage() == Stage.SKILLS
                    && event.status() == StageStatus.COMPLETED);
            assertThat(orchestrator.state(handle)).isEqualTo(RunState.CANCELLED);
            verifyNoInteractions(planGenerator, readinessScorer, artifactStore);
            assertThat(meterRegistry.counter("career_pipeline_runs_cancelled_total").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should abandon an in-flight stage when cancelled")
        void shouldAbandonInFlightStage() {
            when(sourceRetriever.retrieve(any(), any())).thenReturn(Mono.just(stories));
            when(insightExtractor.extract(any(), any(), any())).thenReturn(Mono.never());

            RunHandle handle = orchestrator.start("Teacher", "Data Analyst");
            orchestrator.subscribe(handle)
                    .filter(event -> event.stage() == Stage.INSIGHTS && event.status() == StageStatus.STARTED)
                    .blockFirst(WAIT);

            assertThat(orchestrator.cancel(handle)).isTrue();
            assertThat(orchestrator.cancel(handle)).isFalse();

            StepVerifier.create(orchestrator.result(handle))
                    .expectError(RunCancelledException.class)
                    .verify(WAIT);
            verifyNoInteractions(skillGapAnalyzer);
        }
    }

    @Nested
    @DisplayName("Input and handles")
    class InputTests {

        @Test
        @DisplayName("Should reject null, blank and over-long roles before any call")
        void shouldRejectInvalidRoles() {
            assertThatThrownBy(() -> orchestrator.start(null, "Data Analyst"))
                    .isInstanceOf(InvalidInputException.class);
            assertThatThrownBy(() -> orchestrator.start("Teacher", "   "))
                    .isInstanceOf(InvalidInputException.class);
            assertThatThrownBy(() -> orchestrator.start("x".repeat(101), "Data Analyst"))
                    .isInstanceOf(InvalidInputException.class);

            verifyNoInteractions(sourceRetriever);
            assertThat(meterRegistry.counter("career_pipeline_runs_started_total").count()).isZero();
        }

        @Test
        @DisplayName("Should report unknown handles")
        void shouldRejectUnknownHandles() {
            RunHandle unknown = new RunHandle("missing");

            StepVerifier.create(orchestrator.subscribe(unknown))
                    .expectError(UnknownRunException.class)
                    .verify();
            StepVerifier.create(orchestrator.result(unknown))
                    .expectError(UnknownRunException.class)
                    .verify();
            assertThat(orchestrator.cancel(unknown)).isFalse();
            assertThatThrownBy(() -> orchestrator.state(unknown)).isInstanceOf(UnknownRunException.class);
        }
    }
}
