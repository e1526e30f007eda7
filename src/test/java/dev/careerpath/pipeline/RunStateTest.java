package dev.careerpath.pipeline;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RunStateTest {

    @Test
    void shouldOnlyMoveForwardOneStepAtATime() {
        assertThat(RunState.IDLE.canTransitionTo(RunState.STORIES)).isTrue();
        assertThat(RunState.STORIES.canTransitionTo(RunState.INSIGHTS)).isTrue();
        assertThat(RunState.METRICS.canTransitionTo(RunState.COMPLETE)).isTrue();
        assertThat(RunState.STORIES.canTransitionTo(RunState.SKILLS)).isFalse();
        assertThat(RunState.PLAN.canTransitionTo(RunState.INSIGHTS)).isFalse();
    }

    @Test
    void shouldAllowFailureAndCancellationFromNonTerminalStates() {
        assertThat(RunState.IDLE.canTransitionTo(RunState.CANCELLED)).isTrue();
        assertThat(RunState.PLAN.canTransitionTo(RunState.FAILED)).isTrue();
    }

    @Test
    void shouldNotLeaveTerminalStates() {
        assertThat(RunState.COMPLETE.isTerminal()).isTrue();
        assertThat(RunState.COMPLETE.canTransitionTo(RunState.FAILED)).isFalse();
        assertThat(RunState.CANCELLED.canTransitionTo(RunState.STORIES)).isFalse();
        assertThat(RunState.FAILED.canTransitionTo(RunState.CANCELLED)).isFalse();
        assertThat(RunState.METRICS.isTerminal()).isFalse();
    }
}
