package dev.careerpath.pipeline;

import dev.careerpath.model.Transition;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Per-run view handed to the stages: the transition being analyzed plus the run's
 * cancellation flag and signal.
 */
public class RunContext {

    private final Transition transition;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Sinks.Empty<Void> cancelSignal = Sinks.empty();

    public RunContext(Transition transition) {
        this.transition = transition;
    }

    public Transition getTransition() {
        return transition;
    }

    public String getCurrentRole() {
        return transition.getCurrentRole();
    }

    public String getTargetRole() {
        return transition.getTargetRole();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Raise the flag and fire the signal.
     *
     * @return false if the run was already cancelled
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        cancelSignal.tryEmitEmpty();
        return true;
    }

    /**
     * Fails with {@link RunCancelledException} as soon as the run is cancelled.
     */
    public <T> Mono<T> whenCancelled() {
        return cancelSignal.asMono().then(Mono.error(() -> new RunCancelledException(transition.getId())));
    }

    /**
     * Wrap an external call: refuse to start it once cancelled, and abandon it when
     * cancellation fires while it is in flight.
     */
    public <T> Mono<T> guard(Supplier<Mono<T>> call) {
        return Mono.defer(() -> {
            if (isCancelled()) {
                return Mono.error(new RunCancelledException(transition.getId()));
            }
            return Mono.firstWithSignal(call.get(), this.<T>whenCancelled());
        });
    }
}
