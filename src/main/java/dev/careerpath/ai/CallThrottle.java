package dev.careerpath.ai;

import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Shared gate in front of a provider: at most {@code concurrencyLimit} calls in flight and
 * at least {@code minInterval} between two call starts. Waiting never blocks a thread.
 */
public class CallThrottle {

    private static final Duration POLL_INTERVAL = Duration.ofMillis(25);

    private final Semaphore permits;
    private final long minIntervalNanos;
    private final AtomicLong nextSlot;

    public CallThrottle(int concurrencyLimit, Duration minInterval) {
        this.permits = new Semaphore(Math.max(1, concurrencyLimit), true);
        this.minIntervalNanos = minInterval == null ? 0 : Math.max(0, minInterval.toNanos());
        this.nextSlot = new AtomicLong(System.nanoTime());
    }

    /**
     * Run the call once a permit and a start slot are available. The permit is released when
     * the call terminates or is cancelled.
     */
    public <T> Mono<T> submit(Supplier<Mono<T>> call) {
        return Mono.usingWhen(
                acquirePermit(),
                permit -> Mono.delay(reserveSlot()).then(Mono.defer(call)),
                permit -> Mono.fromRunnable(permits::release));
    }

    public int availablePermits() {
        return permits.availablePermits();
    }

    /**
     * Emits once a permit is held. A permit acquired but never delivered downstream is handed back.
     */
    Mono<Boolean> acquirePermit() {
        return Mono.fromCallable(permits::tryAcquire)
                .filter(Boolean::booleanValue)
                .repeatWhenEmpty(attempts -> attempts.delayElements(POLL_INTERVAL))
                .doOnDiscard(Boolean.class, acquired -> {
                    if (acquired) {
                        permits.release();
                    }
                });
    }

    private Duration reserveSlot() {
        long now = System.nanoTime();
        long previous = nextSlot.getAndAccumulate(now, (next, current) -> Math.max(next, current) + minIntervalNanos);
        return Duration.ofNanos(Math.max(0, Math.max(previous, now) - now));
    }
}
