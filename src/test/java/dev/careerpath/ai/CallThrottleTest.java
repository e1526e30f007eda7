package dev.careerpath.ai;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class CallThrottleTest {

    @Test
    @DisplayName("Should never exceed the concurrency limit")
    void shouldLimitConcurrency() {
        CallThrottle throttle = new CallThrottle(2, Duration.ZERO);
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();

        Flux<Integer> calls = Flux.range(0, 6)
                .flatMap(i -> throttle.submit(() -> Mono.fromCallable(() -> {
                            int current = inFlight.incrementAndGet();
                            maxInFlight.accumulateAndGet(current, Math::max);
                            return i;
                        })
                        .delayElement(Duration.ofMillis(50))
                        .doFinally(signal -> inFlight.decrementAndGet())));

        StepVerifier.create(calls)
                .expectNextCount(6)
                .verifyComplete();

        assertThat(maxInFlight.get()).isLessThanOrEqualTo(2);
        assertThat(throttle.availablePermits()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should space call starts by the minimum interval")
    void shouldSpaceCallStarts() {
        CallThrottle throttle = new CallThrottle(4, Duration.ofMillis(100));
        long start = System.nanoTime();

        StepVerifier.create(Flux.range(0, 3).flatMap(i -> throttle.submit(() -> Mono.just(i))))
                .expectNextCount(3)
                .verifyComplete();

        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();
        assertThat(elapsedMs).isGreaterThanOrEqualTo(150);
    }

    @Test
    @DisplayName("Should release the permit when the call fails")
    void shouldReleaseOnError() {
        CallThrottle throttle = new CallThrottle(1, Duration.ZERO);

        StepVerifier.create(throttle.submit(() -> Mono.error(new IllegalStateException("boom"))))
                .expectError(IllegalStateException.class)
                .verify();

        assertThat(throttle.availablePermits()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should release the permit when cancelled while waiting for a start slot")
    void shouldReleaseOnCancelDuringSlotWait() {
        CallThrottle throttle = new CallThrottle(1, Duration.ofSeconds(30));
        throttle.submit(() -> Mono.just(0)).block(Duration.ofSeconds(5));

        StepVerifier.create(throttle.submit(() -> Mono.just(1)))
                .expectSubscription()
                .expectNoEvent(Duration.ofMillis(100))
                .thenCancel()
                .verify(Duration.ofSeconds(5));

        assertThat(throttle.availablePermits()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should hand back a permit acquired but cancelled before delivery")
    void shouldReleaseUndeliveredPermit() {
        CallThrottle throttle = new CallThrottle(1, Duration.ZERO);

        StepVerifier.create(throttle.acquirePermit(), 0)
                .expectSubscription()
                .thenCancel()
                .verify(Duration.ofSeconds(5));

        assertThat(throttle.availablePermits()).isEqualTo(1);
    }
}
