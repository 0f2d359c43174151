package xyz.vvrf.reactor.flow.retry;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;
import xyz.vvrf.reactor.flow.breaker.CircuitBreakerConfig;
import xyz.vvrf.reactor.flow.breaker.CircuitBreakerRegistry;
import xyz.vvrf.reactor.flow.breaker.CircuitState;
import xyz.vvrf.reactor.flow.exception.CircuitOpenException;
import xyz.vvrf.reactor.flow.exception.PermanentException;
import xyz.vvrf.reactor.flow.exception.RetryExhaustedException;
import xyz.vvrf.reactor.flow.exception.TransientException;
import xyz.vvrf.reactor.flow.metrics.MetricsCollector;
import xyz.vvrf.reactor.flow.test.util.MutableClock;
import xyz.vvrf.reactor.flow.test.util.RecordingSleeper;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static xyz.vvrf.reactor.flow.metrics.MetricsCollector.tags;

class RetryExecutorTest {

    private static final RetryPolicy NO_JITTER = RetryPolicy.builder()
            .maxAttempts(3)
            .initialDelay(Duration.ofSeconds(1))
            .backoffMultiplier(2.0)
            .jitter(false)
            .build();

    private MutableClock clock;
    private MetricsCollector metrics;
    private CircuitBreakerRegistry breakers;
    private RecordingSleeper sleeper;
    private VirtualTimeScheduler vts;
    private RetryExecutor executor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        metrics = new MetricsCollector(new SimpleMeterRegistry(), clock);
        breakers = new CircuitBreakerRegistry(CircuitBreakerConfig.defaults(), metrics, clock);
        sleeper = new RecordingSleeper(clock);
        vts = VirtualTimeScheduler.create();
        executor = new RetryExecutor(breakers, metrics, NO_JITTER, sleeper, vts);
    }

    @AfterEach
    void tearDown() {
        vts.dispose();
    }

    @Test
    void succeedsAfterTransientFailures() {
        AtomicInteger calls = new AtomicInteger();
        List<Integer> attempts = new ArrayList<>();

        String result = executor.execute("queryUpstream", NO_JITTER, () -> {
            if (calls.incrementAndGet() < 3) {
                throw new TransientException("connection reset");
            }
            return "trials";
        }, attempts::add);

        assertEquals("trials", result);
        assertEquals(Arrays.asList(1, 2, 3), attempts);
        assertEquals(Arrays.asList(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeper.getSleeps());
        assertEquals(CircuitState.CLOSED, breakers.get("queryUpstream").getState());
        assertEquals(0, breakers.get("queryUpstream").getConsecutiveFailures());
        assertEquals(1.0, metrics.getCounter("retry.attempts", tags("operation", "queryUpstream", "outcome", "success")));
        assertEquals(2.0, metrics.getCounter("retry.attempts", tags("operation", "queryUpstream", "outcome", "failure")));
    }

    @Test
    void exhaustsAfterMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();

        RetryExhaustedException e = assertThrows(RetryExhaustedException.class, () ->
                executor.execute("queryUpstream", () -> {
                    calls.incrementAndGet();
                    throw new IOException("timeout");
                }));

        assertEquals(3, calls.get());
        assertEquals(3, e.getAttempts());
        assertEquals("queryUpstream", e.getOperation());
        assertTrue(e.getCause() instanceof IOException);
        assertEquals(Arrays.asList(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeper.getSleeps());
        assertEquals(1.0, metrics.getCounter("retry.attempts", tags("operation", "queryUpstream", "outcome", "retry_exhausted")));
        assertEquals(2L, metrics.getHistogram("retry.attempt.duration", tags("operation", "queryUpstream", "outcome", "failure"))
                .map(h -> h.getCount()).orElse(0L));
    }

    @Test
    void permanentErrorIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        PermanentException e = assertThrows(PermanentException.class, () ->
                executor.execute("parse", () -> {
                    calls.incrementAndGet();
                    throw new PermanentException("malformed response");
                }));

        assertEquals("malformed response", e.getMessage());
        assertEquals(1, calls.get());
        assertTrue(sleeper.getSleeps().isEmpty());
    }

    @Test
    void stopsImmediatelyWhenCircuitOpens() {
        breakers.get("flaky", CircuitBreakerConfig.builder().failureThreshold(2).build());
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy fiveAttempts = NO_JITTER.toBuilder().maxAttempts(5).build();

        assertThrows(CircuitOpenException.class, () ->
                executor.execute("flaky", fiveAttempts, () -> {
                    calls.incrementAndGet();
                    throw new TransientException("503");
                }));

        assertEquals(2, calls.get());
        assertEquals(CircuitState.OPEN, breakers.get("flaky").getState());
        assertEquals(1.0, metrics.getCounter("retry.attempts", tags("operation", "flaky", "outcome", "rejected")));
    }

    @Test
    void openCircuitRejectsWithoutCallingAndWithoutObservedAttempt() {
        breakers.get("down", CircuitBreakerConfig.builder().failureThreshold(1).build());
        assertThrows(RetryExhaustedException.class, () -> executor.execute("down", RetryPolicy.noRetry(), () -> {
            throw new TransientException("x");
        }));
        AtomicInteger calls = new AtomicInteger();
        List<Integer> attempts = new ArrayList<>();

        assertThrows(CircuitOpenException.class, () -> executor.execute("down", NO_JITTER, () -> calls.incrementAndGet(), attempts::add));

        assertEquals(0, calls.get());
        assertTrue(attempts.isEmpty());
    }

    @Test
    void nestedCircuitOpenIsNotCountedAsFailure() {
        assertThrows(CircuitOpenException.class, () -> executor.execute("outer", () -> {
            throw new CircuitOpenException("inner", 5, Duration.ofSeconds(1));
        }));
        assertEquals(0, breakers.get("outer").getConsecutiveFailures());
        assertTrue(sleeper.getSleeps().isEmpty());
    }

    @Test
    void asyncRetriesWaitOnDelayScheduler() {
        AtomicInteger calls = new AtomicInteger();

        StepVerifier.withVirtualTime(() -> executor.executeAsync("queryUpstream", NO_JITTER, () -> Mono.fromCallable(() -> {
                    if (calls.incrementAndGet() < 3) {
                        throw new TransientException("reset");
                    }
                    return "trials";
                })), () -> vts, Long.MAX_VALUE)
                .expectSubscription()
                .then(() -> assertEquals(1, calls.get()))
                .expectNoEvent(Duration.ofMillis(999))
                .then(() -> assertEquals(1, calls.get()))
                .thenAwait(Duration.ofMillis(1))
                .then(() -> assertEquals(2, calls.get()))
                .thenAwait(Duration.ofSeconds(2))
                .expectNext("trials")
                .verifyComplete();

        assertTrue(sleeper.getSleeps().isEmpty());
    }

    @Test
    void asyncExhaustionAndPermanentErrors() {
        StepVerifier.withVirtualTime(() -> executor.<String>executeAsync("queryUpstream", NO_JITTER,
                        () -> Mono.error(new TransientException("reset"))), () -> vts, Long.MAX_VALUE)
                .expectSubscription()
                .thenAwait(Duration.ofSeconds(3))
                .expectErrorSatisfies(e -> {
                    assertTrue(e instanceof RetryExhaustedException);
                    assertEquals(3, ((RetryExhaustedException) e).getAttempts());
                })
                .verify();

        AtomicInteger calls = new AtomicInteger();
        StepVerifier.create(executor.<String>executeAsync("parse", NO_JITTER,
                        () -> Mono.defer(() -> {
                            calls.incrementAndGet();
                            return Mono.error(new PermanentException("bad"));
                        })))
                .expectError(PermanentException.class)
                .verify();
        assertEquals(1, calls.get());
    }

    @Test
    void asyncCancellationReleasesHalfOpenTrial() {
        breakers.get("slow", CircuitBreakerConfig.builder().failureThreshold(1).recoveryTimeout(Duration.ofSeconds(10)).build());
        assertThrows(RetryExhaustedException.class, () -> executor.execute("slow", RetryPolicy.noRetry(), () -> {
            throw new TransientException("x");
        }));
        clock.advance(Duration.ofSeconds(10));

        StepVerifier.create(executor.executeAsync("slow", RetryPolicy.noRetry(), Mono::never))
                .expectSubscription()
                .thenCancel()
                .verify();

        assertEquals(CircuitState.HALF_OPEN, breakers.get("slow").getState());
        assertTrue(breakers.get("slow").allow());
    }

    @Test
    void jitterUsesInjectedRandom() {
        RetryExecutor jittered = new RetryExecutor(breakers, metrics, RetryPolicy.defaults(), sleeper, vts, () -> 0.25);
        assertThrows(RetryExhaustedException.class, () -> jittered.execute("j", () -> {
            throw new TransientException("x");
        }));
        assertEquals(Arrays.asList(Duration.ofMillis(250), Duration.ofMillis(500)), sleeper.getSleeps());
    }
}
