package xyz.vvrf.reactor.flow.retry;

import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.flow.exception.PermanentException;
import xyz.vvrf.reactor.flow.exception.TransientException;
import xyz.vvrf.reactor.flow.exception.UpstreamStatusException;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void baseDelayGrowsExponentiallyUpToCap() {
        RetryPolicy policy = RetryPolicy.builder()
                .initialDelay(Duration.ofSeconds(1))
                .backoffMultiplier(2.0)
                .maxDelay(Duration.ofSeconds(5))
                .build();

        assertEquals(Duration.ofSeconds(1), policy.baseDelay(1));
        assertEquals(Duration.ofSeconds(2), policy.baseDelay(2));
        assertEquals(Duration.ofSeconds(4), policy.baseDelay(3));
        assertEquals(Duration.ofSeconds(5), policy.baseDelay(4));
        assertEquals(Duration.ofSeconds(5), policy.baseDelay(10));
    }

    @Test
    void jitteredDelayStaysWithinBaseDelay() {
        RetryPolicy policy = RetryPolicy.builder().jitter(true).build();
        for (int attempt = 1; attempt <= 5; attempt++) {
            Duration base = policy.baseDelay(attempt);
            for (int i = 0; i < 200; i++) {
                Duration d = policy.delayFor(attempt, () -> ThreadLocalRandom.current().nextDouble());
                assertFalse(d.isNegative());
                assertTrue(d.compareTo(base) <= 0, d + " > " + base);
            }
        }
        assertEquals(Duration.ofMillis(500), policy.delayFor(1, () -> 0.5));
    }

    @Test
    void subMillisecondDelaysKeepTheirPrecision() {
        RetryPolicy policy = RetryPolicy.builder()
                .initialDelay(Duration.ofNanos(300_000))
                .backoffMultiplier(2.0)
                .maxDelay(Duration.ofMillis(1))
                .jitter(false)
                .build();

        assertEquals(Duration.ofNanos(300_000), policy.baseDelay(1));
        assertEquals(Duration.ofNanos(600_000), policy.baseDelay(2));
        assertEquals(Duration.ofMillis(1), policy.baseDelay(3));

        RetryPolicy jittered = policy.toBuilder().jitter(true).build();
        assertEquals(Duration.ofNanos(150_000), jittered.delayFor(1, () -> 0.5));
    }

    @Test
    void withoutJitterDelayEqualsBaseDelay() {
        RetryPolicy policy = RetryPolicy.builder().jitter(false).build();
        assertEquals(Duration.ofSeconds(2), policy.delayFor(2, () -> 0.1));
    }

    @Test
    void onlyTransientErrorsAreRetryableByDefault() {
        RetryPolicy policy = RetryPolicy.defaults();

        assertTrue(policy.isRetryable(new TransientException("reset")));
        assertTrue(policy.isRetryable(new SocketTimeoutException("read timed out")));
        assertTrue(policy.isRetryable(new UpstreamStatusException(503, "unavailable")));
        assertTrue(policy.isRetryable(new UpstreamStatusException(429, "slow down")));
        assertFalse(policy.isRetryable(new UpstreamStatusException(404, "not found")));
        assertFalse(policy.isRetryable(new PermanentException("bad input")));
        assertFalse(policy.isRetryable(new IllegalArgumentException("bad input")));
    }

    @Test
    void customPredicateOverridesClassification() {
        RetryPolicy policy = RetryPolicy.builder().retryOn(e -> e instanceof IllegalStateException).build();
        assertTrue(policy.isRetryable(new IllegalStateException()));
        assertFalse(policy.isRetryable(new TransientException("x")));
    }

    @Test
    void invalidPoliciesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().maxAttempts(0).build().validate());
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().backoffMultiplier(0.5).build().validate());
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().initialDelay(Duration.ofSeconds(-1)).build().validate());
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.defaults().baseDelay(0));
        assertEquals(1, RetryPolicy.noRetry().getMaxAttempts());
    }
}
