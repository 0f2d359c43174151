package xyz.vvrf.reactor.flow.monitor;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.flow.core.ExecutionMode;
import xyz.vvrf.reactor.flow.exception.CircuitOpenException;

import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerFlowMonitorListenerTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MicrometerFlowMonitorListener listener = new MicrometerFlowMonitorListener(registry);

    @Test
    void recordsNodeOutcomesWithErrorKind() {
        listener.onNodeSuccess("r1", "lookup", "fetch", ExecutionMode.SYNC, Duration.ofMillis(20), 2, false);
        listener.onNodeFailure("r1", "lookup", "fetch", ExecutionMode.SYNC, Duration.ofMillis(5), 0,
                new CircuitOpenException("queryUpstream", 5, Duration.ofSeconds(1)));

        Timer ok = registry.find(MicrometerFlowMonitorListener.NODE_TIMER)
                .tags("node", "fetch", "outcome", "ok", "mode", "sync").timer();
        assertNotNull(ok);
        assertEquals(1, ok.count());

        Timer failed = registry.find(MicrometerFlowMonitorListener.NODE_TIMER)
                .tags("outcome", "error", "kind", "CIRCUIT_OPEN").timer();
        assertNotNull(failed);

        DistributionSummary attempts = registry.find(MicrometerFlowMonitorListener.NODE_ATTEMPTS)
                .tags("node", "fetch").summary();
        assertNotNull(attempts);
        assertEquals(2, attempts.count());
        assertEquals(2.0, attempts.totalAmount());
    }

    @Test
    void cacheHitsAreCountedSeparately() {
        listener.onNodeSuccess("r1", "lookup", "fetch", ExecutionMode.ASYNC, Duration.ZERO, 0, true);

        assertEquals(1.0, registry.find(MicrometerFlowMonitorListener.NODE_CACHE_HITS)
                .tags("mode", "async").counter().count());
        assertNull(registry.find(MicrometerFlowMonitorListener.NODE_TIMER).timer());
    }

    @Test
    void recordsFlowDurationByOutcome() {
        listener.onFlowComplete("r2", "lookup", ExecutionMode.SYNC, Duration.ofMillis(40),
                Arrays.asList("fetch", "rank"), null);

        Timer timer = registry.find(MicrometerFlowMonitorListener.FLOW_TIMER)
                .tags("flow", "lookup", "outcome", "ok", "steps", "2").timer();
        assertNotNull(timer);
        assertEquals(40, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);
    }
}
