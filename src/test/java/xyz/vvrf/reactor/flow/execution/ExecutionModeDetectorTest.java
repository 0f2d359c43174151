package xyz.vvrf.reactor.flow.execution;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.reactor.flow.core.ExecutionMode;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionModeDetectorTest {

    private final ExecutionModeDetector detector = new ExecutionModeDetector();

    @Test
    void explicitModesPassThrough() {
        assertEquals(ExecutionMode.SYNC, detector.resolve(ExecutionMode.SYNC));
        assertEquals(ExecutionMode.ASYNC, detector.resolve(ExecutionMode.ASYNC));
    }

    @Test
    void autoOnPlainThreadIsSync() {
        assertEquals(ExecutionMode.SYNC, detector.resolve(ExecutionMode.AUTO));
        assertEquals(ExecutionMode.SYNC, detector.resolve(null));
    }

    @Test
    void autoOnNonBlockingThreadIsAsync() {
        ExecutionMode mode = Mono.fromCallable(() -> detector.resolve(ExecutionMode.AUTO))
                .subscribeOn(Schedulers.parallel())
                .block(Duration.ofSeconds(5));
        assertEquals(ExecutionMode.ASYNC, mode);
    }

    @Test
    void autoOnBoundedElasticIsSync() {
        ExecutionMode mode = Mono.fromCallable(() -> detector.resolve(ExecutionMode.AUTO))
                .subscribeOn(Schedulers.boundedElastic())
                .block(Duration.ofSeconds(5));
        assertEquals(ExecutionMode.SYNC, mode);
    }
}
