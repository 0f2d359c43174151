package xyz.vvrf.reactor.flow.breaker;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 熔断器某一时刻的统计快照。
 *
 * @author ruifeng.wen
 */
@Getter
@Builder
@ToString
public class CircuitBreakerStats {

    private final String name;
    private final CircuitState state;
    private final int consecutiveFailures;
    private final int failureThreshold;
    private final long totalCalls;
    private final long rejectedCalls;
    private final long successCount;
    private final long failureCount;
    private final long stateChanges;
    private final Instant lastFailureTime;
    private final Instant lastSuccessTime;
    private final Instant lastTransitionTime;
}
