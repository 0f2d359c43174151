package xyz.vvrf.reactor.flow.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * 熔断器处于 OPEN (或 HALF_OPEN 试探进行中) 时拒绝调用抛出的异常。
 * 调用方可以据此与普通失败区分开。
 *
 * @author ruifeng.wen
 */
@Getter
public class CircuitOpenException extends FlowException {

    private final String operation;
    private final int failureCount;
    /** 距最近一次失败的时长，没有失败记录时为 null */
    private final Duration sinceLastFailure;

    public CircuitOpenException(String operation, int failureCount, Duration sinceLastFailure) {
        super(String.format("Circuit breaker '%s' is OPEN. Failure count: %d, Last failure: %s ago",
                operation, failureCount,
                sinceLastFailure == null ? "never" : String.format("%.1fs", sinceLastFailure.toMillis() / 1000.0)));
        this.operation = operation;
        this.failureCount = failureCount;
        this.sinceLastFailure = sinceLastFailure;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.CIRCUIT_OPEN;
    }
}
