package xyz.vvrf.reactor.flow.breaker;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 熔断器状态。gaugeValue 用于 {@code circuit_breaker.state} 仪表: 0=CLOSED, 1=HALF_OPEN, 2=OPEN。
 *
 * @author ruifeng.wen
 */
@Getter
@RequiredArgsConstructor
public enum CircuitState {
    CLOSED(0),
    HALF_OPEN(1),
    OPEN(2);

    private final int gaugeValue;
}
