package xyz.vvrf.reactor.flow.breaker;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * 熔断器参数。
 *
 * @author ruifeng.wen
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class CircuitBreakerConfig {

    /** 连续失败达到该次数后进入 OPEN */
    @Builder.Default
    private final int failureThreshold = 5;

    /** OPEN 持续该时长后允许一次 HALF_OPEN 试探 */
    @Builder.Default
    private final Duration recoveryTimeout = Duration.ofSeconds(60);

    public static CircuitBreakerConfig defaults() {
        return CircuitBreakerConfig.builder().build();
    }

    void validate() {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold 必须 >= 1, 实际: " + failureThreshold);
        }
        if (recoveryTimeout == null || recoveryTimeout.isNegative()) {
            throw new IllegalArgumentException("recoveryTimeout 不能为空或负数: " + recoveryTimeout);
        }
    }
}
