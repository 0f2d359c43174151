package xyz.vvrf.reactor.flow.breaker;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.flow.exception.CircuitOpenException;
import xyz.vvrf.reactor.flow.metrics.MetricsCollector;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 单个操作的熔断器。
 * <ul>
 *     <li>CLOSED: 正常放行，连续失败达到阈值转 OPEN，任何成功把连续失败数清零。</li>
 *     <li>OPEN: 拒绝所有调用，直到自进入 OPEN 起经过 recoveryTimeout，随后转 HALF_OPEN。</li>
 *     <li>HALF_OPEN: 只放行一次试探调用，成功转 CLOSED，失败转 OPEN 并重新计时；试探期间其他调用被拒绝。</li>
 * </ul>
 * 所有状态读写都在实例锁内完成。
 * <p>
 * 每次放行返回一个 {@link Permit}，记录放行时的状态代数；每次状态变化代数加一。
 * 通过 Permit 上报的结果只有在代数未变时才影响状态，因此进入 HALF_OPEN 之前放行的慢调用
 * 迟到的成功或失败不会结束正在进行的试探。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class CircuitBreaker {

    static final String METRIC_TRANSITIONS = "circuit_breaker.transitions";
    static final String METRIC_STATE = "circuit_breaker.state";
    static final String METRIC_OPEN_EVENTS = "circuit_breaker.open_events";
    static final String METRIC_RECOVERY_EVENTS = "circuit_breaker.recovery_events";
    static final String METRIC_REJECTED = "circuit_breaker.rejected_calls";

    @Getter
    private final String name;
    @Getter
    private final CircuitBreakerConfig config;
    private final MetricsCollector metrics;
    private final Clock clock;

    private final Object lock = new Object();

    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private boolean trialInFlight;
    private long generation;
    private Instant openedAt;
    private Instant lastFailureTime;
    private Instant lastSuccessTime;
    private Instant lastTransitionTime;

    private long totalCalls;
    private long rejectedCalls;
    private long successCount;
    private long failureCount;
    private long stateChanges;

    public CircuitBreaker(String name, CircuitBreakerConfig config, MetricsCollector metrics, Clock clock) {
        this.name = Objects.requireNonNull(name, "熔断器名称不能为空");
        this.config = Objects.requireNonNull(config, "熔断器配置不能为空");
        this.metrics = Objects.requireNonNull(metrics, "MetricsCollector 不能为空");
        this.clock = Objects.requireNonNull(clock, "Clock 不能为空");
        config.validate();
        this.lastTransitionTime = clock.instant();
        metrics.setGauge(METRIC_STATE, CircuitState.CLOSED.getGaugeValue(), operationTag());
        log.debug("熔断器 '{}' 已创建: {}", name, config);
    }

    /**
     * 询问是否放行一次调用，不返回凭证。返回 true 时调用方必须随后调用 {@link #recordSuccess()} 或
     * {@link #recordFailure()}；这组无凭证的上报适用于同一时刻只发起一个调用的调用方。
     */
    public boolean allow() {
        return tryAcquire().isPresent();
    }

    /**
     * 申请放行，被拒绝时返回 empty。
     */
    public Optional<Permit> tryAcquire() {
        synchronized (lock) {
            return Optional.ofNullable(admit());
        }
    }

    /**
     * 申请放行，被拒绝时抛出 {@link CircuitOpenException}。
     */
    public Permit acquire() {
        Permit permit;
        synchronized (lock) {
            permit = admit();
        }
        if (permit == null) {
            throw rejection();
        }
        return permit;
    }

    public void recordSuccess() {
        onSuccess(null);
    }

    public void recordFailure() {
        onFailure(null);
    }

    /**
     * 放弃一次已放行但没有结果的调用 (例如被取消)。HALF_OPEN 下释放试探名额，不改变状态。
     */
    public void release() {
        onRelease(null);
    }

    /**
     * 在熔断保护下执行 callable。
     */
    public <T> T call(Callable<T> callable) throws Exception {
        Permit permit = acquire();
        try {
            T result = callable.call();
            permit.success();
            return result;
        } catch (Exception e) {
            permit.failure();
            throw e;
        }
    }

    public CircuitState getState() {
        synchronized (lock) {
            return state;
        }
    }

    public int getConsecutiveFailures() {
        synchronized (lock) {
            return consecutiveFailures;
        }
    }

    /**
     * 强制回到 CLOSED 并清空统计。
     */
    public void reset() {
        synchronized (lock) {
            if (state != CircuitState.CLOSED) {
                transitionTo(CircuitState.CLOSED);
            }
            consecutiveFailures = 0;
            trialInFlight = false;
            generation++;
            openedAt = null;
            lastFailureTime = null;
            lastSuccessTime = null;
            totalCalls = 0;
            rejectedCalls = 0;
            successCount = 0;
            failureCount = 0;
            stateChanges = 0;
        }
        log.info("熔断器 '{}' 已重置为 CLOSED。", name);
    }

    public CircuitBreakerStats getStats() {
        synchronized (lock) {
            return CircuitBreakerStats.builder()
                    .name(name)
                    .state(state)
                    .consecutiveFailures(consecutiveFailures)
                    .failureThreshold(config.getFailureThreshold())
                    .totalCalls(totalCalls)
                    .rejectedCalls(rejectedCalls)
                    .successCount(successCount)
                    .failureCount(failureCount)
                    .stateChanges(stateChanges)
                    .lastFailureTime(lastFailureTime)
                    .lastSuccessTime(lastSuccessTime)
                    .lastTransitionTime(lastTransitionTime)
                    .build();
        }
    }

    private CircuitOpenException rejection() {
        synchronized (lock) {
            Duration sinceLastFailure = lastFailureTime == null ? null : Duration.between(lastFailureTime, clock.instant());
            return new CircuitOpenException(name, consecutiveFailures, sinceLastFailure);
        }
    }

    private void onSuccess(Permit permit) {
        synchronized (lock) {
            successCount++;
            lastSuccessTime = clock.instant();
            if (isStale(permit)) {
                return;
            }
            switch (state) {
                case CLOSED:
                    consecutiveFailures = 0;
                    break;
                case HALF_OPEN:
                    trialInFlight = false;
                    consecutiveFailures = 0;
                    transitionTo(CircuitState.CLOSED);
                    break;
                case OPEN:
                    // 进入 OPEN 之前放行的调用迟到的结果，不影响状态
                    break;
                default:
                    break;
            }
        }
    }

    private void onFailure(Permit permit) {
        synchronized (lock) {
            failureCount++;
            lastFailureTime = clock.instant();
            if (isStale(permit)) {
                return;
            }
            switch (state) {
                case CLOSED:
                    consecutiveFailures++;
                    if (consecutiveFailures >= config.getFailureThreshold()) {
                        openCircuit();
                    }
                    break;
                case HALF_OPEN:
                    trialInFlight = false;
                    consecutiveFailures++;
                    openCircuit();
                    break;
                case OPEN:
                    break;
                default:
                    break;
            }
        }
    }

    private void onRelease(Permit permit) {
        synchronized (lock) {
            if (!isStale(permit) && state == CircuitState.HALF_OPEN) {
                trialInFlight = false;
            }
        }
    }

    // 以下方法均在锁内调用

    /**
     * 放行时返回新的 Permit，拒绝时返回 null。
     */
    private Permit admit() {
        totalCalls++;
        switch (state) {
            case CLOSED:
                return new Permit(generation);
            case OPEN:
                Duration sinceOpen = Duration.between(openedAt, clock.instant());
                if (sinceOpen.compareTo(config.getRecoveryTimeout()) >= 0) {
                    transitionTo(CircuitState.HALF_OPEN);
                    trialInFlight = true;
                    return new Permit(generation);
                }
                reject();
                return null;
            case HALF_OPEN:
                if (!trialInFlight) {
                    trialInFlight = true;
                    return new Permit(generation);
                }
                reject();
                return null;
            default:
                throw new IllegalStateException("未知的熔断器状态: " + state);
        }
    }

    private boolean isStale(Permit permit) {
        if (permit == null || permit.generation == generation) {
            return false;
        }
        log.debug("熔断器 '{}' 忽略过期放行的结果 (放行代数: {}, 当前代数: {}, 状态: {})",
                name, permit.generation, generation, state);
        return true;
    }

    private void openCircuit() {
        openedAt = clock.instant();
        transitionTo(CircuitState.OPEN);
    }

    private void reject() {
        rejectedCalls++;
        metrics.increment(METRIC_REJECTED, operationTag());
        log.debug("熔断器 '{}' 拒绝调用，当前状态: {}", name, state);
    }

    private void transitionTo(CircuitState newState) {
        CircuitState old = state;
        state = newState;
        generation++;
        stateChanges++;
        lastTransitionTime = clock.instant();

        metrics.increment(METRIC_TRANSITIONS, MetricsCollector.tags("operation", name, "from", old.name(), "to", newState.name()));
        metrics.setGauge(METRIC_STATE, newState.getGaugeValue(), operationTag());
        if (newState == CircuitState.OPEN) {
            metrics.increment(METRIC_OPEN_EVENTS, operationTag());
            log.warn("熔断器 '{}' 状态变更: {} -> OPEN (连续失败: {}, 阈值: {}, 恢复等待: {})",
                    name, old, consecutiveFailures, config.getFailureThreshold(), config.getRecoveryTimeout());
        } else if (newState == CircuitState.CLOSED) {
            metrics.increment(METRIC_RECOVERY_EVENTS, operationTag());
            log.info("熔断器 '{}' 状态变更: {} -> CLOSED", name, old);
        } else {
            log.info("熔断器 '{}' 状态变更: {} -> {}", name, old, newState);
        }
    }

    private Map<String, String> operationTag() {
        return MetricsCollector.tags("operation", name);
    }

    /**
     * 一次放行的凭证。结果只上报一次，重复上报被忽略。
     */
    public final class Permit {

        private final long generation;
        private final AtomicBoolean settled = new AtomicBoolean();

        private Permit(long generation) {
            this.generation = generation;
        }

        public void success() {
            if (settled.compareAndSet(false, true)) {
                onSuccess(this);
            }
        }

        public void failure() {
            if (settled.compareAndSet(false, true)) {
                onFailure(this);
            }
        }

        /**
         * 放弃这次调用，不计成功也不计失败。
         */
        public void release() {
            if (settled.compareAndSet(false, true)) {
                onRelease(this);
            }
        }
    }
}
