package xyz.vvrf.reactor.flow.retry;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import xyz.vvrf.reactor.flow.breaker.CircuitBreaker;
import xyz.vvrf.reactor.flow.breaker.CircuitBreakerRegistry;
import xyz.vvrf.reactor.flow.exception.CircuitOpenException;
import xyz.vvrf.reactor.flow.exception.ErrorClassifier;
import xyz.vvrf.reactor.flow.exception.ErrorKind;
import xyz.vvrf.reactor.flow.exception.PermanentException;
import xyz.vvrf.reactor.flow.exception.RetryExhaustedException;
import xyz.vvrf.reactor.flow.exception.TransientException;
import xyz.vvrf.reactor.flow.metrics.MetricsCollector;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.IntConsumer;
import java.util.function.Supplier;

/**
 * 带熔断保护的重试执行器。同步 ({@link #execute}) 与异步 ({@link #executeAsync}) 两个入口
 * 共享同一套判定逻辑 ({@link #decide})，只是等待方式不同：同步阻塞当前线程，异步通过 {@link Mono#delay} 挂起。
 * <p>
 * 每次尝试前向熔断器申请放行 ({@link CircuitBreaker.Permit})，尝试后通过该凭证上报成功/失败，并记录
 * {@code retry.attempt.duration} 直方图和 {@code retry.attempts} 计数器 (标签 operation, outcome)。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class RetryExecutor {

    static final String METRIC_ATTEMPT_DURATION = "retry.attempt.duration";
    static final String METRIC_ATTEMPTS = "retry.attempts";

    static final String OUTCOME_SUCCESS = "success";
    static final String OUTCOME_FAILURE = "failure";
    static final String OUTCOME_EXHAUSTED = "retry_exhausted";
    static final String OUTCOME_REJECTED = "rejected";

    private static final IntConsumer NO_OP = attempt -> { };

    private final CircuitBreakerRegistry breakers;
    private final MetricsCollector metrics;
    @Getter
    private final RetryPolicy defaultPolicy;
    private final Sleeper sleeper;
    private final Scheduler delayScheduler;
    private final DoubleSupplier random;

    public RetryExecutor(CircuitBreakerRegistry breakers, MetricsCollector metrics, RetryPolicy defaultPolicy,
                         Sleeper sleeper, Scheduler delayScheduler) {
        this(breakers, metrics, defaultPolicy, sleeper, delayScheduler, () -> ThreadLocalRandom.current().nextDouble());
    }

    public RetryExecutor(CircuitBreakerRegistry breakers, MetricsCollector metrics, RetryPolicy defaultPolicy,
                         Sleeper sleeper, Scheduler delayScheduler, DoubleSupplier random) {
        this.breakers = Objects.requireNonNull(breakers, "CircuitBreakerRegistry 不能为空");
        this.metrics = Objects.requireNonNull(metrics, "MetricsCollector 不能为空");
        this.defaultPolicy = Objects.requireNonNull(defaultPolicy, "默认重试策略不能为空");
        this.sleeper = Objects.requireNonNull(sleeper, "Sleeper 不能为空");
        this.delayScheduler = Objects.requireNonNull(delayScheduler, "延迟调度器不能为空");
        this.random = Objects.requireNonNull(random, "随机数来源不能为空");
        defaultPolicy.validate();
        log.info("RetryExecutor 已初始化，默认策略: {}", defaultPolicy);
    }

    public <T> T execute(String operation, Callable<T> call) {
        return execute(operation, defaultPolicy, call, NO_OP);
    }

    public <T> T execute(String operation, RetryPolicy policy, Callable<T> call) {
        return execute(operation, policy, call, NO_OP);
    }

    /**
     * 同步执行，失败时在当前线程上等待后重试。
     *
     * @param attemptObserver 每次获得熔断器放行、真正开始尝试时收到尝试序号 (从 1 开始)
     * @throws CircuitOpenException    熔断器拒绝
     * @throws RetryExhaustedException 可重试错误用尽了所有尝试
     */
    public <T> T execute(String operation, RetryPolicy policy, Callable<T> call, IntConsumer attemptObserver) {
        Objects.requireNonNull(operation, "操作名不能为空");
        Objects.requireNonNull(call, "被执行的调用不能为空");
        RetryPolicy effective = policy != null ? policy : defaultPolicy;
        effective.validate();
        CircuitBreaker breaker = breakers.get(operation);

        int attempt = 0;
        while (true) {
            attempt++;
            long start = System.nanoTime();
            CircuitBreaker.Permit permit;
            try {
                permit = breaker.acquire();
            } catch (CircuitOpenException e) {
                record(operation, OUTCOME_REJECTED, start);
                throw e;
            }
            attemptObserver.accept(attempt);

            Throwable failure;
            try {
                T result = call.call();
                permit.success();
                record(operation, OUTCOME_SUCCESS, start);
                return result;
            } catch (Exception e) {
                failure = ErrorClassifier.unwrap(e);
            }

            if (failure instanceof CircuitOpenException) {
                // 下游嵌套的熔断器拒绝，不计入本熔断器失败
                permit.release();
                record(operation, OUTCOME_REJECTED, start);
                throw (CircuitOpenException) failure;
            }
            permit.failure();
            RetryDecision decision = decide(operation, effective, attempt, failure);
            record(operation, decision.outcome, start);
            if (decision.error != null) {
                throw propagate(decision.error);
            }
            try {
                sleeper.sleep(decision.delay);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new TransientException(String.format("操作 '%s' 在第 %d 次重试等待期间被中断", operation, attempt), ie);
            }
        }
    }

    public <T> Mono<T> executeAsync(String operation, Supplier<Mono<T>> call) {
        return executeAsync(operation, defaultPolicy, call, NO_OP);
    }

    public <T> Mono<T> executeAsync(String operation, RetryPolicy policy, Supplier<Mono<T>> call) {
        return executeAsync(operation, policy, call, NO_OP);
    }

    /**
     * 异步执行，失败时通过 {@link Mono#delay(Duration, Scheduler)} 挂起后重试，不占用线程。
     * 订阅被取消时，已放行的 HALF_OPEN 试探名额会被释放。
     */
    public <T> Mono<T> executeAsync(String operation, RetryPolicy policy, Supplier<Mono<T>> call, IntConsumer attemptObserver) {
        Objects.requireNonNull(operation, "操作名不能为空");
        Objects.requireNonNull(call, "被执行的调用不能为空");
        return Mono.defer(() -> {
            RetryPolicy effective = policy != null ? policy : defaultPolicy;
            effective.validate();
            return attemptAsync(operation, effective, call, attemptObserver, 1);
        });
    }

    private <T> Mono<T> attemptAsync(String operation, RetryPolicy policy, Supplier<Mono<T>> call,
                                     IntConsumer attemptObserver, int attempt) {
        return Mono.defer(() -> {
            long start = System.nanoTime();
            CircuitBreaker.Permit permit;
            try {
                permit = breakers.get(operation).acquire();
            } catch (CircuitOpenException e) {
                record(operation, OUTCOME_REJECTED, start);
                return Mono.error(e);
            }
            attemptObserver.accept(attempt);

            return Mono.defer(call)
                    .doOnSuccess(v -> {
                        permit.success();
                        record(operation, OUTCOME_SUCCESS, start);
                    })
                    .doOnCancel(permit::release)
                    .onErrorResume(error -> {
                        Throwable failure = ErrorClassifier.unwrap(error);
                        if (failure instanceof CircuitOpenException) {
                            permit.release();
                            record(operation, OUTCOME_REJECTED, start);
                            return Mono.error(failure);
                        }
                        permit.failure();
                        RetryDecision decision = decide(operation, policy, attempt, failure);
                        record(operation, decision.outcome, start);
                        if (decision.error != null) {
                            return Mono.error(decision.error);
                        }
                        return Mono.delay(decision.delay, delayScheduler)
                                .then(attemptAsync(operation, policy, call, attemptObserver, attempt + 1));
                    });
        });
    }

    /**
     * 同步与异步共用的判定：继续重试 (给出等待时长) 或放弃 (给出最终抛出的错误)。
     */
    RetryDecision decide(String operation, RetryPolicy policy, int attempt, Throwable failure) {
        if (!policy.isRetryable(failure)) {
            log.warn("操作 '{}' 第 {} 次尝试失败，错误不可重试: {}", operation, attempt, failure.toString());
            return RetryDecision.giveUp(OUTCOME_FAILURE, failure);
        }
        if (attempt >= policy.getMaxAttempts()) {
            log.error("操作 '{}' 在 {} 次尝试后仍然失败: {}", operation, attempt, failure.toString());
            return RetryDecision.giveUp(OUTCOME_EXHAUSTED, new RetryExhaustedException(operation, attempt, failure));
        }
        Duration delay = policy.delayFor(attempt, random);
        log.warn("操作 '{}' 第 {}/{} 次尝试失败，{} ms 后重试: {}",
                operation, attempt, policy.getMaxAttempts(), delay.toMillis(), failure.toString());
        return RetryDecision.retryAfter(delay);
    }

    private void record(String operation, String outcome, long startNanos) {
        double seconds = (System.nanoTime() - startNanos) / 1_000_000_000.0;
        Map<String, String> tags = MetricsCollector.tags("operation", operation, "outcome", outcome);
        metrics.observe(METRIC_ATTEMPT_DURATION, seconds, tags);
        metrics.increment(METRIC_ATTEMPTS, tags);
    }

    private static RuntimeException propagate(Throwable error) {
        if (error instanceof RuntimeException) {
            return (RuntimeException) error;
        }
        if (error instanceof Error) {
            throw (Error) error;
        }
        return ErrorClassifier.classify(error) == ErrorKind.TRANSIENT
                ? new TransientException(error.getMessage(), error)
                : new PermanentException(error.getMessage(), error);
    }

    static final class RetryDecision {
        final String outcome;
        final Duration delay;
        final Throwable error;

        private RetryDecision(String outcome, Duration delay, Throwable error) {
            this.outcome = outcome;
            this.delay = delay;
            this.error = error;
        }

        static RetryDecision retryAfter(Duration delay) {
            return new RetryDecision(OUTCOME_FAILURE, delay, null);
        }

        static RetryDecision giveUp(String outcome, Throwable error) {
            return new RetryDecision(outcome, null, error);
        }
    }
}
