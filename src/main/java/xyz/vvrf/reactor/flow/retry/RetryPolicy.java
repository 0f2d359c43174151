package xyz.vvrf.reactor.flow.retry;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import xyz.vvrf.reactor.flow.exception.ErrorClassifier;

import java.time.Duration;
import java.util.function.DoubleSupplier;
import java.util.function.Predicate;

/**
 * 不可变的重试策略。
 * <p>
 * 第 n 次尝试失败后的基础等待时长为 {@code min(initialDelay * backoffMultiplier^(n-1), maxDelay)}；
 * 开启 jitter 时实际等待时长在 {@code [0, 基础时长]} 内均匀分布。
 *
 * @author ruifeng.wen
 */
@Getter
@Builder(toBuilder = true)
@ToString(exclude = "retryOn")
public class RetryPolicy {

    /** 总尝试次数，包含第一次。1 表示不重试。*/
    @Builder.Default
    private final int maxAttempts = 3;

    @Builder.Default
    private final Duration initialDelay = Duration.ofSeconds(1);

    @Builder.Default
    private final double backoffMultiplier = 2.0;

    @Builder.Default
    private final Duration maxDelay = Duration.ofSeconds(60);

    @Builder.Default
    private final boolean jitter = true;

    /** 判断失败是否可重试，默认只重试瞬时错误。*/
    @Builder.Default
    private final Predicate<Throwable> retryOn = ErrorClassifier::isRetryable;

    public static RetryPolicy defaults() {
        return RetryPolicy.builder().build();
    }

    public static RetryPolicy noRetry() {
        return RetryPolicy.builder().maxAttempts(1).build();
    }

    /**
     * 第 attempt 次尝试 (从 1 开始) 失败后、未加抖动的等待时长。
     */
    public Duration baseDelay(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt 从 1 开始, 实际: " + attempt);
        }
        double nanos = initialDelay.toNanos() * Math.pow(backoffMultiplier, attempt - 1);
        double capped = Math.min(nanos, maxDelay.toNanos());
        return Duration.ofNanos(Math.round(capped));
    }

    /**
     * 第 attempt 次尝试失败后的实际等待时长。random 需返回 [0, 1] 内的值。
     */
    public Duration delayFor(int attempt, DoubleSupplier random) {
        Duration base = baseDelay(attempt);
        if (!jitter) {
            return base;
        }
        double r = Math.min(1.0, Math.max(0.0, random.getAsDouble()));
        return Duration.ofNanos(Math.round(base.toNanos() * r));
    }

    public boolean isRetryable(Throwable error) {
        return retryOn.test(ErrorClassifier.unwrap(error));
    }

    public void validate() {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts 必须 >= 1, 实际: " + maxAttempts);
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay 不能为空或负数: " + initialDelay);
        }
        if (maxDelay == null || maxDelay.isNegative()) {
            throw new IllegalArgumentException("maxDelay 不能为空或负数: " + maxDelay);
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier 必须 >= 1.0, 实际: " + backoffMultiplier);
        }
        if (retryOn == null) {
            throw new IllegalArgumentException("retryOn 不能为空");
        }
    }
}
