package xyz.vvrf.reactor.flow.spring.boot;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import xyz.vvrf.reactor.flow.core.ExecutionMode;

import javax.validation.Valid;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flow 框架的配置属性类，绑定 'flow' 前缀下的属性。
 * 不使用 Spring 时也可以直接 new 出来交给 {@link xyz.vvrf.reactor.flow.runtime.FlowRuntime}。
 *
 * @author ruifeng.wen
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "flow")
@Validated
public class FlowFrameworkProperties {

    @Valid
    private final Engine engine = new Engine();
    @Valid
    private final RetryProps retry = new RetryProps();
    @Valid
    private final CircuitBreakerProps circuitBreaker = new CircuitBreakerProps();
    @Valid
    private final CacheProps cache = new CacheProps();
    @Valid
    private final MetricsProps metrics = new MetricsProps();
    @Valid
    private final ConcurrencyProps concurrency = new ConcurrencyProps();

    @Getter
    @Setter
    public static class Engine {
        /**
         * 默认执行模式。AUTO 根据调用线程选择 SYNC 或 ASYNC。
         */
        @NotNull
        private ExecutionMode mode = ExecutionMode.AUTO;

        /**
         * 节点未声明超时时单次 exec 的超时时间。
         */
        private Duration defaultNodeTimeout = Duration.ofSeconds(30);

        /**
         * 批处理节点未声明并发时，异步模式下同时执行的条目数。
         */
        @Min(1)
        private int batchConcurrency = 5;
    }

    @Getter
    @Setter
    public static class RetryProps {
        /**
         * 最大总尝试次数 (1 表示不重试)。
         */
        @Min(1)
        private int maxAttempts = 3;

        private Duration initialDelay = Duration.ofSeconds(1);

        @DecimalMin("1.0")
        private double backoffMultiplier = 2.0;

        private Duration maxDelay = Duration.ofSeconds(60);

        /**
         * 是否在 [0, delay] 内均匀抖动。
         */
        private boolean jitter = true;
    }

    @Getter
    @Setter
    public static class CircuitBreakerProps {
        @Min(1)
        private int failureThreshold = 5;

        private Duration recoveryTimeout = Duration.ofSeconds(60);
    }

    @Getter
    @Setter
    public static class CacheProps {
        /**
         * 为 false 时不创建缓存，节点的 cacheKey 被忽略。
         */
        private boolean enabled = true;

        private Duration defaultTtl = Duration.ofHours(1);

        private String keyPrefix = "flow";

        /**
         * 本地后端的最大条目数。
         */
        @Min(1)
        private long maxEntries = 10_000;

        /**
         * 过期条目清理周期；为空或非正数时不启动清理任务。
         */
        private Duration sweepInterval = Duration.ofMinutes(5);

        private Duration healthCheckInterval = Duration.ofSeconds(30);

        private Duration analyticsWindow = Duration.ofMinutes(5);

        /**
         * 应用启动时是否执行 STARTUP 预热策略并启动 PERIODIC 策略。
         */
        private boolean warmOnStartup = true;

        /**
         * 启动预热的最长等待时间，超时后取消剩余的预热，应用照常启动。
         */
        @NotNull
        private Duration startupWarmingTimeout = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class MetricsProps {
        /**
         * 分位数滑动时间窗的桶数。
         */
        @Min(1)
        private int histogramBufferLength = 3;

        /**
         * 分位数滑动时间窗的总长度，超过后旧样本不再参与分位数计算。
         */
        @NotNull
        private Duration histogramExpiry = Duration.ofMinutes(2);

        @Min(0)
        private int recentSamples = 10_000;

        /**
         * 存在宿主 MeterRegistry 时是否把指标写入它，并注册 Micrometer 监听器。
         */
        private boolean micrometerEnabled = true;
    }

    @Getter
    @Setter
    public static class ConcurrencyProps {
        /**
         * 未单独配置的操作同时执行 exec 的上限，0 表示不限制。
         */
        @Min(0)
        private int defaultLimit = 0;

        /**
         * 按操作名配置的并发上限，例如 flow.concurrency.limits.queryUpstream=4。
         */
        @NotNull
        private Map<String, Integer> limits = new LinkedHashMap<>();
    }

    @Override
    public String toString() {
        return "FlowFrameworkProperties{" +
                "engine={mode=" + engine.mode +
                ", defaultNodeTimeout=" + engine.defaultNodeTimeout +
                ", batchConcurrency=" + engine.batchConcurrency +
                "}, retry={maxAttempts=" + retry.maxAttempts +
                ", initialDelay=" + retry.initialDelay +
                ", backoffMultiplier=" + retry.backoffMultiplier +
                ", maxDelay=" + retry.maxDelay +
                ", jitter=" + retry.jitter +
                "}, circuitBreaker={failureThreshold=" + circuitBreaker.failureThreshold +
                ", recoveryTimeout=" + circuitBreaker.recoveryTimeout +
                "}, cache={enabled=" + cache.enabled +
                ", defaultTtl=" + cache.defaultTtl +
                ", keyPrefix='" + cache.keyPrefix + '\'' +
                ", maxEntries=" + cache.maxEntries +
                ", sweepInterval=" + cache.sweepInterval +
                ", healthCheckInterval=" + cache.healthCheckInterval +
                ", analyticsWindow=" + cache.analyticsWindow +
                ", warmOnStartup=" + cache.warmOnStartup +
                "}, metrics={histogramBufferLength=" + metrics.histogramBufferLength +
                ", histogramExpiry=" + metrics.histogramExpiry +
                ", recentSamples=" + metrics.recentSamples +
                ", micrometerEnabled=" + metrics.micrometerEnabled +
                "}, concurrency={defaultLimit=" + concurrency.defaultLimit +
                ", limits=" + concurrency.limits +
                "}}";
    }
}
