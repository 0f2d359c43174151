package xyz.vvrf.reactor.flow.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.reactor.flow.breaker.CircuitBreakerConfig;
import xyz.vvrf.reactor.flow.breaker.CircuitBreakerRegistry;
import xyz.vvrf.reactor.flow.cache.FlowCache;
import xyz.vvrf.reactor.flow.cache.analytics.CacheAnalytics;
import xyz.vvrf.reactor.flow.cache.backend.CacheBackend;
import xyz.vvrf.reactor.flow.cache.backend.LocalCacheBackend;
import xyz.vvrf.reactor.flow.cache.backend.RedisCacheBackend;
import xyz.vvrf.reactor.flow.cache.invalidation.CacheInvalidator;
import xyz.vvrf.reactor.flow.cache.warming.CacheWarmer;
import xyz.vvrf.reactor.flow.cache.warming.WarmingResult;
import xyz.vvrf.reactor.flow.cache.warming.WarmingStrategy;
import xyz.vvrf.reactor.flow.concurrency.ConcurrencyLimiterRegistry;
import xyz.vvrf.reactor.flow.core.Flow;
import xyz.vvrf.reactor.flow.core.SharedContext;
import xyz.vvrf.reactor.flow.execution.ExecutionModeDetector;
import xyz.vvrf.reactor.flow.execution.FlowEngine;
import xyz.vvrf.reactor.flow.execution.StandardFlowEngine;
import xyz.vvrf.reactor.flow.execution.StandardNodeExecutor;
import xyz.vvrf.reactor.flow.metrics.MetricsCollector;
import xyz.vvrf.reactor.flow.monitor.FlowMonitorListener;
import xyz.vvrf.reactor.flow.monitor.LoggingFlowMonitorListener;
import xyz.vvrf.reactor.flow.monitor.MetricsFlowMonitorListener;
import xyz.vvrf.reactor.flow.monitor.MicrometerFlowMonitorListener;
import xyz.vvrf.reactor.flow.retry.RetryExecutor;
import xyz.vvrf.reactor.flow.retry.RetryPolicy;
import xyz.vvrf.reactor.flow.retry.Sleeper;
import xyz.vvrf.reactor.flow.spring.boot.FlowFrameworkProperties;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 按 {@link FlowFrameworkProperties} 把各组件装配成一个可运行的整体：
 * 指标、熔断器注册表、重试执行器、并发限制器注册表、缓存 (含预热与失效) 和 Flow 引擎。
 * Spring 环境下由自动配置创建；其他场景直接使用 {@link #builder()}。
 * <p>
 * 缓存后端的选择：显式传入的 cacheBackend 优先，其次是 redisConnectionFactory，都没有时只用本地后端。
 *
 * @author ruifeng.wen
 */
@Slf4j
@Getter
public class FlowRuntime implements AutoCloseable {

    private final FlowFrameworkProperties properties;
    private final Clock clock;
    private final MetricsCollector metrics;
    private final CircuitBreakerRegistry circuitBreakers;
    private final RetryExecutor retryExecutor;
    private final ConcurrencyLimiterRegistry concurrencyLimiters;
    private final FlowCache cache;
    private final CacheWarmer cacheWarmer;
    private final CacheInvalidator cacheInvalidator;
    private final List<FlowMonitorListener> listeners;
    private final FlowEngine engine;

    private final Scheduler workScheduler;
    @Getter(AccessLevel.NONE)
    private final boolean ownsWorkScheduler;

    /**
     * @param properties             配置；为 null 时全部使用默认值
     * @param redisConnectionFactory 存在时用 Redis 作为主缓存后端
     * @param cacheBackend           自定义主缓存后端，优先于 Redis
     * @param meterRegistry          存在且启用时指标直接写入该 registry 并注册 Micrometer 监听器，否则使用独立的 SimpleMeterRegistry
     * @param clock                  TTL、熔断恢复计时等使用的时钟
     * @param sleeper                同步重试的等待方式
     * @param delayScheduler         异步重试等待使用的调度器，默认 parallel
     * @param workScheduler          阻塞调用 (同步超时、缓存 IO、预热) 使用的调度器，默认新建 boundedElastic
     * @param listeners              额外的监控监听器
     * @param warmingStrategies      注册到缓存预热器的策略；缓存关闭时忽略
     */
    @Builder
    private FlowRuntime(FlowFrameworkProperties properties,
                        RedisConnectionFactory redisConnectionFactory,
                        CacheBackend cacheBackend,
                        MeterRegistry meterRegistry,
                        ObjectMapper objectMapper,
                        Clock clock,
                        Sleeper sleeper,
                        Scheduler delayScheduler,
                        Scheduler workScheduler,
                        @Singular List<FlowMonitorListener> listeners,
                        @Singular List<WarmingStrategy> warmingStrategies) {
        this.properties = properties != null ? properties : new FlowFrameworkProperties();
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.ownsWorkScheduler = workScheduler == null;
        this.workScheduler = workScheduler != null ? workScheduler : Schedulers.newBoundedElastic(
                Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE, Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE, "flow-work", 60, true);

        FlowFrameworkProperties.MetricsProps metricsProps = this.properties.getMetrics();
        boolean reportToHost = meterRegistry != null && metricsProps.isMicrometerEnabled();
        this.metrics = new MetricsCollector(reportToHost ? meterRegistry : new SimpleMeterRegistry(),
                metricsProps.getHistogramBufferLength(), metricsProps.getHistogramExpiry(),
                metricsProps.getRecentSamples(), this.clock);

        FlowFrameworkProperties.CircuitBreakerProps breakerProps = this.properties.getCircuitBreaker();
        this.circuitBreakers = new CircuitBreakerRegistry(CircuitBreakerConfig.builder()
                .failureThreshold(breakerProps.getFailureThreshold())
                .recoveryTimeout(breakerProps.getRecoveryTimeout())
                .build(), metrics, this.clock);

        FlowFrameworkProperties.RetryProps retryProps = this.properties.getRetry();
        RetryPolicy defaultPolicy = RetryPolicy.builder()
                .maxAttempts(retryProps.getMaxAttempts())
                .initialDelay(retryProps.getInitialDelay())
                .backoffMultiplier(retryProps.getBackoffMultiplier())
                .maxDelay(retryProps.getMaxDelay())
                .jitter(retryProps.isJitter())
                .build();
        this.retryExecutor = new RetryExecutor(circuitBreakers, metrics, defaultPolicy,
                sleeper != null ? sleeper : Sleeper.THREAD,
                delayScheduler != null ? delayScheduler : Schedulers.parallel());

        FlowFrameworkProperties.ConcurrencyProps concurrencyProps = this.properties.getConcurrency();
        this.concurrencyLimiters = new ConcurrencyLimiterRegistry(concurrencyProps.getDefaultLimit(),
                concurrencyProps.getLimits(), metrics);

        FlowFrameworkProperties.CacheProps cacheProps = this.properties.getCache();
        if (cacheProps.isEnabled()) {
            CacheBackend primary = cacheBackend;
            if (primary == null && redisConnectionFactory != null) {
                primary = new RedisCacheBackend(redisConnectionFactory);
            }
            this.cache = FlowCache.builder()
                    .primary(primary)
                    .local(new LocalCacheBackend(cacheProps.getMaxEntries(), this.clock))
                    .objectMapper(objectMapper)
                    .clock(this.clock)
                    .metrics(metrics)
                    .analytics(new CacheAnalytics(cacheProps.getAnalyticsWindow(), this.clock))
                    .keyPrefix(cacheProps.getKeyPrefix())
                    .defaultTtl(cacheProps.getDefaultTtl())
                    .healthCheckInterval(cacheProps.getHealthCheckInterval())
                    .ioScheduler(this.workScheduler)
                    .build();
            Duration sweep = cacheProps.getSweepInterval();
            if (sweep != null && !sweep.isZero() && !sweep.isNegative()) {
                cache.startSweeper(sweep);
            }
            this.cacheWarmer = new CacheWarmer(cache, this.workScheduler, this.clock);
            if (warmingStrategies != null) {
                warmingStrategies.forEach(cacheWarmer::register);
            }
            this.cacheInvalidator = new CacheInvalidator(cache, this.clock);
        } else {
            this.cache = null;
            this.cacheWarmer = null;
            this.cacheInvalidator = null;
        }

        List<FlowMonitorListener> all = new ArrayList<>();
        all.add(new LoggingFlowMonitorListener());
        all.add(new MetricsFlowMonitorListener(metrics));
        if (reportToHost) {
            all.add(new MicrometerFlowMonitorListener(meterRegistry));
        }
        if (listeners != null) {
            all.addAll(listeners);
        }
        this.listeners = Collections.unmodifiableList(all);

        FlowFrameworkProperties.Engine engineProps = this.properties.getEngine();
        StandardNodeExecutor nodeExecutor = new StandardNodeExecutor(retryExecutor, cache, concurrencyLimiters,
                engineProps.getDefaultNodeTimeout(), engineProps.getBatchConcurrency(), this.workScheduler, this.listeners);
        this.engine = new StandardFlowEngine(nodeExecutor, new ExecutionModeDetector(), this.listeners);

        log.info("FlowRuntime 已初始化。配置: {}, 主缓存后端: {}, 监听器数量: {}",
                this.properties, cache == null ? "禁用" : (primaryName(cacheBackend, redisConnectionFactory)), this.listeners.size());
    }

    private static String primaryName(CacheBackend backend, RedisConnectionFactory factory) {
        if (backend != null) {
            return backend.getName();
        }
        return factory != null ? "redis" : "local-only";
    }

    public SharedContext run(Flow flow, SharedContext context) {
        return engine.run(flow, context);
    }

    public Mono<SharedContext> runAsync(Flow flow, SharedContext context) {
        return engine.runAsync(flow, context);
    }

    /**
     * 以配置的默认模式 (flow.engine.mode) 运行。
     */
    public Mono<SharedContext> execute(Flow flow, SharedContext context) {
        return engine.execute(flow, context, properties.getEngine().getMode());
    }

    /**
     * 执行 STARTUP 预热策略并启动 PERIODIC 策略。缓存关闭或 flow.cache.warm-on-startup=false 时返回空列表。
     */
    public Mono<List<WarmingResult>> startWarming() {
        if (cacheWarmer == null || !properties.getCache().isWarmOnStartup()) {
            return Mono.just(Collections.emptyList());
        }
        return cacheWarmer.start();
    }

    @Override
    public void close() {
        log.info("正在关闭 FlowRuntime...");
        if (cacheWarmer != null) {
            cacheWarmer.close();
        }
        if (cacheInvalidator != null) {
            cacheInvalidator.close();
        }
        if (cache != null) {
            cache.close();
        }
        if (ownsWorkScheduler) {
            workScheduler.dispose();
        }
    }
}
